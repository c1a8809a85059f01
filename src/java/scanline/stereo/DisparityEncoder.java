package scanline.stereo;

import boofcv.struct.image.GrayF32;

/**
 * Converts matched pairs of one row into disparity values and writes them into
 * the left and right raw disparity maps.
 *
 * <p>Values are stretched as {@code |i - j| * scale + offset} so small
 * disparities stay distinguishable and never collide with the zero background
 * of unmatched pixels. Cost matrix index k refers to pixel column k-1.</p>
 */
public class DisparityEncoder implements MatchedPairListener {

    private final GrayF32 leftMap;
    private final GrayF32 rightMap;
    private final int scale;
    private final int offset;
    private int row;

    public DisparityEncoder(GrayF32 leftMap, GrayF32 rightMap, int scale, int offset) {
        this.leftMap = leftMap;
        this.rightMap = rightMap;
        this.scale = scale;
        this.offset = offset;
    }

    public DisparityEncoder(GrayF32 leftMap, GrayF32 rightMap, ScanlineStereoConfig config) {
        this(leftMap, rightMap, config.disparityScale, config.disparityOffset);
    }

    /**
     * Selects the row that following matches are written to
     */
    public DisparityEncoder setRow(int row) {
        this.row = row;
        return this;
    }

    public int encode(int i, int j) {
        return Math.abs(i - j) * scale + offset;
    }

    @Override
    public void matched(int i, int j) {
        float disparity = encode(i, j);
        leftMap.unsafe_set(i - 1, row, disparity);
        rightMap.unsafe_set(j - 1, row, disparity);
    }
}
