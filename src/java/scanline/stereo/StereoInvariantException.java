package scanline.stereo;

/**
 * Raised when the matcher's internal bookkeeping is inconsistent, for example a
 * cost cell whose minimum equals none of its candidates or an unknown direction
 * tag. The computation for the whole image pair is aborted.
 */
public class StereoInvariantException extends IllegalStateException {

    private final int row;
    private final int i;
    private final int j;

    public StereoInvariantException(String message, int row, int i, int j) {
        super(String.format("%s at row=%d cell=(%d,%d)", message, row, i, j));
        this.row = row;
        this.i = i;
        this.j = j;
    }

    public int getRow() {
        return row;
    }

    public int getI() {
        return i;
    }

    public int getJ() {
        return j;
    }
}
