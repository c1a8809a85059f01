/**
 * @file ScanlineStereoMatcher.java
 * @brief Dense stereo disparity by dynamic programming along each scanline
 */

package scanline.stereo;

import boofcv.alg.misc.ImageMiscOps;
import boofcv.concurrency.BoofConcurrency;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.GrayU8;
import pabeles.concurrency.GrowArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes left and right disparity maps from a rectified stereo pair.
 *
 * <p>Each row is matched independently: a {@link ScanlineCostMatrix} is filled,
 * traced back with {@link ScanlineTraceback}, and the matched pairs are written
 * by a {@link DisparityEncoder} into that row of both raw maps. Once every row
 * is done the raw maps are rescaled into 8-bit output by
 * {@link DisparityNormalizer}.</p>
 *
 * <p>Rows only write to their own slice of the raw maps, so in concurrent mode
 * they run through {@link BoofConcurrency#loopBlocks} without locking. Instances
 * are not thread safe.</p>
 */
public class ScanlineStereoMatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScanlineStereoMatcher.class);

    private ScanlineStereoConfig config;

    // raw disparity maps from the last run
    private final GrayF32 rawLeft = new GrayF32(1, 1);
    private final GrayF32 rawRight = new GrayF32(1, 1);

    // one set of tables per block of rows, reused from run to run
    private final GrowArray<ScanlineCostMatrix> workspaces = new GrowArray<>(ScanlineCostMatrix::new);

    /**
     * Constructor with the default configuration
     */
    public ScanlineStereoMatcher() {
        this(new ScanlineStereoConfig());
    }

    public ScanlineStereoMatcher(ScanlineStereoConfig config) {
        updateConfiguration(config);
    }

    /**
     * Replaces the configuration used by later calls
     *
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public void updateConfiguration(ScanlineStereoConfig config) {
        config.checkValidity();
        this.config = config.copy();
        LOGGER.debug("Configuration updated: {}", this.config);
    }

    public ScanlineStereoConfig getConfiguration() {
        return config.copy();
    }

    /**
     * Compute disparity maps from a stereo image pair
     *
     * @param left Left rectified image
     * @param right Right rectified image
     * @param outputLeft Output left disparity map, reshaped to the input size
     * @param outputRight Output right disparity map, reshaped to the input size
     * @return Quality metrics of the run
     * @throws ShapeMismatchException if the images differ in size
     * @throws StereoInvariantException if the matcher reaches an inconsistent state
     */
    public ScanlineQualityMetrics computeDisparity(GrayU8 left, GrayU8 right, GrayU8 outputLeft, GrayU8 outputRight) {
        if (left.width != right.width || left.height != right.height)
            throw new ShapeMismatchException(left, right);

        long startTime = System.currentTimeMillis();
        LOGGER.debug("Processing {}x{} stereo pair, occlusion cost {}", left.width, left.height, config.occlusionCost);

        rawLeft.reshape(left.width, left.height);
        rawRight.reshape(left.width, left.height);
        ImageMiscOps.fill(rawLeft, 0);
        ImageMiscOps.fill(rawRight, 0);

        if (config.concurrent && left.height > 0) {
            try {
                BoofConcurrency.loopBlocks(0, left.height, workspaces, (matrix, y0, y1) -> {
                    for (int row = y0; row < y1; row++) {
                        processRow(matrix, left, right, row);
                    }
                });
            } catch (RuntimeException e) {
                // the worker pool wraps failures, report the matcher's own exception
                for (Throwable t = e; t != null; t = t.getCause()) {
                    if (t instanceof StereoInvariantException)
                        throw (StereoInvariantException) t;
                }
                throw e;
            }
        } else {
            workspaces.reset();
            ScanlineCostMatrix matrix = workspaces.grow();
            for (int row = 0; row < left.height; row++) {
                processRow(matrix, left, right, row);
            }
        }

        ScanlineQualityMetrics metrics = ScanlineQualityMetrics.analyze(rawLeft, rawRight);
        metrics.occlusionCost = config.occlusionCost;
        metrics.degenerateLeft = !DisparityNormalizer.normalize(rawLeft, outputLeft);
        metrics.degenerateRight = !DisparityNormalizer.normalize(rawRight, outputRight);
        metrics.processingTimeMs = System.currentTimeMillis() - startTime;

        LOGGER.info("Disparity computed in {}ms - {}", (long) metrics.processingTimeMs, metrics);
        return metrics;
    }

    /**
     * Matches a single row and writes its disparities into the raw maps
     */
    void processRow(ScanlineCostMatrix matrix, GrayU8 left, GrayU8 right, int row) {
        matrix.process(left, right, row, config.occlusionCost, config.variance);

        DisparityEncoder encoder = new DisparityEncoder(rawLeft, rawRight, config).setRow(row);
        ScanlineTraceback.traverse(matrix, encoder);
    }

    /**
     * Left disparity map of the last run before rescaling
     */
    public GrayF32 getRawLeft() {
        return rawLeft;
    }

    /**
     * Right disparity map of the last run before rescaling
     */
    public GrayF32 getRawRight() {
        return rawRight;
    }
}
