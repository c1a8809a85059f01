/**
 * @file ScanlineQualityMetrics.java
 * @brief Statistics describing one run of the scanline stereo matcher
 */

package scanline.stereo;

import boofcv.struct.image.GrayF32;

/**
 * Coverage and timing summary for a computed pair of disparity maps
 */
public class ScanlineQualityMetrics {

    // Run parameters
    public double occlusionCost = 0.0;
    public int rowsProcessed = 0;

    // Coverage metrics
    public double matchedPercentageLeft = 0.0;   // Left pixels that received a disparity
    public double matchedPercentageRight = 0.0;  // Right pixels that received a disparity

    // Raw disparity metrics, before rescaling
    public double meanDisparityLeft = 0.0;       // Mean over matched left pixels
    public double maxDisparityLeft = 0.0;
    public double maxDisparityRight = 0.0;

    // True if a map had no matches and was written as all zero
    public boolean degenerateLeft = false;
    public boolean degenerateRight = false;

    // Performance metrics
    public double processingTimeMs = 0.0;

    public ScanlineQualityMetrics() {
    }

    /**
     * Computes coverage and disparity statistics from the raw maps
     */
    public static ScanlineQualityMetrics analyze(GrayF32 rawLeft, GrayF32 rawRight) {
        ScanlineQualityMetrics metrics = new ScanlineQualityMetrics();
        metrics.rowsProcessed = rawLeft.height;

        int totalPixels = rawLeft.width * rawLeft.height;
        if (totalPixels == 0)
            return metrics;

        int matchedLeft = 0;
        double sumLeft = 0.0;
        double maxLeft = 0.0;
        for (int y = 0; y < rawLeft.height; y++) {
            for (int x = 0; x < rawLeft.width; x++) {
                float d = rawLeft.unsafe_get(x, y);
                if (d > 0) {
                    matchedLeft++;
                    sumLeft += d;
                    maxLeft = Math.max(maxLeft, d);
                }
            }
        }

        int matchedRight = 0;
        double maxRight = 0.0;
        for (int y = 0; y < rawRight.height; y++) {
            for (int x = 0; x < rawRight.width; x++) {
                float d = rawRight.unsafe_get(x, y);
                if (d > 0) {
                    matchedRight++;
                    maxRight = Math.max(maxRight, d);
                }
            }
        }

        metrics.matchedPercentageLeft = (100.0 * matchedLeft) / totalPixels;
        metrics.matchedPercentageRight = (100.0 * matchedRight) / totalPixels;
        metrics.meanDisparityLeft = matchedLeft > 0 ? sumLeft / matchedLeft : 0.0;
        metrics.maxDisparityLeft = maxLeft;
        metrics.maxDisparityRight = maxRight;
        return metrics;
    }

    /**
     * Percentage of pixels, averaged over both maps, that are occluded
     */
    public double getOcclusionPercentage() {
        return 100.0 - (matchedPercentageLeft + matchedPercentageRight) / 2.0;
    }

    public boolean isDegenerate() {
        return degenerateLeft || degenerateRight;
    }

    /**
     * Get detailed report as string
     */
    public String getDetailedReport() {
        StringBuilder report = new StringBuilder();
        report.append("Scanline Stereo Report\n");
        report.append("======================\n");
        report.append(String.format("Occlusion Cost:     %s\n", occlusionCost));
        report.append(String.format("Rows:               %d\n", rowsProcessed));
        report.append(String.format("Matched Left:       %.1f%%\n", matchedPercentageLeft));
        report.append(String.format("Matched Right:      %.1f%%\n", matchedPercentageRight));
        report.append(String.format("Mean Disparity:     %.2f\n", meanDisparityLeft));
        report.append(String.format("Max Disparity:      %.0f / %.0f\n", maxDisparityLeft, maxDisparityRight));
        report.append(String.format("Processing Time:    %.1f ms\n", processingTimeMs));
        if (isDegenerate()) {
            report.append("\nNo matches in ")
                  .append(degenerateLeft && degenerateRight ? "either map" : degenerateLeft ? "left map" : "right map")
                  .append(", written as all zero\n");
        }
        return report.toString();
    }

    @Override
    public String toString() {
        return String.format("ScanlineMetrics{occlusion=%s, matched=%.1f%%/%.1f%%, meanDisparity=%.2f, time=%.1fms%s}",
                           occlusionCost, matchedPercentageLeft, matchedPercentageRight,
                           meanDisparityLeft, processingTimeMs, isDegenerate() ? ", DEGENERATE" : "");
    }
}
