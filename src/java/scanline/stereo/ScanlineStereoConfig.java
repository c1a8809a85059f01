/**
 * @file ScanlineStereoConfig.java
 * @brief Configuration for the scanline dynamic-programming stereo matcher
 */

package scanline.stereo;

/**
 * Configuration parameters for scanline stereo matching
 */
public class ScanlineStereoConfig {

    // Matching cost parameters
    public double occlusionCost = 1.0; // Penalty per unmatched pixel
    public double variance = 16.0;     // Divides the squared intensity difference

    // Disparity encoding: |i - j| * disparityScale + disparityOffset
    public int disparityScale = 10;
    public int disparityOffset = 128; // Keeps real matches away from the zero background

    // Performance parameters
    public boolean concurrent = true; // One task per row through BoofConcurrency

    public ScanlineStereoConfig() {
    }

    public ScanlineStereoConfig(double occlusionCost) {
        this.occlusionCost = occlusionCost;
    }

    /**
     * Throws IllegalArgumentException if any parameter is out of range
     */
    public void checkValidity() {
        if (!(occlusionCost > 0) || Double.isInfinite(occlusionCost))
            throw new IllegalArgumentException("occlusionCost must be positive and finite: " + occlusionCost);
        if (!(variance > 0) || Double.isInfinite(variance))
            throw new IllegalArgumentException("variance must be positive and finite: " + variance);
        if (disparityScale <= 0)
            throw new IllegalArgumentException("disparityScale must be positive: " + disparityScale);
        if (disparityOffset < 0)
            throw new IllegalArgumentException("disparityOffset can't be negative: " + disparityOffset);
    }

    public ScanlineStereoConfig setTo(ScanlineStereoConfig src) {
        this.occlusionCost = src.occlusionCost;
        this.variance = src.variance;
        this.disparityScale = src.disparityScale;
        this.disparityOffset = src.disparityOffset;
        this.concurrent = src.concurrent;
        return this;
    }

    public ScanlineStereoConfig copy() {
        return new ScanlineStereoConfig().setTo(this);
    }

    @Override
    public String toString() {
        return String.format("ScanlineStereoConfig{occlusionCost=%s, variance=%s, encoding=%d*d+%d, concurrent=%b}",
                           occlusionCost, variance, disparityScale, disparityOffset, concurrent);
    }
}
