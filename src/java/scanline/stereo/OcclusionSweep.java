package scanline.stereo;

import java.util.ArrayList;
import java.util.List;

/**
 * Range of occlusion costs to compare, and the names of the images written
 * for each of them.
 */
public class OcclusionSweep {

    public static final double DEFAULT_START = 0.5;
    public static final double DEFAULT_STOP = 5.0;
    public static final double DEFAULT_STEP = 0.25;

    private final double start;
    private final double stop;
    private final double step;

    public OcclusionSweep() {
        this(DEFAULT_START, DEFAULT_STOP, DEFAULT_STEP);
    }

    public OcclusionSweep(double start, double stop, double step) {
        if (!(step > 0) || Double.isInfinite(step))
            throw new IllegalArgumentException("step must be positive and finite: " + step);
        if (!(start > 0) || Double.isInfinite(start))
            throw new IllegalArgumentException("start must be positive and finite: " + start);
        if (!Double.isFinite(stop))
            throw new IllegalArgumentException("stop must be finite: " + stop);
        this.start = start;
        this.stop = stop;
        this.step = step;
    }

    /**
     * Costs from start (inclusive) to stop (exclusive), each rounded to one
     * decimal place. The tenths are rounded to the nearest integer with ties to
     * even, so 0.75 becomes 0.8, 1.25 becomes 1.2 and 0.05 becomes 0.0.
     */
    public List<Double> costs() {
        List<Double> costs = new ArrayList<>();
        for (int k = 0; ; k++) {
            double value = start + k * step;
            if (value >= stop)
                break;
            costs.add(round(value));
        }
        return costs;
    }

    static double round(double value) {
        return Math.rint(value * 10) / 10;
    }

    public static String leftFileName(double occlusionCost) {
        return "Displeft" + occlusionCost + ".png";
    }

    public static String rightFileName(double occlusionCost) {
        return "Dispright" + occlusionCost + ".png";
    }

    @Override
    public String toString() {
        return String.format("OcclusionSweep{start=%s, stop=%s, step=%s}", start, stop, step);
    }
}
