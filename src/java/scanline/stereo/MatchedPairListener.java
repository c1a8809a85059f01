package scanline.stereo;

/**
 * Receives the matched pairs found while tracing back an optimal alignment.
 */
@FunctionalInterface
public interface MatchedPairListener {
    /**
     * @param i cost matrix index of the left pixel, 1 to N
     * @param j cost matrix index of the right pixel, 1 to N
     */
    void matched(int i, int j);
}
