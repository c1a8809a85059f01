package scanline.stereo;

/**
 * Walks the direction table of a {@link ScanlineCostMatrix} from (N, N) back
 * towards the origin and reports every MATCH cell on the way.
 *
 * <p>The walk stops as soon as either index reaches zero. Pixels left over in
 * the other row's prefix are never reported, so they keep the background value
 * in the disparity maps.</p>
 */
public class ScanlineTraceback {

    /**
     * @return number of matched pairs passed to the listener
     * @throws StereoInvariantException if a visited cell holds an unknown tag
     */
    public static int traverse(ScanlineCostMatrix matrix, MatchedPairListener listener) {
        int i = matrix.getLength();
        int j = matrix.getLength();
        int matches = 0;

        while (i != 0 && j != 0) {
            MatchDirection direction = matrix.getDirection(i, j);
            if (direction == null) {
                throw new StereoInvariantException(
                        "Unknown direction tag " + matrix.getDirectionCode(i, j), matrix.getRow(), i, j);
            }
            switch (direction) {
                case MATCH:
                    listener.matched(i, j);
                    matches++;
                    i--;
                    j--;
                    break;
                case SKIP_LEFT:
                    i--;
                    break;
                case SKIP_RIGHT:
                    j--;
                    break;
            }
        }
        return matches;
    }
}
