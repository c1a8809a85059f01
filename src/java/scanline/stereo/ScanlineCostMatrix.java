/**
 * @file ScanlineCostMatrix.java
 * @brief Cost and direction matrices for matching one pair of scanlines
 */

package scanline.stereo;

import boofcv.struct.image.GrayU8;

/**
 * Dynamic programming tables for aligning one row of the left image against
 * the same row of the right image.
 *
 * <p>Cell (i, j) holds the minimum cost of aligning the first i left pixels
 * with the first j right pixels, and the transition that achieved it. Both
 * tables are flat arrays indexed by {@code i*(N+1)+j}. They are reused between
 * rows and only grow when a longer row is processed, so an instance must not be
 * shared between threads.</p>
 */
public class ScanlineCostMatrix {

    private double[] cost = new double[0];
    private byte[] directions = new byte[0];

    // length of the row being matched
    private int length;
    private int row;

    /**
     * Fills the cost and direction tables for one row.
     *
     * @param left Left rectified image
     * @param right Right rectified image, same shape as left
     * @param row Index of the scanline to match
     * @param occlusionCost Penalty for each unmatched pixel
     * @param variance Divides the squared intensity difference of a match
     * @throws StereoInvariantException if a cell's minimum equals none of its candidates
     */
    public void process(GrayU8 left, GrayU8 right, int row, double occlusionCost, double variance) {
        reshape(left.width);
        this.row = row;

        final int n = length;
        final int stride = n + 1;

        for (int i = 0; i <= n; i++) {
            cost[i * stride] = i * occlusionCost;
            cost[i] = i * occlusionCost;
        }

        final int indexLeft = left.startIndex + row * left.stride;
        final int indexRight = right.startIndex + row * right.stride;

        for (int i = 1; i <= n; i++) {
            int z1 = left.data[indexLeft + i - 1] & 0xFF;
            int prev = (i - 1) * stride;
            int curr = i * stride;
            for (int j = 1; j <= n; j++) {
                int z2 = right.data[indexRight + j - 1] & 0xFF;
                double diff = z1 - z2;
                double matchingCost = diff * diff / variance;

                double match = cost[prev + j - 1] + matchingCost;
                double skipLeft = cost[prev + j] + occlusionCost;
                double skipRight = cost[curr + j - 1] + occlusionCost;

                double minimum = Math.min(match, Math.min(skipLeft, skipRight));
                cost[curr + j] = minimum;

                // ties resolve to SKIP_RIGHT, then MATCH, then SKIP_LEFT
                if (minimum == skipRight) {
                    directions[curr + j] = MatchDirection.SKIP_RIGHT.getCode();
                } else if (minimum == match) {
                    directions[curr + j] = MatchDirection.MATCH.getCode();
                } else if (minimum == skipLeft) {
                    directions[curr + j] = MatchDirection.SKIP_LEFT.getCode();
                } else {
                    throw new StereoInvariantException(String.format(
                            "Minimum %s matches no candidate (match=%s skipLeft=%s skipRight=%s)",
                            minimum, match, skipLeft, skipRight), row, i, j);
                }
            }
        }
    }

    private void reshape(int length) {
        this.length = length;
        int size = (length + 1) * (length + 1);
        if (cost.length < size) {
            cost = new double[size];
            directions = new byte[size];
        }
    }

    public double getCost(int i, int j) {
        checkCell(i, j);
        return cost[i * (length + 1) + j];
    }

    /**
     * Raw tag stored for a cell. Use {@link #getDirection} for the decoded value.
     */
    public byte getDirectionCode(int i, int j) {
        checkCell(i, j);
        return directions[i * (length + 1) + j];
    }

    /**
     * Decoded tag for a cell, or null if the stored code is not a known tag.
     * Row 0 and column 0 are boundary cells and carry no tag.
     */
    public MatchDirection getDirection(int i, int j) {
        return MatchDirection.fromCode(getDirectionCode(i, j));
    }

    void setDirectionCode(int i, int j, byte code) {
        checkCell(i, j);
        directions[i * (length + 1) + j] = code;
    }

    /**
     * Cost of the optimal alignment of the whole row, C[N][N]
     */
    public double getTotalCost() {
        return cost[length * (length + 1) + length];
    }

    /**
     * Number of pixels in the processed row, N. The tables are (N+1)x(N+1).
     */
    public int getLength() {
        return length;
    }

    public int getRow() {
        return row;
    }

    private void checkCell(int i, int j) {
        if (i < 0 || i > length || j < 0 || j > length)
            throw new IndexOutOfBoundsException("cell (" + i + "," + j + ") outside of " + (length + 1) + "x" + (length + 1));
    }
}
