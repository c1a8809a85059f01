package scanline.stereo;

/**
 * Transition chosen for a cell of the cost matrix. The byte codes are what
 * {@link ScanlineCostMatrix} stores in its direction buffer.
 */
public enum MatchDirection {
    /** Left pixel i and right pixel j are matched */
    MATCH((byte) 1),
    /** Left pixel i is occluded */
    SKIP_LEFT((byte) 2),
    /** Right pixel j is occluded */
    SKIP_RIGHT((byte) 3);

    private final byte code;

    MatchDirection(byte code) {
        this.code = code;
    }

    public byte getCode() {
        return code;
    }

    /**
     * Decodes a stored tag.
     *
     * @return the direction or null if the code is not a known tag
     */
    public static MatchDirection fromCode(byte code) {
        switch (code) {
            case 1: return MATCH;
            case 2: return SKIP_LEFT;
            case 3: return SKIP_RIGHT;
            default: return null;
        }
    }
}
