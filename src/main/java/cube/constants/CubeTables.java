package cube.constants;

/**
 * Hand-authored lookup tables shared by the state algebra, the renderer and the
 * encoder. Read-only after class initialisation.
 *
 * <p>Slot numbering: top layer {@code TFL=0, TFR=1, TBR=2, TBL=3}, bottom layer
 * {@code DFL=4, DFR=5, DBR=6, DBL=7}. Corner {@code i} is the piece that sits in
 * slot {@code i} when the cube is solved.
 *
 * <p>Orientation: 0 = untwisted, 1 = one step, 2 = two steps (mod 3).
 */
public final class CubeTables {

    private CubeTables() {}

    /* ───────── Generator moves (R, T, B) ───────── */

    /** {@code {src, dst}} pairs: the corner in {@code src} moves to {@code dst}. Indexed by generator ordinal. */
    public static final int[][][] GENERATOR_CYCLES = {
            {{1, 2}, {2, 6}, {6, 5}, {5, 1}}, // R
            {{0, 3}, {1, 0}, {2, 1}, {3, 2}}, // T
            {{2, 3}, {3, 7}, {7, 6}, {6, 2}}, // B
    };

    /** {@code {dst, delta}} pairs: twist added to whatever lands in {@code dst}. */
    public static final int[][][] GENERATOR_TWISTS = {
            {{1, 2}, {2, 1}, {5, 1}, {6, 2}}, // R
            {},                               // T
            {{2, 2}, {3, 1}, {6, 1}, {7, 2}}, // B
    };

    /* ───────── Stickers ───────── */

    public static final char WHITE = 'W', YELLOW = 'Y', RED = 'R', ORANGE = 'O', GREEN = 'G', BLUE = 'B';

    /** Colours of each corner, clockwise starting from its top/bottom sticker. */
    public static final char[][] CORNER_COLORS = {
            {WHITE, RED, GREEN}, {WHITE, BLUE, RED}, {WHITE, ORANGE, BLUE}, {WHITE, GREEN, ORANGE},
            {YELLOW, GREEN, RED}, {YELLOW, RED, BLUE}, {YELLOW, BLUE, ORANGE}, {YELLOW, ORANGE, GREEN},
    };

    /**
     * Per slot, the {@code {face, cell}} receiving each of the three stickers.
     * Faces follow {@link cube.records.Face} order; cells are {@code row * 2 + col}.
     */
    public static final int[][][] STICKER_PLACEMENT = {
            // top layer
            {{0, 2}, {3, 0}, {1, 1}},
            {{0, 3}, {4, 0}, {3, 1}},
            {{0, 1}, {2, 0}, {4, 1}},
            {{0, 0}, {1, 0}, {2, 1}},
            // bottom layer
            {{5, 0}, {1, 3}, {3, 2}},
            {{5, 1}, {3, 3}, {4, 2}},
            {{5, 3}, {4, 3}, {2, 2}},
            {{5, 2}, {2, 3}, {1, 2}},
    };

    /* ───────── Move notation ───────── */

    /** Token per {@link cube.records.Action} ordinal. */
    public static final String[] ACTION_TOKENS = {"R+", "U+", "B+", "R-", "U-", "B-"};
}
