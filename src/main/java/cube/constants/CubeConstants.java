package cube.constants;

/**
 * Central place for the compile-time constants of the corner cube.
 */
public final class CubeConstants {

    private CubeConstants() {}

    public static final String ENV_NAME = "cube2x2simple";

    /* ────────────── Frame ────────────── */
    public static final int CORNERS = 8;
    public static final int ORIENTATIONS = 3;
    public static final int STICKERS_PER_CORNER = 3;

    /* ────────────── Faces ────────────── */
    public static final int FACES = 6;
    public static final int FACE_SIDE = 2;
    public static final int CELLS_PER_FACE = FACE_SIDE * FACE_SIDE;

    /* ────────────── Feature tensor ────────────── */
    // last corner is implied by the other seven
    public static final int ENCODED_ROWS = CORNERS - 1;
    public static final int ENCODED_COLS = CORNERS * ORIENTATIONS;
    public static final int ENCODED_SIZE = ENCODED_ROWS * ENCODED_COLS;

    /* ────────────── Bench / perft ────────────── */
    public static final int MAX_PLY = 32;
    public static final int BENCH_DEFAULT_DEPTH = 6;
}
