package cube.records;

/**
 * The six faces of a rendered cube, in the order the sticker placement table
 * indexes them.
 */
public enum Face {
    TOP,
    LEFT,
    BACK,
    FRONT,
    RIGHT,
    BOTTOM
}
