package cube.records;

import static cube.constants.CubeConstants.CELLS_PER_FACE;
import static cube.constants.CubeConstants.FACES;
import static cube.constants.CubeConstants.FACE_SIDE;

import java.util.Arrays;
import java.util.Objects;

/**
 * Read-only coloured view of a {@link CubeState}: six faces of 2×2 colour letters.
 *
 * <p>Cells are addressed as {@code row * 2 + col}; row 0 is the upper row when the
 * face is viewed in the unfolded net printed by {@link #toNet()}.
 */
public final class RenderedState {

    private final char[][] faces;

    public RenderedState(char[][] faces) {
        Objects.requireNonNull(faces, "faces");
        if (faces.length != FACES) {
            throw new IllegalArgumentException("expected " + FACES + " faces, got " + faces.length);
        }
        this.faces = new char[FACES][];
        for (int f = 0; f < FACES; f++) {
            if (faces[f].length != CELLS_PER_FACE) {
                throw new IllegalArgumentException(
                        "face " + Face.values()[f] + " has " + faces[f].length + " cells");
            }
            this.faces[f] = faces[f].clone();
        }
    }

    /** The four cells of {@code face}, row-major. */
    public char[] face(Face face) {
        return faces[face.ordinal()].clone();
    }

    public char cell(Face face, int row, int col) {
        if (row < 0 || row >= FACE_SIDE || col < 0 || col >= FACE_SIDE) {
            throw new IndexOutOfBoundsException("cell (" + row + "," + col + ")");
        }
        return faces[face.ordinal()][row * FACE_SIDE + col];
    }

    public char[] top()    { return face(Face.TOP); }
    public char[] left()   { return face(Face.LEFT); }
    public char[] back()   { return face(Face.BACK); }
    public char[] front()  { return face(Face.FRONT); }
    public char[] right()  { return face(Face.RIGHT); }
    public char[] bottom() { return face(Face.BOTTOM); }

    /** {@code true} if every face shows a single colour. */
    public boolean isUniform() {
        for (char[] f : faces) {
            for (char c : f) {
                if (c != f[0]) return false;
            }
        }
        return true;
    }

    /**
     * Unfolded cube as text:
     * <pre>
     *    TT
     *    TT
     * LL FF RR BB
     * LL FF RR BB
     *    DD
     *    DD
     * </pre>
     */
    public String toNet() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < FACE_SIDE; row++) {
            sb.append("   ");
            appendRow(sb, Face.TOP, row);
            sb.append('\n');
        }
        for (int row = 0; row < FACE_SIDE; row++) {
            appendRow(sb, Face.LEFT, row);
            sb.append(' ');
            appendRow(sb, Face.FRONT, row);
            sb.append(' ');
            appendRow(sb, Face.RIGHT, row);
            sb.append(' ');
            appendRow(sb, Face.BACK, row);
            sb.append('\n');
        }
        for (int row = 0; row < FACE_SIDE; row++) {
            sb.append("   ");
            appendRow(sb, Face.BOTTOM, row);
            sb.append('\n');
        }
        return sb.toString();
    }

    private void appendRow(StringBuilder sb, Face face, int row) {
        char[] f = faces[face.ordinal()];
        for (int col = 0; col < FACE_SIDE; col++) {
            sb.append(f[row * FACE_SIDE + col]);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof RenderedState other && Arrays.deepEquals(faces, other.faces);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(faces);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RenderedState[");
        for (Face face : Face.values()) {
            if (face.ordinal() > 0) sb.append(", ");
            sb.append(face.name().toLowerCase()).append('=').append(new String(faces[face.ordinal()]));
        }
        return sb.append(']').toString();
    }
}
