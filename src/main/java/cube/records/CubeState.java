package cube.records;

import static cube.constants.CubeConstants.CORNERS;
import static cube.constants.CubeConstants.ORIENTATIONS;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable corner configuration.
 *
 * <p>{@code cornerPos[i]} is the id (0–7) of the corner sitting in slot {@code i};
 * {@code cornerOrt[i]} is that corner's twist (0–2). Both arrays are index aligned.
 *
 * <p>The canonical constructor only checks the array lengths. Use
 * {@link #checkWellFormed()} for the full permutation / range check.
 *
 * @param cornerPos corner id per slot
 * @param cornerOrt orientation per slot
 */
public record CubeState(int[] cornerPos, int[] cornerOrt) {

    private static final CubeState IDENTITY =
            new CubeState(new int[] {0, 1, 2, 3, 4, 5, 6, 7}, new int[CORNERS]);

    public CubeState {
        Objects.requireNonNull(cornerPos, "cornerPos");
        Objects.requireNonNull(cornerOrt, "cornerOrt");
        if (cornerPos.length != CORNERS || cornerOrt.length != CORNERS) {
            throw new IllegalArgumentException(
                    "expected " + CORNERS + " slots, got pos=" + cornerPos.length + " ort=" + cornerOrt.length);
        }
        cornerPos = cornerPos.clone();
        cornerOrt = cornerOrt.clone();
    }

    /** The solved configuration. */
    public static CubeState identity() {
        return IDENTITY;
    }

    /* ───────── accessors (defensive copies) ───────── */

    @Override
    public int[] cornerPos() {
        return cornerPos.clone();
    }

    @Override
    public int[] cornerOrt() {
        return cornerOrt.clone();
    }

    /** Corner id in {@code slot}. */
    public int cornerAt(int slot) {
        return cornerPos[slot];
    }

    /** Orientation of the corner in {@code slot}. */
    public int orientationAt(int slot) {
        return cornerOrt[slot];
    }

    /** Slot currently holding {@code corner}, or -1 if the state is malformed. */
    public int slotOf(int corner) {
        for (int slot = 0; slot < CORNERS; slot++) {
            if (cornerPos[slot] == corner) return slot;
        }
        return -1;
    }

    public boolean isIdentity() {
        return equals(IDENTITY);
    }

    /**
     * Full invariant check: {@code cornerPos} is a permutation of 0–7 and every
     * orientation lies in 0–2.
     *
     * @return {@code this}, for chaining
     * @throws IllegalArgumentException naming the first offending slot
     */
    public CubeState checkWellFormed() {
        boolean[] seen = new boolean[CORNERS];
        for (int slot = 0; slot < CORNERS; slot++) {
            int c = cornerPos[slot];
            if (c < 0 || c >= CORNERS) {
                throw new IllegalArgumentException("slot " + slot + ": corner id out of range: " + c);
            }
            if (seen[c]) {
                throw new IllegalArgumentException("slot " + slot + ": corner " + c + " appears twice");
            }
            seen[c] = true;
            int o = cornerOrt[slot];
            if (o < 0 || o >= ORIENTATIONS) {
                throw new IllegalArgumentException("slot " + slot + ": orientation out of range: " + o);
            }
        }
        return this;
    }

    /** Non-throwing form of {@link #checkWellFormed()}. */
    public boolean isWellFormed() {
        try {
            checkWellFormed();
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /* ───────── value semantics over array contents ───────── */

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CubeState other)) return false;
        return Arrays.equals(cornerPos, other.cornerPos) && Arrays.equals(cornerOrt, other.cornerOrt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(cornerPos) + Arrays.hashCode(cornerOrt);
    }

    @Override
    public String toString() {
        return "CubeState[pos=" + Arrays.toString(cornerPos) + ", ort=" + Arrays.toString(cornerOrt) + "]";
    }
}
