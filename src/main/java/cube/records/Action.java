package cube.records;

import java.util.List;

/**
 * The closed move alphabet: three quarter-turn generators and their inverses.
 *
 * <p>{@code R} turns the right face, {@code T} the top face and {@code B} the
 * back face, each clockwise. The {@code _INV} constants undo them.
 */
public enum Action {
    R,
    T,
    B,
    R_INV,
    T_INV,
    B_INV;

    private static final Action[] INVERSE = {R_INV, T_INV, B_INV, R, T, B};
    private static final List<Action> GENERATORS = List.of(R, T, B);

    /** {@code true} for the three base moves, {@code false} for their inverses. */
    public boolean isGenerator() {
        return ordinal() < GENERATORS.size();
    }

    /** The move that undoes this one. Involutive: {@code a.inverse().inverse() == a}. */
    public Action inverse() {
        return INVERSE[ordinal()];
    }

    /** The generator this move belongs to ({@code this} for generators). */
    public Action generator() {
        return isGenerator() ? this : inverse();
    }

    public static List<Action> generators() {
        return GENERATORS;
    }
}
