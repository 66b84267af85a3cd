package cube.contracts;

import cube.records.Action;
import cube.records.CubeState;
import java.util.List;

/**
 * Permutation / orientation algebra of the corner cube.
 *
 * <p>All methods are pure and thread-safe. {@code transform} never mutates its
 * argument and always returns a fresh value.
 */
public interface StateAlgebra {

    /** The solved state: corners in their home slots, all untwisted. */
    CubeState identity();

    /** {@code true} iff {@code state} equals {@link #identity()} by content. */
    boolean isGoal(CubeState state);

    /** The six legal moves, generators first. */
    List<Action> actions();

    /** Total, involutive pairing of every move with the move that undoes it. */
    Action inverse(Action action);

    /**
     * Applies one move.
     *
     * <p>Guarantees {@code transform(transform(s, a), inverse(a)).equals(s)}.
     */
    CubeState transform(CubeState state, Action action);

    /** Applies {@code actions} left to right. An empty sequence returns {@code state}. */
    default CubeState transform(CubeState state, Action... actions) {
        CubeState s = state;
        for (Action a : actions) {
            s = transform(s, a);
        }
        return s;
    }

    /** Applies {@code actions} left to right. */
    default CubeState transform(CubeState state, List<Action> actions) {
        return transform(state, actions.toArray(new Action[0]));
    }

    /**
     * Full invariant check (permutation and orientation range).
     *
     * @throws IllegalArgumentException on the first violated invariant
     */
    void validate(CubeState state);
}
