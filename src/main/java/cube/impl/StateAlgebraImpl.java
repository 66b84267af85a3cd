package cube.impl;

import static cube.constants.CubeConstants.CORNERS;
import static cube.constants.CubeConstants.ORIENTATIONS;
import static cube.constants.CubeTables.GENERATOR_CYCLES;
import static cube.constants.CubeTables.GENERATOR_TWISTS;

import cube.contracts.StateAlgebra;
import cube.records.Action;
import cube.records.CubeState;
import java.util.List;
import java.util.Objects;

/**
 * Table-driven move application.
 *
 * <p>Every move is compiled once into two 8-entry arrays:
 * <ul>
 *   <li>{@code SRC[a][dst]} – slot whose contents land in {@code dst} (identity for untouched slots)</li>
 *   <li>{@code TWIST[a][dst]} – orientation delta added after relocation, keyed by destination</li>
 * </ul>
 * Generators come straight from {@link cube.constants.CubeTables}. Inverses are derived:
 * each {@code (src, dst)} pair is reversed and the negated twist of {@code dst} moves
 * with its corner back to {@code src}.
 */
public final class StateAlgebraImpl implements StateAlgebra {

    private static final List<Action> ACTIONS = List.of(Action.values());

    private static final int[][] SRC = new int[ACTIONS.size()][CORNERS];
    private static final int[][] TWIST = new int[ACTIONS.size()][CORNERS];

    static {
        for (Action gen : Action.generators()) {
            int g = gen.ordinal();
            int inv = gen.inverse().ordinal();
            for (int slot = 0; slot < CORNERS; slot++) {
                SRC[g][slot] = slot;
                SRC[inv][slot] = slot;
            }
            for (int[] twist : GENERATOR_TWISTS[g]) {
                TWIST[g][twist[0]] = twist[1];
            }
            for (int[] pair : GENERATOR_CYCLES[g]) {
                int from = pair[0], to = pair[1];
                SRC[g][to] = from;
                SRC[inv][from] = to;
                TWIST[inv][from] = (ORIENTATIONS - TWIST[g][to]) % ORIENTATIONS;
            }
        }
    }

    private final boolean strict;

    /** Default instance: shape checks only. */
    public StateAlgebraImpl() {
        this(false);
    }

    /**
     * @param strict validate every input state fully before transforming it
     */
    public StateAlgebraImpl(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public CubeState identity() {
        return CubeState.identity();
    }

    @Override
    public boolean isGoal(CubeState state) {
        return Objects.requireNonNull(state, "state").isIdentity();
    }

    @Override
    public List<Action> actions() {
        return ACTIONS;
    }

    @Override
    public Action inverse(Action action) {
        return Objects.requireNonNull(action, "action").inverse();
    }

    @Override
    public CubeState transform(CubeState state, Action action) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(action, "action");
        if (strict) state.checkWellFormed();

        int a = action.ordinal();
        int[] src = SRC[a];
        int[] twist = TWIST[a];

        int[] pos = new int[CORNERS];
        int[] ort = new int[CORNERS];
        for (int dst = 0; dst < CORNERS; dst++) {
            int from = src[dst];
            pos[dst] = state.cornerAt(from);
            ort[dst] = (state.orientationAt(from) + twist[dst]) % ORIENTATIONS;
        }
        return new CubeState(pos, ort);
    }

    @Override
    public void validate(CubeState state) {
        Objects.requireNonNull(state, "state").checkWellFormed();
    }

    /* ───────── table access for tests / diagnostics ───────── */

    /** Copy of the compiled source-slot table for {@code action}. */
    static int[] sourceSlots(Action action) {
        return SRC[action.ordinal()].clone();
    }

    /** Copy of the compiled destination-keyed twist table for {@code action}. */
    static int[] twists(Action action) {
        return TWIST[action.ordinal()].clone();
    }
}
