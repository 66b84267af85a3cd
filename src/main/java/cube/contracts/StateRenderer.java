package cube.contracts;

import cube.records.Action;
import cube.records.CubeState;
import cube.records.RenderedState;
import java.util.List;
import java.util.Optional;

/**
 * Human-facing projections: coloured faces for states, short tokens for moves.
 */
public interface StateRenderer {

    /** Six 2×2 faces of colour letters. Recomputed on every call. */
    RenderedState render(CubeState state);

    /** Two-character token, e.g. {@code "R+"} or {@code "U-"}. */
    String renderAction(Action action);

    /**
     * Inverse of {@link #renderAction(Action)}.
     *
     * @return the move, or {@link Optional#empty()} for any unrecognised text (never throws)
     */
    Optional<Action> parseAction(String token);

    /**
     * Parses a whitespace-separated token list.
     *
     * @throws IllegalArgumentException on the first unrecognised token
     */
    List<Action> parseActions(String tokens);
}
