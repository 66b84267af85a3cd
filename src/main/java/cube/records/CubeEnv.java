package cube.records;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Registration record handed to an external search / training harness.
 *
 * @param name              unique environment name
 * @param initialState      the solved state
 * @param goalPredicate     goal test
 * @param actions           full move alphabet
 * @param transformFunc     {@code (state, action) -> state'}
 * @param inverseActionFunc move pairing
 * @param renderFunc        coloured view
 * @param renderActionFunc  move to token
 * @param parseActionFunc   token to move, empty when unrecognised
 * @param encodedShape      {@code {rows, cols}} of the feature tensor
 * @param encodeFunc        allocating encoder
 * @param encodeInPlaceFunc encoder into a caller-supplied zeroed buffer
 */
public record CubeEnv(
        String name,
        CubeState initialState,
        Predicate<CubeState> goalPredicate,
        List<Action> actions,
        Transform transformFunc,
        UnaryOperator<Action> inverseActionFunc,
        Function<CubeState, RenderedState> renderFunc,
        Function<Action, String> renderActionFunc,
        Function<String, Optional<Action>> parseActionFunc,
        int[] encodedShape,
        Function<CubeState, float[][]> encodeFunc,
        BiConsumer<float[][], CubeState> encodeInPlaceFunc
) {
    /** {@code (state, action) -> state'}. */
    @FunctionalInterface
    public interface Transform {
        CubeState apply(CubeState state, Action action);
    }

    public CubeEnv {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initialState, "initialState");
        Objects.requireNonNull(goalPredicate, "goalPredicate");
        Objects.requireNonNull(transformFunc, "transformFunc");
        Objects.requireNonNull(inverseActionFunc, "inverseActionFunc");
        Objects.requireNonNull(renderFunc, "renderFunc");
        Objects.requireNonNull(renderActionFunc, "renderActionFunc");
        Objects.requireNonNull(parseActionFunc, "parseActionFunc");
        Objects.requireNonNull(encodeFunc, "encodeFunc");
        Objects.requireNonNull(encodeInPlaceFunc, "encodeInPlaceFunc");
        actions = List.copyOf(actions);
        encodedShape = encodedShape.clone();
    }

    @Override
    public int[] encodedShape() {
        return encodedShape.clone();
    }

    public boolean isGoal(CubeState state) {
        return goalPredicate.test(state);
    }

    public CubeState transform(CubeState state, Action action) {
        return transformFunc.apply(state, action);
    }
}
