package cube.impl;

import static cube.constants.CubeConstants.ENV_NAME;

import cube.contracts.EnvRegistry;
import cube.contracts.StateAlgebra;
import cube.contracts.StateEncoder;
import cube.contracts.StateRenderer;
import cube.records.CubeEnv;

/**
 * Wires the algebra, renderer and encoder into the {@code cube2x2simple} environment.
 */
public final class Cube2x2Simple {

    public static final StateAlgebra ALGEBRA = new StateAlgebraImpl();
    public static final StateRenderer RENDERER = new StateRendererImpl();
    public static final StateEncoder ENCODER = new StateEncoderImpl();

    public static final CubeEnv ENV = create(ALGEBRA, RENDERER, ENCODER);

    private Cube2x2Simple() {}

    public static CubeEnv create(StateAlgebra algebra, StateRenderer renderer, StateEncoder encoder) {
        return new CubeEnv(
                ENV_NAME,
                algebra.identity(),
                algebra::isGoal,
                algebra.actions(),
                algebra::transform,
                algebra::inverse,
                renderer::render,
                renderer::renderAction,
                renderer::parseAction,
                encoder.shape(),
                encoder::encode,
                encoder::encodeInPlace);
    }

    /** Registers {@link #ENV} into {@code registry}. */
    public static void registerInto(EnvRegistry registry) {
        registry.register(ENV);
    }
}
