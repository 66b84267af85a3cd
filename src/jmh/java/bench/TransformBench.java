package bench;

import cube.contracts.StateAlgebra;
import cube.contracts.StateEncoder;
import cube.contracts.StateRenderer;
import cube.impl.StateAlgebraImpl;
import cube.impl.StateEncoderImpl;
import cube.impl.StateRendererImpl;
import cube.records.Action;
import cube.records.CubeState;
import cube.records.RenderedState;
import org.openjdk.jmh.annotations.*;

import java.util.concurrent.TimeUnit;
import java.util.random.RandomGenerator;

/** Micro-benchmark: move application vs. the two projections that consume it. */
@BenchmarkMode(Mode.Throughput)            // higher = better
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 5,  time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Measurement(iterations = 10, time = 400, timeUnit = TimeUnit.MILLISECONDS)
@Fork(2)
public class TransformBench {

    private static final StateAlgebra ALGEBRA = new StateAlgebraImpl();
    private static final StateRenderer RENDERER = new StateRendererImpl();
    private static final StateEncoder ENCODER = new StateEncoderImpl();

    /** Random but *stable* scrambles so every benchmark sees identical inputs. */
    @State(Scope.Thread)
    public static class TestData {
        CubeState[] states = new CubeState[64];
        Action[] moves = new Action[64];

        @Setup(Level.Trial)
        public void init() {
            RandomGenerator rng = RandomGenerator.getDefault();
            Action[] all = Action.values();
            for (int i = 0; i < states.length; i++) {
                CubeState s = ALGEBRA.identity();
                for (int k = 0; k < 20; k++) {
                    s = ALGEBRA.transform(s, all[rng.nextInt(all.length)]);
                }
                states[i] = s;
                moves[i] = all[rng.nextInt(all.length)];
            }
        }
    }

    @Benchmark
    public int transform(TestData td) {
        int sum = 0;
        for (int i = 0; i < td.states.length; i++) {
            sum += ALGEBRA.transform(td.states[i], td.moves[i]).cornerAt(0);
        }
        return sum;
    }

    @Benchmark
    public int render(TestData td) {
        int sum = 0;
        for (CubeState s : td.states) {
            RenderedState r = RENDERER.render(s);
            sum += r.top()[0];
        }
        return sum;
    }

    @Benchmark
    public int encode(TestData td) {
        int sum = 0;
        for (CubeState s : td.states) {
            sum += ENCODER.activeFeatures(s)[6];
        }
        return sum;
    }
}
