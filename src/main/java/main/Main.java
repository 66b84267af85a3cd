// File: Main.java
package main;

import static cube.constants.CubeConstants.BENCH_DEFAULT_DEPTH;
import static cube.constants.CubeConstants.MAX_PLY;

import cube.contracts.StateAlgebra;
import cube.contracts.StateEncoder;
import cube.contracts.StateRenderer;
import cube.impl.Cube2x2Simple;
import cube.records.Action;
import cube.records.CubeState;

import java.util.Arrays;
import java.util.List;

/**
 * Bench / demo entry point.
 * <ul>
 *   <li>{@code bench [depth]} – perft over the full move tree from the solved state</li>
 *   <li>{@code <tokens...>} – apply moves such as {@code R+ U- B+} and print the result</li>
 * </ul>
 */
public final class Main {

    public static void main(String[] args) {
        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int depth = BENCH_DEFAULT_DEPTH;
            if (args.length > 1) {
                try {
                    depth = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    System.err.println("Invalid depth: " + args[1]);
                    System.exit(2);
                }
            }
            if (depth < 0 || depth > MAX_PLY) {
                System.err.println("Depth must be between 0 and " + MAX_PLY);
                System.exit(2);
            }
            runPerftBench(depth);
            return;
        }

        StateAlgebra algebra = Cube2x2Simple.ALGEBRA;
        StateRenderer renderer = Cube2x2Simple.RENDERER;
        StateEncoder encoder = Cube2x2Simple.ENCODER;

        List<Action> moves;
        try {
            moves = renderer.parseActions(String.join(" ", args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        CubeState state = algebra.transform(algebra.identity(), moves);
        System.out.print(renderer.render(state).toNet());
        System.out.println("state    : " + state);
        System.out.println("goal     : " + algebra.isGoal(state));
        System.out.println("features : " + Arrays.toString(encoder.activeFeatures(state)));
    }

    private static void runPerftBench(int depth) {
        StateAlgebra algebra = Cube2x2Simple.ALGEBRA;

        long t0 = System.nanoTime();
        long nodes = perft(algebra, algebra.identity(), depth);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        long nps = ms > 0 ? (1000L * nodes) / ms : 0;
        System.out.printf("Nodes searched: %d%n", nodes);
        System.out.printf("nps: %d%n", nps);
        System.out.println("benchok");
    }

    /** Leaf count of the full move tree; every leaf is a (possibly repeated) state. */
    static long perft(StateAlgebra algebra, CubeState state, int depth) {
        if (depth == 0) return 1;

        long nodes = 0;
        for (Action a : algebra.actions()) {
            nodes += perft(algebra, algebra.transform(state, a), depth - 1);
        }
        return nodes;
    }
}
