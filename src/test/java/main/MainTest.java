package main;

import static org.junit.jupiter.api.Assertions.*;

import cube.impl.StateAlgebraImpl;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.*;

class MainTest {

    @Test
    void perftCountsFullTree() {
        StateAlgebraImpl algebra = new StateAlgebraImpl();
        assertEquals(1, Main.perft(algebra, algebra.identity(), 0));
        assertEquals(6, Main.perft(algebra, algebra.identity(), 1));
        assertEquals(46_656, Main.perft(algebra, algebra.identity(), 6));
    }

    @Test
    void appliesTokensAndPrintsState() {
        String out = capture(() -> Main.main(new String[] {"R+", "R-"}));
        assertTrue(out.startsWith("   WW\n"), out);
        assertTrue(out.contains("goal     : true"), out);
    }

    @Test
    void benchReportsNodes() {
        String out = capture(() -> Main.main(new String[] {"bench", "3"}));
        assertTrue(out.contains("Nodes searched: 216"), out);
        assertTrue(out.contains("benchok"), out);
    }

    private static String capture(Runnable r) {
        PrintStream old = System.out;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buf, true, StandardCharsets.UTF_8));
        try {
            r.run();
        } finally {
            System.setOut(old);
        }
        return buf.toString(StandardCharsets.UTF_8);
    }
}
