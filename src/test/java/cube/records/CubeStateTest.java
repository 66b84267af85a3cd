package cube.records;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CubeStateTest {

    @Test
    void wrongLengthFailsFast() {
        assertThrows(IllegalArgumentException.class, () -> new CubeState(new int[7], new int[8]));
        assertThrows(IllegalArgumentException.class, () -> new CubeState(new int[8], new int[9]));
        assertThrows(NullPointerException.class, () -> new CubeState(null, new int[8]));
    }

    @Test
    void arraysAreCopiedInAndOut() {
        int[] pos = {0, 1, 2, 3, 4, 5, 6, 7};
        int[] ort = new int[8];
        CubeState s = new CubeState(pos, ort);
        pos[0] = 7;
        ort[0] = 2;
        assertTrue(s.isIdentity(), "constructor must copy");

        s.cornerPos()[1] = 6;
        s.cornerOrt()[1] = 1;
        assertEquals(CubeState.identity(), s, "accessors must copy");
    }

    @Test
    void contentEquality() {
        CubeState a = new CubeState(new int[] {1, 0, 2, 3, 4, 5, 6, 7}, new int[] {1, 2, 0, 0, 0, 0, 0, 0});
        CubeState b = new CubeState(new int[] {1, 0, 2, 3, 4, 5, 6, 7}, new int[] {1, 2, 0, 0, 0, 0, 0, 0});
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(CubeState.identity(), a);
        assertTrue(a.toString().contains("pos=[1, 0, 2"));
    }

    @Test
    void wellFormedChecks() {
        assertTrue(CubeState.identity().isWellFormed());
        assertSame(CubeState.identity(), CubeState.identity().checkWellFormed());

        CubeState duplicate = new CubeState(new int[] {0, 1, 2, 3, 4, 5, 6, 6}, new int[8]);
        CubeState outOfRange = new CubeState(new int[] {0, 1, 2, 3, 4, 5, 6, 8}, new int[8]);
        CubeState badTwist = new CubeState(CubeState.identity().cornerPos(), new int[] {0, 0, 0, 0, 0, -1, 0, 0});

        assertFalse(duplicate.isWellFormed());
        assertFalse(outOfRange.isWellFormed());
        assertFalse(badTwist.isWellFormed());

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, badTwist::checkWellFormed);
        assertTrue(e.getMessage().startsWith("slot 5"));
    }

    @Test
    void slotLookup() {
        CubeState s = new CubeState(new int[] {3, 0, 1, 2, 4, 5, 6, 7}, new int[8]);
        assertEquals(1, s.slotOf(0));
        assertEquals(0, s.slotOf(3));
        assertEquals(3, s.cornerAt(0));
        assertEquals(-1, s.slotOf(9));
    }

    @ParameterizedTest
    @EnumSource(Action.class)
    void actionGeneratorAndInverse(Action a) {
        assertEquals(a, a.inverse().inverse());
        assertTrue(a.generator().isGenerator());
        assertTrue(Action.generators().contains(a.generator()));
    }
}
