package cube.impl;

import static org.junit.jupiter.api.Assertions.*;

import cube.constants.CubeTables;
import cube.contracts.StateAlgebra;
import cube.contracts.StateRenderer;
import cube.records.Action;
import cube.records.Face;
import cube.records.RenderedState;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class StateRendererImplTest {

    private static final StateAlgebra ALGEBRA = new StateAlgebraImpl();
    private static final StateRenderer RENDERER = new StateRendererImpl();

    /* ─── state rendering ──────────────────────────────────────── */

    @Test
    void solvedCubeShowsCanonicalColours() {
        RenderedState r = RENDERER.render(ALGEBRA.identity());
        assertArrayEquals("WWWW".toCharArray(), r.top());
        assertArrayEquals("GGGG".toCharArray(), r.left());
        assertArrayEquals("OOOO".toCharArray(), r.back());
        assertArrayEquals("RRRR".toCharArray(), r.front());
        assertArrayEquals("BBBB".toCharArray(), r.right());
        assertArrayEquals("YYYY".toCharArray(), r.bottom());
        assertTrue(r.isUniform());
    }

    @Test
    void rightTurnBringsBottomStickerToFront() {
        RenderedState r = RENDERER.render(ALGEBRA.transform(ALGEBRA.identity(), Action.R));
        // slot TFR now holds corner DFR twisted twice: Y R B -> R B Y
        assertEquals('R', r.cell(Face.TOP, 1, 1));
        assertEquals('B', r.cell(Face.RIGHT, 0, 0));
        assertEquals('Y', r.cell(Face.FRONT, 0, 1));
        // left face untouched by R
        assertArrayEquals("GGGG".toCharArray(), r.left());
        assertFalse(r.isUniform());
    }

    @ParameterizedTest
    @EnumSource(value = Action.class, names = {"T", "T_INV"})
    void topTurnKeepsTopAndBottomUniform(Action a) {
        RenderedState r = RENDERER.render(ALGEBRA.transform(ALGEBRA.identity(), a));
        assertArrayEquals("WWWW".toCharArray(), r.top());
        assertArrayEquals("YYYY".toCharArray(), r.bottom());
        assertFalse(r.isUniform());
    }

    @Test
    void renderIsRecomputedAndEqualByContent() {
        RenderedState a = RENDERER.render(ALGEBRA.identity());
        RenderedState b = RENDERER.render(ALGEBRA.identity());
        assertNotSame(a, b);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void placementTableIsBijection() {
        Set<Integer> cells = new HashSet<>();
        for (int[][] slot : CubeTables.STICKER_PLACEMENT) {
            for (int[] fc : slot) {
                assertTrue(cells.add(fc[0] * 4 + fc[1]), "cell written twice: " + fc[0] + "/" + fc[1]);
            }
        }
        assertEquals(24, cells.size());
    }

    @Test
    void orientationRotatesColourTriple() {
        // (c0,c1,c2) -> o=1: (c2,c0,c1), o=2: (c1,c2,c0)
        assertEquals(0, StateRendererImpl.rotatedIndex(0, 0));
        assertEquals(2, StateRendererImpl.rotatedIndex(0, 1));
        assertEquals(0, StateRendererImpl.rotatedIndex(1, 1));
        assertEquals(1, StateRendererImpl.rotatedIndex(0, 2));
        assertEquals(0, StateRendererImpl.rotatedIndex(2, 2));
    }

    @Test
    void netLayout() {
        String net = RENDERER.render(ALGEBRA.identity()).toNet();
        assertEquals(
                "   WW\n" +
                "   WW\n" +
                "GG RR BB OO\n" +
                "GG RR BB OO\n" +
                "   YY\n" +
                "   YY\n", net);
    }

    @Test
    void cellOutOfRangeIsRejected() {
        RenderedState r = RENDERER.render(ALGEBRA.identity());
        assertThrows(IndexOutOfBoundsException.class, () -> r.cell(Face.TOP, 2, 0));
    }

    /* ─── action tokens ────────────────────────────────────────── */

    @ParameterizedTest
    @EnumSource(Action.class)
    void tokenRoundTrip(Action a) {
        String token = RENDERER.renderAction(a);
        assertEquals(2, token.length());
        assertEquals(a.isGenerator() ? '+' : '-', token.charAt(1));
        assertEquals(Optional.of(a), RENDERER.parseAction(token));
    }

    @Test
    void tokensUseFaceLetters() {
        assertEquals("R+", RENDERER.renderAction(Action.R));
        assertEquals("U+", RENDERER.renderAction(Action.T));
        assertEquals("B-", RENDERER.renderAction(Action.B_INV));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"ZZ", "R", "r+", "T+", "L+", "D-", "F+", " R+", "R+ ", "R+R-", "U+-"})
    void unrecognisedTokensParseToEmpty(String token) {
        assertEquals(Optional.empty(), RENDERER.parseAction(token));
    }

    @Test
    void parseActionsSplitsOnWhitespace() {
        assertEquals(List.of(Action.R, Action.T_INV, Action.B),
                RENDERER.parseActions("  R+   U-\tB+ "));
        assertEquals(List.of(), RENDERER.parseActions(""));
    }

    @Test
    void parseActionsRejectsUnknownToken() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> RENDERER.parseActions("R+ ZZ U+"));
        assertTrue(e.getMessage().contains("ZZ"));
    }
}
