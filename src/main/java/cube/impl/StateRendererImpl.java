package cube.impl;

import static cube.constants.CubeConstants.CELLS_PER_FACE;
import static cube.constants.CubeConstants.CORNERS;
import static cube.constants.CubeConstants.FACES;
import static cube.constants.CubeConstants.STICKERS_PER_CORNER;
import static cube.constants.CubeTables.ACTION_TOKENS;
import static cube.constants.CubeTables.CORNER_COLORS;
import static cube.constants.CubeTables.STICKER_PLACEMENT;

import cube.contracts.StateRenderer;
import cube.records.Action;
import cube.records.CubeState;
import cube.records.RenderedState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class StateRendererImpl implements StateRenderer {

    private static final Map<String, Action> BY_TOKEN;

    static {
        Map<String, Action> m = new HashMap<>();
        for (Action a : Action.values()) {
            m.put(ACTION_TOKENS[a.ordinal()], a);
        }
        BY_TOKEN = Collections.unmodifiableMap(m);
    }

    @Override
    public RenderedState render(CubeState state) {
        Objects.requireNonNull(state, "state");
        char[][] faces = new char[FACES][CELLS_PER_FACE];

        for (int slot = 0; slot < CORNERS; slot++) {
            char[] colors = CORNER_COLORS[state.cornerAt(slot)];
            int orient = state.orientationAt(slot);
            int[][] placement = STICKER_PLACEMENT[slot];
            for (int i = 0; i < STICKERS_PER_CORNER; i++) {
                faces[placement[i][0]][placement[i][1]] = colors[rotatedIndex(i, orient)];
            }
        }
        return new RenderedState(faces);
    }

    /**
     * Index into the unrotated colour triple for sticker {@code i} of a corner twisted
     * {@code orient} steps: 1 maps (c0,c1,c2) to (c2,c0,c1), 2 maps it to (c1,c2,c0).
     */
    static int rotatedIndex(int i, int orient) {
        return Math.floorMod(i - orient, STICKERS_PER_CORNER);
    }

    @Override
    public String renderAction(Action action) {
        return ACTION_TOKENS[Objects.requireNonNull(action, "action").ordinal()];
    }

    @Override
    public Optional<Action> parseAction(String token) {
        if (token == null) return Optional.empty();
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    @Override
    public List<Action> parseActions(String tokens) {
        Objects.requireNonNull(tokens, "tokens");
        List<Action> out = new ArrayList<>();
        for (String t : tokens.trim().split("\\s+")) {
            if (t.isEmpty()) continue;
            out.add(parseAction(t).orElseThrow(
                    () -> new IllegalArgumentException("Unrecognised move token: " + t)));
        }
        return out;
    }
}
