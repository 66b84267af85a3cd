package cube.impl;

import static cube.constants.CubeConstants.ENCODED_COLS;
import static cube.constants.CubeConstants.ENCODED_ROWS;
import static cube.constants.CubeConstants.ORIENTATIONS;

import cube.contracts.StateEncoder;
import cube.records.CubeState;
import java.util.Objects;

/**
 * One-hot corner encoding (7 × 24). Layout follows the DeepCubeA corner features:
 * the row is the corner id, the column is {@code slot * 3 + orientation}.
 */
public final class StateEncoderImpl implements StateEncoder {

    @Override
    public int[] shape() {
        return new int[] {ENCODED_ROWS, ENCODED_COLS};
    }

    @Override
    public float[][] encode(CubeState state) {
        float[][] target = new float[ENCODED_ROWS][ENCODED_COLS];
        encodeInPlace(target, state);
        return target;
    }

    @Override
    public void encodeInPlace(float[][] target, CubeState state) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(state, "state");
        checkShape(target);
        for (int corner = 0; corner < ENCODED_ROWS; corner++) {
            target[corner][column(state, corner)] = 1f;
        }
    }

    @Override
    public int[] activeFeatures(CubeState state) {
        Objects.requireNonNull(state, "state");
        int[] features = new int[ENCODED_ROWS];
        for (int corner = 0; corner < ENCODED_ROWS; corner++) {
            features[corner] = corner * ENCODED_COLS + column(state, corner);
        }
        return features;
    }

    private static int column(CubeState state, int corner) {
        int slot = state.slotOf(corner);
        if (slot < 0) {
            throw new IllegalArgumentException("corner " + corner + " missing from " + state);
        }
        return slot * ORIENTATIONS + state.orientationAt(slot);
    }

    private static void checkShape(float[][] target) {
        if (target.length != ENCODED_ROWS) {
            throw new IllegalArgumentException("expected " + ENCODED_ROWS + " rows, got " + target.length);
        }
        for (int r = 0; r < ENCODED_ROWS; r++) {
            if (target[r] == null || target[r].length != ENCODED_COLS) {
                throw new IllegalArgumentException("row " + r + " must have " + ENCODED_COLS + " columns");
            }
        }
    }
}
