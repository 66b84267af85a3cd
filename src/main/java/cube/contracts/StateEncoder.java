package cube.contracts;

import cube.records.CubeState;

/**
 * One-hot feature encoding of a state for a learned model.
 *
 * <p>Row {@code c} (corners 0–6) carries a single 1 at column {@code slot * 3 + orientation}.
 * Corner 7 is implied by the others and not encoded.
 */
public interface StateEncoder {

    /** {@code {rows, cols}} of the feature tensor. */
    int[] shape();

    /** Freshly allocated, fully populated tensor. */
    float[][] encode(CubeState state);

    /**
     * Sets the seven feature bits in {@code target}.
     *
     * <p>Precondition: {@code target} is zero-filled. Nothing is cleared, so a
     * dirty buffer keeps its stale bits.
     *
     * @throws IllegalArgumentException if {@code target} has the wrong shape
     */
    void encodeInPlace(float[][] target, CubeState state);

    /** Flat indices ({@code row * cols + col}) of the seven set bits, in row order. */
    int[] activeFeatures(CubeState state);
}
