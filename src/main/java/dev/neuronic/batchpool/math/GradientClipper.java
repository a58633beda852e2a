package dev.neuronic.batchpool.math;

/**
 * Interface for gradient clipping strategies.
 *
 * <p><b>Purpose:</b> Keep one worker's exploding gradient from dominating the
 * reduced gradient of a round. The coordinator clips each worker's buffer
 * individually before it is added to the accumulator, never the sum.
 *
 * <p><b>Thread Safety:</b> Implementations are stateless; the coordinator is the
 * only caller, but nothing prevents sharing a clipper across pools.
 */
public interface GradientClipper {

    /**
     * Clip gradients in-place.
     *
     * @param gradients the gradient array to clip (modified in-place)
     * @return the uniform scale factor applied, or exactly {@code 1.0f} when the
     *         buffer was left untouched
     */
    float clipInPlace(float[] gradients);

    /**
     * Get a description of this clipping strategy for logging/debugging.
     */
    String getDescription();

    /**
     * Create L2 norm gradient clipper.
     * Clips gradients when their L2 norm exceeds maxNorm.
     *
     * @param maxNorm maximum allowed L2 norm (the pool default is 10.0)
     * @return norm-based clipper
     */
    static GradientClipper byNorm(float maxNorm) {
        return new NormClipper(maxNorm);
    }
}
