package dev.neuronic.batchpool.math.ops;

import dev.neuronic.batchpool.math.Vectorization;

/**
 * Computes L2 norm of gradients efficiently with vectorization support.
 * Used for gradient clipping and monitoring gradient magnitudes.
 */
public final class GradientNorm {

    public interface Impl {
        float computeNormSquared(float[] array);
    }

    private static final class ScalarImpl implements Impl {
        @Override
        public float computeNormSquared(float[] array) {
            float sum = 0.0f;
            for (float val : array) {
                sum += val * val;
            }
            return sum;
        }
    }

    private static final Impl IMPL;

    static {
        Impl impl = Vectorization.loadVectorImpl(
                "dev.neuronic.batchpool.math.ops.vector.GradientNormVector", Impl.class);
        IMPL = (impl != null) ? impl : new ScalarImpl();
    }

    /**
     * Compute L2 norm squared of a single array.
     */
    public static float computeNormSquared(float[] array) {
        return IMPL.computeNormSquared(array);
    }

    /**
     * Compute L2 norm (not squared) of a single array.
     *
     * <p>Falls back to double accumulation when the float sum of squares overflows.
     * The result is still infinite when the norm itself exceeds {@link Float#MAX_VALUE};
     * use {@link #computeNormWide(float[])} where that matters.
     */
    public static float computeNorm(float[] array) {
        float normSquared = IMPL.computeNormSquared(array);
        if (Float.isInfinite(normSquared))
            return (float) computeNormWide(array);
        return (float) Math.sqrt(normSquared);
    }

    /**
     * L2 norm accumulated in double. Finite for every buffer of finite floats.
     */
    public static double computeNormWide(float[] array) {
        return Math.sqrt(computeNormSquaredWide(array));
    }

    static double computeNormSquaredWide(float[] array) {
        double sum = 0.0;
        for (float val : array) {
            sum += (double) val * val;
        }
        return sum;
    }

    static float computeNormSquaredScalar(float[] array) {
        return new ScalarImpl().computeNormSquared(array);
    }

    private GradientNorm() {}
}
