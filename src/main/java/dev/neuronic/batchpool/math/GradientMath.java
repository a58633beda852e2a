package dev.neuronic.batchpool.math;

import dev.neuronic.batchpool.math.ops.ElementwiseAccumulate;
import dev.neuronic.batchpool.math.ops.ElementwiseScale;
import dev.neuronic.batchpool.math.ops.GradientNorm;
import dev.neuronic.batchpool.math.ops.NonFiniteScan;
import dev.neuronic.batchpool.math.ops.ParameterUpdate;

/**
 * Central entry point for the buffer math used by the round protocol.
 * Methods are prefixed by operation type for intuitive autocomplete.
 */
public final class GradientMath {

    // ========== NORMS ==========

    /**
     * L2 norm of a buffer.
     */
    public static float normL2(float[] buffer) {
        return GradientNorm.computeNorm(buffer);
    }

    // ========== IN-PLACE UPDATES ==========

    /**
     * accumulator[i] += contribution[i]
     */
    public static void accumulate(float[] accumulator, float[] contribution) {
        ElementwiseAccumulate.compute(accumulator, contribution);
    }

    /**
     * buffer[i] *= scale
     */
    public static void scaleInPlace(float[] buffer, float scale) {
        ElementwiseScale.computeInPlace(buffer, scale);
    }

    /**
     * parameters[i] -= learningRate * gradients[i]
     */
    public static void parameterUpdate(float[] parameters, float[] gradients, float learningRate) {
        ParameterUpdate.compute(parameters, gradients, learningRate);
    }

    // ========== CHECKS ==========

    /**
     * @return true if any element is NaN or infinite
     */
    public static boolean containsNonFinite(float[] buffer) {
        return NonFiniteScan.containsNonFinite(buffer);
    }

    private GradientMath() {}
}
