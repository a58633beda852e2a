package dev.neuronic.batchpool.math.ops;

import dev.neuronic.batchpool.math.Vectorization;

/**
 * Parameter update operation: param[i] = param[i] - learningRate * gradient[i]
 * Used by optimizers to apply the reduced gradient.
 */
public final class ParameterUpdate {

    public interface Impl {
        void compute(float[] parameters, float[] gradients, float learningRate);
    }

    private static final class ScalarImpl implements Impl {
        @Override
        public void compute(float[] parameters, float[] gradients, float learningRate) {
            for (int i = 0; i < parameters.length; i++) {
                parameters[i] -= learningRate * gradients[i];
            }
        }
    }

    private static final Impl IMPL;

    static {
        Impl impl = Vectorization.loadVectorImpl(
                "dev.neuronic.batchpool.math.ops.vector.ParameterUpdateVector", Impl.class);
        IMPL = (impl != null) ? impl : new ScalarImpl();
    }

    /**
     * Update parameters in-place using gradients.
     *
     * @throws IllegalArgumentException if arrays have different lengths
     */
    public static void compute(float[] parameters, float[] gradients, float learningRate) {
        if (parameters.length != gradients.length)
            throw new IllegalArgumentException("Parameters and gradients must have same length: params=" +
                                             parameters.length + ", gradients=" + gradients.length);

        IMPL.compute(parameters, gradients, learningRate);
    }

    static void computeScalar(float[] parameters, float[] gradients, float learningRate) {
        new ScalarImpl().compute(parameters, gradients, learningRate);
    }

    private ParameterUpdate() {}
}
