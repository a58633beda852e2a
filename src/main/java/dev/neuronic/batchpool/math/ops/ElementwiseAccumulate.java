package dev.neuronic.batchpool.math.ops;

import dev.neuronic.batchpool.math.Vectorization;

/**
 * Accumulation into a running sum: accumulator[i] += contribution[i]
 * The reduction step of the round protocol is built on this op.
 */
public final class ElementwiseAccumulate {

    public interface Impl {
        void compute(float[] accumulator, float[] contribution);
    }

    private static final class ScalarImpl implements Impl {
        @Override
        public void compute(float[] accumulator, float[] contribution) {
            for (int i = 0; i < accumulator.length; i++) {
                accumulator[i] += contribution[i];
            }
        }
    }

    private static final Impl IMPL;

    static {
        Impl impl = Vectorization.loadVectorImpl(
                "dev.neuronic.batchpool.math.ops.vector.ElementwiseAccumulateVector", Impl.class);
        IMPL = (impl != null) ? impl : new ScalarImpl();
    }

    /**
     * Add contribution into accumulator element-wise.
     *
     * @throws IllegalArgumentException if arrays have different lengths
     */
    public static void compute(float[] accumulator, float[] contribution) {
        if (accumulator.length != contribution.length)
            throw new IllegalArgumentException("Accumulator and contribution must have same length: accumulator=" +
                                             accumulator.length + ", contribution=" + contribution.length);

        IMPL.compute(accumulator, contribution);
    }

    static void computeScalar(float[] accumulator, float[] contribution) {
        new ScalarImpl().compute(accumulator, contribution);
    }

    private ElementwiseAccumulate() {}
}
