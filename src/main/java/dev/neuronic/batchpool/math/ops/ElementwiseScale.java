package dev.neuronic.batchpool.math.ops;

import dev.neuronic.batchpool.math.Vectorization;

/**
 * Element-wise in-place scaling: array[i] = scale * array[i]
 * Used for norm clipping and for averaging the reduced gradient.
 */
public final class ElementwiseScale {

    public interface Impl {
        void computeInPlace(float[] array, float scale);
    }

    private static final class ScalarImpl implements Impl {
        @Override
        public void computeInPlace(float[] array, float scale) {
            for (int i = 0; i < array.length; i++) {
                array[i] = scale * array[i];
            }
        }
    }

    private static final Impl IMPL;

    static {
        Impl impl = Vectorization.loadVectorImpl(
                "dev.neuronic.batchpool.math.ops.vector.ElementwiseScaleVector", Impl.class);
        IMPL = (impl != null) ? impl : new ScalarImpl();
    }

    /**
     * Scale array in-place by a scalar value.
     *
     * @param array the array to scale (modified in-place)
     * @param scale scalar multiplier
     */
    public static void computeInPlace(float[] array, float scale) {
        IMPL.computeInPlace(array, scale);
    }

    static void computeInPlaceScalar(float[] array, float scale) {
        new ScalarImpl().computeInPlace(array, scale);
    }

    private ElementwiseScale() {}
}
