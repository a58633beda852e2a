package dev.neuronic.batchpool.math.ops;

import dev.neuronic.batchpool.math.Vectorization;

/**
 * Detects NaN and infinite values in a buffer.
 * The vector path only answers the yes/no question; counting and index
 * collection are scalar because they only run once corruption is known.
 */
public final class NonFiniteScan {

    public interface Impl {
        boolean containsNonFinite(float[] array);
    }

    private static final class ScalarImpl implements Impl {
        @Override
        public boolean containsNonFinite(float[] array) {
            for (float value : array) {
                if (!Float.isFinite(value))
                    return true;
            }
            return false;
        }
    }

    private static final Impl IMPL;

    static {
        Impl impl = Vectorization.loadVectorImpl(
                "dev.neuronic.batchpool.math.ops.vector.NonFiniteScanVector", Impl.class);
        IMPL = (impl != null) ? impl : new ScalarImpl();
    }

    /**
     * @return true if any element is NaN or +/-Infinity
     */
    public static boolean containsNonFinite(float[] array) {
        if (array.length == 0) return false;

        return IMPL.containsNonFinite(array);
    }

    static boolean containsNonFiniteScalar(float[] array) {
        return new ScalarImpl().containsNonFinite(array);
    }

    private NonFiniteScan() {}
}
