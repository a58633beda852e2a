package dev.neuronic.batchpool.math.ops.vector;

import dev.neuronic.batchpool.math.Vectorization;
import dev.neuronic.batchpool.math.ops.NonFiniteScan;
import jdk.incubator.vector.FloatVector;
import jdk.incubator.vector.VectorOperators;
import jdk.incubator.vector.VectorSpecies;

/**
 * Vector implementation of NonFiniteScan.
 * x - x is 0 for every finite x and NaN for NaN or +/-Infinity, so a lane-wise
 * running sum of (x - x) turns NaN as soon as one bad element is seen.
 * This class is only loaded when Vector API is available.
 */
public final class NonFiniteScanVector implements NonFiniteScan.Impl {

    @Override
    public boolean containsNonFinite(float[] array) {
        if (!Vectorization.shouldVectorize(array.length)) {
            return scalarContainsNonFinite(array);
        }

        VectorSpecies<Float> species = Vectorization.getSpecies();
        int upperBound = Vectorization.loopBound(array.length);
        FloatVector probe = FloatVector.zero(species);

        int i = 0;
        for (; i < upperBound; i += species.length()) {
            FloatVector v = FloatVector.fromArray(species, array, i);
            probe = probe.add(v.sub(v));
        }

        if (Float.isNaN(probe.reduceLanes(VectorOperators.ADD)))
            return true;

        for (; i < array.length; i++) {
            if (!Float.isFinite(array[i]))
                return true;
        }
        return false;
    }

    private boolean scalarContainsNonFinite(float[] array) {
        for (float value : array) {
            if (!Float.isFinite(value))
                return true;
        }
        return false;
    }
}
