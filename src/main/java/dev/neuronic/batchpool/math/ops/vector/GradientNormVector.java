package dev.neuronic.batchpool.math.ops.vector;

import dev.neuronic.batchpool.math.Vectorization;
import dev.neuronic.batchpool.math.ops.GradientNorm;
import jdk.incubator.vector.FloatVector;
import jdk.incubator.vector.VectorOperators;
import jdk.incubator.vector.VectorSpecies;

/**
 * Vector implementation of GradientNorm.
 * This class is only loaded when Vector API is available.
 */
public final class GradientNormVector implements GradientNorm.Impl {

    @Override
    public float computeNormSquared(float[] array) {
        if (!Vectorization.shouldVectorize(array.length)) {
            return scalarComputeNormSquared(array);
        }

        VectorSpecies<Float> species = Vectorization.getSpecies();
        int loopBound = Vectorization.loopBound(array.length);
        FloatVector sumVec = FloatVector.zero(species);

        int i = 0;
        for (; i < loopBound; i += species.length()) {
            FloatVector vec = FloatVector.fromArray(species, array, i);
            sumVec = vec.fma(vec, sumVec);
        }

        float sum = sumVec.reduceLanes(VectorOperators.ADD);

        for (; i < array.length; i++) {
            sum += array[i] * array[i];
        }

        return sum;
    }

    private float scalarComputeNormSquared(float[] array) {
        float sum = 0.0f;
        for (float val : array) {
            sum += val * val;
        }
        return sum;
    }
}
