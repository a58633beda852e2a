package dev.neuronic.batchpool.math.ops.vector;

import dev.neuronic.batchpool.math.Vectorization;
import dev.neuronic.batchpool.math.ops.ElementwiseScale;
import jdk.incubator.vector.FloatVector;
import jdk.incubator.vector.VectorSpecies;

/**
 * Vector implementation of ElementwiseScale.
 * This class is only loaded when Vector API is available.
 */
public final class ElementwiseScaleVector implements ElementwiseScale.Impl {

    @Override
    public void computeInPlace(float[] array, float scale) {
        if (!Vectorization.shouldVectorize(array.length)) {
            scalarComputeInPlace(array, scale);
            return;
        }

        VectorSpecies<Float> species = Vectorization.getSpecies();
        FloatVector scaleVec = FloatVector.broadcast(species, scale);
        int upperBound = Vectorization.loopBound(array.length);

        int i = 0;
        for (; i < upperBound; i += species.length()) {
            FloatVector v = FloatVector.fromArray(species, array, i);
            v.mul(scaleVec).intoArray(array, i);
        }

        for (; i < array.length; i++) {
            array[i] = scale * array[i];
        }
    }

    private void scalarComputeInPlace(float[] array, float scale) {
        for (int i = 0; i < array.length; i++) {
            array[i] = scale * array[i];
        }
    }
}
