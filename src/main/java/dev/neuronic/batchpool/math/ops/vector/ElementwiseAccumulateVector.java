package dev.neuronic.batchpool.math.ops.vector;

import dev.neuronic.batchpool.math.Vectorization;
import dev.neuronic.batchpool.math.ops.ElementwiseAccumulate;
import jdk.incubator.vector.FloatVector;
import jdk.incubator.vector.VectorSpecies;

/**
 * Vector implementation of ElementwiseAccumulate.
 * This class is only loaded when Vector API is available.
 */
public final class ElementwiseAccumulateVector implements ElementwiseAccumulate.Impl {

    @Override
    public void compute(float[] accumulator, float[] contribution) {
        if (!Vectorization.shouldVectorize(accumulator.length)) {
            scalarCompute(accumulator, contribution);
            return;
        }

        VectorSpecies<Float> species = Vectorization.getSpecies();
        int upperBound = Vectorization.loopBound(accumulator.length);

        int i = 0;
        for (; i < upperBound; i += species.length()) {
            FloatVector acc = FloatVector.fromArray(species, accumulator, i);
            FloatVector add = FloatVector.fromArray(species, contribution, i);
            acc.add(add).intoArray(accumulator, i);
        }

        for (; i < accumulator.length; i++) {
            accumulator[i] += contribution[i];
        }
    }

    private void scalarCompute(float[] accumulator, float[] contribution) {
        for (int i = 0; i < accumulator.length; i++) {
            accumulator[i] += contribution[i];
        }
    }
}
