package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.data.Batch;

/**
 * The model's forward and backward pass over one batch.
 *
 * <p>Called concurrently from every worker thread, each with its own scratch and gradient
 * buffers. Implementations may read shared parameters freely; parameters only change while
 * all workers are parked between rounds.
 */
@FunctionalInterface
public interface ComputeStep {

    /**
     * @param batch the batch to process; must not be released here
     * @param scratch worker-private activation scratch
     * @param outGradient worker-private gradient buffer, zeroed before the call
     * @return the batch loss
     */
    float run(Batch batch, float[] scratch, float[] outGradient);
}
