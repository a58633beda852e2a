package dev.neuronic.batchpool.optimizers;

/**
 * Parameter update applied once per round with the reduced gradient.
 *
 * <p>Called only on the coordinating thread while every worker is parked between Phase A
 * and Phase B, so implementations may write the model parameters without synchronization.
 * The next dispatch publishes those writes to the workers.
 */
@FunctionalInterface
public interface OptimizerStep {

    /**
     * @param reducedGradient mean of the valid, clipped worker gradients; must not be retained
     * @param learningRate configured learning rate
     */
    void apply(float[] reducedGradient, float learningRate);
}
