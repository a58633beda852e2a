package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.WorkerPool;

/**
 * Hooks into a {@link ParallelTrainer} run.
 *
 * Use cases:
 * - Progress monitoring and logging
 * - Early stopping based on the epoch loss
 * - Checkpointing the parameters the optimizer updates
 */
public interface TrainingCallback {

    /**
     * Called before the first epoch.
     *
     * @param pool the pool running the epochs
     * @param metrics metrics collector that will track training progress
     */
    default void onTrainingStart(WorkerPool pool, TrainingMetrics metrics) {}

    /**
     * Called at the end of each epoch.
     *
     * @param epoch current epoch number (0-based)
     * @param metrics current training metrics
     */
    default void onEpochEnd(int epoch, TrainingMetrics metrics) {}

    /**
     * Called after the last epoch, including when training stopped early.
     */
    default void onTrainingEnd(WorkerPool pool, TrainingMetrics metrics) {}
}
