package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.EpochResult;
import dev.neuronic.batchpool.TrainingSystemConfig;
import dev.neuronic.batchpool.WorkerPool;
import dev.neuronic.batchpool.data.BatchSource;
import dev.neuronic.batchpool.engine.ComputeStep;
import dev.neuronic.batchpool.optimizers.OptimizerStep;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Multi-epoch driver over a {@link WorkerPool}.
 *
 * <p>Owns the pool for its lifetime, records every round into a {@link TrainingMetrics}
 * and runs {@link TrainingCallback}s between epochs:
 * <pre>{@code
 * try (ParallelTrainer trainer = new ParallelTrainer(config, source, step, new AdamOptimizer(params))) {
 *     TrainingResult result = trainer
 *         .withEarlyStopping(3, 0.001f)
 *         .fit(50);
 *     result.printSummary();
 * }
 * }</pre>
 */
public class ParallelTrainer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ParallelTrainer.class.getName());

    private final BatchSource source;
    private final TrainingMetrics metrics = new TrainingMetrics();
    private final List<TrainingCallback> callbacks = new ArrayList<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final WorkerPool pool;

    public ParallelTrainer(TrainingSystemConfig config, BatchSource source,
                           ComputeStep computeStep, OptimizerStep optimizerStep) {
        this(config, source, computeStep, optimizerStep, MetricsSink.NONE);
    }

    /**
     * @param extraSink additional receiver of round and epoch events, such as a {@link ProgressReporter}
     */
    public ParallelTrainer(TrainingSystemConfig config, BatchSource source, ComputeStep computeStep,
                           OptimizerStep optimizerStep, MetricsSink extraSink) {
        this.source = source;
        this.pool = WorkerPool.create(config, source, computeStep, optimizerStep,
            CompositeMetricsSink.of(metrics, extraSink), null);
    }

    public ParallelTrainer withCallback(TrainingCallback callback) {
        callbacks.add(callback);
        return this;
    }

    public ParallelTrainer withEarlyStopping(int patience, float minDelta) {
        callbacks.add(new EarlyStoppingCallback(patience, minDelta, stopRequested));
        return this;
    }

    /**
     * Get the stop flag for external early stopping callbacks.
     */
    public AtomicBoolean getStopFlag() {
        return stopRequested;
    }

    /**
     * Stop after the round in flight. Safe from any thread.
     */
    public void stopTraining() {
        stopRequested.set(true);
        pool.requestStop();
    }

    /**
     * Run up to {@code epochs} epochs, stopping early when the stop flag is raised.
     * The flag is cleared on entry, so a trainer stopped once can be fit again.
     */
    public TrainingResult fit(int epochs) {
        if (epochs < 1)
            throw new IllegalArgumentException("Epochs must be positive: " + epochs);
        stopRequested.set(false);

        for (TrainingCallback callback : callbacks)
            callback.onTrainingStart(pool, metrics);

        int epochsRun = 0;
        try {
            for (int i = 0; i < epochs && !stopRequested.get(); i++) {
                EpochResult result = pool.runEpoch(source);
                epochsRun++;

                for (TrainingCallback callback : callbacks)
                    callback.onEpochEnd(result.getEpoch(), metrics);

                if (result.isAborted())
                    break;
            }
        } finally {
            metrics.completeTraining();
        }

        boolean stoppedEarly = epochsRun < epochs;
        if (stoppedEarly)
            LOG.info("Training stopped early after " + epochsRun + " of " + epochs + " epochs");

        for (TrainingCallback callback : callbacks)
            callback.onTrainingEnd(pool, metrics);

        return new TrainingResult(metrics, epochsRun, stoppedEarly);
    }

    public TrainingMetrics getMetrics() {
        return metrics;
    }

    public WorkerPool getPool() {
        return pool;
    }

    @Override
    public void close() {
        pool.close();
    }
}
