package dev.neuronic.batchpool;

import dev.neuronic.batchpool.data.BatchSource;
import dev.neuronic.batchpool.engine.BrokenRoundException;
import dev.neuronic.batchpool.engine.ComputeStep;
import dev.neuronic.batchpool.engine.DatasetSizeGuard;
import dev.neuronic.batchpool.engine.GradientAccumulator;
import dev.neuronic.batchpool.engine.RoundBarrier;
import dev.neuronic.batchpool.engine.RoundCoordinator;
import dev.neuronic.batchpool.engine.RoundState;
import dev.neuronic.batchpool.engine.WorkerContext;
import dev.neuronic.batchpool.engine.WorkerThread;
import dev.neuronic.batchpool.math.GradientClipper;
import dev.neuronic.batchpool.optimizers.OptimizerStep;
import dev.neuronic.batchpool.training.MetricsSink;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed-size pool of worker threads computing batch gradients in barrier-synchronized rounds.
 *
 * <p>Every round the calling thread fetches up to one batch per worker, the workers compute
 * gradients into private buffers, and the calling thread validates, clips and averages them
 * into a shared accumulator before applying the optimizer step. No lock is taken on the
 * compute or reduction path; the round barrier orders every handoff.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * try (WorkerPool pool = WorkerPool.create(config, source, computeStep, new SgdOptimizer(parameters))) {
 *     for (int epoch = 0; epoch < 10; epoch++) {
 *         EpochResult result = pool.runEpoch(source);
 *         System.out.println(result);
 *     }
 * }
 * }</pre>
 *
 * <p><b>Failure model:</b>
 * <ul>
 *   <li>Configuration and dataset problems fail {@link #create} before any thread starts.</li>
 *   <li>A worker gradient with NaN or Inf is excluded from its round and logged.</li>
 *   <li>A malformed batch or a runaway source fails the epoch with
 *       {@link ProtocolViolationException}; the pool stays usable.</li>
 *   <li>A broken barrier (a worker {@link Error}, an interrupt) fails the epoch with
 *       {@link TrainingException} and tears the pool down.</li>
 * </ul>
 */
public final class WorkerPool implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(WorkerPool.class.getName());

    /** Prefix of worker thread names, followed by the worker index. */
    public static final String THREAD_NAME_PREFIX = "batchpool-worker-";

    private final TrainingSystemConfig config;
    private final int effectiveBatchSize;
    private final WorkerContext[] contexts;
    private final GradientAccumulator accumulator;
    private final RoundBarrier barrier;
    private final RoundCoordinator coordinator;
    private final WorkerThread[] workers;
    private final Thread[] threads;
    private final AtomicBoolean stopRequested = new AtomicBoolean();
    private final ReentrantLock lock = new ReentrantLock();

    private volatile boolean closed;
    private int epochCounter;

    private WorkerPool(TrainingSystemConfig config, int effectiveBatchSize, ComputeStep computeStep,
                       OptimizerStep optimizerStep, MetricsSink sink) {
        this.config = config;
        this.effectiveBatchSize = effectiveBatchSize;

        int workerCount = config.workerCount;
        long scratchSize = (long) effectiveBatchSize * config.sequenceLength * config.scratchFloatsPerToken;
        if (scratchSize > Integer.MAX_VALUE - 8)
            throw new ResourceException("Worker scratch of " + scratchSize + " floats exceeds the maximum array size", null);

        this.contexts = new WorkerContext[workerCount];
        for (int i = 0; i < workerCount; i++)
            contexts[i] = new WorkerContext(i, config.gradientBufferSize, (int) scratchSize);
        this.accumulator = new GradientAccumulator(config.gradientBufferSize);
        this.barrier = new RoundBarrier(workerCount);
        this.coordinator = new RoundCoordinator(contexts, accumulator, barrier,
            GradientClipper.byNorm(config.clipNorm), optimizerStep, sink, stopRequested,
            effectiveBatchSize, config.sequenceLength, config.roundCountMargin,
            config.learningRate, config.validateBatches);

        this.workers = new WorkerThread[workerCount];
        for (int i = 0; i < workerCount; i++)
            workers[i] = new WorkerThread(contexts[i], barrier, computeStep);
        this.threads = new Thread[workerCount];
    }

    /**
     * Create a pool with no metrics sink and daemon worker threads.
     *
     * @see #create(TrainingSystemConfig, BatchSource, ComputeStep, OptimizerStep, MetricsSink, ThreadFactory)
     */
    public static WorkerPool create(TrainingSystemConfig config, BatchSource source,
                                    ComputeStep computeStep, OptimizerStep optimizerStep) {
        return create(config, source, computeStep, optimizerStep, MetricsSink.NONE, null);
    }

    /**
     * Size the batches to the data, allocate every worker buffer and start the workers.
     *
     * <p>The dataset check runs first: a source that cannot fill a single sequence fails with
     * {@link DatasetTooSmallException} before anything is allocated. If allocation or thread
     * creation fails, already started workers are stopped and joined before
     * {@link ResourceException} is thrown.
     *
     * @param sink receiver of round and epoch metrics
     * @param threadFactory factory for worker threads, or null for plain daemon threads;
     *        threads are renamed {@value #THREAD_NAME_PREFIX}{@code <i>} and marked daemon
     */
    public static WorkerPool create(TrainingSystemConfig config, BatchSource source, ComputeStep computeStep,
                                    OptimizerStep optimizerStep, MetricsSink sink, ThreadFactory threadFactory) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(computeStep, "computeStep");
        Objects.requireNonNull(optimizerStep, "optimizerStep");
        Objects.requireNonNull(sink, "sink");

        int effectiveBatchSize = DatasetSizeGuard.effectiveBatchSize(
            source.trainableTokenCount(), config.batchSize, config.sequenceLength);
        source.setBatchSize(effectiveBatchSize);

        WorkerPool pool;
        try {
            pool = new WorkerPool(config, effectiveBatchSize, computeStep, optimizerStep, sink);
        } catch (OutOfMemoryError e) {
            throw new ResourceException(String.format(
                "Cannot allocate buffers for %d workers (gradient %d floats each)",
                config.workerCount, config.gradientBufferSize), e);
        }

        pool.start(threadFactory != null ? threadFactory : Thread::new);
        return pool;
    }

    private void start(ThreadFactory threadFactory) {
        int index = 0;
        try {
            for (; index < workers.length; index++) {
                Thread thread = threadFactory.newThread(workers[index]);
                if (thread == null)
                    throw new IllegalStateException("Thread factory returned null");
                thread.setName(THREAD_NAME_PREFIX + index);
                thread.setDaemon(true);
                threads[index] = thread;
                thread.start();
            }
        } catch (RuntimeException | OutOfMemoryError e) {
            LOG.log(Level.SEVERE, "Failed to start worker " + index + "; stopping " + index + " started workers", e);
            closed = true;
            abortWorkers();
            dropBuffers();
            throw new ResourceException(String.format("Failed to start worker %d of %d", index, workers.length), e);
        }

        if (LOG.isLoggable(Level.FINE))
            LOG.fine(String.format("Topology %s spans %d level(s) for %d workers",
                config.topology, config.topology.levelsFor(workers.length), workers.length));
        LOG.info(String.format("Started %d workers (batch size %d of %d requested, sequence length %d)",
            workers.length, effectiveBatchSize, config.batchSize, config.sequenceLength));
    }

    /**
     * Run one epoch over {@code source} on the calling thread.
     *
     * @return the epoch summary; {@link EpochResult#isAborted()} is set if {@link #requestStop()} ended it
     * @throws NoDataException if the source yields no batch
     * @throws ProtocolViolationException if a batch is malformed or the source yields too many batches
     * @throws TrainingException if the round barrier breaks; the pool is closed afterwards
     * @throws IllegalStateException if the pool is closed
     */
    public EpochResult runEpoch(BatchSource source) {
        Objects.requireNonNull(source, "source");
        lock.lock();
        try {
            ensureOpen();
            stopRequested.set(false);
            source.setBatchSize(effectiveBatchSize);
            int epoch = epochCounter++;

            try {
                EpochResult result = coordinator.runEpoch(source, epoch);
                LOG.info(result.toString());
                return result;
            } catch (BrokenRoundException e) {
                LOG.log(Level.SEVERE, "Round barrier broke during epoch " + epoch + "; closing pool", e);
                closed = true;
                abortWorkers();
                coordinator.releaseLeftovers();
                dropBuffers();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ask the running epoch to stop before its next round. Rounds already dispatched complete.
     * Safe to call from any thread; cleared when the next epoch starts.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    /**
     * Stop and join every worker, release leftover batches and drop the buffers.
     * Idempotent; safe before any epoch has run.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed)
                return;
            closed = true;

            barrier.signalShutdown();
            try {
                barrier.awaitDispatch();
            } catch (BrokenRoundException e) {
                LOG.log(Level.WARNING, "Shutdown round failed; interrupting workers", e);
                abortWorkers();
            }
            joinWorkers();
            coordinator.releaseLeftovers();
            dropBuffers();
            LOG.info("Worker pool closed after " + epochCounter + " epochs");
        } finally {
            lock.unlock();
        }
    }

    // Set the shutdown flag before interrupting so a worker that swallowed the interrupt
    // still sees it after its compute step.
    private void abortWorkers() {
        barrier.signalShutdown();
        for (Thread thread : threads) {
            if (thread != null)
                thread.interrupt();
        }
        barrier.breakBarrier();
        joinWorkers();
    }

    private void joinWorkers() {
        for (Thread thread : threads) {
            if (thread == null)
                continue;
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warning("Interrupted while joining " + thread.getName() + "; remaining workers left to exit on their own");
                return;
            }
        }
    }

    private void dropBuffers() {
        for (WorkerContext context : contexts)
            context.dropBuffers();
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("Worker pool is closed");
    }

    // ========== INTROSPECTION ==========

    public int getEffectiveBatchSize() {
        return effectiveBatchSize;
    }

    public int getWorkerCount() {
        return contexts.length;
    }

    public WorkerStats getWorkerStats(int worker) {
        if (worker < 0 || worker >= contexts.length)
            throw new IndexOutOfBoundsException("Worker " + worker + " of " + contexts.length);
        return contexts[worker].snapshot();
    }

    public WorkerStats[] getAllWorkerStats() {
        WorkerStats[] stats = new WorkerStats[contexts.length];
        for (int i = 0; i < contexts.length; i++)
            stats[i] = contexts[i].snapshot();
        return stats;
    }

    /**
     * L2 norm of the most recent reduced gradient, NaN before the first round.
     */
    public float getReducedGradientNorm() {
        return coordinator.getReducedGradientNorm();
    }

    /**
     * Copy of the most recent reduced gradient. Waits for a running epoch to finish.
     */
    public float[] getReducedGradient() {
        lock.lock();
        try {
            return accumulator.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public ThreadTopology getTopology() {
        return config.topology;
    }

    public TrainingSystemConfig getConfig() {
        return config;
    }

    public RoundState getRoundState() {
        return coordinator.getState();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * @return number of worker threads still alive
     */
    public int getLiveWorkerCount() {
        int alive = 0;
        for (Thread thread : threads) {
            if (thread != null && thread.isAlive())
                alive++;
        }
        return alive;
    }
}
