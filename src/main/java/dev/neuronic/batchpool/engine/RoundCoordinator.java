package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.EpochResult;
import dev.neuronic.batchpool.NoDataException;
import dev.neuronic.batchpool.ProtocolViolationException;
import dev.neuronic.batchpool.data.Batch;
import dev.neuronic.batchpool.data.BatchSource;
import dev.neuronic.batchpool.data.BatchValidator;
import dev.neuronic.batchpool.math.GradientClipper;
import dev.neuronic.batchpool.math.GradientValidator;
import dev.neuronic.batchpool.math.GradientValidator.ValidationReport;
import dev.neuronic.batchpool.optimizers.OptimizerStep;
import dev.neuronic.batchpool.training.MetricsSink;
import dev.neuronic.batchpool.training.RoundMetrics;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the rounds of an epoch on the calling thread.
 *
 * <p>Per round:
 * <ol>
 *   <li>fetch up to one batch per worker, validating each</li>
 *   <li>assign batch {@code i} to worker {@code i} and trip the dispatch point</li>
 *   <li>wait at Phase A for every worker to finish</li>
 *   <li>validate, clip and sum each dispatched gradient, then divide by the number accepted</li>
 *   <li>apply the optimizer step, emit {@link RoundMetrics}, and release Phase B</li>
 * </ol>
 * Gradients containing NaN or Inf are excluded from the sum and logged; they never fail the round.
 *
 * <p>All accumulator writes happen inside the {@link ReductionWindow} issued at Phase A.
 */
public final class RoundCoordinator {

    private static final Logger LOG = Logger.getLogger(RoundCoordinator.class.getName());

    private final WorkerContext[] contexts;
    private final GradientAccumulator accumulator;
    private final RoundBarrier barrier;
    private final GradientClipper clipper;
    private final OptimizerStep optimizerStep;
    private final MetricsSink sink;
    private final AtomicBoolean stopRequested;
    private final int batchSize;
    private final int sequenceLength;
    private final int roundCountMargin;
    private final float learningRate;
    private final boolean validateBatches;

    private volatile RoundState state = RoundState.EPOCH_DONE;
    private volatile float reducedGradientNorm = Float.NaN;

    public RoundCoordinator(WorkerContext[] contexts, GradientAccumulator accumulator, RoundBarrier barrier,
                            GradientClipper clipper, OptimizerStep optimizerStep, MetricsSink sink,
                            AtomicBoolean stopRequested, int batchSize, int sequenceLength,
                            int roundCountMargin, float learningRate, boolean validateBatches) {
        if (contexts.length != barrier.getWorkerCount())
            throw new IllegalArgumentException(String.format(
                "Barrier sized for %d workers but %d contexts given", barrier.getWorkerCount(), contexts.length));
        this.contexts = contexts;
        this.accumulator = accumulator;
        this.barrier = barrier;
        this.clipper = clipper;
        this.optimizerStep = optimizerStep;
        this.sink = sink;
        this.stopRequested = stopRequested;
        this.batchSize = batchSize;
        this.sequenceLength = sequenceLength;
        this.roundCountMargin = roundCountMargin;
        this.learningRate = learningRate;
        this.validateBatches = validateBatches;
    }

    /**
     * Run rounds until the source is exhausted or a stop is requested.
     *
     * @throws NoDataException if the source yielded nothing and no stop was requested
     * @throws ProtocolViolationException on a malformed batch or when the round ceiling is exceeded;
     *         the workers are left parked at dispatch
     * @throws BrokenRoundException if the barrier broke; the workers are gone
     */
    public EpochResult runEpoch(BatchSource source, int epoch) {
        long epochStart = System.nanoTime();
        int workerCount = contexts.length;
        long expectedBatches = source.expectedBatchCount(batchSize, sequenceLength);
        long expectedRounds = (expectedBatches + workerCount - 1) / workerCount;
        long roundCeiling = expectedRounds + roundCountMargin;

        LOG.fine(() -> String.format("Epoch %d: expecting %d batches in %d rounds (ceiling %d)",
            epoch, expectedBatches, expectedRounds, roundCeiling));

        source.reset();
        sink.onEpochStart(epoch);

        Batch[] fetched = new Batch[workerCount];
        int rounds = 0;
        long batches = 0;
        long rejected = 0;
        double lossSum = 0;
        int lossRounds = 0;
        boolean aborted = false;

        while (true) {
            state = RoundState.FETCHING;
            if (stopRequested.get()) {
                aborted = true;
                LOG.info(String.format("Epoch %d stopped on request after %d rounds", epoch, rounds));
                break;
            }

            int count = fetch(source, fetched, rounds);
            if (count == 0)
                break;

            if (rounds >= roundCeiling) {
                releaseFetched(fetched, count);
                state = RoundState.EPOCH_DONE;
                throw new ProtocolViolationException(rounds, String.format(
                    "source still yielding batches after %d rounds; expected %d batches in %d rounds " +
                    "plus a margin of %d", rounds, expectedBatches, expectedRounds, roundCountMargin));
            }

            RoundMetrics metrics = executeRound(epoch, rounds, fetched, count);
            rounds++;
            batches += count;
            rejected += metrics.getRejectedCount();
            if (Float.isFinite(metrics.getRoundLoss())) {
                lossSum += metrics.getRoundLoss();
                lossRounds++;
            }
        }
        state = RoundState.EPOCH_DONE;

        if (rounds == 0 && !aborted)
            throw new NoDataException("Batch source yielded no batches for epoch " + epoch);

        float averageLoss = lossRounds > 0 ? (float) (lossSum / lossRounds) : Float.NaN;
        EpochResult result = new EpochResult(epoch, averageLoss, rounds, batches, rejected, aborted,
                                             Duration.ofNanos(System.nanoTime() - epochStart));
        sink.onEpochEnd(epoch, result);
        return result;
    }

    private int fetch(BatchSource source, Batch[] fetched, int round) {
        int count = 0;
        try {
            while (count < fetched.length) {
                Batch batch = source.next();
                if (batch == null)
                    break;
                fetched[count++] = batch;
                checkBatch(batch, round);
            }
        } catch (RuntimeException e) {
            releaseFetched(fetched, count);
            throw e;
        }
        return count;
    }

    private void checkBatch(Batch batch, int round) {
        if (batch.getSequenceLength() != sequenceLength || batch.getSequenceCount() > batchSize)
            throw new ProtocolViolationException(round, String.format(
                "batch shape %dx%d exceeds the pool's %dx%d",
                batch.getSequenceCount(), batch.getSequenceLength(), batchSize, sequenceLength));
        if (validateBatches) {
            String defect = BatchValidator.findDefect(batch);
            if (defect != null)
                throw new ProtocolViolationException(round, "malformed batch: " + defect);
        }
    }

    private RoundMetrics executeRound(int epoch, int round, Batch[] fetched, int count) {
        long roundStart = System.nanoTime();

        for (int i = 0; i < contexts.length; i++) {
            contexts[i].assign(i < count ? fetched[i] : null);
            if (i < count)
                fetched[i] = null;
        }

        state = RoundState.DISPATCHED;
        barrier.awaitDispatch();

        state = RoundState.AWAITING_PHASE_A;
        ReductionWindow window = barrier.awaitPhaseA();

        state = RoundState.REDUCING;
        try {
            return reduce(window, epoch, round, roundStart);
        } finally {
            state = RoundState.AWAITING_PHASE_B;
            barrier.releasePhaseB(window);
            releaseLeftovers();
        }
    }

    private RoundMetrics reduce(ReductionWindow window, int epoch, int round, long roundStart) {
        int workerCount = contexts.length;
        float[] losses = new float[workerCount];
        boolean[] dispatched = new boolean[workerCount];
        boolean[] valid = new boolean[workerCount];
        float[] scales = new float[workerCount];
        Arrays.fill(losses, Float.NaN);
        Arrays.fill(scales, 1.0f);

        accumulator.zero(window);
        int validCount = 0;
        double lossSum = 0;
        int finiteLosses = 0;

        for (int i = 0; i < workerCount; i++) {
            WorkerContext context = contexts[i];
            if (!context.isDispatched())
                continue;

            dispatched[i] = true;
            losses[i] = context.getLoss();
            if (Float.isFinite(losses[i])) {
                lossSum += losses[i];
                finiteLosses++;
            }

            float[] gradient = context.getGradient();
            if (!GradientValidator.isValid(gradient)) {
                ValidationReport report = GradientValidator.inspect(gradient);
                LOG.warning(String.format(
                    "Excluding gradient of worker %d in round %d.%d: %d NaN, %d Inf, first at %s",
                    i, epoch, round, report.getNanCount(), report.getInfCount(),
                    Arrays.toString(report.getOffendingIndices())));
                context.markReduced(false, 1.0f);
                context.recordRound(false);
                continue;
            }

            scales[i] = clipper.clipInPlace(gradient);
            accumulator.add(window, gradient);
            valid[i] = true;
            validCount++;
            context.markReduced(true, scales[i]);
            context.recordRound(true);
        }

        accumulator.scale(window, 1.0f / Math.max(validCount, 1));
        float norm = accumulator.norm(window);
        reducedGradientNorm = norm;

        if (validCount > 0) {
            optimizerStep.apply(accumulator.reduced(window), learningRate);
        } else {
            LOG.warning(String.format("Round %d.%d: no valid gradient, optimizer step skipped", epoch, round));
        }

        float roundLoss = finiteLosses > 0 ? (float) (lossSum / finiteLosses) : Float.NaN;
        RoundMetrics metrics = new RoundMetrics(epoch, round, losses, dispatched, valid, scales,
            roundLoss, norm, Duration.ofNanos(System.nanoTime() - roundStart));
        if (LOG.isLoggable(Level.FINE))
            LOG.fine(metrics.toString());
        sink.onRound(metrics);
        return metrics;
    }

    /**
     * Release batches still referenced by a context. Workers normally release their own,
     * so anything found here is left over from a failed compute path. Must only run while
     * the workers are parked or gone.
     *
     * @return number of batches released
     */
    public int releaseLeftovers() {
        int released = 0;
        for (WorkerContext context : contexts) {
            if (context.releaseLeftover())
                released++;
        }
        if (released > 0)
            LOG.fine("Released " + released + " leftover batches");
        return released;
    }

    private static void releaseFetched(Batch[] fetched, int count) {
        for (int i = 0; i < count; i++) {
            if (fetched[i] != null && !fetched[i].isReleased())
                fetched[i].release();
            fetched[i] = null;
        }
    }

    public RoundState getState() {
        return state;
    }

    /**
     * L2 norm of the last reduced gradient, NaN before the first round.
     */
    public float getReducedGradientNorm() {
        return reducedGradientNorm;
    }
}
