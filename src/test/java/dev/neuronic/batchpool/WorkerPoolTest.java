package dev.neuronic.batchpool;

import dev.neuronic.batchpool.data.Batch;
import dev.neuronic.batchpool.data.TokenStreamBatchSource;
import dev.neuronic.batchpool.engine.RoundState;
import dev.neuronic.batchpool.training.MetricsSink;
import dev.neuronic.batchpool.training.RoundMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static dev.neuronic.batchpool.MarkerComputeStep.*;
import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 30, unit = TimeUnit.SECONDS)
public class WorkerPoolTest {

    private static final float DELTA = 1e-5f;
    private static final int GRADIENT_SIZE = 4;
    private static final int BATCH_SIZE = 2;
    private static final int SEQUENCE_LENGTH = 3;

    private static TrainingSystemConfig.Builder config(int workers) {
        return TrainingSystemConfig.newBuilder()
            .workerCount(workers)
            .gradientBufferSize(GRADIENT_SIZE)
            .batchSize(BATCH_SIZE)
            .sequenceLength(SEQUENCE_LENGTH)
            .clipNorm(1e6f)
            .roundCountMargin(2)
            .learningRate(0.1f);
    }

    private static MarkerBatchSource source(int... markers) {
        return new MarkerBatchSource(markers, BATCH_SIZE, SEQUENCE_LENGTH);
    }

    private static float[] filled(float value) {
        float[] array = new float[GRADIENT_SIZE];
        Arrays.fill(array, value);
        return array;
    }

    /** Collects created threads and their uncaught failures. */
    private static class RecordingThreadFactory implements ThreadFactory {
        final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());
        final List<Throwable> uncaught = Collections.synchronizedList(new ArrayList<>());
        private final int failOnCall;

        RecordingThreadFactory() {
            this(-1);
        }

        RecordingThreadFactory(int failOnCall) {
            this.failOnCall = failOnCall;
        }

        @Override
        public Thread newThread(Runnable r) {
            if (threads.size() + 1 == failOnCall)
                throw new IllegalStateException("thread limit reached");
            Thread thread = new Thread(r);
            thread.setUncaughtExceptionHandler((t, e) -> uncaught.add(e));
            threads.add(thread);
            return thread;
        }
    }

    // ========== ROUND SCHEDULING ==========

    @Test
    public void testRoundCountIsBatchesOverWorkersRoundedUp() {
        int batchCount = 5;
        for (int workers = 1; workers <= 2 * batchCount; workers++) {
            MarkerBatchSource source = source(MarkerBatchSource.repeat(1, batchCount));
            MarkerComputeStep step = new MarkerComputeStep();
            RecordingOptimizer optimizer = new RecordingOptimizer(step);
            List<RoundMetrics> rounds = new ArrayList<>();

            try (WorkerPool pool = WorkerPool.create(config(workers).build(), source, step, optimizer,
                                                     rounds::add, null)) {
                EpochResult result = pool.runEpoch(source);

                int expectedRounds = (batchCount + workers - 1) / workers;
                assertEquals(expectedRounds, result.getRoundsExecuted(), "workers=" + workers);
                assertEquals(batchCount, result.getBatchesProcessed());
                assertEquals(expectedRounds, optimizer.calls());
                assertEquals(batchCount, step.calls.get());
                assertFalse(result.isAborted());

                RoundMetrics last = rounds.get(rounds.size() - 1);
                assertEquals(batchCount - workers * (expectedRounds - 1), last.getDispatchedCount());
                assertEquals(RoundState.EPOCH_DONE, pool.getRoundState());
            }
            assertEquals(0, source.outstandingBatches());
        }
    }

    @Test
    public void testIdleWorkersDoNotComputeOrContribute() {
        MarkerBatchSource source = source(3, 5);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(4).build(), source, step, optimizer)) {
            pool.runEpoch(source);

            assertArrayEquals(filled(4.0f), optimizer.last(), DELTA);
            assertEquals(1, pool.getWorkerStats(0).getBatchesProcessed());
            assertEquals(1, pool.getWorkerStats(1).getBatchesProcessed());
            assertEquals(0, pool.getWorkerStats(2).getBatchesProcessed());
            assertEquals(0, pool.getWorkerStats(3).getBatchesProcessed());
        }
    }

    // ========== REDUCTION ==========

    @Test
    public void testReducedGradientIsMeanOfContributions() {
        MarkerBatchSource source = source(2, 4, 9);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(3).build(), source, step, optimizer)) {
            EpochResult result = pool.runEpoch(source);

            assertArrayEquals(filled(5.0f), optimizer.last(), DELTA);
            assertArrayEquals(filled(5.0f), pool.getReducedGradient(), DELTA);
            assertEquals(10.0f, pool.getReducedGradientNorm(), DELTA);
            assertEquals(5.0f, result.getAverageLoss(), DELTA);
            assertEquals(0, result.getRejectedContributions());
        }
    }

    @Test
    public void testNonFiniteGradientsAreExcludedFromMean() {
        MarkerBatchSource source = source(2, NAN_MARKER, 6, INF_MARKER);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);
        List<RoundMetrics> rounds = new ArrayList<>();

        try (WorkerPool pool = WorkerPool.create(config(4).build(), source, step, optimizer, rounds::add, null)) {
            EpochResult result = pool.runEpoch(source);

            // (2 + 6) / 2, not (2 + 6) / 4
            assertArrayEquals(filled(4.0f), optimizer.last(), DELTA);
            assertEquals(2, result.getRejectedContributions());

            RoundMetrics round = rounds.get(0);
            assertEquals(4, round.getDispatchedCount());
            assertEquals(2, round.getValidCount());
            assertEquals(2, round.getRejectedCount());
            assertTrue(round.isValid(0));
            assertFalse(round.isValid(1));
            assertFalse(round.isValid(3));

            assertEquals(0, pool.getWorkerStats(0).getRejectedRounds());
            assertEquals(1, pool.getWorkerStats(1).getRejectedRounds());
            assertEquals(1, pool.getWorkerStats(3).getRejectedRounds());
        }
        assertEquals(0, source.outstandingBatches());
    }

    @Test
    public void testRoundWithoutValidGradientSkipsOptimizer() {
        MarkerBatchSource source = source(NAN_MARKER, INF_MARKER);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(2).build(), source, step, optimizer)) {
            EpochResult result = pool.runEpoch(source);

            assertEquals(1, result.getRoundsExecuted());
            assertEquals(2, result.getRejectedContributions());
            assertEquals(0, optimizer.calls());
            assertEquals(0.0f, pool.getReducedGradientNorm(), DELTA);
        }
    }

    @Test
    public void testFailedComputeIsExcludedAndPoolContinues() {
        MarkerBatchSource source = source(THROW_MARKER, 3, 5);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(2).build(), source, step, optimizer)) {
            EpochResult first = pool.runEpoch(source);

            assertEquals(2, first.getRoundsExecuted());
            assertEquals(1, first.getRejectedContributions());
            assertArrayEquals(filled(3.0f), optimizer.steps.get(0), DELTA);
            assertArrayEquals(filled(5.0f), optimizer.steps.get(1), DELTA);
            assertEquals(1, pool.getWorkerStats(0).getRejectedRounds());
            assertEquals(5.0f, pool.getWorkerStats(0).getLastLoss(), DELTA);
            assertEquals(0, source.outstandingBatches());

            EpochResult second = pool.runEpoch(source);
            assertEquals(2, second.getRoundsExecuted());
            assertFalse(pool.isClosed());
        }
    }

    @Test
    public void testEachContributionIsClippedBeforeAveraging() {
        // 10s over 4 elements have norm 20 and are scaled to norm 4, i.e. 2s; 1s have norm 2
        MarkerBatchSource source = source(10, 1);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);
        List<RoundMetrics> rounds = new ArrayList<>();

        try (WorkerPool pool = WorkerPool.create(config(2).clipNorm(4.0f).build(), source, step, optimizer,
                                                 rounds::add, null)) {
            pool.runEpoch(source);

            assertArrayEquals(filled(1.5f), optimizer.last(), DELTA);
            RoundMetrics round = rounds.get(0);
            assertEquals(0.2f, round.getClipScale(0), DELTA);
            assertEquals(1.0f, round.getClipScale(1));
            assertEquals(1, round.getClippedCount());
        }
    }

    // ========== STARTUP ==========

    @Test
    public void testDatasetTooSmallFailsBeforeAnyThreadStarts() {
        RecordingThreadFactory factory = new RecordingThreadFactory();
        MarkerBatchSource source = new MarkerBatchSource(new int[]{1}, 32, 128, 100);
        TrainingSystemConfig config = config(4).batchSize(32).sequenceLength(128).build();
        MarkerComputeStep step = new MarkerComputeStep();

        DatasetTooSmallException e = assertThrows(DatasetTooSmallException.class,
            () -> WorkerPool.create(config, source, step, new RecordingOptimizer(step), MetricsSink.NONE, factory));

        assertEquals(100, e.getDeclaredTokens());
        assertEquals(0, factory.threads.size());
    }

    @Test
    public void testBatchSizeShrinksToFitDataset() {
        int[] tokens = new int[1598];
        for (int i = 0; i < tokens.length; i++)
            tokens[i] = 1 + i % 50;
        TokenStreamBatchSource source = new TokenStreamBatchSource(tokens, 32, 128);
        TrainingSystemConfig config = config(4).batchSize(32).sequenceLength(128).build();
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config, source, step, new RecordingOptimizer(step))) {
            assertEquals(12, pool.getEffectiveBatchSize());
            assertEquals(12, source.getBatchSize());

            EpochResult result = pool.runEpoch(source);

            // 1597 usable tokens in batches of 12 x 128 = 1536
            assertEquals(2, result.getBatchesProcessed());
            assertEquals(1, result.getRoundsExecuted());
        }
        assertEquals(0, source.outstandingBatches());
    }

    @Test
    public void testDropLastStreamOfExactlyOneBatchShrinksToFit() {
        // 6 tokens give 5 input/target pairs, one short of a 2 x 3 batch
        TokenStreamBatchSource source = new TokenStreamBatchSource(new int[]{1, 2, 3, 4, 5, 6}, 2, 3, true);
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config(1).build(), source, step, new RecordingOptimizer(step))) {
            assertEquals(1, pool.getEffectiveBatchSize());

            EpochResult result = pool.runEpoch(source);

            assertEquals(1, result.getBatchesProcessed());
            assertEquals(1, result.getRoundsExecuted());
        }
        assertEquals(0, source.outstandingBatches());

        TokenStreamBatchSource single = new TokenStreamBatchSource(new int[]{1, 2, 3}, 1, 3, true);
        assertThrows(DatasetTooSmallException.class,
            () -> WorkerPool.create(config(1).batchSize(1).build(), single, step, new RecordingOptimizer(step)));
    }

    @Test
    public void testThreadStartFailureStopsStartedWorkers() {
        RecordingThreadFactory factory = new RecordingThreadFactory(3);
        MarkerComputeStep step = new MarkerComputeStep();

        ResourceException e = assertThrows(ResourceException.class,
            () -> WorkerPool.create(config(4).build(), source(1), step, new RecordingOptimizer(step),
                                    MetricsSink.NONE, factory));

        assertTrue(e.getMessage().contains("Failed to start worker 2 of 4"));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(2, factory.threads.size());
        for (Thread thread : factory.threads)
            assertFalse(thread.isAlive(), thread.getName() + " still running");
        assertTrue(factory.uncaught.isEmpty());
    }

    @Test
    public void testWorkerThreadsAreNamedDaemons() {
        RecordingThreadFactory factory = new RecordingThreadFactory();
        MarkerComputeStep step = new MarkerComputeStep();
        WorkerPool pool = WorkerPool.create(config(3).build(), source(1), step, new RecordingOptimizer(step),
                                            MetricsSink.NONE, factory);

        assertEquals(3, pool.getLiveWorkerCount());
        for (int i = 0; i < 3; i++) {
            Thread thread = factory.threads.get(i);
            assertEquals(WorkerPool.THREAD_NAME_PREFIX + i, thread.getName());
            assertTrue(thread.isDaemon());
        }

        pool.close();
        assertEquals(0, pool.getLiveWorkerCount());
    }

    // ========== PROTOCOL VIOLATIONS ==========

    @Test
    public void testSourceYieldingPastRoundCeilingFailsEpoch() {
        // declares one batch: expected 1 round, margin 2, ceiling 3
        MarkerBatchSource liar = new MarkerBatchSource(MarkerBatchSource.repeat(1, 20), BATCH_SIZE, SEQUENCE_LENGTH,
                                                       BATCH_SIZE * SEQUENCE_LENGTH + 1);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(2).build(), liar, step, optimizer)) {
            ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> pool.runEpoch(liar));

            assertEquals(3, e.getRound());
            assertEquals(3, optimizer.calls());
            assertEquals(0, liar.outstandingBatches());
            assertFalse(pool.isClosed());

            MarkerBatchSource honest = source(1, 2);
            EpochResult result = pool.runEpoch(honest);
            assertEquals(1, result.getRoundsExecuted());
            assertEquals(2, pool.getLiveWorkerCount());
        }
    }

    @Test
    public void testMalformedBatchFailsEpochBeforeDispatch() {
        MarkerBatchSource source = new MarkerBatchSource(new int[]{1, 7, 3}, BATCH_SIZE, SEQUENCE_LENGTH) {
            @Override
            Batch createBatch(int marker, int batchSize, int sequenceLength) {
                if (marker != 7)
                    return super.createBatch(marker, batchSize, sequenceLength);
                int size = batchSize * sequenceLength;
                int[] ids = new int[size];
                Arrays.fill(ids, marker);
                float[] mask = new float[size];
                Arrays.fill(mask, 1.0f);
                return tracked(batchSize, sequenceLength, ids, ids.clone(), mask, size - 1);
            }
        };
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(2).build(), source, step, optimizer)) {
            ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> pool.runEpoch(source));

            assertEquals(0, e.getRound());
            assertTrue(e.getMessage().contains("malformed batch"));
            assertEquals(0, step.calls.get());
            assertEquals(0, optimizer.calls());
            assertEquals(0, source.outstandingBatches());

            assertEquals(1, pool.runEpoch(source(4)).getRoundsExecuted());
        }
    }

    @Test
    public void testBatchShapeIsCheckedWithoutValidation() {
        MarkerBatchSource source = new MarkerBatchSource(new int[]{1}, BATCH_SIZE, SEQUENCE_LENGTH) {
            @Override
            Batch createBatch(int marker, int batchSize, int sequenceLength) {
                return super.createBatch(marker, batchSize, sequenceLength + 1);
            }
        };
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config(2).validateBatches(false).build(), source, step,
                                                 new RecordingOptimizer(step))) {
            ProtocolViolationException e = assertThrows(ProtocolViolationException.class,
                () -> pool.runEpoch(source));
            assertTrue(e.getMessage().contains("2x4"));
            assertEquals(0, source.outstandingBatches());
        }
    }

    @Test
    public void testExhaustedSourceRaisesNoData() {
        MarkerBatchSource empty = new MarkerBatchSource(new int[0], BATCH_SIZE, SEQUENCE_LENGTH, 100);
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config(2).build(), empty, step, new RecordingOptimizer(step))) {
            assertThrows(NoDataException.class, () -> pool.runEpoch(empty));
            assertFalse(pool.isClosed());
            assertEquals(1, pool.runEpoch(source(1)).getRoundsExecuted());
        }
    }

    // ========== STOP, FAILURE AND LIFECYCLE ==========

    @Test
    public void testRequestStopEndsEpochAfterCurrentRound() {
        AtomicReference<WorkerPool> poolRef = new AtomicReference<>();
        MetricsSink stopper = metrics -> {
            if (metrics.getEpoch() == 0 && metrics.getRound() == 1)
                poolRef.get().requestStop();
        };
        MarkerBatchSource source = source(MarkerBatchSource.repeat(2, 10));
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config(2).build(), source, step, new RecordingOptimizer(step),
                                                 stopper, null)) {
            poolRef.set(pool);

            EpochResult stopped = pool.runEpoch(source);
            assertTrue(stopped.isAborted());
            assertEquals(2, stopped.getRoundsExecuted());
            assertEquals(4, stopped.getBatchesProcessed());
            assertEquals(0, source.outstandingBatches());

            EpochResult full = pool.runEpoch(source);
            assertFalse(full.isAborted());
            assertEquals(5, full.getRoundsExecuted());
            assertEquals(1, full.getEpoch());
        }
    }

    @Test
    public void testFailingSinkFailsEpochButKeepsPoolUsable() {
        AtomicInteger failures = new AtomicInteger();
        MetricsSink flaky = metrics -> {
            if (failures.getAndIncrement() == 0)
                throw new IllegalStateException("sink unavailable");
        };
        MarkerBatchSource source = source(1, 2, 3, 4);
        MarkerComputeStep step = new MarkerComputeStep();

        try (WorkerPool pool = WorkerPool.create(config(2).build(), source, step, new RecordingOptimizer(step),
                                                 flaky, null)) {
            assertThrows(IllegalStateException.class, () -> pool.runEpoch(source));
            assertEquals(0, source.outstandingBatches());

            EpochResult result = pool.runEpoch(source);
            assertEquals(2, result.getRoundsExecuted());
            assertEquals(2, pool.getLiveWorkerCount());
        }
    }

    @Test
    public void testWorkerErrorTearsDownPool() {
        RecordingThreadFactory factory = new RecordingThreadFactory();
        MarkerBatchSource source = source(1, ERROR_MARKER, 3);
        MarkerComputeStep step = new MarkerComputeStep();
        RecordingOptimizer optimizer = new RecordingOptimizer(step);
        WorkerPool pool = WorkerPool.create(config(3).build(), source, step, optimizer, MetricsSink.NONE, factory);

        assertThrows(TrainingException.class, () -> pool.runEpoch(source));

        assertTrue(pool.isClosed());
        assertEquals(0, pool.getLiveWorkerCount());
        assertEquals(0, optimizer.calls());
        assertEquals(0, source.outstandingBatches());
        assertEquals(1, factory.uncaught.size());
        assertInstanceOf(AssertionError.class, factory.uncaught.get(0));

        pool.close();
        assertThrows(IllegalStateException.class, () -> pool.runEpoch(source));
    }

    @Test
    public void testOptimizerNeverOverlapsCompute() {
        MarkerBatchSource source = source(MarkerBatchSource.repeat(1, 40));
        MarkerComputeStep step = new MarkerComputeStep(1);
        RecordingOptimizer optimizer = new RecordingOptimizer(step);

        try (WorkerPool pool = WorkerPool.create(config(4).build(), source, step, optimizer)) {
            pool.runEpoch(source);
            pool.runEpoch(source);
        }

        assertEquals(20, optimizer.calls());
        assertFalse(optimizer.overlappedCompute.get());
        assertFalse(step.sawOptimizerRunning.get());
        assertTrue(step.maxActive.get() <= 4);
    }

    @Test
    public void testRepeatedLifecycleLeavesNothingBehind() {
        for (int cycle = 0; cycle < 5; cycle++) {
            RecordingThreadFactory factory = new RecordingThreadFactory();
            MarkerBatchSource source = source(1, 2, 3, 4, 5, 6, 7);
            MarkerComputeStep step = new MarkerComputeStep();
            WorkerPool pool = WorkerPool.create(config(3).build(), source, step, new RecordingOptimizer(step),
                                                MetricsSink.NONE, factory);

            pool.runEpoch(source);
            pool.runEpoch(source);
            pool.close();

            assertTrue(pool.isClosed());
            assertEquals(0, source.outstandingBatches());
            for (Thread thread : factory.threads)
                assertFalse(thread.isAlive());
            // 7 batches over 3 workers: worker 0 takes one in each of 3 rounds, twice
            assertEquals(6, pool.getWorkerStats(0).getBatchesProcessed());
        }
    }

    @Test
    public void testCloseIsIdempotentAndFinal() {
        MarkerBatchSource source = source(1);
        MarkerComputeStep step = new MarkerComputeStep();
        WorkerPool pool = WorkerPool.create(config(2).build(), source, step, new RecordingOptimizer(step));

        pool.close();
        pool.close();

        assertTrue(pool.isClosed());
        assertEquals(0, pool.getLiveWorkerCount());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> pool.runEpoch(source));
        assertEquals("Worker pool is closed", e.getMessage());
        assertEquals(0, pool.getWorkerStats(1).getBatchesProcessed());
        assertThrows(IndexOutOfBoundsException.class, () -> pool.getWorkerStats(2));
    }

    @Test
    public void testStatsSurviveCloseAfterEpoch() {
        MarkerBatchSource source = source(2, 4);
        MarkerComputeStep step = new MarkerComputeStep();
        WorkerPool pool = WorkerPool.create(config(2).build(), source, step, new RecordingOptimizer(step));
        pool.runEpoch(source);

        pool.close();

        WorkerStats first = pool.getWorkerStats(0);
        WorkerStats second = pool.getWorkerStats(1);
        assertEquals(1, first.getBatchesProcessed());
        assertEquals(1, second.getBatchesProcessed());
        assertEquals(6.0, first.getCumulativeLoss() + second.getCumulativeLoss(), DELTA);
        assertEquals(0, pool.getLiveWorkerCount());
    }
}
