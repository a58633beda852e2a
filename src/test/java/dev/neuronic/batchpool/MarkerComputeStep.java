package dev.neuronic.batchpool;

import dev.neuronic.batchpool.data.Batch;
import dev.neuronic.batchpool.engine.ComputeStep;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fills the gradient with the batch's marker token and reports it as the loss.
 * Reserved markers produce non-finite gradients or failures.
 */
class MarkerComputeStep implements ComputeStep {

    static final int NAN_MARKER = 1000;
    static final int INF_MARKER = 1001;
    static final int THROW_MARKER = 1002;
    static final int ERROR_MARKER = 1003;

    final AtomicInteger calls = new AtomicInteger();
    final AtomicInteger active = new AtomicInteger();
    final AtomicInteger maxActive = new AtomicInteger();
    final AtomicBoolean sawOptimizerRunning = new AtomicBoolean();
    final AtomicBoolean optimizerRunning = new AtomicBoolean();
    private final long delayMillis;

    MarkerComputeStep() {
        this(0);
    }

    MarkerComputeStep(long delayMillis) {
        this.delayMillis = delayMillis;
    }

    @Override
    public float run(Batch batch, float[] scratch, float[] outGradient) {
        calls.incrementAndGet();
        maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
        try {
            if (optimizerRunning.get())
                sawOptimizerRunning.set(true);
            if (delayMillis > 0)
                sleep();

            int marker = batch.getInputIds()[0];
            scratch[0] = marker;
            switch (marker) {
                case THROW_MARKER:
                    throw new IllegalStateException("compute failed for marker " + marker);
                case ERROR_MARKER:
                    throw new AssertionError("fatal compute failure");
                default:
                    break;
            }

            Arrays.fill(outGradient, marker);
            if (marker == NAN_MARKER)
                outGradient[0] = Float.NaN;
            if (marker == INF_MARKER)
                outGradient[outGradient.length - 1] = Float.POSITIVE_INFINITY;
            return marker;
        } finally {
            active.decrementAndGet();
        }
    }

    private void sleep() {
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
