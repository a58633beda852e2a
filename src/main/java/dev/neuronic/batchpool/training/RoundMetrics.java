package dev.neuronic.batchpool.training;

import java.time.Duration;

/**
 * Everything observed during one round, emitted by the coordinator before Phase B.
 * Per-worker arrays are indexed by worker; idle workers report NaN loss and are neither
 * dispatched nor valid.
 */
public final class RoundMetrics {

    private final int epoch;
    private final int round;
    private final float[] workerLosses;
    private final boolean[] dispatched;
    private final boolean[] valid;
    private final int validCount;
    private final float[] clipScales;
    private final float roundLoss;
    private final float reducedGradientNorm;
    private final Duration duration;

    public RoundMetrics(int epoch, int round, float[] workerLosses, boolean[] dispatched, boolean[] valid,
                        float[] clipScales, float roundLoss, float reducedGradientNorm, Duration duration) {
        this.epoch = epoch;
        this.round = round;
        this.workerLosses = workerLosses.clone();
        this.dispatched = dispatched.clone();
        this.valid = valid.clone();
        this.clipScales = clipScales.clone();
        this.roundLoss = roundLoss;
        this.reducedGradientNorm = reducedGradientNorm;
        this.duration = duration;

        int count = 0;
        for (boolean v : valid)
            if (v) count++;
        this.validCount = count;
    }

    public int getEpoch() { return epoch; }
    public int getRound() { return round; }
    public int getWorkerCount() { return workerLosses.length; }

    public float getWorkerLoss(int worker) { return workerLosses[worker]; }
    public boolean isDispatched(int worker) { return dispatched[worker]; }
    public boolean isValid(int worker) { return valid[worker]; }
    public float getClipScale(int worker) { return clipScales[worker]; }

    public float[] getWorkerLosses() { return workerLosses.clone(); }
    public float[] getClipScales() { return clipScales.clone(); }

    public int getDispatchedCount() {
        int count = 0;
        for (boolean d : dispatched)
            if (d) count++;
        return count;
    }

    public int getValidCount() { return validCount; }

    /** Dispatched contributions excluded for non-finite gradients. */
    public int getRejectedCount() { return getDispatchedCount() - validCount; }

    /** Number of valid contributions that were scaled down by clipping. */
    public int getClippedCount() {
        int count = 0;
        for (int i = 0; i < clipScales.length; i++)
            if (valid[i] && clipScales[i] < 1.0f) count++;
        return count;
    }

    /** Mean of the finite losses of dispatched workers, NaN if none. */
    public float getRoundLoss() { return roundLoss; }

    public float getReducedGradientNorm() { return reducedGradientNorm; }
    public Duration getDuration() { return duration; }

    @Override
    public String toString() {
        return String.format("Round %d.%d: loss=%.4f, valid=%d/%d, clipped=%d, norm=%.4f, time=%dms",
            epoch, round, roundLoss, validCount, getDispatchedCount(), getClippedCount(),
            reducedGradientNorm, duration.toMillis());
    }
}
