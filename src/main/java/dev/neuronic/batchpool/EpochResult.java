package dev.neuronic.batchpool;

import java.time.Duration;

/**
 * Outcome of one {@link WorkerPool#runEpoch} call.
 */
public final class EpochResult {

    private final int epoch;
    private final float averageLoss;
    private final int roundsExecuted;
    private final long batchesProcessed;
    private final long rejectedContributions;
    private final boolean aborted;
    private final Duration duration;

    public EpochResult(int epoch, float averageLoss, int roundsExecuted, long batchesProcessed,
                       long rejectedContributions, boolean aborted, Duration duration) {
        this.epoch = epoch;
        this.averageLoss = averageLoss;
        this.roundsExecuted = roundsExecuted;
        this.batchesProcessed = batchesProcessed;
        this.rejectedContributions = rejectedContributions;
        this.aborted = aborted;
        this.duration = duration;
    }

    /** 0-based epoch number within the pool's lifetime. */
    public int getEpoch() { return epoch; }

    /** Mean of the finite round losses, NaN when no round produced one. */
    public float getAverageLoss() { return averageLoss; }

    public int getRoundsExecuted() { return roundsExecuted; }
    public long getBatchesProcessed() { return batchesProcessed; }

    /** Worker contributions excluded for non-finite gradients. */
    public long getRejectedContributions() { return rejectedContributions; }

    /** True when {@link WorkerPool#requestStop()} ended the epoch early. */
    public boolean isAborted() { return aborted; }

    public Duration getDuration() { return duration; }

    @Override
    public String toString() {
        return String.format("EpochResult[epoch=%d, loss=%.4f, rounds=%d, batches=%d, rejected=%d%s, time=%dms]",
            epoch, averageLoss, roundsExecuted, batchesProcessed, rejectedContributions,
            aborted ? ", aborted" : "", duration.toMillis());
    }
}
