package dev.neuronic.batchpool;

/**
 * Point-in-time snapshot of one worker's counters.
 */
public final class WorkerStats {

    private final int workerIndex;
    private final long batchesProcessed;
    private final double cumulativeLoss;
    private final long rejectedRounds;
    private final float lastLoss;

    public WorkerStats(int workerIndex, long batchesProcessed, double cumulativeLoss,
                       long rejectedRounds, float lastLoss) {
        this.workerIndex = workerIndex;
        this.batchesProcessed = batchesProcessed;
        this.cumulativeLoss = cumulativeLoss;
        this.rejectedRounds = rejectedRounds;
        this.lastLoss = lastLoss;
    }

    public int getWorkerIndex() { return workerIndex; }
    public long getBatchesProcessed() { return batchesProcessed; }

    /** Sum of the finite losses this worker reported. */
    public double getCumulativeLoss() { return cumulativeLoss; }

    /** Rounds in which this worker's gradient was excluded. */
    public long getRejectedRounds() { return rejectedRounds; }

    public float getLastLoss() { return lastLoss; }

    @Override
    public String toString() {
        return String.format("WorkerStats[worker=%d, batches=%d, rejected=%d, lastLoss=%.4f]",
            workerIndex, batchesProcessed, rejectedRounds, lastLoss);
    }
}
