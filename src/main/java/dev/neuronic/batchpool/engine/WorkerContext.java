package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.WorkerStats;
import dev.neuronic.batchpool.data.Batch;

/**
 * Per-worker state, allocated once at pool startup.
 *
 * <p>Ownership alternates with the round phases: between dispatch and Phase A only the worker
 * touches the gradient, scratch, batch and loss; between Phase A and Phase B only the
 * coordinator does. The barrier trips order those accesses, so no field here needs to be
 * volatile except the statistics, which may be read from any thread.
 */
public final class WorkerContext {

    private final int index;
    private float[] gradient;
    private float[] scratch;

    private Batch batch;
    private boolean dispatched;
    private float loss = Float.NaN;
    private boolean valid;
    private float clipScale = 1.0f;

    // written by the coordinator only
    private volatile long batchesProcessed;
    private volatile double cumulativeLoss;
    private volatile long rejectedRounds;
    private volatile float lastLoss = Float.NaN;

    public WorkerContext(int index, int gradientSize, int scratchSize) {
        if (gradientSize < 1)
            throw new IllegalArgumentException("Gradient size must be positive: " + gradientSize);
        if (scratchSize < 1)
            throw new IllegalArgumentException("Scratch size must be positive: " + scratchSize);
        this.index = index;
        this.gradient = new float[gradientSize];
        this.scratch = new float[scratchSize];
    }

    public int getIndex() {
        return index;
    }

    public float[] getGradient() {
        return gradient;
    }

    public float[] getScratch() {
        return scratch;
    }

    // ========== ROUND HANDOFF ==========

    /**
     * Hand this context a batch for the coming round, or null to leave it idle.
     */
    void assign(Batch batch) {
        this.batch = batch;
        this.dispatched = batch != null;
        this.loss = Float.NaN;
        this.valid = false;
        this.clipScale = 1.0f;
    }

    Batch getBatch() {
        return batch;
    }

    boolean isDispatched() {
        return dispatched;
    }

    /**
     * Release the held batch, if any, and forget it.
     */
    void releaseBatch() {
        Batch held = batch;
        batch = null;
        if (held != null)
            held.release();
    }

    /**
     * Release a batch left behind by a failed round. Batches already released by
     * their worker are only forgotten.
     *
     * @return true if a batch was released here
     */
    boolean releaseLeftover() {
        Batch held = batch;
        batch = null;
        if (held != null && !held.isReleased()) {
            held.release();
            return true;
        }
        return false;
    }

    void setLoss(float loss) {
        this.loss = loss;
    }

    public float getLoss() {
        return loss;
    }

    void markReduced(boolean valid, float clipScale) {
        this.valid = valid;
        this.clipScale = clipScale;
    }

    public boolean isValid() {
        return valid;
    }

    public float getClipScale() {
        return clipScale;
    }

    // ========== STATISTICS ==========

    void recordRound(boolean accepted) {
        batchesProcessed++;
        lastLoss = loss;
        if (Float.isFinite(loss))
            cumulativeLoss += loss;
        if (!accepted)
            rejectedRounds++;
    }

    public WorkerStats snapshot() {
        return new WorkerStats(index, batchesProcessed, cumulativeLoss, rejectedRounds, lastLoss);
    }

    /**
     * Drop the buffers at teardown. Only the pool calls this, once every worker thread
     * has exited or the pool failed to start; statistics stay readable afterwards.
     */
    public void dropBuffers() {
        gradient = null;
        scratch = null;
    }
}
