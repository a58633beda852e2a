package dev.neuronic.batchpool.data;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Array-backed {@link Batch}. Release hands the batch to a callback exactly once,
 * which normally returns the arrays to a {@link dev.neuronic.batchpool.common.PooledBatchBuffers}.
 */
public final class TokenBatch implements Batch {

    private final int sequenceCount;
    private final int sequenceLength;
    private final int[] inputIds;
    private final int[] targetIds;
    private final float[] attentionMask;
    private final int validTokenCount;
    private final Consumer<TokenBatch> onRelease;
    private final AtomicBoolean released = new AtomicBoolean();

    public TokenBatch(int sequenceCount, int sequenceLength, int[] inputIds, int[] targetIds,
                      float[] attentionMask, int validTokenCount, Consumer<TokenBatch> onRelease) {
        if (sequenceCount < 1 || sequenceLength < 1)
            throw new IllegalArgumentException(String.format(
                "Batch shape must be positive: %d x %d", sequenceCount, sequenceLength));
        if (inputIds == null || targetIds == null || attentionMask == null)
            throw new IllegalArgumentException("Batch arrays must not be null");
        this.sequenceCount = sequenceCount;
        this.sequenceLength = sequenceLength;
        this.inputIds = inputIds;
        this.targetIds = targetIds;
        this.attentionMask = attentionMask;
        this.validTokenCount = validTokenCount;
        this.onRelease = onRelease;
    }

    /**
     * Unpooled batch; release only marks it released.
     */
    public TokenBatch(int sequenceCount, int sequenceLength, int[] inputIds, int[] targetIds,
                      float[] attentionMask, int validTokenCount) {
        this(sequenceCount, sequenceLength, inputIds, targetIds, attentionMask, validTokenCount, null);
    }

    @Override
    public int getSequenceCount() {
        return sequenceCount;
    }

    @Override
    public int getSequenceLength() {
        return sequenceLength;
    }

    @Override
    public int[] getInputIds() {
        ensureLive();
        return inputIds;
    }

    @Override
    public int[] getTargetIds() {
        ensureLive();
        return targetIds;
    }

    @Override
    public float[] getAttentionMask() {
        ensureLive();
        return attentionMask;
    }

    @Override
    public int getValidTokenCount() {
        return validTokenCount;
    }

    @Override
    public void release() {
        if (!released.compareAndSet(false, true))
            throw new IllegalStateException("Batch already released");
        if (onRelease != null)
            onRelease.accept(this);
    }

    @Override
    public boolean isReleased() {
        return released.get();
    }

    // Raw access for the owning source once released
    int[] inputStorage() { return inputIds; }
    int[] targetStorage() { return targetIds; }
    float[] maskStorage() { return attentionMask; }

    private void ensureLive() {
        if (released.get())
            throw new IllegalStateException("Batch accessed after release");
    }

    @Override
    public String toString() {
        return String.format("TokenBatch[%dx%d, valid=%d%s]",
            sequenceCount, sequenceLength, validTokenCount, released.get() ? ", released" : "");
    }
}
