package dev.neuronic.batchpool;

import dev.neuronic.batchpool.data.Batch;
import dev.neuronic.batchpool.data.BatchSource;
import dev.neuronic.batchpool.data.TokenBatch;

import java.util.Arrays;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Yields one batch per marker, every position holding the marker token. Paired with
 * {@link MarkerComputeStep}, the marker becomes the value of the worker's gradient.
 */
class MarkerBatchSource implements BatchSource {

    private final int[] markers;
    private final int sequenceLength;
    private final long declaredTokens;
    private final AtomicInteger outstanding = new AtomicInteger();
    private int batchSize;
    private int next;

    MarkerBatchSource(int[] markers, int batchSize, int sequenceLength) {
        this(markers, batchSize, sequenceLength, (long) markers.length * batchSize * sequenceLength + 1);
    }

    /**
     * @param declaredTokens token count reported to the pool, which need not match the markers
     */
    MarkerBatchSource(int[] markers, int batchSize, int sequenceLength, long declaredTokens) {
        this.markers = markers;
        this.batchSize = batchSize;
        this.sequenceLength = sequenceLength;
        this.declaredTokens = declaredTokens;
    }

    static int[] repeat(int marker, int count) {
        int[] markers = new int[count];
        Arrays.fill(markers, marker);
        return markers;
    }

    @Override
    public void reset() {
        next = 0;
    }

    @Override
    public Batch next() {
        if (next >= markers.length)
            return null;
        Batch batch = createBatch(markers[next++], batchSize, sequenceLength);
        outstanding.incrementAndGet();
        return batch;
    }

    Batch createBatch(int marker, int batchSize, int sequenceLength) {
        int size = batchSize * sequenceLength;
        int[] ids = new int[size];
        Arrays.fill(ids, marker);
        float[] mask = new float[size];
        Arrays.fill(mask, 1.0f);
        return tracked(batchSize, sequenceLength, ids, ids.clone(), mask, size);
    }

    /**
     * Batch whose release is counted by {@link #outstandingBatches()}.
     */
    TokenBatch tracked(int sequenceCount, int sequenceLength, int[] inputIds, int[] targetIds,
                       float[] mask, int validTokens) {
        return new TokenBatch(sequenceCount, sequenceLength, inputIds, targetIds, mask, validTokens,
            released -> outstanding.decrementAndGet());
    }

    @Override
    public long declaredTokenCount() {
        return declaredTokens;
    }

    @Override
    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    int outstandingBatches() {
        return outstanding.get();
    }
}
