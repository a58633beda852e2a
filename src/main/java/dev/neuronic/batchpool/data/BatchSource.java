package dev.neuronic.batchpool.data;

/**
 * Supplier of batches for one epoch at a time.
 *
 * <p>Only the coordinating thread calls a source; implementations need not be thread-safe,
 * although {@link Batch#release()} may be invoked from worker threads.
 */
public interface BatchSource {

    /**
     * Rewind to the first batch of the data.
     */
    void reset();

    /**
     * @return the next batch, or {@code null} once the data is exhausted
     */
    Batch next();

    /**
     * Total tokens in the underlying data, used to size batches before training starts.
     */
    long declaredTokenCount();

    /**
     * Tokens that can go into complete batches. The pool sizes its batches against this
     * count; it differs from {@link #declaredTokenCount()} only for sources that skip
     * incomplete batches.
     */
    default long trainableTokenCount() {
        return declaredTokenCount();
    }

    /**
     * Apply the effective batch size chosen by the pool. Sources that cannot change
     * their batch shape may ignore it.
     */
    default void setBatchSize(int batchSize) {
    }

    /**
     * Batches one pass should yield. Each position consumes one token and needs the
     * following token as its target, so {@code declaredTokenCount() - 1} tokens are usable
     * and a short tail still forms a padded batch.
     */
    default long expectedBatchCount(int batchSize, int sequenceLength) {
        long usable = Math.max(0L, declaredTokenCount() - 1);
        long tokensPerBatch = (long) batchSize * sequenceLength;
        return (usable + tokensPerBatch - 1) / tokensPerBatch;
    }
}
