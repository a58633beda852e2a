package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.DatasetTooSmallException;

import java.util.logging.Logger;

/**
 * Picks the batch size a dataset can actually fill before any worker is started.
 *
 * <p>If the dataset holds fewer tokens than one requested batch, the batch size shrinks to the
 * number of whole sequences available. A dataset shorter than a single sequence cannot be
 * trained on at all.
 */
public final class DatasetSizeGuard {

    private static final Logger LOG = Logger.getLogger(DatasetSizeGuard.class.getName());

    private DatasetSizeGuard() {}

    /**
     * @param totalTokens tokens declared by the data source
     * @param batchSize requested sequences per batch
     * @param sequenceLength positions per sequence
     * @return the effective batch size, between 1 and {@code batchSize}
     * @throws DatasetTooSmallException if the data cannot fill one sequence
     */
    public static int effectiveBatchSize(long totalTokens, int batchSize, int sequenceLength) {
        if (batchSize < 1 || sequenceLength < 1)
            throw new IllegalArgumentException(String.format(
                "Batch size and sequence length must be positive: %d, %d", batchSize, sequenceLength));

        long tokensPerBatch = (long) batchSize * sequenceLength;
        if (totalTokens >= tokensPerBatch)
            return batchSize;

        long maxBatchSize = Math.max(0L, totalTokens) / sequenceLength;
        if (maxBatchSize == 0)
            throw new DatasetTooSmallException(totalTokens, sequenceLength, batchSize);

        LOG.warning(String.format(
            "Dataset has %d tokens, fewer than one batch of %d x %d = %d; reducing batch_size from %d to %d",
            totalTokens, batchSize, sequenceLength, tokensPerBatch, batchSize, maxBatchSize));
        return (int) maxBatchSize;
    }
}
