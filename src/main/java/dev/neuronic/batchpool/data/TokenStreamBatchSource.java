package dev.neuronic.batchpool.data;

import dev.neuronic.batchpool.common.PooledBatchBuffers;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Next-token batches cut from a flat token stream.
 *
 * <p>Position {@code i} of the stream yields input {@code tokens[i]} with target
 * {@code tokens[i + 1]}. Batches advance by {@code batchSize * sequenceLength} tokens.
 * The final partial batch is padded with {@link Batch#PAD_TOKEN} and masked out, unless
 * {@code dropLast} is set, in which case it is skipped.
 *
 * <p>Batch arrays come from a {@link PooledBatchBuffers} and return to it on release,
 * so steady-state epochs allocate nothing.
 */
public class TokenStreamBatchSource implements BatchSource {

    private final int[] tokens;
    private final int sequenceLength;
    private final boolean dropLast;
    private final AtomicInteger outstanding = new AtomicInteger();

    private int batchSize;
    private PooledBatchBuffers buffers;
    private long position;

    public TokenStreamBatchSource(int[] tokens, int batchSize, int sequenceLength) {
        this(tokens, batchSize, sequenceLength, false);
    }

    /**
     * @param tokens the token stream, not copied
     * @param batchSize sequences per batch
     * @param sequenceLength positions per sequence
     * @param dropLast skip the final batch when it cannot be filled completely
     */
    public TokenStreamBatchSource(int[] tokens, int batchSize, int sequenceLength, boolean dropLast) {
        if (tokens == null)
            throw new IllegalArgumentException("Token stream must not be null");
        if (batchSize < 1)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        if (sequenceLength < 1)
            throw new IllegalArgumentException("Sequence length must be positive: " + sequenceLength);
        this.tokens = tokens;
        this.batchSize = batchSize;
        this.sequenceLength = sequenceLength;
        this.dropLast = dropLast;
        this.buffers = new PooledBatchBuffers(Math.multiplyExact(batchSize, sequenceLength));
    }

    @Override
    public void reset() {
        position = 0;
    }

    @Override
    public Batch next() {
        long numTokens = tokens.length;
        if (position >= numTokens)
            return null;

        long tokensPerBatch = (long) batchSize * sequenceLength;
        long remaining = numTokens - position;
        if (dropLast && remaining < tokensPerBatch + 1)
            return null;
        // every input needs a following target token
        if (remaining <= 1)
            return null;

        PooledBatchBuffers pool = buffers;
        int[] inputIds = pool.acquireIds();
        int[] targetIds = pool.acquireIds();
        float[] mask = pool.acquireMask();
        int valid = 0;

        for (int idx = 0; idx < tokensPerBatch; idx++) {
            long tokenPos = position + idx;
            if (tokenPos < numTokens - 1) {
                inputIds[idx] = tokens[(int) tokenPos];
                targetIds[idx] = tokens[(int) tokenPos + 1];
                mask[idx] = 1.0f;
                valid++;
            } else {
                inputIds[idx] = Batch.PAD_TOKEN;
                targetIds[idx] = Batch.PAD_TOKEN;
                mask[idx] = 0.0f;
            }
        }

        position += tokensPerBatch;
        outstanding.incrementAndGet();
        return new TokenBatch(batchSize, sequenceLength, inputIds, targetIds, mask, valid, released -> {
            pool.releaseIds(released.inputStorage());
            pool.releaseIds(released.targetStorage());
            pool.releaseMask(released.maskStorage());
            outstanding.decrementAndGet();
        });
    }

    @Override
    public long declaredTokenCount() {
        return tokens.length;
    }

    /**
     * With {@code dropLast} the last token only serves as a target, so a full batch needs
     * one token more than it has positions.
     */
    @Override
    public long trainableTokenCount() {
        if (!dropLast)
            return tokens.length;
        return Math.max(0L, tokens.length - 1L);
    }

    /**
     * Change the number of sequences per batch. Batches already handed out keep
     * returning their arrays to the pool they came from.
     */
    @Override
    public void setBatchSize(int batchSize) {
        if (batchSize < 1)
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        if (batchSize == this.batchSize)
            return;
        this.batchSize = batchSize;
        this.buffers = new PooledBatchBuffers(Math.multiplyExact(batchSize, sequenceLength));
    }

    @Override
    public long expectedBatchCount(int batchSize, int sequenceLength) {
        if (!dropLast)
            return BatchSource.super.expectedBatchCount(batchSize, sequenceLength);
        long usable = Math.max(0L, declaredTokenCount() - 1);
        return usable / ((long) batchSize * sequenceLength);
    }

    /**
     * Batches one full pass yields with the current batch size.
     */
    public long numBatches() {
        return expectedBatchCount(batchSize, sequenceLength);
    }

    public int getBatchSize() {
        return batchSize;
    }

    public int getSequenceLength() {
        return sequenceLength;
    }

    public boolean isDropLast() {
        return dropLast;
    }

    /**
     * @return batches handed out by {@link #next()} and not yet released
     */
    public int outstandingBatches() {
        return outstanding.get();
    }
}
