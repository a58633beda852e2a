package dev.neuronic.batchpool.data;

/**
 * One unit of work: {@code sequenceCount} sequences of {@code sequenceLength} token positions.
 *
 * <p>Arrays are laid out row-major, position {@code s} of sequence {@code b} lives at
 * {@code b * sequenceLength + s}. Contents are immutable once the batch is handed out;
 * the returned arrays are the batch's own storage and must not be written.
 *
 * <p>A batch is owned by exactly one worker per round and must be released exactly once.
 * Accessors throw {@link IllegalStateException} after {@link #release()}.
 */
public interface Batch {

    /** Token id used for padded positions. */
    int PAD_TOKEN = 0;

    int getSequenceCount();

    int getSequenceLength();

    int[] getInputIds();

    int[] getTargetIds();

    /** 1.0 for real positions, 0.0 for padding. */
    float[] getAttentionMask();

    /** Number of positions whose mask is set. */
    int getValidTokenCount();

    /**
     * Return the batch storage to its source.
     *
     * @throws IllegalStateException if the batch was already released
     */
    void release();

    boolean isReleased();
}
