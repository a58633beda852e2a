package dev.neuronic.batchpool.data;

/**
 * Structural integrity checks for a {@link Batch} before it is dispatched.
 *
 * <p>A batch is well formed when all arrays span {@code sequenceCount * sequenceLength}
 * positions, masked-in positions never carry {@link Batch#PAD_TOKEN}, masked-out positions
 * carry nothing else, and the stored valid count equals the number of masked-in positions.
 */
public final class BatchValidator {

    private BatchValidator() {}

    /**
     * @return null when the batch is well formed, otherwise a description of the first defect
     */
    public static String findDefect(Batch batch) {
        if (batch == null)
            return "batch is null";
        if (batch.isReleased())
            return "batch was already released";

        int[] inputIds = batch.getInputIds();
        int[] targetIds = batch.getTargetIds();
        float[] mask = batch.getAttentionMask();
        if (inputIds == null || targetIds == null || mask == null)
            return "batch arrays are missing";
        if (batch.getSequenceCount() <= 0 || batch.getSequenceLength() <= 0)
            return String.format("empty batch shape %dx%d", batch.getSequenceCount(), batch.getSequenceLength());

        long expected = (long) batch.getSequenceCount() * batch.getSequenceLength();
        if (inputIds.length != expected || targetIds.length != expected || mask.length != expected)
            return String.format("array lengths (%d, %d, %d) do not match shape %dx%d",
                inputIds.length, targetIds.length, mask.length,
                batch.getSequenceCount(), batch.getSequenceLength());

        int countedValid = 0;
        for (int i = 0; i < mask.length; i++) {
            if (mask[i] > 0.5f) {
                countedValid++;
                if (inputIds[i] == Batch.PAD_TOKEN || targetIds[i] == Batch.PAD_TOKEN)
                    return "position " + i + " is masked in but holds padding";
            } else if (inputIds[i] != Batch.PAD_TOKEN || targetIds[i] != Batch.PAD_TOKEN) {
                return "position " + i + " is masked out but holds a token";
            }
        }

        if (countedValid != batch.getValidTokenCount())
            return String.format("counted %d valid tokens but batch declares %d",
                countedValid, batch.getValidTokenCount());
        return null;
    }

    public static boolean isValid(Batch batch) {
        return findDefect(batch) == null;
    }
}
