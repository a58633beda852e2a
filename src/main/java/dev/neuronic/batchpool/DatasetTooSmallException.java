package dev.neuronic.batchpool;

/**
 * The batch source holds fewer tokens than a single sequence, so not even a
 * batch of size one can be formed.
 */
public class DatasetTooSmallException extends ConfigurationException {

    private final long declaredTokens;
    private final long minimumTokens;

    public DatasetTooSmallException(long declaredTokens, long minimumTokens, int requestedBatchSize) {
        super(String.format(
            "Dataset too small for training: %d tokens declared, at least %d tokens required " +
            "(one sequence); requested batch_size=%d cannot be reduced below 1",
            declaredTokens, minimumTokens, requestedBatchSize));
        this.declaredTokens = declaredTokens;
        this.minimumTokens = minimumTokens;
    }

    public long getDeclaredTokens() {
        return declaredTokens;
    }

    /**
     * @return the smallest token count that would have been accepted
     */
    public long getMinimumTokens() {
        return minimumTokens;
    }
}
