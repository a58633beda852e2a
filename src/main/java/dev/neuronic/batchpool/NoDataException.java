package dev.neuronic.batchpool;

/**
 * An epoch finished without a single round because the source was already exhausted.
 */
public class NoDataException extends TrainingException {

    public NoDataException(String message) {
        super(message);
    }
}
