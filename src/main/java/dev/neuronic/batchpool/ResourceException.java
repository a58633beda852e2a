package dev.neuronic.batchpool;

/**
 * Thread or buffer allocation failed while creating a pool. Everything that was
 * allocated before the failure has already been released when this is thrown.
 */
public class ResourceException extends TrainingException {

    public ResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
