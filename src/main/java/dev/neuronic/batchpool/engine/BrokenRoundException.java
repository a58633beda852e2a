package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.TrainingException;

/**
 * The round barrier broke or the waiting thread was interrupted. The round protocol
 * cannot continue and the pool owning the barrier has to be torn down.
 */
public class BrokenRoundException extends TrainingException {

    public BrokenRoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
