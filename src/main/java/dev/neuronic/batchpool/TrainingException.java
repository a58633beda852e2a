package dev.neuronic.batchpool;

/**
 * Base class for every failure raised by the worker pool.
 *
 * <p>Numeric corruption inside a single worker is deliberately not in this
 * hierarchy: it is recovered by excluding the worker from the round and is only
 * visible through logs and {@link dev.neuronic.batchpool.training.RoundMetrics}.
 */
public class TrainingException extends RuntimeException {

    public TrainingException(String message) {
        super(message);
    }

    public TrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
