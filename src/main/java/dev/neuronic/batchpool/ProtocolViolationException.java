package dev.neuronic.batchpool;

/**
 * A collaborator broke the round protocol: a malformed batch, or a source that
 * kept yielding batches past the round ceiling. Fatal to the epoch only; the
 * pool can still run another epoch or be closed.
 */
public class ProtocolViolationException extends TrainingException {

    private final int round;

    public ProtocolViolationException(int round, String message) {
        super("Round " + round + ": " + message);
        this.round = round;
    }

    /**
     * @return zero-based round index within the epoch at which the violation was detected
     */
    public int getRound() {
        return round;
    }
}
