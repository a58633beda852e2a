package dev.neuronic.batchpool.engine;

/**
 * Coordinator position within a round.
 */
public enum RoundState {
    FETCHING,
    DISPATCHED,
    AWAITING_PHASE_A,
    REDUCING,
    AWAITING_PHASE_B,
    EPOCH_DONE
}
