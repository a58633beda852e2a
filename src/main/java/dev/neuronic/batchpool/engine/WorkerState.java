package dev.neuronic.batchpool.engine;

/**
 * Worker thread position within a round.
 */
public enum WorkerState {
    WAIT_DISPATCH,
    IDLE,
    COMPUTE,
    ARRIVE_PHASE_A,
    WAIT_PHASE_B,
    TERMINATE
}
