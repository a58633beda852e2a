package dev.neuronic.batchpool.engine;

/**
 * Permission to mutate the {@link GradientAccumulator}, valid from Phase A until Phase B
 * of one round and only for the thread that received it.
 */
public final class ReductionWindow {

    private final Thread owner;
    private final long round;
    private volatile boolean open = true;

    ReductionWindow(Thread owner, long round) {
        this.owner = owner;
        this.round = round;
    }

    /**
     * @return true if the window is still open and the calling thread owns it
     */
    public boolean isHeldByCurrentThread() {
        return open && Thread.currentThread() == owner;
    }

    public boolean isOpen() {
        return open;
    }

    /** Barrier generation this window was issued for. */
    public long getRound() {
        return round;
    }

    void close() {
        open = false;
    }

    @Override
    public String toString() {
        return "ReductionWindow[round=" + round + ", owner=" + owner.getName() + (open ? ", open]" : ", closed]");
    }
}
