package dev.neuronic.batchpool;

/**
 * Shape of the worker hierarchy.
 *
 * <p>Only the flat shape runs today: one coordinator with {@code workerCount}
 * workers directly beneath it ({@code depth == 1}). The fan-out is carried so a
 * deeper tree can be configured later without changing the round protocol;
 * {@link TrainingSystemConfig} rejects any other depth.
 */
public final class ThreadTopology {

    /** Default branching factor of the hierarchy. */
    public static final int DEFAULT_FAN_OUT = 12;

    /** The only depth the round protocol executes. */
    public static final int FLAT_DEPTH = 1;

    private final int fanOut;
    private final int depth;

    public ThreadTopology(int fanOut, int depth) {
        if (fanOut < 1)
            throw new IllegalArgumentException("Fan-out must be >= 1: " + fanOut);
        if (depth < 1)
            throw new IllegalArgumentException("Depth must be >= 1: " + depth);
        this.fanOut = fanOut;
        this.depth = depth;
    }

    public static ThreadTopology flat() {
        return new ThreadTopology(DEFAULT_FAN_OUT, FLAT_DEPTH);
    }

    public int getFanOut() {
        return fanOut;
    }

    public int getDepth() {
        return depth;
    }

    public boolean isFlat() {
        return depth == FLAT_DEPTH;
    }

    /**
     * Number of levels (root included) a full tree of this fan-out needs to
     * seat {@code threads} threads. With the default fan-out of 12: one thread
     * is a bare root, up to 13 fit two levels, up to 157 fit three.
     *
     * <p>Diagnostic only: the pool always runs a single worker level.
     */
    public int levelsFor(int threads) {
        if (threads <= 1) return 1;

        int levels = 1;
        long capacity = 1;
        long levelWidth = 1;
        while (capacity < threads) {
            levelWidth *= fanOut;
            capacity += levelWidth;
            levels++;
        }
        return levels;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ThreadTopology)) return false;
        ThreadTopology other = (ThreadTopology) obj;
        return fanOut == other.fanOut && depth == other.depth;
    }

    @Override
    public int hashCode() {
        return 31 * fanOut + depth;
    }

    @Override
    public String toString() {
        return String.format("ThreadTopology[fanOut=%d, depth=%d]", fanOut, depth);
    }
}
