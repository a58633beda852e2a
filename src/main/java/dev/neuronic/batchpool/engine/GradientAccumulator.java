package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.math.GradientMath;

import java.util.Arrays;

/**
 * The shared reduction target. Exactly one thread, the holder of the round's open
 * {@link ReductionWindow}, may mutate it; every mutator checks the window and throws
 * {@link IllegalStateException} otherwise.
 */
public final class GradientAccumulator {

    private final float[] buffer;

    public GradientAccumulator(int size) {
        if (size < 1)
            throw new IllegalArgumentException("Accumulator size must be positive: " + size);
        this.buffer = new float[size];
    }

    public void zero(ReductionWindow window) {
        requireWindow(window);
        Arrays.fill(buffer, 0.0f);
    }

    /**
     * Add a worker's gradient element-wise.
     */
    public void add(ReductionWindow window, float[] contribution) {
        requireWindow(window);
        GradientMath.accumulate(buffer, contribution);
    }

    public void scale(ReductionWindow window, float factor) {
        requireWindow(window);
        GradientMath.scaleInPlace(buffer, factor);
    }

    /**
     * Direct access to the reduced gradient for the optimizer step. The array must not be
     * retained past the window.
     */
    public float[] reduced(ReductionWindow window) {
        requireWindow(window);
        return buffer;
    }

    /**
     * L2 norm of the current contents.
     */
    public float norm(ReductionWindow window) {
        requireWindow(window);
        return GradientMath.normL2(buffer);
    }

    /**
     * Copy of the current contents. Safe from any thread once the round that wrote
     * them has passed Phase B.
     */
    public float[] snapshot() {
        return buffer.clone();
    }

    public int size() {
        return buffer.length;
    }

    private static void requireWindow(ReductionWindow window) {
        if (window == null)
            throw new IllegalStateException("Accumulator mutated without a reduction window");
        if (!window.isOpen())
            throw new IllegalStateException("Accumulator mutated through a closed window: " + window);
        if (!window.isHeldByCurrentThread())
            throw new IllegalStateException("Accumulator mutated by " + Thread.currentThread().getName() +
                                            ", which does not own " + window);
    }
}
