package dev.neuronic.batchpool.common;

import java.util.Arrays;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Thread-safe pool for the token and mask arrays backing batches of one shape.
 * Each instance manages buffers for exactly one {@code sequenceCount * sequenceLength} size.
 *
 * Usage:
 * - Create one PooledBatchBuffers per batch shape
 * - Call acquireIds()/acquireMask() to obtain arrays
 * - Return them with releaseIds()/releaseMask() when the batch is released
 *
 * Buffers are released from worker threads and acquired by the coordinating thread,
 * so the backing deques are concurrent.
 */
public class PooledBatchBuffers {
    private final int bufferSize;
    private final ConcurrentLinkedDeque<int[]> idPool;
    private final ConcurrentLinkedDeque<float[]> maskPool;

    /**
     * @param bufferSize number of token positions per buffer
     */
    public PooledBatchBuffers(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
        this.idPool = new ConcurrentLinkedDeque<>();
        this.maskPool = new ConcurrentLinkedDeque<>();
    }

    /**
     * Get a zeroed token-id array, reused when one is available.
     */
    public int[] acquireIds() {
        int[] buffer = idPool.poll();
        if (buffer == null)
            return new int[bufferSize];
        Arrays.fill(buffer, 0);
        return buffer;
    }

    /**
     * Get a zeroed attention-mask array, reused when one is available.
     */
    public float[] acquireMask() {
        float[] buffer = maskPool.poll();
        if (buffer == null)
            return new float[bufferSize];
        Arrays.fill(buffer, 0.0f);
        return buffer;
    }

    /**
     * Return a token-id array. Null and wrong-size arrays are ignored.
     */
    public void releaseIds(int[] buffer) {
        if (buffer != null && buffer.length == bufferSize)
            idPool.offer(buffer);
    }

    /**
     * Return a mask array. Null and wrong-size arrays are ignored.
     */
    public void releaseMask(float[] buffer) {
        if (buffer != null && buffer.length == bufferSize)
            maskPool.offer(buffer);
    }

    public int getBufferSize() {
        return bufferSize;
    }

    /**
     * @return number of pooled id arrays (may change concurrently)
     */
    public int getIdPoolSize() {
        return idPool.size();
    }

    /**
     * @return number of pooled mask arrays (may change concurrently)
     */
    public int getMaskPoolSize() {
        return maskPool.size();
    }
}
