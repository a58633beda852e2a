package dev.neuronic.batchpool.engine;

import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reusable rendezvous for the workers and the coordinator.
 *
 * <p>One {@link CyclicBarrier} with {@code workerCount + 1} parties is tripped three times per round:
 * <ol>
 *   <li><b>dispatch</b> - batches have been assigned, workers may start computing</li>
 *   <li><b>Phase A</b> - every worker has finished writing its buffers; the coordinator
 *       receives a {@link ReductionWindow} and may read them</li>
 *   <li><b>Phase B</b> - reduction and optimizer step are complete; the window is closed and
 *       workers may start the next round</li>
 * </ol>
 * Each trip is a happens-before edge between everything written before it and everything read
 * after it, so buffers handed across a phase need no further synchronization.
 *
 * <p>Shutdown is a poison round: the coordinator signals shutdown and trips the dispatch point,
 * workers see the flag and exit.
 */
public final class RoundBarrier {

    private static final Logger LOG = Logger.getLogger(RoundBarrier.class.getName());

    private final CyclicBarrier barrier;
    private final int workerCount;
    private volatile boolean shutdown;

    // coordinator-only
    private long issuedWindows;
    private ReductionWindow currentWindow;

    public RoundBarrier(int workerCount) {
        if (workerCount < 1)
            throw new IllegalArgumentException("Worker count must be positive: " + workerCount);
        this.workerCount = workerCount;
        this.barrier = new CyclicBarrier(workerCount + 1);
    }

    /**
     * Dispatch point, used by workers and the coordinator alike.
     */
    public void awaitDispatch() {
        await("dispatch");
    }

    /**
     * Worker arrival at Phase A.
     */
    public void arrivePhaseA() {
        await("phase A");
    }

    /**
     * Coordinator arrival at Phase A.
     *
     * @return the reduction window for this round, owned by the calling thread
     */
    public ReductionWindow awaitPhaseA() {
        await("phase A");
        currentWindow = new ReductionWindow(Thread.currentThread(), ++issuedWindows);
        return currentWindow;
    }

    /**
     * Close the reduction window and let the workers proceed past Phase B.
     *
     * @throws IllegalStateException if {@code window} is not the open window of this round
     *         or is held by another thread
     */
    public void releasePhaseB(ReductionWindow window) {
        if (window == null || window != currentWindow || !window.isHeldByCurrentThread())
            throw new IllegalStateException("Phase B released with a foreign or closed window: " + window);
        window.close();
        currentWindow = null;
        await("phase B");
    }

    /**
     * Worker wait at Phase B.
     */
    public void awaitPhaseB() {
        await("phase B");
    }

    /**
     * Mark the next dispatch as the poison round.
     */
    public void signalShutdown() {
        shutdown = true;
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Put the barrier in the broken state. Every waiting party and every party arriving later
     * fails with {@link BrokenRoundException}; the barrier is never reused afterwards.
     *
     * <p>Entering {@link CyclicBarrier#await()} with the interrupt flag set breaks the barrier
     * without counting as an arrival. {@link CyclicBarrier#reset()} would only break the current
     * generation and leave a fresh one for late arrivals to park on.
     */
    public void breakBarrier() {
        LOG.fine("Breaking round barrier");
        boolean wasInterrupted = Thread.interrupted();
        Thread.currentThread().interrupt();
        try {
            barrier.await();
        } catch (InterruptedException e) {
            LOG.finer("Round barrier broken by " + Thread.currentThread().getName());
        } catch (BrokenBarrierException e) {
            LOG.finer("Round barrier was already broken");
        } finally {
            // clear our own interrupt, which an already broken barrier leaves set
            Thread.interrupted();
            if (wasInterrupted)
                Thread.currentThread().interrupt();
        }
    }

    public boolean isBroken() {
        return barrier.isBroken();
    }

    public int getParties() {
        return barrier.getParties();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    /**
     * @return parties currently parked at the barrier
     */
    public int getNumberWaiting() {
        return barrier.getNumberWaiting();
    }

    private void await(String point) {
        try {
            barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokenRoundException("Interrupted while waiting at " + point, e);
        } catch (BrokenBarrierException e) {
            if (LOG.isLoggable(Level.FINER))
                LOG.finer(Thread.currentThread().getName() + " saw broken barrier at " + point);
            throw new BrokenRoundException("Round barrier broken at " + point, e);
        }
    }
}
