package dev.neuronic.batchpool.engine;

import dev.neuronic.batchpool.data.Batch;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Body of one long-lived worker thread.
 *
 * <p>Each round the worker parks at dispatch, computes its batch (if it got one) into its own
 * {@link WorkerContext}, arrives at Phase A and parks again until the coordinator releases Phase B.
 * Idle workers pass through every barrier point without computing.
 *
 * <p>A {@link RuntimeException} from the compute step poisons only this worker's contribution:
 * the gradient is filled with NaN so the coordinator's validation excludes it. An {@link Error}
 * breaks the barrier so the coordinator fails fast, then propagates.
 */
public final class WorkerThread implements Runnable {

    private static final Logger LOG = Logger.getLogger(WorkerThread.class.getName());

    private final WorkerContext context;
    private final RoundBarrier barrier;
    private final ComputeStep computeStep;
    private volatile WorkerState state = WorkerState.WAIT_DISPATCH;

    public WorkerThread(WorkerContext context, RoundBarrier barrier, ComputeStep computeStep) {
        this.context = context;
        this.barrier = barrier;
        this.computeStep = computeStep;
    }

    @Override
    public void run() {
        try {
            loop();
        } catch (BrokenRoundException e) {
            if (barrier.isShutdown()) {
                LOG.fine(() -> "Worker " + context.getIndex() + " leaving broken barrier during teardown");
            } else {
                LOG.log(Level.WARNING, "Worker " + context.getIndex() + " stopped: " + e.getMessage());
            }
        } catch (RuntimeException e) {
            // outside the compute step, e.g. a batch released twice; the round cannot complete
            LOG.log(Level.SEVERE, "Worker " + context.getIndex() + " broke the round protocol", e);
            barrier.breakBarrier();
        } catch (Error e) {
            LOG.log(Level.SEVERE, "Worker " + context.getIndex() + " failed fatally", e);
            barrier.breakBarrier();
            throw e;
        } finally {
            state = WorkerState.TERMINATE;
        }
    }

    private void loop() {
        while (true) {
            state = WorkerState.WAIT_DISPATCH;
            barrier.awaitDispatch();
            if (barrier.isShutdown()) {
                LOG.finer(() -> "Worker " + context.getIndex() + " received shutdown");
                return;
            }

            Batch batch = context.getBatch();
            if (batch != null) {
                state = WorkerState.COMPUTE;
                compute(batch);
            } else {
                state = WorkerState.IDLE;
            }

            // a teardown may have started while computing
            if (barrier.isShutdown())
                return;

            state = WorkerState.ARRIVE_PHASE_A;
            barrier.arrivePhaseA();
            state = WorkerState.WAIT_PHASE_B;
            barrier.awaitPhaseB();
        }
    }

    private void compute(Batch batch) {
        float[] gradient = context.getGradient();
        Arrays.fill(gradient, 0.0f);
        float loss;
        try {
            loss = computeStep.run(batch, context.getScratch(), gradient);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Compute step failed on worker " + context.getIndex() +
                                   "; its contribution will be excluded", e);
            Arrays.fill(gradient, Float.NaN);
            loss = Float.NaN;
        } finally {
            context.releaseBatch();
        }
        context.setLoss(loss);
    }

    public WorkerState getState() {
        return state;
    }

    public int getIndex() {
        return context.getIndex();
    }
}
