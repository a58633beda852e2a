package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.WorkerPool;
import dev.neuronic.batchpool.training.TrainingMetrics.EpochMetrics;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Stops training when the epoch loss stops improving.
 *
 * <p>An epoch improves on the best so far when its average loss is lower by more than
 * {@code minDelta}. A NaN epoch loss never counts as an improvement. After {@code patience}
 * epochs without improvement the shared stop flag is raised.
 */
public class EarlyStoppingCallback implements TrainingCallback {

    private static final Logger LOG = Logger.getLogger(EarlyStoppingCallback.class.getName());

    private final int patience;
    private final float minDelta;
    private final AtomicBoolean stopFlag;

    private double bestLoss;
    private int bestEpoch;
    private int epochsWithoutImprovement;

    /**
     * @param patience epochs to wait without improvement before stopping
     * @param minDelta minimum decrease to count as improvement
     * @param stopFlag shared flag to signal training stop
     */
    public EarlyStoppingCallback(int patience, float minDelta, AtomicBoolean stopFlag) {
        if (patience <= 0)
            throw new IllegalArgumentException("Patience must be positive");
        if (minDelta < 0)
            throw new IllegalArgumentException("Min delta must be non-negative");
        this.patience = patience;
        this.minDelta = minDelta;
        this.stopFlag = stopFlag;
        reset();
    }

    @Override
    public void onTrainingStart(WorkerPool pool, TrainingMetrics metrics) {
        reset();
        LOG.fine(() -> "Early stopping: monitoring epoch loss with patience=" + patience);
    }

    @Override
    public void onEpochEnd(int epoch, TrainingMetrics metrics) {
        EpochMetrics epochMetrics = metrics.getEpochMetrics(epoch);
        if (epochMetrics == null) return;

        double loss = epochMetrics.getAverageLoss();
        if (Double.isFinite(loss) && loss < bestLoss - minDelta) {
            bestLoss = loss;
            bestEpoch = epoch;
            epochsWithoutImprovement = 0;
            return;
        }

        epochsWithoutImprovement++;
        if (epochsWithoutImprovement >= patience && !stopFlag.get()) {
            LOG.info(String.format("Early stopping after %d epochs without improvement; best loss %.4f at epoch %d",
                patience, bestLoss, bestEpoch + 1));
            stopFlag.set(true);
        }
    }

    private void reset() {
        bestLoss = Double.POSITIVE_INFINITY;
        bestEpoch = -1;
        epochsWithoutImprovement = 0;
    }

    public int getBestEpoch() {
        return bestEpoch;
    }

    public double getBestLoss() {
        return bestLoss;
    }

    public int getEpochsWithoutImprovement() {
        return epochsWithoutImprovement;
    }
}
