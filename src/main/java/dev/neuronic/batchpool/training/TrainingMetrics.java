package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.EpochResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Metrics collection across the rounds and epochs of a training run.
 *
 * <p>Register it as the pool's {@link MetricsSink} (directly or through a
 * {@link CompositeMetricsSink}) and it builds an epoch-by-epoch history:
 * <pre>{@code
 * TrainingMetrics metrics = new TrainingMetrics();
 * WorkerPool pool = WorkerPool.create(config, source, step, optimizer, metrics, null);
 * pool.runEpoch(source);
 * System.out.println(metrics.getSummary());
 * MetricsLogger.exportToJson(metrics, Path.of("run.json.zst"), Map.of());
 * }</pre>
 *
 * <p><b>Thread Safety:</b> events arrive on the coordinating thread; every accessor may be called
 * from any thread.
 */
public class TrainingMetrics implements MetricsSink {

    /**
     * Metrics for a single epoch of training.
     */
    public static class EpochMetrics {
        private final int epochNumber;
        private final double averageLoss;
        private final int rounds;
        private final long batches;
        private final long rejected;
        private final long clipped;
        private final double meanClipScale;
        private final boolean aborted;
        private final Duration epochTime;

        public EpochMetrics(int epochNumber, double averageLoss, int rounds, long batches, long rejected,
                            long clipped, double meanClipScale, boolean aborted, Duration epochTime) {
            this.epochNumber = epochNumber;
            this.averageLoss = averageLoss;
            this.rounds = rounds;
            this.batches = batches;
            this.rejected = rejected;
            this.clipped = clipped;
            this.meanClipScale = meanClipScale;
            this.aborted = aborted;
            this.epochTime = epochTime;
        }

        public int getEpochNumber() { return epochNumber; }
        public double getAverageLoss() { return averageLoss; }
        public int getRounds() { return rounds; }
        public long getBatches() { return batches; }
        public long getRejected() { return rejected; }
        public long getClipped() { return clipped; }
        /** Mean clip scale over accepted contributions, 1.0 when nothing was clipped. */
        public double getMeanClipScale() { return meanClipScale; }
        public boolean isAborted() { return aborted; }
        public Duration getEpochTime() { return epochTime; }

        @Override
        public String toString() {
            return String.format("Epoch %d: loss=%.4f, rounds=%d, batches=%d, rejected=%d, clipped=%d, time=%dms%s",
                epochNumber, averageLoss, rounds, batches, rejected, clipped, epochTime.toMillis(),
                aborted ? " (aborted)" : "");
        }
    }

    private final List<EpochMetrics> epochHistory = new ArrayList<>();
    private final List<Float> roundLosses = new ArrayList<>();
    private final Object metricsLock = new Object();
    private final Instant trainingStartTime;
    private volatile Instant trainingEndTime;

    private long totalRounds;
    private long totalBatches;
    private long totalRejected;
    private long totalClipped;
    private double totalClipScale;
    private long totalAccepted;

    // current epoch
    private long epochClipped;
    private double epochClipScale;
    private long epochAccepted;

    private int bestEpoch = -1;
    private double bestLoss = Double.NaN;

    public TrainingMetrics() {
        this.trainingStartTime = Instant.now();
    }

    @Override
    public void onEpochStart(int epoch) {
        synchronized (metricsLock) {
            epochClipped = 0;
            epochClipScale = 0;
            epochAccepted = 0;
        }
    }

    @Override
    public void onRound(RoundMetrics metrics) {
        synchronized (metricsLock) {
            totalRounds++;
            totalBatches += metrics.getDispatchedCount();
            totalRejected += metrics.getRejectedCount();
            roundLosses.add(metrics.getRoundLoss());

            for (int i = 0; i < metrics.getWorkerCount(); i++) {
                if (!metrics.isValid(i))
                    continue;
                float scale = metrics.getClipScale(i);
                epochAccepted++;
                epochClipScale += scale;
                if (scale < 1.0f)
                    epochClipped++;
            }
        }
    }

    @Override
    public void onEpochEnd(int epoch, EpochResult result) {
        synchronized (metricsLock) {
            double meanScale = epochAccepted > 0 ? epochClipScale / epochAccepted : 1.0;
            EpochMetrics metrics = new EpochMetrics(epoch, result.getAverageLoss(), result.getRoundsExecuted(),
                result.getBatchesProcessed(), result.getRejectedContributions(), epochClipped, meanScale,
                result.isAborted(), result.getDuration());
            epochHistory.add(metrics);

            totalClipped += epochClipped;
            totalClipScale += epochClipScale;
            totalAccepted += epochAccepted;

            double loss = result.getAverageLoss();
            if (Double.isFinite(loss) && (bestEpoch < 0 || loss < bestLoss)) {
                bestLoss = loss;
                bestEpoch = epoch;
            }
        }
    }

    /**
     * Mark training as completed.
     */
    public void completeTraining() {
        this.trainingEndTime = Instant.now();
    }

    public Duration getTotalTrainingTime() {
        Instant endTime = trainingEndTime != null ? trainingEndTime : Instant.now();
        return Duration.between(trainingStartTime, endTime);
    }

    /**
     * @return epoch with the lowest finite average loss, or -1
     */
    public int getBestEpoch() {
        synchronized (metricsLock) {
            return bestEpoch;
        }
    }

    /**
     * @return lowest finite epoch loss, NaN before one was recorded
     */
    public double getBestLoss() {
        synchronized (metricsLock) {
            return bestLoss;
        }
    }

    public double getFinalLoss() {
        synchronized (metricsLock) {
            if (epochHistory.isEmpty()) return Double.NaN;
            return epochHistory.get(epochHistory.size() - 1).getAverageLoss();
        }
    }

    public int getEpochCount() {
        synchronized (metricsLock) {
            return epochHistory.size();
        }
    }

    public long getTotalRounds() {
        synchronized (metricsLock) {
            return totalRounds;
        }
    }

    public long getTotalBatches() {
        synchronized (metricsLock) {
            return totalBatches;
        }
    }

    /**
     * @return worker contributions excluded for non-finite gradients, over all rounds
     */
    public long getTotalRejected() {
        synchronized (metricsLock) {
            return totalRejected;
        }
    }

    public long getTotalClipped() {
        synchronized (metricsLock) {
            return totalClipped;
        }
    }

    /**
     * Mean clip scale over every accepted contribution of completed epochs.
     */
    public double getMeanClipScale() {
        synchronized (metricsLock) {
            return totalAccepted > 0 ? totalClipScale / totalAccepted : 1.0;
        }
    }

    public EpochMetrics getEpochMetrics(int epochNumber) {
        synchronized (metricsLock) {
            return epochHistory.stream()
                .filter(m -> m.getEpochNumber() == epochNumber)
                .findFirst()
                .orElse(null);
        }
    }

    /**
     * Get all epoch metrics (defensive copy).
     */
    public List<EpochMetrics> getAllEpochMetrics() {
        synchronized (metricsLock) {
            return new ArrayList<>(epochHistory);
        }
    }

    public double[] getLossHistory() {
        synchronized (metricsLock) {
            return epochHistory.stream().mapToDouble(EpochMetrics::getAverageLoss).toArray();
        }
    }

    public double[] getRoundLossHistory() {
        synchronized (metricsLock) {
            return roundLosses.stream().mapToDouble(Float::doubleValue).toArray();
        }
    }

    public double getBatchesPerSecond() {
        synchronized (metricsLock) {
            double seconds = getTotalTrainingTime().toMillis() / 1000.0;
            return seconds > 0 ? totalBatches / seconds : 0.0;
        }
    }

    public String getSummary() {
        synchronized (metricsLock) {
            return String.format(
                "Training Summary:\n" +
                "  Epochs: %d\n" +
                "  Rounds: %,d\n" +
                "  Batches: %,d\n" +
                "  Rejected contributions: %,d\n" +
                "  Clipped contributions: %,d (mean scale %.4f)\n" +
                "  Training time: %s\n" +
                "  Final loss: %.4f\n" +
                "  Best loss: %.4f (epoch %d)",
                epochHistory.size(), totalRounds, totalBatches, totalRejected,
                totalClipped, getMeanClipScale(),
                formatDuration(getTotalTrainingTime()),
                getFinalLoss(), bestLoss, bestEpoch);
        }
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return String.format("%ds", seconds);
        } else if (seconds < 3600) {
            return String.format("%dm %ds", seconds / 60, seconds % 60);
        } else {
            long hours = seconds / 3600;
            long minutes = (seconds % 3600) / 60;
            return String.format("%dh %dm", hours, minutes);
        }
    }
}
