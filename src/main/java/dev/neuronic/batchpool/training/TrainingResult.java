package dev.neuronic.batchpool.training;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Outcome of {@link ParallelTrainer#fit(int)}.
 */
public class TrainingResult {

    private final TrainingMetrics metrics;
    private final int epochsRun;
    private final boolean stoppedEarly;

    public TrainingResult(TrainingMetrics metrics, int epochsRun, boolean stoppedEarly) {
        this.metrics = metrics;
        this.epochsRun = epochsRun;
        this.stoppedEarly = stoppedEarly;
    }

    public TrainingMetrics getMetrics() {
        return metrics;
    }

    public int getEpochsRun() {
        return epochsRun;
    }

    /** True when a callback or {@link ParallelTrainer#stopTraining()} ended the run before the epoch count. */
    public boolean isStoppedEarly() {
        return stoppedEarly;
    }

    public void exportMetrics(Path path) throws IOException {
        MetricsLogger.exportToJson(metrics, path);
    }

    public void printSummary() {
        MetricsLogger.printReport(metrics);
    }
}
