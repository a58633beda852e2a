package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.EpochResult;

import java.io.PrintStream;

/**
 * Console progress for a running pool.
 *
 * Prints a line every {@code roundInterval} rounds and a summary at the end of each epoch.
 */
public class ProgressReporter implements MetricsSink {

    private final int roundInterval;
    private final PrintStream out;
    private long epochStartTime;

    public ProgressReporter(int roundInterval) {
        this(roundInterval, System.out);
    }

    public ProgressReporter(int roundInterval, PrintStream out) {
        if (roundInterval < 1)
            throw new IllegalArgumentException("Round interval must be positive: " + roundInterval);
        this.roundInterval = roundInterval;
        this.out = out;
    }

    @Override
    public void onEpochStart(int epoch) {
        epochStartTime = System.currentTimeMillis();
        out.printf("Epoch %d started%n", epoch + 1);
    }

    @Override
    public void onRound(RoundMetrics metrics) {
        if ((metrics.getRound() + 1) % roundInterval != 0)
            return;

        out.printf("  round %4d - loss: %.4f - valid: %d/%d - clipped: %d - grad norm: %.4f - %dms%n",
            metrics.getRound() + 1,
            metrics.getRoundLoss(),
            metrics.getValidCount(),
            metrics.getDispatchedCount(),
            metrics.getClippedCount(),
            metrics.getReducedGradientNorm(),
            metrics.getDuration().toMillis());
    }

    @Override
    public void onEpochEnd(int epoch, EpochResult result) {
        long elapsed = System.currentTimeMillis() - epochStartTime;
        out.printf("Epoch %3d - loss: %.4f - rounds: %d - batches: %d - rejected: %d - %s%s%n",
            epoch + 1,
            result.getAverageLoss(),
            result.getRoundsExecuted(),
            result.getBatchesProcessed(),
            result.getRejectedContributions(),
            formatTime(elapsed),
            result.isAborted() ? " (stopped)" : "");
    }

    private String formatTime(long millis) {
        if (millis < 1000) {
            return millis + "ms";
        } else if (millis < 60000) {
            return String.format("%.1fs", millis / 1000.0);
        } else {
            long minutes = millis / 60000;
            long seconds = (millis % 60000) / 1000;
            return String.format("%dm %ds", minutes, seconds);
        }
    }
}
