package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.EpochResult;

/**
 * Receiver of per-round and per-epoch training events.
 *
 * <p>Always called on the coordinating thread. {@link #onRound} runs while the workers are
 * parked before Phase B, so slow sinks stall training.
 */
@FunctionalInterface
public interface MetricsSink {

    /** Sink that ignores every event. */
    MetricsSink NONE = metrics -> {};

    void onRound(RoundMetrics metrics);

    default void onEpochStart(int epoch) {}

    default void onEpochEnd(int epoch, EpochResult result) {}
}
