package dev.neuronic.batchpool.training;

import dev.neuronic.batchpool.EpochResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans every event out to several sinks. A sink that throws is logged and skipped;
 * the remaining sinks and the round still proceed.
 */
public final class CompositeMetricsSink implements MetricsSink {

    private static final Logger LOG = Logger.getLogger(CompositeMetricsSink.class.getName());

    private final List<MetricsSink> sinks;

    public CompositeMetricsSink(List<MetricsSink> sinks) {
        List<MetricsSink> copy = new ArrayList<>();
        for (MetricsSink sink : sinks) {
            if (sink != null && sink != MetricsSink.NONE)
                copy.add(sink);
        }
        this.sinks = Collections.unmodifiableList(copy);
    }

    public static CompositeMetricsSink of(MetricsSink... sinks) {
        return new CompositeMetricsSink(Arrays.asList(sinks));
    }

    @Override
    public void onRound(RoundMetrics metrics) {
        for (MetricsSink sink : sinks) {
            try {
                sink.onRound(metrics);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Metrics sink " + sink.getClass().getName() + " failed on round " +
                                       metrics.getRound(), e);
            }
        }
    }

    @Override
    public void onEpochStart(int epoch) {
        for (MetricsSink sink : sinks) {
            try {
                sink.onEpochStart(epoch);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Metrics sink " + sink.getClass().getName() + " failed at start of epoch " + epoch, e);
            }
        }
    }

    @Override
    public void onEpochEnd(int epoch, EpochResult result) {
        for (MetricsSink sink : sinks) {
            try {
                sink.onEpochEnd(epoch, result);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Metrics sink " + sink.getClass().getName() + " failed at end of epoch " + epoch, e);
            }
        }
    }

    public List<MetricsSink> getSinks() {
        return sinks;
    }
}
