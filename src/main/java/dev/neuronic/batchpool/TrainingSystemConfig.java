package dev.neuronic.batchpool;

import java.util.Properties;

/**
 * Immutable configuration of a {@link WorkerPool}.
 *
 * <p>Built once and never changed for the lifetime of the pool. The batch size
 * recorded here is the requested one; the pool may run with a smaller effective
 * batch size if the dataset cannot fill a single requested batch
 * (see {@link WorkerPool#getEffectiveBatchSize()}).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * TrainingSystemConfig config = TrainingSystemConfig.newBuilder()
 *     .workerCount(8)
 *     .gradientBufferSize(model.parameterCount())
 *     .batchSize(32)
 *     .sequenceLength(128)
 *     .build();
 * }</pre>
 */
public final class TrainingSystemConfig {

    /** Prefix of every key recognized by {@link #fromProperties(Properties)}. */
    public static final String PROPERTY_PREFIX = "batchpool.";

    public static final float DEFAULT_CLIP_NORM = 10.0f;
    public static final int DEFAULT_ROUND_COUNT_MARGIN = 10;
    public static final float DEFAULT_LEARNING_RATE = 0.001f;

    public final int workerCount;
    public final int gradientBufferSize;
    public final float clipNorm;
    public final int batchSize;
    public final int sequenceLength;
    public final int roundCountMargin;
    public final float learningRate;
    public final int scratchFloatsPerToken;
    public final boolean validateBatches;
    public final ThreadTopology topology;

    private TrainingSystemConfig(Builder builder) {
        this.workerCount = builder.workerCount;
        this.gradientBufferSize = builder.gradientBufferSize;
        this.clipNorm = builder.clipNorm;
        this.batchSize = builder.batchSize;
        this.sequenceLength = builder.sequenceLength;
        this.roundCountMargin = builder.roundCountMargin;
        this.learningRate = builder.learningRate;
        this.scratchFloatsPerToken = builder.scratchFloatsPerToken;
        this.validateBatches = builder.validateBatches;
        this.topology = new ThreadTopology(builder.topologyFanOut, builder.topologyDepth);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Tokens a full batch of the requested size consumes.
     */
    public long tokensPerBatch() {
        return (long) batchSize * sequenceLength;
    }

    /**
     * Read a configuration from properties. Recognized keys, all prefixed with
     * {@value #PROPERTY_PREFIX}: {@code worker_count}, {@code gradient_buffer_size},
     * {@code batch_size}, {@code sequence_length}, {@code clip_norm},
     * {@code round_count_margin}, {@code learning_rate},
     * {@code scratch_floats_per_token}, {@code validate_batches},
     * {@code topology.fan_out} and {@code topology.depth}. Missing keys keep
     * the builder defaults; required keys without a default fail in {@link Builder#build()}.
     *
     * @throws IllegalArgumentException if a value is malformed or out of range
     */
    public static TrainingSystemConfig fromProperties(Properties properties) {
        Builder builder = newBuilder();
        String value;

        if ((value = property(properties, "worker_count")) != null)
            builder.workerCount(parseInt("worker_count", value));
        if ((value = property(properties, "gradient_buffer_size")) != null)
            builder.gradientBufferSize(parseInt("gradient_buffer_size", value));
        if ((value = property(properties, "batch_size")) != null)
            builder.batchSize(parseInt("batch_size", value));
        if ((value = property(properties, "sequence_length")) != null)
            builder.sequenceLength(parseInt("sequence_length", value));
        if ((value = property(properties, "clip_norm")) != null)
            builder.clipNorm(parseFloat("clip_norm", value));
        if ((value = property(properties, "round_count_margin")) != null)
            builder.roundCountMargin(parseInt("round_count_margin", value));
        if ((value = property(properties, "learning_rate")) != null)
            builder.learningRate(parseFloat("learning_rate", value));
        if ((value = property(properties, "scratch_floats_per_token")) != null)
            builder.scratchFloatsPerToken(parseInt("scratch_floats_per_token", value));
        if ((value = property(properties, "validate_batches")) != null)
            builder.validateBatches(Boolean.parseBoolean(value));
        if ((value = property(properties, "topology.fan_out")) != null)
            builder.topologyFanOut(parseInt("topology.fan_out", value));
        if ((value = property(properties, "topology.depth")) != null)
            builder.topologyDepth(parseInt("topology.depth", value));

        return builder.build();
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(PROPERTY_PREFIX + key);
        return value == null ? null : value.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + key + " must be an integer: '" + value + "'", e);
        }
    }

    private static float parseFloat(String key, String value) {
        try {
            return Float.parseFloat(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(PROPERTY_PREFIX + key + " must be a number: '" + value + "'", e);
        }
    }

    @Override
    public String toString() {
        return String.format("TrainingSystemConfig[workers=%d, gradientSize=%d, batchSize=%d, seqLen=%d, " +
                             "clipNorm=%.3f, lr=%g, margin=%d, %s]",
            workerCount, gradientBufferSize, batchSize, sequenceLength,
            clipNorm, learningRate, roundCountMargin, topology);
    }

    public static class Builder {
        private int workerCount = 0;
        private int gradientBufferSize = 0;
        private float clipNorm = DEFAULT_CLIP_NORM;
        private int batchSize = 0;
        private int sequenceLength = 0;
        private int roundCountMargin = DEFAULT_ROUND_COUNT_MARGIN;
        private float learningRate = DEFAULT_LEARNING_RATE;
        private int scratchFloatsPerToken = 1;
        private boolean validateBatches = true;
        private int topologyFanOut = ThreadTopology.DEFAULT_FAN_OUT;
        private int topologyDepth = ThreadTopology.FLAT_DEPTH;

        public Builder workerCount(int workerCount) {
            if (workerCount < 1)
                throw new IllegalArgumentException("worker_count must be >= 1: " + workerCount);
            this.workerCount = workerCount;
            return this;
        }

        public Builder gradientBufferSize(int size) {
            if (size < 1)
                throw new IllegalArgumentException("gradient_buffer_size must be >= 1: " + size);
            this.gradientBufferSize = size;
            return this;
        }

        public Builder clipNorm(float clipNorm) {
            if (!(clipNorm > 0) || Float.isInfinite(clipNorm))
                throw new IllegalArgumentException("clip_norm must be a positive finite number: " + clipNorm);
            this.clipNorm = clipNorm;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 1)
                throw new IllegalArgumentException("batch_size must be >= 1: " + batchSize);
            this.batchSize = batchSize;
            return this;
        }

        public Builder sequenceLength(int sequenceLength) {
            if (sequenceLength < 1)
                throw new IllegalArgumentException("sequence_length must be >= 1: " + sequenceLength);
            this.sequenceLength = sequenceLength;
            return this;
        }

        public Builder roundCountMargin(int margin) {
            if (margin < 0)
                throw new IllegalArgumentException("round_count_margin must be >= 0: " + margin);
            this.roundCountMargin = margin;
            return this;
        }

        public Builder learningRate(float learningRate) {
            if (!(learningRate > 0))
                throw new IllegalArgumentException("learning_rate must be positive: " + learningRate);
            this.learningRate = learningRate;
            return this;
        }

        /**
         * Width of the per-token activation scratch each worker owns. The scratch
         * buffer holds {@code batchSize * sequenceLength * floatsPerToken} floats.
         */
        public Builder scratchFloatsPerToken(int floatsPerToken) {
            if (floatsPerToken < 1)
                throw new IllegalArgumentException("scratch_floats_per_token must be >= 1: " + floatsPerToken);
            this.scratchFloatsPerToken = floatsPerToken;
            return this;
        }

        /**
         * Check every fetched batch for padding/mask consistency before dispatch.
         */
        public Builder validateBatches(boolean validate) {
            this.validateBatches = validate;
            return this;
        }

        public Builder topologyFanOut(int fanOut) {
            if (fanOut < 1)
                throw new IllegalArgumentException("topology.fan_out must be >= 1: " + fanOut);
            this.topologyFanOut = fanOut;
            return this;
        }

        public Builder topologyDepth(int depth) {
            if (depth < 1)
                throw new IllegalArgumentException("topology.depth must be >= 1: " + depth);
            this.topologyDepth = depth;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required option was never set
         * @throws ConfigurationException if the topology asks for more than one worker level
         */
        public TrainingSystemConfig build() {
            if (workerCount == 0)
                throw new IllegalArgumentException("worker_count is required");
            if (gradientBufferSize == 0)
                throw new IllegalArgumentException("gradient_buffer_size is required");
            if (batchSize == 0)
                throw new IllegalArgumentException("batch_size is required");
            if (sequenceLength == 0)
                throw new IllegalArgumentException("sequence_length is required");
            if (topologyDepth != ThreadTopology.FLAT_DEPTH)
                throw new ConfigurationException("topology.depth=" + topologyDepth +
                    " is not supported; only a single worker level (depth 1) is executed");
            return new TrainingSystemConfig(this);
        }
    }
}
