package dev.neuronic.batchpool.math;

import dev.neuronic.batchpool.math.ops.NonFiniteScan;

import java.util.Arrays;

/**
 * NaN/Inf detection for per-worker gradient buffers.
 *
 * <p>A buffer that fails validation is excluded from the round's reduction
 * entirely: it contributes neither to the sum nor to the contributor count.
 * Zeroing it and averaging it in would silently shrink the step.
 */
public final class GradientValidator {

    /** Maximum offending indices kept in a report. */
    public static final int MAX_REPORTED_INDICES = 5;

    /**
     * @return true if every element of the buffer is finite
     */
    public static boolean isValid(float[] gradients) {
        return !NonFiniteScan.containsNonFinite(gradients);
    }

    /**
     * Full diagnostic scan. Counts NaN and infinite elements and keeps the first
     * {@value #MAX_REPORTED_INDICES} offending indices.
     */
    public static ValidationReport inspect(float[] gradients) {
        if (isValid(gradients))
            return ValidationReport.VALID;

        int nanCount = 0;
        int infCount = 0;
        int[] indices = new int[MAX_REPORTED_INDICES];
        int reported = 0;

        for (int i = 0; i < gradients.length; i++) {
            float value = gradients[i];
            if (Float.isNaN(value)) {
                nanCount++;
            } else if (Float.isInfinite(value)) {
                infCount++;
            } else {
                continue;
            }
            if (reported < MAX_REPORTED_INDICES)
                indices[reported++] = i;
        }

        return new ValidationReport(nanCount, infCount, Arrays.copyOf(indices, reported));
    }

    /**
     * Outcome of {@link #inspect(float[])}.
     */
    public static final class ValidationReport {

        static final ValidationReport VALID = new ValidationReport(0, 0, new int[0]);

        private final int nanCount;
        private final int infCount;
        private final int[] offendingIndices;

        ValidationReport(int nanCount, int infCount, int[] offendingIndices) {
            this.nanCount = nanCount;
            this.infCount = infCount;
            this.offendingIndices = offendingIndices;
        }

        public boolean isValid() { return nanCount == 0 && infCount == 0; }
        public int getNanCount() { return nanCount; }
        public int getInfCount() { return infCount; }
        public int getInvalidCount() { return nanCount + infCount; }

        /**
         * @return up to {@value GradientValidator#MAX_REPORTED_INDICES} indices, in ascending order
         */
        public int[] getOffendingIndices() { return offendingIndices.clone(); }

        @Override
        public String toString() {
            if (isValid()) return "ValidationReport[valid]";
            return String.format("ValidationReport[nan=%d, inf=%d, first=%s]",
                nanCount, infCount, Arrays.toString(offendingIndices));
        }
    }

    private GradientValidator() {}
}
