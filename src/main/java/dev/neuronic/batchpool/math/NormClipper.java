package dev.neuronic.batchpool.math;

import dev.neuronic.batchpool.math.ops.GradientNorm;

/**
 * L2 norm-based gradient clipper.
 *
 * <p><b>Algorithm:</b>
 * <pre>
 * norm = sqrt(sum(gradient[i]^2))
 * if (norm > maxNorm):
 *     scale = maxNorm / norm
 *     gradient[i] *= scale  // for all i
 * </pre>
 *
 * <p>A gradient of norm 125.73 against maxNorm 10 is scaled by ~0.0796 and comes
 * out with norm 10. Buffers within the limit are not written at all. The scale is
 * computed in double, so a finite buffer whose float norm overflows is still scaled
 * down to maxNorm instead of to zero.
 */
final class NormClipper implements GradientClipper {

    private final float maxNorm;
    private final float maxNormSquared;

    NormClipper(float maxNorm) {
        if (!(maxNorm > 0) || Float.isInfinite(maxNorm)) {
            throw new IllegalArgumentException("Max norm must be positive and finite, got: " + maxNorm);
        }
        this.maxNorm = maxNorm;
        this.maxNormSquared = maxNorm * maxNorm;
    }

    @Override
    public float clipInPlace(float[] gradients) {
        if (gradients.length == 0) return 1.0f;

        float normSquared = GradientNorm.computeNormSquared(gradients);
        if (!Float.isInfinite(normSquared) && normSquared <= maxNormSquared)
            return 1.0f;

        double norm = Float.isInfinite(normSquared)
            ? GradientNorm.computeNormWide(gradients)
            : Math.sqrt(normSquared);
        if (norm <= maxNorm)
            return 1.0f;

        float scale = (float) (maxNorm / norm);
        // excess below float resolution
        if (scale >= 1.0f)
            return 1.0f;

        GradientMath.scaleInPlace(gradients, scale);
        return scale;
    }

    @Override
    public String getDescription() {
        return String.format("NormClipper(maxNorm=%.3f)", maxNorm);
    }

    /**
     * Get the maximum norm threshold.
     */
    public float getMaxNorm() {
        return maxNorm;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof NormClipper)) return false;
        NormClipper other = (NormClipper) obj;
        return Float.compare(maxNorm, other.maxNorm) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(maxNorm);
    }

    @Override
    public String toString() {
        return getDescription();
    }
}
