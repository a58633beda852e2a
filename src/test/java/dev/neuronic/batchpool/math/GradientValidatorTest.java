package dev.neuronic.batchpool.math;

import dev.neuronic.batchpool.math.GradientValidator.ValidationReport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradientValidatorTest {

    @Test
    void testFiniteBufferIsValid() {
        float[] gradients = {0.5f, -3.0f, Float.MAX_VALUE, -Float.MIN_VALUE};

        assertTrue(GradientValidator.isValid(gradients));
        ValidationReport report = GradientValidator.inspect(gradients);
        assertTrue(report.isValid());
        assertEquals(0, report.getInvalidCount());
        assertEquals(0, report.getOffendingIndices().length);
    }

    @Test
    void testCountsNaNAndInfSeparately() {
        float[] gradients = new float[20];
        gradients[2] = Float.NaN;
        gradients[7] = Float.POSITIVE_INFINITY;
        gradients[11] = Float.NaN;
        gradients[19] = Float.NEGATIVE_INFINITY;

        assertFalse(GradientValidator.isValid(gradients));
        ValidationReport report = GradientValidator.inspect(gradients);
        assertFalse(report.isValid());
        assertEquals(2, report.getNanCount());
        assertEquals(2, report.getInfCount());
        assertEquals(4, report.getInvalidCount());
        assertArrayEquals(new int[]{2, 7, 11, 19}, report.getOffendingIndices());
    }

    @Test
    void testReportsOnlyFirstOffendingIndices() {
        float[] gradients = new float[64];
        for (int i = 10; i < 64; i += 2)
            gradients[i] = Float.NaN;

        ValidationReport report = GradientValidator.inspect(gradients);

        assertEquals(27, report.getNanCount());
        assertArrayEquals(new int[]{10, 12, 14, 16, 18}, report.getOffendingIndices());
        assertEquals(GradientValidator.MAX_REPORTED_INDICES, report.getOffendingIndices().length);
    }
}
