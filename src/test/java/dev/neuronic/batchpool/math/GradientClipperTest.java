package dev.neuronic.batchpool.math;

import dev.neuronic.batchpool.math.ops.GradientNorm;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class GradientClipperTest {

    private static final float DELTA = 1e-4f;

    @Test
    public void testGradientAboveLimitIsScaledToMaxNorm() {
        float[] gradients = new float[100];
        Arrays.fill(gradients, 12.573f);  // norm = 12.573 * sqrt(100) = 125.73
        GradientClipper clipper = GradientClipper.byNorm(10.0f);

        float scale = clipper.clipInPlace(gradients);

        assertEquals(10.0f / 125.73f, scale, 1e-5f);
        assertEquals(0.0795, scale, 1e-3);
        assertEquals(10.0f, GradientNorm.computeNorm(gradients), DELTA);
        for (float g : gradients)
            assertEquals(1.0f, g / gradients[0], 1e-6f);
    }

    @Test
    public void testGradientWithinLimitIsUntouched() {
        float[] gradients = {3.0f, 4.0f};
        float[] original = gradients.clone();
        GradientClipper clipper = GradientClipper.byNorm(5.0f);

        assertEquals(1.0f, clipper.clipInPlace(gradients));
        assertArrayEquals(original, gradients);
    }

    @Test
    public void testReclippingKeepsNormAtLimit() {
        float[] gradients = new float[40];
        for (int i = 0; i < gradients.length; i++)
            gradients[i] = (i % 7) - 3.3f;
        GradientClipper clipper = GradientClipper.byNorm(1.0f);

        assertTrue(clipper.clipInPlace(gradients) < 1.0f);
        float[] once = gradients.clone();

        assertEquals(1.0f, clipper.clipInPlace(gradients), 1e-6f);
        assertArrayEquals(once, gradients, 1e-6f);
        assertEquals(1.0f, GradientNorm.computeNorm(gradients), 1e-5f);
    }

    @Test
    public void testNormJustAboveLimitIsClipped() {
        float[] gradients = {0.0f, 5.00002f};
        GradientClipper clipper = GradientClipper.byNorm(5.0f);

        float scale = clipper.clipInPlace(gradients);

        assertTrue(scale < 1.0f, "scale=" + scale);
        assertEquals(0.0f, gradients[0]);
        assertEquals(5.0f, gradients[1], 2e-6f);
    }

    @Test
    public void testHugeFiniteGradientIsScaledNotZeroed() {
        float[] gradients = new float[4];
        Arrays.fill(gradients, 3e38f);  // float sum of squares and float norm both overflow
        GradientClipper clipper = GradientClipper.byNorm(10.0f);

        float scale = clipper.clipInPlace(gradients);

        assertTrue(scale > 0.0f, "scale=" + scale);
        for (float g : gradients)
            assertEquals(5.0f, g, 1e-5f);
        assertEquals(10.0f, GradientNorm.computeNorm(gradients), DELTA);
    }

    @Test
    public void testEmptyBufferIsIgnored() {
        assertEquals(1.0f, GradientClipper.byNorm(1.0f).clipInPlace(new float[0]));
    }

    @Test
    public void testInvalidMaxNormRejected() {
        assertThrows(IllegalArgumentException.class, () -> GradientClipper.byNorm(0.0f));
        assertThrows(IllegalArgumentException.class, () -> GradientClipper.byNorm(-1.0f));
        assertThrows(IllegalArgumentException.class, () -> GradientClipper.byNorm(Float.NaN));
        assertThrows(IllegalArgumentException.class, () -> GradientClipper.byNorm(Float.POSITIVE_INFINITY));
    }

    @Test
    public void testEqualityByMaxNorm() {
        assertEquals(GradientClipper.byNorm(2.0f), GradientClipper.byNorm(2.0f));
        assertNotEquals(GradientClipper.byNorm(2.0f), GradientClipper.byNorm(3.0f));
        assertTrue(GradientClipper.byNorm(2.0f).getDescription().contains("2"));
    }
}
