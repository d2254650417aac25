package com.polynomialarithmetic;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class CoefficientNormalizerTest {

    @Test
    public void testTrailingZerosRemoved() {
        assertArrayEquals(new double[]{1, -4, 0, 2},
                CoefficientNormalizer.normalize(new double[]{1, -4, 0, 2, 0, 0}));
        assertArrayEquals(new double[0], CoefficientNormalizer.normalize(new double[]{0, 0, 0}));
        assertArrayEquals(new double[0], CoefficientNormalizer.normalize(new double[0]));
    }

    @Test
    public void testIdempotent() {
        double[][] samples = {
                {}, {0}, {0, 0}, {3}, {1, 0, 0}, {0, 0, 5, 0}, {-0.0, 1, -0.0, 0}
        };
        for (double[] s : samples) {
            double[] once = CoefficientNormalizer.normalize(s);
            assertArrayEquals(once, CoefficientNormalizer.normalize(once));
            assertTrue(CoefficientNormalizer.isCanonical(once));
        }
    }

    @Test
    public void testArgumentNotModified() {
        double[] in = {1, 2, 0};
        double[] out = CoefficientNormalizer.normalize(in);
        assertArrayEquals(new double[]{1, 2, 0}, in);
        assertNotSame(in, out);
        out[0] = 42;
        assertEquals(1, in[0]);
    }

    @Test
    public void testNegativeZeroBecomesPositiveZero() {
        double[] out = CoefficientNormalizer.normalize(new double[]{-0.0, 1, -0.0, 2, -0.0});
        assertEquals(4, out.length);
        assertEquals(Double.doubleToLongBits(0.0), Double.doubleToLongBits(out[0]));
        assertEquals(Double.doubleToLongBits(0.0), Double.doubleToLongBits(out[2]));
    }

    @Test
    public void testIsCanonical() {
        assertTrue(CoefficientNormalizer.isCanonical(new double[0]));
        assertTrue(CoefficientNormalizer.isCanonical(new double[]{0, 1}));
        assertFalse(CoefficientNormalizer.isCanonical(new double[]{1, 0}));
        assertFalse(CoefficientNormalizer.isCanonical(new double[]{0}));
    }
}
