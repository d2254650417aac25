package com.polynomialarithmetic;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DegreeTest {

    @Test
    public void testNegativeInfinityOrdersBelowEveryFiniteDegree() {
        assertTrue(Degree.NEGATIVE_INFINITY.isLessThan(Degree.of(0)));
        assertTrue(Degree.NEGATIVE_INFINITY.compareTo(Degree.of(100)) < 0);
        assertFalse(Degree.of(0).isLessThan(Degree.NEGATIVE_INFINITY));
        assertEquals(0, Degree.NEGATIVE_INFINITY.compareTo(Degree.NEGATIVE_INFINITY));
    }

    @Test
    public void testFiniteDegrees() {
        Degree three = Degree.of(3);
        assertTrue(three.isFinite());
        assertEquals(3, three.value());
        assertEquals(Degree.of(3), three);
        assertEquals(Degree.of(3).hashCode(), three.hashCode());
        assertTrue(Degree.of(2).isLessThan(three));
        assertEquals("3", three.toString());
    }

    @Test
    public void testSentinelHasNoValue() {
        assertFalse(Degree.NEGATIVE_INFINITY.isFinite());
        assertEquals("-inf", Degree.NEGATIVE_INFINITY.toString());
        assertThrows(ArithmeticException.class, () -> Degree.NEGATIVE_INFINITY.value());
        assertThrows(IllegalArgumentException.class, () -> Degree.of(-1));
    }
}
