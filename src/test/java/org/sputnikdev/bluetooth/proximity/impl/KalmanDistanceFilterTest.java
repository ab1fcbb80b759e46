package org.sputnikdev.bluetooth.proximity.impl;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KalmanDistanceFilterTest {

    private final KalmanDistanceFilter filter = new KalmanDistanceFilter();

    @Test
    public void testFirstMeasurementSeedsFilter() {
        assertFalse(filter.isInitialized());

        assertEquals(5.0, filter.next(5.0), 0.0);

        assertTrue(filter.isInitialized());
        assertEquals(5.0, filter.current(), 0.0);
        assertEquals(1.0, filter.getErrorCovariance(), 0.0);
    }

    @Test
    public void testCorrection() {
        filter.next(5.0);

        // gain = 1.05 / 4.05
        assertEquals(6.2963, filter.next(10.0), 0.0001);
        assertEquals(0.7778, filter.getErrorCovariance(), 0.0001);
    }

    @Test
    public void testConvergence() {
        filter.next(20.0);
        double previous = 20.0;
        for (int i = 0; i < 100; i++) {
            double estimate = filter.next(4.0);
            assertTrue(estimate < previous);
            assertTrue(estimate > 4.0);
            previous = estimate;
        }
        assertEquals(4.0, filter.current(), 0.01);
    }

    @Test
    public void testNeverNegative() {
        assertEquals(0.0, filter.next(-1.0), 0.0);
        assertEquals(0.0, filter.current(), 0.0);
    }

    @Test
    public void testReset() {
        filter.next(5.0);
        filter.next(10.0);

        filter.reset();

        assertFalse(filter.isInitialized());
        assertEquals(1.0, filter.getErrorCovariance(), 0.0);
        assertEquals(8.0, filter.next(8.0), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidMeasurementNoise() {
        new KalmanDistanceFilter(0.05, 0, 1.0);
    }

}
