package org.sputnikdev.bluetooth.proximity.impl;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.ZoneConfig;
import org.sputnikdev.bluetooth.proximity.ZoneMonitor;
import org.sputnikdev.bluetooth.proximity.ZoneState;

import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.sputnikdev.bluetooth.proximity.util.BeaconPayloads.UUID_A;

@RunWith(MockitoJUnitRunner.class)
public class ZoneMonitorBuilderTest {

    private static final ZoneConfig ZONE = new ZoneConfig("desk", "Desk", UUID_A, 2.0);

    @Mock
    private BeaconTracker tracker;

    @Test
    public void testBuild() {
        ZoneMonitor monitor = new ZoneMonitorBuilder()
                .withTracker(tracker)
                .withZones(Collections.singletonList(ZONE))
                .withShutdownHook(false)
                .build();

        assertTrue(monitor.isMonitoring());
        assertEquals(Collections.singletonList(ZONE), monitor.getZones());
        assertEquals(ZoneState.UNKNOWN, monitor.currentState("desk").get().getState());
        verify(tracker).addDiscoveryListener(any());

        monitor.dispose();
        assertFalse(monitor.isMonitoring());
    }

    @Test
    public void testBuildNotMonitoring() {
        ZoneMonitor monitor = new ZoneMonitorBuilder()
                .withTracker(tracker)
                .withMonitoring(false)
                .withShutdownHook(false)
                .build();

        assertFalse(monitor.isMonitoring());
        verifyNoInteractions(tracker);

        monitor.dispose();
    }

    @Test(expected = NullPointerException.class)
    public void testTrackerIsMandatory() {
        new ZoneMonitorBuilder().withShutdownHook(false).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidExitMultiplier() {
        new ZoneMonitorBuilder().withTracker(tracker).withExitMultiplier(0.9).withShutdownHook(false).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidEvaluationRate() {
        new ZoneMonitorBuilder().withTracker(tracker).withEvaluationRate(0).withShutdownHook(false).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidDwellTime() {
        new ZoneMonitorBuilder().withTracker(tracker).withDwellTime(-1).withShutdownHook(false).build();
    }

}
