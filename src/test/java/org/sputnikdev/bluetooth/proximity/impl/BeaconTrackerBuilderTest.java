package org.sputnikdev.bluetooth.proximity.impl;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementScanner;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.sputnikdev.bluetooth.proximity.util.BeaconPayloads.UUID_A;

@RunWith(MockitoJUnitRunner.class)
public class BeaconTrackerBuilderTest {

    @Mock
    private AdvertisementScanner scanner;

    @Test
    public void testBuild() throws Exception {
        BeaconTracker tracker = new BeaconTrackerBuilder()
                .withScanner(scanner)
                .withUuidWhitelist(ImmutableSet.of(UUID_A))
                .withShutdownHook(false)
                .build();

        assertFalse(tracker.isStarted());
        assertEquals(ImmutableSet.of(UUID_A), tracker.getUuidWhitelist());
        assertTrue(tracker.snapshot().isEmpty());
        verify(scanner, never()).start(any());

        tracker.dispose();
    }

    @Test(expected = NullPointerException.class)
    public void testScannerIsMandatory() {
        new BeaconTrackerBuilder().withShutdownHook(false).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBeaconTimeout() {
        new BeaconTrackerBuilder().withScanner(scanner).withBeaconTimeout(0).withShutdownHook(false).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidExpiryRate() {
        new BeaconTrackerBuilder().withScanner(scanner).withExpiryRate(-1).withShutdownHook(false).build();
    }

}
