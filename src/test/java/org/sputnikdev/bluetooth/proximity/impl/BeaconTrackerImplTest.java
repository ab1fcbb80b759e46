package org.sputnikdev.bluetooth.proximity.impl;

import com.google.common.collect.ImmutableSet;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;
import org.sputnikdev.bluetooth.proximity.BeaconDiscoveryListener;
import org.sputnikdev.bluetooth.proximity.BeaconIdentity;
import org.sputnikdev.bluetooth.proximity.ScanStatistics;
import org.sputnikdev.bluetooth.proximity.ScannerUnavailableException;
import org.sputnikdev.bluetooth.proximity.TrackedBeacon;
import org.sputnikdev.bluetooth.proximity.transport.Advertisement;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementListener;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementScanner;
import org.sputnikdev.bluetooth.proximity.util.BeaconPayloads;
import org.sputnikdev.bluetooth.proximity.util.MutableClock;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.sputnikdev.bluetooth.proximity.util.BeaconPayloads.UUID_A;
import static org.sputnikdev.bluetooth.proximity.util.BeaconPayloads.UUID_B;

@RunWith(MockitoJUnitRunner.class)
public class BeaconTrackerImplTest {

    private static final BeaconIdentity BEACON_A = new BeaconIdentity(UUID_A, 1, 1);
    private static final BeaconIdentity BEACON_B = new BeaconIdentity(UUID_B, 1, 2);

    @Mock
    private AdvertisementScanner scanner;
    @Mock
    private BeaconDiscoveryListener discoveryListener;

    private final MutableClock clock = new MutableClock(1_000_000L);
    private BeaconTrackerImpl tracker;
    private AdvertisementListener scannerCallback;

    @Before
    public void setUp() throws Exception {
        tracker = new BeaconTrackerImpl(scanner);
        tracker.setClock(clock);
        tracker.setExpiryRate(3600);
        tracker.addDiscoveryListener(discoveryListener);
    }

    @After
    public void tearDown() {
        tracker.dispose();
    }

    @Test
    public void testFirstDiscoveryNotifiedOnce() throws Exception {
        start();

        advertise(BEACON_A, -70);
        clock.advance(1000);
        advertise(BEACON_A, -72);
        clock.advance(1000);
        advertise(BEACON_A, -71);

        ArgumentCaptor<TrackedBeacon> captor = ArgumentCaptor.forClass(TrackedBeacon.class);
        verify(discoveryListener, times(1)).discovered(captor.capture());
        assertEquals(BEACON_A, captor.getValue().getIdentity());
        assertEquals(-70, captor.getValue().getRssi());

        List<TrackedBeacon> snapshot = tracker.snapshot();
        assertEquals(1, snapshot.size());
        TrackedBeacon beacon = snapshot.get(0);
        assertEquals(-71, beacon.getRssi());
        assertEquals(-59, beacon.getTxPower());
        assertEquals(1_000_000L, beacon.getFirstSeen());
        assertEquals(1_002_000L, beacon.getLastSeen());
        assertEquals(DistanceEstimator.estimate(-71, -59), beacon.getRawDistance(), 0.0);
    }

    @Test
    public void testDistinctBeacons() throws Exception {
        start();

        advertise(BEACON_B, -70);
        advertise(BEACON_A, -80);
        advertise(new BeaconIdentity(UUID_A, 1, 2), -80);

        verify(discoveryListener, times(3)).discovered(any());
        List<TrackedBeacon> snapshot = tracker.snapshot();
        assertEquals(3, snapshot.size());
        assertEquals(BEACON_A, snapshot.get(0).getIdentity());
        assertEquals(BEACON_B, snapshot.get(2).getIdentity());
    }

    @Test
    public void testSnapshotIsImmutable() throws Exception {
        start();
        advertise(BEACON_A, -70);

        List<TrackedBeacon> snapshot = tracker.snapshot();
        advertise(BEACON_B, -70);

        assertEquals(1, snapshot.size());
        try {
            snapshot.clear();
            fail();
        } catch (UnsupportedOperationException ignore) {
            // expected
        }
    }

    @Test
    public void testNonBeaconFramesIgnored() throws Exception {
        start();

        scannerCallback.advertised(new Advertisement(
                BeaconPayloads.withCompanyId(BeaconPayloads.iBeacon(UUID_A, 1, 1), 0x0059), -70, 0L));
        scannerCallback.advertised(new Advertisement(new byte[] {0x4C, 0x00, 0x02}, -70, 0L));
        scannerCallback.advertised(new Advertisement(BeaconPayloads.iBeacon(UUID_A, 1, 1), 0, 0L));
        advertise(BEACON_A, -70);

        verify(discoveryListener, times(1)).discovered(any());
        ScanStatistics statistics = tracker.getStatistics();
        assertEquals(4, statistics.getReceived());
        assertEquals(1, statistics.getDecoded());
        assertEquals(3, statistics.getIgnored());
        assertEquals(1, statistics.getTracked());
        assertEquals(1_000_000L, statistics.getScanStarted());
    }

    @Test
    public void testExpiry() throws Exception {
        start();
        advertise(BEACON_A, -70);

        clock.advance(BeaconTrackerImpl.BEACON_TIMEOUT);
        tracker.expireStale();
        assertEquals(1, tracker.snapshot().size());

        clock.advance(1);
        assertTrue(tracker.snapshot().isEmpty());
        tracker.expireStale();

        ArgumentCaptor<TrackedBeacon> captor = ArgumentCaptor.forClass(TrackedBeacon.class);
        verify(discoveryListener).lost(captor.capture());
        assertEquals(BEACON_A, captor.getValue().getIdentity());
        assertEquals(0, tracker.getStatistics().getTracked());

        // seen again, discovered again
        advertise(BEACON_A, -70);
        verify(discoveryListener, times(2)).discovered(any());
    }

    @Test
    public void testStaleBeaconRediscoveredBeforeExpiryPass() throws Exception {
        start();
        advertise(BEACON_A, -70);

        clock.advance(BeaconTrackerImpl.BEACON_TIMEOUT + 1);
        advertise(BEACON_A, -60);

        verify(discoveryListener, times(2)).discovered(any());
        TrackedBeacon beacon = tracker.snapshot().get(0);
        assertEquals(beacon.getLastSeen(), beacon.getFirstSeen());
    }

    @Test
    public void testUuidWhitelist() throws Exception {
        tracker.setUuidWhitelist(ImmutableSet.of(UUID_A));
        start();

        advertise(BEACON_B, -70);
        advertise(BEACON_A, -70);

        assertEquals(1, tracker.snapshot().size());
        assertEquals(BEACON_A, tracker.snapshot().get(0).getIdentity());
        assertEquals(1, tracker.getStatistics().getFiltered());
        assertEquals(ImmutableSet.of(UUID_A), tracker.getUuidWhitelist());

        tracker.setUuidWhitelist(null);
        advertise(BEACON_B, -70);
        assertEquals(2, tracker.snapshot().size());
    }

    @Test
    public void testStartFailure() throws Exception {
        doThrow(new ScannerUnavailableException(ScannerUnavailableException.Reason.RADIO_DISABLED, "radio is off"))
                .doAnswer(invocation -> null)
                .when(scanner).start(any());

        try {
            tracker.start();
            fail();
        } catch (ScannerUnavailableException ex) {
            assertEquals(ScannerUnavailableException.Reason.RADIO_DISABLED, ex.getReason());
        }
        assertFalse(tracker.isStarted());

        // retry
        tracker.start();
        assertTrue(tracker.isStarted());
    }

    @Test
    public void testStartPermissionDenied() throws Exception {
        doThrow(new SecurityException("denied")).when(scanner).start(any());

        try {
            tracker.start();
            fail();
        } catch (ScannerUnavailableException ex) {
            assertEquals(ScannerUnavailableException.Reason.PERMISSION_DENIED, ex.getReason());
        }
        assertFalse(tracker.isStarted());
    }

    @Test
    public void testStartInternalError() throws Exception {
        doThrow(new IllegalStateException("boom")).when(scanner).start(any());

        try {
            tracker.start();
            fail();
        } catch (ScannerUnavailableException ex) {
            assertEquals(ScannerUnavailableException.Reason.INTERNAL_ERROR, ex.getReason());
        }
        assertFalse(tracker.isStarted());
    }

    @Test
    public void testStartStopIdempotent() throws Exception {
        tracker.stop();
        verify(scanner, never()).stop();

        tracker.start();
        tracker.start();
        verify(scanner, times(1)).start(any());

        tracker.stop();
        tracker.stop();
        verify(scanner, times(1)).stop();
        assertFalse(tracker.isStarted());
    }

    @Test
    public void testNoCallbacksAfterStop() throws Exception {
        start();
        tracker.stop();

        advertise(BEACON_A, -70);

        verify(discoveryListener, never()).discovered(any());
        assertTrue(tracker.snapshot().isEmpty());
    }

    @Test
    public void testStopFromListener() throws Exception {
        start();
        doAnswer(invocation -> {
            tracker.stop();
            return null;
        }).when(discoveryListener).discovered(any());

        advertise(BEACON_A, -70);
        advertise(BEACON_B, -70);

        assertFalse(tracker.isStarted());
        verify(scanner).stop();
        verify(discoveryListener, times(1)).discovered(any());
    }

    @Test
    public void testStopFailureIsNotPropagated() throws Exception {
        start();
        doThrow(new IllegalStateException("boom")).when(scanner).stop();

        tracker.stop();

        assertFalse(tracker.isStarted());
    }

    @Test
    public void testListenerErrorDoesNotAffectOthers() throws Exception {
        BeaconDiscoveryListener other = mock(BeaconDiscoveryListener.class);
        tracker.addDiscoveryListener(other);
        doThrow(new RuntimeException("listener error")).when(discoveryListener).discovered(any());
        start();

        advertise(BEACON_A, -70);

        verify(other).discovered(any());
        assertEquals(1, tracker.snapshot().size());
    }

    @Test
    public void testRemoveDiscoveryListener() throws Exception {
        start();
        tracker.removeDiscoveryListener(discoveryListener);

        advertise(BEACON_A, -70);

        verify(discoveryListener, never()).discovered(any());
    }

    @Test
    public void testScanFailed() throws Exception {
        start();

        scannerCallback.scanFailed(ScannerUnavailableException.Reason.RADIO_DISABLED);

        assertFalse(tracker.isStarted());
        verify(discoveryListener).scanFailed(ScannerUnavailableException.Reason.RADIO_DISABLED);
        advertise(BEACON_A, -70);
        assertTrue(tracker.snapshot().isEmpty());
    }

    @Test(timeout = 5000)
    public void testScanFailedFromListener() throws Exception {
        start();
        doAnswer(invocation -> {
            scannerCallback.scanFailed(ScannerUnavailableException.Reason.INTERNAL_ERROR);
            return null;
        }).when(discoveryListener).discovered(any());

        advertise(BEACON_A, -70);

        assertFalse(tracker.isStarted());
        verify(discoveryListener).scanFailed(ScannerUnavailableException.Reason.INTERNAL_ERROR);

        // the lifecycle lock has been released
        tracker.start();
        assertTrue(tracker.isStarted());
        verify(scanner, times(2)).start(any());
    }

    @Test(timeout = 5000)
    public void testStopWaitsForScanFailedListeners() throws Exception {
        start();
        CountDownLatch notified = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            notified.countDown();
            release.await();
            return null;
        }).when(discoveryListener).scanFailed(any());

        Thread scannerThread =
                new Thread(() -> scannerCallback.scanFailed(ScannerUnavailableException.Reason.RADIO_DISABLED));
        scannerThread.start();
        notified.await();

        Thread stopThread = new Thread(tracker::stop);
        stopThread.start();
        stopThread.join(200);
        assertTrue(stopThread.isAlive());

        release.countDown();
        stopThread.join();
        scannerThread.join();
        assertFalse(tracker.isStarted());
        verify(scanner, never()).stop();
    }

    @Test(timeout = 5000)
    public void testConcurrentStopFromListeners() throws Exception {
        start();
        CyclicBarrier barrier = new CyclicBarrier(2);
        doAnswer(invocation -> {
            barrier.await();
            tracker.stop();
            return null;
        }).when(discoveryListener).discovered(any());

        Thread first = new Thread(() -> advertise(BEACON_A, -70));
        Thread second = new Thread(() -> advertise(BEACON_B, -70));
        first.start();
        second.start();
        first.join();
        second.join();

        assertFalse(tracker.isStarted());
        verify(scanner, times(1)).stop();
        verify(discoveryListener, times(2)).discovered(any());
    }

    @Test
    public void testStartFromListener() throws Exception {
        start();
        AtomicReference<Exception> error = new AtomicReference<>();
        doAnswer(invocation -> {
            try {
                tracker.start();
            } catch (IllegalStateException ex) {
                error.set(ex);
            }
            return null;
        }).when(discoveryListener).discovered(any());

        advertise(BEACON_A, -70);

        assertTrue(error.get() instanceof IllegalStateException);
        assertTrue(tracker.isStarted());
    }

    @Test(expected = IllegalStateException.class)
    public void testStartAfterDispose() throws Exception {
        tracker.dispose();
        tracker.start();
    }

    private void start() throws ScannerUnavailableException {
        tracker.start();
        ArgumentCaptor<AdvertisementListener> captor = ArgumentCaptor.forClass(AdvertisementListener.class);
        verify(scanner).start(captor.capture());
        scannerCallback = captor.getValue();
    }

    private void advertise(BeaconIdentity identity, int rssi) {
        UUID uuid = identity.getUuid();
        scannerCallback.advertised(new Advertisement(
                BeaconPayloads.iBeacon(uuid, identity.getMajor(), identity.getMinor()), rssi, clock.millis()));
    }

}
