package org.sputnikdev.bluetooth.proximity.impl;

/*-
 * #%L
 * org.sputnikdev:bluetooth-proximity
 * %%
 * Copyright (C) 2017 Sputnik Dev
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sputnikdev.bluetooth.proximity.BeaconDiscoveryListener;
import org.sputnikdev.bluetooth.proximity.BeaconIdentity;
import org.sputnikdev.bluetooth.proximity.BeaconSighting;
import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.DistanceFilter;
import org.sputnikdev.bluetooth.proximity.ScanStatistics;
import org.sputnikdev.bluetooth.proximity.ScannerUnavailableException;
import org.sputnikdev.bluetooth.proximity.TrackedBeacon;
import org.sputnikdev.bluetooth.proximity.transport.Advertisement;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementListener;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementScanner;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Thread safe beacon tracker implementation class.
 *
 * <p>Advertisements are handled on the scanner thread. Tracked beacons are kept in a concurrent map,
 * each entry is updated atomically (per identity) and publishes an immutable {@link TrackedBeacon} snapshot,
 * so that {@link #snapshot()} never blocks. Stale beacons are removed by a periodic job.
 */
class BeaconTrackerImpl implements BeaconTracker {

    static final int EXPIRY_RATE_SEC = 5;
    static final long BEACON_TIMEOUT = 1000 * 60;

    private Logger logger = LoggerFactory.getLogger(BeaconTrackerImpl.class);

    private final AdvertisementScanner scanner;
    private final Map<BeaconIdentity, BeaconHolder> beacons = new ConcurrentHashMap<>();
    private final Set<BeaconDiscoveryListener> discoveryListeners = new CopyOnWriteArraySet<>();
    private final ScheduledExecutorService expiryScheduler = Executors.newSingleThreadScheduledExecutor();
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private final ScannerCallback scannerCallback = new ScannerCallback();

    private final AtomicLong received = new AtomicLong();
    private final AtomicLong decoded = new AtomicLong();
    private final AtomicLong ignored = new AtomicLong();
    private final AtomicLong filtered = new AtomicLong();

    private final AtomicBoolean started = new AtomicBoolean();
    private volatile Set<UUID> uuidWhitelist = ImmutableSet.of();
    private volatile ScheduledFuture<?> expiryFuture;
    private long scanStarted;

    private Clock clock = Clock.systemUTC();
    private int expiryRate = EXPIRY_RATE_SEC;
    private long beaconTimeout = BEACON_TIMEOUT;
    private Supplier<DistanceFilter> filterFactory = AdvancedDistanceFilter::new;

    BeaconTrackerImpl(AdvertisementScanner scanner) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
    }

    @Override
    public void start() throws ScannerUnavailableException {
        if (lifecycleLock.getReadHoldCount() > 0) {
            throw new IllegalStateException("Beacon tracker cannot be started from a discovery listener");
        }
        lifecycleLock.writeLock().lock();
        try {
            if (expiryScheduler.isShutdown()) {
                throw new IllegalStateException("Beacon tracker has been disposed");
            }
            if (started.get()) {
                logger.debug("Beacon tracker is already started: {}", scanner.getName());
                return;
            }
            logger.debug("Starting beacon tracker: {}", scanner.getName());
            startScanner();
            received.set(0);
            decoded.set(0);
            ignored.set(0);
            filtered.set(0);
            scanStarted = clock.millis();
            expiryFuture = expiryScheduler.scheduleWithFixedDelay(this::runExpiry,
                    expiryRate, expiryRate, TimeUnit.SECONDS);
            started.set(true);
            logger.info("Beacon tracker started: {}", scanner.getName());
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public void stop() {
        if (lifecycleLock.getReadHoldCount() > 0) {
            // stopping from a listener, the read lock is held by the current thread
            doStop();
            return;
        }
        lifecycleLock.writeLock().lock();
        try {
            doStop();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    @Override
    public List<TrackedBeacon> snapshot() {
        long current = clock.millis();
        return beacons.values().stream()
                .map(BeaconHolder::getBeacon)
                .filter(beacon -> !isStale(beacon, current))
                .sorted(Comparator.comparing(TrackedBeacon::getIdentity))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public void addDiscoveryListener(BeaconDiscoveryListener listener) {
        discoveryListeners.add(listener);
    }

    @Override
    public void removeDiscoveryListener(BeaconDiscoveryListener listener) {
        discoveryListeners.remove(listener);
    }

    @Override
    public void setUuidWhitelist(Set<UUID> uuids) {
        uuidWhitelist = uuids != null ? ImmutableSet.copyOf(uuids) : ImmutableSet.of();
        if (uuidWhitelist.isEmpty()) {
            logger.info("UUID whitelist cleared, tracking all beacons");
        } else {
            logger.info("UUID whitelist updated: {}", uuidWhitelist);
        }
    }

    @Override
    public Set<UUID> getUuidWhitelist() {
        return uuidWhitelist;
    }

    @Override
    public ScanStatistics getStatistics() {
        return new ScanStatistics(received.get(), decoded.get(), ignored.get(), filtered.get(),
                started.get() ? scanStarted : 0, beacons.size());
    }

    @Override
    public void dispose() {
        logger.debug("Disposing beacon tracker: {}", scanner.getName());
        stop();
        expiryScheduler.shutdownNow();
        discoveryListeners.clear();
        beacons.clear();
        logger.debug("Beacon tracker has been disposed: {}", scanner.getName());
    }

    void handleAdvertisement(Advertisement advertisement) {
        received.incrementAndGet();
        Optional<BeaconSighting> sighting =
                IBeaconDecoder.decode(advertisement.getPayload(), advertisement.getRssi(), advertisement.getTimestamp());
        if (!sighting.isPresent() || advertisement.getRssi() >= 0) {
            ignored.incrementAndGet();
            logger.trace("Ignoring advertisement: {}", advertisement);
            return;
        }
        decoded.incrementAndGet();
        update(sighting.get());
    }

    void update(BeaconSighting sighting) {
        BeaconIdentity identity = sighting.getIdentity();
        Set<UUID> whitelist = uuidWhitelist;
        if (!whitelist.isEmpty() && !whitelist.contains(identity.getUuid())) {
            filtered.incrementAndGet();
            logger.trace("Beacon is not whitelisted: {}", identity);
            return;
        }
        double rawDistance = sighting.getRawDistance();
        long now = clock.millis();
        AtomicBoolean discovered = new AtomicBoolean();
        BeaconHolder holder = beacons.compute(identity, (key, existing) -> {
            if (existing == null || isStale(existing.getBeacon(), now)) {
                discovered.set(true);
                return new BeaconHolder(filterFactory.get(), sighting, rawDistance, now);
            }
            existing.update(sighting, rawDistance, now);
            return existing;
        });
        TrackedBeacon beacon = holder.getBeacon();
        if (discovered.get()) {
            logger.info("New beacon discovered: {} [raw distance: {}m]", beacon, String.format("%.2f", rawDistance));
            notifyDiscovered(beacon);
        } else {
            logger.trace("Beacon updated: {} [raw distance: {}m]", beacon, String.format("%.2f", rawDistance));
        }
    }

    void expireStale() {
        lifecycleLock.readLock().lock();
        try {
            long now = clock.millis();
            List<TrackedBeacon> lost = new ArrayList<>();
            for (BeaconIdentity identity : beacons.keySet()) {
                beacons.computeIfPresent(identity, (key, holder) -> {
                    if (isStale(holder.getBeacon(), now)) {
                        lost.add(holder.getBeacon());
                        return null;
                    }
                    return holder;
                });
            }
            logger.debug("Expiry check: {} beacons lost; {}", lost.size(), getStatistics());
            if (started.get()) {
                lost.forEach(this::notifyLost);
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    void setExpiryRate(int expiryRate) {
        this.expiryRate = expiryRate;
    }

    void setBeaconTimeout(long beaconTimeout) {
        this.beaconTimeout = beaconTimeout;
    }

    void setFilterFactory(Supplier<DistanceFilter> filterFactory) {
        this.filterFactory = filterFactory;
    }

    private void startScanner() throws ScannerUnavailableException {
        try {
            scanner.start(scannerCallback);
        } catch (ScannerUnavailableException ex) {
            logger.warn("Scanner could not be started: {} : {} : {}", scanner.getName(), ex.getReason(),
                    ex.getMessage());
            throw ex;
        } catch (SecurityException ex) {
            logger.warn("Scanner permission denied: {} : {}", scanner.getName(), ex.getMessage());
            throw new ScannerUnavailableException(ScannerUnavailableException.Reason.PERMISSION_DENIED,
                    "Scanner permission denied: " + scanner.getName(), ex);
        } catch (RuntimeException ex) {
            logger.warn("Error occurred while starting scanner: {} : {}", scanner.getName(), ex.getMessage());
            throw new ScannerUnavailableException(ScannerUnavailableException.Reason.INTERNAL_ERROR,
                    "Error occurred while starting scanner: " + scanner.getName(), ex);
        }
    }

    private void doStop() {
        if (!started.compareAndSet(true, false)) {
            logger.debug("Beacon tracker is not started: {}", scanner.getName());
            return;
        }
        logger.debug("Stopping beacon tracker: {}", scanner.getName());
        cancelExpiry();
        try {
            scanner.stop();
        } catch (Exception ex) {
            logger.warn("Error occurred while stopping scanner: " + scanner.getName(), ex);
        }
        logger.info("Beacon tracker stopped: {} : {}", scanner.getName(), getStatistics());
    }

    private void cancelExpiry() {
        ScheduledFuture<?> future = expiryFuture;
        expiryFuture = null;
        if (future != null) {
            future.cancel(false);
        }
    }

    private void runExpiry() {
        try {
            expireStale();
        } catch (Exception ex) {
            logger.warn("Beacon expiry job error", ex);
        }
    }

    private boolean isStale(TrackedBeacon beacon, long current) {
        return current - beacon.getLastSeen() > beaconTimeout;
    }

    private void notifyDiscovered(TrackedBeacon beacon) {
        logger.debug("Notifying discovery listeners (discovered): {} : {}", beacon, discoveryListeners.size());
        ProximityUtils.forEachSilently(discoveryListeners, BeaconDiscoveryListener::discovered, beacon,
                logger, "Error in beacon discovery listener");
    }

    private void notifyLost(TrackedBeacon beacon) {
        logger.debug("Beacon has been lost: {}", beacon);
        ProximityUtils.forEachSilently(discoveryListeners, BeaconDiscoveryListener::lost, beacon,
                logger, "Error in beacon discovery listener");
    }

    private void handleScanFailed(ScannerUnavailableException.Reason reason) {
        logger.error("Scanner failed: {} : {}", scanner.getName(), reason);
        if (lifecycleLock.getReadHoldCount() > 0) {
            // reported from within a scanner or listener callback, the read lock is held by the current thread
            notifyScanFailed(markFailed(), reason);
            return;
        }
        boolean wasStarted;
        lifecycleLock.writeLock().lock();
        try {
            wasStarted = markFailed();
            // downgrade, stop() must wait until listeners are notified
            lifecycleLock.readLock().lock();
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        try {
            notifyScanFailed(wasStarted, reason);
        } finally {
            lifecycleLock.readLock().unlock();
        }
    }

    private boolean markFailed() {
        boolean wasStarted = started.getAndSet(false);
        if (wasStarted) {
            cancelExpiry();
        }
        return wasStarted;
    }

    private void notifyScanFailed(boolean wasStarted, ScannerUnavailableException.Reason reason) {
        if (wasStarted) {
            ProximityUtils.forEachSilently(discoveryListeners, BeaconDiscoveryListener::scanFailed, reason,
                    logger, "Error in beacon discovery listener");
        }
    }

    private final class ScannerCallback implements AdvertisementListener {

        @Override
        public void advertised(Advertisement advertisement) {
            lifecycleLock.readLock().lock();
            try {
                if (started.get()) {
                    handleAdvertisement(advertisement);
                }
            } catch (Exception ex) {
                logger.warn("Error occurred while handling advertisement: " + advertisement, ex);
            } finally {
                lifecycleLock.readLock().unlock();
            }
        }

        @Override
        public void scanFailed(ScannerUnavailableException.Reason reason) {
            handleScanFailed(reason);
        }
    }

    private static final class BeaconHolder {

        private final DistanceFilter filter;
        private volatile TrackedBeacon beacon;

        private BeaconHolder(DistanceFilter filter, BeaconSighting sighting, double rawDistance, long now) {
            this.filter = filter;
            beacon = new TrackedBeacon(sighting.getIdentity(), sighting.getRssi(), sighting.getTxPower(),
                    rawDistance, filter.next(rawDistance), now, now);
        }

        private void update(BeaconSighting sighting, double rawDistance, long now) {
            beacon = new TrackedBeacon(sighting.getIdentity(), sighting.getRssi(), sighting.getTxPower(),
                    rawDistance, filter.next(rawDistance), beacon.getFirstSeen(), now);
        }

        private TrackedBeacon getBeacon() {
            return beacon;
        }
    }

}
