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

import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.DistanceFilter;
import org.sputnikdev.bluetooth.proximity.transport.AdvertisementScanner;

import java.time.Clock;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Beacon tracker instance builder. The tracker is not started, use {@link BeaconTracker#start()}.
 */
public class BeaconTrackerBuilder {

    private AdvertisementScanner scanner;
    private long beaconTimeout = BeaconTrackerImpl.BEACON_TIMEOUT;
    private int expiryRate = BeaconTrackerImpl.EXPIRY_RATE_SEC;
    private Supplier<DistanceFilter> filterFactory = AdvancedDistanceFilter::new;
    private Set<UUID> uuidWhitelist = Collections.emptySet();
    private Clock clock = Clock.systemUTC();
    private boolean shutdownHook = true;

    /**
     * Sets the advertisement source. Mandatory.
     * @param scanner advertisement scanner
     */
    public BeaconTrackerBuilder withScanner(AdvertisementScanner scanner) {
        this.scanner = scanner;
        return this;
    }

    /**
     * Sets how long a beacon is kept after its last sighting.
     * @param millis beacon timeout in milliseconds
     */
    public BeaconTrackerBuilder withBeaconTimeout(long millis) {
        beaconTimeout = millis;
        return this;
    }

    /**
     * Sets how often stale beacons are checked and removed.
     * @param seconds expiry rate in seconds
     */
    public BeaconTrackerBuilder withExpiryRate(int seconds) {
        expiryRate = seconds;
        return this;
    }

    /**
     * Sets a factory of distance filters, one filter is created per tracked beacon.
     * @param filterFactory distance filter factory
     */
    public BeaconTrackerBuilder withFilterFactory(Supplier<DistanceFilter> filterFactory) {
        this.filterFactory = filterFactory;
        return this;
    }

    /**
     * Restricts tracking to the given proximity UUIDs. An empty set means all beacons are tracked.
     * @param uuids proximity UUIDs
     */
    public BeaconTrackerBuilder withUuidWhitelist(Set<UUID> uuids) {
        uuidWhitelist = uuids != null ? uuids : Collections.emptySet();
        return this;
    }

    public BeaconTrackerBuilder withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * If set to true (default), a JVM shutdown hook disposing the tracker is registered.
     * @param shutdownHook register a shutdown hook
     */
    public BeaconTrackerBuilder withShutdownHook(boolean shutdownHook) {
        this.shutdownHook = shutdownHook;
        return this;
    }

    /**
     * Builds a new instance of the beacon tracker.
     * @return a new instance of the beacon tracker
     */
    public BeaconTracker build() {
        Objects.requireNonNull(scanner, "Advertisement scanner must be provided");
        Objects.requireNonNull(filterFactory, "Distance filter factory must be provided");
        Objects.requireNonNull(clock, "Clock must be provided");
        if (beaconTimeout <= 0) {
            throw new IllegalArgumentException("Beacon timeout must be positive: " + beaconTimeout);
        }
        if (expiryRate <= 0) {
            throw new IllegalArgumentException("Expiry rate must be positive: " + expiryRate);
        }
        BeaconTrackerImpl tracker = new BeaconTrackerImpl(scanner);
        tracker.setBeaconTimeout(beaconTimeout);
        tracker.setExpiryRate(expiryRate);
        tracker.setFilterFactory(filterFactory);
        tracker.setClock(clock);
        tracker.setUuidWhitelist(uuidWhitelist);

        if (shutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(tracker::dispose));
        }

        return tracker;
    }

}
