package org.sputnikdev.bluetooth.proximity;

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

import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Beacon tracker. Converts a continuous stream of raw BLE advertisements into a filtered,
 * self-expiring, queryable set of currently present beacons.
 *
 * <p>Each beacon identity owns an independent distance filter that smooths noisy RSSI based distance estimates.
 * Beacons that have not been seen for longer than the beacon timeout are silently removed.
 *
 * <p>Usage example:
 * <pre>
 * {@code
 *
 * BeaconTracker tracker = new BeaconTrackerBuilder().withScanner(scanner).build();
 * tracker.addDiscoveryListener(beacon -> System.out.println("Discovered: " + beacon));
 * tracker.start();
 * ...
 * List<TrackedBeacon> beacons = tracker.snapshot();
 * }
 * </pre>
 */
public interface BeaconTracker {

    /**
     * Starts scanning. Does nothing if the tracker is already started.
     * Must not be called from a {@link BeaconDiscoveryListener} callback.
     *
     * @throws ScannerUnavailableException if the scanner cannot be started, e.g. radio is disabled
     * or a permission is not granted, the tracker remains stopped
     */
    void start() throws ScannerUnavailableException;

    /**
     * Stops scanning and releases the scanner. Does nothing if the tracker has not been started.
     * No discovery listener gets notified once this method returns.
     */
    void stop();

    /**
     * Checks whether the tracker has been started.
     * @return true if started, false otherwise
     */
    boolean isStarted();

    /**
     * Returns an immutable point-in-time copy of all currently tracked beacons.
     * @return currently tracked beacons
     */
    List<TrackedBeacon> snapshot();

    /**
     * Registers a new discovery listener.
     * @param listener a new discovery listener
     */
    void addDiscoveryListener(BeaconDiscoveryListener listener);

    /**
     * Unregisters a discovery listener.
     * @param listener a discovery listener
     */
    void removeDiscoveryListener(BeaconDiscoveryListener listener);

    /**
     * Restricts tracking to beacons with the given proximity UUIDs. An empty set disables filtering.
     * @param uuids allowed proximity UUIDs
     */
    void setUuidWhitelist(Set<UUID> uuids);

    /**
     * Returns the UUID whitelist.
     * @return allowed proximity UUIDs, empty if filtering is disabled
     */
    Set<UUID> getUuidWhitelist();

    /**
     * Returns scan counters.
     * @return scan counters
     */
    ScanStatistics getStatistics();

    /**
     * Stops the tracker and releases all its resources. The tracker cannot be started again.
     */
    void dispose();

}
