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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Zone monitor. Matches beacons tracked by a {@link BeaconTracker} against configured zones and
 * converts beacon presence, absence and distance into stable enter/exit/dwell events.
 *
 * <p>Zones are evaluated periodically. A zone is entered when its nearest matching beacon gets closer than the zone
 * radius and exited when the beacon gets further than the exit threshold (radius multiplied by the exit multiplier)
 * or when the beacon disappears from the tracker. The gap between the radius and the exit threshold prevents
 * enter/exit flapping for beacons sitting near the boundary.
 *
 * <p>The monitor never controls the tracker lifecycle, starting and stopping the tracker is up to the caller.
 */
public interface ZoneMonitor {

    /**
     * Registers a new zone or replaces an existing zone with the same id. The zone runtime state is preserved
     * unless the identity pattern (UUID, major, minor) has changed.
     * @param zone zone configuration
     */
    void registerZone(ZoneConfig zone);

    /**
     * Unregisters a zone. No exit event is fired for an occupied zone.
     * @param zoneId zone id
     * @return true if the zone was registered
     */
    boolean unregisterZone(String zoneId);

    /**
     * Replaces all registered zones with the given zones.
     * @param zones new zones
     */
    void updateZones(Collection<ZoneConfig> zones);

    /**
     * Unregisters all zones.
     */
    void clearZones();

    /**
     * Returns all registered zones.
     * @return registered zones
     */
    List<ZoneConfig> getZones();

    /**
     * Returns a registered zone.
     * @param zoneId zone id
     * @return zone configuration or empty if not registered
     */
    Optional<ZoneConfig> getZone(String zoneId);

    /**
     * Starts periodic zone evaluation. Does nothing if already started.
     */
    void startMonitoring();

    /**
     * Stops periodic zone evaluation, zone states are preserved. No zone listener gets notified once
     * this method returns.
     */
    void stopMonitoring();

    /**
     * Checks whether zone evaluation is running.
     * @return true if monitoring
     */
    boolean isMonitoring();

    /**
     * Registers a new zone event listener.
     * @param listener zone event listener
     */
    void addZoneEventListener(ZoneEventListener listener);

    /**
     * Unregisters a zone event listener.
     * @param listener zone event listener
     */
    void removeZoneEventListener(ZoneEventListener listener);

    /**
     * Registers a new presence listener.
     * @param listener presence listener
     */
    void addPresenceListener(ZonePresenceListener listener);

    /**
     * Unregisters a presence listener.
     * @param listener presence listener
     */
    void removePresenceListener(ZonePresenceListener listener);

    /**
     * Returns current runtime state of a zone.
     * @param zoneId zone id
     * @return zone status or empty if the zone is not registered
     */
    Optional<ZoneStatus> currentState(String zoneId);

    /**
     * Returns current runtime states of all registered zones.
     * @return zone statuses by zone id
     */
    Map<String, ZoneStatus> getZoneStatuses();

    /**
     * Checks whether any enabled zone is occupied.
     * @return true if inside any enabled zone
     */
    boolean isInsideAnyZone();

    /**
     * Returns ids of occupied enabled zones.
     * @return ids of occupied zones
     */
    Set<String> getActiveZones();

    /**
     * Returns a human readable summary of all zones.
     * @return summary
     */
    String getSummary();

    /**
     * Stops monitoring and releases all resources. The monitor cannot be started again.
     */
    void dispose();

}
