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

import java.util.Objects;

/**
 * Zone transition event. Event objects are immutable.
 */
public class ZoneEvent {

    private final ZoneEventType type;
    private final ZoneConfig zone;
    private final TrackedBeacon beacon;
    private final long timestamp;

    /**
     * Creates a new event.
     * @param type event type
     * @param zone zone configuration
     * @param beacon triggering beacon snapshot
     * @param timestamp event time (epoch millis)
     */
    public ZoneEvent(ZoneEventType type, ZoneConfig zone, TrackedBeacon beacon, long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.beacon = Objects.requireNonNull(beacon, "beacon");
        this.timestamp = timestamp;
    }

    public ZoneEventType getType() {
        return type;
    }

    public ZoneConfig getZone() {
        return zone;
    }

    public String getZoneId() {
        return zone.getId();
    }

    public String getZoneName() {
        return zone.getName();
    }

    /**
     * Returns the triggering beacon. For an exit caused by signal loss this is the last known snapshot.
     * @return triggering beacon
     */
    public TrackedBeacon getBeacon() {
        return beacon;
    }

    public BeaconIdentity getIdentity() {
        return beacon.getIdentity();
    }

    public double getDistance() {
        return beacon.getDistance();
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "[ZoneEvent] " + type + " " + zone.getId() + " [" + zone.getName() + "] " + beacon;
    }
}
