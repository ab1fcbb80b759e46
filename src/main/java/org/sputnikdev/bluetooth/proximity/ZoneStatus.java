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
 * An immutable snapshot of a zone runtime state.
 */
public class ZoneStatus {

    private final String zoneId;
    private final ZoneState state;
    private final TrackedBeacon beacon;
    private final Long enteredAt;
    private final Long lastConfirmed;
    private final boolean dwellNotified;

    /**
     * Creates a new object.
     * @param zoneId zone id
     * @param state zone state
     * @param beacon the nearest matching beacon that drives the zone state, null if none
     * @param enteredAt time when the zone was entered (epoch millis), null if not inside
     * @param lastConfirmed time of the last sighting of the driving beacon (epoch millis), null if none
     * @param dwellNotified whether a dwell event has been fired for the current inside episode
     */
    public ZoneStatus(String zoneId, ZoneState state, TrackedBeacon beacon, Long enteredAt, Long lastConfirmed,
                      boolean dwellNotified) {
        this.zoneId = Objects.requireNonNull(zoneId, "zoneId");
        this.state = Objects.requireNonNull(state, "state");
        this.beacon = beacon;
        this.enteredAt = enteredAt;
        this.lastConfirmed = lastConfirmed;
        this.dwellNotified = dwellNotified;
    }

    public String getZoneId() {
        return zoneId;
    }

    public ZoneState getState() {
        return state;
    }

    /**
     * Returns the beacon that currently drives the zone state.
     * @return the nearest matching beacon or null
     */
    public TrackedBeacon getBeacon() {
        return beacon;
    }

    /**
     * Returns distance to the driving beacon.
     * @return distance in meters or null if there is no driving beacon
     */
    public Double getDistance() {
        return beacon != null ? beacon.getDistance() : null;
    }

    public Long getEnteredAt() {
        return enteredAt;
    }

    public Long getLastConfirmed() {
        return lastConfirmed;
    }

    public boolean isDwellNotified() {
        return dwellNotified;
    }

    public boolean isInside() {
        return state == ZoneState.INSIDE;
    }

    @Override
    public String toString() {
        return "[ZoneStatus] " + zoneId + " " + state + (beacon != null ? " " + beacon : "");
    }
}
