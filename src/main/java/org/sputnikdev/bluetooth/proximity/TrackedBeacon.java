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
 * An immutable snapshot of a beacon that is currently tracked by {@link BeaconTracker}.
 */
public class TrackedBeacon {

    private final BeaconIdentity identity;
    private final int rssi;
    private final int txPower;
    private final double rawDistance;
    private final double distance;
    private final long firstSeen;
    private final long lastSeen;

    /**
     * Creates a new snapshot.
     * @param identity beacon identity
     * @param rssi last raw RSSI
     * @param txPower last reference transmit power
     * @param rawDistance last unfiltered distance estimate
     * @param distance smoothed distance estimate (meters)
     * @param firstSeen time when the beacon was discovered (epoch millis)
     * @param lastSeen time of the last sighting (epoch millis)
     */
    public TrackedBeacon(BeaconIdentity identity, int rssi, int txPower, double rawDistance, double distance,
                         long firstSeen, long lastSeen) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.rssi = rssi;
        this.txPower = txPower;
        this.rawDistance = rawDistance;
        this.distance = Math.max(0, distance);
        this.firstSeen = firstSeen;
        this.lastSeen = lastSeen;
    }

    /**
     * Returns beacon identity.
     * @return beacon identity
     */
    public BeaconIdentity getIdentity() {
        return identity;
    }

    /**
     * Returns the last raw RSSI.
     * @return RSSI in dBm
     */
    public int getRssi() {
        return rssi;
    }

    /**
     * Returns the last reference transmit power.
     * @return tx power in dBm
     */
    public int getTxPower() {
        return txPower;
    }

    /**
     * Returns the last distance estimate before smoothing.
     * @return raw distance in meters
     */
    public double getRawDistance() {
        return rawDistance;
    }

    /**
     * Returns the smoothed distance estimate, never negative.
     * @return distance in meters
     */
    public double getDistance() {
        return distance;
    }

    /**
     * Returns discovery time.
     * @return discovery time (epoch millis)
     */
    public long getFirstSeen() {
        return firstSeen;
    }

    /**
     * Returns the time of the last sighting.
     * @return last sighting time (epoch millis)
     */
    public long getLastSeen() {
        return lastSeen;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TrackedBeacon)) {
            return false;
        }
        TrackedBeacon that = (TrackedBeacon) o;
        return rssi == that.rssi && txPower == that.txPower
                && Double.compare(that.rawDistance, rawDistance) == 0
                && Double.compare(that.distance, distance) == 0
                && firstSeen == that.firstSeen && lastSeen == that.lastSeen
                && identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, rssi, txPower, rawDistance, distance, firstSeen, lastSeen);
    }

    @Override
    public String toString() {
        return String.format("[Beacon] %s [rssi: %d, distance: %.2fm]", identity, rssi, distance);
    }
}
