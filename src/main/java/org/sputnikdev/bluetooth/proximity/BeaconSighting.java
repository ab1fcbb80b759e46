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
 * A single decoded beacon advertisement.
 */
public class BeaconSighting {

    private final BeaconIdentity identity;
    private final int rssi;
    private final int txPower;
    private final double rawDistance;
    private final long timestamp;

    /**
     * Creates a new sighting.
     * @param identity beacon identity
     * @param rssi received signal strength (dBm)
     * @param txPower measured power at 1 meter carried by the advertisement (dBm)
     * @param rawDistance unfiltered distance estimate (meters)
     * @param timestamp capture time (epoch millis)
     */
    public BeaconSighting(BeaconIdentity identity, int rssi, int txPower, double rawDistance, long timestamp) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.rssi = rssi;
        this.txPower = txPower;
        this.rawDistance = rawDistance;
        this.timestamp = timestamp;
    }

    /**
     * Returns beacon identity.
     * @return beacon identity
     */
    public BeaconIdentity getIdentity() {
        return identity;
    }

    /**
     * Returns received signal strength.
     * @return RSSI in dBm
     */
    public int getRssi() {
        return rssi;
    }

    /**
     * Returns reference transmit power (measured power at 1 meter).
     * @return tx power in dBm
     */
    public int getTxPower() {
        return txPower;
    }

    /**
     * Returns the distance estimated from this sighting alone.
     * @return raw distance in meters
     */
    public double getRawDistance() {
        return rawDistance;
    }

    /**
     * Returns capture time.
     * @return capture time (epoch millis)
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BeaconSighting)) {
            return false;
        }
        BeaconSighting that = (BeaconSighting) o;
        return rssi == that.rssi && txPower == that.txPower && timestamp == that.timestamp
                && Double.compare(that.rawDistance, rawDistance) == 0 && identity.equals(that.identity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, rssi, txPower, rawDistance, timestamp);
    }

    @Override
    public String toString() {
        return "[Sighting] " + identity + " [rssi: " + rssi + ", tx: " + txPower + "]";
    }
}
