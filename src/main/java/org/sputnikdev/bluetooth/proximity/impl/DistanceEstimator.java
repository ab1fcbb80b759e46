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

/**
 * Path loss based distance estimation from RSSI and the measured power carried by an iBeacon record.
 */
final class DistanceEstimator {

    static final int DEFAULT_TX_POWER = -59;

    private DistanceEstimator() { }

    /**
     * Estimates distance in meters.
     * @param rssi received signal strength (dBm), must be negative
     * @param txPower measured power at 1 meter (dBm), default tx power is used if 0
     * @return estimated distance in meters
     */
    static double estimate(int rssi, int txPower) {
        int reference = txPower != 0 ? txPower : DEFAULT_TX_POWER;
        double ratio = (double) rssi / reference;
        if (ratio < 1.0) {
            return Math.pow(ratio, 10);
        }
        return 0.89976 * Math.pow(ratio, 7.7095) + 0.111;
    }

}
