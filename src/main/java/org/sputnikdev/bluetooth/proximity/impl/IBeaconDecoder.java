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

import org.sputnikdev.bluetooth.proximity.BeaconIdentity;
import org.sputnikdev.bluetooth.proximity.BeaconSighting;

import java.nio.ByteBuffer;
import java.util.Optional;
import java.util.UUID;

/**
 * iBeacon manufacturer record decoder. The record layout is
 * {@code m:2-3=0215,i:4-19,i:20-21,i:22-23,p:24-24}:
 * <ul>
 *     <li>0-1: company identifier (little endian), 0x004C</li>
 *     <li>2-3: beacon type code, 0x02 0x15</li>
 *     <li>4-19: proximity UUID</li>
 *     <li>20-21: major</li>
 *     <li>22-23: minor</li>
 *     <li>24: measured power at 1 meter (signed)</li>
 * </ul>
 * Only records of exactly this length are decoded.
 */
final class IBeaconDecoder {

    static final int COMPANY_ID = 0x004C;
    static final int RECORD_LENGTH = 25;
    private static final byte TYPE_CODE_FIRST = 0x02;
    private static final byte TYPE_CODE_SECOND = 0x15;

    private IBeaconDecoder() { }

    /**
     * Decodes a manufacturer record.
     * @param payload manufacturer specific data including company identifier
     * @param rssi received signal strength
     * @param timestamp capture time
     * @return decoded sighting or empty if the payload is not an iBeacon record
     */
    static Optional<BeaconSighting> decode(byte[] payload, int rssi, long timestamp) {
        if (!isBeaconRecord(payload)) {
            return Optional.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(payload, 4, RECORD_LENGTH - 4);
        UUID uuid = new UUID(buffer.getLong(), buffer.getLong());
        int major = buffer.getShort() & 0xFFFF;
        int minor = buffer.getShort() & 0xFFFF;
        int txPower = buffer.get();
        return Optional.of(new BeaconSighting(new BeaconIdentity(uuid, major, minor), rssi, txPower,
                DistanceEstimator.estimate(rssi, txPower), timestamp));
    }

    static boolean isBeaconRecord(byte[] payload) {
        if (payload == null || payload.length != RECORD_LENGTH) {
            return false;
        }
        int companyId = (payload[0] & 0xFF) | (payload[1] & 0xFF) << 8;
        return companyId == COMPANY_ID && payload[2] == TYPE_CODE_FIRST && payload[3] == TYPE_CODE_SECOND;
    }

}
