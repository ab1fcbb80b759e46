package org.sputnikdev.bluetooth.proximity.transport;

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

import java.util.Arrays;

/**
 * A raw advertisement as received by a scanner: manufacturer specific data (including the
 * two byte company identifier), RSSI and capture time.
 */
public class Advertisement {

    private final byte[] payload;
    private final int rssi;
    private final long timestamp;

    /**
     * Creates a new object.
     * @param payload manufacturer specific data
     * @param rssi received signal strength (dBm)
     * @param timestamp capture time (epoch millis)
     */
    public Advertisement(byte[] payload, int rssi, long timestamp) {
        this.payload = payload != null ? payload.clone() : null;
        this.rssi = rssi;
        this.timestamp = timestamp;
    }

    /**
     * Returns a copy of the payload.
     * @return manufacturer specific data, may be null
     */
    public byte[] getPayload() {
        return payload != null ? payload.clone() : null;
    }

    public int getRssi() {
        return rssi;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "[Advertisement] " + Arrays.toString(payload) + " [rssi: " + rssi + "]";
    }
}
