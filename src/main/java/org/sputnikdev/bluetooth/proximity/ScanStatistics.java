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

/**
 * Point-in-time scan counters of a {@link BeaconTracker}.
 */
public class ScanStatistics {

    private final long received;
    private final long decoded;
    private final long ignored;
    private final long filtered;
    private final long scanStarted;
    private final int tracked;

    /**
     * Creates a new object.
     * @param received total number of advertisements received since the scan was started
     * @param decoded number of advertisements decoded as beacon sightings
     * @param ignored number of advertisements that are not beacon records (or carry unusable RSSI)
     * @param filtered number of beacon sightings rejected by the UUID whitelist
     * @param scanStarted time when the scan was started (epoch millis), 0 if not started
     * @param tracked number of currently tracked beacons
     */
    public ScanStatistics(long received, long decoded, long ignored, long filtered, long scanStarted, int tracked) {
        this.received = received;
        this.decoded = decoded;
        this.ignored = ignored;
        this.filtered = filtered;
        this.scanStarted = scanStarted;
        this.tracked = tracked;
    }

    public long getReceived() {
        return received;
    }

    public long getDecoded() {
        return decoded;
    }

    public long getIgnored() {
        return ignored;
    }

    public long getFiltered() {
        return filtered;
    }

    public long getScanStarted() {
        return scanStarted;
    }

    public int getTracked() {
        return tracked;
    }

    @Override
    public String toString() {
        return "received=" + received + ", decoded=" + decoded + ", ignored=" + ignored
                + ", filtered=" + filtered + ", tracked=" + tracked;
    }
}
