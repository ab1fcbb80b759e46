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
 * A listener of beacon discovery events.
 *
 * <p>Only the very first sighting of a beacon identity is pushed to listeners. Subsequent refinements
 * (RSSI, smoothed distance, last seen time) are available through {@link BeaconTracker#snapshot()} only.
 */
@FunctionalInterface
public interface BeaconDiscoveryListener {

    /**
     * Fires when a beacon identity is seen for the first time (or for the first time after it has expired).
     *
     * @param beacon a snapshot of the newly tracked beacon
     */
    void discovered(TrackedBeacon beacon);

    /**
     * Fires when a beacon has not been seen for longer than the beacon timeout and has been removed.
     *
     * @param beacon the last known snapshot of the removed beacon
     */
    default void lost(TrackedBeacon beacon) { }

    /**
     * Fires when the underlying scanner reports a failure after it has been started.
     * The tracker gets stopped.
     *
     * @param reason failure reason
     */
    default void scanFailed(ScannerUnavailableException.Reason reason) { }

}
