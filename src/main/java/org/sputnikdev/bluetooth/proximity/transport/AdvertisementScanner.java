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

import org.sputnikdev.bluetooth.proximity.ScannerUnavailableException;

/**
 * Platform radio scanner (transport). Implementations deliver manufacturer specific data of received
 * BLE advertisements asynchronously, typically from a radio driver thread.
 */
public interface AdvertisementScanner {

    /**
     * Returns scanner name, e.g. "android" or "bluez".
     * @return scanner name
     */
    String getName();

    /**
     * Starts continuous scanning.
     * @param listener advertisement callback
     * @throws ScannerUnavailableException if the radio is disabled, a permission is not granted etc
     */
    void start(AdvertisementListener listener) throws ScannerUnavailableException;

    /**
     * Stops scanning and releases the radio.
     */
    void stop();

}
