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
 * A callback that receives raw advertisements from an {@link AdvertisementScanner}.
 */
public interface AdvertisementListener {

    /**
     * Fires for every received advertisement.
     * @param advertisement raw advertisement
     */
    void advertised(Advertisement advertisement);

    /**
     * Fires when the scanner fails after it has been started. The scanner is considered stopped.
     * @param reason failure reason
     */
    void scanFailed(ScannerUnavailableException.Reason reason);

}
