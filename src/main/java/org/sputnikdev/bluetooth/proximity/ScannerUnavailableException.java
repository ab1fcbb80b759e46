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
 * Indicates that the radio scanner could not be started (or has stopped unexpectedly).
 * The tracker remains stopped; callers may retry once the precondition is resolved.
 */
public class ScannerUnavailableException extends Exception {

    /**
     * Failure reasons.
     */
    public enum Reason {
        /**
         * Bluetooth radio is missing or switched off.
         */
        RADIO_DISABLED,
        /**
         * Bluetooth or location permission is not granted.
         */
        PERMISSION_DENIED,
        /**
         * Hardware or platform does not support BLE scanning.
         */
        UNSUPPORTED,
        /**
         * Any other platform error.
         */
        INTERNAL_ERROR
    }

    private final Reason reason;

    /**
     * A constructor with a reason and a message.
     * @param reason failure reason
     * @param message a message
     */
    public ScannerUnavailableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * A constructor with a reason, a message and a cause.
     * @param reason failure reason
     * @param message a message
     * @param cause original exception
     */
    public ScannerUnavailableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Returns failure reason.
     * @return failure reason
     */
    public Reason getReason() {
        return reason;
    }

}
