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
import java.util.UUID;

/**
 * Beacon identity: proximity UUID, major and minor. Two sightings belong to the same beacon
 * if and only if all three parts are equal.
 */
public final class BeaconIdentity implements Comparable<BeaconIdentity> {

    private static final int MAX_UNSIGNED_SHORT = 0xFFFF;

    private final UUID uuid;
    private final int major;
    private final int minor;

    /**
     * Creates a new identity.
     * @param uuid proximity UUID
     * @param major major number (0 - 65535)
     * @param minor minor number (0 - 65535)
     */
    public BeaconIdentity(UUID uuid, int major, int minor) {
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.major = checkUnsignedShort(major, "major");
        this.minor = checkUnsignedShort(minor, "minor");
    }

    /**
     * Returns proximity UUID.
     * @return proximity UUID
     */
    public UUID getUuid() {
        return uuid;
    }

    /**
     * Returns major number.
     * @return major number
     */
    public int getMajor() {
        return major;
    }

    /**
     * Returns minor number.
     * @return minor number
     */
    public int getMinor() {
        return minor;
    }

    @Override
    public int compareTo(BeaconIdentity other) {
        int result = uuid.compareTo(other.uuid);
        if (result == 0) {
            result = Integer.compare(major, other.major);
        }
        if (result == 0) {
            result = Integer.compare(minor, other.minor);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BeaconIdentity)) {
            return false;
        }
        BeaconIdentity that = (BeaconIdentity) o;
        return major == that.major && minor == that.minor && uuid.equals(that.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid, major, minor);
    }

    @Override
    public String toString() {
        return uuid.toString().toUpperCase() + "/" + major + "/" + minor;
    }

    private static int checkUnsignedShort(int value, String name) {
        if (value < 0 || value > MAX_UNSIGNED_SHORT) {
            throw new IllegalArgumentException(name + " must be within 0 - 65535: " + value);
        }
        return value;
    }

}
