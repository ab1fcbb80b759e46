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
 * Zone (geofence) configuration. A zone is a radius bound region around a beacon matched by its identity pattern:
 * proximity UUID is required, major and minor are optional ({@code null} matches any value).
 */
public final class ZoneConfig {

    private final String id;
    private final String name;
    private final UUID uuid;
    private final Integer major;
    private final Integer minor;
    private final double radius;
    private final boolean enabled;

    /**
     * Creates a new zone configuration.
     * @param id zone id
     * @param name display name, zone id is used if null
     * @param uuid proximity UUID of beacons that define this zone
     * @param major major number, null to match any major
     * @param minor minor number, null to match any minor
     * @param radius zone radius in meters, must be positive
     * @param enabled whether the zone is evaluated
     */
    public ZoneConfig(String id, String name, UUID uuid, Integer major, Integer minor, double radius,
                      boolean enabled) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.uuid = Objects.requireNonNull(uuid, "uuid");
        this.major = major;
        this.minor = minor;
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new IllegalArgumentException("Zone radius must be a positive number: " + radius);
        }
        this.radius = radius;
        this.enabled = enabled;
    }

    /**
     * Creates a new enabled zone matching any beacon with the given UUID.
     * @param id zone id
     * @param name display name
     * @param uuid proximity UUID
     * @param radius zone radius in meters
     */
    public ZoneConfig(String id, String name, UUID uuid, double radius) {
        this(id, name, uuid, null, null, radius, true);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public UUID getUuid() {
        return uuid;
    }

    /**
     * Returns major number to match.
     * @return major number or null if any major matches
     */
    public Integer getMajor() {
        return major;
    }

    /**
     * Returns minor number to match.
     * @return minor number or null if any minor matches
     */
    public Integer getMinor() {
        return minor;
    }

    public double getRadius() {
        return radius;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Returns a copy of this configuration with the given enabled flag.
     * @param enabled enabled flag
     * @return a copy of this configuration
     */
    public ZoneConfig withEnabled(boolean enabled) {
        return enabled == this.enabled ? this : new ZoneConfig(id, name, uuid, major, minor, radius, enabled);
    }

    /**
     * Checks whether the given beacon identity matches the identity pattern of this zone.
     * @param identity beacon identity
     * @return true if matches
     */
    public boolean matches(BeaconIdentity identity) {
        return uuid.equals(identity.getUuid())
                && (major == null || major == identity.getMajor())
                && (minor == null || minor == identity.getMinor());
    }

    /**
     * Checks whether this zone and the given zone have the same identity pattern.
     * @param other another zone
     * @return true if UUID, major and minor are equal
     */
    public boolean hasSamePattern(ZoneConfig other) {
        return uuid.equals(other.uuid) && Objects.equals(major, other.major) && Objects.equals(minor, other.minor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZoneConfig)) {
            return false;
        }
        ZoneConfig that = (ZoneConfig) o;
        return Double.compare(that.radius, radius) == 0 && enabled == that.enabled && id.equals(that.id)
                && name.equals(that.name) && hasSamePattern(that);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, uuid, major, minor, radius, enabled);
    }

    @Override
    public String toString() {
        return "[Zone] " + id + " [" + name + "] " + uuid.toString().toUpperCase() + "/"
                + (major != null ? major : "*") + "/" + (minor != null ? minor : "*") + " r=" + radius + "m"
                + (enabled ? "" : " (disabled)");
    }
}
