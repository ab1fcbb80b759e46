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

import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.ZoneConfig;
import org.sputnikdev.bluetooth.proximity.ZoneMonitor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Zone monitor instance builder.
 */
public class ZoneMonitorBuilder {

    private BeaconTracker tracker;
    private int evaluationRate = ZoneMonitorImpl.EVALUATION_RATE_SEC;
    private double exitMultiplier = ZoneMonitorImpl.EXIT_MULTIPLIER;
    private long dwellTime = ZoneMonitorImpl.DWELL_TIME;
    private boolean evaluateOnDiscovery = true;
    private final List<ZoneConfig> zones = new ArrayList<>();
    private boolean monitoring = true;
    private Clock clock = Clock.systemUTC();
    private boolean shutdownHook = true;

    /**
     * Sets the beacon tracker that zones are evaluated against. Mandatory.
     * Note: the monitor does not start or stop the tracker.
     * @param tracker beacon tracker
     */
    public ZoneMonitorBuilder withTracker(BeaconTracker tracker) {
        this.tracker = tracker;
        return this;
    }

    /**
     * Sets how often zones are evaluated.
     * @param seconds evaluation rate in seconds
     */
    public ZoneMonitorBuilder withEvaluationRate(int seconds) {
        evaluationRate = seconds;
        return this;
    }

    /**
     * Sets exit hysteresis. A zone is left when the distance exceeds radius multiplied by this value.
     * @param exitMultiplier exit multiplier, must not be less than 1
     */
    public ZoneMonitorBuilder withExitMultiplier(double exitMultiplier) {
        this.exitMultiplier = exitMultiplier;
        return this;
    }

    /**
     * Sets how long the driving beacon must stay inside a zone before a dwell event is fired.
     * @param millis dwell time in milliseconds
     */
    public ZoneMonitorBuilder withDwellTime(long millis) {
        dwellTime = millis;
        return this;
    }

    /**
     * If set to true (default), an extra evaluation pass is scheduled whenever a new beacon is discovered.
     * @param evaluateOnDiscovery evaluate on discovery
     */
    public ZoneMonitorBuilder withEvaluateOnDiscovery(boolean evaluateOnDiscovery) {
        this.evaluateOnDiscovery = evaluateOnDiscovery;
        return this;
    }

    public ZoneMonitorBuilder withZones(Collection<ZoneConfig> zones) {
        this.zones.addAll(zones);
        return this;
    }

    /**
     * If set to true (default), monitoring is started.
     * @param monitoring if true, monitoring is started
     */
    public ZoneMonitorBuilder withMonitoring(boolean monitoring) {
        this.monitoring = monitoring;
        return this;
    }

    public ZoneMonitorBuilder withClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * If set to true (default), a JVM shutdown hook disposing the monitor is registered.
     * @param shutdownHook register a shutdown hook
     */
    public ZoneMonitorBuilder withShutdownHook(boolean shutdownHook) {
        this.shutdownHook = shutdownHook;
        return this;
    }

    /**
     * Builds a new instance of the zone monitor.
     * @return a new instance of the zone monitor
     */
    public ZoneMonitor build() {
        Objects.requireNonNull(tracker, "Beacon tracker must be provided");
        Objects.requireNonNull(clock, "Clock must be provided");
        if (evaluationRate <= 0) {
            throw new IllegalArgumentException("Evaluation rate must be positive: " + evaluationRate);
        }
        if (!(exitMultiplier >= 1) || Double.isInfinite(exitMultiplier)) {
            throw new IllegalArgumentException("Exit multiplier must not be less than 1: " + exitMultiplier);
        }
        if (dwellTime < 0) {
            throw new IllegalArgumentException("Dwell time must not be negative: " + dwellTime);
        }
        ZoneMonitorImpl monitor = new ZoneMonitorImpl(tracker);
        monitor.setEvaluationRate(evaluationRate);
        monitor.setExitMultiplier(exitMultiplier);
        monitor.setDwellTime(dwellTime);
        monitor.setEvaluateOnDiscovery(evaluateOnDiscovery);
        monitor.setClock(clock);
        zones.forEach(monitor::registerZone);
        if (monitoring) {
            monitor.startMonitoring();
        }

        if (shutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(monitor::dispose));
        }

        return monitor;
    }

}
