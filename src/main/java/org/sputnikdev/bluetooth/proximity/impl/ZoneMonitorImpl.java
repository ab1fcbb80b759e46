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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sputnikdev.bluetooth.proximity.BeaconDiscoveryListener;
import org.sputnikdev.bluetooth.proximity.BeaconTracker;
import org.sputnikdev.bluetooth.proximity.TrackedBeacon;
import org.sputnikdev.bluetooth.proximity.ZoneConfig;
import org.sputnikdev.bluetooth.proximity.ZoneEvent;
import org.sputnikdev.bluetooth.proximity.ZoneEventListener;
import org.sputnikdev.bluetooth.proximity.ZoneEventType;
import org.sputnikdev.bluetooth.proximity.ZoneMonitor;
import org.sputnikdev.bluetooth.proximity.ZonePresenceListener;
import org.sputnikdev.bluetooth.proximity.ZoneState;
import org.sputnikdev.bluetooth.proximity.ZoneStatus;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Thread safe zone monitor implementation class.
 *
 * <p>Zone runtime state is changed only under the evaluation lock: by an evaluation pass or by zone registration.
 * Each zone publishes an immutable {@link ZoneStatus} so that state queries never block.
 * Events produced by a pass are dispatched after the whole pass is computed, still under the lock,
 * so that {@link #stopMonitoring()} returning guarantees that no further callbacks are made.
 */
class ZoneMonitorImpl implements ZoneMonitor {

    static final int EVALUATION_RATE_SEC = 10;
    static final double EXIT_MULTIPLIER = 1.2;
    static final long DWELL_TIME = 1000 * 10;

    // nearest first, then the most recently seen, then identity order
    private static final Comparator<TrackedBeacon> NEAREST = Comparator.comparingDouble(TrackedBeacon::getDistance)
            .thenComparing(Comparator.comparingLong(TrackedBeacon::getLastSeen).reversed())
            .thenComparing(TrackedBeacon::getIdentity);

    private Logger logger = LoggerFactory.getLogger(ZoneMonitorImpl.class);

    private final BeaconTracker tracker;
    private final Map<String, ZoneHolder> zones = new ConcurrentHashMap<>();
    private final Set<ZoneEventListener> eventListeners = new CopyOnWriteArraySet<>();
    private final Set<ZonePresenceListener> presenceListeners = new CopyOnWriteArraySet<>();
    private final ScheduledExecutorService evaluationScheduler = Executors.newSingleThreadScheduledExecutor();
    private final ReentrantLock evaluationLock = new ReentrantLock();
    private final AtomicBoolean insideAnyZone = new AtomicBoolean();
    private final BeaconDiscoveryListener evaluationTrigger = new EvaluationTrigger();

    private volatile boolean monitoring;
    private ScheduledFuture<?> evaluationFuture;

    private Clock clock = Clock.systemUTC();
    private int evaluationRate = EVALUATION_RATE_SEC;
    private double exitMultiplier = EXIT_MULTIPLIER;
    private long dwellTime = DWELL_TIME;
    private boolean evaluateOnDiscovery = true;

    ZoneMonitorImpl(BeaconTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    @Override
    public void registerZone(ZoneConfig zone) {
        Objects.requireNonNull(zone, "zone");
        evaluationLock.lock();
        try {
            ZoneHolder holder = zones.get(zone.getId());
            if (holder == null) {
                zones.put(zone.getId(), new ZoneHolder(zone));
                logger.info("Zone registered: {}", zone);
            } else {
                if (!holder.config.hasSamePattern(zone)) {
                    logger.debug("Zone beacon pattern changed, resetting its state: {}", zone.getId());
                    holder.reset();
                }
                holder.config = zone;
                holder.publish();
                logger.info("Zone updated: {}", zone);
            }
            updatePresence();
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public boolean unregisterZone(String zoneId) {
        evaluationLock.lock();
        try {
            ZoneHolder removed = zones.remove(zoneId);
            if (removed != null) {
                logger.info("Zone unregistered: {}", removed.config);
                updatePresence();
            }
            return removed != null;
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public void updateZones(Collection<ZoneConfig> newZones) {
        Set<String> ids = newZones.stream().map(ZoneConfig::getId).collect(Collectors.toSet());
        evaluationLock.lock();
        try {
            zones.keySet().stream().filter(id -> !ids.contains(id)).collect(Collectors.toList())
                    .forEach(this::unregisterZone);
            newZones.forEach(this::registerZone);
            logger.debug("Zones updated: {}", zones.size());
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public void clearZones() {
        evaluationLock.lock();
        try {
            zones.clear();
            logger.info("All zones cleared");
            updatePresence();
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public List<ZoneConfig> getZones() {
        return zones.values().stream()
                .map(holder -> holder.config)
                .sorted(Comparator.comparing(ZoneConfig::getId))
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public Optional<ZoneConfig> getZone(String zoneId) {
        return Optional.ofNullable(zones.get(zoneId)).map(holder -> holder.config);
    }

    @Override
    public void startMonitoring() {
        evaluationLock.lock();
        try {
            if (evaluationScheduler.isShutdown()) {
                throw new IllegalStateException("Zone monitor has been disposed");
            }
            if (monitoring) {
                logger.debug("Zone monitor is already monitoring");
                return;
            }
            monitoring = true;
            if (evaluateOnDiscovery) {
                tracker.addDiscoveryListener(evaluationTrigger);
            }
            evaluationFuture = evaluationScheduler.scheduleWithFixedDelay(this::runEvaluation,
                    evaluationRate, evaluationRate, TimeUnit.SECONDS);
            logger.info("Zone monitoring started: {} zones, evaluation rate {}s", zones.size(), evaluationRate);
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public void stopMonitoring() {
        evaluationLock.lock();
        try {
            if (!monitoring) {
                logger.debug("Zone monitor is not monitoring");
                return;
            }
            monitoring = false;
            tracker.removeDiscoveryListener(evaluationTrigger);
            if (evaluationFuture != null) {
                evaluationFuture.cancel(false);
                evaluationFuture = null;
            }
            logger.info("Zone monitoring stopped");
        } finally {
            evaluationLock.unlock();
        }
    }

    @Override
    public boolean isMonitoring() {
        return monitoring;
    }

    @Override
    public void addZoneEventListener(ZoneEventListener listener) {
        eventListeners.add(listener);
    }

    @Override
    public void removeZoneEventListener(ZoneEventListener listener) {
        eventListeners.remove(listener);
    }

    @Override
    public void addPresenceListener(ZonePresenceListener listener) {
        presenceListeners.add(listener);
    }

    @Override
    public void removePresenceListener(ZonePresenceListener listener) {
        presenceListeners.remove(listener);
    }

    @Override
    public Optional<ZoneStatus> currentState(String zoneId) {
        return Optional.ofNullable(zones.get(zoneId)).map(holder -> holder.status);
    }

    @Override
    public Map<String, ZoneStatus> getZoneStatuses() {
        return zones.values().stream()
                .sorted(Comparator.comparing(holder -> holder.config.getId()))
                .collect(ImmutableMap.toImmutableMap(holder -> holder.config.getId(), holder -> holder.status));
    }

    @Override
    public boolean isInsideAnyZone() {
        return insideAnyZone.get();
    }

    @Override
    public Set<String> getActiveZones() {
        return zones.values().stream()
                .filter(holder -> holder.config.isEnabled() && holder.status.isInside())
                .map(holder -> holder.config.getId())
                .sorted()
                .collect(ImmutableSet.toImmutableSet());
    }

    @Override
    public String getSummary() {
        Map<String, ZoneStatus> statuses = getZoneStatuses();
        Set<String> active = getActiveZones();
        StringBuilder summary = new StringBuilder();
        summary.append("Zone monitor: ").append(monitoring ? "monitoring" : "idle")
                .append(", zones: ").append(statuses.size())
                .append(", inside: ").append(active.isEmpty() ? "none" : String.join(", ", active));
        for (ZoneStatus status : statuses.values()) {
            ZoneHolder holder = zones.get(status.getZoneId());
            if (holder == null) {
                continue;
            }
            ZoneConfig zone = holder.config;
            summary.append(System.lineSeparator()).append("  ").append(zone.getId())
                    .append(" [").append(zone.getName()).append("] ").append(status.getState())
                    .append(String.format(" radius %.1fm", zone.getRadius()));
            if (status.getDistance() != null) {
                summary.append(String.format(", distance %.2fm", status.getDistance()));
            }
            if (!zone.isEnabled()) {
                summary.append(", disabled");
            }
        }
        return summary.toString();
    }

    @Override
    public void dispose() {
        logger.debug("Disposing zone monitor");
        stopMonitoring();
        evaluationScheduler.shutdownNow();
        eventListeners.clear();
        presenceListeners.clear();
        zones.clear();
        logger.debug("Zone monitor has been disposed");
    }

    void evaluate() {
        evaluationLock.lock();
        try {
            if (!monitoring) {
                return;
            }
            List<TrackedBeacon> snapshot = tracker.snapshot();
            long now = clock.millis();
            List<ZoneEvent> events = new ArrayList<>();
            for (ZoneHolder holder : zones.values()) {
                if (holder.config.isEnabled()) {
                    evaluate(holder, snapshot, now, events);
                }
            }
            logger.debug("Evaluation pass: {} beacons, {} zones, {} events", snapshot.size(), zones.size(),
                    events.size());
            for (ZoneEvent event : events) {
                if (!monitoring) {
                    // stopped by a listener
                    break;
                }
                notifyZoneEvent(event);
            }
            updatePresence();
        } finally {
            evaluationLock.unlock();
        }
    }

    void setClock(Clock clock) {
        this.clock = clock;
    }

    void setEvaluationRate(int evaluationRate) {
        this.evaluationRate = evaluationRate;
    }

    void setExitMultiplier(double exitMultiplier) {
        this.exitMultiplier = exitMultiplier;
    }

    void setDwellTime(long dwellTime) {
        this.dwellTime = dwellTime;
    }

    void setEvaluateOnDiscovery(boolean evaluateOnDiscovery) {
        this.evaluateOnDiscovery = evaluateOnDiscovery;
    }

    private void evaluate(ZoneHolder holder, List<TrackedBeacon> snapshot, long now, List<ZoneEvent> events) {
        ZoneConfig zone = holder.config;
        Optional<TrackedBeacon> nearest = snapshot.stream()
                .filter(beacon -> zone.matches(beacon.getIdentity()))
                .min(NEAREST);

        if (holder.state != ZoneState.INSIDE) {
            if (nearest.isPresent()) {
                TrackedBeacon beacon = nearest.get();
                holder.beacon = beacon;
                if (beacon.getDistance() <= zone.getRadius()) {
                    holder.state = ZoneState.INSIDE;
                    holder.enteredAt = now;
                    holder.lastConfirmed = beacon.getLastSeen();
                    holder.dwellNotified = false;
                    events.add(new ZoneEvent(ZoneEventType.ENTER, zone, beacon, now));
                } else {
                    holder.state = ZoneState.OUTSIDE;
                }
            }
        } else if (!nearest.isPresent()) {
            logger.debug("Signal lost in zone: {}", zone.getId());
            events.add(new ZoneEvent(ZoneEventType.EXIT, zone, holder.beacon, now));
            holder.exit();
            holder.beacon = null;
        } else {
            TrackedBeacon beacon = nearest.get();
            holder.beacon = beacon;
            if (beacon.getDistance() > zone.getRadius() * exitMultiplier) {
                events.add(new ZoneEvent(ZoneEventType.EXIT, zone, beacon, now));
                holder.exit();
            } else {
                if (beacon.getDistance() <= zone.getRadius()) {
                    holder.lastConfirmed = beacon.getLastSeen();
                }
                if (!holder.dwellNotified && now - holder.enteredAt >= dwellTime) {
                    holder.dwellNotified = true;
                    events.add(new ZoneEvent(ZoneEventType.DWELL, zone, beacon, now));
                }
            }
        }
        holder.publish();
    }

    private void notifyZoneEvent(ZoneEvent event) {
        logger.info("Zone event: {}", event);
        switch (event.getType()) {
            case ENTER:
                ProximityUtils.forEachSilently(eventListeners, ZoneEventListener::entered, event,
                        logger, "Error in zone event listener (entered)");
                break;
            case EXIT:
                ProximityUtils.forEachSilently(eventListeners, ZoneEventListener::exited, event,
                        logger, "Error in zone event listener (exited)");
                break;
            case DWELL:
                ProximityUtils.forEachSilently(eventListeners, ZoneEventListener::dwelled, event,
                        logger, "Error in zone event listener (dwelled)");
                break;
            default:
                throw new IllegalStateException("Unknown zone event type: " + event.getType());
        }
    }

    private void updatePresence() {
        boolean inside = zones.values().stream()
                .anyMatch(holder -> holder.config.isEnabled() && holder.state == ZoneState.INSIDE);
        if (insideAnyZone.getAndSet(inside) != inside) {
            logger.info("Inside any zone: {}", inside);
            if (monitoring) {
                ProximityUtils.forEachSilently(presenceListeners, ZonePresenceListener::insideAnyZoneChanged, inside,
                        logger, "Error in zone presence listener");
            }
        }
    }

    private void runEvaluation() {
        try {
            evaluate();
        } catch (Exception ex) {
            logger.warn("Zone evaluation job error", ex);
        }
    }

    private final class EvaluationTrigger implements BeaconDiscoveryListener {

        @Override
        public void discovered(TrackedBeacon beacon) {
            if (!monitoring) {
                return;
            }
            try {
                evaluationScheduler.execute(ZoneMonitorImpl.this::runEvaluation);
            } catch (RejectedExecutionException ex) {
                logger.debug("Zone monitor has been disposed, skipping evaluation: {}", beacon);
            }
        }
    }

    private static final class ZoneHolder {

        private volatile ZoneConfig config;
        private volatile ZoneStatus status;
        private ZoneState state = ZoneState.UNKNOWN;
        private TrackedBeacon beacon;
        private Long enteredAt;
        private Long lastConfirmed;
        private boolean dwellNotified;

        private ZoneHolder(ZoneConfig config) {
            this.config = config;
            publish();
        }

        private void exit() {
            state = ZoneState.OUTSIDE;
            enteredAt = null;
            dwellNotified = false;
        }

        private void reset() {
            state = ZoneState.UNKNOWN;
            beacon = null;
            enteredAt = null;
            lastConfirmed = null;
            dwellNotified = false;
        }

        private void publish() {
            status = new ZoneStatus(config.getId(), state, beacon, enteredAt, lastConfirmed, dwellNotified);
        }
    }

}
