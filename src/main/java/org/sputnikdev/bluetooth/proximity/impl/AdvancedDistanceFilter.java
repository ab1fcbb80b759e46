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

import com.google.common.collect.EvictingQueue;
import org.sputnikdev.bluetooth.proximity.DistanceFilter;

import java.util.Arrays;

/**
 * Default distance filter: an outlier gate, followed by a Kalman filter, followed by a short median window.
 *
 * <p>Accepted measurements are fed into the {@link KalmanDistanceFilter}, the result is the median of
 * the last few Kalman outputs. A measurement outside of [0, max distance] is not fed into either stage,
 * the current Kalman estimate is returned instead.
 */
public class AdvancedDistanceFilter implements DistanceFilter {

    static final double DEFAULT_MAX_DISTANCE = 50.0;
    static final int DEFAULT_MEDIAN_WINDOW = 3;

    private final KalmanDistanceFilter kalmanFilter;
    private final double maxDistance;
    private final int medianWindow;
    private EvictingQueue<Double> samples;
    private double current;

    public AdvancedDistanceFilter() {
        this(new KalmanDistanceFilter(), DEFAULT_MAX_DISTANCE, DEFAULT_MEDIAN_WINDOW);
    }

    /**
     * Creates a new filter.
     * @param kalmanFilter Kalman filter
     * @param maxDistance measurements above this value are treated as outliers
     * @param medianWindow median window size
     */
    public AdvancedDistanceFilter(KalmanDistanceFilter kalmanFilter, double maxDistance, int medianWindow) {
        if (maxDistance <= 0 || medianWindow < 1) {
            throw new IllegalArgumentException("Invalid filter parameters: " + maxDistance + " / " + medianWindow);
        }
        this.kalmanFilter = kalmanFilter;
        this.maxDistance = maxDistance;
        this.medianWindow = medianWindow;
        this.samples = EvictingQueue.create(medianWindow);
    }

    @Override
    public double next(double measurement) {
        if (Double.isNaN(measurement) || measurement < 0 || measurement > maxDistance) {
            if (kalmanFilter.isInitialized()) {
                current = kalmanFilter.current();
                return current;
            }
            current = Double.isNaN(measurement) ? 0 : Math.min(Math.max(0, measurement), maxDistance);
            return current;
        }
        samples.add(kalmanFilter.next(measurement));
        current = median();
        return current;
    }

    @Override
    public double current() {
        return current;
    }

    @Override
    public void reset() {
        kalmanFilter.reset();
        samples = EvictingQueue.create(medianWindow);
        current = 0;
    }

    private double median() {
        Double[] sorted = samples.toArray(new Double[0]);
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

}
