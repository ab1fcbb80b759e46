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

import org.sputnikdev.bluetooth.proximity.DistanceFilter;

/**
 * One dimensional Kalman filter for a (nearly) static scalar state.
 */
public class KalmanDistanceFilter implements DistanceFilter {

    static final double DEFAULT_PROCESS_NOISE = 0.05;
    static final double DEFAULT_MEASUREMENT_NOISE = 3.0;
    static final double DEFAULT_ERROR_COVARIANCE = 1.0;

    private final double processNoise;
    private final double measurementNoise;
    private final double initialErrorCovariance;

    private double estimate;
    private double errorCovariance;
    private boolean initialized;

    /**
     * Creates a filter with default covariances: process noise 0.05 (beacons are mostly static),
     * measurement noise 3.0 (RSSI is very noisy) and initial error covariance 1.0.
     */
    public KalmanDistanceFilter() {
        this(DEFAULT_PROCESS_NOISE, DEFAULT_MEASUREMENT_NOISE, DEFAULT_ERROR_COVARIANCE);
    }

    /**
     * Creates a filter.
     * @param processNoise process noise covariance
     * @param measurementNoise measurement noise covariance
     * @param initialErrorCovariance initial estimation error covariance
     */
    public KalmanDistanceFilter(double processNoise, double measurementNoise, double initialErrorCovariance) {
        if (processNoise < 0 || measurementNoise <= 0 || initialErrorCovariance < 0) {
            throw new IllegalArgumentException("Invalid covariances: " + processNoise + " / " + measurementNoise
                    + " / " + initialErrorCovariance);
        }
        this.processNoise = processNoise;
        this.measurementNoise = measurementNoise;
        this.initialErrorCovariance = initialErrorCovariance;
        this.errorCovariance = initialErrorCovariance;
    }

    @Override
    public double next(double measurement) {
        if (!initialized) {
            estimate = measurement;
            initialized = true;
        } else {
            // predict
            double predicted = errorCovariance + processNoise;
            // correct
            double gain = predicted / (predicted + measurementNoise);
            estimate += gain * (measurement - estimate);
            errorCovariance = (1 - gain) * predicted;
        }
        return Math.max(0, estimate);
    }

    @Override
    public double current() {
        return Math.max(0, estimate);
    }

    @Override
    public void reset() {
        estimate = 0;
        errorCovariance = initialErrorCovariance;
        initialized = false;
    }

    boolean isInitialized() {
        return initialized;
    }

    double getErrorCovariance() {
        return errorCovariance;
    }

}
