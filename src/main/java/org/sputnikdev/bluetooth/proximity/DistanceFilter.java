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
 * A recursive filter of distance measurements. Each tracked beacon owns its own filter instance,
 * measurements of a beacon are fed in arrival order.
 */
public interface DistanceFilter {

    /**
     * Feeds a new measurement and returns a new estimate. The very first measurement seeds the filter.
     * @param measurement raw distance in meters
     * @return smoothed distance in meters, never negative
     */
    double next(double measurement);

    /**
     * Returns the current estimate.
     * @return current estimate, 0 if the filter has not been seeded
     */
    double current();

    /**
     * Resets the filter to its initial (unseeded) state.
     */
    void reset();

}
