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
 * A listener of zone transition events. All methods have empty default implementations.
 */
public interface ZoneEventListener {

    /**
     * Fires when a zone is entered.
     * @param event enter event
     */
    default void entered(ZoneEvent event) { }

    /**
     * Fires when a zone is exited, either because the beacon is too far or because it has not been seen
     * for longer than the beacon timeout.
     * @param event exit event
     */
    default void exited(ZoneEvent event) { }

    /**
     * Fires once per inside episode when a zone has been continuously occupied for longer than the dwell time.
     * @param event dwell event
     */
    default void dwelled(ZoneEvent event) { }

}
