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

import org.slf4j.Logger;

import java.util.Collection;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Listener helpers.
 */
final class ProximityUtils {

    private ProximityUtils() { }

    static <T> void forEachSilently(Collection<T> listeners, Consumer<T> consumer,
                                    Logger logger, String error) {
        forEachSilently(listeners, consumer, ex -> {
            logger.warn(error, ex);
        });
    }

    static <T, V> void forEachSilently(Collection<T> listeners, BiConsumer<T, V> consumer, V value,
                                       Logger logger, String error) {
        forEachSilently(listeners, listener -> consumer.accept(listener, value), logger, error);
    }

    static <T> void forEachSilently(Collection<T> objects, Consumer<T> func, Consumer<Exception> errorHandler) {
        objects.forEach(listener -> {
            try {
                func.accept(listener);
            } catch (Exception ex) {
                errorHandler.accept(ex);
            }
        });
    }

}
