/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.parley.gateway.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Thread-safe set of listeners for one kind of event.
 *
 * <p>A listener that throws is logged and does not prevent the remaining
 * listeners from being notified.</p>
 *
 * @param <T> the listener type
 */
public final class ListenerRegistry<T> {

    private static final Logger logger = LoggerFactory.getLogger(ListenerRegistry.class);

    private final String name;
    private final List<T> listeners = new CopyOnWriteArrayList<>();

    public ListenerRegistry(String name) {
        this.name = name;
    }

    public Subscription add(T listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void notifyEach(Consumer<T> action) {
        for (T listener : listeners) {
            try {
                action.accept(listener);
            } catch (RuntimeException e) {
                logger.error("Listener for '{}' failed", name, e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }

    public boolean isEmpty() {
        return listeners.isEmpty();
    }
}
