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

package dev.mars.parley.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of the gateway's connection to the coordinating server.
 *
 * <p>The normal path is {@code DISCONNECTED -> CONNECTING -> CONNECTED}. An
 * unexpected close moves a session through {@code RECONNECTING} and back to
 * {@code CONNECTING}. {@code DISCONNECTED} is entered on an explicit
 * disconnect, when the retry budget is exhausted, or when the session can no
 * longer authenticate.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ConnectionStatus {

    DISCONNECTED("disconnected"),

    /**
     * A transport channel is being opened or the session is waiting for the
     * authentication result on an open channel.
     */
    CONNECTING("connecting"),

    /**
     * The channel is open and authenticated.
     */
    CONNECTED("connected"),

    /**
     * The channel was lost and a retry is scheduled.
     */
    RECONNECTING("reconnecting");

    // ── Transition table ───────────────────────────────────────────────

    private static final Map<ConnectionStatus, Set<ConnectionStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<ConnectionStatus, Set<ConnectionStatus>>(ConnectionStatus.class);
        map.put(DISCONNECTED, EnumSet.of(CONNECTING));
        map.put(CONNECTING, EnumSet.of(CONNECTED, RECONNECTING, DISCONNECTED));
        map.put(CONNECTED, EnumSet.of(RECONNECTING, DISCONNECTED));
        map.put(RECONNECTING, EnumSet.of(CONNECTING, DISCONNECTED));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    private final String value;

    ConnectionStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Check whether moving from this status to {@code target} is part of the
     * connection state machine.
     *
     * @param target the requested status
     * @return true if the transition is valid
     */
    public boolean canTransitionTo(ConnectionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<ConnectionStatus> getValidTransitions() {
        return TRANSITIONS.get(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
