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

import java.util.Arrays;

/**
 * Externally reported availability of an agent, as carried by
 * {@code gateway:agent_status} messages.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum AgentPresence {

    ONLINE("online"),
    BUSY("busy");

    private final String value;

    AgentPresence(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire value.
     *
     * @param value the wire value, e.g. {@code "busy"}
     * @return the matching presence
     * @throws IllegalArgumentException if the value is not recognised
     */
    public static AgentPresence fromValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown agent presence: " + value));
    }

    /**
     * Presence that corresponds to a scheduler state.
     */
    public static AgentPresence of(AgentState state) {
        return state == AgentState.BUSY ? BUSY : ONLINE;
    }

    @Override
    public String toString() {
        return value;
    }
}
