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

package dev.mars.parley.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry of every message type known on the gateway channel.
 *
 * <p>Each constant carries its wire name (the JSON {@code type} discriminator),
 * the direction it travels in, and whether it is a control message. Control
 * messages (authentication and heartbeat) are only meaningful on the channel
 * they were produced for and are never queued while the channel is down.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum MessageType {

    // Control
    CLIENT_AUTH("client:auth", Direction.OUTBOUND, true),
    CLIENT_PING("client:ping", Direction.OUTBOUND, true),
    SERVER_PONG("server:pong", Direction.INBOUND, true),
    SERVER_AUTH_RESULT("server:auth_result", Direction.INBOUND, true),

    // Gateway -> server
    GATEWAY_REGISTER_AGENT("gateway:register_agent", Direction.OUTBOUND, false),
    GATEWAY_UNREGISTER_AGENT("gateway:unregister_agent", Direction.OUTBOUND, false),
    GATEWAY_AGENT_STATUS("gateway:agent_status", Direction.OUTBOUND, false),
    GATEWAY_MESSAGE_COMPLETE("gateway:message_complete", Direction.OUTBOUND, false),

    // Server -> gateway
    SERVER_SEND_TO_AGENT("server:send_to_agent", Direction.INBOUND, false),
    SERVER_STOP_AGENT("server:stop_agent", Direction.INBOUND, false),
    SERVER_REMOVE_AGENT("server:remove_agent", Direction.INBOUND, false),
    SERVER_ERROR("server:error", Direction.INBOUND, false);

    public enum Direction {
        INBOUND,
        OUTBOUND
    }

    private static final Map<String, MessageType> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::getWireName, Function.identity()));

    private final String wireName;
    private final Direction direction;
    private final boolean control;

    MessageType(String wireName, Direction direction, boolean control) {
        this.wireName = wireName;
        this.direction = direction;
        this.control = control;
    }

    public String getWireName() {
        return wireName;
    }

    public Direction getDirection() {
        return direction;
    }

    /**
     * Control messages are discarded rather than queued while disconnected.
     *
     * @return true for authentication and heartbeat messages
     */
    public boolean isControl() {
        return control;
    }

    /**
     * Look up a message type by its wire name.
     *
     * @param wireName the {@code type} field of a frame
     * @return the registered type, or empty if the name is unknown
     */
    public static Optional<MessageType> fromWireName(String wireName) {
        if (wireName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
