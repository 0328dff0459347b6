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

import dev.mars.parley.core.AgentPresence;
import dev.mars.parley.core.WorkItem;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Sealed hierarchy of the messages exchanged between a gateway and the server.
 *
 * <p>Every permitted record maps to exactly one {@link MessageType}. Handling
 * code matches on the concrete record type and must provide an explicit
 * fallback for anything it does not expect.</p>
 *
 * <pre>{@code
 * if (message instanceof WireMessage.SendToAgent send) {
 *     scheduler.enqueue(send.agentId(), send.toWorkItem());
 * } else if (message instanceof WireMessage.StopAgent stop) {
 *     scheduler.stop(stop.agentId());
 * } else {
 *     logger.warn("Unexpected message: {}", message.type());
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public sealed interface WireMessage {

    MessageType type();

    /**
     * @return true if this message must never be queued for later delivery
     */
    default boolean isControl() {
        return type().isControl();
    }

    // ========== CONTROL ==========

    /**
     * First message on every freshly opened channel.
     */
    record Authenticate(String token, String gatewayId, int protocolVersion) implements WireMessage {
        public Authenticate {
            Objects.requireNonNull(token, "Token cannot be null");
        }

        @Override
        public MessageType type() {
            return MessageType.CLIENT_AUTH;
        }

        @Override
        public String toString() {
            return "Authenticate[gatewayId=" + gatewayId + ", protocolVersion=" + protocolVersion + ", token=***]";
        }
    }

    record AuthResult(boolean ok, String error) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_AUTH_RESULT;
        }
    }

    record Ping(long timestamp) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.CLIENT_PING;
        }
    }

    record Pong(long timestamp) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_PONG;
        }
    }

    // ========== GATEWAY -> SERVER ==========

    record RegisterAgent(String agentId, String name, String agentType) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.GATEWAY_REGISTER_AGENT;
        }
    }

    record UnregisterAgent(String agentId) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.GATEWAY_UNREGISTER_AGENT;
        }
    }

    record AgentStatusUpdate(String agentId, AgentPresence status, int queueDepth) implements WireMessage {
        public AgentStatusUpdate {
            Objects.requireNonNull(agentId, "Agent ID cannot be null");
            Objects.requireNonNull(status, "Status cannot be null");
            if (queueDepth < 0) {
                throw new IllegalArgumentException("Queue depth cannot be negative: " + queueDepth);
            }
        }

        @Override
        public MessageType type() {
            return MessageType.GATEWAY_AGENT_STATUS;
        }
    }

    /**
     * Terminal outcome of one work item, successful or not.
     */
    record MessageComplete(String agentId, String messageId, String roomId, String fullContent, boolean error)
            implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.GATEWAY_MESSAGE_COMPLETE;
        }
    }

    // ========== SERVER -> GATEWAY ==========

    record SendToAgent(String agentId, String messageId, String content, String roomId, String senderName)
            implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_SEND_TO_AGENT;
        }

        public WorkItem toWorkItem() {
            Map<String, String> context = new HashMap<>();
            if (roomId != null) {
                context.put(WorkItem.ROOM_ID, roomId);
            }
            if (senderName != null) {
                context.put(WorkItem.SENDER_NAME, senderName);
            }
            return new WorkItem(messageId, content, context);
        }
    }

    record StopAgent(String agentId) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_STOP_AGENT;
        }
    }

    record RemoveAgent(String agentId) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_REMOVE_AGENT;
        }
    }

    record ServerError(String code, String message) implements WireMessage {
        @Override
        public MessageType type() {
            return MessageType.SERVER_ERROR;
        }
    }
}
