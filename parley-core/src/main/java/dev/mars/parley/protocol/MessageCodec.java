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
import dev.mars.parley.core.exceptions.MessageValidationException;
import io.vertx.core.json.JsonObject;

/**
 * JSON codec for {@link WireMessage}s.
 *
 * <p>Every frame is a JSON object whose {@code type} field names a registered
 * {@link MessageType}. Decoding is strict about the fields each type
 * requires and lenient about extra fields, so newer servers can add
 * information without breaking older gateways.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class MessageCodec {

    static final String TYPE = "type";

    private MessageCodec() {
        // Utility class
    }

    // ============================================================
    // Encode
    // ============================================================

    /**
     * Encode a message as a JSON text frame.
     *
     * @param message the message to encode
     * @return the JSON representation
     */
    public static String encode(WireMessage message) {
        return toJson(message).encode();
    }

    /**
     * Encode a message as a JSON object.
     *
     * @param message the message to encode
     * @return a new JSON object including the {@code type} discriminator
     */
    public static JsonObject toJson(WireMessage message) {
        JsonObject json = new JsonObject().put(TYPE, message.type().getWireName());
        if (message instanceof WireMessage.Authenticate auth) {
            json.put("token", auth.token())
                    .put("protocolVersion", auth.protocolVersion());
            putIfPresent(json, "gatewayId", auth.gatewayId());
        } else if (message instanceof WireMessage.AuthResult result) {
            json.put("ok", result.ok());
            putIfPresent(json, "error", result.error());
        } else if (message instanceof WireMessage.Ping ping) {
            json.put("ts", ping.timestamp());
        } else if (message instanceof WireMessage.Pong pong) {
            json.put("ts", pong.timestamp());
        } else if (message instanceof WireMessage.RegisterAgent register) {
            json.put("agentId", register.agentId())
                    .put("name", register.name())
                    .put("agentType", register.agentType());
        } else if (message instanceof WireMessage.UnregisterAgent unregister) {
            json.put("agentId", unregister.agentId());
        } else if (message instanceof WireMessage.AgentStatusUpdate status) {
            json.put("agentId", status.agentId())
                    .put("status", status.status().getValue())
                    .put("queueDepth", status.queueDepth());
        } else if (message instanceof WireMessage.MessageComplete complete) {
            json.put("agentId", complete.agentId())
                    .put("messageId", complete.messageId())
                    .put("fullContent", complete.fullContent())
                    .put("error", complete.error());
            putIfPresent(json, "roomId", complete.roomId());
        } else if (message instanceof WireMessage.SendToAgent send) {
            json.put("agentId", send.agentId())
                    .put("messageId", send.messageId())
                    .put("content", send.content());
            putIfPresent(json, "roomId", send.roomId());
            putIfPresent(json, "senderName", send.senderName());
        } else if (message instanceof WireMessage.StopAgent stop) {
            json.put("agentId", stop.agentId());
        } else if (message instanceof WireMessage.RemoveAgent remove) {
            json.put("agentId", remove.agentId());
        } else if (message instanceof WireMessage.ServerError error) {
            json.put("code", error.code())
                    .put("message", error.message());
        } else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }
        return json;
    }

    // ============================================================
    // Decode
    // ============================================================

    /**
     * Decode a JSON text frame.
     *
     * @param text the raw frame
     * @return the decoded message
     * @throws MessageValidationException if the frame is malformed, its type is
     *                                    not registered, or a field is missing or invalid
     */
    public static WireMessage decode(String text) throws MessageValidationException {
        if (text == null || text.isBlank()) {
            throw new MessageValidationException("Empty frame", text);
        }
        JsonObject json;
        try {
            json = new JsonObject(text);
        } catch (RuntimeException e) {
            throw new MessageValidationException("Frame is not a JSON object", text, e);
        }
        return fromJson(json, text);
    }

    static WireMessage fromJson(JsonObject json, String raw) throws MessageValidationException {
        Object typeValue = json.getValue(TYPE);
        if (!(typeValue instanceof String wireName)) {
            throw new MessageValidationException("Missing message type", raw);
        }
        MessageType type = MessageType.fromWireName(wireName)
                .orElseThrow(() -> new MessageValidationException("Unknown message type: " + wireName, raw));

        return switch (type) {
            case CLIENT_AUTH -> new WireMessage.Authenticate(
                    requireString(json, "token", raw),
                    optionalString(json, "gatewayId", raw),
                    (int) requireLong(json, "protocolVersion", raw));
            case SERVER_AUTH_RESULT -> new WireMessage.AuthResult(
                    requireBoolean(json, "ok", raw),
                    optionalString(json, "error", raw));
            case CLIENT_PING -> new WireMessage.Ping(requireLong(json, "ts", raw));
            case SERVER_PONG -> new WireMessage.Pong(requireLong(json, "ts", raw));
            case GATEWAY_REGISTER_AGENT -> new WireMessage.RegisterAgent(
                    requireId(json, "agentId", raw),
                    requireString(json, "name", raw),
                    requireString(json, "agentType", raw));
            case GATEWAY_UNREGISTER_AGENT -> new WireMessage.UnregisterAgent(requireId(json, "agentId", raw));
            case GATEWAY_AGENT_STATUS -> decodeAgentStatus(json, raw);
            case GATEWAY_MESSAGE_COMPLETE -> new WireMessage.MessageComplete(
                    requireId(json, "agentId", raw),
                    requireId(json, "messageId", raw),
                    optionalString(json, "roomId", raw),
                    requireString(json, "fullContent", raw),
                    requireBoolean(json, "error", raw));
            case SERVER_SEND_TO_AGENT -> new WireMessage.SendToAgent(
                    requireId(json, "agentId", raw),
                    requireId(json, "messageId", raw),
                    requireString(json, "content", raw),
                    optionalString(json, "roomId", raw),
                    optionalString(json, "senderName", raw));
            case SERVER_STOP_AGENT -> new WireMessage.StopAgent(requireId(json, "agentId", raw));
            case SERVER_REMOVE_AGENT -> new WireMessage.RemoveAgent(requireId(json, "agentId", raw));
            case SERVER_ERROR -> new WireMessage.ServerError(
                    requireString(json, "code", raw),
                    requireString(json, "message", raw));
        };
    }

    private static WireMessage decodeAgentStatus(JsonObject json, String raw) throws MessageValidationException {
        String agentId = requireId(json, "agentId", raw);
        String status = requireString(json, "status", raw);
        long queueDepth = requireLong(json, "queueDepth", raw);
        if (queueDepth < 0 || queueDepth > Integer.MAX_VALUE) {
            throw new MessageValidationException("Invalid queueDepth: " + queueDepth, raw);
        }
        AgentPresence presence;
        try {
            presence = AgentPresence.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new MessageValidationException("Invalid agent status: " + status, raw, e);
        }
        return new WireMessage.AgentStatusUpdate(agentId, presence, (int) queueDepth);
    }

    // ============================================================
    // Field helpers
    // ============================================================

    private static String requireString(JsonObject json, String field, String raw) throws MessageValidationException {
        Object value = json.getValue(field);
        if (value == null) {
            throw new MessageValidationException("Missing field: " + field, raw);
        }
        if (!(value instanceof String)) {
            throw new MessageValidationException("Field must be a string: " + field, raw);
        }
        return (String) value;
    }

    private static String requireId(JsonObject json, String field, String raw) throws MessageValidationException {
        String value = requireString(json, field, raw);
        if (value.isBlank()) {
            throw new MessageValidationException("Field cannot be blank: " + field, raw);
        }
        return value;
    }

    private static String optionalString(JsonObject json, String field, String raw) throws MessageValidationException {
        Object value = json.getValue(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new MessageValidationException("Field must be a string: " + field, raw);
        }
        return (String) value;
    }

    private static long requireLong(JsonObject json, String field, String raw) throws MessageValidationException {
        Object value = json.getValue(field);
        if (value == null) {
            throw new MessageValidationException("Missing field: " + field, raw);
        }
        if (!(value instanceof Number number)) {
            throw new MessageValidationException("Field must be a number: " + field, raw);
        }
        if (number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new MessageValidationException("Field must be an integer: " + field, raw);
        }
        return number.longValue();
    }

    private static boolean requireBoolean(JsonObject json, String field, String raw) throws MessageValidationException {
        Object value = json.getValue(field);
        if (!(value instanceof Boolean)) {
            throw new MessageValidationException("Field must be a boolean: " + field, raw);
        }
        return (Boolean) value;
    }

    private static void putIfPresent(JsonObject json, String field, String value) {
        if (value != null) {
            json.put(field, value);
        }
    }
}
