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

package dev.mars.parley.core.exceptions;

/**
 * Thrown when an inbound frame cannot be decoded into a known wire message:
 * malformed JSON, a missing or unregistered {@code type}, or a missing or
 * mistyped field.
 *
 * <p>The offending payload is kept (truncated) for diagnostics.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class MessageValidationException extends ParleyException {

    private static final int MAX_PAYLOAD_CHARS = 256;

    private final String payload;

    public MessageValidationException(String message, String payload) {
        super(message);
        this.payload = truncate(payload);
    }

    public MessageValidationException(String message, String payload, Throwable cause) {
        super(message, cause);
        this.payload = truncate(payload);
    }

    public String getPayload() {
        return payload;
    }

    private static String truncate(String payload) {
        if (payload == null || payload.length() <= MAX_PAYLOAD_CHARS) {
            return payload;
        }
        return payload.substring(0, MAX_PAYLOAD_CHARS) + "...";
    }
}
