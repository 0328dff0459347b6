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

import java.util.Map;
import java.util.Objects;

/**
 * A unit of work addressed to one agent.
 *
 * <p>The content is opaque to the scheduler. The correlation identifier ties
 * the eventual result back to the message that caused it, and the context
 * carries optional routing details (room, sender) that adapters may use.</p>
 *
 * @param correlationId identifier of the originating message, never blank
 * @param content       opaque payload handed to the adapter
 * @param context       immutable routing details, possibly empty
 */
public record WorkItem(String correlationId, String content, Map<String, String> context) {

    public static final String ROOM_ID = "roomId";
    public static final String SENDER_NAME = "senderName";

    public WorkItem {
        Objects.requireNonNull(correlationId, "Correlation ID cannot be null");
        Objects.requireNonNull(content, "Content cannot be null");
        if (correlationId.isBlank()) {
            throw new IllegalArgumentException("Correlation ID cannot be blank");
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    public WorkItem(String correlationId, String content) {
        this(correlationId, content, Map.of());
    }

    public String roomId() {
        return context.get(ROOM_ID);
    }

    public String senderName() {
        return context.get(SENDER_NAME);
    }
}
