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
 * Thrown when a work item is offered to a busy agent whose pending queue
 * is already at capacity. The item is not queued and must be reported back
 * to its submitter as a terminal failure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class AgentQueueFullException extends ParleyException {

    private final String agentId;
    private final int capacity;

    public AgentQueueFullException(String agentId, int capacity) {
        super(String.format("Agent queue is full for '%s' (capacity %d)", agentId, capacity));
        this.agentId = agentId;
        this.capacity = capacity;
    }

    public String getAgentId() {
        return agentId;
    }

    public int getCapacity() {
        return capacity;
    }
}
