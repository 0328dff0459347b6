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

package dev.mars.parley.gateway.scheduler;

import dev.mars.parley.core.AgentState;
import dev.mars.parley.core.WorkItem;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable per-agent record owned by {@link AgentScheduler}. Every field is
 * guarded by the entry's own monitor.
 */
final class AgentQueueEntry {

    final String agentId;
    final AgentAdapter adapter;
    final Deque<WorkItem> queue = new ArrayDeque<>();
    AgentState state = AgentState.IDLE;
    WorkCompletion inFlight;
    boolean removed;

    AgentQueueEntry(String agentId, AgentAdapter adapter) {
        this.agentId = agentId;
        this.adapter = adapter;
    }

    AgentSnapshot snapshot() {
        return new AgentSnapshot(agentId, adapter.type(), state, queue.size());
    }
}
