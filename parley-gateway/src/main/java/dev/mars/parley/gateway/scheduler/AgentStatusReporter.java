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

import dev.mars.parley.core.AgentPresence;
import dev.mars.parley.gateway.connection.MessageSink;
import dev.mars.parley.gateway.connection.SendResult;
import dev.mars.parley.protocol.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes scheduler transitions as {@code gateway:agent_status} messages,
 * skipping a message identical to the last one sent for the same agent.
 */
public class AgentStatusReporter implements AgentStateListener {

    private static final Logger logger = LoggerFactory.getLogger(AgentStatusReporter.class);

    private final MessageSink sink;
    private final Map<String, WireMessage.AgentStatusUpdate> lastReported = new ConcurrentHashMap<>();

    public AgentStatusReporter(MessageSink sink) {
        this.sink = Objects.requireNonNull(sink, "Message sink cannot be null");
    }

    @Override
    public void onStateChange(String agentId, AgentPresence status, int queueDepth) {
        WireMessage.AgentStatusUpdate update = new WireMessage.AgentStatusUpdate(agentId, status, queueDepth);
        WireMessage.AgentStatusUpdate previous = lastReported.put(agentId, update);
        if (update.equals(previous)) {
            logger.debug("Suppressing repeated status {} for agent {}", update, agentId);
            return;
        }
        SendResult result = sink.send(update);
        logger.debug("Agent {} is {} (queue depth {}): {}", agentId, status, queueDepth, result);
    }

    @Override
    public void onAgentRemoved(String agentId) {
        lastReported.remove(agentId);
    }

    /**
     * Last status published for an agent, or {@code null} if none.
     */
    public WireMessage.AgentStatusUpdate lastReported(String agentId) {
        return lastReported.get(agentId);
    }
}
