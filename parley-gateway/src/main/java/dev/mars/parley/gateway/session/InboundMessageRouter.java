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

package dev.mars.parley.gateway.session;

import dev.mars.parley.core.WorkItem;
import dev.mars.parley.core.exceptions.AgentQueueFullException;
import dev.mars.parley.core.exceptions.UnknownAgentException;
import dev.mars.parley.gateway.observability.GatewayMetrics;
import dev.mars.parley.gateway.scheduler.AgentScheduler;
import dev.mars.parley.gateway.scheduler.EnqueueOutcome;
import dev.mars.parley.protocol.WireMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Routes inbound application messages to the scheduler.
 *
 * <p>Races with agent removal are expected (the server may still address an
 * agent that was just removed), so unknown agents are logged and ignored.</p>
 */
public class InboundMessageRouter {

    private static final Logger logger = LoggerFactory.getLogger(InboundMessageRouter.class);

    public static final String PROTOCOL_VERSION_MISMATCH = "PROTOCOL_VERSION_MISMATCH";

    private final AgentScheduler scheduler;
    private final Consumer<String> agentRemover;
    private final Runnable protocolMismatchHandler;
    private final GatewayMetrics metrics;

    /**
     * @param scheduler               receives work, stop and removal requests
     * @param agentRemover            performs a server-requested agent removal
     * @param protocolMismatchHandler invoked when the server rejects our protocol version
     * @param metrics                 optional, may be {@code null}
     */
    public InboundMessageRouter(AgentScheduler scheduler, Consumer<String> agentRemover,
                                Runnable protocolMismatchHandler, GatewayMetrics metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.agentRemover = Objects.requireNonNull(agentRemover, "Agent remover cannot be null");
        this.protocolMismatchHandler = Objects.requireNonNull(protocolMismatchHandler,
                "Protocol mismatch handler cannot be null");
        this.metrics = metrics;
    }

    public void route(WireMessage message) {
        if (message instanceof WireMessage.SendToAgent send) {
            handleSendToAgent(send);
        } else if (message instanceof WireMessage.StopAgent stop) {
            handleStopAgent(stop.agentId());
        } else if (message instanceof WireMessage.RemoveAgent remove) {
            logger.info("Server requested removal of agent {}", remove.agentId());
            agentRemover.accept(remove.agentId());
        } else if (message instanceof WireMessage.ServerError error) {
            handleServerError(error);
        } else {
            logger.warn("Unexpected inbound message type {}", message.type());
        }
    }

    private void handleSendToAgent(WireMessage.SendToAgent message) {
        WorkItem item = message.toWorkItem();
        try {
            EnqueueOutcome outcome = scheduler.enqueue(message.agentId(), item);
            logger.debug("Message {} for agent {}: {}", message.messageId(), message.agentId(), outcome);
            if (metrics != null) {
                metrics.recordAccepted(message.agentId());
            }
        } catch (UnknownAgentException e) {
            logger.debug("Ignoring message {} for unknown agent {}", message.messageId(), message.agentId());
        } catch (AgentQueueFullException e) {
            logger.warn("Message {} rejected: {}", message.messageId(), e.getMessage());
        }
    }

    private void handleStopAgent(String agentId) {
        try {
            scheduler.stop(agentId);
        } catch (UnknownAgentException e) {
            logger.debug("Ignoring stop for unknown agent {}", agentId);
        }
    }

    private void handleServerError(WireMessage.ServerError error) {
        if (PROTOCOL_VERSION_MISMATCH.equals(error.code())) {
            logger.error("Protocol version mismatch, the gateway must be upgraded: {}", error.message());
            protocolMismatchHandler.run();
        } else {
            logger.warn("Server error [{}]: {}", error.code(), error.message());
        }
    }
}
