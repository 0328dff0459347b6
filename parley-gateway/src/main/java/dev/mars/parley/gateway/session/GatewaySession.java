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

import dev.mars.parley.core.ConnectionStatus;
import dev.mars.parley.core.exceptions.DuplicateAgentException;
import dev.mars.parley.gateway.connection.ConnectionClient;
import dev.mars.parley.gateway.connection.Subscription;
import dev.mars.parley.gateway.observability.GatewayMetrics;
import dev.mars.parley.gateway.scheduler.AgentAdapter;
import dev.mars.parley.gateway.scheduler.AgentScheduler;
import dev.mars.parley.gateway.scheduler.AgentStatusReporter;
import dev.mars.parley.gateway.scheduler.SchedulerOptions;
import dev.mars.parley.gateway.scheduler.WorkOutcome;
import dev.mars.parley.protocol.WireMessage;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires a {@link ConnectionClient} to an {@link AgentScheduler}.
 *
 * <p>The session owns the agent registrations. Every successful handshake
 * re-registers all agents under their existing ids, so the server can rebuild
 * its view after a restart or a reconnect. Work outcomes are reported back as
 * {@code gateway:message_complete}, including rejections caused by a full
 * agent queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-11
 * @version 1.0
 */
public class GatewaySession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GatewaySession.class);

    private final ConnectionClient client;
    private final AgentScheduler scheduler;
    private final AgentStatusReporter reporter;
    private final InboundMessageRouter router;
    private final GatewayMetrics metrics;
    private final Map<String, WireMessage.RegisterAgent> registrations = new LinkedHashMap<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param metrics optional, may be {@code null}
     */
    public GatewaySession(Vertx vertx, ConnectionClient client, SchedulerOptions schedulerOptions,
                          GatewayMetrics metrics) {
        this.client = Objects.requireNonNull(client, "Connection client cannot be null");
        this.metrics = metrics;
        this.reporter = new AgentStatusReporter(client);
        this.scheduler = new AgentScheduler(vertx, schedulerOptions, reporter, this::onOutcome);
        this.router = new InboundMessageRouter(scheduler, this::removeAgent, client::disconnect, metrics);

        subscriptions.add(client.onMessage(router::route));
        subscriptions.add(client.onStatusChange(this::onStatusChange));
        subscriptions.add(client.onReconnect(this::onReconnect));
        subscriptions.add(client.onQueueOverflow(message -> {
            logger.warn("Too many pending messages, dropped {}", message.type());
            if (metrics != null) {
                metrics.recordOutboundDropped();
            }
        }));
        subscriptions.add(client.onValidationError(e -> {
            if (metrics != null) {
                metrics.recordInvalidInbound();
            }
        }));
    }

    /**
     * Starts connecting. Agents added before or after this call are registered
     * as soon as the handshake succeeds.
     */
    public void start(String token) {
        ensureOpen();
        logger.info("Starting gateway session ({} agent(s))", agentCount());
        client.connect(token);
    }

    /**
     * Registers an agent with the scheduler and announces it to the server.
     *
     * @throws DuplicateAgentException if the id is already in use
     */
    public void addAgent(String agentId, String name, AgentAdapter adapter) throws DuplicateAgentException {
        ensureOpen();
        Objects.requireNonNull(name, "Agent name cannot be null");
        scheduler.registerAgent(agentId, adapter);
        WireMessage.RegisterAgent registration = new WireMessage.RegisterAgent(agentId, name, adapter.type());
        synchronized (registrations) {
            registrations.put(agentId, registration);
        }
        // while disconnected the next handshake registers it
        if (client.isConnected()) {
            client.send(registration);
        }
        logger.info("Added agent {} ({}, {})", name, adapter.type(), agentId);
    }

    /**
     * Removes an agent and tells the server. Unknown ids are ignored.
     *
     * @return {@code true} if the agent was registered
     */
    public boolean removeAgent(String agentId) {
        WireMessage.RegisterAgent registration;
        synchronized (registrations) {
            registration = registrations.remove(agentId);
        }
        boolean removed = scheduler.removeAgent(agentId);
        if (registration != null) {
            client.send(new WireMessage.UnregisterAgent(agentId));
            logger.info("Removed agent {} ({})", registration.name(), agentId);
        }
        return removed || registration != null;
    }

    public List<String> agentIds() {
        synchronized (registrations) {
            return new ArrayList<>(registrations.keySet());
        }
    }

    public int agentCount() {
        synchronized (registrations) {
            return registrations.size();
        }
    }

    public AgentScheduler getScheduler() {
        return scheduler;
    }

    public AgentStatusReporter getReporter() {
        return reporter;
    }

    public ConnectionClient getClient() {
        return client;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Disposes every agent and disconnects. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            logger.debug("Gateway session already closed");
            return;
        }
        logger.info("Closing gateway session");
        subscriptions.forEach(Subscription::unsubscribe);
        subscriptions.clear();
        scheduler.shutdown();
        synchronized (registrations) {
            registrations.clear();
        }
        client.disconnect();
        logger.info("Gateway session closed");
    }

    private void onStatusChange(ConnectionStatus status) {
        if (metrics != null) {
            metrics.recordStatus(status);
        }
        if (status == ConnectionStatus.CONNECTED) {
            registerAll();
        }
    }

    private void onReconnect() {
        logger.info("Connection recovered");
        if (metrics != null) {
            metrics.recordReconnect();
        }
    }

    private void registerAll() {
        List<WireMessage.RegisterAgent> current;
        synchronized (registrations) {
            current = new ArrayList<>(registrations.values());
        }
        for (WireMessage.RegisterAgent registration : current) {
            client.send(registration);
        }
        if (!current.isEmpty()) {
            logger.info("Registered {} agent(s) with the server", current.size());
        }
    }

    private void onOutcome(WorkOutcome outcome) {
        if (metrics != null) {
            metrics.recordOutcome(outcome);
        }
        client.send(new WireMessage.MessageComplete(outcome.agentId(), outcome.item().correlationId(),
                outcome.item().roomId(), outcome.detail(), outcome.isError()));
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Gateway session is closed");
        }
    }
}
