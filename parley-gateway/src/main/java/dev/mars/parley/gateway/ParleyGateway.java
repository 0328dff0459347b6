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

package dev.mars.parley.gateway;

import dev.mars.parley.core.exceptions.DuplicateAgentException;
import dev.mars.parley.gateway.config.GatewayConfig;
import dev.mars.parley.gateway.connection.ConnectionClient;
import dev.mars.parley.gateway.connection.EndpointResolver;
import dev.mars.parley.gateway.connection.ProbingNetworkMonitor;
import dev.mars.parley.gateway.connection.VertxWebSocketTransport;
import dev.mars.parley.gateway.observability.GatewayMetrics;
import dev.mars.parley.gateway.observability.GatewayTelemetryConfig;
import dev.mars.parley.gateway.session.EchoAgentAdapter;
import dev.mars.parley.gateway.session.GatewaySession;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main class for the Parley gateway.
 * Connects to the Parley server over a WebSocket and runs the configured agents.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class ParleyGateway {

    private static final Logger logger = LoggerFactory.getLogger(ParleyGateway.class);

    private final Vertx vertx;
    private final GatewayConfig config;
    private final GatewayMetrics metrics;

    private VertxWebSocketTransport transport;
    private ProbingNetworkMonitor networkMonitor;
    private GatewaySession session;

    // Shutdown coordination
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /**
     * Creates a gateway on a shared Vert.x instance.
     *
     * @param vertx   the Vert.x instance (must not be null)
     * @param config  the gateway configuration (must not be null)
     * @param metrics optional metrics, may be {@code null}
     */
    public ParleyGateway(Vertx vertx, GatewayConfig config, GatewayMetrics metrics) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "GatewayConfig cannot be null");
        this.metrics = metrics;
        logger.info("Parley gateway created: {}", config.getGatewayId());
    }

    public static void main(String[] args) {
        logger.info("Starting Parley gateway...");

        GatewayConfig config = GatewayConfig.get();
        OpenTelemetrySdk openTelemetry = null;
        if (config.isTelemetryEnabled()) {
            openTelemetry = GatewayTelemetryConfig.initialize(config.getGatewayId(), config.getPrometheusPort());
        }
        OpenTelemetrySdk telemetryToClose = openTelemetry;

        // Create shared Vert.x instance
        Vertx vertx = Vertx.vertx();

        try {
            config.validate();
            ParleyGateway gateway = new ParleyGateway(vertx, config, null);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                gateway.shutdown();
                if (telemetryToClose != null) {
                    telemetryToClose.close();
                }
                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                });
            }));

            gateway.start();
            gateway.awaitShutdown();

        } catch (Exception e) {
            logger.error("Failed to start Parley gateway", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Parley gateway stopped");
    }

    /**
     * Builds the connection stack, adds the configured agents and starts connecting.
     *
     * @throws IllegalStateException if the gateway was shut down or no token is configured
     * @throws DuplicateAgentException if two configured agents share a name
     */
    public void start() throws DuplicateAgentException {
        if (closed.get()) {
            throw new IllegalStateException("Gateway is closed, cannot start");
        }
        String token = config.getToken();
        if (token.isEmpty()) {
            throw new IllegalStateException("No access token configured (parley.gateway.token)");
        }

        String endpoint = EndpointResolver.resolve(config.getServerUrl());
        transport = new VertxWebSocketTransport(vertx);
        networkMonitor = ProbingNetworkMonitor.forServer(vertx, config.getServerUrl(),
                Duration.ofMillis(config.getNetworkProbeIntervalMs()));

        ConnectionClient client = new ConnectionClient(vertx, transport, endpoint, config.toConnectionOptions())
                .setNetworkMonitor(networkMonitor);
        GatewayMetrics gatewayMetrics = metrics;
        if (gatewayMetrics == null && config.isTelemetryEnabled()) {
            gatewayMetrics = new GatewayMetrics(config.getGatewayId(), client::getPendingMessageCount);
        }
        session = new GatewaySession(vertx, client, config.toSchedulerOptions(), gatewayMetrics);

        for (String name : config.getAgentNames()) {
            session.addAgent(agentId(name), name, new EchoAgentAdapter(vertx, config.getEchoDelayMs()));
        }

        running = true;
        session.start(token);
        logger.info("Parley gateway started: {} agent(s), endpoint {}", session.agentCount(), endpoint);
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Gateway already closed, skipping shutdown");
            return;
        }
        if (!running) {
            logger.info("Gateway not running, performing cleanup only");
            shutdownLatch.countDown();
            return;
        }

        logger.info("Shutting down Parley gateway...");
        running = false;
        try {
            session.close();
            networkMonitor.close();
            transport.close();
            logger.info("Parley gateway shutdown complete");
        } catch (RuntimeException e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public boolean isRunning() {
        return running;
    }

    public GatewaySession getSession() {
        return session;
    }

    /**
     * Agent ids combine the gateway id and the agent name so that they stay
     * stable across restarts of the same gateway.
     */
    String agentId(String name) {
        return config.getGatewayId() + ":" + name;
    }
}
