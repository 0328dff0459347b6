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

package dev.mars.parley.gateway.observability;

import dev.mars.parley.core.ConnectionStatus;
import dev.mars.parley.gateway.scheduler.WorkOutcome;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for the Parley gateway.
 *
 * Provides:
 * - parley.gateway.connection.status (gauge) - 0=disconnected, 1=connecting, 2=connected, 3=reconnecting
 * - parley.gateway.connection.attempts (counter) - Channels opened or attempted
 * - parley.gateway.reconnects (counter) - Recovered sessions
 * - parley.gateway.outbound.pending (gauge) - Messages waiting for a connection
 * - parley.gateway.outbound.dropped (counter) - Messages dropped on a full outbound queue
 * - parley.gateway.inbound.invalid (counter) - Inbound frames rejected by validation
 * - parley.gateway.work.accepted (counter) - Items accepted by the scheduler, dispatched or queued
 * - parley.gateway.work.finished (counter) - Items settled, by outcome
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0 (OpenTelemetry)
 */
public class GatewayMetrics {

    private static final Logger logger = LoggerFactory.getLogger(GatewayMetrics.class);
    private static final String METER_NAME = "parley-gateway";

    private static final AttributeKey<String> GATEWAY_ID_KEY = AttributeKey.stringKey("gateway.id");
    private static final AttributeKey<String> AGENT_ID_KEY = AttributeKey.stringKey("agent.id");
    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");

    private final LongCounter connectionAttempts;
    private final LongCounter reconnects;
    private final LongCounter outboundDropped;
    private final LongCounter inboundInvalid;
    private final LongCounter workAccepted;
    private final LongCounter workFinished;

    private final AtomicLong connectionStatus = new AtomicLong(0);
    private final Attributes gatewayAttributes;
    private final String gatewayId;

    /**
     * @param gatewayId      identifies this gateway in every measurement
     * @param pendingOutbound supplies the current outbound queue size
     */
    public GatewayMetrics(String gatewayId, LongSupplier pendingOutbound) {
        this.gatewayId = gatewayId;
        this.gatewayAttributes = Attributes.of(GATEWAY_ID_KEY, gatewayId);

        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        connectionAttempts = meter.counterBuilder("parley.gateway.connection.attempts")
                .setDescription("Number of channel open attempts")
                .setUnit("1")
                .build();

        reconnects = meter.counterBuilder("parley.gateway.reconnects")
                .setDescription("Number of sessions recovered after a connection loss")
                .setUnit("1")
                .build();

        outboundDropped = meter.counterBuilder("parley.gateway.outbound.dropped")
                .setDescription("Outbound messages dropped because the queue was full")
                .setUnit("1")
                .build();

        inboundInvalid = meter.counterBuilder("parley.gateway.inbound.invalid")
                .setDescription("Inbound frames rejected by validation")
                .setUnit("1")
                .build();

        workAccepted = meter.counterBuilder("parley.gateway.work.accepted")
                .setDescription("Work items accepted by the scheduler, dispatched or queued")
                .setUnit("1")
                .build();

        workFinished = meter.counterBuilder("parley.gateway.work.finished")
                .setDescription("Work items completed, failed or rejected")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("parley.gateway.connection.status")
                .setDescription("Connection status (0=disconnected, 1=connecting, 2=connected, 3=reconnecting)")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(connectionStatus.get(), gatewayAttributes));

        meter.gaugeBuilder("parley.gateway.outbound.pending")
                .setDescription("Outbound messages waiting for a connection")
                .ofLongs()
                .buildWithCallback(measurement ->
                        measurement.record(pendingOutbound.getAsLong(), gatewayAttributes));

        logger.info("GatewayMetrics initialized for gateway: {}", gatewayId);
    }

    public void recordStatus(ConnectionStatus status) {
        connectionStatus.set(status.ordinal());
        if (status == ConnectionStatus.CONNECTING) {
            connectionAttempts.add(1, gatewayAttributes);
        }
    }

    public void recordReconnect() {
        reconnects.add(1, gatewayAttributes);
    }

    public void recordOutboundDropped() {
        outboundDropped.add(1, gatewayAttributes);
    }

    public void recordInvalidInbound() {
        inboundInvalid.add(1, gatewayAttributes);
    }

    public void recordAccepted(String agentId) {
        workAccepted.add(1, agentAttributes(agentId).build());
    }

    public void recordOutcome(WorkOutcome outcome) {
        workFinished.add(1, agentAttributes(outcome.agentId())
                .put(OUTCOME_KEY, outcome.kind().name().toLowerCase())
                .build());
    }

    public long getConnectionStatusValue() {
        return connectionStatus.get();
    }

    private AttributesBuilder agentAttributes(String agentId) {
        return Attributes.builder()
                .put(GATEWAY_ID_KEY, gatewayId)
                .put(AGENT_ID_KEY, agentId);
    }
}
