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
import dev.mars.parley.core.WorkItem;
import dev.mars.parley.gateway.scheduler.AgentAdapter;
import dev.mars.parley.gateway.scheduler.AgentScheduler;
import dev.mars.parley.gateway.scheduler.AgentSnapshot;
import dev.mars.parley.gateway.scheduler.SchedulerOptions;
import dev.mars.parley.gateway.scheduler.WorkCompletion;
import dev.mars.parley.gateway.scheduler.WorkOutcome;
import dev.mars.parley.gateway.session.InboundMessageRouter;
import dev.mars.parley.protocol.WireMessage;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.*;

/**
 * Records gateway metrics through the real SDK and scrapes them from the
 * Prometheus endpoint.
 */
@DisplayName("GatewayMetrics Tests")
class GatewayMetricsTest {

    private OpenTelemetrySdk sdk;
    private int port;

    @BeforeEach
    void setUp() throws Exception {
        GlobalOpenTelemetry.resetForTest();
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        sdk = GatewayTelemetryConfig.initialize("gw-metrics", port);
    }

    @AfterEach
    void tearDown() {
        if (sdk != null) {
            sdk.close();
        }
        GlobalOpenTelemetry.resetForTest();
    }

    private String scrape() throws Exception {
        HttpClient http = HttpClient.newHttpClient();
        HttpResponse<String> response = http.send(
                HttpRequest.newBuilder(URI.create("http://localhost:" + port + "/metrics")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
        assertThat(response.statusCode()).isEqualTo(200);
        return response.body();
    }

    @Test
    @DisplayName("Should expose connection and work metrics on the Prometheus endpoint")
    void testPrometheusExport() throws Exception {
        GatewayMetrics metrics = new GatewayMetrics("gw-metrics", () -> 7);

        metrics.recordStatus(ConnectionStatus.CONNECTING);
        metrics.recordStatus(ConnectionStatus.CONNECTED);
        metrics.recordReconnect();
        metrics.recordOutboundDropped();
        metrics.recordInvalidInbound();
        metrics.recordAccepted("gw-metrics:echo");
        metrics.recordOutcome(new WorkOutcome("gw-metrics:echo", new WorkItem("m-1", "hi"),
                WorkOutcome.Kind.COMPLETED, "hi"));

        String body = scrape();

        assertThat(body)
                .contains("parley_gateway_connection_attempts")
                .contains("parley_gateway_reconnects")
                .contains("parley_gateway_outbound_dropped")
                .contains("parley_gateway_inbound_invalid")
                .contains("parley_gateway_work_accepted")
                .contains("parley_gateway_work_finished")
                .contains("outcome=\"completed\"")
                .contains("parley_gateway_outbound_pending")
                .contains("gateway_id=\"gw-metrics\"");
        assertThat(metrics.getConnectionStatusValue()).isEqualTo(ConnectionStatus.CONNECTED.ordinal());
    }

    @Test
    @DisplayName("Should count queued work as accepted alongside dispatched work")
    void testAcceptedCountsQueuedWork() throws Exception {
        GatewayMetrics metrics = new GatewayMetrics("gw-metrics", () -> 0);
        Vertx vertx = Vertx.vertx();
        try {
            AgentScheduler scheduler = new AgentScheduler(vertx, SchedulerOptions.defaults(), null, null);
            scheduler.registerAgent("gw-metrics:held", new AgentAdapter() {
                @Override
                public String type() {
                    return "held";
                }

                @Override
                public void dispatch(WorkItem item, WorkCompletion completion) {
                }
            });
            InboundMessageRouter router = new InboundMessageRouter(scheduler, agentId -> { }, () -> { }, metrics);

            router.route(new WireMessage.SendToAgent("gw-metrics:held", "m-1", "one", null, null));
            router.route(new WireMessage.SendToAgent("gw-metrics:held", "m-2", "two", null, null));
            router.route(new WireMessage.SendToAgent("gw-metrics:missing", "m-3", "three", null, null));

            String accepted = scrape().lines()
                    .filter(line -> line.startsWith("parley_gateway_work_accepted"))
                    .findFirst()
                    .orElseThrow();
            assertThat(accepted).contains("agent_id=\"gw-metrics:held\"").matches(".* 2(\\.0)?$");
            assertThat(scheduler.snapshot("gw-metrics:held")).get().extracting(AgentSnapshot::queueDepth).isEqualTo(1);
        } finally {
            vertx.close();
        }
    }

    @Test
    @DisplayName("Should track the latest connection status")
    void testStatusGauge() {
        GatewayMetrics metrics = new GatewayMetrics("gw-metrics", () -> 0);

        metrics.recordStatus(ConnectionStatus.RECONNECTING);

        assertThat(metrics.getConnectionStatusValue()).isEqualTo(3);
    }
}
