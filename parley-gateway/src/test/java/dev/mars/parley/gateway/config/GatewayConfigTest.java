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

package dev.mars.parley.gateway.config;

import dev.mars.parley.gateway.connection.ConnectionOptions;
import dev.mars.parley.gateway.scheduler.SchedulerOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for GatewayConfig loading, validation and derived options.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 */
class GatewayConfigTest {

    private static GatewayConfig config(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(keyValues[i], keyValues[i + 1]);
        }
        return GatewayConfig.fromProperties(properties);
    }

    @Test
    @DisplayName("Should return singleton instance")
    void shouldReturnSingletonInstance() {
        assertThat(GatewayConfig.get()).isSameAs(GatewayConfig.get());
    }

    @Test
    @DisplayName("Should load the bundled properties file")
    void shouldLoadBundledProperties() {
        GatewayConfig config = GatewayConfig.get();

        assertThat(config.getAgentNames()).isNotEmpty();
        assertThat(config.getServerUrl()).isNotBlank();
    }

    @Test
    @DisplayName("Should fall back to defaults for missing keys")
    void shouldUseDefaults() {
        GatewayConfig config = config();

        assertThat(config.getServerUrl()).isEqualTo("http://localhost:3000");
        assertThat(config.getToken()).isEmpty();
        assertThat(config.getHeartbeatIntervalMs()).isEqualTo(30000);
        assertThat(config.getPongTimeoutMs()).isEqualTo(10000);
        assertThat(config.getReconnectMaxAttempts()).isEqualTo(50);
        assertThat(config.getOutboundQueueCapacity()).isEqualTo(500);
        assertThat(config.getAgentQueueCapacity()).isEqualTo(50);
        assertThat(config.getWorkTimeoutMs()).isZero();
        assertThat(config.getAgentNames()).isEmpty();
        assertThat(config.getGatewayId()).startsWith("gateway-");
    }

    @Test
    @DisplayName("Should parse the agent list")
    void shouldParseAgentNames() {
        GatewayConfig config = config("parley.gateway.agents", " echo, , helper ,echo2");

        assertThat(config.getAgentNames()).containsExactly("echo", "helper", "echo2");
    }

    @Test
    @DisplayName("Should use the default for unparseable numbers")
    void shouldIgnoreInvalidNumbers() {
        GatewayConfig config = config("parley.gateway.heartbeat.interval-ms", "soon");

        assertThat(config.getHeartbeatIntervalMs()).isEqualTo(30000);
    }

    @Test
    @DisplayName("Should build connection and scheduler options from configuration")
    void shouldDeriveOptions() {
        GatewayConfig config = config(
                "parley.gateway.id", "gw-1",
                "parley.gateway.heartbeat.interval-ms", "15000",
                "parley.gateway.reconnect.max-attempts", "5",
                "parley.gateway.agents.queue-capacity", "10",
                "parley.gateway.agents.work-timeout-ms", "60000");

        ConnectionOptions connection = config.toConnectionOptions();
        SchedulerOptions scheduler = config.toSchedulerOptions();

        assertThat(connection.getGatewayId()).isEqualTo("gw-1");
        assertThat(connection.getHeartbeatInterval()).isEqualTo(Duration.ofSeconds(15));
        assertThat(connection.getMaxReconnectAttempts()).isEqualTo(5);
        assertThat(scheduler.getQueueCapacity()).isEqualTo(10);
        assertThat(scheduler.getWorkTimeout()).contains(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("Should accept the defaults")
    void shouldValidateDefaults() {
        assertThatCode(() -> config().validate()).doesNotThrowAnyException();
    }

    @ParameterizedTest(name = "{0}={1}")
    @CsvSource({
        "parley.gateway.server.url,              ws://localhost:3000",
        "parley.gateway.server.url,              localhost:3000",
        "parley.gateway.server.url,              http://",
        "parley.gateway.heartbeat.interval-ms,   0",
        "parley.gateway.heartbeat.pong-timeout-ms, -5",
        "parley.gateway.reconnect.max-attempts,  0",
        "parley.gateway.reconnect.max-delay-ms,  10",
        "parley.gateway.agents.queue-capacity,   0",
        "parley.gateway.agents.work-timeout-ms,  -1",
        "parley.gateway.network.probe-interval-ms, 0"
    })
    @DisplayName("Should reject invalid settings")
    void shouldRejectInvalidSettings(String key, String value) {
        assertThatIllegalStateException().isThrownBy(() -> config(key, value).validate());
    }
}
