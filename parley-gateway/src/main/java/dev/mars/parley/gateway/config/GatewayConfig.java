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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Centralized configuration loader for the Parley gateway.
 *
 * <p>Loads configuration from {@code parley-gateway.properties} with environment
 * variable and system property overrides. Environment variables use the upper-case
 * form of the key ({@code parley.gateway.server.url} becomes
 * {@code PARLEY_GATEWAY_SERVER_URL}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class GatewayConfig {

    private static final Logger logger = LoggerFactory.getLogger(GatewayConfig.class);
    private static final String CONFIG_FILE = "parley-gateway.properties";
    private static final GatewayConfig INSTANCE = new GatewayConfig(loadProperties(), true);

    private final Properties properties;
    private final boolean useOverrides;

    private GatewayConfig(Properties properties, boolean useOverrides) {
        this.properties = properties;
        this.useOverrides = useOverrides;
        if (useOverrides) {
            logConfiguration();
        }
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static GatewayConfig get() {
        return INSTANCE;
    }

    /**
     * Creates a configuration backed only by the given properties, ignoring the
     * environment and system properties.
     */
    public static GatewayConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new GatewayConfig(copy, false);
    }

    // ==================== Gateway Identity ====================

    /**
     * Gets the gateway ID, derived from the hostname when not configured.
     */
    public String getGatewayId() {
        String gatewayId = getString("parley.gateway.id", "");
        if (gatewayId.isEmpty()) {
            gatewayId = deriveGatewayIdFromHostname();
        }
        return gatewayId;
    }

    public String getVersion() {
        return getString("parley.gateway.version", "1.0.0");
    }

    public int getProtocolVersion() {
        return getInt("parley.gateway.protocol-version", 1);
    }

    // ==================== Server Connection ====================

    public String getServerUrl() {
        return getString("parley.gateway.server.url", "http://localhost:3000");
    }

    /**
     * Gets the access token used to authenticate, or an empty string when none is configured.
     */
    public String getToken() {
        return getString("parley.gateway.token", "");
    }

    // ==================== Heartbeat ====================

    public long getHeartbeatIntervalMs() {
        return getLong("parley.gateway.heartbeat.interval-ms", 30000);
    }

    public long getPongTimeoutMs() {
        return getLong("parley.gateway.heartbeat.pong-timeout-ms", 10000);
    }

    // ==================== Reconnect ====================

    public long getReconnectBaseDelayMs() {
        return getLong("parley.gateway.reconnect.base-delay-ms", 1000);
    }

    public long getReconnectMaxDelayMs() {
        return getLong("parley.gateway.reconnect.max-delay-ms", 30000);
    }

    public int getReconnectMaxAttempts() {
        return getInt("parley.gateway.reconnect.max-attempts", 50);
    }

    public int getOutboundQueueCapacity() {
        return getInt("parley.gateway.outbound.queue-capacity", 500);
    }

    public long getNetworkProbeIntervalMs() {
        return getLong("parley.gateway.network.probe-interval-ms", 5000);
    }

    // ==================== Agents ====================

    public int getAgentQueueCapacity() {
        return getInt("parley.gateway.agents.queue-capacity", 50);
    }

    /**
     * Per-item timeout enforced by the scheduler; 0 leaves timeouts to the adapters.
     */
    public long getWorkTimeoutMs() {
        return getLong("parley.gateway.agents.work-timeout-ms", 0);
    }

    /**
     * Names of the agents to start with, from a comma-separated list.
     */
    public List<String> getAgentNames() {
        String names = getString("parley.gateway.agents", "");
        return Arrays.stream(names.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    public long getEchoDelayMs() {
        return getLong("parley.gateway.agents.echo-delay-ms", 250);
    }

    // ==================== Telemetry ====================

    public boolean isTelemetryEnabled() {
        return getBoolean("parley.gateway.telemetry.enabled", true);
    }

    public int getPrometheusPort() {
        return getInt("parley.gateway.telemetry.prometheus.port", 9466);
    }

    // ==================== Derived Options ====================

    public ConnectionOptions toConnectionOptions() {
        return ConnectionOptions.builder()
                .gatewayId(getGatewayId())
                .protocolVersion(getProtocolVersion())
                .heartbeatInterval(Duration.ofMillis(getHeartbeatIntervalMs()))
                .pongTimeout(Duration.ofMillis(getPongTimeoutMs()))
                .reconnectBaseDelay(Duration.ofMillis(getReconnectBaseDelayMs()))
                .reconnectMaxDelay(Duration.ofMillis(getReconnectMaxDelayMs()))
                .maxReconnectAttempts(getReconnectMaxAttempts())
                .outboundQueueCapacity(getOutboundQueueCapacity())
                .build();
    }

    public SchedulerOptions toSchedulerOptions() {
        return SchedulerOptions.builder()
                .queueCapacity(getAgentQueueCapacity())
                .workTimeout(Duration.ofMillis(getWorkTimeoutMs()))
                .build();
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., PARLEY_GATEWAY_SERVER_URL)</li>
     *   <li>System property (e.g., -Dparley.gateway.server.url=...)</li>
     *   <li>Properties file (parley-gateway.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        if (useOverrides) {
            String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
            String envValue = System.getenv(envKey);
            if (envValue != null && !envValue.isEmpty()) {
                return envValue;
            }

            String sysProp = System.getProperty(key);
            if (sysProp != null && !sysProp.isEmpty()) {
                return sysProp;
            }
        }
        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that configured values are sensible.
     * Called during startup to fail fast on misconfiguration.
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        String serverUrl = getServerUrl();
        if (!serverUrl.startsWith("http://") && !serverUrl.startsWith("https://")) {
            throw new IllegalStateException(
                    "Server URL must start with http:// or https://, got: " + serverUrl);
        }
        try {
            if (URI.create(serverUrl).getHost() == null) {
                throw new IllegalStateException("Server URL has no host: " + serverUrl);
            }
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Server URL is not a valid URI: " + serverUrl, e);
        }

        requirePositive("Heartbeat interval", getHeartbeatIntervalMs());
        requirePositive("Pong timeout", getPongTimeoutMs());
        requirePositive("Reconnect base delay", getReconnectBaseDelayMs());
        requirePositive("Reconnect max attempts", getReconnectMaxAttempts());
        requirePositive("Outbound queue capacity", getOutboundQueueCapacity());
        requirePositive("Agent queue capacity", getAgentQueueCapacity());
        requirePositive("Network probe interval", getNetworkProbeIntervalMs());
        if (getReconnectMaxDelayMs() < getReconnectBaseDelayMs()) {
            throw new IllegalStateException("Reconnect max delay must not be below the base delay, got: "
                    + getReconnectMaxDelayMs() + " < " + getReconnectBaseDelayMs());
        }
        if (getWorkTimeoutMs() < 0) {
            throw new IllegalStateException("Work timeout cannot be negative, got: " + getWorkTimeoutMs());
        }

        logger.info("Gateway configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalStateException(name + " must be positive, got: " + value);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        try (InputStream input = GatewayConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
        return properties;
    }

    private static String deriveGatewayIdFromHostname() {
        try {
            return "gateway-" + InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not determine hostname, using fallback gateway ID");
            return "gateway-" + ProcessHandle.current().pid();
        }
    }

    private void logConfiguration() {
        logger.info("=== Parley Gateway Configuration ===");
        logger.info("  Gateway ID:           {}", getGatewayId());
        logger.info("  Server URL:           {}", getServerUrl());
        logger.info("  Token configured:     {}", !getToken().isEmpty());
        logger.info("  Version:              {}", getVersion());
        logger.info("  --- Heartbeat ---");
        logger.info("  Interval:             {}ms", getHeartbeatIntervalMs());
        logger.info("  Pong Timeout:         {}ms", getPongTimeoutMs());
        logger.info("  --- Reconnect ---");
        logger.info("  Base Delay:           {}ms", getReconnectBaseDelayMs());
        logger.info("  Max Delay:            {}ms", getReconnectMaxDelayMs());
        logger.info("  Max Attempts:         {}", getReconnectMaxAttempts());
        logger.info("  Outbound Capacity:    {}", getOutboundQueueCapacity());
        logger.info("  --- Agents ---");
        logger.info("  Agents:               {}", getAgentNames());
        logger.info("  Queue Capacity:       {}", getAgentQueueCapacity());
        logger.info("  Work Timeout:         {}ms", getWorkTimeoutMs());
        logger.info("  --- Telemetry ---");
        logger.info("  Enabled:              {}", isTelemetryEnabled());
        logger.info("  Prometheus Port:      {}", getPrometheusPort());
        logger.info("====================================");
    }
}
