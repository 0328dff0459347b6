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

package dev.mars.parley.gateway.connection;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunables for a {@link ConnectionClient}.
 *
 * <p>Defaults: ping every 30s, 10s pong timeout, reconnect backoff starting at
 * 1s and capped at 30s, at most 50 consecutive reconnect attempts, and up to
 * 500 outbound messages held while disconnected.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 */
public final class ConnectionOptions {

    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 50;
    public static final int DEFAULT_OUTBOUND_QUEUE_CAPACITY = 500;

    private final String gatewayId;
    private final int protocolVersion;
    private final Duration heartbeatInterval;
    private final Duration pongTimeout;
    private final Duration reconnectBaseDelay;
    private final Duration reconnectMaxDelay;
    private final int maxReconnectAttempts;
    private final int outboundQueueCapacity;

    private ConnectionOptions(Builder builder) {
        this.gatewayId = builder.gatewayId;
        this.protocolVersion = builder.protocolVersion;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.pongTimeout = builder.pongTimeout;
        this.reconnectBaseDelay = builder.reconnectBaseDelay;
        this.reconnectMaxDelay = builder.reconnectMaxDelay;
        this.maxReconnectAttempts = builder.maxReconnectAttempts;
        this.outboundQueueCapacity = builder.outboundQueueCapacity;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConnectionOptions defaults() {
        return builder().build();
    }

    /**
     * Backoff delay before the retry that follows {@code attempt} previous
     * attempts: {@code min(base * 2^attempt, max)}.
     *
     * @param attempt number of retries already scheduled since the last reset
     * @return the delay in milliseconds, at least 1
     */
    public long reconnectDelayMs(int attempt) {
        long base = reconnectBaseDelay.toMillis();
        long max = reconnectMaxDelay.toMillis();
        // Cap the exponent to avoid overflow
        long exponential = base * (1L << Math.min(attempt, 30));
        if (exponential < 0) {
            exponential = max;
        }
        return Math.max(1, Math.min(exponential, max));
    }

    public String getGatewayId() { return gatewayId; }
    public int getProtocolVersion() { return protocolVersion; }
    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public Duration getPongTimeout() { return pongTimeout; }
    public Duration getReconnectBaseDelay() { return reconnectBaseDelay; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public int getMaxReconnectAttempts() { return maxReconnectAttempts; }
    public int getOutboundQueueCapacity() { return outboundQueueCapacity; }

    public static class Builder {
        private String gatewayId;
        private int protocolVersion = 1;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration pongTimeout = Duration.ofSeconds(10);
        private Duration reconnectBaseDelay = Duration.ofSeconds(1);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private int maxReconnectAttempts = DEFAULT_MAX_RECONNECT_ATTEMPTS;
        private int outboundQueueCapacity = DEFAULT_OUTBOUND_QUEUE_CAPACITY;

        public Builder gatewayId(String gatewayId) {
            this.gatewayId = gatewayId;
            return this;
        }

        public Builder protocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder pongTimeout(Duration pongTimeout) {
            this.pongTimeout = pongTimeout;
            return this;
        }

        public Builder reconnectBaseDelay(Duration reconnectBaseDelay) {
            this.reconnectBaseDelay = reconnectBaseDelay;
            return this;
        }

        public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
            this.reconnectMaxDelay = reconnectMaxDelay;
            return this;
        }

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder outboundQueueCapacity(int outboundQueueCapacity) {
            this.outboundQueueCapacity = outboundQueueCapacity;
            return this;
        }

        public ConnectionOptions build() {
            Objects.requireNonNull(heartbeatInterval, "Heartbeat interval cannot be null");
            Objects.requireNonNull(pongTimeout, "Pong timeout cannot be null");
            Objects.requireNonNull(reconnectBaseDelay, "Reconnect base delay cannot be null");
            Objects.requireNonNull(reconnectMaxDelay, "Reconnect max delay cannot be null");
            if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
                throw new IllegalArgumentException("Heartbeat interval must be positive");
            }
            if (pongTimeout.isNegative() || pongTimeout.isZero()) {
                throw new IllegalArgumentException("Pong timeout must be positive");
            }
            if (reconnectBaseDelay.isNegative() || reconnectBaseDelay.isZero()) {
                throw new IllegalArgumentException("Reconnect base delay must be positive");
            }
            if (reconnectMaxDelay.compareTo(reconnectBaseDelay) < 0) {
                throw new IllegalArgumentException("Reconnect max delay must not be below the base delay");
            }
            if (maxReconnectAttempts <= 0) {
                throw new IllegalArgumentException("Max reconnect attempts must be positive");
            }
            if (outboundQueueCapacity <= 0) {
                throw new IllegalArgumentException("Outbound queue capacity must be positive");
            }
            return new ConnectionOptions(this);
        }
    }
}
