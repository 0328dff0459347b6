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

import io.opentelemetry.exporter.prometheus.PrometheusHttpServer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.resources.Resource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenTelemetry configuration for the Parley gateway.
 *
 * Provides:
 * - Prometheus metrics export (configurable port, default 9466)
 * - Global registration so {@link GatewayMetrics} picks up the SDK meter provider
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-10
 * @version 1.0 (OpenTelemetry)
 */
public final class GatewayTelemetryConfig {

    private static final Logger logger = LoggerFactory.getLogger(GatewayTelemetryConfig.class);

    private GatewayTelemetryConfig() {
    }

    /**
     * Builds the SDK and registers it globally. Must run before any
     * {@link GatewayMetrics} is created.
     *
     * @param gatewayId      service instance identifier
     * @param prometheusPort port for the Prometheus scrape endpoint
     * @return the SDK, to be closed on shutdown
     */
    public static OpenTelemetrySdk initialize(String gatewayId, int prometheusPort) {
        Resource resource = Resource.getDefault().toBuilder()
                .put("service.name", "parley-gateway")
                .put("service.instance.id", gatewayId)
                .build();

        PrometheusHttpServer prometheusReader = PrometheusHttpServer.builder()
                .setPort(prometheusPort)
                .build();

        SdkMeterProvider meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(prometheusReader)
                .build();

        OpenTelemetrySdk openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider)
                .buildAndRegisterGlobal();

        logger.info("OpenTelemetry initialized, Prometheus metrics on port {}", prometheusPort);
        return openTelemetry;
    }
}
