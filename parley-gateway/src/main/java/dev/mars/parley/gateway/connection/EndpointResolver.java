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

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Derives the gateway WebSocket endpoint from the configured server URL.
 *
 * <p>{@code http} maps to {@code ws} and {@code https} to {@code wss}; the
 * host and port are kept and the path is always {@value #GATEWAY_PATH}.</p>
 */
public final class EndpointResolver {

    public static final String GATEWAY_PATH = "/ws/gateway";

    private EndpointResolver() {
    }

    public static String resolve(String serverUrl) {
        URI uri = parse(serverUrl);
        String scheme = switch (scheme(uri)) {
            case "http", "ws" -> "ws";
            case "https", "wss" -> "wss";
            default -> throw new IllegalArgumentException("Unsupported server URL scheme: " + serverUrl);
        };
        StringBuilder endpoint = new StringBuilder(scheme).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            endpoint.append(':').append(uri.getPort());
        }
        return endpoint.append(GATEWAY_PATH).toString();
    }

    public static String host(String serverUrl) {
        return parse(serverUrl).getHost();
    }

    /**
     * Explicit port of the server URL, or the scheme default (80 or 443).
     */
    public static int port(String serverUrl) {
        URI uri = parse(serverUrl);
        if (uri.getPort() != -1) {
            return uri.getPort();
        }
        String scheme = scheme(uri);
        return scheme.equals("https") || scheme.equals("wss") ? 443 : 80;
    }

    private static String scheme(URI uri) {
        return uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    }

    private static URI parse(String serverUrl) {
        if (serverUrl == null || serverUrl.isBlank()) {
            throw new IllegalArgumentException("Server URL cannot be empty");
        }
        try {
            URI uri = new URI(serverUrl.trim());
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Server URL has no host: " + serverUrl);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid server URL: " + serverUrl, e);
        }
    }
}
