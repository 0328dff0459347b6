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

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.WebSocket;
import io.vertx.core.http.WebSocketClient;
import io.vertx.core.http.WebSocketClientOptions;
import io.vertx.core.http.WebSocketConnectOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link Transport} backed by the Vert.x {@link WebSocketClient}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public class VertxWebSocketTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(VertxWebSocketTransport.class);

    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 10000;
    private static final int MAX_MESSAGE_SIZE = 1024 * 1024;

    private final WebSocketClient client;

    public VertxWebSocketTransport(Vertx vertx) {
        this(vertx, new WebSocketClientOptions()
                .setConnectTimeout(DEFAULT_CONNECT_TIMEOUT_MS)
                .setMaxMessageSize(MAX_MESSAGE_SIZE));
    }

    public VertxWebSocketTransport(Vertx vertx, WebSocketClientOptions options) {
        Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.client = vertx.createWebSocketClient(options);
        logger.debug("VertxWebSocketTransport initialized (connectTimeout={}ms)", options.getConnectTimeout());
    }

    @Override
    public Future<TransportChannel> open(String endpoint) {
        WebSocketConnectOptions connectOptions = new WebSocketConnectOptions().setAbsoluteURI(endpoint);
        return client.connect(connectOptions)
                .<TransportChannel>map(WebSocketChannel::new)
                .onFailure(err -> logger.debug("WebSocket connect to {} failed: {}", endpoint, err.getMessage()));
    }

    @Override
    public Future<Void> close() {
        logger.debug("Closing WebSocket client");
        return client.close();
    }

    private static final class WebSocketChannel implements TransportChannel {

        private final WebSocket webSocket;

        WebSocketChannel(WebSocket webSocket) {
            this.webSocket = webSocket;
            webSocket.exceptionHandler(err ->
                    logger.warn("WebSocket error on {}: {}", webSocket.remoteAddress(), err.getMessage()));
        }

        @Override
        public void textHandler(Consumer<String> handler) {
            webSocket.textMessageHandler(handler::accept);
        }

        @Override
        public void closeHandler(Runnable handler) {
            webSocket.closeHandler(v -> handler.run());
        }

        @Override
        public void send(String text) {
            if (webSocket.isClosed()) {
                throw new IllegalStateException("WebSocket is closed");
            }
            webSocket.writeTextMessage(text)
                    .onFailure(err -> logger.warn("WebSocket write failed: {}", err.getMessage()));
        }

        @Override
        public void close() {
            if (!webSocket.isClosed()) {
                webSocket.close();
            }
        }

        @Override
        public boolean isOpen() {
            return !webSocket.isClosed();
        }
    }
}
