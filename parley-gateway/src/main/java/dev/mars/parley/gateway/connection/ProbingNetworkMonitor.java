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

import io.vertx.core.Vertx;
import io.vertx.core.net.NetClient;
import io.vertx.core.net.NetClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link NetworkMonitor} that periodically opens a TCP connection to the
 * server host and reports transitions in reachability.
 *
 * <p>Probing only runs while at least one listener is subscribed. The first
 * probe establishes a baseline and is never reported.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 */
public class ProbingNetworkMonitor implements NetworkMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ProbingNetworkMonitor.class);

    private final Vertx vertx;
    private final NetClient netClient;
    private final String host;
    private final int port;
    private final long intervalMs;
    private final ListenerRegistry<NetworkListener> listeners = new ListenerRegistry<>("network");

    private long timerId = -1;
    private Boolean reachable;

    public ProbingNetworkMonitor(Vertx vertx, String host, int port, Duration interval) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.host = Objects.requireNonNull(host, "Host cannot be null");
        this.port = port;
        this.intervalMs = interval.toMillis();
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Probe interval must be positive");
        }
        this.netClient = vertx.createNetClient(new NetClientOptions()
                .setConnectTimeout((int) Math.min(intervalMs, Integer.MAX_VALUE)));
    }

    /**
     * Convenience constructor probing the host and port of a server URL.
     */
    public static ProbingNetworkMonitor forServer(Vertx vertx, String serverUrl, Duration interval) {
        return new ProbingNetworkMonitor(vertx, EndpointResolver.host(serverUrl),
                EndpointResolver.port(serverUrl), interval);
    }

    @Override
    public Subscription subscribe(NetworkListener listener) {
        Subscription registration = listeners.add(listener);
        synchronized (this) {
            if (timerId == -1) {
                logger.debug("Starting network probe of {}:{} every {}ms", host, port, intervalMs);
                timerId = vertx.setPeriodic(intervalMs, this::probe);
            }
        }
        return () -> {
            registration.unsubscribe();
            stopIfIdle();
        };
    }

    /**
     * Last observed reachability, or {@code null} before the first probe completes.
     */
    public synchronized Boolean isReachable() {
        return reachable;
    }

    public void close() {
        synchronized (this) {
            if (timerId != -1) {
                vertx.cancelTimer(timerId);
                timerId = -1;
            }
        }
        netClient.close();
    }

    private void stopIfIdle() {
        synchronized (this) {
            if (listeners.isEmpty() && timerId != -1) {
                logger.debug("Stopping network probe of {}:{}", host, port);
                vertx.cancelTimer(timerId);
                timerId = -1;
                reachable = null;
            }
        }
    }

    private void probe(long id) {
        netClient.connect(port, host).onComplete(ar -> {
            if (ar.succeeded()) {
                ar.result().close();
            } else {
                logger.debug("Network probe of {}:{} failed: {}", host, port, ar.cause().getMessage());
            }
            update(id, ar.succeeded());
        });
    }

    private void update(long id, boolean nowReachable) {
        Boolean previous;
        synchronized (this) {
            if (id != timerId) {
                return;
            }
            previous = reachable;
            reachable = nowReachable;
        }
        if (previous == null || previous == nowReachable) {
            return;
        }
        if (nowReachable) {
            logger.info("Server host {}:{} reachable again", host, port);
            listeners.notifyEach(NetworkListener::onOnline);
        } else {
            logger.warn("Server host {}:{} unreachable", host, port);
            listeners.notifyEach(NetworkListener::onOffline);
        }
    }
}
