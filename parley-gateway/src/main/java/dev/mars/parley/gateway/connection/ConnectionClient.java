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

import dev.mars.parley.core.ConnectionStatus;
import dev.mars.parley.core.exceptions.MessageValidationException;
import dev.mars.parley.protocol.MessageCodec;
import dev.mars.parley.protocol.WireMessage;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Keeps one authenticated channel to the server alive.
 *
 * <p>The client authenticates every new channel with the latest token, sends a
 * ping every heartbeat interval and drops the channel when no pong arrives in
 * time. Lost channels are retried with exponential backoff up to a fixed number
 * of attempts. Application messages sent while not connected are queued (up to
 * a bounded capacity) and flushed in order once the next handshake succeeds;
 * control messages are never queued.</p>
 *
 * <p>All state is guarded by a single lock. Listeners are always invoked after
 * the lock is released, one event at a time and in the order the events
 * happened, so a listener may safely call back into the client.</p>
 *
 * <p>Timer, transport and token-refresh callbacks carry the identity of the
 * timer, channel or attempt that scheduled them and are ignored once that
 * identity is no longer current. A {@link #disconnect()} therefore cannot be
 * undone by a callback that was already in flight.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class ConnectionClient implements MessageSink, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionClient.class);

    private static final long NO_TIMER = -1;

    private final Vertx vertx;
    private final Transport transport;
    private final String endpoint;
    private final ConnectionOptions options;

    private final ListenerRegistry<Consumer<WireMessage>> messageListeners = new ListenerRegistry<>("message");
    private final ListenerRegistry<Consumer<ConnectionStatus>> statusListeners = new ListenerRegistry<>("status");
    private final ListenerRegistry<Runnable> reconnectListeners = new ListenerRegistry<>("reconnect");
    private final ListenerRegistry<Consumer<WireMessage>> overflowListeners = new ListenerRegistry<>("overflow");
    private final ListenerRegistry<Consumer<MessageValidationException>> validationListeners =
            new ListenerRegistry<>("validation");

    private final Queue<Runnable> events = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private final Object lock = new Object();

    // guarded by lock
    private final Deque<WireMessage> outbound = new ArrayDeque<>();
    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private String token;
    private TokenRefresher tokenRefresher;
    private NetworkMonitor networkMonitor;
    private Subscription networkSubscription;
    private TransportChannel channel;
    private boolean opening;
    private boolean authenticated;
    private boolean shouldReconnect;
    private boolean wasConnected;
    private int reconnectAttempts;
    private int authFailures;
    private long openSequence;
    private long epoch;
    private long reconnectTimerId = NO_TIMER;
    private long heartbeatTimerId = NO_TIMER;
    private long pongTimerId = NO_TIMER;
    private long authTimerId = NO_TIMER;

    public ConnectionClient(Vertx vertx, Transport transport, String endpoint, ConnectionOptions options) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx cannot be null");
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.endpoint = Objects.requireNonNull(endpoint, "Endpoint cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        logger.debug("ConnectionClient created for {} (gatewayId={})", endpoint, options.getGatewayId());
    }

    /**
     * Installs the token source consulted before each reconnect attempt. With a
     * refresher installed, the first rejected handshake after a successful one
     * is retried once with a refreshed token instead of giving up.
     */
    public ConnectionClient setTokenRefresher(TokenRefresher tokenRefresher) {
        synchronized (lock) {
            this.tokenRefresher = tokenRefresher;
        }
        return this;
    }

    /**
     * Installs the connectivity signal source. The client subscribes while it
     * wants to be connected and unsubscribes on {@link #disconnect()}.
     */
    public ConnectionClient setNetworkMonitor(NetworkMonitor networkMonitor) {
        Subscription previous;
        synchronized (lock) {
            previous = networkSubscription;
            networkSubscription = null;
            this.networkMonitor = networkMonitor;
            if (shouldReconnect) {
                subscribeNetworkLocked();
            }
        }
        if (previous != null) {
            previous.unsubscribe();
        }
        return this;
    }

    // ---- lifecycle ----

    /**
     * Starts connecting with the given token. While a channel is open or being
     * opened this only records the token for later handshakes.
     */
    public void connect(String token) {
        Objects.requireNonNull(token, "Token cannot be null");
        synchronized (lock) {
            this.token = token;
            this.shouldReconnect = true;
            subscribeNetworkLocked();
            if (channel != null || opening) {
                logger.debug("connect() ignored, connection already in progress ({})", status);
            } else {
                reconnectAttempts = 0;
                authFailures = 0;
                cancelReconnectTimerLocked();
                openChannelLocked();
            }
        }
        drainEvents();
    }

    /**
     * Stops all activity: cancels timers, closes the channel, clears the
     * outbound queue and reports {@link ConnectionStatus#DISCONNECTED}. The
     * token is kept so {@link #reconnect()} can start again.
     */
    public void disconnect() {
        Subscription toRelease;
        synchronized (lock) {
            shouldReconnect = false;
            wasConnected = false;
            reconnectAttempts = 0;
            authFailures = 0;
            epoch++;
            openSequence++;
            opening = false;
            cancelReconnectTimerLocked();
            stopHeartbeatLocked();
            closeChannelLocked();
            int dropped = outbound.size();
            outbound.clear();
            if (dropped > 0) {
                logger.info("Discarded {} queued outbound message(s) on disconnect", dropped);
            }
            toRelease = networkSubscription;
            networkSubscription = null;
            setStatusLocked(ConnectionStatus.DISCONNECTED);
        }
        if (toRelease != null) {
            toRelease.unsubscribe();
        }
        drainEvents();
    }

    /**
     * Reconnects immediately using the stored token, resetting the attempt
     * counter. Does nothing if no token was ever supplied.
     */
    public void reconnect() {
        synchronized (lock) {
            if (token == null) {
                logger.debug("reconnect() ignored, no token available");
                return;
            }
            shouldReconnect = true;
            reconnectAttempts = 0;
            authFailures = 0;
            epoch++;
            subscribeNetworkLocked();
            cancelReconnectTimerLocked();
            if (channel == null && !opening) {
                openChannelLocked();
            }
        }
        drainEvents();
    }

    /**
     * Replaces the token used by subsequent handshakes without touching the
     * current channel.
     */
    public void updateToken(String token) {
        Objects.requireNonNull(token, "Token cannot be null");
        synchronized (lock) {
            this.token = token;
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    // ---- connectivity signals ----

    /**
     * Connectivity came back: forget earlier failures and retry right away.
     */
    public void onNetworkOnline() {
        synchronized (lock) {
            reconnectAttempts = 0;
            if (!shouldReconnect || token == null) {
                return;
            }
            if (channel != null || opening) {
                return;
            }
            logger.info("Network online, reconnecting immediately");
            epoch++;
            cancelReconnectTimerLocked();
            openChannelLocked();
        }
        drainEvents();
    }

    /**
     * Connectivity was lost: drop the current channel rather than wait for the
     * heartbeat to notice.
     */
    public void onNetworkOffline() {
        synchronized (lock) {
            if (channel == null) {
                return;
            }
            logger.info("Network offline, dropping current connection");
            dropChannelLocked();
        }
        drainEvents();
    }

    // ---- sending ----

    /**
     * Sends a message. Application messages are queued while not connected;
     * control messages are only written to an open channel and otherwise
     * discarded.
     */
    @Override
    public SendResult send(WireMessage message) {
        Objects.requireNonNull(message, "Message cannot be null");
        SendResult result;
        synchronized (lock) {
            result = sendLocked(message);
        }
        drainEvents();
        return result;
    }

    private SendResult sendLocked(WireMessage message) {
        if (message.isControl()) {
            if (channel != null && channel.isOpen() && transmitLocked(message)) {
                return SendResult.SENT;
            }
            logger.debug("Discarding {} while not connected", message.type());
            return SendResult.DROPPED;
        }
        if (authenticated && outbound.isEmpty() && transmitLocked(message)) {
            return SendResult.SENT;
        }
        if (outbound.size() >= options.getOutboundQueueCapacity()) {
            logger.warn("Outbound queue full ({}), dropping {}", outbound.size(), message.type());
            emit(() -> overflowListeners.notifyEach(l -> l.accept(message)));
            return SendResult.DROPPED;
        }
        outbound.addLast(message);
        return SendResult.QUEUED;
    }

    private boolean transmitLocked(WireMessage message) {
        TransportChannel current = channel;
        if (current == null) {
            return false;
        }
        try {
            current.send(MessageCodec.encode(message));
            return true;
        } catch (RuntimeException e) {
            logger.warn("Failed to write {}: {}", message.type(), e.getMessage());
            return false;
        }
    }

    private void flushOutboundLocked() {
        int flushed = 0;
        while (authenticated && !outbound.isEmpty()) {
            if (!transmitLocked(outbound.peekFirst())) {
                break;
            }
            outbound.pollFirst();
            flushed++;
        }
        if (flushed > 0) {
            logger.info("Flushed {} queued outbound message(s)", flushed);
        }
    }

    // ---- accessors ----

    public ConnectionStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return authenticated && channel != null && channel.isOpen();
        }
    }

    public int getPendingMessageCount() {
        synchronized (lock) {
            return outbound.size();
        }
    }

    public int getReconnectAttempts() {
        synchronized (lock) {
            return reconnectAttempts;
        }
    }

    public String getEndpoint() {
        return endpoint;
    }

    // ---- subscriptions ----

    public Subscription onMessage(Consumer<WireMessage> listener) {
        return messageListeners.add(listener);
    }

    public Subscription onStatusChange(Consumer<ConnectionStatus> listener) {
        return statusListeners.add(listener);
    }

    /**
     * Fires after every successful handshake except the first one since
     * {@link #connect(String)}.
     */
    public Subscription onReconnect(Runnable listener) {
        return reconnectListeners.add(listener);
    }

    public Subscription onQueueOverflow(Consumer<WireMessage> listener) {
        return overflowListeners.add(listener);
    }

    public Subscription onValidationError(Consumer<MessageValidationException> listener) {
        return validationListeners.add(listener);
    }

    // ---- channel lifecycle ----

    private void openChannelLocked() {
        opening = true;
        long attempt = ++openSequence;
        setStatusLocked(ConnectionStatus.CONNECTING);
        logger.debug("Opening channel to {} (attempt sequence {})", endpoint, attempt);
        Future<TransportChannel> future;
        try {
            future = transport.open(endpoint);
        } catch (RuntimeException e) {
            future = Future.failedFuture(e);
        }
        // may complete synchronously, so this must stay the last statement
        future.onComplete(ar -> onChannelOpened(attempt, ar));
    }

    private void onChannelOpened(long attempt, AsyncResult<TransportChannel> ar) {
        synchronized (lock) {
            if (attempt != openSequence || !opening) {
                if (ar.succeeded()) {
                    logger.debug("Closing channel from superseded attempt {}", attempt);
                    ar.result().close();
                }
                return;
            }
            opening = false;
            if (ar.failed()) {
                logger.warn("Connection to {} failed: {}", endpoint, ar.cause().getMessage());
                scheduleReconnectLocked();
            } else {
                TransportChannel opened = ar.result();
                channel = opened;
                authenticated = false;
                opened.textHandler(text -> onText(opened, text));
                opened.closeHandler(() -> onChannelClosed(opened));
                logger.debug("Channel open, authenticating as {}", options.getGatewayId());
                if (transmitLocked(new WireMessage.Authenticate(token, options.getGatewayId(),
                        options.getProtocolVersion()))) {
                    authTimerId = vertx.setTimer(options.getPongTimeout().toMillis(), this::onAuthTimeout);
                } else {
                    logger.warn("Could not send authentication to {}, dropping channel", endpoint);
                    dropChannelLocked();
                }
            }
        }
        drainEvents();
    }

    private void onText(TransportChannel source, String text) {
        WireMessage message;
        try {
            message = MessageCodec.decode(text);
        } catch (MessageValidationException e) {
            logger.warn("Dropping invalid inbound frame: {}", e.getMessage());
            emit(() -> validationListeners.notifyEach(l -> l.accept(e)));
            drainEvents();
            return;
        }
        synchronized (lock) {
            if (source != channel) {
                return;
            }
            if (message instanceof WireMessage.AuthResult result) {
                handleAuthResultLocked(result);
            } else if (message instanceof WireMessage.Pong) {
                cancelPongTimerLocked();
            } else if (authenticated) {
                emit(() -> messageListeners.notifyEach(l -> l.accept(message)));
            } else {
                logger.debug("Ignoring {} received before authentication", message.type());
            }
        }
        drainEvents();
    }

    private void handleAuthResultLocked(WireMessage.AuthResult result) {
        if (authenticated) {
            logger.debug("Ignoring duplicate auth result");
            return;
        }
        cancelAuthTimerLocked();
        if (result.ok()) {
            authenticated = true;
            reconnectAttempts = 0;
            authFailures = 0;
            boolean recovered = wasConnected;
            wasConnected = true;
            setStatusLocked(ConnectionStatus.CONNECTED);
            logger.info("Connected to {}", endpoint);
            if (recovered) {
                emit(() -> reconnectListeners.notifyEach(Runnable::run));
            }
            flushOutboundLocked();
            startHeartbeatLocked();
            return;
        }
        authFailures++;
        logger.warn("Authentication rejected: {}", result.error());
        closeChannelLocked();
        if (tokenRefresher != null && authFailures == 1) {
            logger.info("Retrying with a refreshed token");
            scheduleReconnectLocked();
        } else {
            shouldReconnect = false;
            setStatusLocked(ConnectionStatus.DISCONNECTED);
        }
    }

    private void onChannelClosed(TransportChannel source) {
        synchronized (lock) {
            if (source != channel) {
                return;
            }
            channel = null;
            authenticated = false;
            stopHeartbeatLocked();
            logger.warn("Connection to {} closed", endpoint);
            scheduleReconnectLocked();
        }
        drainEvents();
    }

    private void dropChannelLocked() {
        stopHeartbeatLocked();
        closeChannelLocked();
        scheduleReconnectLocked();
    }

    private void closeChannelLocked() {
        TransportChannel current = channel;
        channel = null;
        authenticated = false;
        if (current != null) {
            current.close();
        }
    }

    // ---- reconnect ----

    private void scheduleReconnectLocked() {
        stopHeartbeatLocked();
        if (!shouldReconnect) {
            setStatusLocked(ConnectionStatus.DISCONNECTED);
            return;
        }
        if (reconnectAttempts >= options.getMaxReconnectAttempts()) {
            logger.error("Giving up after {} reconnect attempts", reconnectAttempts);
            cancelReconnectTimerLocked();
            setStatusLocked(ConnectionStatus.DISCONNECTED);
            return;
        }
        long delay = options.reconnectDelayMs(reconnectAttempts);
        reconnectAttempts++;
        setStatusLocked(ConnectionStatus.RECONNECTING);
        cancelReconnectTimerLocked();
        logger.info("Reconnecting in {}ms (attempt {}/{})", delay, reconnectAttempts,
                options.getMaxReconnectAttempts());
        reconnectTimerId = vertx.setTimer(delay, this::onReconnectTimer);
    }

    private void onReconnectTimer(long timerId) {
        TokenRefresher refresher;
        long scheduledEpoch;
        synchronized (lock) {
            if (timerId != reconnectTimerId) {
                return;
            }
            reconnectTimerId = NO_TIMER;
            if (!shouldReconnect || channel != null || opening) {
                return;
            }
            refresher = tokenRefresher;
            scheduledEpoch = epoch;
            if (refresher == null) {
                openChannelLocked();
            }
        }
        if (refresher == null) {
            drainEvents();
            return;
        }
        Future<String> refreshed;
        try {
            refreshed = refresher.refresh();
        } catch (RuntimeException e) {
            refreshed = Future.failedFuture(e);
        }
        refreshed.onComplete(ar -> onTokenRefreshed(scheduledEpoch, ar));
    }

    private void onTokenRefreshed(long scheduledEpoch, AsyncResult<String> ar) {
        synchronized (lock) {
            if (scheduledEpoch != epoch || !shouldReconnect || channel != null || opening) {
                return;
            }
            if (ar.failed()) {
                logger.warn("Token refresh failed, reusing previous token: {}", ar.cause().getMessage());
            } else if (ar.result() == null) {
                logger.warn("Session expired, not reconnecting");
                shouldReconnect = false;
                setStatusLocked(ConnectionStatus.DISCONNECTED);
            } else {
                token = ar.result();
            }
            if (shouldReconnect) {
                openChannelLocked();
            }
        }
        drainEvents();
    }

    private void cancelReconnectTimerLocked() {
        if (reconnectTimerId != NO_TIMER) {
            vertx.cancelTimer(reconnectTimerId);
            reconnectTimerId = NO_TIMER;
        }
    }

    // ---- heartbeat ----

    private void startHeartbeatLocked() {
        stopHeartbeatLocked();
        heartbeatTimerId = vertx.setPeriodic(options.getHeartbeatInterval().toMillis(), this::onHeartbeatTick);
    }

    private void onHeartbeatTick(long timerId) {
        synchronized (lock) {
            if (timerId != heartbeatTimerId || !authenticated || pongTimerId != NO_TIMER) {
                return;
            }
            // armed first so a pong that arrives during the write finds the timer
            pongTimerId = vertx.setTimer(options.getPongTimeout().toMillis(), this::onPongTimeout);
            if (!transmitLocked(new WireMessage.Ping(System.currentTimeMillis()))) {
                cancelPongTimerLocked();
            }
        }
    }

    private void onPongTimeout(long timerId) {
        synchronized (lock) {
            if (timerId != pongTimerId) {
                return;
            }
            pongTimerId = NO_TIMER;
            logger.warn("No pong within {}ms, dropping connection", options.getPongTimeout().toMillis());
            dropChannelLocked();
        }
        drainEvents();
    }

    private void onAuthTimeout(long timerId) {
        synchronized (lock) {
            if (timerId != authTimerId) {
                return;
            }
            authTimerId = NO_TIMER;
            logger.warn("No auth result within {}ms, dropping connection", options.getPongTimeout().toMillis());
            dropChannelLocked();
        }
        drainEvents();
    }

    private void cancelAuthTimerLocked() {
        if (authTimerId != NO_TIMER) {
            vertx.cancelTimer(authTimerId);
            authTimerId = NO_TIMER;
        }
    }

    private void cancelPongTimerLocked() {
        if (pongTimerId != NO_TIMER) {
            vertx.cancelTimer(pongTimerId);
            pongTimerId = NO_TIMER;
        }
    }

    private void stopHeartbeatLocked() {
        if (heartbeatTimerId != NO_TIMER) {
            vertx.cancelTimer(heartbeatTimerId);
            heartbeatTimerId = NO_TIMER;
        }
        cancelPongTimerLocked();
        cancelAuthTimerLocked();
    }

    // ---- status and events ----

    private void setStatusLocked(ConnectionStatus next) {
        if (status == next) {
            return;
        }
        if (!status.canTransitionTo(next)) {
            logger.warn("Unexpected status transition {} -> {}", status, next);
        }
        logger.debug("Status {} -> {}", status, next);
        status = next;
        emit(() -> statusListeners.notifyEach(l -> l.accept(next)));
    }

    private void subscribeNetworkLocked() {
        if (networkMonitor != null && networkSubscription == null) {
            networkSubscription = networkMonitor.subscribe(new NetworkMonitor.NetworkListener() {
                @Override
                public void onOnline() {
                    onNetworkOnline();
                }

                @Override
                public void onOffline() {
                    onNetworkOffline();
                }
            });
        }
    }

    private void emit(Runnable event) {
        events.add(event);
    }

    /**
     * Runs queued listener notifications on the calling thread unless another
     * thread is already doing so. A call made while holding the lock (a
     * transport that completes synchronously) leaves the events for the
     * outermost caller.
     */
    private void drainEvents() {
        if (Thread.holdsLock(lock)) {
            return;
        }
        do {
            if (!draining.compareAndSet(false, true)) {
                return;
            }
            try {
                Runnable event;
                while ((event = events.poll()) != null) {
                    event.run();
                }
            } finally {
                draining.set(false);
            }
        } while (!events.isEmpty());
    }
}
