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

import dev.mars.parley.core.exceptions.MessageValidationException;
import dev.mars.parley.protocol.MessageCodec;
import dev.mars.parley.protocol.MessageType;
import dev.mars.parley.protocol.WireMessage;
import io.vertx.core.Future;
import io.vertx.core.Promise;

import java.net.ConnectException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-process {@link Transport} for tests. Opening succeeds synchronously
 * unless connections are refused or deferred; the test plays the server by
 * delivering frames to the channel and reading what the client wrote.
 */
public class InMemoryTransport implements Transport {

    private final List<InMemoryChannel> channels = new CopyOnWriteArrayList<>();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private volatile boolean refuseConnections;
    private volatile boolean deferOpen;
    private volatile boolean failSends;
    private volatile Promise<TransportChannel> pendingOpen;

    @Override
    public Future<TransportChannel> open(String endpoint) {
        openAttempts.incrementAndGet();
        if (refuseConnections) {
            return Future.failedFuture(new ConnectException("Connection refused: " + endpoint));
        }
        if (deferOpen) {
            Promise<TransportChannel> promise = Promise.promise();
            pendingOpen = promise;
            return promise.future();
        }
        return Future.succeededFuture(newChannel());
    }

    /**
     * Completes a deferred open with a fresh channel.
     */
    public InMemoryChannel completePendingOpen() {
        Promise<TransportChannel> promise = pendingOpen;
        if (promise == null) {
            throw new IllegalStateException("No pending open");
        }
        pendingOpen = null;
        InMemoryChannel channel = newChannel();
        promise.complete(channel);
        return channel;
    }

    public void setRefuseConnections(boolean refuseConnections) {
        this.refuseConnections = refuseConnections;
    }

    public void setDeferOpen(boolean deferOpen) {
        this.deferOpen = deferOpen;
    }

    /**
     * Makes every write on channels opened from now on fail.
     */
    public void setFailSends(boolean failSends) {
        this.failSends = failSends;
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    public List<InMemoryChannel> channels() {
        return channels;
    }

    public InMemoryChannel lastChannel() {
        if (channels.isEmpty()) {
            throw new IllegalStateException("No channel opened yet");
        }
        return channels.get(channels.size() - 1);
    }

    private InMemoryChannel newChannel() {
        InMemoryChannel channel = new InMemoryChannel();
        channel.failSends = failSends;
        channels.add(channel);
        return channel;
    }

    public static class InMemoryChannel implements TransportChannel {

        private final List<String> sent = new CopyOnWriteArrayList<>();
        private volatile Consumer<String> textHandler = text -> { };
        private volatile Runnable closeHandler = () -> { };
        private volatile Consumer<WireMessage> sendHook = message -> { };
        private volatile boolean open = true;
        private volatile boolean failSends;

        @Override
        public void textHandler(Consumer<String> handler) {
            this.textHandler = handler;
        }

        @Override
        public void closeHandler(Runnable handler) {
            this.closeHandler = handler;
        }

        @Override
        public void send(String text) {
            if (!open) {
                throw new IllegalStateException("Channel is closed");
            }
            if (failSends) {
                throw new IllegalStateException("Write failed");
            }
            sent.add(text);
            sendHook.accept(decode(text));
        }

        @Override
        public void close() {
            if (open) {
                open = false;
                closeHandler.run();
            }
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        // ---- server side ----

        public void deliver(WireMessage message) {
            deliver(MessageCodec.encode(message));
        }

        public void deliver(String frame) {
            textHandler.accept(frame);
        }

        public void acceptAuth() {
            deliver(new WireMessage.AuthResult(true, null));
        }

        public void rejectAuth(String error) {
            deliver(new WireMessage.AuthResult(false, error));
        }

        /**
         * Simulates the server dropping the connection.
         */
        public void serverClose() {
            close();
        }

        /**
         * Called with every message the client writes, after it is recorded.
         */
        public void onSend(Consumer<WireMessage> hook) {
            this.sendHook = hook;
        }

        public List<WireMessage> sentMessages() {
            List<WireMessage> messages = new ArrayList<>();
            for (String text : sent) {
                messages.add(decode(text));
            }
            return messages;
        }

        public List<MessageType> sentTypes() {
            List<MessageType> types = new ArrayList<>();
            for (WireMessage message : sentMessages()) {
                types.add(message.type());
            }
            return types;
        }

        private static WireMessage decode(String text) {
            try {
                return MessageCodec.decode(text);
            } catch (MessageValidationException e) {
                throw new IllegalStateException("Client wrote an invalid frame: " + text, e);
            }
        }
    }
}
