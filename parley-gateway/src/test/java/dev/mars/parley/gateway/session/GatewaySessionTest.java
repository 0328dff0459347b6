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

package dev.mars.parley.gateway.session;

import dev.mars.parley.core.AgentPresence;
import dev.mars.parley.core.ConnectionStatus;
import dev.mars.parley.core.WorkItem;
import dev.mars.parley.core.exceptions.DuplicateAgentException;
import dev.mars.parley.gateway.connection.ConnectionClient;
import dev.mars.parley.gateway.connection.ConnectionOptions;
import dev.mars.parley.gateway.connection.InMemoryTransport;
import dev.mars.parley.gateway.connection.InMemoryTransport.InMemoryChannel;
import dev.mars.parley.gateway.scheduler.AgentAdapter;
import dev.mars.parley.gateway.scheduler.SchedulerOptions;
import dev.mars.parley.gateway.scheduler.WorkCompletion;
import dev.mars.parley.protocol.MessageType;
import dev.mars.parley.protocol.WireMessage;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link GatewaySession} wired to a {@link ConnectionClient} over the
 * in-process transport.
 */
@ExtendWith(VertxExtension.class)
@DisplayName("GatewaySession Tests")
class GatewaySessionTest {

    private Vertx vertx;
    private InMemoryTransport transport;
    private ConnectionClient client;
    private GatewaySession session;

    @BeforeEach
    void setUp(Vertx vertx) {
        this.vertx = vertx;
        this.transport = new InMemoryTransport();
        this.client = new ConnectionClient(vertx, transport, "ws://localhost:3000/ws/gateway",
                ConnectionOptions.builder()
                        .gatewayId("gw-session")
                        .reconnectBaseDelay(Duration.ofMillis(10))
                        .reconnectMaxDelay(Duration.ofMillis(40))
                        .build());
        this.session = new GatewaySession(vertx, client, SchedulerOptions.defaults(), null);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private InMemoryChannel startAndAuthenticate() {
        session.start("token-1");
        InMemoryChannel channel = transport.lastChannel();
        channel.acceptAuth();
        return channel;
    }

    private static WireMessage.SendToAgent sendTo(String agentId, String messageId, String content) {
        return new WireMessage.SendToAgent(agentId, messageId, content, "room-1", "alice");
    }

    /**
     * Holds every item until the test settles it.
     */
    private static final class HoldingAdapter implements AgentAdapter {
        final List<WorkCompletion> held = new CopyOnWriteArrayList<>();

        @Override
        public String type() {
            return "holding";
        }

        @Override
        public void dispatch(WorkItem item, WorkCompletion completion) {
            held.add(completion);
        }
    }

    // ==================== Registration ====================

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Should register agents right after the handshake")
        void testRegisterAfterAuth() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));

            InMemoryChannel channel = startAndAuthenticate();

            assertThat(channel.sentMessages()).containsExactly(
                    new WireMessage.Authenticate("token-1", "gw-session", 1),
                    new WireMessage.RegisterAgent("gw:echo", "echo", "echo"));
        }

        @Test
        @DisplayName("Should register again after every reconnect")
        void testReRegisterOnReconnect() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));
            InMemoryChannel first = startAndAuthenticate();

            first.serverClose();
            await().atMost(2, SECONDS).until(() -> transport.openAttempts() == 2);
            InMemoryChannel second = transport.lastChannel();
            second.acceptAuth();

            assertThat(second.sentMessages())
                    .filteredOn(WireMessage.RegisterAgent.class::isInstance)
                    .containsExactly(new WireMessage.RegisterAgent("gw:echo", "echo", "echo"));
        }

        @Test
        @DisplayName("Should send a registration at once for an agent added while connected")
        void testAddWhileConnected() throws Exception {
            InMemoryChannel channel = startAndAuthenticate();

            session.addAgent("gw:late", "late", new EchoAgentAdapter(vertx, 0));

            assertThat(channel.sentTypes()).containsExactly(MessageType.CLIENT_AUTH,
                    MessageType.GATEWAY_REGISTER_AGENT);
            assertThat(session.agentIds()).containsExactly("gw:late");
        }

        @Test
        @DisplayName("Should reject an agent id that is already in use")
        void testDuplicateAgent() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));

            assertThatThrownBy(() -> session.addAgent("gw:echo", "other", new EchoAgentAdapter(vertx, 0)))
                    .isInstanceOf(DuplicateAgentException.class);
            assertThat(session.agentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should unregister an agent the server removes")
        void testServerRemovesAgent() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(new WireMessage.RemoveAgent("gw:echo"));

            assertThat(channel.sentMessages()).endsWith(new WireMessage.UnregisterAgent("gw:echo"));
            assertThat(session.agentIds()).isEmpty();
            assertThat(session.getScheduler().isRegistered("gw:echo")).isFalse();
            assertThat(session.removeAgent("gw:echo")).isFalse();
        }
    }

    // ==================== Work ====================

    @Nested
    @DisplayName("Work")
    class WorkTests {

        @Test
        @DisplayName("Should run server work and report status and completion")
        void testEchoRoundTrip() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(sendTo("gw:echo", "m-1", "hello"));

            await().atMost(2, SECONDS).until(() ->
                    channel.sentTypes().contains(MessageType.GATEWAY_MESSAGE_COMPLETE));
            await().atMost(2, SECONDS).until(() -> channel.sentMessages()
                    .contains(new WireMessage.AgentStatusUpdate("gw:echo", AgentPresence.ONLINE, 0)));

            assertThat(channel.sentMessages())
                    .filteredOn(m -> !(m instanceof WireMessage.Ping))
                    .containsSubsequence(
                            new WireMessage.AgentStatusUpdate("gw:echo", AgentPresence.BUSY, 0),
                            new WireMessage.MessageComplete("gw:echo", "m-1", "room-1", "hello", false),
                            new WireMessage.AgentStatusUpdate("gw:echo", AgentPresence.ONLINE, 0));
        }

        @Test
        @DisplayName("Should answer work that does not fit the queue with an error completion")
        void testQueueFullReported() throws Exception {
            session.close();
            session = new GatewaySession(vertx, client, SchedulerOptions.builder().queueCapacity(1).build(), null);
            HoldingAdapter adapter = new HoldingAdapter();
            session.addAgent("gw:slow", "slow", adapter);
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(sendTo("gw:slow", "m-1", "one"));
            channel.deliver(sendTo("gw:slow", "m-2", "two"));
            channel.deliver(sendTo("gw:slow", "m-3", "three"));

            assertThat(adapter.held).hasSize(1);
            assertThat(channel.sentMessages())
                    .filteredOn(WireMessage.MessageComplete.class::isInstance)
                    .singleElement()
                    .satisfies(m -> {
                        WireMessage.MessageComplete complete = (WireMessage.MessageComplete) m;
                        assertThat(complete.messageId()).isEqualTo("m-3");
                        assertThat(complete.roomId()).isEqualTo("room-1");
                        assertThat(complete.error()).isTrue();
                    });
        }

        @Test
        @DisplayName("Should queue completions while disconnected and deliver them after reconnecting")
        void testCompletionSurvivesDisconnect() throws Exception {
            HoldingAdapter adapter = new HoldingAdapter();
            session.addAgent("gw:slow", "slow", adapter);
            InMemoryChannel first = startAndAuthenticate();
            first.deliver(sendTo("gw:slow", "m-1", "one"));

            first.serverClose();
            adapter.held.get(0).complete("answer");

            await().atMost(2, SECONDS).until(() -> transport.openAttempts() == 2);
            InMemoryChannel second = transport.lastChannel();
            second.acceptAuth();

            assertThat(second.sentMessages())
                    .contains(new WireMessage.MessageComplete("gw:slow", "m-1", "room-1", "answer", false));
        }

        @Test
        @DisplayName("Should ignore work for agents it does not host")
        void testUnknownAgentIgnored() {
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(sendTo("elsewhere", "m-1", "hi"));
            channel.deliver(new WireMessage.StopAgent("elsewhere"));

            assertThat(channel.sentTypes()).containsExactly(MessageType.CLIENT_AUTH);
        }

        @Test
        @DisplayName("Should abort in-flight work when the server stops the agent")
        void testStopAgent() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 10_000));
            InMemoryChannel channel = startAndAuthenticate();
            channel.deliver(sendTo("gw:echo", "m-1", "hello"));

            channel.deliver(new WireMessage.StopAgent("gw:echo"));

            await().atMost(2, SECONDS).until(() ->
                    channel.sentTypes().contains(MessageType.GATEWAY_MESSAGE_COMPLETE));
            assertThat(channel.sentMessages())
                    .contains(new WireMessage.MessageComplete("gw:echo", "m-1", "room-1", "Aborted", true));
        }
    }

    // ==================== Lifecycle ====================

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should disconnect when the server reports a protocol version mismatch")
        void testProtocolMismatch() {
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(new WireMessage.ServerError(InboundMessageRouter.PROTOCOL_VERSION_MISMATCH,
                    "upgrade required"));

            assertThat(client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
            assertThat(channel.isOpen()).isFalse();
        }

        @Test
        @DisplayName("Should stay connected on other server errors")
        void testOtherServerError() {
            InMemoryChannel channel = startAndAuthenticate();

            channel.deliver(new WireMessage.ServerError("RATE_LIMITED", "slow down"));

            assertThat(client.isConnected()).isTrue();
        }

        @Test
        @DisplayName("Should close once and refuse further use")
        void testCloseIdempotent() throws Exception {
            session.addAgent("gw:echo", "echo", new EchoAgentAdapter(vertx, 0));
            startAndAuthenticate();

            session.close();
            session.close();

            assertThat(session.isClosed()).isTrue();
            assertThat(session.agentCount()).isZero();
            assertThat(client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
            assertThatIllegalStateException().isThrownBy(() -> session.start("token-2"));
        }
    }
}
