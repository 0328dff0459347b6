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

/**
 * Opens duplex text channels to a remote endpoint.
 *
 * <p>The connection client owns at most one channel at a time and never
 * assumes anything about how the channel is carried, which keeps the
 * reconnect state machine testable without a network.</p>
 */
public interface Transport {

    /**
     * Opens a channel.
     *
     * @param endpoint absolute endpoint URI, e.g. {@code wss://host/ws/gateway}
     * @return a future completed with the open channel, or failed if the
     *         endpoint could not be reached
     */
    Future<TransportChannel> open(String endpoint);

    /**
     * Releases transport resources. Channels already handed out are not affected.
     */
    default Future<Void> close() {
        return Future.succeededFuture();
    }
}
