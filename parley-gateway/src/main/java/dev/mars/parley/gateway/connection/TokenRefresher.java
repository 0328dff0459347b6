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
 * Supplies a fresh session token before a reconnect attempt.
 *
 * <p>Completion semantics:</p>
 * <ul>
 *   <li>succeeded with a token: use it for the next handshake</li>
 *   <li>succeeded with {@code null}: the session has expired and the client stops reconnecting</li>
 *   <li>failed: a transient problem, the previous token is reused</li>
 * </ul>
 */
@FunctionalInterface
public interface TokenRefresher {

    Future<String> refresh();
}
