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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("EndpointResolver Tests")
class EndpointResolverTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
        "http://localhost:3000,            ws://localhost:3000/ws/gateway",
        "https://chat.example.com,         wss://chat.example.com/ws/gateway",
        "ws://10.0.0.5:8080,               ws://10.0.0.5:8080/ws/gateway",
        "wss://chat.example.com:8443,      wss://chat.example.com:8443/ws/gateway",
        "HTTPS://chat.example.com/api/v1,  wss://chat.example.com/ws/gateway",
        "http://localhost:3000/?debug=1,   ws://localhost:3000/ws/gateway"
    })
    @DisplayName("Should map the server URL onto the gateway WebSocket endpoint")
    void testResolve(String serverUrl, String expected) {
        assertThat(EndpointResolver.resolve(serverUrl)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"ftp://example.com", "localhost:3000", "", "   ", "http://"})
    @DisplayName("Should reject URLs that cannot carry a gateway connection")
    void testResolveRejects(String serverUrl) {
        assertThatThrownBy(() -> EndpointResolver.resolve(serverUrl))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reject a null URL")
    void testResolveNull() {
        assertThatIllegalArgumentException().isThrownBy(() -> EndpointResolver.resolve(null));
    }

    @Test
    @DisplayName("Should fall back to the scheme default port")
    void testPort() {
        assertThat(EndpointResolver.port("http://example.com")).isEqualTo(80);
        assertThat(EndpointResolver.port("https://example.com")).isEqualTo(443);
        assertThat(EndpointResolver.port("wss://example.com")).isEqualTo(443);
        assertThat(EndpointResolver.port("http://example.com:3000")).isEqualTo(3000);
        assertThat(EndpointResolver.host("https://chat.example.com:8443/x")).isEqualTo("chat.example.com");
    }
}
