/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.stereo.server.config.ServerConfig;
import io.stereo.server.config.SessionSettings;
import io.stereo.server.internal.discovery.DiscoveryProviders;
import io.stereo.server.internal.session.SessionTransport;
import io.stereo.server.internal.store.SqliteCatalogStore;

import static org.assertj.core.api.Assertions.assertThat;

class StereoServerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path home;

    private StereoServer server;
    private EventCollector collector;
    private WebSocket webSocket;

    @BeforeEach
    void setUp() throws Exception {
        ServerConfig config = new ServerConfig(home, "127.0.0.1", 0, 0, false, SessionSettings.defaults());
        server = new StereoServer(config, new SqliteCatalogStore(), DiscoveryProviders.empty()).startup();
        collector = new EventCollector();
        webSocket = HttpClient.newHttpClient()
                .newWebSocketBuilder()
                .connectTimeout(TIMEOUT)
                .buildAsync(URI.create("ws://127.0.0.1:" + server.localPort() + "/ws"), collector)
                .get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
    }

    @AfterEach
    void tearDown() throws Exception {
        webSocket.abort();
        server.shutdown();
    }

    @Test
    void shouldGreetNewClientWithBackendInfoAndDefaultCollection() throws Exception {
        // When
        JsonNode first = collector.next();
        JsonNode second = collector.next();

        // Then
        assertThat(first.get("type").asText()).isEqualTo("backend-info");
        assertThat(first.has("version")).isTrue();
        assertThat(second.get("type").asText()).isEqualTo("default-collection");
        assertThat(second.at("/collection/path").asText()).isEqualTo(home.resolve(ServerConfig.DEFAULT_COLLECTION_FILE).toString());
        assertThat(second.at("/collection/size").asInt()).isZero();
        assertThat(home.resolve(ServerConfig.DEFAULT_COLLECTION_FILE)).exists();
    }

    @Test
    void shouldEchoHeartbeat() throws Exception {
        // Given
        collector.next();
        collector.next();

        // When
        webSocket.sendText("{\"type\":\"heartbeat\",\"timestamp\":1700000000000}", true).get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);

        // Then
        JsonNode echo = collector.next();
        assertThat(echo.get("type").asText()).isEqualTo("heartbeat");
        assertThat(echo.get("timestamp").asLong()).isEqualTo(1700000000000L);
    }

    @Test
    void shouldWarnClientsAndCloseOnShutdown() throws Exception {
        // Given
        collector.next();
        collector.next();

        // When
        server.shutdown();

        // Then
        JsonNode notification = collector.next();
        assertThat(notification.get("type").asText()).isEqualTo("notification");
        assertThat(notification.get("message").asText()).isEqualTo(StereoServer.SHUTDOWN_MESSAGE);
        assertThat(notification.get("kind").asText()).isEqualTo("warn");
        assertThat(collector.closeStatus.get(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)).isEqualTo(SessionTransport.GOING_AWAY);
    }

    /**
     * Splits every batch the server sends into its events.
     */
    private static final class EventCollector implements WebSocket.Listener {

        private final BlockingQueue<JsonNode> events = new LinkedBlockingQueue<>();
        private final StringBuilder partial = new StringBuilder();
        private final CompletableFuture<Integer> closeStatus = new CompletableFuture<>();

        JsonNode next() throws InterruptedException {
            JsonNode event = events.poll(TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            assertThat(event).as("event within %s", TIMEOUT).isNotNull();
            return event;
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                try {
                    JSON.readTree(partial.toString()).forEach(events::add);
                }
                catch (JsonProcessingException e) {
                    throw new UncheckedIOException(e);
                }
                partial.setLength(0);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            closeStatus.complete(statusCode);
            return null;
        }
    }
}
