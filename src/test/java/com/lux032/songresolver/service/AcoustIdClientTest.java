package com.lux032.songresolver.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lux032.songresolver.config.ResolverConfig;
import com.lux032.songresolver.model.AudioFingerprint;
import com.lux032.songresolver.model.CorrectionSubmission;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcoustIdClientTest {

    private static final AudioFingerprint FINGERPRINT = new AudioFingerprint(215, "AQADtEmUZEkSRU");

    private HttpServer server;
    private ResolverConfig config;
    private AcoustIdClient client;

    private final List<Map<String, String>> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile int failuresBeforeSuccess;
    private volatile int failureStatus = 503;
    private volatile String responseBody = "{\"status\":\"ok\",\"results\":[]}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v2/lookup", this::handle);
        server.createContext("/v2/submit", this::handle);
        server.start();

        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        config = new ResolverConfig();
        config.setAcoustIdApiKey("app-key");
        config.setAcoustIdUserKey("user-key");
        config.setAcoustIdApiUrl(baseUrl + "/v2/lookup");
        config.setAcoustIdSubmitUrl(baseUrl + "/v2/submit");
        config.setHttpTimeoutSeconds(5);
        config.setMaxRetries(2);
        config.setRetryDelayMillis(10);
        client = new AcoustIdClient(config);
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(parseForm(body));

        int status = calls.incrementAndGet() <= failuresBeforeSuccess ? failureStatus : 200;
        byte[] bytes = (status == 200 ? responseBody : "{\"status\":\"error\"}").getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static Map<String, String> parseForm(String body) {
        Map<String, String> params = new HashMap<>();
        for (String pair : body.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0) {
                params.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    @Test
    @DisplayName("lookup posts the fingerprint with recordings and release-group metadata")
    void lookup() throws Exception {
        responseBody = "{\"status\":\"ok\",\"results\":[{\"score\":0.9,\"id\":\"x\"}]}";

        JsonNode response = client.lookup(FINGERPRINT);

        assertThat(response.path("results").get(0).path("score").asDouble()).isEqualTo(0.9);
        assertThat(requests).hasSize(1);
        assertThat(requests.get(0))
            .containsEntry("client", "app-key")
            .containsEntry("duration", "215")
            .containsEntry("fingerprint", "AQADtEmUZEkSRU")
            .containsEntry("meta", "recordings releasegroups compress");
    }

    @Test
    @DisplayName("retries server errors and succeeds within the retry budget")
    void retriesServerErrors() throws Exception {
        failuresBeforeSuccess = 2;

        JsonNode response = client.lookup(FINGERPRINT);

        assertThat(response.path("status").asText()).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("gives up after the retry budget is exhausted")
    void exhaustsRetries() {
        failuresBeforeSuccess = 10;

        assertThatThrownBy(() -> client.lookup(FINGERPRINT))
            .isInstanceOf(LookupServiceException.class)
            .hasMessageContaining("503");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("does not retry client errors")
    void clientErrorsAreFatal() {
        failuresBeforeSuccess = 10;
        failureStatus = 400;

        assertThatThrownBy(() -> client.lookup(FINGERPRINT)).isInstanceOf(LookupServiceException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("an error status in the body is a lookup failure")
    void errorStatus() {
        responseBody = "{\"status\":\"error\",\"error\":{\"code\":4,\"message\":\"invalid API key\"}}";

        assertThatThrownBy(() -> client.lookup(FINGERPRINT))
            .isInstanceOf(LookupServiceException.class)
            .hasMessageContaining("invalid API key");
    }

    @Test
    @DisplayName("submission posts the corrected metadata with indexed parameters")
    void submit() throws Exception {
        responseBody = "{\"status\":\"ok\",\"submissions\":[{\"id\":1,\"status\":\"pending\"}]}";

        client.submit(new CorrectionSubmission(215, "AQADtEmUZEkSRU", "Artist", "Title", "Album", "Artist", "MP3"));

        assertThat(requests.get(0))
            .containsEntry("client", "app-key")
            .containsEntry("user", "user-key")
            .containsEntry("duration.0", "215")
            .containsEntry("fingerprint.0", "AQADtEmUZEkSRU")
            .containsEntry("artist.0", "Artist")
            .containsEntry("track.0", "Title")
            .containsEntry("album.0", "Album")
            .containsEntry("albumartist.0", "Artist")
            .containsEntry("fileformat.0", "MP3");
    }

    @Test
    @DisplayName("lookup requires an application key")
    void requiresApiKey() {
        config.setAcoustIdApiKey("");

        assertThatThrownBy(() -> client.lookup(FINGERPRINT)).isInstanceOf(IllegalStateException.class);
    }
}
