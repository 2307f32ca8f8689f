package com.mailroute.gateway.health;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.store.InMemoryProviderStore;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.*;

import java.io.IOException;

import static org.assertj.core.api.Assertions.*;

class HealthServerTest {

    private final OkHttpClient http   = new OkHttpClient();
    private final ObjectMapper mapper = new ObjectMapper();

    private InMemoryProviderStore store;
    private ProviderHealthTracker tracker;
    private HealthServer          server;

    @BeforeEach
    void setup() throws Exception {
        store   = new InMemoryProviderStore();
        tracker = new ProviderHealthTracker(store);
        store.saveProvider(EmailProvider.builder("sg")
                .providerName("SendGrid")
                .apiKeyEncrypted("ciphertext-never-shown")
                .maxPerHour(100)
                .build());
        server = new HealthServer(0, store, tracker);
        server.start();
    }

    @AfterEach
    void teardown() {
        server.stop();
    }

    @Test
    void health_reflectsReadiness() throws Exception {
        assertThat(get("/health").code()).isEqualTo(503);
        assertThat(get("/health/ready").code()).isEqualTo(503);
        assertThat(get("/health/live").code()).isEqualTo(200);

        server.markReady();

        assertThat(get("/health").code()).isEqualTo(200);
        assertThat(get("/health/ready").code()).isEqualTo(200);
    }

    @Test
    void providers_listsCountersWithoutCredentials() throws Exception {
        tracker.recordSuccess(store.getProvider("sg").orElseThrow());

        final Result result = get("/health/providers");

        assertThat(result.code()).isEqualTo(200);
        assertThat(result.body()).doesNotContain("ciphertext-never-shown");
        final JsonNode rows = mapper.readTree(result.body());
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).path("providerId").asText()).isEqualTo("sg");
        assertThat(rows.get(0).path("providerName").asText()).isEqualTo("SendGrid");
        assertThat(rows.get(0).path("hourlyCount").asInt()).isEqualTo(1);
        assertThat(rows.get(0).path("maxPerHour").asInt()).isEqualTo(100);
        assertThat(rows.get(0).path("canSend").asBoolean()).isTrue();
    }

    @Test
    void reset_clearsConsecutiveFailures() throws Exception {
        final EmailProvider sg = store.getProvider("sg").orElseThrow();
        for (int i = 0; i < ProviderHealthTracker.FAILURE_THRESHOLD; i++) {
            tracker.recordFailure(sg, "down");
        }
        assertThat(tracker.canSend(sg)).isFalse();

        final Result result = post("/health/providers/sg/reset");

        assertThat(result.code()).isEqualTo(200);
        assertThat(tracker.canSend(store.getProvider("sg").orElseThrow())).isTrue();
        assertThat(store.getProvider("sg").orElseThrow().getConsecutiveFailures()).isZero();
    }

    @Test
    void reset_returns404_forUnknownProvider() throws Exception {
        assertThat(post("/health/providers/ghost/reset").code()).isEqualTo(404);
        assertThat(get("/health/providers/sg/unknown").code()).isEqualTo(404);
    }

    @Test
    void reset_returns404_whenProviderIdIsMissing() throws Exception {
        assertThat(post("/health/providers/reset").code()).isEqualTo(404);
        assertThat(post("/health/providers//reset").code()).isEqualTo(404);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static final class Result {
        private final int    code;
        private final String body;

        Result(final int code, final String body) {
            this.code = code;
            this.body = body;
        }

        int    code() { return code; }
        String body() { return body; }
    }

    private Result get(final String path) throws IOException {
        return call(new Request.Builder().url(url(path)).get().build());
    }

    private Result post(final String path) throws IOException {
        return call(new Request.Builder().url(url(path)).post(RequestBody.create(new byte[0])).build());
    }

    private Result call(final Request request) throws IOException {
        try (Response response = http.newCall(request).execute()) {
            return new Result(response.code(), response.body() != null ? response.body().string() : "");
        }
    }

    private String url(final String path) {
        return "http://localhost:" + server.getPort() + path;
    }
}
