package com.mailroute.gateway.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.security.CredentialCipher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Response;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Base for adapters that talk to a vendor over HTTP with OkHttp and Jackson.
 */
abstract class AbstractHttpProviderAdapter extends AbstractProviderAdapter {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    protected final OkHttpClient http;
    protected final ObjectMapper mapper = new ObjectMapper();

    protected AbstractHttpProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        super(provider, cipher, tracker);
        this.http = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .writeTimeout(15, TimeUnit.SECONDS)
                .build();
    }

    /** The configured endpoint, or {@code defaultEndpoint} when none is set. */
    protected String endpointOr(final String defaultEndpoint) {
        final String configured = provider.getApiEndpoint();
        return configured != null && !configured.isBlank() ? configured : defaultEndpoint;
    }

    /** Resolve an absolute path against the host of {@code endpoint}. */
    protected static HttpUrl sibling(final String endpoint, final String path) {
        final HttpUrl base = HttpUrl.get(endpoint);
        return base.newBuilder().encodedPath(path).query(null).build();
    }

    protected static String bodyOf(final Response response) throws IOException {
        return response.body() != null ? response.body().string() : "";
    }

    protected JsonNode parseOrEmpty(final String body) {
        try {
            return body == null || body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
        } catch (IOException e) {
            return mapper.createObjectNode();
        }
    }

    protected String toJson(final Object node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize " + provider.getProviderType().tag() + " payload", e);
        }
    }

    @Override
    public void close() {
        http.dispatcher().executorService().shutdown();
        http.connectionPool().evictAll();
    }
}
