package com.mailroute.gateway.channel;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.ProbeResult;
import com.mailroute.gateway.model.ProviderCapabilities;
import com.mailroute.gateway.security.CredentialCipher;
import com.mailroute.gateway.security.LogSanitizer;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Relays the message as JSON to an automation webhook (Pabbly Connect and
 * similar), which performs the actual delivery.
 *
 * <p>The webhook URL is the provider's {@code apiEndpoint}. When an API key
 * is configured it is sent as a bearer token. Attachments are not relayed.
 */
public class WebhookProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(WebhookProviderAdapter.class);

    private static final ProviderCapabilities CAPABILITIES =
            new ProviderCapabilities(false, true, false, 100, 0L);

    public WebhookProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        super(provider, cipher, tracker);
    }

    @Override
    protected String errorFamily() { return ErrorCodes.WEBHOOK_ERROR; }

    @Override
    public ProviderCapabilities getCapabilities() { return CAPABILITIES; }

    @Override
    public AttemptResult send(final EmailMessage message) {
        final AttemptResult rejected = checkCapabilities(message);
        if (rejected != null) return rejected;

        final String url = provider.getApiEndpoint();
        if (url == null || url.isBlank()) {
            return failure(ErrorCodes.WEBHOOK_ERROR, "Webhook URL not configured", null);
        }

        try {
            final Request.Builder b = new Request.Builder()
                    .url(url)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(buildPayload(message), JSON));
            authorize(b);

            try (Response response = http.newCall(b.build()).execute()) {
                final int    code = response.code();
                final String body = bodyOf(response);
                if (response.isSuccessful()) {
                    final String msgId = parseOrEmpty(body).path("messageId")
                            .asText("webhook-" + System.currentTimeMillis());
                    LOG.info("Webhook relay accepted email: provider={} to={} msgId={}",
                            provider.getId(), LogSanitizer.maskEmails(message.getTo()), msgId);
                    return success(msgId);
                }
                LOG.warn("Webhook returned error: provider={} http={} body={}",
                        provider.getId(), code, LogSanitizer.sanitize(body));
                return failure(ErrorCodes.WEBHOOK_ERROR,
                        "Webhook returned " + code + ": " + response.message(), String.valueOf(code));
            }
        } catch (CredentialCipher.CredentialException e) {
            LOG.error("Webhook credentials unavailable: provider={}", provider.getId());
            return credentialsUnavailable(e);
        } catch (IOException e) {
            LOG.error("Webhook IO error: provider={} error={}", provider.getId(), e.getMessage());
            return failure(ErrorCodes.WEBHOOK_ERROR, String.valueOf(e.getMessage()), null);
        } catch (RuntimeException e) {
            LOG.error("Webhook unexpected error: provider={}", provider.getId(), e);
            return failure(ErrorCodes.WEBHOOK_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    /** {@code HEAD} on the webhook URL; 2xx or 405 means reachable. */
    @Override
    public ProbeResult test() {
        final String url = provider.getApiEndpoint();
        if (url == null || url.isBlank()) {
            return ProbeResult.failed("Webhook URL not configured");
        }
        try {
            final Request.Builder b = new Request.Builder().url(url).head();
            authorize(b);
            try (Response response = http.newCall(b.build()).execute()) {
                if (response.isSuccessful() || response.code() == 405) {
                    return ProbeResult.ok();
                }
                return ProbeResult.failed("Webhook unreachable: " + response.code());
            }
        } catch (CredentialCipher.CredentialException e) {
            return ProbeResult.failed("Webhook test failed: credentials unavailable");
        } catch (IOException | RuntimeException e) {
            return ProbeResult.failed("Webhook test failed: " + e.getMessage());
        }
    }

    private void authorize(final Request.Builder b) {
        final String key = provider.getApiKeyEncrypted();
        if (key != null && !key.isBlank()) {
            b.addHeader("Authorization", "Bearer " + cipher.decrypt(key));
        }
    }

    private String buildPayload(final EmailMessage message) {
        final ObjectNode root = mapper.createObjectNode();
        final ObjectNode from = root.putObject("from");
        from.put("name",  fromName(message));
        from.put("email", fromEmail(message));
        addAll(root.putArray("to"), message.getTo());
        if (!message.getCc().isEmpty())  addAll(root.putArray("cc"),  message.getCc());
        if (!message.getBcc().isEmpty()) addAll(root.putArray("bcc"), message.getBcc());
        root.put("subject", message.getSubject());
        root.put("html",    message.getHtml());
        root.put("text",    message.plainText());
        final String replyTo = replyTo(message);
        if (replyTo != null) root.put("replyTo", replyTo);
        if (!message.getMetadata().isEmpty()) {
            root.set("metadata", mapper.valueToTree(message.getMetadata()));
        }
        return toJson(root);
    }

    private static void addAll(final ArrayNode target, final List<String> values) {
        values.forEach(target::add);
    }
}
