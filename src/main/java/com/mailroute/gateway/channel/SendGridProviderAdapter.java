package com.mailroute.gateway.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailAttachment;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.ProbeResult;
import com.mailroute.gateway.model.ProviderCapabilities;
import com.mailroute.gateway.model.ProviderType;
import com.mailroute.gateway.security.CredentialCipher;
import com.mailroute.gateway.security.LogSanitizer;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Adapter backed by the SendGrid v3 Mail Send API.
 *
 * <p>API reference: <a href="https://docs.sendgrid.com/api-reference/mail-send/mail-send">
 * SendGrid Mail Send v3</a>
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code apiKeyEncrypted}: a SendGrid API key with "Mail Send" permission</li>
 * </ul>
 */
public class SendGridProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SendGridProviderAdapter.class);

    private static final ProviderCapabilities CAPABILITIES =
            new ProviderCapabilities(true, true, true, 1000, 30L * 1024 * 1024);

    private final String endpoint;

    public SendGridProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        super(provider, cipher, tracker);
        this.endpoint = endpointOr(ProviderType.SENDGRID.getPresetApiEndpoint());
    }

    @Override
    protected String errorFamily() { return ErrorCodes.SENDGRID_ERROR; }

    @Override
    public ProviderCapabilities getCapabilities() { return CAPABILITIES; }

    @Override
    public AttemptResult send(final EmailMessage message) {
        final AttemptResult rejected = checkCapabilities(message);
        if (rejected != null) return rejected;

        try {
            final String payload = buildPayload(message);
            final Request request = new Request.Builder()
                    .url(endpoint)
                    .addHeader("Authorization", "Bearer " + cipher.decrypt(provider.getApiKeyEncrypted()))
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(payload, JSON))
                    .build();

            try (Response response = http.newCall(request).execute()) {
                final int code = response.code();
                // SendGrid returns 202 Accepted on success
                if (code == 202) {
                    final String msgId = response.header("X-Message-Id", "unknown");
                    LOG.info("SendGrid email sent: provider={} to={} msgId={}",
                            provider.getId(), LogSanitizer.maskEmails(message.getTo()), msgId);
                    return success(msgId);
                }
                final String body = bodyOf(response);
                LOG.warn("SendGrid rejected email: provider={} http={} body={}",
                        provider.getId(), code, LogSanitizer.sanitize(body));
                return failure(ErrorCodes.SENDGRID_ERROR, "HTTP " + code + ": " + errorText(body), String.valueOf(code));
            }
        } catch (CredentialCipher.CredentialException e) {
            LOG.error("SendGrid credentials unavailable: provider={}", provider.getId());
            return credentialsUnavailable(e);
        } catch (IOException e) {
            LOG.error("SendGrid IO error: provider={} error={}", provider.getId(), e.getMessage());
            return failure(ErrorCodes.SENDGRID_ERROR, String.valueOf(e.getMessage()), null);
        } catch (RuntimeException e) {
            LOG.error("SendGrid unexpected error: provider={}", provider.getId(), e);
            return failure(ErrorCodes.SEND_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    /** Authenticated GET of the key's scopes. */
    @Override
    public ProbeResult test() {
        try {
            final Request request = new Request.Builder()
                    .url(sibling(endpoint, "/v3/scopes"))
                    .addHeader("Authorization", "Bearer " + cipher.decrypt(provider.getApiKeyEncrypted()))
                    .get()
                    .build();
            try (Response response = http.newCall(request).execute()) {
                return response.isSuccessful()
                        ? ProbeResult.ok()
                        : ProbeResult.failed("SendGrid test failed: HTTP " + response.code());
            }
        } catch (CredentialCipher.CredentialException e) {
            return ProbeResult.failed("SendGrid test failed: credentials unavailable");
        } catch (IOException | RuntimeException e) {
            return ProbeResult.failed("SendGrid test failed: " + e.getMessage());
        }
    }

    private String buildPayload(final EmailMessage message) {
        // https://docs.sendgrid.com/api-reference/mail-send/mail-send#request-body
        final ObjectNode root = mapper.createObjectNode();

        final ObjectNode personalization = root.putArray("personalizations").addObject();
        addAddresses(personalization.putArray("to"), message.getTo());
        if (!message.getCc().isEmpty())  addAddresses(personalization.putArray("cc"),  message.getCc());
        if (!message.getBcc().isEmpty()) addAddresses(personalization.putArray("bcc"), message.getBcc());

        final ObjectNode from = root.putObject("from");
        from.put("email", fromEmail(message));
        final String fromName = fromName(message);
        if (fromName != null && !fromName.isBlank()) {
            from.put("name", fromName);
        }

        final String replyTo = replyTo(message);
        if (replyTo != null && !replyTo.isBlank()) {
            root.putObject("reply_to").put("email", replyTo);
        }

        root.put("subject", message.getSubject());

        final ArrayNode content = root.putArray("content");
        final ObjectNode text = content.addObject();
        text.put("type",  "text/plain");
        text.put("value", message.plainText());
        if (!message.getHtml().isEmpty()) {
            final ObjectNode html = content.addObject();
            html.put("type",  "text/html");
            html.put("value", message.getHtml());
        }

        if (!message.getAttachments().isEmpty()) {
            final ArrayNode attachments = root.putArray("attachments");
            for (final EmailAttachment a : message.getAttachments()) {
                final ObjectNode node = attachments.addObject();
                node.put("content",  Base64.getEncoder().encodeToString(a.getContent()));
                node.put("filename", a.getFilename());
                node.put("type",     a.getContentType());
            }
        }

        if (!message.getHeaders().isEmpty()) {
            final ObjectNode headers = root.putObject("headers");
            message.getHeaders().forEach(headers::put);
        }

        // Custom args surface in SendGrid event webhooks
        if (!message.getMetadata().isEmpty()) {
            final ObjectNode customArgs = root.putObject("custom_args");
            for (final Map.Entry<String, Object> e : message.getMetadata().entrySet()) {
                customArgs.put(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return toJson(root);
    }

    private static void addAddresses(final ArrayNode target, final List<String> addresses) {
        for (final String address : addresses) {
            target.addObject().put("email", address);
        }
    }

    private String errorText(final String body) {
        final JsonNode first = parseOrEmpty(body).path("errors").path(0);
        return first.hasNonNull("message") ? first.get("message").asText() : body;
    }
}
