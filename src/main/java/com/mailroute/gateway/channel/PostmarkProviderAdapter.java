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
import java.util.Map;

/**
 * Adapter backed by the Postmark Email API.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code apiKeyEncrypted}: the server API token from the Postmark dashboard</li>
 * </ul>
 *
 * <p>The sender address must have a verified Sender Signature in Postmark.
 * A {@code messageStream} metadata entry selects the stream; the default is
 * {@code outbound}. Postmark's numeric {@code ErrorCode} is kept as the
 * vendor code of a failure.
 *
 * <p>API reference:
 * <a href="https://postmarkapp.com/developer/api/email-api">Postmark Email API</a>
 */
public class PostmarkProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(PostmarkProviderAdapter.class);

    private static final ProviderCapabilities CAPABILITIES =
            new ProviderCapabilities(true, true, false, 50, 10L * 1024 * 1024);

    private static final String DEFAULT_STREAM = "outbound";

    private final String endpoint;

    public PostmarkProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        super(provider, cipher, tracker);
        this.endpoint = endpointOr(ProviderType.POSTMARK.getPresetApiEndpoint());
    }

    @Override
    protected String errorFamily() { return ErrorCodes.POSTMARK_ERROR; }

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
                    .addHeader("Accept",                  "application/json")
                    .addHeader("Content-Type",            "application/json")
                    .addHeader("X-Postmark-Server-Token", cipher.decrypt(provider.getApiKeyEncrypted()))
                    .post(RequestBody.create(payload, JSON))
                    .build();

            try (Response response = http.newCall(request).execute()) {
                final int      code = response.code();
                final JsonNode body = parseOrEmpty(bodyOf(response));
                final int      errorCode = body.path("ErrorCode").asInt(code == 200 ? 0 : -1);

                if (code == 200 && errorCode == 0) {
                    final String msgId = body.path("MessageID").asText("unknown");
                    LOG.info("Postmark email sent: provider={} to={} msgId={}",
                            provider.getId(), LogSanitizer.maskEmails(message.getTo()), msgId);
                    return success(msgId);
                }
                final String text = body.path("Message").asText("HTTP " + code);
                LOG.warn("Postmark rejected: provider={} http={} errorCode={} message={}",
                        provider.getId(), code, errorCode, LogSanitizer.sanitize(text));
                return failure(ErrorCodes.POSTMARK_ERROR, text,
                        errorCode >= 0 ? String.valueOf(errorCode) : String.valueOf(code));
            }
        } catch (CredentialCipher.CredentialException e) {
            LOG.error("Postmark credentials unavailable: provider={}", provider.getId());
            return credentialsUnavailable(e);
        } catch (IOException e) {
            LOG.error("Postmark IO error: provider={} error={}", provider.getId(), e.getMessage());
            return failure(ErrorCodes.POSTMARK_ERROR, String.valueOf(e.getMessage()), null);
        } catch (RuntimeException e) {
            LOG.error("Postmark unexpected error: provider={}", provider.getId(), e);
            return failure(ErrorCodes.SEND_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    /** Authenticated GET of the server record. */
    @Override
    public ProbeResult test() {
        try {
            final Request request = new Request.Builder()
                    .url(sibling(endpoint, "/server"))
                    .addHeader("Accept",                  "application/json")
                    .addHeader("X-Postmark-Server-Token", cipher.decrypt(provider.getApiKeyEncrypted()))
                    .get()
                    .build();
            try (Response response = http.newCall(request).execute()) {
                return response.isSuccessful()
                        ? ProbeResult.ok()
                        : ProbeResult.failed("Postmark test failed: HTTP " + response.code());
            }
        } catch (CredentialCipher.CredentialException e) {
            return ProbeResult.failed("Postmark test failed: credentials unavailable");
        } catch (IOException | RuntimeException e) {
            return ProbeResult.failed("Postmark test failed: " + e.getMessage());
        }
    }

    private String buildPayload(final EmailMessage message) {
        final ObjectNode root = mapper.createObjectNode();
        root.put("From",     formatAddress(fromName(message), fromEmail(message)));
        root.put("To",       String.join(",", message.getTo()));
        if (!message.getCc().isEmpty())  root.put("Cc",  String.join(",", message.getCc()));
        if (!message.getBcc().isEmpty()) root.put("Bcc", String.join(",", message.getBcc()));
        final String replyTo = replyTo(message);
        if (replyTo != null && !replyTo.isBlank()) root.put("ReplyTo", replyTo);
        root.put("Subject",  message.getSubject());
        if (!message.getHtml().isEmpty()) root.put("HtmlBody", message.getHtml());
        root.put("TextBody", message.plainText());

        final Object stream = message.getMetadata().get("messageStream");
        root.put("MessageStream", stream != null ? stream.toString() : DEFAULT_STREAM);

        if (!message.getHeaders().isEmpty()) {
            final ArrayNode headers = root.putArray("Headers");
            message.getHeaders().forEach((name, value) -> {
                final ObjectNode h = headers.addObject();
                h.put("Name",  name);
                h.put("Value", value);
            });
        }

        if (!message.getAttachments().isEmpty()) {
            final ArrayNode attachments = root.putArray("Attachments");
            for (final EmailAttachment a : message.getAttachments()) {
                final ObjectNode node = attachments.addObject();
                node.put("Name",        a.getFilename());
                node.put("Content",     Base64.getEncoder().encodeToString(a.getContent()));
                node.put("ContentType", a.getContentType());
            }
        }

        // Metadata visible in the Postmark activity feed
        if (!message.getMetadata().isEmpty()) {
            final ObjectNode meta = root.putObject("Metadata");
            for (final Map.Entry<String, Object> e : message.getMetadata().entrySet()) {
                meta.put(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return toJson(root);
    }
}
