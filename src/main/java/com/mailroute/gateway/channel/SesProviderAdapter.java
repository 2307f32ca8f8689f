package com.mailroute.gateway.channel;

import com.fasterxml.jackson.databind.JsonNode;
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
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;

/**
 * Adapter backed by AWS Simple Email Service (SES) v2.
 *
 * <p>Uses the SES v2 {@code SendEmail} REST API with AWS Signature Version 4
 * request signing, so no AWS SDK dependency is needed. Messages with
 * attachments are rendered to MIME and sent as {@code Content.Raw}.
 *
 * <h2>Required credentials</h2>
 * <ul>
 *   <li>{@code apiKeyEncrypted}: AWS access key id</li>
 *   <li>{@code apiSecretEncrypted}: AWS secret access key</li>
 *   <li>{@code apiRegion} (e.g. {@code eu-west-1}); defaults to {@code us-east-1}</li>
 * </ul>
 *
 * <p>The sender address must be verified in the SES console.
 *
 * <p>API reference:
 * <a href="https://docs.aws.amazon.com/ses/latest/APIReference-V2/API_SendEmail.html">SES v2 SendEmail</a>
 */
public class SesProviderAdapter extends AbstractHttpProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SesProviderAdapter.class);

    private static final ProviderCapabilities CAPABILITIES =
            new ProviderCapabilities(true, true, true, 50, 10L * 1024 * 1024);

    private static final String DEFAULT_REGION = "us-east-1";
    private static final String SEND_PATH      = "/v2/email/outbound-emails";
    private static final String ACCOUNT_PATH   = "/v2/email/account";

    private static final DateTimeFormatter ISO_DATE     = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ISO_DATETIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");

    private final String region;
    private final String endpoint;
    private final Clock  clock;

    public SesProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        this(provider, cipher, tracker, Clock.systemUTC());
    }

    SesProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker,
            final Clock clock) {
        super(provider, cipher, tracker);
        final String r = provider.getApiRegion();
        this.region   = r != null && !r.isBlank() ? r : DEFAULT_REGION;
        this.endpoint = endpointOr("https://email." + region + ".amazonaws.com");
        this.clock    = clock;
    }

    @Override
    protected String errorFamily() { return ErrorCodes.SES_ERROR; }

    @Override
    public ProviderCapabilities getCapabilities() { return CAPABILITIES; }

    @Override
    public AttemptResult send(final EmailMessage message) {
        final AttemptResult rejected = checkCapabilities(message);
        if (rejected != null) return rejected;

        try {
            final String payload = buildPayload(message);
            final Request request = signed("POST", sibling(endpoint, SEND_PATH), payload);

            try (Response response = http.newCall(request).execute()) {
                final int    code = response.code();
                final String body = bodyOf(response);
                if (code == 200) {
                    final String msgId = parseOrEmpty(body).path("MessageId").asText("unknown");
                    LOG.info("SES email sent: provider={} to={} msgId={}",
                            provider.getId(), LogSanitizer.maskEmails(message.getTo()), msgId);
                    return success(msgId);
                }
                final JsonNode error = parseOrEmpty(body);
                final String text = error.path("message").asText(error.path("Message").asText("HTTP " + code));
                final String type = errorType(response, error, code);
                LOG.warn("SES rejected email: provider={} http={} type={} message={}",
                        provider.getId(), code, type, LogSanitizer.sanitize(text));
                return failure(ErrorCodes.SES_ERROR, text, type);
            }
        } catch (CredentialCipher.CredentialException e) {
            LOG.error("SES credentials unavailable: provider={}", provider.getId());
            return credentialsUnavailable(e);
        } catch (IOException e) {
            LOG.error("SES IO error: provider={} error={}", provider.getId(), e.getMessage());
            return failure(ErrorCodes.SES_ERROR, String.valueOf(e.getMessage()), null);
        } catch (MessagingException e) {
            LOG.error("SES MIME rendering failed: provider={} error={}", provider.getId(), e.getMessage());
            return failure(ErrorCodes.SEND_ERROR, String.valueOf(e.getMessage()), null);
        } catch (RuntimeException e) {
            LOG.error("SES unexpected error: provider={}", provider.getId(), e);
            return failure(ErrorCodes.SEND_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    /** Signed GET of the account record; proves credentials and region. */
    @Override
    public ProbeResult test() {
        try {
            final Request request = signed("GET", sibling(endpoint, ACCOUNT_PATH), "");
            try (Response response = http.newCall(request).execute()) {
                return response.isSuccessful()
                        ? ProbeResult.ok()
                        : ProbeResult.failed("SES test failed: HTTP " + response.code());
            }
        } catch (CredentialCipher.CredentialException e) {
            return ProbeResult.failed("SES test failed: credentials unavailable");
        } catch (IOException | RuntimeException e) {
            return ProbeResult.failed("SES test failed: " + e.getMessage());
        }
    }

    String buildPayload(final EmailMessage message) throws MessagingException {
        // SES v2 SendEmail request body
        final ObjectNode root = mapper.createObjectNode();
        root.put("FromEmailAddress", formatAddress(fromName(message), fromEmail(message)));

        final ObjectNode dest = root.putObject("Destination");
        addAll(dest.putArray("ToAddresses"), message.getTo());
        if (!message.getCc().isEmpty())  addAll(dest.putArray("CcAddresses"),  message.getCc());
        if (!message.getBcc().isEmpty()) addAll(dest.putArray("BccAddresses"), message.getBcc());

        final String replyTo = replyTo(message);
        if (replyTo != null && !replyTo.isBlank()) {
            root.putArray("ReplyToAddresses").add(replyTo);
        }

        final ObjectNode content = root.putObject("Content");
        if (message.getAttachments().isEmpty() && message.getHeaders().isEmpty()) {
            final ObjectNode simple = content.putObject("Simple");
            charsetNode(simple.putObject("Subject"), message.getSubject());
            final ObjectNode body = simple.putObject("Body");
            charsetNode(body.putObject("Text"), message.plainText());
            if (!message.getHtml().isEmpty()) {
                charsetNode(body.putObject("Html"), message.getHtml());
            }
        } else {
            final MimeMessage mime = MimeMessages.build(MimeMessages.renderingSession(),
                    message, fromName(message), fromEmail(message), replyTo);
            content.putObject("Raw").put("Data", Base64.getEncoder().encodeToString(MimeMessages.toBytes(mime)));
        }
        return toJson(root);
    }

    // ── AWS SigV4 helpers ─────────────────────────────────────────────────────

    private Request signed(final String method, final HttpUrl url, final String payload) {
        final String accessKeyId     = cipher.decrypt(provider.getApiKeyEncrypted());
        final String secretAccessKey = cipher.decrypt(provider.getApiSecretEncrypted());

        final ZonedDateTime now      = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        final String        dateTime = ISO_DATETIME.format(now);
        final String        date     = ISO_DATE.format(now);
        final String        host     = url.port() == HttpUrl.defaultPort(url.scheme())
                ? url.host() : url.host() + ":" + url.port();

        try {
            final String payloadHash = sha256Hex(payload);
            final String canonicalRequest = method + "\n"
                    + url.encodedPath() + "\n"
                    + "\n"
                    + "content-type:application/json; charset=utf-8\n"
                    + "host:" + host + "\n"
                    + "x-amz-date:" + dateTime + "\n"
                    + "\n"
                    + "content-type;host;x-amz-date\n"
                    + payloadHash;

            final String credentialScope = date + "/" + region + "/ses/aws4_request";
            final String stringToSign = "AWS4-HMAC-SHA256\n"
                    + dateTime + "\n"
                    + credentialScope + "\n"
                    + sha256Hex(canonicalRequest);

            final byte[] signingKey = signingKey(secretAccessKey, date, region, "ses");
            final String signature  = HexFormat.of().formatHex(hmac(signingKey, stringToSign));

            final String authHeader = "AWS4-HMAC-SHA256 Credential=" + accessKeyId + "/" + credentialScope
                    + ", SignedHeaders=content-type;host;x-amz-date"
                    + ", Signature=" + signature;

            final Request.Builder b = new Request.Builder()
                    .url(url)
                    .addHeader("Authorization", authHeader)
                    .addHeader("Content-Type",  "application/json; charset=utf-8")
                    .addHeader("X-Amz-Date",    dateTime);
            return "GET".equals(method) ? b.get().build() : b.method(method, RequestBody.create(payload, JSON)).build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SigV4 signing failed", e);
        }
    }

    private static String sha256Hex(final String data) throws GeneralSecurityException {
        final MessageDigest md = MessageDigest.getInstance("SHA-256");
        return HexFormat.of().formatHex(md.digest(data.getBytes(StandardCharsets.UTF_8)));
    }

    private static byte[] hmac(final byte[] key, final String data) throws GeneralSecurityException {
        final Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(key, "HmacSHA256"));
        return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] signingKey(
            final String secret, final String date,
            final String region, final String service) throws GeneralSecurityException {
        final byte[] kDate    = hmac(("AWS4" + secret).getBytes(StandardCharsets.UTF_8), date);
        final byte[] kRegion  = hmac(kDate, region);
        final byte[] kService = hmac(kRegion, service);
        return hmac(kService, "aws4_request");
    }

    // ── Payload helpers ──────────────────────────────────────────────────────

    private static void charsetNode(final ObjectNode node, final String data) {
        node.put("Data",    data);
        node.put("Charset", "UTF-8");
    }

    private static void addAll(final ArrayNode target, final List<String> values) {
        values.forEach(target::add);
    }

    /** SES error type from {@code x-amzn-ErrorType} or {@code __type}, else the HTTP status. */
    private static String errorType(final Response response, final JsonNode body, final int code) {
        String type = response.header("x-amzn-ErrorType");
        if (type == null || type.isBlank()) {
            type = body.path("__type").asText("");
        }
        if (type.isBlank()) return String.valueOf(code);
        final int colon = type.indexOf(':');
        type = colon >= 0 ? type.substring(0, colon) : type;
        final int hash = type.lastIndexOf('#');
        return hash >= 0 ? type.substring(hash + 1) : type;
    }
}
