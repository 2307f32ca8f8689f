package com.mailroute.gateway.channel;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.ProbeResult;
import com.mailroute.gateway.model.ProviderCapabilities;
import com.mailroute.gateway.model.SmtpEncryption;
import com.mailroute.gateway.security.CredentialCipher;
import com.mailroute.gateway.security.LogSanitizer;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.MimeMessage;
import org.eclipse.angus.mail.smtp.SMTPAddressFailedException;
import org.eclipse.angus.mail.smtp.SMTPSendFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Properties;

/**
 * Generic SMTP adapter backed by Jakarta Mail.
 *
 * <p>Serves every SMTP-family provider (Gmail, Outlook, Zoho, Yahoo,
 * Rediffmail Pro, ProtonMail, SMTP2GO, custom servers) and any provider type
 * that has no specialised adapter. Encryption follows the provider record:
 * {@code TLS} upgrades with STARTTLS, {@code SSL} connects over implicit TLS,
 * {@code NONE} stays plaintext.
 *
 * <p>A new connection is opened per message; the SMTP password is decrypted
 * for that connection only.
 */
public class SmtpProviderAdapter extends AbstractProviderAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SmtpProviderAdapter.class);

    private static final ProviderCapabilities CAPABILITIES =
            new ProviderCapabilities(true, true, false, 100, 25L * 1024 * 1024);

    private static final String CONNECT_TIMEOUT_MS = "10000";
    private static final String IO_TIMEOUT_MS      = "15000";

    private final Session session;

    public SmtpProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        super(provider, cipher, tracker);
        this.session = Session.getInstance(sessionProperties(provider));
    }

    @Override
    protected String errorFamily() { return ErrorCodes.SMTP_ERROR; }

    @Override
    public ProviderCapabilities getCapabilities() { return CAPABILITIES; }

    @Override
    public AttemptResult send(final EmailMessage message) {
        final AttemptResult rejected = checkCapabilities(message);
        if (rejected != null) return rejected;

        final String fromEmail = fromEmail(message);
        if (provider.getSmtpHost() == null || provider.getSmtpHost().isBlank()) {
            return failure(ErrorCodes.SMTP_ERROR, "SMTP host not configured", null);
        }

        try {
            final MimeMessage mime = MimeMessages.build(
                    session, message, fromName(message), fromEmail, replyTo(message));
            try (Transport transport = connect()) {
                transport.sendMessage(mime, mime.getAllRecipients());
            }
            final String msgId = mime.getMessageID();
            LOG.info("SMTP email sent: provider={} to={} msgId={}",
                    provider.getId(), LogSanitizer.maskEmails(message.getTo()), msgId);
            return success(msgId);
        } catch (CredentialCipher.CredentialException e) {
            LOG.error("SMTP credentials unavailable: provider={}", provider.getId());
            return credentialsUnavailable(e);
        } catch (SMTPSendFailedException e) {
            return rejectedByServer(e.getReturnCode(), e.getMessage());
        } catch (SMTPAddressFailedException e) {
            return rejectedByServer(e.getReturnCode(), e.getMessage());
        } catch (AuthenticationFailedException e) {
            LOG.warn("SMTP authentication failed: provider={}", provider.getId());
            return failure(ErrorCodes.SMTP_ERROR, "Authentication failed: " + e.getMessage(), "AUTH");
        } catch (MessagingException e) {
            LOG.error("SMTP error: provider={} error={}", provider.getId(), LogSanitizer.sanitize(e.getMessage()));
            return failure(ErrorCodes.SMTP_ERROR, String.valueOf(e.getMessage()), null);
        } catch (RuntimeException e) {
            LOG.error("SMTP unexpected error: provider={}", provider.getId(), e);
            return failure(ErrorCodes.SEND_ERROR, String.valueOf(e.getMessage()), null);
        }
    }

    /** Connects and authenticates, then disconnects without sending. */
    @Override
    public ProbeResult test() {
        if (provider.getSmtpHost() == null || provider.getSmtpHost().isBlank()) {
            return ProbeResult.failed("SMTP host not configured");
        }
        try (Transport ignored = connect()) {
            return ProbeResult.ok();
        } catch (CredentialCipher.CredentialException e) {
            return ProbeResult.failed("SMTP test failed: credentials unavailable");
        } catch (MessagingException | RuntimeException e) {
            return ProbeResult.failed("SMTP test failed: " + LogSanitizer.sanitize(e.getMessage()));
        }
    }

    @Override
    public void close() {
        // connections are per message
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private Transport connect() throws MessagingException {
        final Transport transport = session.getTransport(
                provider.getSmtpEncryption() == SmtpEncryption.SSL ? "smtps" : "smtp");
        final String username = provider.getSmtpUsername();
        if (username == null || username.isBlank()) {
            transport.connect(provider.getSmtpHost(), provider.getSmtpPort(), null, null);
        } else {
            final String password = cipher.decrypt(provider.getSmtpPasswordEncrypted());
            transport.connect(provider.getSmtpHost(), provider.getSmtpPort(), username, password);
        }
        return transport;
    }

    private AttemptResult rejectedByServer(final int replyCode, final String text) {
        LOG.warn("SMTP server rejected message: provider={} code={} reply={}",
                provider.getId(), replyCode, LogSanitizer.sanitize(text));
        return failure(ErrorCodes.SMTP_ERROR, String.valueOf(text), String.valueOf(replyCode));
    }

    private static Properties sessionProperties(final EmailProvider provider) {
        final Properties props = new Properties();
        final boolean auth = provider.getSmtpUsername() != null && !provider.getSmtpUsername().isBlank();
        for (final String proto : new String[] {"smtp", "smtps"}) {
            final String prefix = "mail." + proto + ".";
            props.put(prefix + "auth",              String.valueOf(auth));
            props.put(prefix + "connectiontimeout", CONNECT_TIMEOUT_MS);
            props.put(prefix + "timeout",           IO_TIMEOUT_MS);
            props.put(prefix + "writetimeout",      IO_TIMEOUT_MS);
        }
        if (provider.getSmtpEncryption() == SmtpEncryption.TLS) {
            props.put("mail.smtp.starttls.enable",   "true");
            props.put("mail.smtp.starttls.required", "true");
        }
        return props;
    }
}
