package com.mailroute.gateway.channel;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailAttachment;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.ProviderCapabilities;
import com.mailroute.gateway.security.CredentialCipher;

/**
 * State and helpers shared by every adapter: the provider record, the
 * credential cipher and the health gate.
 */
abstract class AbstractProviderAdapter implements ProviderAdapter {

    protected final EmailProvider         provider;
    protected final CredentialCipher      cipher;
    private   final ProviderHealthTracker tracker;

    protected AbstractProviderAdapter(
            final EmailProvider provider,
            final CredentialCipher cipher,
            final ProviderHealthTracker tracker) {
        this.provider = provider;
        this.cipher   = cipher;
        this.tracker  = tracker;
    }

    /** Error family reported by this transport, e.g. {@code SMTP_ERROR}. */
    protected abstract String errorFamily();

    @Override
    public EmailProvider provider() { return provider; }

    @Override
    public boolean canSend() {
        return tracker.canSend(provider);
    }

    // ── Shared helpers ───────────────────────────────────────────────────────

    /**
     * Rejects a message this transport cannot carry, before any network call.
     * Returns null when the message fits.
     */
    protected AttemptResult checkCapabilities(final EmailMessage message) {
        final ProviderCapabilities caps = getCapabilities();
        if (message.recipientCount() > caps.getMaxRecipientsPerEmail()) {
            return failure(errorFamily(), "Too many recipients: " + message.recipientCount()
                    + " (max " + caps.getMaxRecipientsPerEmail() + ")", null);
        }
        if (!message.getAttachments().isEmpty()) {
            if (!caps.supportsAttachments()) {
                return failure(errorFamily(), "Attachments are not supported by this provider", null);
            }
            long total = 0;
            for (final EmailAttachment a : message.getAttachments()) {
                total += a.size();
            }
            if (total > caps.getMaxAttachmentSize()) {
                return failure(errorFamily(), "Attachments exceed " + caps.getMaxAttachmentSize() + " bytes", null);
            }
        }
        return null;
    }

    protected String fromEmail(final EmailMessage message) {
        return message.hasFromOverride() ? message.getFromEmail() : provider.getFromEmail();
    }

    protected String fromName(final EmailMessage message) {
        if (message.hasFromOverride()) return message.getFromName();
        return provider.getFromName();
    }

    protected String replyTo(final EmailMessage message) {
        final String r = message.getReplyTo();
        return r != null && !r.isBlank() ? r : provider.getReplyToEmail();
    }

    /** {@code "Name <addr>"} or the bare address when no name is set. */
    protected static String formatAddress(final String name, final String email) {
        if (name == null || name.isBlank()) return email;
        return name + " <" + email + ">";
    }

    protected AttemptResult success(final String messageId) {
        return AttemptResult.builder(provider.getId(), provider.getProviderName())
                .success(messageId)
                .build();
    }

    protected AttemptResult failure(final String code, final String message, final String vendorCode) {
        return AttemptResult.builder(provider.getId(), provider.getProviderName())
                .failure(code, message, vendorCode)
                .build();
    }

    protected AttemptResult credentialsUnavailable(final CredentialCipher.CredentialException e) {
        return failure(ErrorCodes.SEND_ERROR, "Credentials unavailable: " + e.getMessage(), null);
    }
}
