package com.mailroute.gateway.model;

import java.util.Locale;

/**
 * Vendor tag of a configured provider, together with the connection preset
 * used to fill in details an operator left blank.
 *
 * <p>The tag is the lower-case snake name used in configuration files
 * ({@code "gmail"}, {@code "pabbly_webhook"}, ...). Unknown tags resolve to
 * {@link #CUSTOM_SMTP}.
 */
public enum ProviderType {

    GMAIL           (ConnectionType.SMTP,    "smtp.gmail.com",        587, null),
    OUTLOOK         (ConnectionType.SMTP,    "smtp.office365.com",    587, null),
    ZOHO            (ConnectionType.SMTP,    "smtp.zoho.com",         587, null),
    YAHOO           (ConnectionType.SMTP,    "smtp.mail.yahoo.com",   587, null),
    REDIFFMAIL_PRO  (ConnectionType.SMTP,    "smtp.rediffmail.com",   587, null),
    PROTONMAIL      (ConnectionType.SMTP,    "smtp.protonmail.ch",    587, null),
    SMTP2GO         (ConnectionType.SMTP,    "mail.smtp2go.com",      587, null),
    CUSTOM_SMTP     (ConnectionType.SMTP,    null,                    587, null),

    SES             (ConnectionType.API, null, 0, null),     // endpoint derived from the region
    BREVO           (ConnectionType.API, null, 0, "https://api.brevo.com/v3/smtp/email"),
    SENDGRID        (ConnectionType.API, null, 0, "https://api.sendgrid.com/v3/mail/send"),
    MAILGUN         (ConnectionType.API, null, 0, "https://api.mailgun.net/v3"),
    POSTMARK        (ConnectionType.API, null, 0, "https://api.postmarkapp.com/email"),
    SPARKPOST       (ConnectionType.API, null, 0, "https://api.sparkpost.com/api/v1/transmissions"),
    MAILJET         (ConnectionType.API, null, 0, "https://api.mailjet.com/v3.1/send"),
    ELASTIC_EMAIL   (ConnectionType.API, null, 0, "https://api.elasticemail.com/v2/email/send"),
    NETCORE_PEPIPOST(ConnectionType.API, null, 0, "https://api.pepipost.com/v5/mail/send"),

    PABBLY_WEBHOOK  (ConnectionType.WEBHOOK, null, 0, null);

    private final ConnectionType defaultConnection;
    private final String presetSmtpHost;
    private final int    presetSmtpPort;
    private final String presetApiEndpoint;

    ProviderType(
            final ConnectionType defaultConnection,
            final String presetSmtpHost,
            final int presetSmtpPort,
            final String presetApiEndpoint) {
        this.defaultConnection = defaultConnection;
        this.presetSmtpHost    = presetSmtpHost;
        this.presetSmtpPort    = presetSmtpPort;
        this.presetApiEndpoint = presetApiEndpoint;
    }

    public ConnectionType getDefaultConnection() { return defaultConnection; }
    public String getPresetSmtpHost()            { return presetSmtpHost; }
    public int    getPresetSmtpPort()            { return presetSmtpPort; }
    public String getPresetApiEndpoint()         { return presetApiEndpoint; }

    /** Configuration tag, e.g. {@code "custom_smtp"}. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a configuration tag. Blank or unrecognised tags map to
     * {@link #CUSTOM_SMTP}, matching the adapter factory's default.
     */
    public static ProviderType fromTag(final String tag) {
        if (tag == null || tag.isBlank()) return CUSTOM_SMTP;
        final String normalized = tag.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (final ProviderType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return CUSTOM_SMTP;
    }

    /**
     * Guess the provider type from the sender address and SMTP host when the
     * operator did not declare one.
     */
    public static ProviderType detect(final String fromEmail, final String smtpHost) {
        final int at = fromEmail != null ? fromEmail.indexOf('@') : -1;
        final String domain = at >= 0 ? fromEmail.substring(at + 1).toLowerCase(Locale.ROOT) : "";
        final String host   = smtpHost != null ? smtpHost.toLowerCase(Locale.ROOT) : "";

        if (domain.equals("gmail.com") || host.contains("smtp.gmail.com")) return GMAIL;
        if (domain.contains("outlook.") || domain.contains("hotmail.")
                || domain.contains("live.") || host.contains("smtp.office365.com")) return OUTLOOK;
        if (domain.contains("zoho.") || host.contains("smtp.zoho.com")) return ZOHO;
        if (domain.contains("yahoo.") || host.contains("smtp.mail.yahoo.com")) return YAHOO;
        if (domain.contains("rediffmail.") || host.contains("smtp.rediffmail.com")) return REDIFFMAIL_PRO;
        if (domain.contains("protonmail.") || domain.contains("pm.me")
                || host.contains("smtp.protonmail.ch")) return PROTONMAIL;
        if (host.contains("amazonaws.com") && host.contains("email-smtp")) return SES;
        if (host.contains("sendgrid.net")) return SENDGRID;
        if (host.contains("mailgun.org")) return MAILGUN;
        if (host.contains("postmarkapp.com")) return POSTMARK;
        if (host.contains("sparkpost.com")) return SPARKPOST;
        if (host.contains("mailjet.com")) return MAILJET;
        if (host.contains("smtp2go.com")) return SMTP2GO;
        if (host.contains("elasticemail.com")) return ELASTIC_EMAIL;
        if (host.contains("sendinblue.com") || host.contains("brevo.com")) return BREVO;
        if (host.contains("pepipost.com")) return NETCORE_PEPIPOST;
        return CUSTOM_SMTP;
    }
}
