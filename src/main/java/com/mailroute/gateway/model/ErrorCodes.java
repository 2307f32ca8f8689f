package com.mailroute.gateway.model;

/**
 * Normalised error codes carried by {@link SendError}.
 *
 * <p>Configuration-class codes ({@link #CONSENT_REQUIRED},
 * {@link #ROUTING_NOT_CONFIGURED}, {@link #NO_PROVIDERS_AVAILABLE}) are
 * terminal and never retried. Transport-family codes are recoverable by the
 * routing engine through retry and failover.
 */
public final class ErrorCodes {

    // Configuration class
    public static final String CONSENT_REQUIRED       = "CONSENT_REQUIRED";
    public static final String ROUTING_NOT_CONFIGURED = "ROUTING_NOT_CONFIGURED";
    public static final String NO_PROVIDERS_AVAILABLE = "NO_PROVIDERS_AVAILABLE";
    public static final String PROVIDER_NOT_FOUND     = "PROVIDER_NOT_FOUND";

    // Gate
    public static final String PROVIDER_UNAVAILABLE   = "PROVIDER_UNAVAILABLE";

    // Transport families
    public static final String SEND_ERROR             = "SEND_ERROR";
    public static final String SMTP_ERROR             = "SMTP_ERROR";
    public static final String SENDGRID_ERROR         = "SENDGRID_ERROR";
    public static final String POSTMARK_ERROR         = "POSTMARK_ERROR";
    public static final String SES_ERROR              = "SES_ERROR";
    public static final String WEBHOOK_ERROR          = "WEBHOOK_ERROR";

    // Terminal
    public static final String ALL_PROVIDERS_FAILED   = "ALL_PROVIDERS_FAILED";
    public static final String CANCELLED              = "CANCELLED";

    private ErrorCodes() {}

    public static boolean isConfigurationError(final String code) {
        return CONSENT_REQUIRED.equals(code)
            || ROUTING_NOT_CONFIGURED.equals(code)
            || NO_PROVIDERS_AVAILABLE.equals(code)
            || PROVIDER_NOT_FOUND.equals(code);
    }
}
