package com.mailroute.gateway.security;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scrubs values that must not reach logs or audit records.
 *
 * <p>Vendor error strings sometimes echo request parameters back; anything
 * shaped like {@code password=...}, {@code key: ...}, {@code token=...},
 * {@code secret=...} or {@code auth=...} has its value replaced with
 * {@code ***}.
 */
public final class LogSanitizer {

    public static final int MAX_ERROR_LENGTH = 200;

    private static final List<String> SECRET_HINTS = List.of("password", "key", "token", "secret", "auth");

    private static final List<Pattern> SECRET_PATTERNS = SECRET_HINTS.stream()
            .map(h -> Pattern.compile("(?i)" + h + "[=:]\\s*[^\\s&]+"))
            .collect(Collectors.toList());

    private LogSanitizer() {}

    public static String sanitize(final String message) {
        if (message == null) return null;
        String out = message;
        for (int i = 0; i < SECRET_PATTERNS.size(); i++) {
            out = SECRET_PATTERNS.get(i).matcher(out).replaceAll(SECRET_HINTS.get(i) + "=***");
        }
        return out;
    }

    public static String truncate(final String message, final int max) {
        if (message == null || message.length() <= max) return message;
        return message.substring(0, max);
    }

    /** Sanitised and cut to {@link #MAX_ERROR_LENGTH}, the form stored in audit records. */
    public static String forAudit(final String message) {
        return truncate(sanitize(message), MAX_ERROR_LENGTH);
    }

    public static String maskEmail(final String email) {
        if (email == null) return "null";
        final int at = email.indexOf('@');
        if (at <= 1) return "***";
        return email.substring(0, Math.min(3, at)) + "***" + email.substring(at);
    }

    public static String maskEmails(final List<String> emails) {
        if (emails == null || emails.isEmpty()) return "[]";
        final String first = maskEmail(emails.get(0));
        return emails.size() == 1 ? first : first + " (+" + (emails.size() - 1) + ")";
    }
}
