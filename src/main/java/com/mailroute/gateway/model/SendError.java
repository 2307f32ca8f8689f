package com.mailroute.gateway.model;

import java.util.Objects;

/**
 * Canonical error pair produced by every adapter and by the routing engine.
 *
 * <p>{@code code} is one of {@link ErrorCodes}; {@code vendorCode} keeps the
 * provider's own code (SMTP reply code, HTTP status, Postmark ErrorCode, ...)
 * when one was available, otherwise {@code null}.
 */
public final class SendError {

    private final String code;
    private final String message;
    private final String vendorCode;

    public SendError(final String code, final String message, final String vendorCode) {
        this.code       = Objects.requireNonNull(code, "code");
        this.message    = message != null ? message : "";
        this.vendorCode = vendorCode;
    }

    public static SendError of(final String code, final String message) {
        return new SendError(code, message, null);
    }

    public String getCode()       { return code; }
    public String getMessage()    { return message; }
    public String getVendorCode() { return vendorCode; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SendError)) return false;
        final SendError other = (SendError) o;
        return code.equals(other.code)
            && message.equals(other.message)
            && Objects.equals(vendorCode, other.vendorCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, vendorCode);
    }

    @Override
    public String toString() {
        return code + (vendorCode != null ? "[" + vendorCode + "]" : "") + ": " + message;
    }
}
