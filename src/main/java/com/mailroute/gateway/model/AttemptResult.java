package com.mailroute.gateway.model;

import java.time.Instant;

/**
 * Immutable outcome of a single send attempt against one provider.
 *
 * <p>Returned by every {@link com.mailroute.gateway.channel.ProviderAdapter},
 * audited by the routing engine and then discarded. The {@code messageId} is
 * the reference returned by the provider (SMTP Message-ID, SendGrid
 * X-Message-Id, SES MessageId).
 */
public final class AttemptResult {

    private final boolean   success;
    private final String    providerId;
    private final String    providerName;
    private final String    messageId;      // null on failure
    private final SendError error;          // null on success
    private final int       attemptNumber;
    private final Instant   timestamp;

    private AttemptResult(final Builder b) {
        this.success       = b.success;
        this.providerId    = b.providerId;
        this.providerName  = b.providerName;
        this.messageId     = b.messageId;
        this.error         = b.error;
        this.attemptNumber = b.attemptNumber;
        this.timestamp     = b.timestamp != null ? b.timestamp : Instant.now();
    }

    public static Builder builder(final String providerId, final String providerName) {
        return new Builder(providerId, providerName);
    }

    public static final class Builder {
        private final String providerId;
        private final String providerName;
        private boolean   success;
        private String    messageId;
        private SendError error = SendError.of(ErrorCodes.SEND_ERROR, "No outcome recorded");
        private int       attemptNumber = 1;
        private Instant   timestamp;

        private Builder(final String providerId, final String providerName) {
            this.providerId   = providerId;
            this.providerName = providerName;
        }

        public Builder success(final String messageId) {
            this.success   = true;
            this.messageId = messageId;
            this.error     = null;
            return this;
        }

        public Builder failure(final SendError error) {
            this.success   = false;
            this.messageId = null;
            this.error     = error;
            return this;
        }

        public Builder failure(final String code, final String message, final String vendorCode) {
            return failure(new SendError(code, message, vendorCode));
        }

        public Builder attemptNumber(final int attemptNumber) {
            this.attemptNumber = attemptNumber;
            return this;
        }

        public Builder timestamp(final Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AttemptResult build() { return new AttemptResult(this); }
    }

    /** Copy of this result carrying the engine's global attempt index. */
    public AttemptResult withAttemptNumber(final int number) {
        final Builder b = builder(providerId, providerName).attemptNumber(number).timestamp(timestamp);
        return (success ? b.success(messageId) : b.failure(error)).build();
    }

    public boolean   isSuccess()        { return success; }
    public String    getProviderId()    { return providerId; }
    public String    getProviderName()  { return providerName; }
    public String    getMessageId()     { return messageId; }
    public SendError getError()         { return error; }
    public int       getAttemptNumber() { return attemptNumber; }
    public Instant   getTimestamp()     { return timestamp; }

    @Override
    public String toString() {
        return "AttemptResult{provider=" + providerName
             + ", success=" + success
             + ", attempt=" + attemptNumber
             + (messageId != null ? ", msgId=" + messageId : "")
             + (error != null ? ", error=" + error : "")
             + "}";
    }
}
