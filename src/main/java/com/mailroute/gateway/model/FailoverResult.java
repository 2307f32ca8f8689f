package com.mailroute.gateway.model;

import java.time.Instant;

/**
 * Aggregate outcome of routing one message across a provider chain.
 *
 * <p>Returned synchronously (or through a completed future) to the calling
 * feature, which decides its own remediation on failure. The engine never
 * throws; every outcome, including configuration problems, arrives here with
 * a structured {@link SendError}.
 */
public final class FailoverResult {

    public static final String NO_PROVIDER = "none";

    private final boolean   success;
    private final String    providerId;
    private final String    providerName;
    private final String    messageId;
    private final SendError error;
    private final int       attemptNumber;
    private final int       totalAttempts;
    private final boolean   failoverOccurred;
    private final String    failoverFromProviderId;
    private final String    failoverReason;
    private final SendError lastAttemptError;
    private final Instant   completedAt;

    private FailoverResult(final Builder b) {
        this.success                = b.success;
        this.providerId             = b.providerId;
        this.providerName           = b.providerName;
        this.messageId              = b.messageId;
        this.error                  = b.error;
        this.attemptNumber          = b.attemptNumber;
        this.totalAttempts          = b.totalAttempts;
        this.failoverOccurred       = b.failoverOccurred;
        this.failoverFromProviderId = b.failoverFromProviderId;
        this.failoverReason         = b.failoverReason;
        this.lastAttemptError       = b.lastAttemptError;
        this.completedAt            = Instant.now();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Terminal result that never reached a provider. */
    public static FailoverResult rejected(final String code, final String message) {
        return builder()
                .provider(NO_PROVIDER, NO_PROVIDER)
                .error(SendError.of(code, message))
                .build();
    }

    /** Promote a single attempt into an aggregate result. */
    public static Builder from(final AttemptResult attempt) {
        final Builder b = builder()
                .provider(attempt.getProviderId(), attempt.getProviderName())
                .attemptNumber(attempt.getAttemptNumber());
        if (attempt.isSuccess()) {
            b.success(attempt.getMessageId());
        } else {
            b.error(attempt.getError());
        }
        return b;
    }

    public static final class Builder {
        private boolean   success;
        private String    providerId   = NO_PROVIDER;
        private String    providerName = NO_PROVIDER;
        private String    messageId;
        private SendError error;
        private int       attemptNumber;
        private int       totalAttempts;
        private boolean   failoverOccurred;
        private String    failoverFromProviderId;
        private String    failoverReason;
        private SendError lastAttemptError;

        private Builder() {}

        public Builder success(final String messageId) {
            this.success   = true;
            this.messageId = messageId;
            this.error     = null;
            return this;
        }

        public Builder error(final SendError error) {
            this.success = false;
            this.error   = error;
            return this;
        }

        public Builder provider(final String id, final String name) {
            this.providerId   = id;
            this.providerName = name;
            return this;
        }

        public Builder attemptNumber(final int n)  { this.attemptNumber = n; return this; }
        public Builder totalAttempts(final int n)  { this.totalAttempts = n; return this; }

        public Builder failover(final boolean occurred, final String fromProviderId, final String reason) {
            this.failoverOccurred       = occurred;
            this.failoverFromProviderId = fromProviderId;
            this.failoverReason         = reason;
            return this;
        }

        public Builder lastAttemptError(final SendError e) {
            this.lastAttemptError = e;
            return this;
        }

        public FailoverResult build() { return new FailoverResult(this); }
    }

    public boolean   isSuccess()                 { return success; }
    public String    getProviderId()             { return providerId; }
    public String    getProviderName()           { return providerName; }
    public String    getMessageId()              { return messageId; }
    public SendError getError()                  { return error; }
    public int       getAttemptNumber()          { return attemptNumber; }
    public int       getTotalAttempts()          { return totalAttempts; }
    public boolean   isFailoverOccurred()        { return failoverOccurred; }
    public String    getFailoverFromProviderId() { return failoverFromProviderId; }
    public String    getFailoverReason()         { return failoverReason; }
    public Instant   getCompletedAt()            { return completedAt; }

    /** The transport error of the final attempt, when the chain was exhausted. */
    public SendError getLastAttemptError()       { return lastAttemptError; }

    public String getErrorCode() {
        return error != null ? error.getCode() : null;
    }

    @Override
    public String toString() {
        return "FailoverResult{success=" + success
             + ", provider=" + providerName
             + ", totalAttempts=" + totalAttempts
             + ", failover=" + failoverOccurred
             + (failoverFromProviderId != null ? ", from=" + failoverFromProviderId : "")
             + (error != null ? ", error=" + error : "")
             + "}";
    }
}
