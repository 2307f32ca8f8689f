package com.mailroute.gateway.model;

import java.time.Instant;

/**
 * Append-only record of one send attempt or rejection.
 *
 * <p>Carries routing facts only. Body, subject, addresses and credentials
 * are never part of a record; {@code errorMessage} is already sanitised and
 * truncated by the time it lands here.
 */
public final class AuditRecord {

    private final TaskType taskType;
    private final String   providerId;
    private final String   providerName;
    private final boolean  success;
    private final String   messageId;
    private final String   errorCode;
    private final String   errorMessage;
    private final int      attemptNumber;
    private final int      recipientCount;
    private final String   emailId;
    private final String   userId;
    private final Instant  timestamp;

    private AuditRecord(final Builder b) {
        this.taskType       = b.taskType;
        this.providerId     = b.providerId;
        this.providerName   = b.providerName;
        this.success        = b.success;
        this.messageId      = b.messageId;
        this.errorCode      = b.errorCode;
        this.errorMessage   = b.errorMessage;
        this.attemptNumber  = b.attemptNumber;
        this.recipientCount = b.recipientCount;
        this.emailId        = b.emailId;
        this.userId         = b.userId;
        this.timestamp      = b.timestamp != null ? b.timestamp : Instant.now();
    }

    public static Builder builder(final TaskType taskType) {
        return new Builder(taskType);
    }

    public static final class Builder {
        private final TaskType taskType;
        private String  providerId   = FailoverResult.NO_PROVIDER;
        private String  providerName = FailoverResult.NO_PROVIDER;
        private boolean success;
        private String  messageId;
        private String  errorCode;
        private String  errorMessage;
        private int     attemptNumber;
        private int     recipientCount;
        private String  emailId;
        private String  userId;
        private Instant timestamp;

        private Builder(final TaskType taskType) {
            this.taskType = taskType;
        }

        public Builder provider(final String id, final String name) {
            this.providerId   = id;
            this.providerName = name;
            return this;
        }

        public Builder success(final String messageId) {
            this.success   = true;
            this.messageId = messageId;
            return this;
        }

        public Builder failure(final String code, final String message) {
            this.success      = false;
            this.errorCode    = code;
            this.errorMessage = message;
            return this;
        }

        public Builder attemptNumber(final int n)   { this.attemptNumber = n; return this; }
        public Builder recipientCount(final int n)  { this.recipientCount = n; return this; }
        public Builder emailId(final String v)      { this.emailId = v; return this; }
        public Builder userId(final String v)       { this.userId = v; return this; }
        public Builder timestamp(final Instant v)   { this.timestamp = v; return this; }

        public AuditRecord build() { return new AuditRecord(this); }
    }

    public TaskType getTaskType()       { return taskType; }
    public String   getProviderId()     { return providerId; }
    public String   getProviderName()   { return providerName; }
    public boolean  isSuccess()         { return success; }
    public String   getMessageId()      { return messageId; }
    public String   getErrorCode()      { return errorCode; }
    public String   getErrorMessage()   { return errorMessage; }
    public int      getAttemptNumber()  { return attemptNumber; }
    public int      getRecipientCount() { return recipientCount; }
    public String   getEmailId()        { return emailId; }
    public String   getUserId()         { return userId; }
    public Instant  getTimestamp()      { return timestamp; }

    @Override
    public String toString() {
        return "AuditRecord{" + taskType
             + ", provider=" + providerId
             + ", success=" + success
             + ", attempt=" + attemptNumber
             + (errorCode != null ? ", error=" + errorCode : "")
             + "}";
    }
}
