package com.mailroute.gateway.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Configured email provider: connection details, encrypted credentials,
 * routing role, rate limits and the mirrored health counters.
 *
 * <p>Instances are immutable snapshots. The provider store replaces the whole
 * record when counters change (see {@link #toBuilder()}). Credential fields
 * hold ciphertext only; {@link #toString()} reports their presence, never
 * their value.
 */
public final class EmailProvider {

    private final String         id;
    private final ProviderType   providerType;
    private final String         providerName;
    private final ConnectionType connectionType;
    private final String         fromName;
    private final String         fromEmail;
    private final String         replyToEmail;

    private final String         smtpHost;
    private final int            smtpPort;
    private final String         smtpUsername;
    private final String         smtpPasswordEncrypted;
    private final SmtpEncryption smtpEncryption;

    private final String         apiEndpoint;
    private final String         apiKeyEncrypted;
    private final String         apiSecretEncrypted;
    private final String         apiRegion;

    private final boolean        active;
    private final boolean        verified;
    private final ProviderRole   role;
    private final int            priorityOrder;

    private final int            maxPerHour;          // 0 = unlimited
    private final int            maxPerDay;           // 0 = unlimited
    private final int            currentHourlyCount;
    private final int            currentDailyCount;
    private final Instant        rateLimitResetAt;

    private final int            consecutiveFailures;
    private final long           totalSent;
    private final long           totalFailed;
    private final Instant        lastUsedAt;
    private final Instant        lastErrorAt;
    private final String         lastErrorMessage;

    private EmailProvider(final Builder b) {
        this.id                    = Objects.requireNonNull(b.id, "id");
        this.providerType          = b.providerType != null ? b.providerType : ProviderType.CUSTOM_SMTP;
        this.providerName          = b.providerName != null ? b.providerName : b.id;
        this.connectionType        = b.connectionType != null ? b.connectionType : providerType.getDefaultConnection();
        this.fromName              = b.fromName;
        this.fromEmail             = b.fromEmail;
        this.replyToEmail          = b.replyToEmail;
        this.smtpHost              = b.smtpHost;
        this.smtpPort              = b.smtpPort;
        this.smtpUsername          = b.smtpUsername;
        this.smtpPasswordEncrypted = b.smtpPasswordEncrypted;
        this.smtpEncryption        = b.smtpEncryption != null ? b.smtpEncryption : SmtpEncryption.TLS;
        this.apiEndpoint           = b.apiEndpoint;
        this.apiKeyEncrypted       = b.apiKeyEncrypted;
        this.apiSecretEncrypted    = b.apiSecretEncrypted;
        this.apiRegion             = b.apiRegion;
        this.active                = b.active;
        this.verified              = b.verified;
        this.role                  = b.role != null ? b.role : ProviderRole.PRIMARY;
        this.priorityOrder         = b.priorityOrder;
        this.maxPerHour            = Math.max(0, b.maxPerHour);
        this.maxPerDay             = Math.max(0, b.maxPerDay);
        this.currentHourlyCount    = b.currentHourlyCount;
        this.currentDailyCount     = b.currentDailyCount;
        this.rateLimitResetAt      = b.rateLimitResetAt;
        this.consecutiveFailures   = b.consecutiveFailures;
        this.totalSent             = b.totalSent;
        this.totalFailed           = b.totalFailed;
        this.lastUsedAt            = b.lastUsedAt;
        this.lastErrorAt           = b.lastErrorAt;
        this.lastErrorMessage      = b.lastErrorMessage;
    }

    public static Builder builder(final String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        final Builder b = new Builder(id);
        b.providerType          = providerType;
        b.providerName          = providerName;
        b.connectionType        = connectionType;
        b.fromName              = fromName;
        b.fromEmail             = fromEmail;
        b.replyToEmail          = replyToEmail;
        b.smtpHost              = smtpHost;
        b.smtpPort              = smtpPort;
        b.smtpUsername          = smtpUsername;
        b.smtpPasswordEncrypted = smtpPasswordEncrypted;
        b.smtpEncryption        = smtpEncryption;
        b.apiEndpoint           = apiEndpoint;
        b.apiKeyEncrypted       = apiKeyEncrypted;
        b.apiSecretEncrypted    = apiSecretEncrypted;
        b.apiRegion             = apiRegion;
        b.active                = active;
        b.verified              = verified;
        b.role                  = role;
        b.priorityOrder         = priorityOrder;
        b.maxPerHour            = maxPerHour;
        b.maxPerDay             = maxPerDay;
        b.currentHourlyCount    = currentHourlyCount;
        b.currentDailyCount     = currentDailyCount;
        b.rateLimitResetAt      = rateLimitResetAt;
        b.consecutiveFailures   = consecutiveFailures;
        b.totalSent             = totalSent;
        b.totalFailed           = totalFailed;
        b.lastUsedAt            = lastUsedAt;
        b.lastErrorAt           = lastErrorAt;
        b.lastErrorMessage      = lastErrorMessage;
        return b;
    }

    public static final class Builder {
        private final String id;
        private ProviderType   providerType;
        private String         providerName;
        private ConnectionType connectionType;
        private String         fromName;
        private String         fromEmail;
        private String         replyToEmail;
        private String         smtpHost;
        private int            smtpPort = 587;
        private String         smtpUsername;
        private String         smtpPasswordEncrypted;
        private SmtpEncryption smtpEncryption;
        private String         apiEndpoint;
        private String         apiKeyEncrypted;
        private String         apiSecretEncrypted;
        private String         apiRegion;
        private boolean        active = true;
        private boolean        verified;
        private ProviderRole   role;
        private int            priorityOrder = 1;
        private int            maxPerHour;
        private int            maxPerDay;
        private int            currentHourlyCount;
        private int            currentDailyCount;
        private Instant        rateLimitResetAt;
        private int            consecutiveFailures;
        private long           totalSent;
        private long           totalFailed;
        private Instant        lastUsedAt;
        private Instant        lastErrorAt;
        private String         lastErrorMessage;

        private Builder(final String id) {
            this.id = id;
        }

        public Builder providerType(final ProviderType v)     { this.providerType = v; return this; }
        public Builder providerName(final String v)           { this.providerName = v; return this; }
        public Builder connectionType(final ConnectionType v) { this.connectionType = v; return this; }
        public Builder fromName(final String v)               { this.fromName = v; return this; }
        public Builder fromEmail(final String v)              { this.fromEmail = v; return this; }
        public Builder replyToEmail(final String v)           { this.replyToEmail = v; return this; }
        public Builder smtpHost(final String v)               { this.smtpHost = v; return this; }
        public Builder smtpPort(final int v)                  { this.smtpPort = v; return this; }
        public Builder smtpUsername(final String v)           { this.smtpUsername = v; return this; }
        public Builder smtpPasswordEncrypted(final String v)  { this.smtpPasswordEncrypted = v; return this; }
        public Builder smtpEncryption(final SmtpEncryption v) { this.smtpEncryption = v; return this; }
        public Builder apiEndpoint(final String v)            { this.apiEndpoint = v; return this; }
        public Builder apiKeyEncrypted(final String v)        { this.apiKeyEncrypted = v; return this; }
        public Builder apiSecretEncrypted(final String v)     { this.apiSecretEncrypted = v; return this; }
        public Builder apiRegion(final String v)              { this.apiRegion = v; return this; }
        public Builder active(final boolean v)                { this.active = v; return this; }
        public Builder verified(final boolean v)              { this.verified = v; return this; }
        public Builder role(final ProviderRole v)             { this.role = v; return this; }
        public Builder priorityOrder(final int v)             { this.priorityOrder = v; return this; }
        public Builder maxPerHour(final int v)                { this.maxPerHour = v; return this; }
        public Builder maxPerDay(final int v)                 { this.maxPerDay = v; return this; }
        public Builder currentHourlyCount(final int v)        { this.currentHourlyCount = v; return this; }
        public Builder currentDailyCount(final int v)         { this.currentDailyCount = v; return this; }
        public Builder rateLimitResetAt(final Instant v)      { this.rateLimitResetAt = v; return this; }
        public Builder consecutiveFailures(final int v)       { this.consecutiveFailures = v; return this; }
        public Builder totalSent(final long v)                { this.totalSent = v; return this; }
        public Builder totalFailed(final long v)              { this.totalFailed = v; return this; }
        public Builder lastUsedAt(final Instant v)            { this.lastUsedAt = v; return this; }
        public Builder lastErrorAt(final Instant v)           { this.lastErrorAt = v; return this; }
        public Builder lastErrorMessage(final String v)       { this.lastErrorMessage = v; return this; }

        public EmailProvider build() { return new EmailProvider(this); }
    }

    public String         getId()                    { return id; }
    public ProviderType   getProviderType()          { return providerType; }
    public String         getProviderName()          { return providerName; }
    public ConnectionType getConnectionType()        { return connectionType; }
    public String         getFromName()              { return fromName; }
    public String         getFromEmail()             { return fromEmail; }
    public String         getReplyToEmail()          { return replyToEmail; }
    public String         getSmtpHost()              { return smtpHost; }
    public int            getSmtpPort()              { return smtpPort; }
    public String         getSmtpUsername()          { return smtpUsername; }
    public String         getSmtpPasswordEncrypted() { return smtpPasswordEncrypted; }
    public SmtpEncryption getSmtpEncryption()        { return smtpEncryption; }
    public String         getApiEndpoint()           { return apiEndpoint; }
    public String         getApiKeyEncrypted()       { return apiKeyEncrypted; }
    public String         getApiSecretEncrypted()    { return apiSecretEncrypted; }
    public String         getApiRegion()             { return apiRegion; }
    public boolean        isActive()                 { return active; }
    public boolean        isVerified()               { return verified; }
    public ProviderRole   getRole()                  { return role; }
    public int            getPriorityOrder()         { return priorityOrder; }
    public int            getMaxPerHour()            { return maxPerHour; }
    public int            getMaxPerDay()             { return maxPerDay; }
    public int            getCurrentHourlyCount()    { return currentHourlyCount; }
    public int            getCurrentDailyCount()     { return currentDailyCount; }
    public Instant        getRateLimitResetAt()      { return rateLimitResetAt; }
    public int            getConsecutiveFailures()   { return consecutiveFailures; }
    public long           getTotalSent()             { return totalSent; }
    public long           getTotalFailed()           { return totalFailed; }
    public Instant        getLastUsedAt()            { return lastUsedAt; }
    public Instant        getLastErrorAt()           { return lastErrorAt; }
    public String         getLastErrorMessage()      { return lastErrorMessage; }

    /** True when the configuration (not the counters) differs from {@code other}. */
    public boolean configurationDiffers(final EmailProvider other) {
        if (other == null) return true;
        return providerType != other.providerType
            || connectionType != other.connectionType
            || smtpPort != other.smtpPort
            || smtpEncryption != other.smtpEncryption
            || !Objects.equals(fromName, other.fromName)
            || !Objects.equals(fromEmail, other.fromEmail)
            || !Objects.equals(replyToEmail, other.replyToEmail)
            || !Objects.equals(smtpHost, other.smtpHost)
            || !Objects.equals(smtpUsername, other.smtpUsername)
            || !Objects.equals(smtpPasswordEncrypted, other.smtpPasswordEncrypted)
            || !Objects.equals(apiEndpoint, other.apiEndpoint)
            || !Objects.equals(apiKeyEncrypted, other.apiKeyEncrypted)
            || !Objects.equals(apiSecretEncrypted, other.apiSecretEncrypted)
            || !Objects.equals(apiRegion, other.apiRegion);
    }

    @Override
    public String toString() {
        return "EmailProvider{id=" + id
             + ", type=" + providerType.tag()
             + ", name=" + providerName
             + ", connection=" + connectionType
             + ", role=" + role
             + ", active=" + active
             + ", smtpPassword=" + present(smtpPasswordEncrypted)
             + ", apiKey=" + present(apiKeyEncrypted)
             + ", apiSecret=" + present(apiSecretEncrypted)
             + ", failures=" + consecutiveFailures
             + "}";
    }

    private static String present(final String secret) {
        return secret != null && !secret.isEmpty() ? "[set]" : "[none]";
    }
}
