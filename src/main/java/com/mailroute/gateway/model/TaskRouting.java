package com.mailroute.gateway.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Routing row for one {@link TaskType}: which provider to try first, which
 * to fall back to, and how hard to try.
 */
public final class TaskRouting {

    public static final int      DEFAULT_RETRY_ATTEMPTS    = 1;
    public static final Duration DEFAULT_RETRY_DELAY       = Duration.ofSeconds(5);
    public static final int      DEFAULT_MAX_SEND_ATTEMPTS = 3;

    private final TaskType     taskType;
    private final String       primaryProviderId;
    private final List<String> fallbackProviderIds;
    private final int          retryAttempts;
    private final Duration     retryDelay;
    private final int          maxSendAttempts;
    private final String       forceProviderId;
    private final boolean      enabled;
    private final String       description;

    private TaskRouting(final Builder b) {
        if (b.retryAttempts < 1) {
            throw new IllegalArgumentException("retryAttempts must be >= 1 for " + b.taskType);
        }
        if (b.maxSendAttempts < 1) {
            throw new IllegalArgumentException("maxSendAttempts must be >= 1 for " + b.taskType);
        }
        if (b.retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative for " + b.taskType);
        }
        this.taskType            = b.taskType;
        this.primaryProviderId   = b.primaryProviderId;
        this.fallbackProviderIds = List.copyOf(b.fallbackProviderIds);
        this.retryAttempts       = b.retryAttempts;
        this.retryDelay          = b.retryDelay;
        this.maxSendAttempts     = b.maxSendAttempts;
        this.forceProviderId     = blankToNull(b.forceProviderId);
        this.enabled             = b.enabled;
        this.description         = b.description;
    }

    public static Builder builder(final TaskType taskType) {
        return new Builder(taskType);
    }

    public static final class Builder {
        private final TaskType taskType;
        private String       primaryProviderId;
        private final List<String> fallbackProviderIds = new ArrayList<>();
        private int          retryAttempts   = DEFAULT_RETRY_ATTEMPTS;
        private Duration     retryDelay      = DEFAULT_RETRY_DELAY;
        private int          maxSendAttempts = DEFAULT_MAX_SEND_ATTEMPTS;
        private String       forceProviderId;
        private boolean      enabled = true;
        private String       description;

        private Builder(final TaskType taskType) {
            this.taskType = Objects.requireNonNull(taskType, "taskType");
        }

        public Builder primary(final String providerId)  { this.primaryProviderId = providerId; return this; }
        public Builder retryAttempts(final int n)        { this.retryAttempts = n; return this; }
        public Builder maxSendAttempts(final int n)      { this.maxSendAttempts = n; return this; }
        public Builder forceProvider(final String id)    { this.forceProviderId = id; return this; }
        public Builder enabled(final boolean v)          { this.enabled = v; return this; }
        public Builder description(final String v)       { this.description = v; return this; }

        public Builder retryDelay(final Duration d) {
            this.retryDelay = Objects.requireNonNull(d, "retryDelay");
            return this;
        }

        public Builder fallbacks(final String... ids) {
            return fallbacks(List.of(ids));
        }

        public Builder fallbacks(final List<String> ids) {
            if (ids != null) {
                for (final String id : ids) {
                    if (id != null && !id.isBlank()) fallbackProviderIds.add(id.trim());
                }
            }
            return this;
        }

        public TaskRouting build() { return new TaskRouting(this); }
    }

    public TaskType     getTaskType()            { return taskType; }
    public String       getPrimaryProviderId()   { return primaryProviderId; }
    public List<String> getFallbackProviderIds() { return fallbackProviderIds; }
    public int          getRetryAttempts()       { return retryAttempts; }
    public Duration     getRetryDelay()          { return retryDelay; }
    public int          getMaxSendAttempts()     { return maxSendAttempts; }
    public String       getForceProviderId()     { return forceProviderId; }
    public boolean      isEnabled()              { return enabled; }
    public String       getDescription()         { return description; }

    public boolean hasForcedProvider() {
        return forceProviderId != null;
    }

    private static String blankToNull(final String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    @Override
    public String toString() {
        return "TaskRouting{" + taskType
             + (forceProviderId != null ? ", force=" + forceProviderId : ", primary=" + primaryProviderId)
             + ", fallbacks=" + fallbackProviderIds
             + ", retries=" + retryAttempts
             + ", delay=" + retryDelay.toMillis() + "ms"
             + ", maxAttempts=" + maxSendAttempts
             + ", enabled=" + enabled + "}";
    }
}
