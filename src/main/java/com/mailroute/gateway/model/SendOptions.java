package com.mailroute.gateway.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call options for the routing engine. All fields are optional.
 *
 * <ul>
 *   <li>{@code userId}: recipient user, enables the consent check</li>
 *   <li>{@code emailId}: caller correlation id, copied into audit records</li>
 *   <li>{@code deadline}: no attempt starts after this instant</li>
 *   <li>{@code cancellation}: stops the chain walk before the next attempt</li>
 * </ul>
 */
public final class SendOptions {

    private static final SendOptions NONE = builder().build();

    private final String              userId;
    private final String              emailId;
    private final Map<String, Object> metadata;
    private final Instant             deadline;
    private final CancellationSignal  cancellation;

    private SendOptions(final Builder b) {
        this.userId       = b.userId;
        this.emailId      = b.emailId;
        this.metadata     = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        this.deadline     = b.deadline;
        this.cancellation = b.cancellation;
    }

    public static SendOptions none() {
        return NONE;
    }

    public static SendOptions forUser(final String userId) {
        return builder().userId(userId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String userId;
        private String emailId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant deadline;
        private CancellationSignal cancellation;

        private Builder() {}

        public Builder userId(final String v)                  { this.userId = v; return this; }
        public Builder emailId(final String v)                 { this.emailId = v; return this; }
        public Builder deadline(final Instant v)               { this.deadline = v; return this; }
        public Builder cancellation(final CancellationSignal v) { this.cancellation = v; return this; }

        public Builder metadata(final String key, final Object value) {
            metadata.put(key, value);
            return this;
        }

        public SendOptions build() { return new SendOptions(this); }
    }

    public String              getUserId()       { return userId; }
    public String              getEmailId()      { return emailId; }
    public Map<String, Object> getMetadata()     { return metadata; }
    public Instant             getDeadline()     { return deadline; }
    public CancellationSignal  getCancellation() { return cancellation; }

    public boolean hasUser() {
        return userId != null && !userId.isBlank();
    }

    /** True when the caller cancelled or the deadline has passed at {@code now}. */
    public boolean isStopped(final Instant now) {
        if (cancellation != null && cancellation.isCancelled()) return true;
        return deadline != null && !now.isBefore(deadline);
    }
}
