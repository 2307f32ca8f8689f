package com.mailroute.gateway.channel;

import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ProbeResult;
import com.mailroute.gateway.model.ProviderCapabilities;

/**
 * Transport adapter for one configured {@link EmailProvider}.
 *
 * <p>Each implementation wraps a single transport family (SMTP, a vendor
 * HTTP API, a webhook relay) and translates an {@link EmailMessage} into
 * that transport's wire format.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance per provider is
 *       shared by every send thread.</li>
 *   <li>{@link #send} and {@link #test} must <em>never</em> throw. Every
 *       error is captured in the returned {@link AttemptResult} or
 *       {@link ProbeResult}. Retry and failover are applied by the routing
 *       engine above this layer.</li>
 *   <li>{@link #canSend()} has no side effects.</li>
 *   <li>Implementations must release their HTTP clients in {@link #close()}.</li>
 * </ul>
 */
public interface ProviderAdapter extends AutoCloseable {

    /** The provider record this adapter was built from. */
    EmailProvider provider();

    default String providerId() {
        return provider().getId();
    }

    default String providerName() {
        return provider().getProviderName();
    }

    /**
     * Attempt delivery of {@code message} exactly once.
     *
     * @return the outcome; never null
     */
    AttemptResult send(EmailMessage message);

    /**
     * Connectivity and credential probe. Never delivers a message.
     */
    ProbeResult test();

    ProviderCapabilities getCapabilities();

    /**
     * {@code false} when the provider is inactive, has reached the
     * consecutive-failure threshold, or has used up its hourly or daily
     * quota.
     */
    boolean canSend();

    @Override
    void close();
}
