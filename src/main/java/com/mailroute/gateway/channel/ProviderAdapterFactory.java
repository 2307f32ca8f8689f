package com.mailroute.gateway.channel;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.security.CredentialCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link ProviderAdapter} instances from provider records.
 *
 * <p>Types with a dedicated API adapter get it; every other type, including
 * ones added to {@code ProviderType} later, falls back to the generic SMTP
 * adapter rather than failing. Adapters are cached per provider id so HTTP
 * connection pools survive across messages; a cached adapter is replaced
 * (and closed) when the provider's configuration changes.
 */
public class ProviderAdapterFactory implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderAdapterFactory.class);

    private final CredentialCipher      cipher;
    private final ProviderHealthTracker tracker;
    private final Map<String, ProviderAdapter> cache = new ConcurrentHashMap<>();

    public ProviderAdapterFactory(final CredentialCipher cipher, final ProviderHealthTracker tracker) {
        this.cipher  = cipher;
        this.tracker = tracker;
    }

    /** A new, uncached adapter for {@code provider}. */
    public ProviderAdapter create(final EmailProvider provider) {
        return switch (provider.getProviderType()) {
            case SES            -> new SesProviderAdapter(provider, cipher, tracker);
            case SENDGRID       -> new SendGridProviderAdapter(provider, cipher, tracker);
            case POSTMARK       -> new PostmarkProviderAdapter(provider, cipher, tracker);
            case PABBLY_WEBHOOK -> new WebhookProviderAdapter(provider, cipher, tracker);
            default             -> new SmtpProviderAdapter(provider, cipher, tracker);
        };
    }

    /**
     * The cached adapter for {@code provider}, rebuilt when its configuration,
     * active flag or quotas differ from the record the cached one was built
     * from. Counter changes alone keep the cached adapter; live counters are
     * read from the tracker.
     */
    public ProviderAdapter adapterFor(final EmailProvider provider) {
        final ProviderAdapter[] replaced = new ProviderAdapter[1];
        final ProviderAdapter adapter = cache.compute(provider.getId(), (id, existing) -> {
            if (existing == null) {
                LOG.debug("Building adapter: provider={} type={}", id, provider.getProviderType().tag());
                return create(provider);
            }
            if (existing.provider().configurationDiffers(provider)
                    || existing.provider().isActive() != provider.isActive()
                    || existing.provider().getMaxPerHour() != provider.getMaxPerHour()
                    || existing.provider().getMaxPerDay() != provider.getMaxPerDay()) {
                LOG.info("Provider {} changed; rebuilding adapter", id);
                replaced[0] = existing;
                return create(provider);
            }
            return existing;
        });
        if (replaced[0] != null) {
            replaced[0].close();
        }
        return adapter;
    }

    /** Drop and close the cached adapter of {@code providerId}, if any. */
    public void evict(final String providerId) {
        final ProviderAdapter removed = cache.remove(providerId);
        if (removed != null) {
            removed.close();
        }
    }

    @Override
    public void close() {
        cache.values().forEach(ProviderAdapter::close);
        cache.clear();
    }
}
