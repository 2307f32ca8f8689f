package com.mailroute.gateway.routing;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.store.ProviderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a {@link TaskRouting} row into the ordered list of providers to try.
 *
 * <p>A forced provider yields a chain of exactly that provider when it exists
 * and is active; its health is not consulted, so an operator can pin traffic
 * to a provider that is recovering. Otherwise the primary comes first and the
 * fallbacks follow in declared order, each kept only when active and below
 * the consecutive-failure threshold. The order is never re-sorted and a
 * provider id listed twice appears once.
 */
public class ProviderChainBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderChainBuilder.class);

    private final ProviderStore         store;
    private final ProviderHealthTracker tracker;

    public ProviderChainBuilder(final ProviderStore store, final ProviderHealthTracker tracker) {
        this.store   = store;
        this.tracker = tracker;
    }

    public List<EmailProvider> build(final TaskRouting routing) {
        if (routing.hasForcedProvider()) {
            final Optional<EmailProvider> forced = store.getProvider(routing.getForceProviderId());
            if (forced.isPresent() && forced.get().isActive()) {
                return List.of(forced.get());
            }
            LOG.warn("Forced provider {} for {} is missing or inactive",
                    routing.getForceProviderId(), routing.getTaskType());
            return List.of();
        }

        final Set<String> ids = new LinkedHashSet<>();
        if (routing.getPrimaryProviderId() != null) {
            ids.add(routing.getPrimaryProviderId());
        }
        ids.addAll(routing.getFallbackProviderIds());

        final List<EmailProvider> chain = new ArrayList<>(ids.size());
        for (final String id : ids) {
            final Optional<EmailProvider> provider = store.getProvider(id);
            if (provider.isEmpty()) {
                LOG.warn("Routing for {} references unknown provider {}", routing.getTaskType(), id);
                continue;
            }
            if (isEligible(provider.get())) {
                chain.add(provider.get());
            } else {
                LOG.debug("Provider {} left out of chain for {}: inactive or unhealthy", id, routing.getTaskType());
            }
        }
        return chain;
    }

    private boolean isEligible(final EmailProvider provider) {
        return provider.isActive() && tracker.snapshot(provider).isHealthy();
    }
}
