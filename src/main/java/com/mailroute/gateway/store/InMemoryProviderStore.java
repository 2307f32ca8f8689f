package com.mailroute.gateway.store;

import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Provider records and routing rows held in memory.
 *
 * <p>Counter updates replace the whole immutable record inside
 * {@link ConcurrentHashMap#computeIfPresent}, so concurrent updates to the
 * same provider serialise on its map bin. Hourly and daily counts restart
 * when the UTC hour or day rolls over, tracked through
 * {@code rateLimitResetAt}. Updates for unknown ids are ignored.
 */
public class InMemoryProviderStore implements ProviderStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryProviderStore.class);

    private final Map<String, EmailProvider>  providers = new ConcurrentHashMap<>();
    private final Map<TaskType, TaskRouting>  routings  = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryProviderStore() {
        this(Clock.systemUTC());
    }

    public InMemoryProviderStore(final Clock clock) {
        this.clock = clock;
    }

    public void saveProvider(final EmailProvider provider) {
        providers.put(provider.getId(), provider);
    }

    public void saveRouting(final TaskRouting routing) {
        routings.put(routing.getTaskType(), routing);
    }

    @Override
    public Optional<EmailProvider> getProvider(final String providerId) {
        if (providerId == null) return Optional.empty();
        return Optional.ofNullable(providers.get(providerId));
    }

    @Override
    public Optional<TaskRouting> getTaskRouting(final TaskType taskType) {
        return Optional.ofNullable(routings.get(taskType));
    }

    @Override
    public List<EmailProvider> listProviders() {
        return providers.values().stream()
                .sorted(Comparator.comparingInt(EmailProvider::getPriorityOrder)
                        .thenComparing(EmailProvider::getId))
                .collect(Collectors.toList());
    }

    @Override
    public void incrementRateCounters(final String providerId) {
        final Instant now = clock.instant();
        final EmailProvider updated = providers.computeIfPresent(providerId, (id, p) -> {
            final EmailProvider rolled = rollWindows(p, now);
            return rolled.toBuilder()
                    .currentHourlyCount(rolled.getCurrentHourlyCount() + 1)
                    .currentDailyCount(rolled.getCurrentDailyCount() + 1)
                    .build();
        });
        if (updated == null) {
            LOG.debug("Rate counter update for unknown provider {}", providerId);
        }
    }

    @Override
    public void updateHealth(final String providerId, final boolean success, final String errorMessage) {
        final Instant now = clock.instant();
        providers.computeIfPresent(providerId, (id, p) -> {
            final EmailProvider.Builder b = p.toBuilder().lastUsedAt(now);
            if (success) {
                b.consecutiveFailures(0).totalSent(p.getTotalSent() + 1);
            } else {
                b.consecutiveFailures(p.getConsecutiveFailures() + 1)
                 .totalFailed(p.getTotalFailed() + 1)
                 .lastErrorAt(now)
                 .lastErrorMessage(errorMessage);
            }
            return b.build();
        });
    }

    @Override
    public void resetHealth(final String providerId) {
        providers.computeIfPresent(providerId, (id, p) -> p.toBuilder().consecutiveFailures(0).build());
    }

    private static EmailProvider rollWindows(final EmailProvider p, final Instant now) {
        final Instant resetAt = p.getRateLimitResetAt();
        final Instant hour = now.truncatedTo(ChronoUnit.HOURS);
        if (resetAt != null && !resetAt.isBefore(hour)) {
            return p;
        }
        final boolean sameDay = resetAt != null
                && resetAt.truncatedTo(ChronoUnit.DAYS).equals(now.truncatedTo(ChronoUnit.DAYS));
        return p.toBuilder()
                .currentHourlyCount(0)
                .currentDailyCount(sameDay ? p.getCurrentDailyCount() : 0)
                .rateLimitResetAt(hour)
                .build();
    }
}
