package com.mailroute.gateway.health;

import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.security.LogSanitizer;
import com.mailroute.gateway.store.ProviderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Live health and rate counters for every provider, shared by all send
 * threads.
 *
 * <p>Counters live in a map keyed by provider id and are seeded from the
 * provider record the first time a provider is written to. Hourly and daily
 * quotas use fixed UTC windows held as immutable values and swapped by CAS,
 * so a window rolls over exactly once even under contention.
 *
 * <p>A provider reaching {@link #FAILURE_THRESHOLD} consecutive failures is
 * excluded until an operator calls {@link #resetHealth(String)}; there is no
 * time-based decay.
 *
 * <p>Every write is mirrored to the {@link ProviderStore}. A store failure is
 * logged and does not undo the in-memory update.
 */
public class ProviderHealthTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderHealthTracker.class);

    public static final int FAILURE_THRESHOLD = 10;

    private final Map<String, Counters> arena = new ConcurrentHashMap<>();
    private final ProviderStore store;
    private final Clock clock;

    public ProviderHealthTracker(final ProviderStore store) {
        this(store, Clock.systemUTC());
    }

    public ProviderHealthTracker(final ProviderStore store, final Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Whether {@code provider} may take another message right now. Pure:
     * repeated calls never change any counter.
     */
    public boolean canSend(final EmailProvider provider) {
        return evaluate(provider, view(provider), clock.instant());
    }

    public ProviderHealth snapshot(final EmailProvider provider) {
        final Instant now = clock.instant();
        final Counters c = view(provider);
        return new ProviderHealth(
                provider.getId(),
                provider.getProviderName(),
                provider.isActive(),
                evaluate(provider, c, now),
                c.hourly.get().countAt(now, ChronoUnit.HOURS),
                provider.getMaxPerHour(),
                c.daily.get().countAt(now, ChronoUnit.DAYS),
                provider.getMaxPerDay(),
                c.consecutiveFailures.get(),
                c.totalSent.get(),
                c.totalFailed.get(),
                c.lastUsedAt,
                c.lastErrorAt,
                c.lastErrorMessage);
    }

    public List<ProviderHealth> snapshotAll(final List<EmailProvider> providers) {
        return providers.stream().map(this::snapshot).collect(Collectors.toList());
    }

    /** Count a delivered message: quotas up, consecutive failures back to zero. */
    public void recordSuccess(final EmailProvider provider) {
        final Instant now = clock.instant();
        final Counters c = counters(provider);
        c.hourly.updateAndGet(w -> w.increment(now, ChronoUnit.HOURS));
        c.daily.updateAndGet(w -> w.increment(now, ChronoUnit.DAYS));
        c.consecutiveFailures.set(0);
        c.totalSent.incrementAndGet();
        c.lastUsedAt = now;

        mirror(provider.getId(), () -> {
            store.incrementRateCounters(provider.getId());
            store.updateHealth(provider.getId(), true, null);
        });
    }

    /** Count a transport failure. Quotas are untouched. */
    public void recordFailure(final EmailProvider provider, final String errorMessage) {
        final Instant now = clock.instant();
        final String sanitized = LogSanitizer.forAudit(errorMessage);
        final Counters c = counters(provider);
        final int failures = c.consecutiveFailures.incrementAndGet();
        c.totalFailed.incrementAndGet();
        c.lastUsedAt       = now;
        c.lastErrorAt      = now;
        c.lastErrorMessage = sanitized;

        if (failures == FAILURE_THRESHOLD) {
            LOG.warn("Provider {} reached {} consecutive failures and is excluded from routing until reset",
                    provider.getId(), FAILURE_THRESHOLD);
        }
        mirror(provider.getId(), () -> store.updateHealth(provider.getId(), false, sanitized));
    }

    /** Operator action: clear consecutive failures so the provider is eligible again. */
    public void resetHealth(final String providerId) {
        final Counters c = arena.get(providerId);
        if (c != null) {
            c.consecutiveFailures.set(0);
        }
        LOG.info("Health counters reset for provider {}", providerId);
        mirror(providerId, () -> store.resetHealth(providerId));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static boolean evaluate(final EmailProvider p, final Counters c, final Instant now) {
        if (!p.isActive()) return false;
        if (c.consecutiveFailures.get() >= FAILURE_THRESHOLD) return false;
        if (p.getMaxPerHour() > 0 && c.hourly.get().countAt(now, ChronoUnit.HOURS) >= p.getMaxPerHour()) {
            return false;
        }
        return p.getMaxPerDay() <= 0 || c.daily.get().countAt(now, ChronoUnit.DAYS) < p.getMaxPerDay();
    }

    /** Existing counters, or a detached seed that is not stored. */
    private Counters view(final EmailProvider provider) {
        final Counters c = arena.get(provider.getId());
        return c != null ? c : Counters.seed(provider, clock.instant());
    }

    private Counters counters(final EmailProvider provider) {
        return arena.computeIfAbsent(provider.getId(), id -> Counters.seed(provider, clock.instant()));
    }

    private void mirror(final String providerId, final Runnable write) {
        if (store == null) return;
        try {
            write.run();
        } catch (RuntimeException e) {
            LOG.warn("Failed to persist health counters for provider {}: {}",
                    providerId, LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private static final class Window {
        private final Instant start;
        private final int     count;

        private Window(final Instant start, final int count) {
            this.start = start;
            this.count = count;
        }

        int countAt(final Instant now, final ChronoUnit unit) {
            return start.equals(now.truncatedTo(unit)) ? count : 0;
        }

        Window increment(final Instant now, final ChronoUnit unit) {
            final Instant current = now.truncatedTo(unit);
            return new Window(current, start.equals(current) ? count + 1 : 1);
        }
    }

    private static final class Counters {
        final AtomicReference<Window> hourly;
        final AtomicReference<Window> daily;
        final AtomicInteger consecutiveFailures;
        final AtomicLong    totalSent;
        final AtomicLong    totalFailed;
        volatile Instant lastUsedAt;
        volatile Instant lastErrorAt;
        volatile String  lastErrorMessage;

        private Counters(final EmailProvider p, final Window hourly, final Window daily) {
            this.hourly              = new AtomicReference<>(hourly);
            this.daily               = new AtomicReference<>(daily);
            this.consecutiveFailures = new AtomicInteger(p.getConsecutiveFailures());
            this.totalSent           = new AtomicLong(p.getTotalSent());
            this.totalFailed         = new AtomicLong(p.getTotalFailed());
            this.lastUsedAt          = p.getLastUsedAt();
            this.lastErrorAt         = p.getLastErrorAt();
            this.lastErrorMessage    = p.getLastErrorMessage();
        }

        static Counters seed(final EmailProvider p, final Instant now) {
            final Instant hour = now.truncatedTo(ChronoUnit.HOURS);
            final Instant day  = now.truncatedTo(ChronoUnit.DAYS);
            final Instant resetAt = p.getRateLimitResetAt();
            final boolean sameHour = resetAt == null || !resetAt.isBefore(hour);
            final boolean sameDay  = resetAt == null || !resetAt.isBefore(day);
            return new Counters(p,
                    new Window(hour, sameHour ? p.getCurrentHourlyCount() : 0),
                    new Window(day,  sameDay  ? p.getCurrentDailyCount()  : 0));
        }
    }
}
