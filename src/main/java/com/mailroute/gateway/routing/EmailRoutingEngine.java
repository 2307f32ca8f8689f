package com.mailroute.gateway.routing;

import com.mailroute.gateway.audit.AuditLogger;
import com.mailroute.gateway.channel.ProviderAdapter;
import com.mailroute.gateway.channel.ProviderAdapterFactory;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.FailoverResult;
import com.mailroute.gateway.model.ProbeResult;
import com.mailroute.gateway.model.SendError;
import com.mailroute.gateway.model.SendOptions;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.retry.RetryBackoff;
import com.mailroute.gateway.security.LogSanitizer;
import com.mailroute.gateway.store.ProviderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes one message of a given {@link TaskType} across its provider chain.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Consent check: a rejected recipient yields {@code CONSENT_REQUIRED}
 *       without touching any provider.</li>
 *   <li>Routing lookup: missing or disabled routing yields
 *       {@code ROUTING_NOT_CONFIGURED}.</li>
 *   <li>Chain build via {@link ProviderChainBuilder}; an empty chain yields
 *       {@code NO_PROVIDERS_AVAILABLE}.</li>
 *   <li>Chain walk: up to {@code retryAttempts} tries per provider, capped by
 *       {@code maxSendAttempts} across the whole chain. A provider that cannot
 *       send (quota or failure threshold) is skipped after one counted,
 *       audited attempt. Every real attempt is audited and updates the
 *       provider's health.</li>
 * </ol>
 *
 * <p>The walk for a single message is sequential. Attempts run on the send
 * executor and the wait between retries is a scheduled task, so no thread
 * sleeps. Nothing in this class throws to the caller: every outcome is a
 * {@link FailoverResult}. Closing an engine that owns its executors ends
 * every unfinished walk with {@code CANCELLED}.
 */
public class EmailRoutingEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EmailRoutingEngine.class);

    static final String REASON_RATE_LIMITED = "Rate limit exceeded";
    static final String REASON_FAILED       = "Provider failed after retries";
    static final String REASON_ALL_FAILED   = "All providers failed";
    static final String REASON_CLOSED       = "Routing engine closed";

    private final ProviderStore            store;
    private final ProviderAdapterFactory   adapters;
    private final ProviderHealthTracker    tracker;
    private final ConsentGate              consent;
    private final ProviderChainBuilder     chains;
    private final AuditLogger              audit;
    private final RetryBackoff             backoff;
    private final Executor                 sendExecutor;
    private final ScheduledExecutorService scheduler;
    private final Clock                    clock;
    private final boolean                  ownsExecutors;
    private final Set<ChainRun>            live   = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean            closed = new AtomicBoolean(false);

    /** Engine with its own send pool of {@code sendThreads} threads and retry timer. */
    public EmailRoutingEngine(
            final ProviderStore store,
            final ProviderAdapterFactory adapters,
            final ProviderHealthTracker tracker,
            final ConsentGate consent,
            final AuditLogger audit,
            final RetryBackoff backoff,
            final int sendThreads) {
        this(store, adapters, tracker, consent, audit, backoff,
                newSendPool(sendThreads), newScheduler(), Clock.systemUTC(), true);
    }

    /** Engine running on caller-owned executors; {@link #close()} leaves them alone. */
    public EmailRoutingEngine(
            final ProviderStore store,
            final ProviderAdapterFactory adapters,
            final ProviderHealthTracker tracker,
            final ConsentGate consent,
            final AuditLogger audit,
            final RetryBackoff backoff,
            final Executor sendExecutor,
            final ScheduledExecutorService scheduler,
            final Clock clock) {
        this(store, adapters, tracker, consent, audit, backoff, sendExecutor, scheduler, clock, false);
    }

    private EmailRoutingEngine(
            final ProviderStore store,
            final ProviderAdapterFactory adapters,
            final ProviderHealthTracker tracker,
            final ConsentGate consent,
            final AuditLogger audit,
            final RetryBackoff backoff,
            final Executor sendExecutor,
            final ScheduledExecutorService scheduler,
            final Clock clock,
            final boolean ownsExecutors) {
        this.store         = store;
        this.adapters      = adapters;
        this.tracker       = tracker;
        this.consent       = consent;
        this.chains        = new ProviderChainBuilder(store, tracker);
        this.audit         = audit;
        this.backoff       = backoff;
        this.sendExecutor  = sendExecutor;
        this.scheduler     = scheduler;
        this.clock         = clock;
        this.ownsExecutors = ownsExecutors;
    }

    // ── Public API ────────────────────────────────────────────────────────────

    /**
     * Route {@code message} through the provider chain configured for
     * {@code taskType}. The returned future always completes normally.
     */
    public CompletableFuture<FailoverResult> sendWithRouting(
            final TaskType taskType,
            final EmailMessage message,
            final SendOptions options) {
        final SendOptions opts = options != null ? options : SendOptions.none();
        final ChainRun run = new ChainRun(taskType, message, opts);
        live.add(run);
        run.result.whenComplete((r, t) -> live.remove(run));
        if (closed.get()) {
            run.abandon();
            return run.result;
        }
        try {
            sendExecutor.execute(run::start);
        } catch (RuntimeException e) {
            LOG.error("Send executor rejected {} message: {}", taskType, e.getMessage());
            run.complete(FailoverResult.rejected(ErrorCodes.SEND_ERROR, "Send executor unavailable: " + e.getMessage()));
        }
        return run.result;
    }

    /** Blocking form of {@link #sendWithRouting}. */
    public FailoverResult send(final TaskType taskType, final EmailMessage message, final SendOptions options) {
        return await(sendWithRouting(taskType, message, options));
    }

    public FailoverResult send(final TaskType taskType, final EmailMessage message) {
        return send(taskType, message, SendOptions.none());
    }

    /**
     * One attempt on a named provider, bypassing consent, routing and
     * failover. Used for operator test sends; the attempt is audited and
     * updates the provider's health like any other.
     */
    public CompletableFuture<FailoverResult> sendWithProvider(final String providerId, final EmailMessage message) {
        return CompletableFuture
                .supplyAsync(() -> store.getProvider(providerId), sendExecutor)
                .thenApply(found -> found
                        .map(p -> sendDirect(p, message))
                        .orElseGet(() -> FailoverResult.rejected(
                                ErrorCodes.PROVIDER_NOT_FOUND, "Provider not found: " + providerId)))
                .exceptionally(t -> unexpected(providerId, t));
    }

    public CompletableFuture<FailoverResult> sendWithProvider(final EmailProvider provider, final EmailMessage message) {
        return CompletableFuture
                .supplyAsync(() -> sendDirect(provider, message), sendExecutor)
                .exceptionally(t -> unexpected(provider.getId(), t));
    }

    /** Connectivity probe of a stored provider. Blocks for the probe's duration. */
    public ProbeResult testProvider(final String providerId) {
        final Optional<EmailProvider> provider = store.getProvider(providerId);
        if (provider.isEmpty()) {
            return ProbeResult.failed("Provider not found: " + providerId);
        }
        final ProbeResult probe = adapters.adapterFor(provider.get()).test();
        LOG.info("Probe of provider {}: {}", providerId, probe);
        return probe;
    }

    /**
     * Stops the executors this engine created. Walks waiting for a retry are
     * not resumed; they complete with {@code CANCELLED} once the send pool
     * has drained. An engine on caller-owned executors is left running.
     */
    @Override
    public void close() {
        if (!ownsExecutors || !closed.compareAndSet(false, true)) return;
        scheduler.shutdownNow();
        final ExecutorService pool = (ExecutorService) sendExecutor;
        pool.shutdown();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Send pool did not drain in 30s; forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
        for (final ChainRun run : live) {
            run.abandon();
        }
        LOG.info("Routing engine closed");
    }

    // ── Chain walk ────────────────────────────────────────────────────────────

    /**
     * State of one message's walk. Fields are only touched by the single
     * task currently advancing the walk; each hand-off goes through an
     * executor, which orders the writes.
     */
    private final class ChainRun {

        private final TaskType     taskType;
        private final EmailMessage message;
        private final SendOptions  options;
        private final CompletableFuture<FailoverResult> result = new CompletableFuture<>();
        private final AtomicBoolean abandoned = new AtomicBoolean(false);

        private TaskRouting         routing;
        private List<EmailProvider> chain;
        private int                 providerIndex;
        private int                 retry;
        private int                 totalAttempts;
        private boolean             failoverOccurred;
        private String              failoverFrom;
        private String              failoverReason;
        private EmailProvider       lastProvider;
        private SendError           lastError;

        ChainRun(final TaskType taskType, final EmailMessage message, final SendOptions options) {
            this.taskType = taskType;
            this.message  = message;
            this.options  = options;
        }

        void start() {
            try {
                if (!consent.check(options.getUserId(), taskType)) {
                    reject(ErrorCodes.CONSENT_REQUIRED, "Recipient has not consented to " + taskType + " emails");
                    return;
                }
                final Optional<TaskRouting> found = store.getTaskRouting(taskType);
                if (found.isEmpty() || !found.get().isEnabled()) {
                    reject(ErrorCodes.ROUTING_NOT_CONFIGURED, "No enabled routing configured for " + taskType);
                    return;
                }
                routing = found.get();
                chain   = chains.build(routing);
                if (chain.isEmpty()) {
                    reject(ErrorCodes.NO_PROVIDERS_AVAILABLE, "No active providers available for " + taskType);
                    return;
                }
                LOG.debug("Routing {} to {} provider(s), maxSendAttempts={}",
                        taskType, chain.size(), routing.getMaxSendAttempts());
                step();
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        /** Start the next attempt, or finish when nothing is left to try. */
        void step() {
            try {
                if (result.isDone()) return;
                if (options.isStopped(clock.instant())) {
                    cancelled();
                    return;
                }
                if (providerIndex >= chain.size() || totalAttempts >= routing.getMaxSendAttempts()) {
                    exhausted();
                    return;
                }

                final EmailProvider   provider = chain.get(providerIndex);
                final ProviderAdapter adapter  = adapters.adapterFor(provider);
                final int attemptNumber = ++totalAttempts;
                lastProvider = provider;

                if (!adapter.canSend()) {
                    final AttemptResult skipped = AttemptResult.builder(provider.getId(), provider.getProviderName())
                            .failure(SendError.of(ErrorCodes.PROVIDER_UNAVAILABLE, REASON_RATE_LIMITED))
                            .attemptNumber(attemptNumber)
                            .build();
                    audit.logAttempt(taskType, skipped, message.recipientCount(), options);
                    lastError = skipped.getError();
                    LOG.info("Provider {} cannot send; skipping for {}", provider.getId(), taskType);
                    leaveProvider(provider, REASON_RATE_LIMITED);
                    step();
                    return;
                }

                CompletableFuture
                        .supplyAsync(() -> attempt(adapter, message), sendExecutor)
                        .thenAccept(a -> onAttempt(provider, a.withAttemptNumber(attemptNumber)))
                        .exceptionally(t -> {
                            fail(t);
                            return null;
                        });
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        private void onAttempt(final EmailProvider provider, final AttemptResult attempt) {
            audit.logAttempt(taskType, attempt, message.recipientCount(), options);

            if (attempt.isSuccess()) {
                tracker.recordSuccess(provider);
                LOG.info("Sent {} email via {} (attempt {}/{}) msgId={}",
                        taskType, provider.getId(), attempt.getAttemptNumber(),
                        routing.getMaxSendAttempts(), attempt.getMessageId());
                complete(FailoverResult.from(attempt)
                        .totalAttempts(totalAttempts)
                        .failover(failoverOccurred, failoverFrom, failoverReason)
                        .build());
                return;
            }

            tracker.recordFailure(provider, attempt.getError().getMessage());
            lastError = attempt.getError();
            retry++;
            LOG.warn("Attempt {} of {} email via {} failed: {}",
                    attempt.getAttemptNumber(), taskType, provider.getId(),
                    LogSanitizer.sanitize(attempt.getError().toString()));

            final boolean retryHere = retry < routing.getRetryAttempts()
                    && totalAttempts < routing.getMaxSendAttempts();
            if (!retryHere) {
                leaveProvider(provider, REASON_FAILED);
                step();
                return;
            }

            final Duration delay = capToDeadline(backoff.delay(routing.getRetryDelay(), retry - 1));
            if (delay.isZero()) {
                step();
            } else {
                LOG.debug("Retrying {} in {}ms", provider.getId(), delay.toMillis());
                try {
                    scheduler.schedule(this::resume, delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    fail(e);
                }
            }
        }

        private void resume() {
            try {
                sendExecutor.execute(this::step);
            } catch (RuntimeException e) {
                fail(e);
            }
        }

        private Duration capToDeadline(final Duration delay) {
            final Instant deadline = options.getDeadline();
            if (deadline == null) return delay;
            final Duration remaining = Duration.between(clock.instant(), deadline);
            if (remaining.isNegative()) return Duration.ZERO;
            return remaining.compareTo(delay) < 0 ? remaining : delay;
        }

        private void leaveProvider(final EmailProvider provider, final String reason) {
            if (!failoverOccurred) {
                failoverOccurred = true;
                failoverFrom     = provider.getId();
                failoverReason   = reason;
            }
            providerIndex++;
            retry = 0;
        }

        // ── Terminal outcomes ────────────────────────────────────────────────

        private void reject(final String code, final String msg) {
            LOG.info("Rejected {} email: {}", taskType, code);
            audit.logRejection(taskType, code, msg, message.recipientCount(), options);
            complete(FailoverResult.rejected(code, msg));
        }

        private void exhausted() {
            final String msg = "Failed to send email after " + totalAttempts
                    + " attempts across " + chain.size() + " providers";
            LOG.error("{} email: {}", taskType, msg);
            complete(aggregateFailure(SendError.of(ErrorCodes.ALL_PROVIDERS_FAILED, msg),
                    failoverReason != null ? failoverReason : REASON_ALL_FAILED));
        }

        private void cancelled() {
            final String msg = "Send stopped by cancellation or deadline after " + totalAttempts + " attempts";
            LOG.info("{} email: {}", taskType, msg);
            audit.logRejection(taskType, ErrorCodes.CANCELLED, msg, message.recipientCount(), options);
            complete(aggregateFailure(SendError.of(ErrorCodes.CANCELLED, msg), failoverReason));
        }

        /** Ends the walk because the engine is closing; no further attempt starts. */
        void abandon() {
            if (result.isDone() || !abandoned.compareAndSet(false, true)) return;
            final String msg = REASON_CLOSED + " after " + totalAttempts + " attempts";
            LOG.warn("{} email: {}", taskType, msg);
            audit.logRejection(taskType, ErrorCodes.CANCELLED, msg, message.recipientCount(), options);
            complete(aggregateFailure(SendError.of(ErrorCodes.CANCELLED, msg), failoverReason));
        }

        private FailoverResult aggregateFailure(final SendError error, final String reason) {
            final EmailProvider last = lastProvider;
            return FailoverResult.builder()
                    .provider(last != null ? last.getId() : FailoverResult.NO_PROVIDER,
                              last != null ? last.getProviderName() : FailoverResult.NO_PROVIDER)
                    .error(error)
                    .attemptNumber(totalAttempts)
                    .totalAttempts(totalAttempts)
                    .failover(failoverOccurred, failoverFrom, reason)
                    .lastAttemptError(lastError)
                    .build();
        }

        private void fail(final Throwable t) {
            if (closed.get()) {
                abandon();
                return;
            }
            final Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
            LOG.error("Unexpected failure routing {} email", taskType, cause);
            complete(aggregateFailure(SendError.of(ErrorCodes.SEND_ERROR,
                    LogSanitizer.sanitize(String.valueOf(cause.getMessage()))), failoverReason));
        }

        void complete(final FailoverResult r) {
            result.complete(r);
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private FailoverResult sendDirect(final EmailProvider provider, final EmailMessage message) {
        final ProviderAdapter adapter = adapters.adapterFor(provider);
        final AttemptResult attempt;
        if (!adapter.canSend()) {
            attempt = AttemptResult.builder(provider.getId(), provider.getProviderName())
                    .failure(SendError.of(ErrorCodes.PROVIDER_UNAVAILABLE,
                            "Provider " + provider.getId() + " is currently unavailable"))
                    .build();
        } else {
            attempt = attempt(adapter, message);
            if (attempt.isSuccess()) {
                tracker.recordSuccess(provider);
            } else {
                tracker.recordFailure(provider, attempt.getError().getMessage());
            }
        }
        audit.logAttempt(null, attempt, message.recipientCount(), SendOptions.none());
        return FailoverResult.from(attempt).totalAttempts(1).build();
    }

    /** Adapters must not throw; anything that escapes still becomes a failed attempt. */
    private static AttemptResult attempt(final ProviderAdapter adapter, final EmailMessage message) {
        try {
            return adapter.send(message);
        } catch (RuntimeException e) {
            LOG.error("Adapter {} threw during send", adapter.providerId(), e);
            return AttemptResult.builder(adapter.providerId(), adapter.providerName())
                    .failure(SendError.of(ErrorCodes.SEND_ERROR, LogSanitizer.sanitize(String.valueOf(e.getMessage()))))
                    .build();
        }
    }

    private static FailoverResult unexpected(final String providerId, final Throwable t) {
        final Throwable cause = t instanceof CompletionException && t.getCause() != null ? t.getCause() : t;
        LOG.error("Unexpected failure sending via {}", providerId, cause);
        return FailoverResult.rejected(ErrorCodes.SEND_ERROR, LogSanitizer.sanitize(String.valueOf(cause.getMessage())));
    }

    private static FailoverResult await(final CompletableFuture<FailoverResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            return unexpected(FailoverResult.NO_PROVIDER, e);
        }
    }

    private static ExecutorService newSendPool(final int threads) {
        final AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            final Thread t = new Thread(r, "mail-send-" + seq.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
    }

    private static ScheduledExecutorService newScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "mail-retry-timer");
            t.setDaemon(true);
            return t;
        });
    }
}
