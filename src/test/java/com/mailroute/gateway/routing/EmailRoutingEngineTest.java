package com.mailroute.gateway.routing;

import com.mailroute.gateway.audit.AuditLogger;
import com.mailroute.gateway.channel.ProviderAdapter;
import com.mailroute.gateway.channel.ProviderAdapterFactory;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.AuditRecord;
import com.mailroute.gateway.model.CancellationSignal;
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
import com.mailroute.gateway.store.ConsentStatus;
import com.mailroute.gateway.store.InMemoryConsentStore;
import com.mailroute.gateway.store.InMemoryProviderStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailRoutingEngineTest {

    @Mock private ProviderAdapterFactory adapters;
    @Mock private ProviderAdapter        p1;
    @Mock private ProviderAdapter        p2;
    @Mock private ProviderAdapter        p3;

    private final List<AuditRecord> audited = new CopyOnWriteArrayList<>();

    private InMemoryProviderStore    store;
    private InMemoryConsentStore     consent;
    private ProviderHealthTracker    tracker;
    private ScheduledExecutorService scheduler;
    private EmailRoutingEngine       engine;

    private final EmailMessage message = EmailMessage.builder()
            .to("ada@example.com")
            .subject("Your code")
            .html("<p>123456</p>")
            .build();

    @BeforeEach
    void setup() {
        store     = new InMemoryProviderStore();
        consent   = new InMemoryConsentStore();
        tracker   = new ProviderHealthTracker(store);
        scheduler = Executors.newSingleThreadScheduledExecutor();

        for (final String id : List.of("p1", "p2", "p3")) {
            store.saveProvider(EmailProvider.builder(id).providerName(id.toUpperCase()).build());
        }
        stub("p1", p1);
        stub("p2", p2);
        stub("p3", p3);

        engine = new EmailRoutingEngine(
                store, adapters, tracker, new ConsentGate(consent),
                new AuditLogger(List.of(audited::add)),
                RetryBackoff.fixed(), Runnable::run, scheduler, Clock.systemUTC());
    }

    @AfterEach
    void teardown() {
        scheduler.shutdownNow();
    }

    // ── Retry and failover ────────────────────────────────────────────────────

    @Test
    void send_failsOverToFallback_afterPrimaryExhaustsRetries() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        when(p1.send(message)).thenReturn(failure("p1"), failure("p1"));
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProviderId()).isEqualTo("p2");
        assertThat(result.getMessageId()).isEqualTo("msg-2");
        assertThat(result.getTotalAttempts()).isEqualTo(3);
        assertThat(result.getAttemptNumber()).isEqualTo(3);
        assertThat(result.isFailoverOccurred()).isTrue();
        assertThat(result.getFailoverFromProviderId()).isEqualTo("p1");
        assertThat(result.getFailoverReason()).isEqualTo(EmailRoutingEngine.REASON_FAILED);

        verify(p1, times(2)).send(message);
        verify(p2, times(1)).send(message);
        assertThat(audited).extracting(AuditRecord::getAttemptNumber).containsExactly(1, 2, 3);
        assertThat(audited).extracting(AuditRecord::isSuccess).containsExactly(false, false, true);
    }

    @Test
    void send_stopsAtMaxSendAttempts_evenWithRetriesLeft() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        when(p1.send(message)).thenReturn(failure("p1"));
        when(p2.send(message)).thenReturn(failure("p2"));

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.ALL_PROVIDERS_FAILED);
        assertThat(result.getTotalAttempts()).isEqualTo(3);
        assertThat(result.getProviderId()).isEqualTo("p2");
        assertThat(result.getError().getMessage())
                .isEqualTo("Failed to send email after 3 attempts across 2 providers");
        assertThat(result.getLastAttemptError().getCode()).isEqualTo(ErrorCodes.SENDGRID_ERROR);
        verify(p2, times(1)).send(message);
        assertThat(audited).hasSize(3);
    }

    @Test
    void send_triesEveryProviderRetryAttemptsTimes_whenCeilingIsHigh() {
        routing(TaskType.SYSTEM_EMAILS, 2, 10, "p1", "p2", "p3");
        when(p1.send(message)).thenReturn(failure("p1"));
        when(p2.send(message)).thenReturn(failure("p2"));
        when(p3.send(message)).thenReturn(failure("p3"));

        final FailoverResult result = engine.send(TaskType.SYSTEM_EMAILS, message);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.ALL_PROVIDERS_FAILED);
        assertThat(result.getTotalAttempts()).isEqualTo(6);
        assertThat(result.getFailoverReason()).isEqualTo(EmailRoutingEngine.REASON_FAILED);
        verify(p1, times(2)).send(message);
        verify(p2, times(2)).send(message);
        verify(p3, times(2)).send(message);
    }

    @Test
    void send_makesSingleAttempt_whenCeilingIsOne() {
        routing(TaskType.MARKETING_EMAILS, 3, 1, "p1", "p2");
        when(p1.send(message)).thenReturn(failure("p1"));

        final FailoverResult result = engine.send(TaskType.MARKETING_EMAILS, message);

        assertThat(result.getTotalAttempts()).isEqualTo(1);
        verify(p1, times(1)).send(message);
        verify(p2, never()).send(any());
    }

    @Test
    void send_reportsNoFailover_whenPrimarySucceedsOnRetry() {
        routing(TaskType.AUTH_EMAILS, 2, 3, "p1", "p2");
        when(p1.send(message)).thenReturn(failure("p1"), success("p1", "msg-1"));

        final FailoverResult result = engine.send(TaskType.AUTH_EMAILS, message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getProviderId()).isEqualTo("p1");
        assertThat(result.getTotalAttempts()).isEqualTo(2);
        assertThat(result.isFailoverOccurred()).isFalse();
        assertThat(result.getFailoverFromProviderId()).isNull();
        verify(p2, never()).send(any());
    }

    @Test
    void send_waitsRetryDelay_onSchedulerBetweenRetries() {
        store.saveRouting(TaskRouting.builder(TaskType.AUTH_EMAILS)
                .primary("p1")
                .retryAttempts(2)
                .retryDelay(Duration.ofMillis(50))
                .build());
        when(p1.send(message)).thenReturn(failure("p1"), success("p1", "msg-1"));

        final long start = System.nanoTime();
        final FailoverResult result = engine
                .sendWithRouting(TaskType.AUTH_EMAILS, message, SendOptions.none())
                .orTimeout(5, TimeUnit.SECONDS)
                .join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotalAttempts()).isEqualTo(2);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(50));
    }

    @Test
    void send_turnsAdapterExceptionIntoSendError_andFailsOver() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 1, 3, "p1", "p2");
        when(p1.send(message)).thenThrow(new IllegalStateException("boom"));
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(audited.get(0).getErrorCode()).isEqualTo(ErrorCodes.SEND_ERROR);
        assertThat(audited.get(0).getErrorMessage()).contains("boom");
    }

    // ── Rate limiting and health ──────────────────────────────────────────────

    @Test
    void send_skipsRateLimitedProvider_withoutTouchingHealth() {
        routing(TaskType.NOTIFICATION_EMAILS, 2, 3, "p1", "p2");
        when(p1.canSend()).thenReturn(false);
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        final FailoverResult result = engine.send(TaskType.NOTIFICATION_EMAILS, message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotalAttempts()).isEqualTo(2);
        assertThat(result.getFailoverFromProviderId()).isEqualTo("p1");
        assertThat(result.getFailoverReason()).isEqualTo(EmailRoutingEngine.REASON_RATE_LIMITED);
        verify(p1, never()).send(any());

        assertThat(audited.get(0).getErrorCode()).isEqualTo(ErrorCodes.PROVIDER_UNAVAILABLE);
        assertThat(store.getProvider("p1").orElseThrow().getConsecutiveFailures()).isZero();
        assertThat(store.getProvider("p1").orElseThrow().getTotalFailed()).isZero();
    }

    @Test
    void send_updatesHealthAndRateCounters_forEachAttempt() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        when(p1.send(message)).thenReturn(failure("p1"), failure("p1"));
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        engine.send(TaskType.TRANSACTIONAL_EMAILS, message);

        final EmailProvider primary  = store.getProvider("p1").orElseThrow();
        final EmailProvider fallback = store.getProvider("p2").orElseThrow();
        assertThat(primary.getConsecutiveFailures()).isEqualTo(2);
        assertThat(primary.getTotalFailed()).isEqualTo(2);
        assertThat(fallback.getTotalSent()).isEqualTo(1);
        assertThat(fallback.getCurrentHourlyCount()).isEqualTo(1);
        assertThat(tracker.snapshot(fallback).getHourlyCount()).isEqualTo(1);
    }

    @Test
    void send_leavesOutProviderAtFailureThreshold() {
        store.saveProvider(EmailProvider.builder("p1")
                .consecutiveFailures(ProviderHealthTracker.FAILURE_THRESHOLD)
                .build());
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotalAttempts()).isEqualTo(1);
        assertThat(result.isFailoverOccurred()).isFalse();
        verify(p1, never()).send(any());
    }

    @Test
    void send_usesOnlyForcedProvider() {
        store.saveRouting(TaskRouting.builder(TaskType.BILLING_EMAILS)
                .primary("p1")
                .fallbacks("p2")
                .forceProvider("p3")
                .retryDelay(Duration.ZERO)
                .build());
        when(p3.send(message)).thenReturn(success("p3", "msg-3"));

        final FailoverResult result = engine.send(TaskType.BILLING_EMAILS, message);

        assertThat(result.getProviderId()).isEqualTo("p3");
        verify(p1, never()).send(any());
        verify(p2, never()).send(any());
    }

    // ── Terminal configuration outcomes ───────────────────────────────────────

    @Test
    void send_rejectsMarketing_withoutConsent() {
        routing(TaskType.MARKETING_EMAILS, 1, 3, "p1");

        final FailoverResult result = engine.send(
                TaskType.MARKETING_EMAILS, message, SendOptions.forUser("user-1"));

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CONSENT_REQUIRED);
        assertThat(result.getProviderId()).isEqualTo(FailoverResult.NO_PROVIDER);
        assertThat(result.getTotalAttempts()).isZero();
        verifyNoInteractions(adapters);
        assertThat(audited).hasSize(1);
        assertThat(audited.get(0).getErrorCode()).isEqualTo(ErrorCodes.CONSENT_REQUIRED);
        assertThat(audited.get(0).getUserId()).isEqualTo("user-1");
        assertThat(store.getProvider("p1").orElseThrow().getTotalSent()).isZero();
    }

    @Test
    void send_deliversMarketing_whenConsentGranted() {
        routing(TaskType.MARKETING_EMAILS, 1, 3, "p1");
        consent.record("user-1", TaskType.MARKETING_EMAILS, ConsentStatus.GRANTED);
        when(p1.send(message)).thenReturn(success("p1", "msg-1"));

        final FailoverResult result = engine.send(
                TaskType.MARKETING_EMAILS, message, SendOptions.forUser("user-1"));

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    void send_rejectsWithRoutingNotConfigured_whenRoutingDisabled() {
        store.saveRouting(TaskRouting.builder(TaskType.SUPPORT_EMAILS).primary("p1").enabled(false).build());

        final FailoverResult result = engine.send(TaskType.SUPPORT_EMAILS, message);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.ROUTING_NOT_CONFIGURED);
        verifyNoInteractions(adapters);
    }

    @Test
    void send_rejectsWithRoutingNotConfigured_whenRoutingMissing() {
        final FailoverResult result = engine.send(TaskType.REPORT_EMAILS, message);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.ROUTING_NOT_CONFIGURED);
        assertThat(audited).hasSize(1);
    }

    @Test
    void send_rejectsWithNoProviders_whenChainIsEmpty() {
        store.saveProvider(EmailProvider.builder("p1").active(false).build());
        routing(TaskType.ONBOARDING_EMAILS, 1, 3, "p1", "missing");

        final FailoverResult result = engine.send(TaskType.ONBOARDING_EMAILS, message);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.NO_PROVIDERS_AVAILABLE);
        verifyNoInteractions(adapters);
    }

    // ── Cancellation ──────────────────────────────────────────────────────────

    @Test
    void send_startsNoAttempt_whenAlreadyCancelled() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        final CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message,
                SendOptions.builder().cancellation(signal).build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CANCELLED);
        assertThat(result.getTotalAttempts()).isZero();
        verify(p1, never()).send(any());
    }

    @Test
    void send_stopsBeforeNextAttempt_whenCancelledMidChain() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1", "p2");
        final CancellationSignal signal = new CancellationSignal();
        when(p1.send(message)).thenAnswer(inv -> {
            signal.cancel();
            return failure("p1");
        });

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message,
                SendOptions.builder().cancellation(signal).build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CANCELLED);
        assertThat(result.getTotalAttempts()).isEqualTo(1);
        assertThat(result.getLastAttemptError().getCode()).isEqualTo(ErrorCodes.SENDGRID_ERROR);
        verify(p1, times(1)).send(message);
        verify(p2, never()).send(any());
    }

    @Test
    void send_startsNoAttempt_afterDeadline() {
        routing(TaskType.TRANSACTIONAL_EMAILS, 2, 3, "p1");

        final FailoverResult result = engine.send(TaskType.TRANSACTIONAL_EMAILS, message,
                SendOptions.builder().deadline(Instant.now().minusSeconds(1)).build());

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CANCELLED);
        verify(p1, never()).send(any());
    }

    @Test
    void close_completesWalkWaitingForRetry_withCancelled() {
        store.saveRouting(TaskRouting.builder(TaskType.AUTH_EMAILS)
                .primary("p1")
                .retryAttempts(2)
                .retryDelay(Duration.ofSeconds(5))
                .build());
        when(p1.send(message)).thenReturn(failure("p1"));
        final EmailRoutingEngine owning = new EmailRoutingEngine(
                store, adapters, tracker, new ConsentGate(consent),
                new AuditLogger(List.of(audited::add)), RetryBackoff.fixed(), 2);

        final CompletableFuture<FailoverResult> pending =
                owning.sendWithRouting(TaskType.AUTH_EMAILS, message, SendOptions.none());
        verify(p1, timeout(2000)).send(message);
        owning.close();

        assertThat(pending).isDone();
        final FailoverResult result = pending.join();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CANCELLED);
        assertThat(result.getTotalAttempts()).isEqualTo(1);
        assertThat(audited).extracting(AuditRecord::getErrorCode)
                .containsExactly(ErrorCodes.SENDGRID_ERROR, ErrorCodes.CANCELLED);
        verify(p1, times(1)).send(message);
    }

    @Test
    void sendWithRouting_returnsCancelled_afterClose() {
        routing(TaskType.AUTH_EMAILS, 1, 1, "p1");
        final EmailRoutingEngine owning = new EmailRoutingEngine(
                store, adapters, tracker, new ConsentGate(consent),
                new AuditLogger(List.of(audited::add)), RetryBackoff.fixed(), 1);
        owning.close();

        final FailoverResult result = owning.send(TaskType.AUTH_EMAILS, message);

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.CANCELLED);
        verify(p1, never()).send(any());
    }

    // ── Direct sends and probes ───────────────────────────────────────────────

    @Test
    void sendWithProvider_bypassesRouting() {
        when(p2.send(message)).thenReturn(success("p2", "msg-2"));

        final FailoverResult result = engine.sendWithProvider("p2", message).join();

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotalAttempts()).isEqualTo(1);
        assertThat(store.getProvider("p2").orElseThrow().getTotalSent()).isEqualTo(1);
        assertThat(audited).hasSize(1);
    }

    @Test
    void sendWithProvider_returnsNotFound_forUnknownProvider() {
        final FailoverResult result = engine.sendWithProvider("nope", message).join();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.PROVIDER_NOT_FOUND);
    }

    @Test
    void sendWithProvider_returnsUnavailable_whenProviderCannotSend() {
        when(p1.canSend()).thenReturn(false);

        final FailoverResult result = engine.sendWithProvider("p1", message).join();

        assertThat(result.getErrorCode()).isEqualTo(ErrorCodes.PROVIDER_UNAVAILABLE);
        assertThat(result.getError().getMessage()).isEqualTo("Provider p1 is currently unavailable");
        verify(p1, never()).send(any());
    }

    @Test
    void testProvider_runsProbe() {
        when(p1.test()).thenReturn(ProbeResult.ok());

        assertThat(engine.testProvider("p1").isOk()).isTrue();
        assertThat(engine.testProvider("nope").getError()).contains("not found");
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void stub(final String id, final ProviderAdapter adapter) {
        lenient().when(adapters.adapterFor(argThat(p -> p != null && id.equals(p.getId())))).thenReturn(adapter);
        lenient().when(adapter.canSend()).thenReturn(true);
    }

    private void routing(final TaskType task, final int retries, final int maxAttempts,
                         final String primary, final String... fallbacks) {
        store.saveRouting(TaskRouting.builder(task)
                .primary(primary)
                .fallbacks(fallbacks)
                .retryAttempts(retries)
                .maxSendAttempts(maxAttempts)
                .retryDelay(Duration.ZERO)
                .build());
    }

    private static AttemptResult success(final String providerId, final String messageId) {
        return AttemptResult.builder(providerId, providerId.toUpperCase()).success(messageId).build();
    }

    private static AttemptResult failure(final String providerId) {
        return AttemptResult.builder(providerId, providerId.toUpperCase())
                .failure(new SendError(ErrorCodes.SENDGRID_ERROR, "Service unavailable", "503"))
                .build();
    }
}
