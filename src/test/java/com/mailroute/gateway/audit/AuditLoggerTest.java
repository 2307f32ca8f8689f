package com.mailroute.gateway.audit;

import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.AuditRecord;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.FailoverResult;
import com.mailroute.gateway.model.SendOptions;
import com.mailroute.gateway.model.TaskType;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AuditLoggerTest {

    private final List<AuditRecord> recorded = new ArrayList<>();

    private final SendOptions options = SendOptions.builder().userId("u1").emailId("req-1").build();

    @Test
    void logAttempt_recordsSuccess() {
        final Instant at = Instant.parse("2024-05-01T10:00:00Z");
        final AuditLogger audit = new AuditLogger(List.of(recorded::add));

        audit.logAttempt(TaskType.AUTH_EMAILS,
                AttemptResult.builder("sg", "SendGrid").success("msg-1").attemptNumber(2).timestamp(at).build(),
                3, options);

        assertThat(recorded).hasSize(1);
        final AuditRecord r = recorded.get(0);
        assertThat(r.isSuccess()).isTrue();
        assertThat(r.getProviderId()).isEqualTo("sg");
        assertThat(r.getMessageId()).isEqualTo("msg-1");
        assertThat(r.getAttemptNumber()).isEqualTo(2);
        assertThat(r.getRecipientCount()).isEqualTo(3);
        assertThat(r.getEmailId()).isEqualTo("req-1");
        assertThat(r.getUserId()).isEqualTo("u1");
        assertThat(r.getTimestamp()).isEqualTo(at);
    }

    @Test
    void logAttempt_sanitisesFailureMessage() {
        final AuditLogger audit = new AuditLogger(List.of(recorded::add));

        audit.logAttempt(TaskType.BILLING_EMAILS,
                AttemptResult.builder("smtp", "Backup")
                        .failure(ErrorCodes.SMTP_ERROR, "535 auth rejected password=hunter2 " + "z".repeat(300), "535")
                        .attemptNumber(1)
                        .build(),
                1, options);

        final AuditRecord r = recorded.get(0);
        assertThat(r.isSuccess()).isFalse();
        assertThat(r.getErrorCode()).isEqualTo(ErrorCodes.SMTP_ERROR);
        assertThat(r.getErrorMessage()).doesNotContain("hunter2").hasSize(200);
    }

    @Test
    void logRejection_hasNoProvider() {
        final AuditLogger audit = new AuditLogger(List.of(recorded::add));

        audit.logRejection(TaskType.MARKETING_EMAILS, ErrorCodes.CONSENT_REQUIRED,
                "User has not consented to marketing emails", 1, options);

        final AuditRecord r = recorded.get(0);
        assertThat(r.getProviderId()).isEqualTo(FailoverResult.NO_PROVIDER);
        assertThat(r.getAttemptNumber()).isZero();
        assertThat(r.getErrorCode()).isEqualTo(ErrorCodes.CONSENT_REQUIRED);
    }

    @Test
    void append_continuesPastFailingSink() {
        final AuditSink broken = record -> { throw new IllegalStateException("disk full"); };
        final AuditLogger audit = new AuditLogger(List.of(broken, recorded::add));

        assertThatCode(() -> audit.logRejection(TaskType.AUTH_EMAILS, ErrorCodes.ROUTING_NOT_CONFIGURED,
                "No routing configured for task type: AUTH_EMAILS", 1, SendOptions.none()))
                .doesNotThrowAnyException();
        assertThat(recorded).hasSize(1);
    }
}
