package com.mailroute.gateway.audit;

import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.AuditRecord;
import com.mailroute.gateway.model.SendOptions;
import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.security.LogSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Builds audit records for attempts and rejections and hands them to every
 * configured {@link AuditSink}.
 *
 * <p>Appends are synchronous: when a method returns, every sink has either
 * stored the record or failed. A failing sink is logged at ERROR and never
 * stops delivery or the remaining sinks.
 */
public class AuditLogger {

    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final List<AuditSink> sinks;

    public AuditLogger(final List<AuditSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    /** One record for one provider attempt. */
    public void logAttempt(
            final TaskType taskType,
            final AttemptResult attempt,
            final int recipientCount,
            final SendOptions options) {
        final AuditRecord.Builder b = AuditRecord.builder(taskType)
                .provider(attempt.getProviderId(), attempt.getProviderName())
                .attemptNumber(attempt.getAttemptNumber())
                .recipientCount(recipientCount)
                .emailId(options.getEmailId())
                .userId(options.getUserId())
                .timestamp(attempt.getTimestamp());
        if (attempt.isSuccess()) {
            b.success(attempt.getMessageId());
        } else {
            b.failure(attempt.getError().getCode(), LogSanitizer.forAudit(attempt.getError().getMessage()));
        }
        append(b.build());
    }

    /** One record for a request stopped before any provider was called. */
    public void logRejection(
            final TaskType taskType,
            final String errorCode,
            final String errorMessage,
            final int recipientCount,
            final SendOptions options) {
        append(AuditRecord.builder(taskType)
                .failure(errorCode, LogSanitizer.forAudit(errorMessage))
                .recipientCount(recipientCount)
                .emailId(options.getEmailId())
                .userId(options.getUserId())
                .build());
    }

    public void append(final AuditRecord record) {
        for (final AuditSink sink : sinks) {
            try {
                sink.append(record);
            } catch (RuntimeException e) {
                LOG.error("Audit sink {} failed for {}: {}",
                        sink.getClass().getSimpleName(), record, e.getMessage());
            }
        }
    }
}
