package com.mailroute.gateway.audit;

import com.mailroute.gateway.model.AuditRecord;

/**
 * Destination for audit records. Implementations append only and must be
 * thread-safe. A failure is reported by throwing an unchecked exception;
 * {@link AuditLogger} logs it and carries on.
 */
public interface AuditSink {

    void append(AuditRecord record);
}
