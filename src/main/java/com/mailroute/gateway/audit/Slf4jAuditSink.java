package com.mailroute.gateway.audit;

import com.mailroute.gateway.model.AuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each record as a JSON line to the {@code AUDIT} logger. Routing of
 * that logger (own file, retention) is left to {@code logback.xml}.
 */
public class Slf4jAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "AUDIT";

    private static final Logger AUDIT = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void append(final AuditRecord record) {
        AUDIT.info(AuditRecordJson.toJson(record));
    }
}
