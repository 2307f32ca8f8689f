package com.mailroute.gateway.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mailroute.gateway.model.AuditRecord;

/** One-line JSON rendering of an {@link AuditRecord}. */
final class AuditRecordJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AuditRecordJson() {}

    static String toJson(final AuditRecord r) {
        final ObjectNode row = MAPPER.createObjectNode();
        row.put("timestamp",      r.getTimestamp().toString());
        row.put("taskType",       r.getTaskType() != null ? r.getTaskType().name() : null);
        row.put("providerId",     r.getProviderId());
        row.put("providerName",   r.getProviderName());
        row.put("success",        r.isSuccess());
        row.put("messageId",      r.getMessageId());
        row.put("errorCode",      r.getErrorCode());
        row.put("errorMessage",   r.getErrorMessage());
        row.put("attemptNumber",  r.getAttemptNumber());
        row.put("recipientCount", r.getRecipientCount());
        row.put("emailId",        r.getEmailId());
        row.put("userId",         r.getUserId());
        try {
            return MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize audit record", e);
        }
    }
}
