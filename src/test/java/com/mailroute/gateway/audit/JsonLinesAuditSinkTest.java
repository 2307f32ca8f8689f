package com.mailroute.gateway.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailroute.gateway.model.AuditRecord;
import com.mailroute.gateway.model.TaskType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class JsonLinesAuditSinkTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tmp;

    @Test
    void append_writesOneJsonObjectPerLine() throws Exception {
        final JsonLinesAuditSink sink = new JsonLinesAuditSink(tmp.resolve("audit/mail.jsonl"));

        sink.append(AuditRecord.builder(TaskType.AUTH_EMAILS)
                .provider("sg", "SendGrid")
                .success("msg-1")
                .attemptNumber(1)
                .recipientCount(1)
                .emailId("req-1")
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build());
        sink.append(AuditRecord.builder(null)
                .provider("smtp", "Backup")
                .failure("SMTP_ERROR", "Connection refused")
                .attemptNumber(2)
                .build());

        final List<String> lines = Files.readAllLines(sink.getFile());
        assertThat(lines).hasSize(2);

        final JsonNode first = mapper.readTree(lines.get(0));
        assertThat(first.path("taskType").asText()).isEqualTo("AUTH_EMAILS");
        assertThat(first.path("providerId").asText()).isEqualTo("sg");
        assertThat(first.path("success").asBoolean()).isTrue();
        assertThat(first.path("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(first.has("subject")).isFalse();

        final JsonNode second = mapper.readTree(lines.get(1));
        assertThat(second.path("taskType").isNull()).isTrue();
        assertThat(second.path("errorCode").asText()).isEqualTo("SMTP_ERROR");
        assertThat(second.path("attemptNumber").asInt()).isEqualTo(2);
    }

    @Test
    void append_neverInterleavesLines() throws Exception {
        final JsonLinesAuditSink sink = new JsonLinesAuditSink(tmp.resolve("mail.jsonl"));
        final ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            final int n = i;
            pool.submit(() -> sink.append(AuditRecord.builder(TaskType.REPORT_EMAILS)
                    .provider("p" + n, "P" + n)
                    .success("m" + n)
                    .build()));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        final List<String> lines = Files.readAllLines(sink.getFile());
        assertThat(lines).hasSize(200);
        for (final String line : lines) {
            assertThat(mapper.readTree(line).path("success").asBoolean()).isTrue();
        }
    }
}
