package com.mailroute.gateway.security;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LogSanitizerTest {

    @Test
    void sanitize_masksSecretShapedValues() {
        final String out = LogSanitizer.sanitize("login failed password=hunter2 token: abc123&x=1 Secret=s3");

        assertThat(out)
                .doesNotContain("hunter2", "abc123", "s3")
                .contains("password=***", "token=***", "secret=***", "&x=1");
    }

    @Test
    void sanitize_leavesOrdinaryTextAlone() {
        assertThat(LogSanitizer.sanitize("Mailbox unavailable")).isEqualTo("Mailbox unavailable");
        assertThat(LogSanitizer.sanitize(null)).isNull();
    }

    @Test
    void forAudit_truncatesTo200Characters() {
        assertThat(LogSanitizer.forAudit("e".repeat(500))).hasSize(LogSanitizer.MAX_ERROR_LENGTH);
        assertThat(LogSanitizer.forAudit("short")).isEqualTo("short");
    }

    @Test
    void maskEmail_keepsDomainOnly() {
        assertThat(LogSanitizer.maskEmail("jane.doe@example.com")).isEqualTo("jan***@example.com");
        assertThat(LogSanitizer.maskEmail("j@example.com")).isEqualTo("***");
        assertThat(LogSanitizer.maskEmail(null)).isEqualTo("null");
    }

    @Test
    void maskEmails_summarisesLists() {
        assertThat(LogSanitizer.maskEmails(List.of("alice@example.com", "bob@example.com", "carol@example.com")))
                .isEqualTo("ali***@example.com (+2)");
        assertThat(LogSanitizer.maskEmails(List.of())).isEqualTo("[]");
    }
}
