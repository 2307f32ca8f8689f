package com.mailroute.gateway.channel;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.AttemptResult;
import com.mailroute.gateway.model.EmailMessage;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ErrorCodes;
import com.mailroute.gateway.model.SmtpEncryption;
import com.mailroute.gateway.security.CredentialCipher;
import org.junit.jupiter.api.*;

import java.net.ServerSocket;

import static org.assertj.core.api.Assertions.*;

class SmtpProviderAdapterTest {

    private final CredentialCipher cipher  = CredentialCipher.ephemeral();
    private final EmailMessage     message = EmailMessage.builder()
            .to("a@example.com")
            .subject("Hello")
            .html("<p>Hello</p>")
            .build();

    @Test
    void send_fails_whenHostMissing() {
        final SmtpProviderAdapter adapter = adapter(EmailProvider.builder("smtp").fromEmail("from@example.com"));

        final AttemptResult result = adapter.send(message);

        assertThat(result.getError().getCode()).isEqualTo(ErrorCodes.SMTP_ERROR);
        assertThat(result.getError().getMessage()).isEqualTo("SMTP host not configured");
    }

    @Test
    void send_returnsSmtpError_whenServerUnreachable() throws Exception {
        final SmtpProviderAdapter adapter = adapter(EmailProvider.builder("smtp")
                .fromEmail("from@example.com")
                .smtpHost("127.0.0.1")
                .smtpPort(closedPort())
                .smtpEncryption(SmtpEncryption.NONE));

        final AttemptResult result = adapter.send(message);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError().getCode()).isEqualTo(ErrorCodes.SMTP_ERROR);
        assertThat(result.getProviderId()).isEqualTo("smtp");
    }

    @Test
    void send_returnsSendError_whenPasswordCannotBeDecrypted() {
        final SmtpProviderAdapter adapter = adapter(EmailProvider.builder("smtp")
                .fromEmail("from@example.com")
                .smtpHost("127.0.0.1")
                .smtpUsername("user")
                .smtpPasswordEncrypted("garbage"));

        final AttemptResult result = adapter.send(message);

        assertThat(result.getError().getCode()).isEqualTo(ErrorCodes.SEND_ERROR);
        assertThat(result.getError().getMessage()).startsWith("Credentials unavailable");
    }

    @Test
    void send_rejectsTooManyRecipients() {
        final EmailMessage.Builder b = EmailMessage.builder().subject("x");
        for (int i = 0; i < 101; i++) {
            b.to("user" + i + "@example.com");
        }
        final SmtpProviderAdapter adapter = adapter(EmailProvider.builder("smtp").smtpHost("127.0.0.1"));

        assertThat(adapter.send(b.build()).getError().getMessage()).contains("Too many recipients");
    }

    @Test
    void test_fails_whenServerUnreachable() throws Exception {
        final SmtpProviderAdapter adapter = adapter(EmailProvider.builder("smtp")
                .smtpHost("127.0.0.1")
                .smtpPort(closedPort())
                .smtpEncryption(SmtpEncryption.NONE));

        assertThat(adapter.test().isOk()).isFalse();
        assertThat(adapter.test().getError()).startsWith("SMTP test failed");
    }

    private SmtpProviderAdapter adapter(final EmailProvider.Builder provider) {
        return new SmtpProviderAdapter(provider.build(), cipher, new ProviderHealthTracker(null));
    }

    private static int closedPort() throws Exception {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
