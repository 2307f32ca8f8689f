package com.mailroute.gateway.channel;

import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ProviderType;
import com.mailroute.gateway.security.CredentialCipher;
import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class ProviderAdapterFactoryTest {

    private ProviderAdapterFactory factory;

    @BeforeEach
    void setup() {
        factory = new ProviderAdapterFactory(CredentialCipher.ephemeral(), new ProviderHealthTracker(null));
    }

    @AfterEach
    void teardown() {
        factory.close();
    }

    @Test
    void create_picksDedicatedAdapter_perApiType() {
        assertThat(factory.create(provider("a", ProviderType.SENDGRID))).isInstanceOf(SendGridProviderAdapter.class);
        assertThat(factory.create(provider("b", ProviderType.POSTMARK))).isInstanceOf(PostmarkProviderAdapter.class);
        assertThat(factory.create(provider("c", ProviderType.SES))).isInstanceOf(SesProviderAdapter.class);
        assertThat(factory.create(provider("d", ProviderType.PABBLY_WEBHOOK))).isInstanceOf(WebhookProviderAdapter.class);
    }

    @Test
    void create_fallsBackToSmtp_forOtherTypes() {
        assertThat(factory.create(provider("a", ProviderType.GMAIL))).isInstanceOf(SmtpProviderAdapter.class);
        assertThat(factory.create(provider("b", ProviderType.MAILGUN))).isInstanceOf(SmtpProviderAdapter.class);
        assertThat(factory.create(provider("c", ProviderType.CUSTOM_SMTP))).isInstanceOf(SmtpProviderAdapter.class);
    }

    @Test
    void adapterFor_reusesCachedAdapter_whenOnlyCountersChange() {
        final EmailProvider p = provider("a", ProviderType.SENDGRID);
        final ProviderAdapter first = factory.adapterFor(p);

        final ProviderAdapter second = factory.adapterFor(p.toBuilder().totalSent(42).consecutiveFailures(3).build());

        assertThat(second).isSameAs(first);
    }

    @Test
    void adapterFor_rebuilds_whenConfigurationChanges() {
        final EmailProvider p = provider("a", ProviderType.SENDGRID);
        final ProviderAdapter first = factory.adapterFor(p);

        final ProviderAdapter second = factory.adapterFor(p.toBuilder().fromEmail("other@example.com").build());
        final ProviderAdapter third  = factory.adapterFor(p.toBuilder().fromEmail("other@example.com").maxPerHour(5).build());

        assertThat(second).isNotSameAs(first);
        assertThat(second.provider().getFromEmail()).isEqualTo("other@example.com");
        assertThat(third).isNotSameAs(second);
    }

    @Test
    void evict_dropsCachedAdapter() {
        final EmailProvider p = provider("a", ProviderType.POSTMARK);
        final ProviderAdapter first = factory.adapterFor(p);

        factory.evict("a");

        assertThat(factory.adapterFor(p)).isNotSameAs(first);
    }

    private static EmailProvider provider(final String id, final ProviderType type) {
        return EmailProvider.builder(id).providerType(type).fromEmail("noreply@example.com").build();
    }
}
