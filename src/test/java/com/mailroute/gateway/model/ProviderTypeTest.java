package com.mailroute.gateway.model;

import org.junit.jupiter.api.*;

import static org.assertj.core.api.Assertions.*;

class ProviderTypeTest {

    @Test
    void fromTag_isCaseAndDashInsensitive() {
        assertThat(ProviderType.fromTag("sendgrid")).isEqualTo(ProviderType.SENDGRID);
        assertThat(ProviderType.fromTag("Pabbly-Webhook")).isEqualTo(ProviderType.PABBLY_WEBHOOK);
        assertThat(ProviderType.fromTag("custom_smtp")).isEqualTo(ProviderType.CUSTOM_SMTP);
    }

    @Test
    void fromTag_defaultsToCustomSmtp() {
        assertThat(ProviderType.fromTag(null)).isEqualTo(ProviderType.CUSTOM_SMTP);
        assertThat(ProviderType.fromTag("carrier-pigeon")).isEqualTo(ProviderType.CUSTOM_SMTP);
    }

    @Test
    void detect_usesSenderDomainFirst() {
        assertThat(ProviderType.detect("someone@gmail.com", null)).isEqualTo(ProviderType.GMAIL);
        assertThat(ProviderType.detect("someone@hotmail.com", null)).isEqualTo(ProviderType.OUTLOOK);
        assertThat(ProviderType.detect("someone@pm.me", null)).isEqualTo(ProviderType.PROTONMAIL);
    }

    @Test
    void detect_fallsBackToSmtpHost() {
        assertThat(ProviderType.detect("ops@example.com", "email-smtp.eu-west-1.amazonaws.com"))
                .isEqualTo(ProviderType.SES);
        assertThat(ProviderType.detect("ops@example.com", "smtp.sendgrid.net")).isEqualTo(ProviderType.SENDGRID);
        assertThat(ProviderType.detect("ops@example.com", "mail.example.com")).isEqualTo(ProviderType.CUSTOM_SMTP);
    }

    @Test
    void presets_matchKnownVendors() {
        assertThat(ProviderType.GMAIL.getPresetSmtpHost()).isEqualTo("smtp.gmail.com");
        assertThat(ProviderType.POSTMARK.getPresetApiEndpoint()).isEqualTo("https://api.postmarkapp.com/email");
        assertThat(ProviderType.PABBLY_WEBHOOK.getDefaultConnection()).isEqualTo(ConnectionType.WEBHOOK);
        assertThat(ProviderType.SMTP2GO.tag()).isEqualTo("smtp2go");
    }
}
