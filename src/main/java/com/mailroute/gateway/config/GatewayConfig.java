package com.mailroute.gateway.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;

/**
 * Typed configuration for the Mail Routing Gateway, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>Provider credentials and the credential key are read from environment
 * variables via Typesafe Config substitution (e.g.
 * {@code ${?SENDGRID_API_KEY}}). This class never logs secret values.
 */
public final class GatewayConfig {

    private final Config raw;

    private GatewayConfig(final Config config) {
        this.raw = config;
    }

    public static GatewayConfig load() {
        return new GatewayConfig(ConfigFactory.load().resolve());
    }

    /** Wrap an already built config; missing keys fall back to the packaged defaults. */
    public static GatewayConfig from(final Config config) {
        return new GatewayConfig(config.withFallback(ConfigFactory.load()).resolve());
    }

    public Config raw() {
        return raw;
    }

    // ── Kafka ─────────────────────────────────────────────────────────────────

    public String getBootstrapServers() {
        return raw.getString("kafka.bootstrap-servers");
    }

    public String getConsumerGroupId() {
        return raw.getString("kafka.consumer.group-id");
    }

    public String getAutoOffsetReset() {
        return raw.getString("kafka.consumer.auto-offset-reset");
    }

    public int getMaxPollRecords() {
        return raw.getInt("kafka.consumer.max-poll-records");
    }

    public int getSessionTimeoutMs() {
        return raw.getInt("kafka.consumer.session-timeout-ms");
    }

    public int getHeartbeatIntervalMs() {
        return raw.getInt("kafka.consumer.heartbeat-interval-ms");
    }

    public List<String> getTopics() {
        return raw.getStringList("kafka.topics");
    }

    // ── Mail ──────────────────────────────────────────────────────────────────

    public List<? extends Config> getProviders() {
        return raw.getConfigList("mail.providers");
    }

    public List<? extends Config> getRoutings() {
        return raw.getConfigList("mail.routing");
    }

    public List<? extends Config> getConsentSeeds() {
        return raw.hasPath("mail.consent") ? raw.getConfigList("mail.consent") : List.of();
    }

    // ── Engine ────────────────────────────────────────────────────────────────

    public int getSendThreads() {
        return raw.getInt("engine.send-threads");
    }

    public double getBackoffFactor() {
        return raw.getDouble("engine.backoff-factor");
    }

    public long getBackoffMaxDelayMs() {
        return raw.getLong("engine.max-delay-ms");
    }

    public double getBackoffJitterRatio() {
        return raw.getDouble("engine.jitter-ratio");
    }

    /** Per-request deadline applied by the Kafka ingress; 0 disables it. */
    public long getRequestTimeoutMs() {
        return raw.getLong("engine.request-timeout-ms");
    }

    // ── Exhaustion handling ───────────────────────────────────────────────────

    public String getRetryOnExhausted() {
        return raw.getString("retry.on-exhausted");
    }

    public String getDlqTopic() {
        return raw.getString("retry.dlq-topic");
    }

    // ── Audit ─────────────────────────────────────────────────────────────────

    /** {@code log}, {@code file} or {@code both}. */
    public String getAuditSink() {
        return raw.getString("audit.sink");
    }

    public String getAuditFile() {
        return raw.getString("audit.file");
    }

    // ── Security ──────────────────────────────────────────────────────────────

    /** Base64 AES-256 key; blank when {@code MAIL_CREDENTIAL_KEY} is unset. */
    public String getCredentialKey() {
        return raw.getString("security.credential-key");
    }

    // ── Health ────────────────────────────────────────────────────────────────

    public int getHealthPort() {
        return raw.getInt("health.port");
    }
}
