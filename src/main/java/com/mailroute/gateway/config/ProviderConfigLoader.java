package com.mailroute.gateway.config;

import com.mailroute.gateway.model.ConnectionType;
import com.mailroute.gateway.model.EmailProvider;
import com.mailroute.gateway.model.ProviderRole;
import com.mailroute.gateway.model.ProviderType;
import com.mailroute.gateway.model.SmtpEncryption;
import com.mailroute.gateway.model.TaskRouting;
import com.mailroute.gateway.model.TaskType;
import com.mailroute.gateway.security.CredentialCipher;
import com.mailroute.gateway.store.ConsentStatus;
import com.mailroute.gateway.store.InMemoryConsentStore;
import com.mailroute.gateway.store.InMemoryProviderStore;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;

/**
 * Turns the {@code mail.*} sections of the application config into provider
 * records, routing rows and consent entries.
 *
 * <p>Plain-text credentials ({@code smtp-password}, {@code api-key},
 * {@code api-secret}) are encrypted with the {@link CredentialCipher} as they
 * are read, so decrypted secrets never sit in a provider record. Values under
 * the {@code *-encrypted} keys are taken as already encrypted.
 *
 * <p>A provider without a {@code type} is classified from its sender domain
 * and SMTP host; connection details left blank are filled from the type's
 * preset. Invalid enum names fail startup with {@link IllegalArgumentException}.
 */
public final class ProviderConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderConfigLoader.class);

    private ProviderConfigLoader() {}

    /** Load providers, routings and consent seeds into the given stores. */
    public static void load(
            final GatewayConfig config,
            final CredentialCipher cipher,
            final InMemoryProviderStore providers,
            final InMemoryConsentStore consent) {
        for (final Config cfg : config.getProviders()) {
            final EmailProvider provider = parseProvider(cfg, cipher);
            providers.saveProvider(provider);
            LOG.info("Provider loaded: id={} type={} connection={} active={}",
                    provider.getId(), provider.getProviderType().tag(),
                    provider.getConnectionType(), provider.isActive());
        }
        for (final Config cfg : config.getRoutings()) {
            final TaskRouting routing = parseRouting(cfg);
            providers.saveRouting(routing);
            LOG.info("Routing loaded: {}", routing);
        }
        for (final Config cfg : config.getConsentSeeds()) {
            seedConsent(cfg, consent);
        }
        if (consent.size() > 0) {
            LOG.info("Consent entries loaded: {}", consent.size());
        }
    }

    public static EmailProvider parseProvider(final Config cfg, final CredentialCipher cipher) {
        final String id        = cfg.getString("id");
        final String fromEmail = cfgStrOpt(cfg, "from-email");
        final String smtpHost  = cfgStrOpt(cfg, "smtp-host");

        final ProviderType type = cfg.hasPath("type")
                ? ProviderType.fromTag(cfg.getString("type"))
                : ProviderType.detect(fromEmail, smtpHost);

        final EmailProvider.Builder b = EmailProvider.builder(id)
                .providerType(type)
                .providerName(cfgStrOpt(cfg, "name"))
                .fromName(cfgStrOpt(cfg, "from-name"))
                .fromEmail(fromEmail)
                .replyToEmail(cfgStrOpt(cfg, "reply-to"))
                .smtpHost(smtpHost != null ? smtpHost : type.getPresetSmtpHost())
                .smtpPort(cfg.hasPath("smtp-port") ? cfg.getInt("smtp-port") : type.getPresetSmtpPort())
                .smtpUsername(cfgStrOpt(cfg, "smtp-username"))
                .smtpPasswordEncrypted(secret(cfg, "smtp-password", cipher))
                .apiEndpoint(orElse(cfgStrOpt(cfg, "api-endpoint"), type.getPresetApiEndpoint()))
                .apiKeyEncrypted(secret(cfg, "api-key", cipher))
                .apiSecretEncrypted(secret(cfg, "api-secret", cipher))
                .apiRegion(cfgStrOpt(cfg, "api-region"))
                .active(!cfg.hasPath("active") || cfg.getBoolean("active"))
                .verified(cfg.hasPath("verified") && cfg.getBoolean("verified"))
                .priorityOrder(cfg.hasPath("priority") ? cfg.getInt("priority") : 1)
                .maxPerHour(cfg.hasPath("max-per-hour") ? cfg.getInt("max-per-hour") : 0)
                .maxPerDay(cfg.hasPath("max-per-day") ? cfg.getInt("max-per-day") : 0);

        if (cfg.hasPath("connection")) {
            b.connectionType(enumValue(ConnectionType.class, cfg.getString("connection")));
        }
        if (cfg.hasPath("smtp-encryption")) {
            b.smtpEncryption(enumValue(SmtpEncryption.class, cfg.getString("smtp-encryption")));
        }
        if (cfg.hasPath("role")) {
            b.role(enumValue(ProviderRole.class, cfg.getString("role")));
        }
        return b.build();
    }

    public static TaskRouting parseRouting(final Config cfg) {
        final TaskRouting.Builder b = TaskRouting.builder(enumValue(TaskType.class, cfg.getString("task")))
                .primary(cfgStrOpt(cfg, "primary"))
                .forceProvider(cfgStrOpt(cfg, "force-provider"))
                .enabled(!cfg.hasPath("enabled") || cfg.getBoolean("enabled"))
                .description(cfgStrOpt(cfg, "description"));
        if (cfg.hasPath("fallbacks")) {
            b.fallbacks(cfg.getStringList("fallbacks"));
        }
        if (cfg.hasPath("retry-attempts")) {
            b.retryAttempts(cfg.getInt("retry-attempts"));
        }
        if (cfg.hasPath("retry-delay")) {
            b.retryDelay(cfg.getDuration("retry-delay"));
        }
        if (cfg.hasPath("max-send-attempts")) {
            b.maxSendAttempts(cfg.getInt("max-send-attempts"));
        }
        return b.build();
    }

    /**
     * A consent entry: {@code user}, {@code status} and either a list of
     * {@code tasks} or none, meaning every category.
     */
    static void seedConsent(final Config cfg, final InMemoryConsentStore consent) {
        final String user = cfg.getString("user");
        final ConsentStatus status = enumValue(ConsentStatus.class, cfg.getString("status"));
        if (!cfg.hasPath("tasks")) {
            consent.recordAll(user, status);
            return;
        }
        for (final String task : cfg.getStringList("tasks")) {
            consent.record(user, enumValue(TaskType.class, task), status);
        }
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    /** Encrypted form of {@code key}: plain values are encrypted, {@code key-encrypted} is kept. */
    private static String secret(final Config cfg, final String key, final CredentialCipher cipher) {
        final String plain = cfgStrOpt(cfg, key);
        if (plain != null) {
            return cipher.encrypt(plain);
        }
        return cfgStrOpt(cfg, key + "-encrypted");
    }

    private static <E extends Enum<E>> E enumValue(final Class<E> type, final String raw) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown " + type.getSimpleName() + " '" + raw + "'; expected one of " + List.of(type.getEnumConstants()), e);
        }
    }

    private static String orElse(final String value, final String fallback) {
        return value != null ? value : fallback;
    }

    /** Blank values count as absent so that unset {@code ${?ENV}} substitutions are ignored. */
    private static String cfgStrOpt(final Config cfg, final String key) {
        if (!cfg.hasPath(key)) return null;
        final String v = cfg.getString(key);
        return v.isBlank() ? null : v;
    }
}
