package com.mailroute.gateway;

import com.mailroute.gateway.audit.AuditLogger;
import com.mailroute.gateway.audit.AuditSink;
import com.mailroute.gateway.audit.JsonLinesAuditSink;
import com.mailroute.gateway.audit.Slf4jAuditSink;
import com.mailroute.gateway.channel.ProviderAdapterFactory;
import com.mailroute.gateway.config.GatewayConfig;
import com.mailroute.gateway.config.ProviderConfigLoader;
import com.mailroute.gateway.consumer.EmailRequestConsumer;
import com.mailroute.gateway.health.HealthServer;
import com.mailroute.gateway.health.ProviderHealthTracker;
import com.mailroute.gateway.retry.RetryBackoff;
import com.mailroute.gateway.routing.ConsentGate;
import com.mailroute.gateway.routing.EmailRoutingEngine;
import com.mailroute.gateway.security.CredentialCipher;
import com.mailroute.gateway.store.InMemoryConsentStore;
import com.mailroute.gateway.store.InMemoryProviderStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Mail Routing Gateway, main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration and the credential key</li>
 *   <li>Load providers, routing rows and consent entries (fail fast if no
 *       provider is configured)</li>
 *   <li>Build the tracker, adapters, audit sinks and routing engine</li>
 *   <li>Start the health check HTTP server</li>
 *   <li>Start the Kafka consumer loop on a dedicated thread</li>
 *   <li>Register a JVM shutdown hook for graceful drain</li>
 * </ol>
 */
public class MailRoutingGatewayApp {

    private static final Logger LOG = LoggerFactory.getLogger(MailRoutingGatewayApp.class);

    public static void main(final String[] args) throws Exception {
        LOG.info("=================================================");
        LOG.info("  Mail Routing Gateway  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration ──────────────────────────────────────────────────
        final GatewayConfig config = GatewayConfig.load();
        LOG.info("Configuration loaded. Bootstrap: {}, Topics: {}",
                config.getBootstrapServers(), config.getTopics());
        final CredentialCipher cipher = CredentialCipher.fromBase64Key(config.getCredentialKey());

        // ── 2. Providers, routing, consent ────────────────────────────────────
        final InMemoryProviderStore providers = new InMemoryProviderStore();
        final InMemoryConsentStore  consent   = new InMemoryConsentStore();
        ProviderConfigLoader.load(config, cipher, providers, consent);

        if (providers.listProviders().isEmpty()) {
            LOG.error("No mail providers are configured, refusing to start. "
                    + "Declare at least one entry under mail.providers.");
            System.exit(1);
        }

        // ── 3. Core services ──────────────────────────────────────────────────
        final ProviderHealthTracker  tracker  = new ProviderHealthTracker(providers);
        final ProviderAdapterFactory adapters = new ProviderAdapterFactory(cipher, tracker);
        final AuditLogger            audit    = new AuditLogger(buildAuditSinks(config));
        final EmailRoutingEngine     engine   = new EmailRoutingEngine(
                providers, adapters, tracker, new ConsentGate(consent), audit,
                new RetryBackoff(config), config.getSendThreads());
        final EmailRequestConsumer   consumer = EmailRequestConsumer.create(config, engine);

        // ── 4. Health server ──────────────────────────────────────────────────
        final HealthServer health = new HealthServer(config.getHealthPort(), providers, tracker);
        health.start();

        // ── 5. Consumer thread ────────────────────────────────────────────────
        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "mail-request-consumer");
            t.setDaemon(false);
            return t;
        });
        final CountDownLatch shutdownLatch = new CountDownLatch(1);

        executor.submit(() -> {
            try {
                health.markReady();
                consumer.run();
            } finally {
                health.markNotReady();
                shutdownLatch.countDown();
            }
        });

        // ── 6. Shutdown hook ──────────────────────────────────────────────────
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, starting graceful shutdown...");
            health.markNotReady();
            consumer.shutdown();
            executor.shutdown();
            try {
                if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Consumer thread did not terminate in 30s, forcing shutdown");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
            engine.close();
            adapters.close();
            health.stop();
            LOG.info("Mail Routing Gateway shut down cleanly.");
        }, "shutdown-hook"));

        LOG.info("Mail Routing Gateway is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }

    static List<AuditSink> buildAuditSinks(final GatewayConfig config) {
        final String type = config.getAuditSink();
        final List<AuditSink> sinks = new ArrayList<>();
        switch (type.toLowerCase()) {
            case "log" -> sinks.add(new Slf4jAuditSink());
            case "file" -> sinks.add(new JsonLinesAuditSink(Path.of(config.getAuditFile())));
            case "both" -> {
                sinks.add(new Slf4jAuditSink());
                sinks.add(new JsonLinesAuditSink(Path.of(config.getAuditFile())));
            }
            default -> throw new IllegalArgumentException("Unknown audit sink: " + type);
        }
        LOG.info("Audit sinks: {}", type);
        return sinks;
    }
}
