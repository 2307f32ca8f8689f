package com.mailroute.gateway.consumer;

import com.mailroute.gateway.config.GatewayConfig;
import com.mailroute.gateway.model.FailoverResult;
import com.mailroute.gateway.routing.EmailRoutingEngine;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Kafka ingress for the routing engine.
 *
 * <p>Polls {@link EmailSendRequest} JSON records, hands every record of a
 * batch to {@link EmailRoutingEngine#sendWithRouting} so they are routed
 * concurrently, and waits for the whole batch before committing.
 *
 * <h2>Offset management</h2>
 * Offsets are committed <em>after</em> every result of the batch is known
 * (at-least-once delivery). A crash between send and commit re-delivers the
 * batch; the providers see the message again.
 *
 * <h2>Error handling</h2>
 * <ul>
 *   <li>Malformed request: logged and treated as a terminal failure with
 *       code {@code INVALID_REQUEST}.</li>
 *   <li>Terminal failure: with {@code retry.on-exhausted=kafka} the original
 *       record is published to the DLQ topic with {@code x-failure-code} and
 *       {@code x-source-topic} headers; with {@code log} it is logged.</li>
 *   <li>{@link WakeupException}: clean shutdown signal from {@link #shutdown()}.</li>
 * </ul>
 */
public class EmailRequestConsumer implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EmailRequestConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    static final String INVALID_REQUEST       = "INVALID_REQUEST";
    static final String HEADER_FAILURE_CODE   = "x-failure-code";
    static final String HEADER_FAILURE_REASON = "x-failure-reason";
    static final String HEADER_SOURCE_TOPIC   = "x-source-topic";

    private final Consumer<String, String> consumer;
    private final Producer<String, String> dlqProducer;     // null unless on-exhausted=kafka
    private final EmailRoutingEngine       engine;
    private final List<String>             topics;
    private final String                   onExhausted;
    private final String                   dlqTopic;
    private final Duration                 requestTimeout;
    private final Clock                    clock;
    private final AtomicBoolean            running = new AtomicBoolean(false);

    private long totalReceived  = 0L;
    private long totalDelivered = 0L;
    private long totalFailed    = 0L;

    public EmailRequestConsumer(
            final Consumer<String, String> consumer,
            final Producer<String, String> dlqProducer,
            final EmailRoutingEngine engine,
            final List<String> topics,
            final String onExhausted,
            final String dlqTopic,
            final Duration requestTimeout,
            final Clock clock) {
        this.consumer       = consumer;
        this.dlqProducer    = dlqProducer;
        this.engine         = engine;
        this.topics         = List.copyOf(topics);
        this.onExhausted    = onExhausted;
        this.dlqTopic       = dlqTopic;
        this.requestTimeout = requestTimeout;
        this.clock          = clock;
    }

    /** Consumer (and DLQ producer when configured) built from the {@code kafka} and {@code retry} sections. */
    public static EmailRequestConsumer create(final GatewayConfig config, final EmailRoutingEngine engine) {
        final boolean dlq = "kafka".equalsIgnoreCase(config.getRetryOnExhausted());
        return new EmailRequestConsumer(
                new KafkaConsumer<>(consumerProperties(config)),
                dlq ? new KafkaProducer<>(producerProperties(config)) : null,
                engine,
                config.getTopics(),
                config.getRetryOnExhausted(),
                config.getDlqTopic(),
                Duration.ofMillis(config.getRequestTimeoutMs()),
                Clock.systemUTC());
    }

    @Override
    public void run() {
        running.set(true);
        consumer.subscribe(topics);
        LOG.info("Mail request consumer started, subscribed to {} topics: {}", topics.size(), topics);

        try {
            while (running.get()) {
                final ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                if (records.isEmpty()) continue;

                processBatch(records);

                // Commit after the whole batch has a result (at-least-once)
                consumer.commitSync();
            }
        } catch (WakeupException e) {
            if (running.get()) {
                LOG.error("Unexpected WakeupException while still running", e);
            } else {
                LOG.debug("Consumer woken up for shutdown");
            }
        } catch (Exception e) {
            LOG.error("Fatal error in consumer loop", e);
        } finally {
            consumer.close();
            if (dlqProducer != null) {
                dlqProducer.close();
            }
            LOG.info("Consumer closed. Stats: received={} delivered={} failed={}",
                    totalReceived, totalDelivered, totalFailed);
        }
    }

    /** Signal the consumer loop to stop on the next poll boundary. */
    public void shutdown() {
        running.set(false);
        consumer.wakeup();
        LOG.info("Shutdown signal sent to mail request consumer");
    }

    @Override
    public void close() {
        shutdown();
    }

    public long getTotalReceived()  { return totalReceived; }
    public long getTotalDelivered() { return totalDelivered; }
    public long getTotalFailed()    { return totalFailed; }

    // ── Private ───────────────────────────────────────────────────────────────

    private void processBatch(final ConsumerRecords<String, String> records) {
        final List<ConsumerRecord<String, String>>         accepted = new ArrayList<>();
        final List<CompletableFuture<FailoverResult>>      pending  = new ArrayList<>();

        for (final ConsumerRecord<String, String> record : records) {
            totalReceived++;
            try {
                final EmailSendRequest request = EmailSendRequest.fromJson(record.value());
                LOG.info("Processing: requestId={} task={} topic={} partition={} offset={}",
                        request.getRequestId(), request.getTaskType(),
                        record.topic(), record.partition(), record.offset());
                pending.add(engine.sendWithRouting(
                        request.getTaskType(), request.toMessage(), request.toOptions(defaultDeadline())));
                accepted.add(record);
            } catch (IllegalArgumentException e) {
                LOG.error("Malformed mail request, skipping. topic={} partition={} offset={} error={}",
                        record.topic(), record.partition(), record.offset(), e.getMessage());
                totalFailed++;
                handleTerminalFailure(record, INVALID_REQUEST, e.getMessage());
            }
        }

        for (int i = 0; i < pending.size(); i++) {
            final ConsumerRecord<String, String> record = accepted.get(i);
            final FailoverResult result = pending.get(i).join();
            if (result.isSuccess()) {
                totalDelivered++;
                LOG.info("Delivered: offset={} provider={} attempts={} failover={} msgId={}",
                        record.offset(), result.getProviderId(), result.getTotalAttempts(),
                        result.isFailoverOccurred(), result.getMessageId());
            } else {
                totalFailed++;
                handleTerminalFailure(record, result.getErrorCode(), result.getError().getMessage());
            }
        }

        if (dlqProducer != null) {
            dlqProducer.flush();
        }
    }

    private void handleTerminalFailure(
            final ConsumerRecord<String, String> record,
            final String failureCode,
            final String reason) {
        if (dlqProducer == null || !"kafka".equalsIgnoreCase(onExhausted)) {
            LOG.error("MAIL UNDELIVERED: topic={} partition={} offset={} code={} reason={}",
                    record.topic(), record.partition(), record.offset(), failureCode, reason);
            return;
        }

        final RecordHeaders headers = new RecordHeaders();
        headers.add(HEADER_FAILURE_CODE,   bytes(failureCode));
        headers.add(HEADER_FAILURE_REASON, bytes(reason));
        headers.add(HEADER_SOURCE_TOPIC,   bytes(record.topic()));
        dlqProducer.send(new ProducerRecord<>(dlqTopic, null, record.key(), record.value(), headers),
                (metadata, ex) -> {
                    if (ex != null) {
                        LOG.error("Failed to publish to DLQ {}: offset={} error={}",
                                dlqTopic, record.offset(), ex.getMessage());
                    }
                });
        LOG.warn("Published undelivered request to DLQ {}: offset={} code={}",
                dlqTopic, record.offset(), failureCode);
    }

    private Instant defaultDeadline() {
        return requestTimeout.isZero() || requestTimeout.isNegative()
                ? null
                : clock.instant().plus(requestTimeout);
    }

    private static byte[] bytes(final String value) {
        return (value != null ? value : "").getBytes(StandardCharsets.UTF_8);
    }

    private static Properties consumerProperties(final GatewayConfig cfg) {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,     cfg.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG,              cfg.getConsumerGroupId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,     cfg.getAutoOffsetReset());
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG,      cfg.getMaxPollRecords());
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG,    cfg.getSessionTimeoutMs());
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, cfg.getHeartbeatIntervalMs());
        // Manual offset commit: we commit after processing, not before
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,   StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }

    private static Properties producerProperties(final GatewayConfig cfg) {
        final Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, cfg.getBootstrapServers());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, "true");
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,   StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return props;
    }
}
