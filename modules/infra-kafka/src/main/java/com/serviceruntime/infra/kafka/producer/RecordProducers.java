package com.serviceruntime.infra.kafka.producer;

import com.serviceruntime.infra.kafka.errors.KafkaClientException;
import com.serviceruntime.infra.kafka.observability.KafkaTelemetry;
import com.serviceruntime.infra.kafka.serde.MessageType;
import com.serviceruntime.infra.kafka.topics.KafkaTopicDefinition;
import com.serviceruntime.infra.kafka.topics.TopicAdministrator;
import com.serviceruntime.infra.kafka.topics.TopicNameValidator;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

/** Builds {@link RecordProducer}s that share one Kafka producer client. */
public class RecordProducers {
  private static final Logger log = LoggerFactory.getLogger(RecordProducers.class);

  private final String serviceName;
  private final KafkaTemplate<byte[], byte[]> kafkaTemplate;
  private final TopicAdministrator topicAdministrator;
  private final KafkaTelemetry telemetry;
  private final Settings settings;
  private final Clock clock;

  public record Settings(
      Duration partitionRefreshInterval, int topicPartitions, short topicReplicationFactor) {
    public static Settings defaults() {
      return new Settings(PartitionCountCache.DEFAULT_REFRESH_INTERVAL, 1, (short) 1);
    }
  }

  public RecordProducers(
      String serviceName,
      KafkaTemplate<byte[], byte[]> kafkaTemplate,
      TopicAdministrator topicAdministrator,
      KafkaTelemetry telemetry,
      Settings settings) {
    this(serviceName, kafkaTemplate, topicAdministrator, telemetry, settings, Clock.systemUTC());
  }

  public RecordProducers(
      String serviceName,
      KafkaTemplate<byte[], byte[]> kafkaTemplate,
      TopicAdministrator topicAdministrator,
      KafkaTelemetry telemetry,
      Settings settings,
      Clock clock) {
    this.serviceName = serviceName;
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.topicAdministrator =
        Objects.requireNonNull(topicAdministrator, "topicAdministrator must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.settings = settings == null ? Settings.defaults() : settings;
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Producer for the topic named after this service. */
  public <K, V> RecordProducer<K, V> create(MessageType<K, V> messageType) {
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalStateException("infra.kafka.service-name must be set to use its topic");
    }
    return create(serviceName, messageType);
  }

  /**
   * Ensures {@code topic} exists, then returns a producer bound to it.
   *
   * @throws com.serviceruntime.infra.kafka.topics.TopicProvisioningException if the topic cannot
   *     be created
   * @throws KafkaClientException if the producer client cannot be constructed
   */
  public <K, V> RecordProducer<K, V> create(String topic, MessageType<K, V> messageType) {
    TopicNameValidator.assertValid(topic);
    Objects.requireNonNull(messageType, "messageType must not be null");

    topicAdministrator.ensureTopic(
        new KafkaTopicDefinition(
            topic, settings.topicPartitions(), settings.topicReplicationFactor()));
    verifyClient(topic);

    PartitionCountCache cache =
        new PartitionCountCache(
            topic, settings.topicPartitions(), settings.partitionRefreshInterval(), clock);
    log.info("Record producer ready topic={}", topic);
    return new KafkaRecordProducer<>(topic, messageType, kafkaTemplate, cache, telemetry);
  }

  private void verifyClient(String topic) {
    // The factory caches one shared client, so closing this handle keeps it open.
    try (Producer<byte[], byte[]> producer = kafkaTemplate.getProducerFactory().createProducer()) {
      Objects.requireNonNull(producer, "producer");
    } catch (KafkaException ex) {
      throw new KafkaClientException("Unable to create Kafka producer for topic " + topic, ex);
    }
  }
}
