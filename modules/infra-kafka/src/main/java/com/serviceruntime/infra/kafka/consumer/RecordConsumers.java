package com.serviceruntime.infra.kafka.consumer;

import com.serviceruntime.infra.kafka.errors.RetryPolicy;
import com.serviceruntime.infra.kafka.observability.KafkaTelemetry;
import com.serviceruntime.infra.kafka.triage.SeverityClassifier;
import java.time.Duration;
import java.util.Objects;
import org.springframework.kafka.core.ConsumerFactory;

/** Builds {@link KafkaRecordConsumer}s with the service's client settings. */
public class RecordConsumers {
  private final String serviceName;
  private final String groupIdOverride;
  private final ConsumerFactory<byte[], byte[]> consumerFactory;
  private final KafkaRecordConsumer.Settings settings;
  private final RetryPolicy defaultHandlerRetryPolicy;
  private final SeverityClassifier classifier;
  private final ProcessTerminator terminator;
  private final KafkaTelemetry telemetry;
  private final Sleeper sleeper;

  public RecordConsumers(
      String serviceName,
      String groupIdOverride,
      ConsumerFactory<byte[], byte[]> consumerFactory,
      Duration pollTimeout,
      RetryPolicy streamRetryPolicy,
      RetryPolicy defaultHandlerRetryPolicy,
      SeverityClassifier classifier,
      ProcessTerminator terminator,
      KafkaTelemetry telemetry) {
    this(
        serviceName,
        groupIdOverride,
        consumerFactory,
        new KafkaRecordConsumer.Settings(pollTimeout, streamRetryPolicy),
        defaultHandlerRetryPolicy,
        classifier,
        terminator,
        telemetry,
        Sleeper.THREAD);
  }

  RecordConsumers(
      String serviceName,
      String groupIdOverride,
      ConsumerFactory<byte[], byte[]> consumerFactory,
      KafkaRecordConsumer.Settings settings,
      RetryPolicy defaultHandlerRetryPolicy,
      SeverityClassifier classifier,
      ProcessTerminator terminator,
      KafkaTelemetry telemetry,
      Sleeper sleeper) {
    this.serviceName = serviceName;
    this.groupIdOverride = groupIdOverride;
    this.consumerFactory =
        Objects.requireNonNull(consumerFactory, "consumerFactory must not be null");
    this.settings = Objects.requireNonNull(settings, "settings must not be null");
    this.defaultHandlerRetryPolicy =
        Objects.requireNonNull(
            defaultHandlerRetryPolicy, "defaultHandlerRetryPolicy must not be null");
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <G> KafkaRecordConsumer<G> create(MessageGroup<G> messageGroup) {
    Objects.requireNonNull(messageGroup, "messageGroup must not be null");
    String groupId = groupIdFor(messageGroup);
    return KafkaRecordConsumer.build(
        groupId,
        messageGroup,
        () -> consumerFactory.createConsumer(groupId, null),
        settings,
        classifier,
        terminator,
        telemetry,
        sleeper);
  }

  /** Handler retry policy configured under {@code infra.kafka.handler-retry}. */
  public RetryPolicy defaultHandlerRetryPolicy() {
    return defaultHandlerRetryPolicy;
  }

  String groupIdFor(MessageGroup<?> messageGroup) {
    if (groupIdOverride != null && !groupIdOverride.isBlank()) {
      return groupIdOverride;
    }
    if (serviceName == null || serviceName.isBlank()) {
      throw new IllegalStateException("infra.kafka.service-name must be set to derive group ids");
    }
    return messageGroup.groupName() + "@" + serviceName;
  }
}
