package com.serviceruntime.infra.kafka.producer;

import com.serviceruntime.infra.kafka.observability.KafkaTelemetry;
import com.serviceruntime.infra.kafka.serde.MessageType;
import com.serviceruntime.infra.kafka.topics.TopicNameValidator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.IntUnaryOperator;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.PartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaProducerException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

/**
 * Writes records of one {@link MessageType} to a fixed topic. Each record goes to a partition
 * drawn uniformly at random from the cached partition count; the key does not affect placement.
 */
public class KafkaRecordProducer<K, V> implements RecordProducer<K, V> {
  private static final Logger log = LoggerFactory.getLogger(KafkaRecordProducer.class);

  static final IntUnaryOperator RANDOM_PARTITION =
      partitionCount -> ThreadLocalRandom.current().nextInt(partitionCount);

  private final String topic;
  private final MessageType<K, V> messageType;
  private final KafkaTemplate<byte[], byte[]> kafkaTemplate;
  private final PartitionCountCache partitionCountCache;
  private final KafkaTelemetry telemetry;
  private final IntUnaryOperator partitionSelector;

  public KafkaRecordProducer(
      String topic,
      MessageType<K, V> messageType,
      KafkaTemplate<byte[], byte[]> kafkaTemplate,
      PartitionCountCache partitionCountCache,
      KafkaTelemetry telemetry) {
    this(topic, messageType, kafkaTemplate, partitionCountCache, telemetry, RANDOM_PARTITION);
  }

  KafkaRecordProducer(
      String topic,
      MessageType<K, V> messageType,
      KafkaTemplate<byte[], byte[]> kafkaTemplate,
      PartitionCountCache partitionCountCache,
      KafkaTelemetry telemetry,
      IntUnaryOperator partitionSelector) {
    TopicNameValidator.assertValid(topic);
    this.topic = topic;
    this.messageType = Objects.requireNonNull(messageType, "messageType must not be null");
    this.kafkaTemplate = Objects.requireNonNull(kafkaTemplate, "kafkaTemplate must not be null");
    this.partitionCountCache =
        Objects.requireNonNull(partitionCountCache, "partitionCountCache must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.partitionSelector =
        Objects.requireNonNull(partitionSelector, "partitionSelector must not be null");
  }

  @Override
  public String topic() {
    return topic;
  }

  @Override
  public CompletableFuture<SendResult<byte[], byte[]>> send(K key, V payload) {
    byte[] keyBytes = key == null ? null : messageType.keyCodec().encode(key);
    byte[] payloadBytes = payload == null ? null : messageType.payloadCodec().encode(payload);

    int partitionCount = partitionCountCache.current(this::fetchPartitionCount);
    int partition = partitionSelector.applyAsInt(partitionCount);
    long started = System.nanoTime();
    ProducerRecord<byte[], byte[]> record =
        new ProducerRecord<>(topic, partition, keyBytes, payloadBytes);

    CompletableFuture<SendResult<byte[], byte[]>> sendFuture;
    try {
      sendFuture = kafkaTemplate.send(record);
    } catch (RuntimeException ex) {
      return CompletableFuture.failedFuture(failed(partition, ex));
    }

    CompletableFuture<SendResult<byte[], byte[]>> result = new CompletableFuture<>();
    sendFuture.whenComplete(
        (sendResult, throwable) -> {
          if (throwable == null) {
            telemetry.onPublishSuccess(topic, partition, System.nanoTime() - started);
            if (log.isDebugEnabled()) {
              RecordMetadata metadata = sendResult == null ? null : sendResult.getRecordMetadata();
              log.debug(
                  "Record dispatched topic={} partition={} offset={}",
                  topic,
                  partition,
                  metadata == null ? -1L : metadata.offset());
            }
            result.complete(sendResult);
            return;
          }
          result.completeExceptionally(failed(partition, throwable));
        });
    return result;
  }

  private KafkaSendException failed(int partition, Throwable throwable) {
    Throwable cause = unwrap(throwable);
    KafkaSendException sendException =
        new KafkaSendException(
            topic,
            partition,
            "Failed to send record to Kafka topic=" + topic + " partition=" + partition,
            cause);
    telemetry.onPublishFailure(topic, partition, sendException);
    log.warn(
        "Record send failed topic={} partition={} severity={}",
        topic,
        partition,
        sendException.severity(),
        cause);
    return sendException;
  }

  private int fetchPartitionCount() {
    try {
      List<PartitionInfo> partitions = kafkaTemplate.partitionsFor(topic);
      int count = partitions == null ? 0 : partitions.size();
      telemetry.onPartitionRefresh(topic, count);
      return count;
    } catch (RuntimeException ex) {
      telemetry.onPartitionRefreshFailure(topic, ex);
      throw ex;
    }
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException
            || current instanceof KafkaProducerException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
