package com.serviceruntime.infra.kafka.producer;

import java.util.concurrent.CompletableFuture;
import org.springframework.kafka.support.SendResult;

public interface RecordProducer<K, V> {
  String topic();

  /**
   * Encodes and writes one record. Either part may be {@code null} to send it absent. The future
   * completes once the broker acknowledges the write, or exceptionally with a {@link
   * KafkaSendException}. No retry happens here.
   */
  CompletableFuture<SendResult<byte[], byte[]>> send(K key, V payload);
}
