package com.serviceruntime.infra.kafka.consumer;

import com.serviceruntime.infra.kafka.errors.KafkaReceiveException;
import java.util.List;

/**
 * The events one consumer understands: a fixed topic subscription plus a decoder from raw record
 * parts into the application's event type.
 */
public interface MessageGroup<G> {
  List<String> topics();

  /**
   * Turns one record into an event.
   *
   * @throws KafkaReceiveException if the topic is unknown, a required part is absent or the bytes
   *     cannot be decoded
   */
  G decode(String topic, byte[] key, byte[] payload);

  /** Name used to derive the consumer group id. */
  default String groupName() {
    return getClass().getSimpleName();
  }
}
