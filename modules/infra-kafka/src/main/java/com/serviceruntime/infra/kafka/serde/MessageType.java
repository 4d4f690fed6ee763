package com.serviceruntime.infra.kafka.serde;

import java.util.Objects;

/** The key and payload codecs of one kind of record. */
public record MessageType<K, V>(RecordCodec<K> keyCodec, RecordCodec<V> payloadCodec) {
  public MessageType {
    Objects.requireNonNull(keyCodec, "keyCodec must not be null");
    Objects.requireNonNull(payloadCodec, "payloadCodec must not be null");
  }

  public static <V> MessageType<String, V> stringKeyed(RecordCodec<V> payloadCodec) {
    return new MessageType<>(Utf8RecordCodec.INSTANCE, payloadCodec);
  }

  public static <K, V> MessageType<K, V> json(Class<K> keyType, Class<V> payloadType) {
    return new MessageType<>(JsonRecordCodec.of(keyType), JsonRecordCodec.of(payloadType));
  }
}
