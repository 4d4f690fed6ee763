package com.serviceruntime.infra.kafka.serde;

/** Converts one key or payload type to and from record bytes. */
public interface RecordCodec<T> {
  byte[] encode(T value);

  T decode(byte[] bytes);
}
