package com.serviceruntime.infra.kafka.serde;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

public class JsonRecordCodec<T> implements RecordCodec<T> {
  private final ObjectMapper objectMapper;
  private final JavaType valueType;

  public JsonRecordCodec(ObjectMapper objectMapper, Class<T> valueType) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.valueType =
        objectMapper.constructType(Objects.requireNonNull(valueType, "valueType must not be null"));
  }

  public static <T> JsonRecordCodec<T> of(Class<T> valueType) {
    return new JsonRecordCodec<>(RecordObjectMapperFactory.create(), valueType);
  }

  @Override
  public byte[] encode(T value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (IOException ex) {
      throw RecordCodecException.encodeFailed(
          "Failed to encode " + valueType.getRawClass().getSimpleName(), ex);
    }
  }

  @Override
  public T decode(byte[] bytes) {
    try {
      return objectMapper.readValue(bytes, valueType);
    } catch (IOException ex) {
      throw RecordCodecException.decodeFailed(
          "Failed to decode " + valueType.getRawClass().getSimpleName(), ex);
    }
  }
}
