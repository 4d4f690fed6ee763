package com.serviceruntime.infra.kafka.serde;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class Utf8RecordCodec implements RecordCodec<String> {
  public static final Utf8RecordCodec INSTANCE = new Utf8RecordCodec();

  private Utf8RecordCodec() {}

  @Override
  public byte[] encode(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String decode(byte[] bytes) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException ex) {
      throw RecordCodecException.decodeFailed("Record bytes are not valid UTF-8", ex);
    }
  }
}
