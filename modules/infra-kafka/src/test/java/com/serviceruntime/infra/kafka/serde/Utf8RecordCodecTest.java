package com.serviceruntime.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.serviceruntime.infra.kafka.triage.Severity;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class Utf8RecordCodecTest {
  @Test
  void shouldEncodeAndDecodeMultibyteText() {
    byte[] bytes = Utf8RecordCodec.INSTANCE.encode("café ₿");

    assertArrayEquals("café ₿".getBytes(StandardCharsets.UTF_8), bytes);
    assertEquals("café ₿", Utf8RecordCodec.INSTANCE.decode(bytes));
  }

  @Test
  void shouldRejectInvalidUtf8() {
    RecordCodecException error =
        assertThrows(
            RecordCodecException.class,
            () -> Utf8RecordCodec.INSTANCE.decode(new byte[] {(byte) 0xC3, (byte) 0x28}));

    assertEquals(Severity.PERMANENT, error.severity());
  }
}
