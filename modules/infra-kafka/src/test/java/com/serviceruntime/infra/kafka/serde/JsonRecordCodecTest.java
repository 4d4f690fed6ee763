package com.serviceruntime.infra.kafka.serde;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.serviceruntime.infra.kafka.triage.Severity;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class JsonRecordCodecTest {
  private final JsonRecordCodec<PriceTick> codec = JsonRecordCodec.of(PriceTick.class);

  @Test
  void shouldWriteInstantsAsIsoStrings() {
    PriceTick tick =
        new PriceTick("BTCUSDT", new BigDecimal("40100.50"), Instant.parse("2026-02-24T12:00:00Z"));

    String json = new String(codec.encode(tick), StandardCharsets.UTF_8);

    assertTrue(json.contains("\"observedAt\":\"2026-02-24T12:00:00Z\""), json);
    assertTrue(json.contains("\"price\":40100.50"), json);
  }

  @Test
  void shouldRoundTripValues() {
    PriceTick tick =
        new PriceTick(
            "BTCUSDT", new BigDecimal("40100.50"), Instant.parse("2026-02-24T12:00:00.125Z"));

    assertEquals(tick, codec.decode(codec.encode(tick)));
  }

  @Test
  void shouldRoundTripKeyAndPayloadThroughMessageType() {
    MessageType<TickKey, PriceTick> ticks = MessageType.json(TickKey.class, PriceTick.class);
    TickKey key = new TickKey("binance", "ETHUSDT");
    PriceTick tick =
        new PriceTick("ETHUSDT", new BigDecimal("2500.0"), Instant.parse("2026-02-24T12:00:00Z"));

    assertEquals(key, ticks.keyCodec().decode(ticks.keyCodec().encode(key)));
    assertEquals(tick, ticks.payloadCodec().decode(ticks.payloadCodec().encode(tick)));

    MessageType<String, PriceTick> stringKeyed = MessageType.stringKeyed(codec);
    assertEquals(
        "ETHUSDT", stringKeyed.keyCodec().decode(stringKeyed.keyCodec().encode("ETHUSDT")));
    assertEquals(tick, stringKeyed.payloadCodec().decode(stringKeyed.payloadCodec().encode(tick)));
  }

  @Test
  void shouldIgnoreUnknownProperties() {
    PriceTick tick =
        codec.decode(
            ("{\"symbol\":\"ETHUSDT\",\"price\":2500,\"observedAt\":\"2026-02-24T12:00:00Z\","
                    + "\"venue\":\"spot\"}")
                .getBytes(StandardCharsets.UTF_8));

    assertEquals("ETHUSDT", tick.symbol());
    assertEquals(0, new BigDecimal("2500").compareTo(tick.price()));
    assertEquals(Instant.parse("2026-02-24T12:00:00Z"), tick.observedAt());
  }

  @Test
  void shouldReportMalformedJsonAsPermanentDecodeFailure() {
    RecordCodecException error =
        assertThrows(
            RecordCodecException.class,
            () -> codec.decode("{\"symbol\":".getBytes(StandardCharsets.UTF_8)));

    assertFalse(error.isEncoding());
    assertEquals(Severity.PERMANENT, error.severity());
  }

  @Test
  void shouldReportUnserializableValueAsFatalEncodeFailure() {
    JsonRecordCodec<Object> objects = JsonRecordCodec.of(Object.class);

    RecordCodecException error =
        assertThrows(RecordCodecException.class, () -> objects.encode(new Object()));

    assertTrue(error.isEncoding());
    assertEquals(Severity.FATAL, error.severity());
  }

  record PriceTick(String symbol, BigDecimal price, Instant observedAt) {}

  record TickKey(String venue, String symbol) {}
}
