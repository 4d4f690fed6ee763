package com.serviceruntime.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.serviceruntime.infra.kafka.errors.FixedBackoffRetryPolicy;
import com.serviceruntime.infra.kafka.errors.RetryPolicy;
import com.serviceruntime.infra.kafka.observability.NoOpKafkaTelemetry;
import com.serviceruntime.infra.kafka.serde.Utf8RecordCodec;
import com.serviceruntime.infra.kafka.triage.SeverityClassifier;
import java.time.Duration;
import java.util.List;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.core.ConsumerFactory;

class RecordConsumersTest {
  private final MessageGroup<String> orderEvents =
      TopicRoutedMessageGroup.<String>builder("OrderEvents")
          .routePayload("orders", Utf8RecordCodec.INSTANCE, payload -> payload)
          .build();
  private final RetryPolicy handlerRetry = new FixedBackoffRetryPolicy(3, Duration.ofMillis(10));

  @Test
  void shouldDeriveGroupIdFromGroupNameAndServiceName() {
    @SuppressWarnings("unchecked")
    ConsumerFactory<byte[], byte[]> factory = mock(ConsumerFactory.class);
    MockConsumer<byte[], byte[]> client = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
    when(factory.createConsumer(eq("OrderEvents@ledger"), isNull())).thenReturn(client);

    KafkaRecordConsumer<String> consumer = consumers("ledger", null, factory).create(orderEvents);

    assertEquals("OrderEvents@ledger", consumer.groupId());
    assertEquals(List.of("orders"), consumer.topics());
    assertEquals(List.of("orders"), List.copyOf(client.subscription()));
    verify(factory).createConsumer(eq("OrderEvents@ledger"), isNull());
  }

  @Test
  void shouldPreferConfiguredGroupId() {
    @SuppressWarnings("unchecked")
    ConsumerFactory<byte[], byte[]> factory = mock(ConsumerFactory.class);

    RecordConsumers consumers = consumers("ledger", "ledger-replay", factory);

    assertEquals("ledger-replay", consumers.groupIdFor(orderEvents));
    assertSame(handlerRetry, consumers.defaultHandlerRetryPolicy());
  }

  @Test
  void shouldRequireServiceNameWithoutConfiguredGroupId() {
    @SuppressWarnings("unchecked")
    ConsumerFactory<byte[], byte[]> factory = mock(ConsumerFactory.class);

    assertThrows(
        IllegalStateException.class, () -> consumers(" ", null, factory).create(orderEvents));
  }

  private RecordConsumers consumers(
      String serviceName, String groupId, ConsumerFactory<byte[], byte[]> factory) {
    return new RecordConsumers(
        serviceName,
        groupId,
        factory,
        Duration.ofMillis(50),
        new FixedBackoffRetryPolicy(2, Duration.ofMillis(100)),
        handlerRetry,
        SeverityClassifier.defaults(),
        (reason, cause) -> {},
        new NoOpKafkaTelemetry());
  }
}
