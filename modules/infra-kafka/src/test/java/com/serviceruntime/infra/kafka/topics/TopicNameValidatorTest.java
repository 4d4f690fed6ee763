package com.serviceruntime.infra.kafka.topics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class TopicNameValidatorTest {
  @Test
  void shouldAcceptKafkaLegalNames() {
    for (String topic : new String[] {"ledger", "orders.submitted.v1", "Prices_EU-2", "a"}) {
      assertDoesNotThrow(() -> TopicNameValidator.assertValid(topic));
      assertTrue(TopicNameValidator.isValid(topic));
    }
  }

  @Test
  void shouldRejectInvalidTopicNames() {
    assertFalse(TopicNameValidator.isValid(null));
    assertFalse(TopicNameValidator.isValid(""));
    assertFalse(TopicNameValidator.isValid("."));
    assertFalse(TopicNameValidator.isValid(".."));
    assertFalse(TopicNameValidator.isValid("orders submitted"));
    assertFalse(TopicNameValidator.isValid("orders/submitted"));
    assertFalse(TopicNameValidator.isValid("x".repeat(250)));
    assertTrue(TopicNameValidator.isValid("x".repeat(249)));
    assertThrows(
        IllegalArgumentException.class, () -> TopicNameValidator.assertValid("orders/submitted"));
  }

  @Test
  void shouldValidateTopicDefinitions() {
    KafkaTopicDefinition definition = new KafkaTopicDefinition("ledger", 6, (short) 3);

    assertEquals(6, definition.toNewTopic().numPartitions());
    assertEquals((short) 3, definition.toNewTopic().replicationFactor());
    assertThrows(
        IllegalArgumentException.class, () -> new KafkaTopicDefinition("ledger", 0, (short) 1));
    assertThrows(
        IllegalArgumentException.class, () -> new KafkaTopicDefinition("ledger", 1, (short) 0));
    assertThrows(
        IllegalArgumentException.class, () -> new KafkaTopicDefinition("bad topic", 1, (short) 1));
  }
}
