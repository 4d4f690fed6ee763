package com.serviceruntime.infra.kafka.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.common.config.SaslConfigs;
import org.junit.jupiter.api.Test;

class InfraKafkaPropertiesTest {
  @Test
  void shouldExposeDefaults() {
    InfraKafkaProperties properties = new InfraKafkaProperties();

    assertEquals("localhost:9092", properties.bootstrapServersAsCsv());
    assertEquals("service-runtime-producer", properties.effectiveProducerClientId());
    assertEquals(Duration.ofMinutes(5), properties.getProducer().getPartitionRefreshInterval());
    assertEquals(Duration.ofMillis(100), properties.getConsumer().getPollTimeout());
    assertEquals(Duration.ofSeconds(1), properties.getSupervision().getAbortGracePeriod());
    assertEquals(1, properties.getSupervision().getAbortExitStatus());
    assertTrue(properties.getSecurity().isSsl());
  }

  @Test
  void shouldUseServiceNameAsProducerClientId() {
    InfraKafkaProperties properties = new InfraKafkaProperties();
    properties.setServiceName("ledger");

    assertEquals("ledger", properties.effectiveProducerClientId());

    properties.getProducer().setClientId("ledger-writer");
    assertEquals("ledger-writer", properties.effectiveProducerClientId());
  }

  @Test
  void shouldConfigureScramOverSslWithCredentials() {
    InfraKafkaProperties properties = new InfraKafkaProperties();
    properties.setBootstrapServers(List.of("broker-1:9093", "broker-2:9093"));
    properties.getSecurity().setUsername("svc");
    properties.getSecurity().setPassword("se\"cret");

    Map<String, Object> config = properties.commonClientConfig();

    assertEquals("broker-1:9093,broker-2:9093", config.get(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG));
    assertEquals("SASL_SSL", config.get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
    assertEquals("SCRAM-SHA-512", config.get(SaslConfigs.SASL_MECHANISM));
    String jaas = (String) config.get(SaslConfigs.SASL_JAAS_CONFIG);
    assertTrue(jaas.contains("ScramLoginModule required"));
    assertTrue(jaas.contains("username=\"svc\""));
    assertTrue(jaas.contains("password=\"se\\\"cret\""));
  }

  @Test
  void shouldPickProtocolFromSslFlagWithoutCredentials() {
    InfraKafkaProperties properties = new InfraKafkaProperties();
    assertEquals("SSL", properties.commonClientConfig().get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));

    properties.getSecurity().setSsl(false);
    Map<String, Object> config = properties.commonClientConfig();
    assertEquals("PLAINTEXT", config.get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
    assertFalse(config.containsKey(SaslConfigs.SASL_MECHANISM));

    properties.getSecurity().setUsername("svc");
    properties.getSecurity().setPassword("secret");
    assertEquals(
        "SASL_PLAINTEXT",
        properties.commonClientConfig().get(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG));
  }

  @Test
  void shouldRejectUsernameWithoutPassword() {
    InfraKafkaProperties properties = new InfraKafkaProperties();
    properties.getSecurity().setUsername("svc");

    assertThrows(IllegalArgumentException.class, properties::commonClientConfig);
  }
}
