package com.serviceruntime.infra.kafka.topics;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class KafkaTopicAdministrator implements TopicAdministrator {
  private static final Logger log = LoggerFactory.getLogger(KafkaTopicAdministrator.class);

  private final Admin admin;
  private final Duration timeout;

  public KafkaTopicAdministrator(Admin admin, Duration timeout) {
    this.admin = Objects.requireNonNull(admin, "admin must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
  }

  @Override
  public void ensureTopic(KafkaTopicDefinition definition) {
    String topic = definition.name();
    try {
      admin
          .createTopics(List.of(definition.toNewTopic()))
          .all()
          .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      log.info(
          "Kafka topic created topic={} partitions={} replicationFactor={}",
          topic,
          definition.partitions(),
          definition.replicationFactor());
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof TopicExistsException) {
        log.debug("Kafka topic already exists topic={}", topic);
        return;
      }
      throw new TopicProvisioningException(
          topic, "Failed to create Kafka topic " + topic, ex.getCause());
    } catch (TimeoutException ex) {
      throw new TopicProvisioningException(
          topic, "Timed out creating Kafka topic " + topic, ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new TopicProvisioningException(
          topic, "Interrupted while creating Kafka topic " + topic, ex);
    }
  }
}
