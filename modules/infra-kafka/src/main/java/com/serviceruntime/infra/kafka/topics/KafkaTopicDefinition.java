package com.serviceruntime.infra.kafka.topics;

import org.apache.kafka.clients.admin.NewTopic;

public record KafkaTopicDefinition(String name, int partitions, short replicationFactor) {
  public KafkaTopicDefinition {
    TopicNameValidator.assertValid(name);
    if (partitions < 1) {
      throw new IllegalArgumentException("partitions must be >= 1");
    }
    if (replicationFactor < 1) {
      throw new IllegalArgumentException("replicationFactor must be >= 1");
    }
  }

  public NewTopic toNewTopic() {
    return new NewTopic(name, partitions, replicationFactor);
  }
}
