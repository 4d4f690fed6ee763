package com.serviceruntime.infra.kafka.topics;

public interface TopicAdministrator {
  /**
   * Creates the topic unless it already exists.
   *
   * @throws TopicProvisioningException if the broker rejects the creation for any other reason
   */
  void ensureTopic(KafkaTopicDefinition definition);
}
