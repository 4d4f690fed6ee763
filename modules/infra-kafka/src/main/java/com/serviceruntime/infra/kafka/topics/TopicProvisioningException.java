package com.serviceruntime.infra.kafka.topics;

import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.Triage;

public class TopicProvisioningException extends RuntimeException implements Triage {
  private final String topic;

  public TopicProvisioningException(String topic, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
  }

  public String getTopic() {
    return topic;
  }

  @Override
  public Severity severity() {
    return Severity.PERMANENT;
  }
}
