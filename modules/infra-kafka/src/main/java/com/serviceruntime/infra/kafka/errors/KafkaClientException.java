package com.serviceruntime.infra.kafka.errors;

import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.Triage;

/** A Kafka client could not be constructed or subscribed. */
public class KafkaClientException extends RuntimeException implements Triage {
  public KafkaClientException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public Severity severity() {
    return Severity.PERMANENT;
  }
}
