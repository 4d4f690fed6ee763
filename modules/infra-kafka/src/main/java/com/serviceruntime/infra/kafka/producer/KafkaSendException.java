package com.serviceruntime.infra.kafka.producer;

import com.serviceruntime.infra.kafka.triage.TriagedException;

/** Writing a record to the broker failed. Severity follows the underlying transport error. */
public class KafkaSendException extends TriagedException {
  private final String topic;
  private final int partition;

  public KafkaSendException(String topic, int partition, String message, Throwable cause) {
    super(message, cause);
    this.topic = topic;
    this.partition = partition;
  }

  public String getTopic() {
    return topic;
  }

  public int getPartition() {
    return partition;
  }
}
