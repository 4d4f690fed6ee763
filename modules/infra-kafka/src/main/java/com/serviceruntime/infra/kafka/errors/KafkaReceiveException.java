package com.serviceruntime.infra.kafka.errors;

import com.serviceruntime.infra.kafka.triage.Severity;
import com.serviceruntime.infra.kafka.triage.Triage;
import java.util.Objects;

/** A record could not be received or turned into an application event. */
public class KafkaReceiveException extends RuntimeException implements Triage {
  public enum Reason {
    /** Reading from the broker failed. */
    KAFKA(Severity.TRANSIENT),
    /** The key or payload bytes could not be decoded. */
    DECODE(Severity.PERMANENT),
    /** The record arrived on a topic outside the subscription set. */
    BAD_TOPIC(Severity.PERMANENT),
    MISSING_KEY(Severity.PERMANENT),
    MISSING_PAYLOAD(Severity.PERMANENT);

    private final Severity severity;

    Reason(Severity severity) {
      this.severity = severity;
    }

    public Severity severity() {
      return severity;
    }
  }

  private final Reason reason;
  private final String topic;

  public KafkaReceiveException(Reason reason, String topic, String message, Throwable cause) {
    super(message, cause);
    this.reason = Objects.requireNonNull(reason, "reason must not be null");
    this.topic = topic;
  }

  public static KafkaReceiveException transport(Throwable cause) {
    return new KafkaReceiveException(
        Reason.KAFKA, null, "Error receiving records from Kafka: " + cause.getMessage(), cause);
  }

  public static KafkaReceiveException decode(String topic, Throwable cause) {
    return new KafkaReceiveException(
        Reason.DECODE, topic, "Error decoding record from topic " + topic, cause);
  }

  public static KafkaReceiveException badTopic(String topic) {
    return new KafkaReceiveException(Reason.BAD_TOPIC, topic, "Unexpected topic " + topic, null);
  }

  public static KafkaReceiveException missingKey(String topic) {
    return new KafkaReceiveException(
        Reason.MISSING_KEY, topic, "Expected a record key on topic " + topic + ", got none", null);
  }

  public static KafkaReceiveException missingPayload(String topic) {
    return new KafkaReceiveException(
        Reason.MISSING_PAYLOAD,
        topic,
        "Expected a record payload on topic " + topic + ", got none",
        null);
  }

  public Reason reason() {
    return reason;
  }

  public String topic() {
    return topic;
  }

  @Override
  public Severity severity() {
    return reason.severity();
  }
}
