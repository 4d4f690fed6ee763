package com.serviceruntime.infra.kafka.observability;

import com.serviceruntime.infra.kafka.triage.Severity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

public class MicrometerKafkaTelemetry implements KafkaTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerKafkaTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPublishSuccess(String topic, int partition, long durationNanos) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.kafka.publish.duration")
        .description("Kafka publish latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onPublishFailure(String topic, int partition, Throwable error) {
    Counter.builder("infra.kafka.publish.total")
        .description("Total Kafka publish attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onPartitionRefresh(String topic, int partitionCount) {
    Counter.builder("infra.kafka.partition_refresh.total")
        .description("Partition count refreshes by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "success")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onPartitionRefreshFailure(String topic, Throwable error) {
    Counter.builder("infra.kafka.partition_refresh.total")
        .description("Partition count refreshes by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "failure")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onConsumeSuccess(
      String topic, int partition, long offset, int attempts, long durationNanos) {
    Counter.builder("infra.kafka.consume.total")
        .description("Total Kafka consume attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "success")
        .tag("severity", "none")
        .tag("error", "none")
        .register(meterRegistry)
        .increment();

    Timer.builder("infra.kafka.consume.duration")
        .description("Kafka consume processing latency")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onConsumeFailure(String topic, Severity severity, Throwable error) {
    Counter.builder("infra.kafka.consume.total")
        .description("Total Kafka consume attempts by outcome")
        .tag("topic", safeValue(topic))
        .tag("outcome", "failure")
        .tag("severity", safeSeverity(severity))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onHandlerRetry(String topic, int attempt, Duration delay) {
    Counter.builder("infra.kafka.handler.retry.total")
        .description("Handler retries scheduled after a transient failure")
        .tag("topic", safeValue(topic))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRecordDropped(String topic, String reason, Throwable error) {
    Counter.builder("infra.kafka.dropped.total")
        .description("Records dropped without successful handling")
        .tag("topic", safeValue(topic))
        .tag("reason", safeValue(reason))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onReceiveFailure(String topic, Throwable error) {
    Counter.builder("infra.kafka.receive.failure.total")
        .description("Stream-level receive and decode failures")
        .tag("topic", safeValue(topic))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onStreamReconnect(int attempt, Duration delay) {
    Counter.builder("infra.kafka.stream.reconnect.total")
        .description("Record stream reconnects")
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeSeverity(Severity severity) {
    if (severity == null) {
      return "unknown";
    }
    return severity.name().toLowerCase(Locale.ROOT);
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
