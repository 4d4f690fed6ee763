package com.serviceruntime.infra.kafka.observability;

import com.serviceruntime.infra.kafka.triage.Severity;
import java.time.Duration;

public interface KafkaTelemetry {
  void onPublishSuccess(String topic, int partition, long durationNanos);

  void onPublishFailure(String topic, int partition, Throwable error);

  void onPartitionRefresh(String topic, int partitionCount);

  void onPartitionRefreshFailure(String topic, Throwable error);

  void onConsumeSuccess(String topic, int partition, long offset, int attempts, long durationNanos);

  void onConsumeFailure(String topic, Severity severity, Throwable error);

  void onHandlerRetry(String topic, int attempt, Duration delay);

  void onRecordDropped(String topic, String reason, Throwable error);

  void onReceiveFailure(String topic, Throwable error);

  void onStreamReconnect(int attempt, Duration delay);
}
