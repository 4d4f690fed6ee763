package com.serviceruntime.infra.kafka.observability;

import com.serviceruntime.infra.kafka.triage.Severity;
import java.time.Duration;

public class NoOpKafkaTelemetry implements KafkaTelemetry {
    @Override
    public void onPublishSuccess(String topic, int partition, long durationNanos) {
    }

    @Override
    public void onPublishFailure(String topic, int partition, Throwable error) {
    }

    @Override
    public void onPartitionRefresh(String topic, int partitionCount) {
    }

    @Override
    public void onPartitionRefreshFailure(String topic, Throwable error) {
    }

    @Override
    public void onConsumeSuccess(String topic, int partition, long offset, int attempts, long durationNanos) {
    }

    @Override
    public void onConsumeFailure(String topic, Severity severity, Throwable error) {
    }

    @Override
    public void onHandlerRetry(String topic, int attempt, Duration delay) {
    }

    @Override
    public void onRecordDropped(String topic, String reason, Throwable error) {
    }

    @Override
    public void onReceiveFailure(String topic, Throwable error) {
    }

    @Override
    public void onStreamReconnect(int attempt, Duration delay) {
    }
}
