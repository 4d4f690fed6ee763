package com.serviceruntime.infra.kafka.config;

import com.serviceruntime.infra.kafka.errors.ExponentialBackoffRetryPolicy;
import com.serviceruntime.infra.kafka.errors.FixedBackoffRetryPolicy;
import com.serviceruntime.infra.kafka.errors.RetryPolicy;
import java.time.Duration;
import java.util.Locale;

public final class RetryPolicyFactory {
  private RetryPolicyFactory() {}

  public static RetryPolicy handlerRetry(InfraKafkaProperties.HandlerRetry retry) {
    if (retry == null) {
      return FixedBackoffRetryPolicy.noRetry();
    }

    String mode =
        retry.getMode() == null ? "exponential" : retry.getMode().trim().toLowerCase(Locale.ROOT);
    if ("exponential".equals(mode)) {
      return new ExponentialBackoffRetryPolicy(
          retry.getMaxAttempts(),
          millis(retry.getInitialBackoffMs()),
          millis(retry.getMaxBackoffMs()),
          retry.getMultiplier(),
          retry.isJitterEnabled());
    }
    if ("fixed".equals(mode)) {
      return new FixedBackoffRetryPolicy(
          retry.getMaxAttempts(), millis(retry.getFixedBackoffMs()));
    }
    throw new IllegalArgumentException(
        "Unsupported infra.kafka.handler-retry.mode: " + retry.getMode());
  }

  public static RetryPolicy supervision(InfraKafkaProperties.Supervision supervision) {
    InfraKafkaProperties.Supervision effective =
        supervision == null ? new InfraKafkaProperties.Supervision() : supervision;
    return new ExponentialBackoffRetryPolicy(
        effective.getMaxAttempts(),
        millis(effective.getInitialBackoffMs()),
        millis(effective.getMaxBackoffMs()),
        effective.getMultiplier(),
        effective.isJitterEnabled());
  }

  private static Duration millis(long value) {
    return Duration.ofMillis(Math.max(0L, value));
  }
}
