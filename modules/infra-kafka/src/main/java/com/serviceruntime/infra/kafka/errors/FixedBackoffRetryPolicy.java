package com.serviceruntime.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;

/** Same delay before every retry, up to {@code maxAttempts} attempts in total. */
public class FixedBackoffRetryPolicy implements RetryPolicy {
  private static final FixedBackoffRetryPolicy NO_RETRY =
      new FixedBackoffRetryPolicy(1, Duration.ZERO);

  private final int maxAttempts;
  private final Duration delay;

  public FixedBackoffRetryPolicy(int maxAttempts, Duration delay) {
    Objects.requireNonNull(delay, "delay must not be null");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative: " + delay);
    }
    this.maxAttempts = Math.max(1, maxAttempts);
    this.delay = delay;
  }

  /** A single attempt: the first failure exhausts the sequence. */
  public static FixedBackoffRetryPolicy noRetry() {
    return NO_RETRY;
  }

  @Override
  public boolean shouldRetry(int attempt) {
    return attempt < maxAttempts;
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    return delay;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public String toString() {
    return "FixedBackoffRetryPolicy[maxAttempts="
        + maxAttempts
        + ", delayMs="
        + delay.toMillis()
        + "]";
  }
}
