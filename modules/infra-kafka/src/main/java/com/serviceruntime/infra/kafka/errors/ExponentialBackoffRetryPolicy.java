package com.serviceruntime.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final Duration initialBackoff;
  private final Duration maxBackoff;
  private final double multiplier;
  private final boolean jitterEnabled;
  private final DoubleSupplier jitterSource;

  public ExponentialBackoffRetryPolicy(
      int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {
    this(maxAttempts, initialBackoff, maxBackoff, multiplier, false);
  }

  public ExponentialBackoffRetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      double multiplier,
      boolean jitterEnabled) {
    this(
        maxAttempts,
        initialBackoff,
        maxBackoff,
        multiplier,
        jitterEnabled,
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public ExponentialBackoffRetryPolicy(
      int maxAttempts,
      Duration initialBackoff,
      Duration maxBackoff,
      double multiplier,
      boolean jitterEnabled,
      DoubleSupplier jitterSource) {
    this.maxAttempts = Math.max(1, maxAttempts);
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
    this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
    this.multiplier = Math.max(1.0d, multiplier);
    this.jitterEnabled = jitterEnabled;
    this.jitterSource = Objects.requireNonNull(jitterSource, "jitterSource must not be null");
  }

  @Override
  public boolean shouldRetry(int attempt) {
    return attempt < maxAttempts;
  }

  @Override
  public Duration backoffForAttempt(int attempt) {
    long deterministic = deterministicBackoff(attempt);
    if (!jitterEnabled || deterministic == 0L) {
      return Duration.ofMillis(deterministic);
    }
    // Full jitter: uniform in [0, deterministic].
    double factor = Math.max(0.0d, Math.min(0.999999999d, jitterSource.getAsDouble()));
    long jittered = (long) Math.floor(factor * (deterministic + 1L));
    return Duration.ofMillis(Math.max(0L, Math.min(deterministic, jittered)));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private long deterministicBackoff(int attempt) {
    long initialMillis = Math.max(0L, initialBackoff.toMillis());
    long maxMillis = Math.max(initialMillis, maxBackoff.toMillis());
    if (initialMillis == 0L) {
      return 0L;
    }

    int exponent = Math.max(0, attempt - 1);
    double scaled = initialMillis * Math.pow(multiplier, exponent);
    long bounded = (long) Math.floor(Math.min((double) maxMillis, scaled));
    return Math.max(0L, bounded);
  }
}
