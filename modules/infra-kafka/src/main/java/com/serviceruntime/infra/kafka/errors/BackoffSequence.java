package com.serviceruntime.infra.kafka.errors;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/** Mutable cursor over a {@link RetryPolicy}. Not thread-safe; each owner keeps its own. */
public final class BackoffSequence {
  private final RetryPolicy policy;
  private int attempt = 1;

  BackoffSequence(RetryPolicy policy) {
    this.policy = Objects.requireNonNull(policy, "policy must not be null");
  }

  /** Returns the next delay, or empty once the policy's attempt cap is reached. */
  public Optional<Duration> next() {
    if (!policy.shouldRetry(attempt)) {
      return Optional.empty();
    }
    Duration delay = policy.backoffForAttempt(attempt);
    attempt++;
    return Optional.of(delay == null ? Duration.ZERO : delay);
  }

  public void reset() {
    attempt = 1;
  }

  public int attempt() {
    return attempt;
  }

  public boolean isInitial() {
    return attempt == 1;
  }
}
