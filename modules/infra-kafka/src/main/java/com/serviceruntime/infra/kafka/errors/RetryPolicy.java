package com.serviceruntime.infra.kafka.errors;

import java.time.Duration;

/**
 * A capped backoff schedule. {@code attempt} counts the attempts already made, starting at 1.
 */
public interface RetryPolicy {
  boolean shouldRetry(int attempt);

  Duration backoffForAttempt(int attempt);

  default BackoffSequence newSequence() {
    return new BackoffSequence(this);
  }
}
