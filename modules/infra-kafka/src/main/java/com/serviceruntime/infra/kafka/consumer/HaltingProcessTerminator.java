package com.serviceruntime.infra.kafka.consumer;

import java.time.Duration;
import java.util.Objects;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the failure, waits a grace period for log shipping, then halts the JVM. An interrupt does
 * not shorten the grace period.
 */
public class HaltingProcessTerminator implements ProcessTerminator {
  private static final Logger log = LoggerFactory.getLogger(HaltingProcessTerminator.class);

  private final Duration gracePeriod;
  private final int exitStatus;
  private final Sleeper sleeper;
  private final IntConsumer halt;

  public HaltingProcessTerminator(Duration gracePeriod, int exitStatus) {
    this(gracePeriod, exitStatus, Sleeper.THREAD, status -> Runtime.getRuntime().halt(status));
  }

  HaltingProcessTerminator(
      Duration gracePeriod, int exitStatus, Sleeper sleeper, IntConsumer halt) {
    this.gracePeriod = gracePeriod == null ? Duration.ZERO : gracePeriod;
    this.exitStatus = exitStatus;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.halt = Objects.requireNonNull(halt, "halt must not be null");
  }

  @Override
  public void terminate(String reason, Throwable cause) {
    log.error(
        "Terminating process reason={} exitStatus={} graceMs={}",
        reason,
        exitStatus,
        gracePeriod.toMillis(),
        cause);
    boolean interrupted = false;
    long deadline = System.nanoTime() + gracePeriod.toNanos();
    Duration remaining = gracePeriod;
    while (remaining.compareTo(Duration.ZERO) > 0) {
      try {
        sleeper.sleep(remaining);
        break;
      } catch (InterruptedException ex) {
        interrupted = true;
        remaining = Duration.ofNanos(deadline - System.nanoTime());
      }
    }
    halt.accept(exitStatus);
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }
}
