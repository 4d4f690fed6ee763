package com.serviceruntime.infra.kafka.producer;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last known partition count of a topic, refreshed at most once per interval.
 *
 * <p>Reads never block. When the interval has elapsed, the caller that wins a compare-and-swap on
 * the refresh timestamp fetches the new count; every other caller keeps reading the cached value.
 * A failed fetch leaves the cached count untouched and waits for the next interval.
 */
public final class PartitionCountCache {
  public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);

  private static final Logger log = LoggerFactory.getLogger(PartitionCountCache.class);
  // Epoch millis 0 means "never refreshed".
  private static final long NEVER = 0L;

  private final String topic;
  private final long refreshIntervalMillis;
  private final Clock clock;
  private final AtomicInteger partitionCount;
  private final AtomicLong lastRefreshMillis = new AtomicLong(NEVER);

  public PartitionCountCache(String topic, int initialCount, Duration refreshInterval, Clock clock) {
    this.topic = Objects.requireNonNull(topic, "topic must not be null");
    this.refreshIntervalMillis =
        Math.max(0L, Objects.requireNonNull(refreshInterval, "refreshInterval must not be null")
            .toMillis());
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.partitionCount = new AtomicInteger(Math.max(1, initialCount));
  }

  /**
   * Returns the partition count, first refreshing it through {@code fetch} if this caller claims a
   * due refresh. Exceptions from {@code fetch} are logged and swallowed.
   */
  public int current(IntSupplier fetch) {
    long now = clock.millis();
    long last = lastRefreshMillis.get();
    if (now - last > refreshIntervalMillis && lastRefreshMillis.compareAndSet(last, now)) {
      refresh(fetch);
    }
    return partitionCount.get();
  }

  public int cachedCount() {
    return partitionCount.get();
  }

  public long lastRefreshMillis() {
    return lastRefreshMillis.get();
  }

  private void refresh(IntSupplier fetch) {
    try {
      int fresh = fetch.getAsInt();
      if (fresh < 1) {
        log.warn(
            "Ignoring partition count refresh topic={} fetched={} cached={}",
            topic,
            fresh,
            partitionCount.get());
        return;
      }
      int previous = partitionCount.getAndSet(fresh);
      if (previous != fresh) {
        log.info(
            "Partition count changed topic={} previous={} current={}", topic, previous, fresh);
      }
    } catch (RuntimeException ex) {
      log.warn(
          "Partition count refresh failed topic={} cached={}", topic, partitionCount.get(), ex);
    }
  }
}
