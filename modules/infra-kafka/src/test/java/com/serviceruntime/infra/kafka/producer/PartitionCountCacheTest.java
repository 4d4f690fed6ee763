package com.serviceruntime.infra.kafka.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class PartitionCountCacheTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void shouldRefreshOnFirstUse() {
    PartitionCountCache cache =
        new PartitionCountCache("orders", 1, Duration.ofMinutes(5), fixedClock(NOW));
    AtomicInteger fetches = new AtomicInteger();

    assertEquals(4, cache.current(() -> countingFetch(fetches, 4)));
    assertEquals(4, cache.current(() -> countingFetch(fetches, 8)));
    assertEquals(1, fetches.get());
    assertEquals(NOW.toEpochMilli(), cache.lastRefreshMillis());
  }

  @Test
  void shouldRefreshAgainOnlyAfterInterval() {
    MutableClock clock = new MutableClock(NOW);
    PartitionCountCache cache = new PartitionCountCache("orders", 1, Duration.ofMinutes(5), clock);
    cache.current(() -> 4);

    clock.advance(Duration.ofMinutes(5));
    assertEquals(4, cache.current(() -> 6));

    clock.advance(Duration.ofMillis(1));
    assertEquals(6, cache.current(() -> 6));
  }

  @Test
  void shouldKeepCachedCountWhenFetchFails() {
    MutableClock clock = new MutableClock(NOW);
    PartitionCountCache cache = new PartitionCountCache("orders", 1, Duration.ofMinutes(5), clock);
    cache.current(() -> 3);

    clock.advance(Duration.ofMinutes(6));
    int count =
        cache.current(
            () -> {
              throw new IllegalStateException("metadata unavailable");
            });

    assertEquals(3, count);
    assertEquals(clock.millis(), cache.lastRefreshMillis());
  }

  @Test
  void shouldIgnoreEmptyMetadata() {
    PartitionCountCache cache =
        new PartitionCountCache("orders", 2, Duration.ofMinutes(5), fixedClock(NOW));

    assertEquals(2, cache.current(() -> 0));
  }

  @Test
  void shouldLetExactlyOneConcurrentCallerRefreshStaleCache() throws Exception {
    PartitionCountCache cache =
        new PartitionCountCache("orders", 1, Duration.ofMinutes(5), fixedClock(NOW));
    AtomicInteger fetches = new AtomicInteger();
    int callers = 16;
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(callers);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(
            executor.submit(
                () -> {
                  start.await();
                  return cache.current(
                      () -> {
                        fetches.incrementAndGet();
                        return 4;
                      });
                }));
      }
      start.countDown();
      for (Future<Integer> result : results) {
        int count = result.get(5, TimeUnit.SECONDS);
        assertTrue(count == 1 || count == 4);
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, fetches.get());
    assertEquals(4, cache.cachedCount());
  }

  @Test
  void shouldNotRefreshFreshCacheUnderConcurrency() throws Exception {
    PartitionCountCache cache =
        new PartitionCountCache("orders", 1, Duration.ofMinutes(5), fixedClock(NOW));
    cache.current(() -> 4);
    AtomicInteger fetches = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Future<Integer>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(executor.submit(() -> cache.current(fetches::incrementAndGet)));
      }
      for (Future<Integer> result : results) {
        assertEquals(4, result.get(5, TimeUnit.SECONDS));
      }
    } finally {
      executor.shutdownNow();
    }

    assertEquals(0, fetches.get());
  }

  private static int countingFetch(AtomicInteger fetches, int partitions) {
    fetches.incrementAndGet();
    return partitions;
  }

  private static Clock fixedClock(Instant instant) {
    return Clock.fixed(instant, ZoneOffset.UTC);
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    private void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
