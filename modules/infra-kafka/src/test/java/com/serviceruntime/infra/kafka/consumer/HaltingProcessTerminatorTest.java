package com.serviceruntime.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class HaltingProcessTerminatorTest {
  @Test
  void shouldWaitGracePeriodThenHaltWithConfiguredStatus() {
    List<Duration> slept = new ArrayList<>();
    List<Integer> halted = new ArrayList<>();
    HaltingProcessTerminator terminator =
        new HaltingProcessTerminator(Duration.ofSeconds(2), 3, slept::add, halted::add);

    terminator.terminate("stream exhausted", new IllegalStateException("gone"));

    assertEquals(List.of(Duration.ofSeconds(2)), slept);
    assertEquals(List.of(3), halted);
  }

  @Test
  void shouldSleepRemainingGraceAfterInterruptThenHalt() {
    List<Duration> slept = new ArrayList<>();
    List<Integer> halted = new ArrayList<>();
    AtomicBoolean interruptedOnce = new AtomicBoolean();
    HaltingProcessTerminator terminator =
        new HaltingProcessTerminator(
            Duration.ofSeconds(30),
            1,
            duration -> {
              if (interruptedOnce.compareAndSet(false, true)) {
                throw new InterruptedException("worker pool shutting down");
              }
              slept.add(duration);
            },
            halted::add);

    try {
      terminator.terminate("fatal", null);

      assertEquals(1, slept.size());
      assertTrue(slept.get(0).compareTo(Duration.ofSeconds(29)) > 0);
      assertTrue(slept.get(0).compareTo(Duration.ofSeconds(30)) <= 0);
      assertEquals(List.of(1), halted);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void shouldHaltImmediatelyWithoutGracePeriod() {
    List<Duration> slept = new ArrayList<>();
    List<Integer> halted = new ArrayList<>();

    new HaltingProcessTerminator(Duration.ZERO, 2, slept::add, halted::add).terminate("fatal", null);

    assertTrue(slept.isEmpty());
    assertEquals(List.of(2), halted);
  }
}
