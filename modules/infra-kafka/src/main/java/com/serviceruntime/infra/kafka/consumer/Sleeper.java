package com.serviceruntime.infra.kafka.consumer;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = duration -> Thread.sleep(Math.max(0L, duration.toMillis()));

  void sleep(Duration duration) throws InterruptedException;
}
