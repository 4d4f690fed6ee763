package com.serviceruntime.infra.kafka.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.Test;

class OffsetTrackerTest {
  private static final TopicPartition P0 = new TopicPartition("orders", 0);
  private static final TopicPartition P1 = new TopicPartition("orders", 1);

  @Test
  void shouldHoldPositionAtLowestInFlightOffset() {
    OffsetTracker tracker = new OffsetTracker();
    tracker.track(P0, 10);
    tracker.track(P0, 11);
    tracker.track(P0, 12);

    tracker.complete(P0, 11);
    tracker.complete(P0, 12);
    assertTrue(tracker.takeCommittable().isEmpty());
    assertEquals(1, tracker.inFlight());

    tracker.complete(P0, 10);
    assertEquals(Map.of(P0, new OffsetAndMetadata(13)), tracker.takeCommittable());
    assertEquals(0, tracker.inFlight());
  }

  @Test
  void shouldReportEachPositionOnce() {
    OffsetTracker tracker = new OffsetTracker();
    tracker.track(P0, 0);
    tracker.track(P0, 1);
    tracker.complete(P0, 0);

    assertEquals(Map.of(P0, new OffsetAndMetadata(1)), tracker.takeCommittable());
    assertTrue(tracker.takeCommittable().isEmpty());

    tracker.complete(P0, 1);
    assertEquals(Map.of(P0, new OffsetAndMetadata(2)), tracker.takeCommittable());
  }

  @Test
  void shouldRestrictCommittableOffsetsToRequestedPartitions() {
    OffsetTracker tracker = new OffsetTracker();
    tracker.track(P0, 4);
    tracker.track(P1, 8);
    tracker.complete(P0, 4);
    tracker.complete(P1, 8);

    assertEquals(Map.of(P1, new OffsetAndMetadata(9)), tracker.takeCommittable(List.of(P1)));
    assertEquals(Map.of(P0, new OffsetAndMetadata(5)), tracker.takeCommittable());
  }

  @Test
  void shouldDropStateOfForgottenPartitions() {
    OffsetTracker tracker = new OffsetTracker();
    tracker.track(P0, 3);
    tracker.track(P1, 3);

    tracker.forget(List.of(P0));
    tracker.complete(P0, 3);

    assertEquals(1, tracker.inFlight());
    assertTrue(tracker.takeCommittable().isEmpty());
  }
}
