package com.serviceruntime.infra.kafka.consumer;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;

/**
 * In-flight offsets per partition. The committable position of a partition is the lowest offset
 * still in flight, or one past the highest tracked offset once nothing is in flight. Only the
 * driving thread touches an instance.
 */
final class OffsetTracker {
  private final Map<TopicPartition, PartitionOffsets> partitions = new HashMap<>();

  void track(TopicPartition partition, long offset) {
    partitions.computeIfAbsent(partition, ignored -> new PartitionOffsets()).track(offset);
  }

  void complete(TopicPartition partition, long offset) {
    PartitionOffsets offsets = partitions.get(partition);
    if (offsets != null) {
      offsets.pending.remove(offset);
    }
  }

  /** Positions that moved since the last call, marked as committed. */
  Map<TopicPartition, OffsetAndMetadata> takeCommittable() {
    return takeCommittable(partitions.keySet());
  }

  Map<TopicPartition, OffsetAndMetadata> takeCommittable(Collection<TopicPartition> subset) {
    Map<TopicPartition, OffsetAndMetadata> committable = new HashMap<>();
    for (TopicPartition partition : subset) {
      PartitionOffsets offsets = partitions.get(partition);
      if (offsets == null) {
        continue;
      }
      long position = offsets.committablePosition();
      if (position > offsets.committed) {
        offsets.committed = position;
        committable.put(partition, new OffsetAndMetadata(position));
      }
    }
    return committable;
  }

  void forget(Collection<TopicPartition> revoked) {
    revoked.forEach(partitions::remove);
  }

  int inFlight() {
    int count = 0;
    for (PartitionOffsets offsets : partitions.values()) {
      count += offsets.pending.size();
    }
    return count;
  }

  private static final class PartitionOffsets {
    private final TreeSet<Long> pending = new TreeSet<>();
    private long highestTracked = -1L;
    private long committed = -1L;

    private void track(long offset) {
      if (committed < 0) {
        committed = offset;
      }
      pending.add(offset);
      highestTracked = Math.max(highestTracked, offset);
    }

    private long committablePosition() {
      return pending.isEmpty() ? highestTracked + 1 : pending.first();
    }
  }
}
