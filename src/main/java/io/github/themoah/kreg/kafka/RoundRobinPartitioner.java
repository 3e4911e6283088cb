package io.github.themoah.kreg.kafka;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;

/**
 * Cycles through the partitions of a topic, one record per partition, keyed or not.
 *
 * <p>The producer asks for a partition a second time after {@link #onNewBatch} when a
 * record opens a new batch. That second call returns the partition chosen by the first
 * one, so the cycle advances once per record.
 */
public class RoundRobinPartitioner implements Partitioner {

  private final ConcurrentMap<String, AtomicInteger> counters = new ConcurrentHashMap<>();
  private final ThreadLocal<TopicPartition> pending = new ThreadLocal<>();

  @Override
  public int partition(String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes,
      Cluster cluster) {
    TopicPartition previous = pending.get();
    if (previous != null) {
      pending.remove();
      if (previous.topic().equals(topic)) {
        return previous.partition();
      }
    }

    int next = counters.computeIfAbsent(topic, t -> new AtomicInteger()).getAndIncrement();
    List<PartitionInfo> available = cluster.availablePartitionsForTopic(topic);
    if (!available.isEmpty()) {
      return available.get(Math.floorMod(next, available.size())).partition();
    }
    Integer count = cluster.partitionCountForTopic(topic);
    if (count == null || count < 1) {
      return 0;
    }
    return Math.floorMod(next, count);
  }

  @Override
  @SuppressWarnings("deprecation")
  public void onNewBatch(String topic, Cluster cluster, int prevPartition) {
    pending.set(new TopicPartition(topic, prevPartition));
  }

  @Override
  public void close() {
    pending.remove();
  }

  @Override
  public void configure(Map<String, ?> configs) {}
}
