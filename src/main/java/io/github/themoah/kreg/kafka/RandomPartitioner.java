package io.github.themoah.kreg.kafka;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import org.apache.kafka.clients.producer.Partitioner;
import org.apache.kafka.common.Cluster;
import org.apache.kafka.common.PartitionInfo;

/**
 * Picks a random partition for every record, keyed or not.
 * Prefers partitions that currently have a leader.
 */
public class RandomPartitioner implements Partitioner {

  @Override
  public int partition(String topic, Object key, byte[] keyBytes, Object value, byte[] valueBytes,
      Cluster cluster) {
    List<PartitionInfo> available = cluster.availablePartitionsForTopic(topic);
    if (!available.isEmpty()) {
      return available.get(ThreadLocalRandom.current().nextInt(available.size())).partition();
    }
    Integer count = cluster.partitionCountForTopic(topic);
    if (count == null || count < 1) {
      return 0;
    }
    return ThreadLocalRandom.current().nextInt(count);
  }

  @Override
  public void close() {}

  @Override
  public void configure(Map<String, ?> configs) {}
}
