package io.github.themoah.kreg.kafka;

import io.github.themoah.kreg.model.PartitionInfo;
import io.vertx.core.Future;
import java.util.List;

/**
 * Cluster metadata operations of one broker.
 * All methods return Vert.x Futures for async, non-blocking execution.
 */
public interface MetadataService {

  /**
   * Gets partition information for a specific topic.
   *
   * @param topic the topic name
   * @return Future containing the partitions of the topic, ordered by partition id
   */
  Future<List<PartitionInfo>> listPartitions(String topic);

  /**
   * Gets the newest offset of a partition, the offset the next produced message gets.
   *
   * @param topic the topic name
   * @param partition the partition id
   * @return Future containing the log end offset
   */
  Future<Long> newestOffset(String topic, int partition);

  /**
   * Describes the Kafka cluster (lightweight connectivity check).
   *
   * @return Future containing cluster ID
   */
  Future<String> describeCluster();

  /**
   * Closes the underlying admin client and releases resources.
   *
   * @return Future that completes when the client is closed
   */
  Future<Void> close();
}
