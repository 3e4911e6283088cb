package io.github.themoah.kreg.kafka;

import io.vertx.core.Future;
import io.vertx.kafka.client.consumer.KafkaConsumer;

/**
 * Opens one dedicated reader per topic partition.
 */
@FunctionalInterface
public interface PartitionReaderFactory {

  /**
   * Opens a reader assigned to a single partition and positioned at {@code offset}.
   * No handler is set on the returned consumer, so it does not poll yet.
   *
   * @param topic the topic name
   * @param partition the partition id
   * @param offset the offset of the first message to read
   * @return Future containing the positioned consumer
   */
  Future<KafkaConsumer<String, String>> open(String topic, int partition, long offset);
}
