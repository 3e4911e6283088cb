package io.github.themoah.kreg.model;

/**
 * Information about a topic partition.
 *
 * @param leader broker id of the leader, -1 when there is none
 */
public record PartitionInfo(
  String topic,
  int partition,
  int leader
) {}
