package io.github.themoah.kreg.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A message about to be sent.
 *
 * @param topic target topic
 * @param value message payload
 * @param key partition key, null when the partitioner picks the partition
 * @param timestamp creation time of the message
 */
public record OutboundMessage(
  String topic,
  String value,
  String key,
  Instant timestamp
) {

  public OutboundMessage {
    Objects.requireNonNull(topic, "topic cannot be null");
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
  }

  /**
   * Creates a message stamped with the current time. Empty keys are dropped.
   */
  public static OutboundMessage of(String topic, String value, String partitionKey) {
    String key = (partitionKey == null || partitionKey.isEmpty()) ? null : partitionKey;
    return new OutboundMessage(topic, value, key, Instant.now());
  }

  public boolean hasKey() {
    return key != null;
  }
}
