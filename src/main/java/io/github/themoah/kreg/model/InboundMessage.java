package io.github.themoah.kreg.model;

import java.nio.charset.StandardCharsets;

/**
 * A message read from a topic partition.
 */
public record InboundMessage(
  String topic,
  int partition,
  long offset,
  String key,
  String value,
  long timestamp
) {

  /**
   * Returns the payload as UTF-8 bytes, empty for null values.
   */
  public byte[] payload() {
    return value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8);
  }
}
