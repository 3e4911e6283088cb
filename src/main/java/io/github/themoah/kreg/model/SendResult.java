package io.github.themoah.kreg.model;

/**
 * Position the broker assigned to an acknowledged message.
 */
public record SendResult(
  String topic,
  int partition,
  long offset
) {}
