package io.github.themoah.kreg.config;

/**
 * Partitioning strategy applied to records sent without an explicit partition.
 */
public enum PartitionerType {
  /** Kafka client default: key hash for keyed records. */
  DEFAULT(0),
  RANDOM(1),
  ROUND_ROBIN(2);

  private final int code;

  PartitionerType(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  /**
   * Resolves the configured selector. Unknown codes fall back to {@link #DEFAULT}.
   *
   * @param code selector value from configuration
   * @return the matching partitioner type
   */
  public static PartitionerType fromCode(int code) {
    return switch (code) {
      case 1 -> RANDOM;
      case 2 -> ROUND_ROBIN;
      default -> DEFAULT;
    };
  }
}
