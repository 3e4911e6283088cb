package io.github.themoah.kreg.config;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Settings of one named broker.
 *
 * @param name logical broker name used for lookups
 * @param addresses bootstrap addresses ({@code host:port})
 * @param requiredAcks acknowledgment requirement, passed to the producer verbatim
 * @param partitioner partitioning strategy for records without a key
 * @param readTimeoutSeconds network read timeout in seconds (0 = client default)
 * @param writeTimeoutSeconds send blocking timeout in seconds (0 = client default)
 * @param maxOpenRequests max in-flight requests per connection (0 = client default)
 * @param clientProperties extra Kafka client properties copied into every client
 */
public record BrokerConfig(
  String name,
  List<String> addresses,
  int requiredAcks,
  PartitionerType partitioner,
  int readTimeoutSeconds,
  int writeTimeoutSeconds,
  int maxOpenRequests,
  Map<String, String> clientProperties
) {

  public static final int DEFAULT_REQUIRED_ACKS = 1;

  public BrokerConfig {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(addresses, "addresses cannot be null");
    addresses = List.copyOf(addresses);
    partitioner = partitioner == null ? PartitionerType.DEFAULT : partitioner;
    clientProperties = clientProperties == null ? Map.of() : Map.copyOf(clientProperties);
  }

  /**
   * Returns the addresses joined the way {@code bootstrap.servers} expects them.
   */
  public String bootstrapServers() {
    return String.join(",", addresses);
  }

  /**
   * Splits a comma separated address list, trimming entries and dropping blanks.
   *
   * @param addressList the raw address list
   * @return the parsed addresses
   */
  public static List<String> parseAddresses(String addressList) {
    if (addressList == null || addressList.isBlank()) {
      return List.of();
    }
    return Arrays.stream(addressList.split(","))
      .map(String::trim)
      .filter(address -> !address.isEmpty())
      .collect(Collectors.toList());
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public static class Builder {

    private final String name;
    private List<String> addresses = List.of();
    private int requiredAcks = DEFAULT_REQUIRED_ACKS;
    private PartitionerType partitioner = PartitionerType.DEFAULT;
    private int readTimeoutSeconds;
    private int writeTimeoutSeconds;
    private int maxOpenRequests;
    private final Map<String, String> clientProperties = new HashMap<>();

    private Builder(String name) {
      this.name = Objects.requireNonNull(name, "name cannot be null");
    }

    public Builder address(String addressList) {
      this.addresses = parseAddresses(addressList);
      return this;
    }

    public Builder requiredAcks(int requiredAcks) {
      this.requiredAcks = requiredAcks;
      return this;
    }

    public Builder partitioner(PartitionerType partitioner) {
      this.partitioner = Objects.requireNonNull(partitioner, "partitioner cannot be null");
      return this;
    }

    public Builder readTimeoutSeconds(int readTimeoutSeconds) {
      this.readTimeoutSeconds = readTimeoutSeconds;
      return this;
    }

    public Builder writeTimeoutSeconds(int writeTimeoutSeconds) {
      this.writeTimeoutSeconds = writeTimeoutSeconds;
      return this;
    }

    public Builder maxOpenRequests(int maxOpenRequests) {
      this.maxOpenRequests = maxOpenRequests;
      return this;
    }

    public Builder property(String key, String value) {
      this.clientProperties.put(key, value);
      return this;
    }

    public BrokerConfig build() {
      return new BrokerConfig(name, addresses, requiredAcks, partitioner,
        readTimeoutSeconds, writeTimeoutSeconds, maxOpenRequests, clientProperties);
    }
  }
}
