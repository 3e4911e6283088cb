package io.github.themoah.kreg.kafka;

import io.github.themoah.kreg.config.BrokerConfig;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Translates a {@link BrokerConfig} into Kafka client properties.
 *
 * <p>Zero timeouts and a zero request cap leave the Kafka client defaults in place.
 * Client properties from the broker configuration are applied last.
 */
public final class KafkaSettings {

  private final BrokerConfig config;

  public KafkaSettings(BrokerConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
  }

  public BrokerConfig getConfig() {
    return config;
  }

  public Map<String, String> producerProperties() {
    Map<String, String> props = common("producer");
    props.put(ProducerConfig.ACKS_CONFIG, String.valueOf(config.requiredAcks()));
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

    String partitionerClass = partitionerClass();
    if (partitionerClass != null) {
      props.put(ProducerConfig.PARTITIONER_CLASS_CONFIG, partitionerClass);
    }
    if (config.writeTimeoutSeconds() > 0) {
      props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, seconds(config.writeTimeoutSeconds()));
    }
    if (config.maxOpenRequests() > 0) {
      props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION,
        String.valueOf(config.maxOpenRequests()));
    }

    props.putAll(config.clientProperties());
    return props;
  }

  /**
   * Properties of a partition reader. No group id: partitions are assigned manually
   * and offsets are never committed.
   */
  public Map<String, String> consumerProperties() {
    Map<String, String> props = common("consumer");
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.putAll(config.clientProperties());
    return props;
  }

  public Map<String, String> adminProperties() {
    Map<String, String> props = common("admin");
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
    props.putAll(config.clientProperties());
    return props;
  }

  /**
   * Returns the partitioner class name for the configured strategy, or null for the
   * Kafka default.
   */
  String partitionerClass() {
    return switch (config.partitioner()) {
      case RANDOM -> RandomPartitioner.class.getName();
      case ROUND_ROBIN -> RoundRobinPartitioner.class.getName();
      case DEFAULT -> null;
    };
  }

  private Map<String, String> common(String role) {
    Map<String, String> props = new HashMap<>();
    props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, config.bootstrapServers());
    props.put(CommonClientConfigs.CLIENT_ID_CONFIG, "kreg-" + config.name() + "-" + role);
    if (config.readTimeoutSeconds() > 0) {
      props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, seconds(config.readTimeoutSeconds()));
    }
    return props;
  }

  private static String seconds(int seconds) {
    return String.valueOf(seconds * 1000L);
  }
}
