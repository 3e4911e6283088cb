package io.github.themoah.kreg.kafka;

import io.vertx.core.Future;
import io.vertx.kafka.client.producer.KafkaProducer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Live Kafka handles of one named broker: metadata access, a producer and the
 * factory for partition readers.
 */
public class BrokerClient {

  private static final Logger log = LoggerFactory.getLogger(BrokerClient.class);

  private final String name;
  private final MetadataService metadata;
  private final KafkaProducer<String, String> producer;
  private final PartitionReaderFactory readers;

  public BrokerClient(
      String name,
      MetadataService metadata,
      KafkaProducer<String, String> producer,
      PartitionReaderFactory readers) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    this.metadata = Objects.requireNonNull(metadata, "metadata cannot be null");
    this.producer = Objects.requireNonNull(producer, "producer cannot be null");
    this.readers = Objects.requireNonNull(readers, "readers cannot be null");
  }

  public String getName() {
    return name;
  }

  public MetadataService getMetadata() {
    return metadata;
  }

  public KafkaProducer<String, String> getProducer() {
    return producer;
  }

  public PartitionReaderFactory getReaders() {
    return readers;
  }

  /**
   * Closes the producer and the metadata client. Readers are owned by their
   * subscriptions and closed there.
   *
   * @return Future that completes when both clients are closed
   */
  public Future<Void> close() {
    log.info("Closing client bundle for broker {}", name);
    return Future.join(producer.close(), metadata.close())
      .<Void>mapEmpty()
      .onFailure(err -> log.error("Failed to close client bundle for broker {}", name, err));
  }
}
