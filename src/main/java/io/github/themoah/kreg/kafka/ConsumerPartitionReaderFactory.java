package io.github.themoah.kreg.kafka;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.kafka.client.common.TopicPartition;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a Vert.x Kafka consumer per partition from the broker's consumer settings.
 */
public class ConsumerPartitionReaderFactory implements PartitionReaderFactory {

  private static final Logger log = LoggerFactory.getLogger(ConsumerPartitionReaderFactory.class);

  private final Supplier<KafkaConsumer<String, String>> consumers;

  public ConsumerPartitionReaderFactory(Vertx vertx, KafkaSettings settings) {
    Objects.requireNonNull(vertx, "vertx cannot be null");
    Map<String, String> consumerProperties = Objects.requireNonNull(settings, "settings cannot be null")
      .consumerProperties();
    this.consumers = () -> KafkaConsumer.create(vertx, consumerProperties);
  }

  /**
   * Creates a factory drawing a fresh consumer from {@code consumers} for every partition.
   *
   * @param consumers supplies unassigned consumers
   */
  public ConsumerPartitionReaderFactory(Supplier<KafkaConsumer<String, String>> consumers) {
    this.consumers = Objects.requireNonNull(consumers, "consumers cannot be null");
  }

  @Override
  public Future<KafkaConsumer<String, String>> open(String topic, int partition, long offset) {
    TopicPartition tp = new TopicPartition(topic, partition);
    KafkaConsumer<String, String> consumer;
    try {
      consumer = consumers.get();
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }

    return consumer.assign(tp)
      .compose(v -> consumer.seek(tp, offset))
      .map(v -> {
        log.debug("Opened reader for {}-{} at offset {}", topic, partition, offset);
        return consumer;
      })
      .recover(err -> consumer.close()
        .transform(ignored -> Future.<KafkaConsumer<String, String>>failedFuture(err)));
  }
}
