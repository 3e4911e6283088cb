package io.github.themoah.kreg.consumer;

import io.github.themoah.kreg.kafka.BrokerClient;
import io.github.themoah.kreg.metrics.MetricsReporter;
import io.github.themoah.kreg.model.PartitionInfo;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes every partition of a topic concurrently, one worker per partition,
 * starting from the newest offset of each partition.
 *
 * <p>No consumer group is involved: each subscription sees every new message.
 */
public class ConsumerFanout {

  private static final Logger log = LoggerFactory.getLogger(ConsumerFanout.class);

  private final ClientRegistry registry;
  private final MetricsReporter metrics;

  public ConsumerFanout(ClientRegistry registry) {
    this(registry, MetricsReporter.noop());
  }

  public ConsumerFanout(ClientRegistry registry, MetricsReporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Starts consuming {@code topic} on the named broker.
   *
   * <p>Partitions whose newest offset cannot be fetched, or whose reader cannot be
   * opened, are skipped. Errors raised while consuming are only logged.
   *
   * @param broker the broker name
   * @param topic the topic name
   * @param handler applied to every message
   * @return Future containing the subscription once all workers are started, failed if
   *     the broker is unknown or the partitions of the topic cannot be listed
   */
  public Future<ConsumeSubscription> consume(String broker, String topic, MessageHandler handler) {
    Objects.requireNonNull(topic, "topic cannot be null");
    Objects.requireNonNull(handler, "handler cannot be null");

    return registry.find(broker)
      .compose(client -> client.getMetadata().listPartitions(topic)
        .compose(partitions -> startWorkers(client, topic, partitions, handler)))
      .onFailure(err -> log.error("Failed to start consumer: broker={}, topic={}", broker, topic, err));
  }

  private Future<ConsumeSubscription> startWorkers(
      BrokerClient client, String topic, List<PartitionInfo> partitions, MessageHandler handler) {

    List<Future<PartitionWorker>> opening = partitions.stream()
      .map(partition -> openWorker(client, topic, partition.partition(), handler))
      .collect(Collectors.toList());

    return Future.join(opening).transform(ignored -> {
      List<PartitionWorker> workers = new ArrayList<>();
      for (Future<PartitionWorker> attempt : opening) {
        if (attempt.succeeded()) {
          workers.add(attempt.result());
        }
      }
      ConsumeSubscription subscription = new ConsumeSubscription(client.getName(), topic, workers);
      workers.forEach(PartitionWorker::start);

      if (workers.size() < partitions.size()) {
        log.warn("Consuming {} of {} partitions of topic {} on broker {}",
          workers.size(), partitions.size(), topic, client.getName());
      } else {
        log.info("Consuming {} partitions of topic {} on broker {}",
          workers.size(), topic, client.getName());
      }
      return Future.succeededFuture(subscription);
    });
  }

  private Future<PartitionWorker> openWorker(
      BrokerClient client, String topic, int partition, MessageHandler handler) {

    return client.getMetadata().newestOffset(topic, partition)
      .onFailure(err -> log.info("get offset failed for {}-{} on broker {}: {}",
        topic, partition, client.getName(), err.getMessage()))
      .compose(offset -> client.getReaders().open(topic, partition, offset)
        .onFailure(err -> log.info("create partition consumer failed for {}-{} on broker {}: {}",
          topic, partition, client.getName(), err.getMessage())))
      .map(reader -> new PartitionWorker(client.getName(), topic, partition, reader, handler, metrics));
  }
}
