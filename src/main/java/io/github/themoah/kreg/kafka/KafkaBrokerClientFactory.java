package io.github.themoah.kreg.kafka;

import io.github.themoah.kreg.config.BrokerConfig;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.kafka.admin.KafkaAdminClient;
import io.vertx.kafka.client.producer.KafkaProducer;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds client bundles backed by real Kafka clients.
 * A broker counts as connected once a cluster describe succeeds within the connect timeout.
 */
public class KafkaBrokerClientFactory implements BrokerClientFactory {

  private static final Logger log = LoggerFactory.getLogger(KafkaBrokerClientFactory.class);

  private final Vertx vertx;
  private final long connectTimeoutMs;
  private final BiFunction<String, KafkaSettings, MetadataService> metadataClients;

  public KafkaBrokerClientFactory(Vertx vertx, long connectTimeoutMs) {
    this(vertx, connectTimeoutMs, (name, settings) ->
      new AdminMetadataService(name, KafkaAdminClient.create(vertx, settings.adminProperties())));
  }

  KafkaBrokerClientFactory(
      Vertx vertx, long connectTimeoutMs, BiFunction<String, KafkaSettings, MetadataService> metadataClients) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.connectTimeoutMs = connectTimeoutMs;
    this.metadataClients = Objects.requireNonNull(metadataClients, "metadataClients cannot be null");
  }

  @Override
  public Future<BrokerClient> create(BrokerConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    if (config.addresses().isEmpty()) {
      return Future.failedFuture(
        new IllegalArgumentException("No addresses configured for broker " + config.name()));
    }

    KafkaSettings settings = new KafkaSettings(config);
    log.info("Connecting to broker {} at {}", config.name(), config.bootstrapServers());

    MetadataService metadata;
    try {
      metadata = metadataClients.apply(config.name(), settings);
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }

    return verifyConnection(config.name(), metadata)
      .map(clusterId -> {
        log.info("Broker {} connected, cluster ID: {}", config.name(), clusterId);
        KafkaProducer<String, String> producer = KafkaProducer.create(vertx, settings.producerProperties());
        return new BrokerClient(config.name(), metadata, producer,
          new ConsumerPartitionReaderFactory(vertx, settings));
      })
      .recover(err -> metadata.close()
        .onFailure(closeErr -> log.warn("Failed to release admin client of broker {}", config.name(), closeErr))
        .transform(ignored -> Future.<BrokerClient>failedFuture(err)));
  }

  private Future<String> verifyConnection(String name, MetadataService metadata) {
    Promise<String> promise = Promise.promise();
    long timerId = vertx.setTimer(connectTimeoutMs, id -> promise.tryFail(new TimeoutException(
      "Broker " + name + " did not respond within " + connectTimeoutMs + "ms")));

    metadata.describeCluster().onComplete(ar -> {
      vertx.cancelTimer(timerId);
      if (ar.succeeded()) {
        promise.tryComplete(ar.result());
      } else {
        promise.tryFail(ar.cause());
      }
    });
    return promise.future();
  }
}
