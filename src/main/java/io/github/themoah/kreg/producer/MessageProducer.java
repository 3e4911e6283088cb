package io.github.themoah.kreg.producer;

import io.github.themoah.kreg.kafka.BrokerClient;
import io.github.themoah.kreg.metrics.MetricsReporter;
import io.github.themoah.kreg.model.OutboundMessage;
import io.github.themoah.kreg.model.SendResult;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.vertx.core.Future;
import io.vertx.kafka.client.producer.KafkaProducerRecord;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends single messages through the producer of a named broker.
 * Every returned future completes only once the broker acknowledged the message.
 */
public class MessageProducer {

  private static final Logger log = LoggerFactory.getLogger(MessageProducer.class);

  private final ClientRegistry registry;
  private final MetricsReporter metrics;

  public MessageProducer(ClientRegistry registry) {
    this(registry, MetricsReporter.noop());
  }

  public MessageProducer(ClientRegistry registry, MetricsReporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Sends a message without a key; the configured partitioner picks the partition.
   *
   * @param broker the broker name
   * @param topic the topic name
   * @param value the message payload
   * @return Future containing the assigned partition and offset
   */
  public Future<SendResult> send(String broker, String topic, String value) {
    return send(broker, topic, value, null);
  }

  /**
   * Sends a message with a partition key. An empty or null key is treated as no key.
   *
   * @param broker the broker name
   * @param topic the topic name
   * @param value the message payload
   * @param partitionKey the partition key
   * @return Future containing the assigned partition and offset, failed with the
   *     producer's error if the send fails or BrokerNotFoundException for unknown brokers
   */
  public Future<SendResult> send(String broker, String topic, String value, String partitionKey) {
    Objects.requireNonNull(topic, "topic cannot be null");
    return send(broker, OutboundMessage.of(topic, value, partitionKey));
  }

  /**
   * Sends a prepared message.
   *
   * @param broker the broker name
   * @param message the message
   * @return Future containing the assigned partition and offset
   */
  public Future<SendResult> send(String broker, OutboundMessage message) {
    Objects.requireNonNull(message, "message cannot be null");
    String topic = message.topic();

    return registry.find(broker)
      .compose(client -> send(client, message))
      .onSuccess(result -> {
        metrics.messageSent(broker, topic);
        log.debug("send message success: broker={}, topic={}, partition={}, offset={}",
          broker, topic, result.partition(), result.offset());
      })
      .onFailure(err -> {
        metrics.sendFailed(broker, topic);
        log.error("Failed to send message: broker={}, topic={}", broker, topic, err);
      });
  }

  private Future<SendResult> send(BrokerClient client, OutboundMessage message) {
    KafkaProducerRecord<String, String> record = KafkaProducerRecord.create(
      message.topic(), message.key(), message.value(), message.timestamp().toEpochMilli(), null);

    return client.getProducer().send(record)
      .map(metadata -> new SendResult(message.topic(), metadata.getPartition(), metadata.getOffset()));
  }
}
