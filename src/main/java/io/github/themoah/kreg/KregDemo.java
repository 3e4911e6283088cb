package io.github.themoah.kreg;

import io.github.themoah.kreg.consumer.ConsumeSubscription;
import io.github.themoah.kreg.consumer.ConsumerFanout;
import io.github.themoah.kreg.consumer.MessageHandler;
import io.github.themoah.kreg.metrics.MetricsReporter;
import io.github.themoah.kreg.producer.MessageProducer;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.vertx.core.Future;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends {@code hello world <i>} messages to a topic, then tails the topic and logs
 * every message that arrives. Failures are logged and never fail the caller.
 */
class KregDemo {

  private static final Logger log = LoggerFactory.getLogger(KregDemo.class);

  private final ClientRegistry registry;
  private final MetricsReporter metrics;

  KregDemo(ClientRegistry registry, MetricsReporter metrics) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  /**
   * Runs the demo against {@code topic} on the named broker.
   *
   * @return Future containing the demo subscription, or null if consuming could not start
   */
  Future<ConsumeSubscription> run(String broker, String topic, int messageCount) {
    MessageProducer producer = new MessageProducer(registry, metrics);
    ConsumerFanout fanout = new ConsumerFanout(registry, metrics);

    Future<Void> sends = Future.succeededFuture();
    for (int i = 0; i < messageCount; i++) {
      String value = "hello world " + i;
      sends = sends.compose(v -> producer.send(broker, topic, value)
        .<Void>mapEmpty()
        .otherwiseEmpty());
    }

    return sends
      .compose(v -> fanout.consume(broker, topic, MessageHandler.of(message ->
        log.info("consume message: partition={}, offset={}, value={}",
          message.partition(), message.offset(), message.value()))))
      .onFailure(err -> log.error("Failed to start consumer for demo topic {}: {}", topic, err.getMessage()))
      .otherwiseEmpty();
  }
}
