package io.github.themoah.kreg.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend.
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  static final String MESSAGES_SENT = "kreg.producer.messages.sent";
  static final String SEND_FAILURES = "kreg.producer.send.failures";
  static final String MESSAGES_CONSUMED = "kreg.consumer.messages.consumed";
  static final String HANDLER_FAILURES = "kreg.consumer.handler.failures";
  static final String ACTIVE_WORKERS = "kreg.consumer.partition.workers";

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> workerGauges = new ConcurrentHashMap<>();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
  }

  @Override
  public void messageSent(String broker, String topic) {
    registry.counter(MESSAGES_SENT, tags(broker, topic)).increment();
  }

  @Override
  public void sendFailed(String broker, String topic) {
    registry.counter(SEND_FAILURES, tags(broker, topic)).increment();
  }

  @Override
  public void messageConsumed(String broker, String topic) {
    registry.counter(MESSAGES_CONSUMED, tags(broker, topic)).increment();
  }

  @Override
  public void handlerFailed(String broker, String topic) {
    registry.counter(HANDLER_FAILURES, tags(broker, topic)).increment();
  }

  @Override
  public void workersChanged(String broker, String topic, int delta) {
    String key = broker + ":" + topic;
    AtomicLong value = workerGauges.computeIfAbsent(key, k -> {
      AtomicLong holder = new AtomicLong(0);
      Gauge.builder(ACTIVE_WORKERS, holder, AtomicLong::get)
        .tags(tags(broker, topic))
        .register(registry);
      log.debug("Registered worker gauge for {}", k);
      return holder;
    });
    value.addAndGet(delta);
  }

  private static Tags tags(String broker, String topic) {
    return Tags.of("broker", broker, "topic", topic);
  }
}
