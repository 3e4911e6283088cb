package io.github.themoah.kreg.consumer;

import io.github.themoah.kreg.metrics.MetricsReporter;
import io.github.themoah.kreg.model.InboundMessage;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import io.vertx.kafka.client.consumer.KafkaConsumerRecord;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one partition and hands its messages, one at a time and in offset order,
 * to a handler. Owns the partition reader and closes it exactly once.
 */
public class PartitionWorker {

  private static final Logger log = LoggerFactory.getLogger(PartitionWorker.class);

  private final String broker;
  private final String topic;
  private final int partition;
  private final KafkaConsumer<String, String> reader;
  private final MessageHandler handler;
  private final MetricsReporter metrics;
  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private final Promise<Void> closed = Promise.promise();

  PartitionWorker(
      String broker,
      String topic,
      int partition,
      KafkaConsumer<String, String> reader,
      MessageHandler handler,
      MetricsReporter metrics) {
    this.broker = broker;
    this.topic = topic;
    this.partition = partition;
    this.reader = Objects.requireNonNull(reader, "reader cannot be null");
    this.handler = Objects.requireNonNull(handler, "handler cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
  }

  public int getPartition() {
    return partition;
  }

  public boolean isRunning() {
    return started.get() && !stopped.get();
  }

  /**
   * Completes once the reader has been closed.
   */
  public Future<Void> closed() {
    return closed.future();
  }

  void start() {
    if (!started.compareAndSet(false, true) || stopped.get()) {
      return;
    }
    metrics.workersChanged(broker, topic, 1);
    reader.exceptionHandler(err -> {
      log.error("Reader failed for {}-{} on broker {}, stopping", topic, partition, broker, err);
      stop();
    });
    reader.handler(this::deliver);
    log.debug("Started consuming {}-{} on broker {}", topic, partition, broker);
  }

  /**
   * Stops delivery and closes the reader. Safe to call more than once and from any thread.
   *
   * @return Future that completes once the reader is closed
   */
  Future<Void> stop() {
    if (stopped.compareAndSet(false, true)) {
      if (started.get()) {
        metrics.workersChanged(broker, topic, -1);
      }
      reader.close().onComplete(ar -> {
        if (ar.failed()) {
          log.info("close partition reader failed for {}-{}", topic, partition, ar.cause());
        } else {
          log.debug("Closed reader for {}-{} on broker {}", topic, partition, broker);
        }
        closed.complete();
      });
    }
    return closed.future();
  }

  private void deliver(KafkaConsumerRecord<String, String> record) {
    if (stopped.get()) {
      return;
    }
    reader.pause();

    InboundMessage message = new InboundMessage(record.topic(), record.partition(), record.offset(),
      record.key(), record.value(), record.timestamp());

    // stop() may run on another thread while this delivery was being prepared
    if (stopped.get()) {
      return;
    }

    Future<Void> result;
    try {
      result = handler.handle(message);
    } catch (Throwable e) {
      log.error("panic occurred while consuming kafka messages from {}-{} at offset {}",
        topic, partition, record.offset(), e);
      metrics.handlerFailed(broker, topic);
      stop();
      if (e instanceof VirtualMachineError) {
        throw (VirtualMachineError) e;
      }
      return;
    }

    if (result == null) {
      result = Future.succeededFuture();
    }
    result.onComplete(ar -> {
      if (ar.failed()) {
        log.warn("Handler failed for {}-{} at offset {}, stopping partition: {}",
          topic, partition, record.offset(), ar.cause().getMessage());
        metrics.handlerFailed(broker, topic);
        stop();
      } else {
        metrics.messageConsumed(broker, topic);
        if (!stopped.get()) {
          reader.resume();
        }
      }
    });
  }
}
