package io.github.themoah.kreg.consumer;

import io.vertx.core.Future;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle on a running fanout consumption. Cancelling it stops every partition worker.
 */
public class ConsumeSubscription {

  private static final Logger log = LoggerFactory.getLogger(ConsumeSubscription.class);

  private final String broker;
  private final String topic;
  private final List<PartitionWorker> workers;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);

  ConsumeSubscription(String broker, String topic, List<PartitionWorker> workers) {
    this.broker = broker;
    this.topic = topic;
    this.workers = List.copyOf(workers);
  }

  public String getBroker() {
    return broker;
  }

  public String getTopic() {
    return topic;
  }

  /**
   * Returns the partitions a worker was started for.
   */
  public List<Integer> partitions() {
    return workers.stream().map(PartitionWorker::getPartition).collect(Collectors.toList());
  }

  /**
   * Returns the number of workers still consuming.
   */
  public int activeWorkers() {
    return (int) workers.stream().filter(PartitionWorker::isRunning).count();
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Stops all workers. May be called from any thread.
   *
   * <p>A handler call already running on a reader's context may still finish. No
   * handler call starts once the returned future completed.
   *
   * @return Future that completes once every partition reader is closed
   */
  public Future<Void> cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Cancelling consumption of topic {} on broker {}", topic, broker);
    }
    List<Future<Void>> closing = workers.stream()
      .map(PartitionWorker::stop)
      .collect(Collectors.toList());
    return Future.join(closing).mapEmpty();
  }
}
