package io.github.themoah.kreg.metrics;

/**
 * Interface for reporting producer and consumer activity to external systems.
 * Every method defaults to a no-op.
 */
public interface MetricsReporter {

  /**
   * Returns a reporter that records nothing.
   */
  static MetricsReporter noop() {
    return new MetricsReporter() {};
  }

  /**
   * Records a message acknowledged by the broker.
   */
  default void messageSent(String broker, String topic) {}

  /**
   * Records a send that failed.
   */
  default void sendFailed(String broker, String topic) {}

  /**
   * Records a message handed to a consumer handler that completed successfully.
   */
  default void messageConsumed(String broker, String topic) {}

  /**
   * Records a handler failure that stopped a partition worker.
   */
  default void handlerFailed(String broker, String topic) {}

  /**
   * Records a change in the number of running partition workers.
   *
   * @param delta +1 when a worker starts, -1 when it stops
   */
  default void workersChanged(String broker, String topic, int delta) {}
}
