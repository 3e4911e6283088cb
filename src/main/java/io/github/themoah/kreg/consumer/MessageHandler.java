package io.github.themoah.kreg.consumer;

import io.github.themoah.kreg.model.InboundMessage;
import io.vertx.core.Future;

/**
 * Processes consumed messages.
 *
 * <p>The next message of the same partition is delivered only after the returned
 * future completed successfully. A failed future, or an exception thrown by
 * {@link #handle}, stops consumption of that partition.
 */
@FunctionalInterface
public interface MessageHandler {

  Future<Void> handle(InboundMessage message);

  /**
   * Adapts a synchronous callback. Exceptions thrown by the callback fail the
   * returned future.
   */
  static MessageHandler of(Callback callback) {
    return message -> {
      try {
        callback.accept(message);
        return Future.succeededFuture();
      } catch (Exception e) {
        return Future.failedFuture(e);
      }
    };
  }

  /**
   * Synchronous message callback.
   */
  @FunctionalInterface
  interface Callback {
    void accept(InboundMessage message) throws Exception;
  }
}
