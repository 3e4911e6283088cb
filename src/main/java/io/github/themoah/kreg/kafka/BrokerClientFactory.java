package io.github.themoah.kreg.kafka;

import io.github.themoah.kreg.config.BrokerConfig;
import io.vertx.core.Future;

/**
 * Creates connected client bundles.
 */
@FunctionalInterface
public interface BrokerClientFactory {

  /**
   * Connects to the broker and builds its client bundle.
   *
   * @param config the broker settings
   * @return Future containing the bundle, failed if the broker cannot be reached
   */
  Future<BrokerClient> create(BrokerConfig config);
}
