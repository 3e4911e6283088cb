package io.github.themoah.kreg.registry;

/**
 * Thrown when no client bundle is registered under a broker name.
 */
public class BrokerNotFoundException extends RuntimeException {

  private final String brokerName;

  public BrokerNotFoundException(String brokerName) {
    super("Broker not found: " + brokerName);
    this.brokerName = brokerName;
  }

  public String getBrokerName() {
    return brokerName;
  }
}
