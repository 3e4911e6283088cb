package io.github.themoah.kreg.registry;

import java.util.Map;

/**
 * Thrown when an all-or-nothing registry initialization has failing brokers.
 */
public class RegistryInitializationException extends RuntimeException {

  private final Map<String, Throwable> failures;

  public RegistryInitializationException(Map<String, Throwable> failures) {
    super("Failed to connect to brokers: " + failures.keySet());
    this.failures = Map.copyOf(failures);
    failures.values().forEach(this::addSuppressed);
  }

  /**
   * Returns the failure cause of each broker that could not connect.
   */
  public Map<String, Throwable> getFailures() {
    return failures;
  }
}
