package io.github.themoah.kreg.registry;

import java.util.Map;

/**
 * Outcome of a registry initialization.
 *
 * @param registry registry holding every broker that connected
 * @param failures failure cause per broker that did not connect
 */
public record InitializationResult(
  ClientRegistry registry,
  Map<String, Throwable> failures
) {

  public InitializationResult {
    failures = Map.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
