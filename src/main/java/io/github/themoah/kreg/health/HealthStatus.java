package io.github.themoah.kreg.health;

/**
 * Connection state of a registered broker as seen by the last heartbeat.
 */
public enum HealthStatus {
  UP,
  DOWN;

  public boolean isUp() {
    return this == UP;
  }

  /**
   * Maps the outcome of a heartbeat onto a status.
   */
  public static HealthStatus of(boolean reachable) {
    return reachable ? UP : DOWN;
  }
}
