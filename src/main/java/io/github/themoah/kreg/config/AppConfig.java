package io.github.themoah.kreg.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param healthCheckIntervalMs broker health check interval in milliseconds
 * @param demoBroker broker used by the demo producer and consumer
 * @param demoTopic topic of the demo run, demo disabled when blank
 * @param demoMessageCount number of messages the demo sends
 */
public record AppConfig(
  long healthCheckIntervalMs,
  String demoBroker,
  String demoTopic,
  int demoMessageCount
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final long DEFAULT_HEALTH_CHECK_INTERVAL_MS = 30_000L;
  private static final String DEFAULT_DEMO_BROKER = "default";
  private static final int DEFAULT_DEMO_MESSAGE_COUNT = 10;

  /**
   * Returns true if a demo topic is configured.
   */
  public boolean isDemoEnabled() {
    return demoTopic != null && !demoTopic.isBlank();
  }

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    long interval = getEnvLong("KAFKA_HEALTH_CHECK_INTERVAL_MS", DEFAULT_HEALTH_CHECK_INTERVAL_MS);
    String demoBroker = System.getenv().getOrDefault("DEMO_BROKER", DEFAULT_DEMO_BROKER);
    String demoTopic = System.getenv("DEMO_TOPIC");
    int demoCount = getEnvInt("DEMO_MESSAGE_COUNT", DEFAULT_DEMO_MESSAGE_COUNT);

    log.info("AppConfig loaded: healthCheckIntervalMs={}, demoBroker={}, demoTopic={}",
      interval, demoBroker, demoTopic);
    return new AppConfig(interval, demoBroker, demoTopic, demoCount);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
