package io.github.themoah.kreg.metrics;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics configuration loaded from environment variables.
 *
 * @param reporterType registry type ("logging", "simple"), null disables metrics
 * @param step publishing interval of push registries
 * @param jvmMetricsEnabled whether JVM metrics are bound to the registry
 */
public record MetricsConfig(
  String reporterType,
  Duration step,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final long DEFAULT_STEP_MS = 60_000L;

  public boolean isEnabled() {
    return reporterType != null && !reporterType.isBlank();
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - logging or simple (default: unset, metrics disabled)</li>
   *   <li>METRICS_STEP_MS - publishing interval in milliseconds (default: 60000)</li>
   *   <li>METRICS_JVM_ENABLED - bind JVM metrics (default: false)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    String reporter = System.getenv("METRICS_REPORTER");
    long stepMs = DEFAULT_STEP_MS;
    String stepValue = System.getenv("METRICS_STEP_MS");
    if (stepValue != null && !stepValue.isBlank()) {
      try {
        stepMs = Long.parseLong(stepValue);
      } catch (NumberFormatException e) {
        log.warn("Invalid value for METRICS_STEP_MS: '{}', using default: {}", stepValue, DEFAULT_STEP_MS);
      }
    }
    boolean jvm = "true".equalsIgnoreCase(System.getenv("METRICS_JVM_ENABLED"));

    log.info("Metrics config: reporter={}, stepMs={}, jvmMetrics={}", reporter, stepMs, jvm);
    return new MetricsConfig(reporter, Duration.ofMillis(stepMs), jvm);
  }
}
