package io.github.themoah.kreg.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import io.micrometer.core.instrument.logging.LoggingRegistryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private MicrometerConfig() {}

  /**
   * Creates a registry that periodically writes all meters to the log.
   *
   * @param step publishing interval
   */
  public static MeterRegistry createLoggingRegistry(Duration step) {
    log.info("Creating logging meter registry with step {}", step);
    LoggingRegistryConfig config = new LoggingRegistryConfig() {
      @Override
      public Duration step() {
        return step;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };
    return LoggingMeterRegistry.builder(config).build();
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "logging" or "simple"
   * @param step publishing interval for registries that push
   * @return the registry, or null for unknown types
   */
  public static MeterRegistry createRegistry(String reporterType, Duration step) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase(Locale.ROOT)) {
      case "logging" -> createLoggingRegistry(step);
      case "simple" -> new SimpleMeterRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
