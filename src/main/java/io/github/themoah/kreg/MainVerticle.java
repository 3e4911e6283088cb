package io.github.themoah.kreg;

import io.github.themoah.kreg.config.AppConfig;
import io.github.themoah.kreg.config.RegistryConfig;
import io.github.themoah.kreg.consumer.ConsumeSubscription;
import io.github.themoah.kreg.health.BrokerHealthMonitor;
import io.github.themoah.kreg.kafka.KafkaBrokerClientFactory;
import io.github.themoah.kreg.metrics.MetricsConfig;
import io.github.themoah.kreg.metrics.MetricsReporter;
import io.github.themoah.kreg.metrics.MicrometerConfig;
import io.github.themoah.kreg.metrics.MicrometerReporter;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for kreg.
 * Initializes the client registry and health monitoring, then runs the demo when configured.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private ClientRegistry registry;
  private BrokerHealthMonitor healthMonitor;
  private MeterRegistry meterRegistry;
  private ConsumeSubscription demoSubscription;

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting kreg MainVerticle");

    AppConfig appConfig = AppConfig.fromEnvironment();
    MetricsConfig metricsConfig = MetricsConfig.fromEnvironment();
    RegistryConfig registryConfig = loadRegistryConfig();
    MetricsReporter metrics = createMetricsReporter(metricsConfig);

    ClientRegistry.initialize(registryConfig,
        new KafkaBrokerClientFactory(vertx, registryConfig.getConnectTimeoutMs()))
      .compose(result -> {
        registry = result.registry();
        healthMonitor = new BrokerHealthMonitor(vertx, registry, appConfig.healthCheckIntervalMs());
        return healthMonitor.start();
      })
      .compose(v -> runDemo(appConfig, metrics))
      .onSuccess(v -> {
        log.info("kreg started with brokers {}", registry.brokerNames());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start kreg", err);
        releaseResources().onComplete(ar -> startPromise.fail(err));
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping kreg MainVerticle");

    releaseResources()
      .onSuccess(v -> {
        log.info("kreg stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during kreg shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Runs the demo when a demo topic is configured. Never fails startup.
   */
  private Future<Void> runDemo(AppConfig appConfig, MetricsReporter metrics) {
    if (!appConfig.isDemoEnabled()) {
      return Future.succeededFuture();
    }
    return new KregDemo(registry, metrics)
      .run(appConfig.demoBroker(), appConfig.demoTopic(), appConfig.demoMessageCount())
      .onSuccess(subscription -> demoSubscription = subscription)
      .mapEmpty();
  }

  /**
   * Cancels the demo subscription, stops the health monitor and closes the registry,
   * in that order. Also runs when startup fails.
   */
  private Future<Void> releaseResources() {
    Future<Void> cancelSubscription = (demoSubscription != null)
      ? demoSubscription.cancel()
      : Future.succeededFuture();

    return cancelSubscription
      .compose(v -> healthMonitor != null ? healthMonitor.stop() : Future.<Void>succeededFuture())
      .compose(v -> registry != null ? registry.close() : Future.<Void>succeededFuture())
      .onComplete(ar -> {
        if (meterRegistry != null) {
          meterRegistry.close();
        }
      });
  }

  private RegistryConfig loadRegistryConfig() {
    try {
      return RegistryConfig.fromClasspath();
    } catch (Exception e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return RegistryConfig.fromEnvironment();
    }
  }

  private MetricsReporter createMetricsReporter(MetricsConfig config) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.noop();
    }

    meterRegistry = MicrometerConfig.createRegistry(config.reporterType(), config.step());
    if (meterRegistry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.noop();
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(meterRegistry);
      log.info("JVM metrics enabled");
    }
    return new MicrometerReporter(meterRegistry);
  }
}
