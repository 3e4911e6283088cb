package io.github.themoah.kreg.health;

import io.github.themoah.kreg.kafka.BrokerClient;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Monitors the connection of every registered broker via periodic heartbeat.
 * Thread-safe status tracking using AtomicReference per broker.
 */
public class BrokerHealthMonitor {

  private static final Logger log = LoggerFactory.getLogger(BrokerHealthMonitor.class);

  private static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;

  private final Vertx vertx;
  private final ClientRegistry registry;
  private final long heartbeatIntervalMs;
  private final Map<String, AtomicReference<HealthStatus>> statuses = new ConcurrentHashMap<>();

  private Long timerId;

  public BrokerHealthMonitor(Vertx vertx, ClientRegistry registry) {
    this(vertx, registry, DEFAULT_HEARTBEAT_INTERVAL_MS);
  }

  public BrokerHealthMonitor(Vertx vertx, ClientRegistry registry, long heartbeatIntervalMs) {
    this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
    this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    this.heartbeatIntervalMs = heartbeatIntervalMs;
    registry.brokerNames().forEach(name -> statuses.put(name, new AtomicReference<>(HealthStatus.DOWN)));
  }

  /**
   * Starts the health monitor with initial check and periodic heartbeat.
   *
   * @return Future that completes when the initial health checks finish
   */
  public Future<Void> start() {
    log.info("Starting broker health monitor with heartbeat interval: {}ms", heartbeatIntervalMs);

    return checkAll()
      .onComplete(ar -> {
        timerId = vertx.setPeriodic(heartbeatIntervalMs, id -> checkAll());
        log.info("Broker health monitor started, timer ID: {}", timerId);
      });
  }

  /**
   * Stops the health monitor and cancels periodic timer.
   *
   * @return Future that completes when stopped
   */
  public Future<Void> stop() {
    log.info("Stopping broker health monitor");
    if (timerId != null) {
      vertx.cancelTimer(timerId);
      timerId = null;
    }
    statuses.values().forEach(status -> status.set(HealthStatus.DOWN));
    return Future.succeededFuture();
  }

  /**
   * Returns the current status of a broker, DOWN for unknown brokers.
   */
  public HealthStatus getStatus(String broker) {
    AtomicReference<HealthStatus> status = statuses.get(broker);
    return status == null ? HealthStatus.DOWN : status.get();
  }

  /**
   * Returns a snapshot of every broker's status in registration order.
   */
  public Map<String, HealthStatus> getStatuses() {
    Map<String, HealthStatus> snapshot = new LinkedHashMap<>();
    registry.brokerNames().forEach(name -> snapshot.put(name, getStatus(name)));
    return snapshot;
  }

  public boolean isHealthy(String broker) {
    return getStatus(broker).isUp();
  }

  Future<Void> checkAll() {
    List<Future<Void>> checks = new ArrayList<>();
    for (String name : registry.brokerNames()) {
      checks.add(check(registry.get(name)));
    }
    return Future.join(checks).mapEmpty();
  }

  /**
   * Performs a health check by describing cluster (lightweight metadata operation).
   * Never fails; the outcome is recorded in the broker's status.
   */
  private Future<Void> check(BrokerClient client) {
    String name = client.getName();
    AtomicReference<HealthStatus> status = statuses.computeIfAbsent(name,
      n -> new AtomicReference<>(HealthStatus.DOWN));
    log.debug("Performing health check for broker {}", name);

    return client.getMetadata().describeCluster()
      .onComplete(ar -> {
        HealthStatus current = HealthStatus.of(ar.succeeded());
        HealthStatus previous = status.getAndSet(current);
        if (current.isUp() && previous != current) {
          log.info("Broker {} connection restored, cluster ID: {}", name, ar.result());
        } else if (current.isUp()) {
          log.debug("Broker {} health check passed, cluster ID: {}", name, ar.result());
        } else if (previous != current) {
          log.warn("Broker {} connection lost: {}", name, ar.cause().getMessage());
        } else {
          log.debug("Broker {} health check failed: {}", name, ar.cause().getMessage());
        }
      })
      .<Void>mapEmpty()
      .otherwiseEmpty();
  }
}
