package io.github.themoah.kreg.registry;

import io.github.themoah.kreg.config.BrokerConfig;
import io.github.themoah.kreg.config.RegistryConfig;
import io.github.themoah.kreg.config.StartupMode;
import io.github.themoah.kreg.kafka.BrokerClient;
import io.github.themoah.kreg.kafka.BrokerClientFactory;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps broker names to connected client bundles.
 *
 * <p>The mapping is fixed at construction and read without locking afterwards.
 * A name either resolves to a fully initialized bundle or is absent.
 */
public class ClientRegistry {

  private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

  private final Map<String, BrokerClient> clients;
  private final Set<String> names;

  public ClientRegistry(Collection<BrokerClient> clients) {
    Objects.requireNonNull(clients, "clients cannot be null");
    this.clients = new ConcurrentHashMap<>();
    Set<String> ordered = new LinkedHashSet<>();
    for (BrokerClient client : clients) {
      if (this.clients.putIfAbsent(client.getName(), client) != null) {
        throw new IllegalArgumentException("Duplicate broker name: " + client.getName());
      }
      ordered.add(client.getName());
    }
    this.names = Collections.unmodifiableSet(ordered);
  }

  /**
   * Connects every configured broker and builds the registry.
   *
   * <p>Each broker is attempted regardless of the others. In {@link StartupMode#PARTIAL}
   * the result carries the failures next to the registry of connected brokers. In
   * {@link StartupMode#ALL_OR_NOTHING} any failure closes the connected bundles and
   * fails with {@link RegistryInitializationException}.
   *
   * @param config the registry configuration
   * @param factory creates one connected bundle per broker
   * @return Future containing the initialization result
   */
  public static Future<InitializationResult> initialize(RegistryConfig config, BrokerClientFactory factory) {
    Objects.requireNonNull(config, "config cannot be null");
    Objects.requireNonNull(factory, "factory cannot be null");
    log.info("Initializing client registry for {} brokers", config.getBrokers().size());

    Map<String, Future<BrokerClient>> attempts = new LinkedHashMap<>();
    for (BrokerConfig broker : config.getBrokers().values()) {
      attempts.put(broker.name(), connect(factory, broker));
    }

    return Future.join(new ArrayList<>(attempts.values()))
      .transform(ignored -> {
        List<BrokerClient> connected = new ArrayList<>();
        Map<String, Throwable> failures = new LinkedHashMap<>();
        attempts.forEach((name, attempt) -> {
          if (attempt.succeeded()) {
            connected.add(attempt.result());
          } else {
            failures.put(name, attempt.cause());
            log.error("Failed to connect to broker {}", name, attempt.cause());
          }
        });
        return complete(config.getStartupMode(), connected, failures);
      });
  }

  private static Future<BrokerClient> connect(BrokerClientFactory factory, BrokerConfig broker) {
    try {
      Future<BrokerClient> attempt = factory.create(broker);
      return attempt != null
        ? attempt
        : Future.failedFuture(new IllegalStateException("Factory returned no client for " + broker.name()));
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }

  private static Future<InitializationResult> complete(
      StartupMode mode, List<BrokerClient> connected, Map<String, Throwable> failures) {

    if (!failures.isEmpty() && mode == StartupMode.ALL_OR_NOTHING) {
      log.error("Registry initialization aborted, {} of {} brokers failed",
        failures.size(), failures.size() + connected.size());
      List<Future<Void>> closing = new ArrayList<>();
      connected.forEach(client -> closing.add(client.close()));
      return Future.join(closing)
        .transform(ignored -> Future.failedFuture(new RegistryInitializationException(failures)));
    }

    ClientRegistry registry = new ClientRegistry(connected);
    if (failures.isEmpty()) {
      log.info("Client registry initialized with brokers {}", registry.brokerNames());
    } else {
      log.warn("Client registry initialized with brokers {}, failed brokers {}",
        registry.brokerNames(), failures.keySet());
    }
    return Future.succeededFuture(new InitializationResult(registry, failures));
  }

  /**
   * Returns the bundle registered under {@code name}.
   *
   * @param name the broker name
   * @return the client bundle
   * @throws BrokerNotFoundException if no broker is registered under the name
   */
  public BrokerClient get(String name) {
    BrokerClient client = name == null ? null : clients.get(name);
    if (client == null) {
      throw new BrokerNotFoundException(name);
    }
    return client;
  }

  /**
   * Asynchronous variant of {@link #get(String)}.
   *
   * @param name the broker name
   * @return Future containing the bundle, failed with BrokerNotFoundException if absent
   */
  public Future<BrokerClient> find(String name) {
    BrokerClient client = name == null ? null : clients.get(name);
    return client != null
      ? Future.succeededFuture(client)
      : Future.failedFuture(new BrokerNotFoundException(name));
  }

  public boolean contains(String name) {
    return name != null && clients.containsKey(name);
  }

  /**
   * Returns the registered broker names in registration order.
   */
  public Set<String> brokerNames() {
    return names;
  }

  /**
   * Closes every registered bundle.
   *
   * @return Future that completes once all bundles are closed, failed if any close failed
   */
  public Future<Void> close() {
    log.info("Closing client registry");
    List<Future<Void>> closing = new ArrayList<>();
    for (String name : names) {
      closing.add(clients.get(name).close());
    }
    return Future.join(closing).mapEmpty();
  }
}
