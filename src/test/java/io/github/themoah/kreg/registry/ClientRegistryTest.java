package io.github.themoah.kreg.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kreg.config.BrokerConfig;
import io.github.themoah.kreg.config.RegistryConfig;
import io.github.themoah.kreg.config.StartupMode;
import io.github.themoah.kreg.kafka.BrokerClient;
import io.github.themoah.kreg.kafka.BrokerClientFactory;
import io.github.themoah.kreg.kafka.FakeMetadataService;
import io.github.themoah.kreg.kafka.MockPartitionReaders;
import io.github.themoah.kreg.kafka.TestClients;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.MockProducer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for ClientRegistry initialization and lookups.
 */
@ExtendWith(VertxExtension.class)
public class ClientRegistryTest {

  private static RegistryConfig config(StartupMode mode, String... names) {
    RegistryConfig.Builder builder = RegistryConfig.builder().startupMode(mode);
    for (String name : names) {
      builder.broker(BrokerConfig.builder(name).address(name + ":9092").build());
    }
    return builder.build();
  }

  /**
   * Factory that fails for the given names and records what it created.
   */
  private static class RecordingFactory implements BrokerClientFactory {

    private final Vertx vertx;
    private final Set<String> failing;
    private final Map<String, FakeMetadataService> metadata = new ConcurrentHashMap<>();
    private final Map<String, MockProducer<String, String>> producers = new ConcurrentHashMap<>();

    RecordingFactory(Vertx vertx, String... failing) {
      this.vertx = vertx;
      this.failing = Set.of(failing);
    }

    @Override
    public Future<BrokerClient> create(BrokerConfig config) {
      if (failing.contains(config.name())) {
        return Future.failedFuture(new IllegalStateException("cannot reach " + config.name()));
      }
      FakeMetadataService meta = new FakeMetadataService("t1", 1);
      MockProducer<String, String> producer = TestClients.mockProducer();
      metadata.put(config.name(), meta);
      producers.put(config.name(), producer);
      return Future.succeededFuture(
        TestClients.client(vertx, config.name(), meta, producer, new MockPartitionReaders(vertx)));
    }
  }

  @Test
  void initialize_allConnected(Vertx vertx, VertxTestContext ctx) throws Exception {
    RecordingFactory factory = new RecordingFactory(vertx);

    ClientRegistry.initialize(config(StartupMode.PARTIAL, "b1", "b2"), factory)
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        assertFalse(result.hasFailures());
        assertEquals(Set.of("b1", "b2"), result.registry().brokerNames());
        assertEquals("b1", result.registry().get("b1").getName());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void initialize_partial_keepsBrokersAfterAFailure(Vertx vertx, VertxTestContext ctx) throws Exception {
    RecordingFactory factory = new RecordingFactory(vertx, "b1");

    ClientRegistry.initialize(config(StartupMode.PARTIAL, "b1", "b2", "b3"), factory)
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        ClientRegistry registry = result.registry();
        assertEquals(List.of("b2", "b3"), List.copyOf(registry.brokerNames()));
        assertFalse(registry.contains("b1"));
        assertEquals(Set.of("b1"), result.failures().keySet());
        assertEquals("cannot reach b1", result.failures().get("b1").getMessage());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void initialize_allOrNothing_closesConnectedBrokers(Vertx vertx, VertxTestContext ctx) throws Exception {
    RecordingFactory factory = new RecordingFactory(vertx, "b2");

    ClientRegistry.initialize(config(StartupMode.ALL_OR_NOTHING, "b1", "b2", "b3"), factory)
      .onComplete(ctx.failing(err -> ctx.verify(() -> {
        RegistryInitializationException failure = assertInstanceOf(RegistryInitializationException.class, err);
        assertEquals(Set.of("b2"), failure.getFailures().keySet());
        assertTrue(factory.metadata.get("b1").isClosed());
        assertTrue(factory.metadata.get("b3").isClosed());
        assertTrue(factory.producers.get("b1").closed());
        assertTrue(factory.producers.get("b3").closed());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void initialize_factoryThrowing_isRecordedAsFailure(Vertx vertx, VertxTestContext ctx) throws Exception {
    BrokerClientFactory factory = broker -> {
      throw new IllegalArgumentException("bad address");
    };

    ClientRegistry.initialize(config(StartupMode.PARTIAL, "b1"), factory)
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        assertTrue(result.registry().brokerNames().isEmpty());
        assertEquals("bad address", result.failures().get("b1").getMessage());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void initialize_noBrokers(Vertx vertx, VertxTestContext ctx) throws Exception {
    ClientRegistry.initialize(RegistryConfig.builder().build(), new RecordingFactory(vertx))
      .onComplete(ctx.succeeding(result -> ctx.verify(() -> {
        assertTrue(result.registry().brokerNames().isEmpty());
        assertFalse(result.hasFailures());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void get_unknownBroker(Vertx vertx) {
    ClientRegistry registry = new ClientRegistry(
      List.of(TestClients.client(vertx, "b1", new FakeMetadataService("t1", 1))));

    BrokerNotFoundException error = assertThrows(BrokerNotFoundException.class, () -> registry.get("ghost"));
    assertEquals("ghost", error.getBrokerName());
    assertThrows(BrokerNotFoundException.class, () -> registry.get(null));
    assertFalse(registry.contains("ghost"));
  }

  @Test
  void find_resolvesKnownAndFailsUnknown(Vertx vertx) {
    BrokerClient client = TestClients.client(vertx, "b1", new FakeMetadataService("t1", 1));
    ClientRegistry registry = new ClientRegistry(List.of(client));

    assertSame(client, registry.find("b1").result());
    assertInstanceOf(BrokerNotFoundException.class, registry.find("ghost").cause());
  }

  @Test
  void constructor_rejectsDuplicateNames(Vertx vertx) {
    List<BrokerClient> clients = List.of(
      TestClients.client(vertx, "b1", new FakeMetadataService("t1", 1)),
      TestClients.client(vertx, "b1", new FakeMetadataService("t1", 1)));

    assertThrows(IllegalArgumentException.class, () -> new ClientRegistry(clients));
  }

  @Test
  void close_closesEveryBundle(Vertx vertx, VertxTestContext ctx) throws Exception {
    FakeMetadataService m1 = new FakeMetadataService("t1", 1);
    FakeMetadataService m2 = new FakeMetadataService("t1", 1);
    MockProducer<String, String> p1 = TestClients.mockProducer();
    ClientRegistry registry = new ClientRegistry(List.of(
      TestClients.client(vertx, "b1", m1, p1, new MockPartitionReaders(vertx)),
      TestClients.client(vertx, "b2", m2)));

    registry.close().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
      assertTrue(m1.isClosed());
      assertTrue(m2.isClosed());
      assertTrue(p1.closed());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }
}
