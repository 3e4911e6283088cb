package io.github.themoah.kreg.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kreg.config.BrokerConfig;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for the connection checks of KafkaBrokerClientFactory.
 */
@ExtendWith(VertxExtension.class)
public class KafkaBrokerClientFactoryTest {

  private static BrokerConfig broker(String address) {
    return BrokerConfig.builder("b1").address(address).build();
  }

  @Test
  void create_noAddresses_failsWithoutCreatingClients(Vertx vertx, VertxTestContext ctx) throws Exception {
    AtomicInteger created = new AtomicInteger();
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 200, (name, settings) -> {
      created.incrementAndGet();
      return new FakeMetadataService("t1", 1);
    });

    factory.create(broker(" , ")).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertInstanceOf(IllegalArgumentException.class, err);
      assertEquals(0, created.get());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void create_silentCluster_timesOutAndClosesAdmin(Vertx vertx, VertxTestContext ctx) throws Exception {
    FakeMetadataService metadata = new FakeMetadataService("t1", 1).silenceCluster();
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 200, (name, settings) -> metadata);

    factory.create(broker("kafka-1:9092")).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertInstanceOf(TimeoutException.class, err);
      assertTrue(metadata.isClosed());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void create_unreachableCluster_propagatesErrorAndClosesAdmin(Vertx vertx, VertxTestContext ctx) throws Exception {
    FakeMetadataService metadata = new FakeMetadataService("t1", 1);
    metadata.setClusterReachable(false);
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 5_000, (name, settings) -> metadata);

    factory.create(broker("kafka-1:9092")).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertEquals("cluster unreachable", err.getMessage());
      assertTrue(metadata.isClosed());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void create_adminCreationThrows_fails(Vertx vertx, VertxTestContext ctx) throws Exception {
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 200, (name, settings) -> {
      throw new IllegalStateException("bad admin config");
    });

    factory.create(broker("kafka-1:9092")).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertEquals("bad admin config", err.getMessage());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void create_reachableCluster_buildsBundle(Vertx vertx, VertxTestContext ctx) throws Exception {
    FakeMetadataService metadata = new FakeMetadataService("t1", 1);
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 1_000, (name, settings) -> metadata);

    factory.create(broker("localhost:9092")).onComplete(ctx.succeeding(client -> {
      ctx.verify(() -> {
        assertEquals("b1", client.getName());
        assertFalse(metadata.isClosed());
      });
      client.close().onComplete(ctx.succeeding(v -> ctx.verify(() -> {
        assertTrue(metadata.isClosed());
        ctx.completeNow();
      })));
    }));

    assertTrue(ctx.awaitCompletion(10, TimeUnit.SECONDS));
  }

  @Test
  void create_realClientAgainstClosedPort_timesOut(Vertx vertx, VertxTestContext ctx) throws Exception {
    KafkaBrokerClientFactory factory = new KafkaBrokerClientFactory(vertx, 200);

    factory.create(broker("127.0.0.1:1")).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertInstanceOf(TimeoutException.class, err);
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(15, TimeUnit.SECONDS));
  }
}
