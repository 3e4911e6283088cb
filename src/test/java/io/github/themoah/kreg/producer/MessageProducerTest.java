package io.github.themoah.kreg.producer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kreg.kafka.FakeMetadataService;
import io.github.themoah.kreg.kafka.MockPartitionReaders;
import io.github.themoah.kreg.kafka.RoundRobinPartitioner;
import io.github.themoah.kreg.kafka.TestClients;
import io.github.themoah.kreg.model.OutboundMessage;
import io.github.themoah.kreg.model.SendResult;
import io.github.themoah.kreg.registry.BrokerNotFoundException;
import io.github.themoah.kreg.registry.ClientRegistry;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.internals.DefaultPartitioner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for MessageProducer against Kafka's MockProducer.
 */
@ExtendWith(VertxExtension.class)
public class MessageProducerTest {

  private static final String TOPIC = "t1";

  private static ClientRegistry registry(Vertx vertx, MockProducer<String, String> producer) {
    return new ClientRegistry(List.of(TestClients.client(vertx, "b1",
      new FakeMetadataService(TOPIC, 3), producer, new MockPartitionReaders(vertx))));
  }

  /**
   * Sends the values one after another and collects the results in order.
   */
  private static Future<List<SendResult>> sendAll(MessageProducer producer, List<String> values, String key) {
    List<SendResult> results = new ArrayList<>();
    Future<Void> chain = Future.succeededFuture();
    for (String value : values) {
      chain = chain.compose(v -> producer.send("b1", TOPIC, value, key).map(result -> {
        results.add(result);
        return null;
      }));
    }
    return chain.map(v -> results);
  }

  @Test
  void send_unknownBroker_failsWithoutTouchingProducers(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer();
    MessageProducer producer = new MessageProducer(registry(vertx, mock));

    producer.send("ghost", TOPIC, "hello").onComplete(ctx.failing(err -> ctx.verify(() -> {
      BrokerNotFoundException notFound = assertInstanceOf(BrokerNotFoundException.class, err);
      assertEquals("ghost", notFound.getBrokerName());
      assertTrue(mock.history().isEmpty());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void send_returnsAssignedPosition(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer();
    MessageProducer producer = new MessageProducer(registry(vertx, mock));

    sendAll(producer, List.of("first", "second"), null).onComplete(ctx.succeeding(results -> ctx.verify(() -> {
      assertEquals(2, mock.history().size());
      ProducerRecord<String, String> record = mock.history().get(0);
      assertEquals(TOPIC, record.topic());
      assertEquals("first", record.value());
      assertNull(record.key());
      assertTrue(record.timestamp() > 0);
      assertEquals(TOPIC, results.get(0).topic());
      assertTrue(results.get(1).offset() > results.get(0).offset());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void send_emptyKey_sendsWithoutKey(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer();
    MessageProducer producer = new MessageProducer(registry(vertx, mock));

    producer.send("b1", TOPIC, "v", "").onComplete(ctx.succeeding(result -> ctx.verify(() -> {
      assertNull(mock.history().get(0).key());
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  @SuppressWarnings("deprecation")
  void send_sameKey_landsOnSamePartition(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer(TOPIC, 3, new DefaultPartitioner());
    MessageProducer producer = new MessageProducer(registry(vertx, mock));

    sendAll(producer, List.of("a", "b", "c", "d", "e"), "customer-42")
      .onComplete(ctx.succeeding(results -> ctx.verify(() -> {
        Set<Integer> partitions = new HashSet<>();
        results.forEach(result -> partitions.add(result.partition()));
        assertEquals(1, partitions.size(), "keyed sends spread over " + partitions);
        assertEquals("customer-42", mock.history().get(0).key());
        ctx.completeNow();
      })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void send_roundRobin_usesEveryPartition(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer(TOPIC, 4, new RoundRobinPartitioner());
    MessageProducer producer = new MessageProducer(registry(vertx, mock));

    sendAll(producer, List.of("m0", "m1", "m2", "m3"), null).onComplete(ctx.succeeding(results -> ctx.verify(() -> {
      Set<Integer> partitions = new HashSet<>();
      results.forEach(result -> partitions.add(result.partition()));
      assertEquals(Set.of(0, 1, 2, 3), partitions);
      ctx.completeNow();
    })));

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void send_failure_propagatesProducerError(Vertx vertx, VertxTestContext ctx) throws Exception {
    MockProducer<String, String> mock = TestClients.mockProducer(TOPIC, 1, new RoundRobinPartitioner(), false);
    MessageProducer producer = new MessageProducer(registry(vertx, mock));
    RuntimeException failure = new RuntimeException("broker rejected the record");

    producer.send("b1", TOPIC, "v").onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertEquals(failure.getMessage(), err.getMessage());
      ctx.completeNow();
    })));

    // Fail the send once it reached the mock
    vertx.setPeriodic(10, id -> {
      if (mock.errorNext(failure)) {
        vertx.cancelTimer(id);
      }
    });

    assertTrue(ctx.awaitCompletion(5, TimeUnit.SECONDS));
  }

  @Test
  void outboundMessage_dropsEmptyKey() {
    assertNull(OutboundMessage.of(TOPIC, "v", "").key());
    assertNull(OutboundMessage.of(TOPIC, "v", null).key());
    assertEquals("k", OutboundMessage.of(TOPIC, "v", "k").key());
  }
}
