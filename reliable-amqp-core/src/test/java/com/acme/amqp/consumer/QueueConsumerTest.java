package com.acme.amqp.consumer;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.acme.amqp.channel.GuardedChannel;
import com.acme.amqp.codec.JacksonCodec;
import com.acme.amqp.config.ConsumerConfig;
import com.acme.amqp.config.PublisherConfirmsConfig;
import com.acme.amqp.connection.ConnectionManager;
import com.acme.amqp.core.AmqpClientException;
import com.acme.amqp.core.CodecException;
import com.acme.amqp.core.ConsumerStateException;
import com.acme.amqp.core.HandlerException;
import com.acme.amqp.spi.BrokerChannel;
import com.acme.amqp.spi.Delivery;
import com.acme.amqp.spi.MessageProperties;
import com.acme.amqp.testing.Fixtures;
import com.acme.amqp.testing.InMemoryBroker;
import com.acme.amqp.testing.InMemoryBroker.StoredMessage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/** Unit tests for QueueConsumer */
class QueueConsumerTest {

  record OrderPlaced(String orderId) {}

  private static final Duration WAIT = Duration.ofSeconds(5);

  private final JacksonCodec codec = new JacksonCodec();
  private InMemoryBroker broker;
  private ConnectionManager connectionManager;
  private QueueConsumer<OrderPlaced> consumer;

  @BeforeEach
  void setUp() {
    broker = new InMemoryBroker();
    connectionManager = new ConnectionManager(broker, Fixtures.endpoint());
  }

  @AfterEach
  void tearDown() {
    if (consumer != null) {
      consumer.close();
    }
    connectionManager.close();
  }

  private QueueConsumer<OrderPlaced> newConsumer(ConsumerConfig config) {
    consumer =
        new QueueConsumer<>(
            config, connectionManager, false, codec, OrderPlaced.class, ScopeFactory.none());
    return consumer;
  }

  private void publish(String queue, Object payload) {
    publish(queue, codec.encode(payload), Map.of());
  }

  private void publish(String queue, byte[] body, Map<String, Object> headers) {
    MessageProperties properties =
        new MessageProperties(MessageProperties.JSON, true, null, null, headers);
    broker.publish(queue + ".direct", queue, properties, body);
  }

  private void awaitSettled(String queue) {
    await()
        .atMost(WAIT)
        .until(() -> broker.depth(queue) == 0 && broker.unacked(queue) == 0);
  }

  @Nested
  @DisplayName("Subscribe Tests")
  class SubscribeTests {

    @Test
    @DisplayName("should declare the topology and start consuming")
    void testSubscribeDeclaresTopology() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));

      consumer.subscribe((message, scope, context) -> {}, null);

      assertThat(consumer.state()).isEqualTo(ConsumerState.SUBSCRIBED);
      assertThat(consumer.consumerTags()).hasSize(1);
      assertThat(broker.hasQueue("orders")).isTrue();
      assertThat(broker.hasQueue("orders.DLQ")).isTrue();
      assertThat(broker.hasQueue("orders.RetryQ.5s")).isTrue();
      assertThat(broker.exchangeType("orders.topic.Retry")).isEqualTo("topic");
      assertThat(broker.isBound("orders", "orders.direct", "orders")).isTrue();
    }

    @Test
    @DisplayName("should not touch the broker before subscribe")
    void testLazy() {
      newConsumer(Fixtures.consumer("orders"));

      assertThat(broker.connectCalls()).isZero();
      assertThat(consumer.state()).isEqualTo(ConsumerState.UNBOUND);
    }

    @Test
    @DisplayName("should reject a second subscribe")
    void testDoubleSubscribe() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      consumer.subscribe((message, scope, context) -> {}, null);

      assertThatThrownBy(() -> consumer.subscribe((message, scope, context) -> {}, null))
          .isInstanceOf(ConsumerStateException.class);
      assertThat(consumer.consumerTags()).hasSize(1);
    }

    @Test
    @DisplayName("should require an on-dequeue handler")
    void testNullHandler() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));

      assertThatThrownBy(() -> consumer.subscribe(null, null))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should notify lifecycle listeners and survive a failing one")
    void testLifecycleListeners() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      List<String> registered = new CopyOnWriteArrayList<>();
      consumer.addLifecycleListener(
          new ConsumerLifecycleListener() {
            @Override
            public void onRegistered(String queue, String consumerTag) {
              throw new IllegalStateException("listener bug");
            }
          });
      consumer.addLifecycleListener(
          new ConsumerLifecycleListener() {
            @Override
            public void onRegistered(String queue, String consumerTag) {
              registered.add(queue + "/" + consumerTag);
            }
          });

      consumer.subscribe((message, scope, context) -> {}, null);

      assertThat(registered).containsExactly("orders/" + consumer.consumerTags().iterator().next());
    }
  }

  @Nested
  @DisplayName("Delivery Tests")
  class DeliveryTests {

    @Test
    @DisplayName("should hand the decoded message to the handler and ack it")
    void testSuccess() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      AtomicReference<MessageContext<OrderPlaced>> seen = new AtomicReference<>();
      List<OrderPlaced> received = new CopyOnWriteArrayList<>();
      consumer.subscribe(
          (message, scope, context) -> {
            received.add(message);
            seen.set(context);
          },
          null);

      publish("orders", new OrderPlaced("o-1"));

      await().atMost(WAIT).until(() -> received.size() == 1);
      awaitSettled("orders");
      assertThat(received).containsExactly(new OrderPlaced("o-1"));
      MessageContext<OrderPlaced> context = seen.get();
      assertThat(context.lastTry()).isFalse();
      assertThat(context.retryCount()).isZero();
      assertThat(context.sender()).isSameAs(consumer);
      assertThat(context.envelope().exchange()).isEqualTo("orders.direct");
      assertThat(context.envelope().routingKey()).isEqualTo("orders");
      assertThat(context.envelope().payload()).isEqualTo(new OrderPlaced("o-1"));
    }

    @Test
    @DisplayName("should republish a failed message to the first retry tier")
    void testRetry() {
      QueueConsumer<OrderPlaced> consumer =
          newConsumer(Fixtures.consumer("orders", 5000L, 60000L));
      AtomicReference<AmqpClientException> error = new AtomicReference<>();
      consumer.subscribe(
          (message, scope, context) -> {
            throw new IllegalStateException("downstream unavailable");
          },
          (message, scope, context, e) -> error.set(e));

      publish("orders", new OrderPlaced("o-2"));

      await().atMost(WAIT).until(() -> broker.depth("orders.RetryQ.5s") == 1);
      awaitSettled("orders");
      StoredMessage retried = broker.messages("orders.RetryQ.5s").get(0);
      assertThat(retried.retries()).isEqualTo(1);
      assertThat(retried.properties().expirationMs()).isEqualTo(5000L);
      assertThat(retried.exchange()).isEqualTo("orders.topic.Retry");
      assertThat(retried.routingKey()).isEqualTo("5s");
      assertThat(error.get())
          .isInstanceOf(HandlerException.class)
          .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should dead-letter a message that failed its last try")
    void testDeadLetterOnLastTry() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      AtomicReference<Boolean> lastTry = new AtomicReference<>();
      consumer.subscribe(
          (message, scope, context) -> {
            lastTry.set(context.lastTry());
            throw new IllegalStateException("still failing");
          },
          null);

      publish("orders", codec.encode(new OrderPlaced("o-3")), Map.of("x-retries", 1));

      await().atMost(WAIT).until(() -> broker.depth("orders.DLQ") == 1);
      assertThat(lastTry.get()).isTrue();
      assertThat(broker.depth("orders.RetryQ.5s")).isZero();
    }

    @Test
    @DisplayName("should treat an undecodable body as a failure and pass a null payload")
    void testDecodeFailure() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      AtomicInteger handlerCalls = new AtomicInteger();
      AtomicReference<AmqpClientException> error = new AtomicReference<>();
      AtomicReference<OrderPlaced> errorPayload = new AtomicReference<>(new OrderPlaced("x"));
      consumer.subscribe(
          (message, scope, context) -> handlerCalls.incrementAndGet(),
          (message, scope, context, e) -> {
            errorPayload.set(message);
            error.set(e);
          });

      publish("orders", "{broken".getBytes(StandardCharsets.UTF_8), Map.of());

      await().atMost(WAIT).until(() -> broker.depth("orders.RetryQ.5s") == 1);
      assertThat(handlerCalls.get()).isZero();
      assertThat(error.get()).isInstanceOf(CodecException.class);
      assertThat(errorPayload.get()).isNull();
    }

    @Test
    @DisplayName("a failing error handler should not stop the retry path")
    void testErrorHandlerFailure() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      consumer.subscribe(
          (message, scope, context) -> {
            throw new IllegalStateException("handler");
          },
          (message, scope, context, e) -> {
            throw new IllegalStateException("error handler");
          });

      publish("orders", new OrderPlaced("o-4"));

      await().atMost(WAIT).until(() -> broker.depth("orders.RetryQ.5s") == 1);
      awaitSettled("orders");
    }

    @Test
    @DisplayName("should ack and drop when retry and dead-lettering are disabled")
    void testDrop() {
      ConsumerConfig config = Fixtures.consumer("orders");
      config.setDisableDeadLettering(true);
      QueueConsumer<OrderPlaced> consumer = newConsumer(config);
      AtomicInteger calls = new AtomicInteger();
      consumer.subscribe(
          (message, scope, context) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
          },
          null);

      publish("orders", new OrderPlaced("o-5"));

      await().atMost(WAIT).until(() -> calls.get() == 1);
      awaitSettled("orders");
      assertThat(broker.hasQueue("orders.DLQ")).isFalse();
    }

    @Test
    @DisplayName("should run up to prefetchCount handlers concurrently on named threads")
    void testConcurrentHandlers() throws Exception {
      ConsumerConfig config = Fixtures.consumer("orders");
      config.setPrefetchCount(3);
      QueueConsumer<OrderPlaced> consumer = newConsumer(config);
      CountDownLatch release = new CountDownLatch(1);
      AtomicInteger inFlight = new AtomicInteger();
      AtomicInteger maxInFlight = new AtomicInteger();
      Set<String> threads = ConcurrentHashMap.newKeySet();
      consumer.subscribe(
          (message, scope, context) -> {
            threads.add(Thread.currentThread().getName());
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            release.await(5, TimeUnit.SECONDS);
            inFlight.decrementAndGet();
          },
          null);

      for (int i = 0; i < 5; i++) {
        publish("orders", new OrderPlaced("o-" + i));
      }

      await().atMost(WAIT).until(() -> inFlight.get() == 3);
      assertThat(broker.unacked("orders")).isEqualTo(3);
      release.countDown();
      awaitSettled("orders");
      assertThat(maxInFlight.get()).isEqualTo(3);
      assertThat(threads).allMatch(name -> name.startsWith("amqp-consumer-orders-"));
    }

    @Test
    @DisplayName("should wait for publisher confirms when republishing")
    void testRetryWithConfirms() {
      ConsumerConfig config = Fixtures.consumer("orders", 5000L);
      config.setPublisherConfirms(new PublisherConfirmsConfig(100));
      QueueConsumer<OrderPlaced> consumer = newConsumer(config);
      consumer.subscribe(
          (message, scope, context) -> {
            throw new IllegalStateException("boom");
          },
          null);

      publish("orders", new OrderPlaced("o-6"));

      await().atMost(WAIT).until(() -> broker.depth("orders.RetryQ.5s") == 1);
      awaitSettled("orders");
    }
  }

  @Nested
  @DisplayName("Retry Or Reject Tests")
  class RetryOrRejectTests {

    private final BrokerChannel raw = mock(BrokerChannel.class);
    private final GuardedChannel channel = GuardedChannel.of(raw);

    private Delivery delivery(int retries) {
      MessageProperties properties =
          MessageProperties.empty().withHeader("x-retries", retries);
      return new Delivery("ctag", 7L, "orders.direct", "orders", false, properties, new byte[] {1});
    }

    @Test
    @DisplayName("should requeue the original when the retry republish fails")
    void testRepublishFailure() throws IOException {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      doThrow(new IOException("channel closed"))
          .when(raw)
          .basicPublish(anyString(), anyString(), anyBoolean(), any(), any());

      RetryDecision decision = consumer.retryOrReject(channel, delivery(0), 0);

      assertThat(decision.action()).isEqualTo(RetryDecision.Action.RETRY);
      verify(raw).basicNack(7L, false, true);
      verify(raw, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    @DisplayName("should republish with the tier TTL and an incremented retry header")
    void testRepublishProperties() throws IOException {
      QueueConsumer<OrderPlaced> consumer =
          newConsumer(Fixtures.consumer("orders", 5000L, 65000L));

      consumer.retryOrReject(channel, delivery(1), 1);

      verify(raw)
          .basicPublish(
              eq("orders.topic.Retry"),
              eq("1m5s"),
              eq(true),
              argThat(p -> p.expirationMs() == 65000L && p.intHeader("x-retries", -1) == 2),
              any());
      verify(raw).basicAck(7L, false);
    }

    @Test
    @DisplayName("should keep message identity properties on the retry republish")
    void testRepublishKeepsIdentity() throws IOException {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));
      Instant sentAt = Instant.parse("2026-01-15T10:00:00Z");
      MessageProperties original =
          new MessageProperties(
              MessageProperties.JSON,
              "utf-8",
              true,
              3,
              null,
              "m-1",
              "c-1",
              "OrderPlaced",
              "orders.replies",
              sentAt,
              "checkout",
              "guest",
              Map.of("tenant", "acme"));
      Delivery delivery =
          new Delivery("ctag", 7L, "orders.direct", "orders", false, original, new byte[] {1});

      consumer.retryOrReject(channel, delivery, 0);

      ArgumentCaptor<MessageProperties> captor = ArgumentCaptor.forClass(MessageProperties.class);
      verify(raw)
          .basicPublish(eq("orders.topic.Retry"), eq("5s"), eq(true), captor.capture(), any());
      MessageProperties republished = captor.getValue();
      assertThat(republished.messageId()).isEqualTo("m-1");
      assertThat(republished.correlationId()).isEqualTo("c-1");
      assertThat(republished.type()).isEqualTo("OrderPlaced");
      assertThat(republished.replyTo()).isEqualTo("orders.replies");
      assertThat(republished.timestamp()).isEqualTo(sentAt);
      assertThat(republished.appId()).isEqualTo("checkout");
      assertThat(republished.userId()).isEqualTo("guest");
      assertThat(republished.contentEncoding()).isEqualTo("utf-8");
      assertThat(republished.priority()).isEqualTo(3);
      assertThat(republished.persistent()).isTrue();
      assertThat(republished.expirationMs()).isEqualTo(5000L);
      assertThat(republished.headers())
          .containsEntry("tenant", "acme")
          .containsEntry("x-retries", 1);
    }

    @Test
    @DisplayName("should nack without requeue once tiers are exhausted")
    void testDeadLetter() throws IOException {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders", 5000L));

      RetryDecision decision = consumer.retryOrReject(channel, delivery(1), 1);

      assertThat(decision.action()).isEqualTo(RetryDecision.Action.DEAD_LETTER);
      verify(raw).basicNack(7L, false, false);
    }

    @Test
    @DisplayName("should not escalate a failing settlement")
    void testSettlementFailure() throws IOException {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      doThrow(new IOException("gone")).when(raw).basicNack(anyLong(), anyBoolean(), anyBoolean());

      assertThatCode(() -> consumer.retryOrReject(channel, delivery(0), 0))
          .doesNotThrowAnyException();
    }
  }

  @Nested
  @DisplayName("Recovery Tests")
  class RecoveryTests {

    @Test
    @DisplayName("should reopen a closed channel and resume consuming")
    void testRecreateChannel() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      List<OrderPlaced> received = new CopyOnWriteArrayList<>();
      consumer.subscribe((message, scope, context) -> received.add(message), null);

      consumer.closeChannel();
      assertThat(consumer.consumerTags()).isEmpty();
      boolean recreated = consumer.createNewChannelAndStartConsume(false);
      publish("orders", new OrderPlaced("o-7"));

      assertThat(recreated).isTrue();
      assertThat(consumer.consumerTags()).hasSize(1);
      await().atMost(WAIT).until(() -> received.size() == 1);
    }

    @Test
    @DisplayName("should refuse to recreate while the channel is open")
    void testRecreateWhileOpen() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      consumer.subscribe((message, scope, context) -> {}, null);

      assertThat(consumer.createNewChannelAndStartConsume(true)).isFalse();
      assertThat(consumer.startConsume(true)).isFalse();
      assertThat(broker.channelsCreated()).isEqualTo(1);
    }

    @Test
    @DisplayName("should refuse to recreate before subscribe")
    void testRecreateBeforeSubscribe() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));

      assertThat(consumer.createNewChannelAndStartConsume(false)).isFalse();
      assertThat(broker.connectCalls()).isZero();
    }

    @Test
    @DisplayName("should recover after the broker dropped the connection")
    void testRecoverAfterConnectionLoss() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      List<OrderPlaced> received = new CopyOnWriteArrayList<>();
      List<String> shutdowns = new CopyOnWriteArrayList<>();
      consumer.addLifecycleListener(
          new ConsumerLifecycleListener() {
            @Override
            public void onShutdown(String queue, String consumerTag, String reason) {
              shutdowns.add(reason);
            }
          });
      consumer.subscribe((message, scope, context) -> received.add(message), null);

      broker.connections().get(0).kill("connection forced");
      assertThat(shutdowns).hasSize(1);
      assertThat(consumer.createNewChannelAndStartConsume(true)).isTrue();
      publish("orders", new OrderPlaced("o-8"));

      await().atMost(WAIT).until(() -> received.size() == 1);
      assertThat(broker.connectCalls()).isEqualTo(2);
    }

    @Test
    @DisplayName("basicCancel should stop consuming until startConsume is called")
    void testCancelAndRestart() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      List<String> cancelled = new CopyOnWriteArrayList<>();
      consumer.addLifecycleListener(
          new ConsumerLifecycleListener() {
            @Override
            public void onCancelled(String queue, String consumerTag) {
              cancelled.add(consumerTag);
            }
          });
      List<OrderPlaced> received = new CopyOnWriteArrayList<>();
      consumer.subscribe((message, scope, context) -> received.add(message), null);

      consumer.basicCancel();
      publish("orders", new OrderPlaced("o-9"));

      assertThat(consumer.state()).isEqualTo(ConsumerState.CANCELLED);
      assertThat(consumer.consumerTags()).isEmpty();
      assertThat(cancelled).hasSize(1);
      assertThat(broker.depth("orders")).isEqualTo(1);

      assertThat(consumer.startConsume(true)).isTrue();
      await().atMost(WAIT).until(() -> received.size() == 1);
      assertThat(consumer.state()).isEqualTo(ConsumerState.SUBSCRIBED);
    }
  }

  @Nested
  @DisplayName("Close Tests")
  class CloseTests {

    @Test
    @DisplayName("close should release the channel and be idempotent")
    void testClose() {
      QueueConsumer<OrderPlaced> consumer = newConsumer(Fixtures.consumer("orders"));
      consumer.subscribe((message, scope, context) -> {}, null);

      consumer.close();
      consumer.close();

      assertThat(consumer.state()).isEqualTo(ConsumerState.CLOSED);
      assertThat(broker.openChannels()).isZero();
      assertThat(connectionManager.getOrCreate().isOpen()).isTrue();
      assertThatThrownBy(() -> consumer.subscribe((message, scope, context) -> {}, null))
          .isInstanceOf(ConsumerStateException.class);
    }
  }
}
