package com.acme.amqp.consumer;

import com.acme.amqp.channel.GuardedChannel;
import com.acme.amqp.config.ConfigDefaults;
import com.acme.amqp.config.ConsumerConfig;
import com.acme.amqp.connection.ConnectionProvider;
import com.acme.amqp.core.AmqpClientException;
import com.acme.amqp.core.ChannelException;
import com.acme.amqp.core.CodecException;
import com.acme.amqp.core.ConsumerStateException;
import com.acme.amqp.core.HandlerException;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.ConsumerSignalListener;
import com.acme.amqp.spi.Delivery;
import com.acme.amqp.spi.MessageProperties;
import com.acme.amqp.topology.QueueTopology;
import com.acme.amqp.topology.RetryTier;
import com.acme.amqp.topology.TopologyBuilder;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes one queue on a channel it owns exclusively.
 *
 * <p>Deliveries are dispatched to a pool of {@code prefetchCount} threads, so that many handlers
 * may run at once. Every channel operation goes through a {@link GuardedChannel}, and each
 * delivery is acknowledged on the channel it arrived on.
 *
 * <p>A failed delivery (undecodable body or handler exception) is retried through the retry tier
 * matching its {@code x-retries} header. When no tier is left it is rejected to the dead-letter
 * queue, or acknowledged and dropped when dead-lettering is disabled.
 */
public class QueueConsumer<T> implements Consumer<T> {

  private static final Logger log = LoggerFactory.getLogger(QueueConsumer.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

  private final ConsumerConfig config;
  private final QueueTopology topology;
  private final ConnectionProvider connectionProvider;
  private final boolean ownsProvider;
  private final Codec codec;
  private final Class<T> messageType;
  private final ScopeFactory scopeFactory;
  private final int prefetchSize;
  private final int prefetchCount;
  private final Duration confirmTimeout;

  private final ExecutorService dispatcher;
  private final ReentrantLock channelLock = new ReentrantLock();
  private final ReentrantLock consumeLock = new ReentrantLock();
  private final Set<String> consumerTags = ConcurrentHashMap.newKeySet();
  private final List<ConsumerLifecycleListener> lifecycleListeners = new CopyOnWriteArrayList<>();
  private final ConsumerSignalListener signalListener = new SignalBridge();

  private volatile GuardedChannel channel;
  private volatile ConsumerState state = ConsumerState.UNBOUND;
  private volatile DequeueHandler<T> onDequeue;
  private volatile ErrorHandler<T> onError;

  /**
   * @param ownsProvider whether {@link #close()} also closes {@code connectionProvider}
   * @throws com.acme.amqp.core.ConfigException when {@code config} is invalid
   */
  public QueueConsumer(
      ConsumerConfig config,
      ConnectionProvider connectionProvider,
      boolean ownsProvider,
      Codec codec,
      Class<T> messageType,
      ScopeFactory scopeFactory) {
    config.validate();
    this.config = config;
    this.topology = TopologyBuilder.build(config, messageType);
    this.connectionProvider = connectionProvider;
    this.ownsProvider = ownsProvider;
    this.codec = codec;
    this.messageType = messageType;
    this.scopeFactory = scopeFactory != null ? scopeFactory : ScopeFactory.none();
    this.prefetchSize = config.prefetchSizeOrDefault();
    this.prefetchCount = config.prefetchCountOrDefault();
    this.confirmTimeout =
        config.isPublisherConfirmsEnabled() ? config.getPublisherConfirms().waitConfirms() : null;
    this.dispatcher = newDispatcher(topology.queueName(), prefetchCount);
  }

  private static ExecutorService newDispatcher(String queue, int threads) {
    AtomicInteger counter = new AtomicInteger();
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        r -> {
          Thread t = new Thread(r, "amqp-consumer-" + queue + "-" + counter.incrementAndGet());
          t.setDaemon(true);
          return t;
        });
  }

  @Override
  public void subscribe(DequeueHandler<T> onDequeue, ErrorHandler<T> onError) {
    if (onDequeue == null) {
      throw new IllegalArgumentException("onDequeue handler is required");
    }
    consumeLock.lock();
    try {
      if (state != ConsumerState.UNBOUND) {
        throw new ConsumerStateException(
            "Consumer for queue " + topology.queueName() + " cannot subscribe in state " + state);
      }
      this.onDequeue = onDequeue;
      this.onError = onError;
      state = ConsumerState.SUBSCRIBED;
    } finally {
      consumeLock.unlock();
    }

    GuardedChannel opened = openChannel();
    consumeLock.lock();
    try {
      startConsumeOn(opened);
    } catch (IOException e) {
      throw new ChannelException("Failed to start consuming " + topology.queueName(), e);
    } finally {
      consumeLock.unlock();
    }
    log.info(
        "Subscribed to queue={} prefetchCount={} retry={} deadLettering={}",
        topology.queueName(),
        prefetchCount,
        topology.retryPolicy(),
        topology.deadLettering());
  }

  @Override
  public boolean createNewChannelAndStartConsume(boolean rethrow) {
    try {
      if (!isChannelClosed()) {
        log.warn(
            "createNewChannelAndStartConsume: channel of {} is not closed and can't open new",
            topology.queueName());
        return false;
      }
      if (!hasHandlers()) {
        log.error(
            "createNewChannelAndStartConsume: consumer of {} is not subscribed",
            topology.queueName());
        return false;
      }
      channelLock.lock();
      try {
        if (!isChannelClosed()) {
          log.warn(
              "createNewChannelAndStartConsume: channel of {} is not closed and can't open new",
              topology.queueName());
          return false;
        }
        consumerTags.clear();
        openChannel();
      } finally {
        channelLock.unlock();
      }
      return startConsume(rethrow);
    } catch (RuntimeException e) {
      log.error("createNewChannelAndStartConsume error on {}", topology.queueName(), e);
      if (rethrow) {
        throw e;
      }
      return false;
    }
  }

  @Override
  public boolean startConsume(boolean rethrow) {
    try {
      if (!consumerTags.isEmpty()) {
        log.warn(
            "startConsume: {} is already consuming with tags {}",
            topology.queueName(),
            consumerTags);
        return false;
      }
      if (!hasHandlers()) {
        log.error("startConsume: consumer of {} is not subscribed", topology.queueName());
        return false;
      }
      consumeLock.lock();
      try {
        if (!consumerTags.isEmpty()) {
          log.warn(
              "startConsume: {} is already consuming with tags {}",
              topology.queueName(),
              consumerTags);
          return false;
        }
        GuardedChannel current = channel;
        if (current == null || !current.isOpen()) {
          throw new ChannelException("Channel of " + topology.queueName() + " is not open");
        }
        startConsumeOn(current);
        state = ConsumerState.SUBSCRIBED;
      } finally {
        consumeLock.unlock();
      }
      return true;
    } catch (IOException e) {
      log.error("startConsume error on {}", topology.queueName(), e);
      if (rethrow) {
        throw new ChannelException("Failed to start consuming " + topology.queueName(), e);
      }
      return false;
    } catch (RuntimeException e) {
      log.error("startConsume error on {}", topology.queueName(), e);
      if (rethrow) {
        throw e;
      }
      return false;
    }
  }

  @Override
  public void basicCancel() {
    GuardedChannel current = channel;
    if (current == null) {
      return;
    }
    for (String tag : Set.copyOf(consumerTags)) {
      try {
        current.basicCancel(tag);
      } catch (IOException e) {
        throw new ChannelException("Failed to cancel consumer tag " + tag, e);
      }
      consumerTags.remove(tag);
      log.info("Cancelled consumer tag={} on queue={}", tag, topology.queueName());
    }
    if (state == ConsumerState.SUBSCRIBED) {
      state = ConsumerState.CANCELLED;
    }
  }

  @Override
  public void closeChannel() {
    channelLock.lock();
    try {
      GuardedChannel current = channel;
      if (current != null) {
        current.close();
      }
      consumerTags.clear();
    } finally {
      channelLock.unlock();
    }
  }

  @Override
  public Set<String> consumerTags() {
    return Set.copyOf(consumerTags);
  }

  @Override
  public String queueName() {
    return topology.queueName();
  }

  @Override
  public ConsumerState state() {
    return state;
  }

  public QueueTopology topology() {
    return topology;
  }

  @Override
  public void addLifecycleListener(ConsumerLifecycleListener listener) {
    lifecycleListeners.add(listener);
  }

  /** Stops intake and lets in-flight handlers finish within a grace period before closing. */
  @Override
  public void close() {
    consumeLock.lock();
    try {
      if (state == ConsumerState.CLOSED) {
        return;
      }
      state = ConsumerState.CLOSED;
    } finally {
      consumeLock.unlock();
    }
    lifecycleListeners.clear();

    dispatcher.shutdown();
    try {
      if (!dispatcher.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Handlers of {} did not finish within {}", topology.queueName(), SHUTDOWN_GRACE);
        dispatcher.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      dispatcher.shutdownNow();
    }

    GuardedChannel current = channel;
    if (current != null && current.isOpen()) {
      current.close();
    }
    channel = null;
    consumerTags.clear();
    if (ownsProvider) {
      connectionProvider.close();
    }
    log.info("Consumer closed: queue={}", topology.queueName());
  }

  private boolean isChannelClosed() {
    GuardedChannel current = channel;
    return current == null || !current.isOpen();
  }

  private boolean hasHandlers() {
    return onDequeue != null
        && state != ConsumerState.UNBOUND
        && state != ConsumerState.CLOSED;
  }

  private GuardedChannel openChannel() {
    GuardedChannel opened;
    try {
      opened = GuardedChannel.of(connectionProvider.getOrCreate().createChannel());
    } catch (IOException e) {
      throw new ChannelException("Failed to open channel for " + topology.queueName(), e);
    }
    try {
      TopologyBuilder.declare(opened, topology);
    } catch (RuntimeException e) {
      opened.close();
      throw e;
    }
    channel = opened;
    return opened;
  }

  private void startConsumeOn(GuardedChannel target) throws IOException {
    target.basicQos(prefetchSize, prefetchCount);
    if (config.isPublisherConfirmsEnabled()) {
      target.confirmSelect();
    }
    String tag =
        target.basicConsume(
            topology.queueName(), delivery -> dispatch(target, delivery), signalListener);
    consumerTags.add(tag);
    log.debug("Consuming queue={} tag={}", topology.queueName(), tag);
  }

  private void dispatch(GuardedChannel source, Delivery delivery) {
    try {
      dispatcher.execute(() -> handleDelivery(source, delivery));
    } catch (RejectedExecutionException e) {
      log.warn(
          "Consumer of {} is closing, returning delivery tag={} to the queue",
          topology.queueName(),
          delivery.deliveryTag());
      try {
        source.basicNack(delivery.deliveryTag(), false, true);
      } catch (IOException | RuntimeException nackFailure) {
        log.warn("Failed to requeue delivery tag={}", delivery.deliveryTag(), nackFailure);
      }
    }
  }

  void handleDelivery(GuardedChannel source, Delivery delivery) {
    int retryCount = delivery.properties().intHeader(ConfigDefaults.HEADER_RETRIES, 0);
    boolean lastTry = topology.retryPolicy().isLastTry(retryCount);

    T payload = null;
    MessageContext<T> context = context(delivery, retryCount, lastTry, null);
    AmqpClientException failure = null;
    try (HandlerScope scope = scopeFactory.openScope()) {
      try {
        payload = codec.decode(delivery.body(), messageType);
      } catch (CodecException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new CodecException("Failed to decode message for " + topology.queueName(), e);
      }
      context = context(delivery, retryCount, lastTry, payload);
      onDequeue.handle(payload, scope, context);
    } catch (CodecException e) {
      failure = e;
    } catch (Exception e) {
      failure = new HandlerException("Handler failed for queue " + topology.queueName(), e);
    }

    if (failure == null) {
      ack(source, delivery);
      return;
    }
    log.error(
        "Consumer error: queue={}, tag={}, deliveryTag={}, retryCount={}, isLastTry={}",
        topology.queueName(),
        delivery.consumerTag(),
        delivery.deliveryTag(),
        retryCount,
        lastTry,
        failure);
    notifyErrorHandler(payload, context, failure);
    retryOrReject(source, delivery, retryCount);
  }

  private MessageContext<T> context(Delivery d, int retryCount, boolean lastTry, T payload) {
    MessageEnvelope<T> envelope =
        new MessageEnvelope<>(
            d.exchange(),
            d.routingKey(),
            d.deliveryTag(),
            d.consumerTag(),
            d.redelivered(),
            retryCount,
            d.properties(),
            payload);
    return new MessageContext<>(this, lastTry, envelope);
  }

  private void notifyErrorHandler(
      T payload, MessageContext<T> context, AmqpClientException failure) {
    ErrorHandler<T> handler = onError;
    if (handler == null) {
      return;
    }
    try (HandlerScope scope = scopeFactory.openScope()) {
      handler.onError(payload, scope, context, failure);
    } catch (Exception e) {
      log.error("onError handler failed for queue={}", topology.queueName(), e);
    }
  }

  RetryDecision retryOrReject(GuardedChannel source, Delivery delivery, int retryCount) {
    RetryDecision decision =
        RetryDecision.decide(topology.retryPolicy(), topology.deadLettering(), retryCount);
    long tag = delivery.deliveryTag();
    try {
      switch (decision.action()) {
        case ACK_DROP -> {
          source.basicAck(tag, false);
          log.warn(
              "Dropped message deliveryTag={} from {} after {} retries",
              tag,
              topology.queueName(),
              retryCount);
        }
        case DEAD_LETTER -> {
          source.basicNack(tag, false, false);
          log.warn("Dead-lettered message deliveryTag={} to {}", tag, topology.deadLetterQueue());
        }
        case RETRY -> republish(source, delivery, decision.tier(), retryCount);
      }
    } catch (IOException | RuntimeException e) {
      log.error("Failed to settle deliveryTag={} on {}", tag, topology.queueName(), e);
    }
    return decision;
  }

  private void republish(GuardedChannel source, Delivery delivery, RetryTier tier, int retryCount)
      throws IOException {
    MessageProperties properties =
        delivery
            .properties()
            .withExpirationMs(tier.ttlMs())
            .withHeader(ConfigDefaults.HEADER_RETRIES, retryCount + 1);
    try {
      if (confirmTimeout != null) {
        source.publishAndConfirm(
            topology.retryExchange(), tier.id(), true, properties, delivery.body(), confirmTimeout);
      } else {
        source.basicPublish(topology.retryExchange(), tier.id(), true, properties, delivery.body());
      }
    } catch (IOException | TimeoutException | InterruptedException e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.error(
          "Failed to republish deliveryTag={} to retry tier {}, requeueing",
          delivery.deliveryTag(),
          tier.id(),
          e);
      source.basicNack(delivery.deliveryTag(), false, true);
      return;
    }
    source.basicAck(delivery.deliveryTag(), false);
    log.info(
        "Scheduled retry {}/{} for deliveryTag={} on {} in {}",
        retryCount + 1,
        topology.retryPolicy().maxAttempts(),
        delivery.deliveryTag(),
        topology.queueName(),
        tier.id());
  }

  private void ack(GuardedChannel source, Delivery delivery) {
    try {
      source.basicAck(delivery.deliveryTag(), false);
    } catch (IOException | RuntimeException e) {
      log.error(
          "Failed to ack deliveryTag={} on {}, broker will redeliver",
          delivery.deliveryTag(),
          topology.queueName(),
          e);
    }
  }

  private void fireLifecycle(java.util.function.Consumer<ConsumerLifecycleListener> call) {
    for (ConsumerLifecycleListener listener : lifecycleListeners) {
      try {
        call.accept(listener);
      } catch (Exception e) {
        log.error("Consumer lifecycle listener failed for queue={}", topology.queueName(), e);
      }
    }
  }

  private final class SignalBridge implements ConsumerSignalListener {

    @Override
    public void onRegistered(String consumerTag) {
      log.info("Consumer registered: queue={}, tag={}", topology.queueName(), consumerTag);
      fireLifecycle(l -> l.onRegistered(topology.queueName(), consumerTag));
    }

    @Override
    public void onCancelled(String consumerTag) {
      consumerTags.remove(consumerTag);
      log.warn("Consumer cancelled: queue={}, tag={}", topology.queueName(), consumerTag);
      fireLifecycle(l -> l.onCancelled(topology.queueName(), consumerTag));
    }

    @Override
    public void onShutdown(String consumerTag, String reason) {
      consumerTags.remove(consumerTag);
      log.warn(
          "Consumer shutdown: queue={}, tag={}, reason={}",
          topology.queueName(),
          consumerTag,
          reason);
      fireLifecycle(l -> l.onShutdown(topology.queueName(), consumerTag, reason));
    }
  }
}
