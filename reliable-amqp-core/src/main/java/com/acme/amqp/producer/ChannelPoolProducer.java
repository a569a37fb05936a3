package com.acme.amqp.producer;

import com.acme.amqp.channel.GuardedChannel;
import com.acme.amqp.config.ConfigDefaults;
import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.core.Chunks;
import com.acme.amqp.core.ConfigException;
import com.acme.amqp.core.PublishException;
import com.acme.amqp.pool.ChannelPool;
import com.acme.amqp.pool.PooledChannel;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.MessageProperties;
import com.acme.amqp.spi.OutboundMessage;
import com.acme.amqp.topology.QueueNaming;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link Producer} that borrows a pooled channel for each publish call. */
public class ChannelPoolProducer implements Producer {

  private static final Logger log = LoggerFactory.getLogger(ChannelPoolProducer.class);

  private final ChannelPool pool;
  private final Codec codec;
  private final Duration confirmTimeout;
  private final int defaultBatchSize;
  private final Map<Class<?>, TypeRoute> typeRoutes = new ConcurrentHashMap<>();

  public ChannelPoolProducer(ChannelPool pool, ProducerConfig config, Codec codec) {
    config.validate();
    this.pool = pool;
    this.codec = codec;
    this.confirmTimeout =
        config.isPublisherConfirmsEnabled() ? config.getPublisherConfirms().waitConfirms() : null;
    this.defaultBatchSize = config.batchSizeOrDefault();
  }

  @Override
  public void publish(String exchange, String routingKey, Object message, PublishOptions options) {
    PooledChannel pooled = null;
    try {
      byte[] body = codec.encode(message);
      MessageProperties properties = properties(options);
      pooled = pool.acquire();
      GuardedChannel channel = pooled.channel();
      if (confirmTimeout != null) {
        channel.confirmSelect();
      }
      channel.basicPublish(exchange, routingKey, true, properties, body);
      if (confirmTimeout != null) {
        channel.waitForConfirmsOrDie(confirmTimeout);
      }
    } catch (IOException | TimeoutException | InterruptedException e) {
      markBroken(pooled);
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.error("Producer error: exchange={}, routingKey={}", exchange, routingKey, e);
      throw new PublishException(
          "Failed to publish to exchange=" + exchange + ", routingKey=" + routingKey, e);
    } catch (RuntimeException e) {
      log.error("Producer error: exchange={}, routingKey={}", exchange, routingKey, e);
      throw e;
    } finally {
      pool.release(pooled);
    }
  }

  @Override
  public void publishAll(
      String exchange, String routingKey, Iterable<?> messages, PublishOptions options) {
    if (options.batchSize() != null && options.batchSize() < 1) {
      throw new ConfigException("Publish batchSize must be > 0 but was " + options.batchSize());
    }
    int batchSize = options.batchSize() != null ? options.batchSize() : defaultBatchSize;
    List<List<Object>> chunks = Chunks.<Object>of(messages, batchSize);
    if (chunks.isEmpty()) {
      return;
    }
    MessageProperties properties = properties(options);
    PooledChannel pooled = null;
    int published = 0;
    try {
      pooled = pool.acquire();
      GuardedChannel channel = pooled.channel();
      if (confirmTimeout != null) {
        channel.confirmSelect();
      }
      for (List<Object> chunk : chunks) {
        List<OutboundMessage> batch = new ArrayList<>(chunk.size());
        for (Object message : chunk) {
          batch.add(
              new OutboundMessage(exchange, routingKey, true, properties, codec.encode(message)));
        }
        channel.publishBatch(batch);
        if (confirmTimeout != null) {
          channel.waitForConfirmsOrDie(confirmTimeout);
        }
        published += batch.size();
      }
      log.debug(
          "Published {} messages in {} batches to exchange={}, routingKey={}",
          published,
          chunks.size(),
          exchange,
          routingKey);
    } catch (IOException | TimeoutException | InterruptedException e) {
      markBroken(pooled);
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      log.error(
          "Producer error while batch publish: exchange={}, routingKey={}, published={}",
          exchange,
          routingKey,
          published,
          e);
      throw new PublishException(
          "Failed to batch publish to exchange="
              + exchange
              + ", routingKey="
              + routingKey
              + " after "
              + published
              + " messages",
          e);
    } catch (RuntimeException e) {
      log.error(
          "Producer error while batch publish: exchange={}, routingKey={}",
          exchange,
          routingKey,
          e);
      throw e;
    } finally {
      pool.release(pooled);
    }
  }

  @Override
  public void publish(Object message, PublishOptions options) {
    TypeRoute route = routeFor(message.getClass());
    publish(route.exchange(), route.queue(), message, options);
  }

  @Override
  public <T> void publish(T message, Class<T> type, PublishOptions options) {
    TypeRoute route = routeFor(type);
    publish(route.exchange(), route.queue(), message, options);
  }

  @Override
  public <T> void publishAll(
      Iterable<? extends T> messages, Class<T> type, PublishOptions options) {
    TypeRoute route = routeFor(type);
    publishAll(route.exchange(), route.queue(), messages, options);
  }

  @Override
  public void warmUp() {
    pool.warmUp();
  }

  @Override
  public void close() {
    pool.close();
  }

  TypeRoute routeFor(Class<?> type) {
    return typeRoutes.computeIfAbsent(
        type,
        t -> {
          String queue = QueueNaming.forType(t);
          return new TypeRoute(queue, QueueNaming.directExchange(queue));
        });
  }

  int cachedRoutes() {
    return typeRoutes.size();
  }

  private MessageProperties properties(PublishOptions options) {
    MessageProperties properties =
        new MessageProperties(codec.contentType(), true, null, null, Map.of());
    if (options.priority() != null) {
      properties = properties.withPriority(options.priority());
    }
    if (options.expirationMs() > ConfigDefaults.MIN_EXPIRATION_MS) {
      properties = properties.withExpirationMs(options.expirationMs());
    }
    return properties;
  }

  private static void markBroken(PooledChannel pooled) {
    if (pooled != null) {
      pooled.markBroken();
    }
  }

  record TypeRoute(String queue, String exchange) {}
}
