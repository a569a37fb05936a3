package com.acme.amqp.producer;

import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.connection.ConnectionManager;
import com.acme.amqp.core.ConfigException;
import com.acme.amqp.pool.ChannelPool;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.Transport;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registry of named producers. Closing the factory closes every registered producer. */
public class ProducerFactory implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ProducerFactory.class);

  private final Map<String, Producer> producers = new ConcurrentHashMap<>();

  /**
   * Builds a producer with its own connection and channel pool. The pool owns the connection, so
   * closing the producer closes both.
   *
   * @param clientName connection name suffix; may be null
   */
  public static Producer newProducer(
      ServerEndpoint endpoint,
      ProducerConfig config,
      Transport transport,
      Codec codec,
      String clientName) {
    if (endpoint == null || config == null) {
      throw new ConfigException("ProducerFactory: config is null");
    }
    endpoint.validate();
    config.validate();
    ConnectionManager connection = new ConnectionManager(transport, endpoint, clientName);
    ChannelPool pool = new ChannelPool(connection, config.getChannelPool(), true);
    return new ChannelPoolProducer(pool, config, codec);
  }

  /** Creates a producer and registers it under {@code key}. */
  public Producer create(
      String key,
      ServerEndpoint endpoint,
      ProducerConfig config,
      Transport transport,
      Codec codec) {
    Producer producer = newProducer(endpoint, config, transport, codec, key);
    try {
      add(key, producer);
    } catch (ConfigException e) {
      producer.close();
      throw e;
    }
    return producer;
  }

  /** @throws ConfigException when a producer is already registered under {@code key} */
  public void add(String key, Producer producer) {
    if (key == null || producer == null) {
      throw new ConfigException("Producer key and producer are required");
    }
    if (producers.putIfAbsent(key, producer) != null) {
      throw new ConfigException("Can't add producer by key=" + key + ", it already exists");
    }
  }

  /** @throws ConfigException when no producer is registered under {@code key} */
  public Producer get(String key) {
    Producer producer = producers.get(key);
    if (producer == null) {
      throw new ConfigException("Producer not found by key=" + key);
    }
    return producer;
  }

  public Set<String> keys() {
    return Set.copyOf(producers.keySet());
  }

  /** Opens every producer's connection and primes its pool. Failures are logged per producer. */
  public void warmUp() {
    producers.forEach(
        (key, producer) -> {
          try {
            producer.warmUp();
            log.info("Producer {} warmed up", key);
          } catch (RuntimeException e) {
            log.error("Failed to warm up producer {}", key, e);
          }
        });
  }

  @Override
  public void close() {
    producers.forEach(
        (key, producer) -> {
          try {
            producer.close();
          } catch (RuntimeException e) {
            log.warn("Failed to close producer {}", key, e);
          }
        });
    producers.clear();
  }
}
