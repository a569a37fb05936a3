package com.acme.amqp.consumer;

import com.acme.amqp.config.ConsumerConfig;
import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.connection.ConnectionManager;
import com.acme.amqp.core.ConfigException;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.Transport;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds the {@code consumersCount} consumers of a consumer configuration. */
public final class ConsumerFactory {

  private static final Logger log = LoggerFactory.getLogger(ConsumerFactory.class);

  private ConsumerFactory() {}

  /**
   * @param singleConnectionPerConsumerGroup {@code true} to share one connection between all
   *     consumers, {@code false} to give each consumer its own connection named {@code
   *     clientId:clientName:i}
   * @param clientName suffix of the connection name; may be null
   * @throws ConfigException when either configuration is missing or invalid
   */
  public static <T> ConsumerGroup<T> createConsumers(
      ServerEndpoint endpoint,
      ConsumerConfig config,
      Transport transport,
      Codec codec,
      Class<T> messageType,
      ScopeFactory scopeFactory,
      boolean singleConnectionPerConsumerGroup,
      String clientName) {
    if (endpoint == null || config == null) {
      throw new ConfigException("ConsumerFactory: config is null");
    }
    if (transport == null || codec == null) {
      throw new ConfigException("ConsumerFactory: transport and codec are required");
    }
    endpoint.validate();
    config.validate();

    ConnectionManager shared =
        singleConnectionPerConsumerGroup
            ? new ConnectionManager(transport, endpoint, clientName)
            : null;

    List<Consumer<T>> consumers = new ArrayList<>(config.getConsumersCount());
    for (int i = 0; i < config.getConsumersCount(); i++) {
      if (shared != null) {
        consumers.add(
            new QueueConsumer<>(config, shared, false, codec, messageType, scopeFactory));
      } else {
        String suffix = clientName == null ? String.valueOf(i) : clientName + ":" + i;
        consumers.add(
            new QueueConsumer<>(
                config,
                new ConnectionManager(transport, endpoint, suffix),
                true,
                codec,
                messageType,
                scopeFactory));
      }
    }
    log.info(
        "Created {} consumers for {} (sharedConnection={})",
        consumers.size(),
        consumers.get(0).queueName(),
        singleConnectionPerConsumerGroup);
    return new ConsumerGroup<>(consumers, shared);
  }

  public static <T> void subscribeAll(
      Collection<? extends Consumer<T>> consumers,
      DequeueHandler<T> onDequeue,
      ErrorHandler<T> onError) {
    for (Consumer<T> consumer : consumers) {
      consumer.subscribe(onDequeue, onError);
    }
  }
}
