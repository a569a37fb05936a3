package com.acme.amqp.rabbitmq;

import com.acme.amqp.codec.JacksonCodec;
import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.consumer.ScopeFactory;
import com.acme.amqp.producer.Producer;
import com.acme.amqp.producer.ProducerFactory;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.Transport;
import io.micronaut.context.BeanContext;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

/**
 * Wires the framework-free client into Micronaut. Endpoint and producer settings are bound from
 * {@code amqp.server.*} and {@code amqp.producer.*}; consumers are built by the application through
 * {@link com.acme.amqp.consumer.ConsumerFactory} with the beans exposed here.
 */
@Factory
public class AmqpFactory {

  /** Name under which the default producer is registered in the {@link ProducerFactory}. */
  public static final String DEFAULT_PRODUCER = "default";

  @Singleton
  @ConfigurationProperties("amqp.server")
  public ServerEndpoint serverEndpoint() {
    return new ServerEndpoint();
  }

  @Singleton
  @ConfigurationProperties("amqp.producer")
  public ProducerConfig producerConfig() {
    return new ProducerConfig();
  }

  @Singleton
  public Transport transport() {
    return new RabbitMqTransport();
  }

  @Singleton
  public Codec codec() {
    return new JacksonCodec();
  }

  @Singleton
  public ScopeFactory scopeFactory(BeanContext beanContext) {
    return new BeanContextScopeFactory(beanContext);
  }

  @Singleton
  @Bean(preDestroy = "close")
  public ProducerFactory producerFactory() {
    return new ProducerFactory();
  }

  /** Producer with a private connection named {@code clientId:default}. */
  @Singleton
  @Named(DEFAULT_PRODUCER)
  @Requires(property = "amqp.producer")
  public Producer defaultProducer(
      ProducerFactory producerFactory,
      ServerEndpoint serverEndpoint,
      ProducerConfig producerConfig,
      Transport transport,
      Codec codec) {
    return producerFactory.create(
        DEFAULT_PRODUCER, serverEndpoint, producerConfig, transport, codec);
  }
}
