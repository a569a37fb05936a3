package com.acme.amqp.rabbitmq;

import com.acme.amqp.producer.Producer;
import com.acme.amqp.producer.ProducerFactory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Opens producer connections at startup instead of on the first publish. */
@Slf4j
@Singleton
@Requires(property = "amqp.producer.open-on-startup", value = "true")
public class ProducerWarmUp implements ApplicationEventListener<StartupEvent> {

  private final ProducerFactory producerFactory;

  /** {@code defaultProducer} is injected so it is registered before warm-up runs. */
  public ProducerWarmUp(
      ProducerFactory producerFactory,
      @Named(AmqpFactory.DEFAULT_PRODUCER) Producer defaultProducer) {
    this.producerFactory = producerFactory;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    log.info("Opening producer connections on startup: {}", producerFactory.keys());
    producerFactory.warmUp();
  }
}
