package com.acme.amqp.rabbitmq;

import static org.assertj.core.api.Assertions.*;

import com.acme.amqp.codec.JacksonCodec;
import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.consumer.ScopeFactory;
import com.acme.amqp.producer.Producer;
import com.acme.amqp.producer.ProducerFactory;
import com.acme.amqp.spi.Codec;
import com.acme.amqp.spi.Transport;
import io.micronaut.context.ApplicationContext;
import io.micronaut.context.env.Environment;
import io.micronaut.inject.qualifiers.Qualifiers;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for AmqpFactory */
class AmqpFactoryTest {

  @Nested
  @DisplayName("Micronaut Context Tests")
  class ContextTests {

    @Test
    @DisplayName("should expose the client beans as singletons")
    void shouldCreateBeans() {
      try (ApplicationContext context =
          ApplicationContext.run(
              Map.of("amqp.server.hosts", "localhost", "amqp.server.client-id", "svc"),
              Environment.TEST)) {

        assertThat(context.getBean(ServerEndpoint.class)).isNotNull();
        assertThat(context.getBean(ProducerConfig.class)).isNotNull();
        assertThat(context.getBean(Transport.class)).isInstanceOf(RabbitMqTransport.class);
        assertThat(context.getBean(Codec.class)).isInstanceOf(JacksonCodec.class);
        assertThat(context.getBean(ScopeFactory.class))
            .isInstanceOf(BeanContextScopeFactory.class);
        assertThat(context.getBean(ProducerFactory.class))
            .isSameAs(context.getBean(ProducerFactory.class));
      }
    }

    @Test
    @DisplayName("should not register a default producer without producer settings")
    void shouldSkipDefaultProducer() {
      try (ApplicationContext context = ApplicationContext.run(Environment.TEST)) {

        assertThat(
                context.containsBean(
                    Producer.class, Qualifiers.byName(AmqpFactory.DEFAULT_PRODUCER)))
            .isFalse();
      }
    }

    @Test
    @DisplayName("should not log configuration in the test environment")
    void shouldSkipConfigurationLoggerInTests() {
      try (ApplicationContext context =
          ApplicationContext.run(Map.of("amqp.server.hosts", "localhost"), Environment.TEST)) {

        assertThat(context.containsBean(AmqpConfigurationLogger.class)).isFalse();
      }
    }

    @Test
    @DisplayName("should not warm up producers unless asked to")
    void shouldSkipWarmUpByDefault() {
      try (ApplicationContext context = ApplicationContext.run(Environment.TEST)) {

        assertThat(context.containsBean(ProducerWarmUp.class)).isFalse();
      }
    }
  }
}
