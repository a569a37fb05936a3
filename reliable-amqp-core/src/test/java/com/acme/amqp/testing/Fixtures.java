package com.acme.amqp.testing;

import com.acme.amqp.config.ChannelPoolConfig;
import com.acme.amqp.config.ConsumerConfig;
import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.config.RetryConfig;
import com.acme.amqp.config.ServerEndpoint;
import java.util.List;

/** Configuration builders shared by tests. */
public final class Fixtures {

  private Fixtures() {}

  public static ServerEndpoint endpoint() {
    ServerEndpoint endpoint = new ServerEndpoint();
    endpoint.setUserName("guest");
    endpoint.setPassword("guest");
    endpoint.setVirtualHost("/");
    endpoint.setHosts(List.of("localhost"));
    endpoint.setClientId("test-client");
    return endpoint;
  }

  public static ServerEndpoint endpoint(int reconnectCount) {
    ServerEndpoint endpoint = endpoint();
    endpoint.setReconnectCount(reconnectCount);
    return endpoint;
  }

  public static ConsumerConfig consumer(String queue) {
    ConsumerConfig config = new ConsumerConfig();
    QueueConfig queueConfig = new QueueConfig();
    queueConfig.setName(queue);
    config.setQueue(queueConfig);
    return config;
  }

  public static ConsumerConfig consumer(String queue, Long... retryTtlMs) {
    ConsumerConfig config = consumer(queue);
    config.setRetry(new RetryConfig(List.of(retryTtlMs)));
    return config;
  }

  public static ProducerConfig producer(int min, int max, long waitMs) {
    ProducerConfig config = new ProducerConfig();
    config.setChannelPool(new ChannelPoolConfig(min, max, waitMs));
    return config;
  }
}
