package com.acme.amqp.spi;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * A broker channel. Implementations are not required to be thread safe; callers sharing a channel
 * wrap it in {@link com.acme.amqp.channel.GuardedChannel}.
 */
public interface BrokerChannel extends AutoCloseable {

  boolean isOpen();

  void exchangeDeclare(String exchange, String type, boolean durable) throws IOException;

  void queueDeclare(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException;

  void queueBind(String queue, String exchange, String routingKey) throws IOException;

  void basicQos(int prefetchSize, int prefetchCount) throws IOException;

  void confirmSelect() throws IOException;

  void basicPublish(
      String exchange,
      String routingKey,
      boolean mandatory,
      MessageProperties properties,
      byte[] body)
      throws IOException;

  /** Publishes all messages as one batch; the default publishes them one by one. */
  default void publishBatch(List<OutboundMessage> messages) throws IOException {
    for (OutboundMessage m : messages) {
      basicPublish(m.exchange(), m.routingKey(), m.mandatory(), m.properties(), m.body());
    }
  }

  /**
   * Waits until every message published since the last call is confirmed.
   *
   * @throws IOException when the broker nacked a message
   * @throws TimeoutException when confirms did not arrive in time
   */
  void waitForConfirmsOrDie(Duration timeout)
      throws IOException, InterruptedException, TimeoutException;

  /** @return the consumer tag assigned by the broker */
  String basicConsume(String queue, DeliveryHandler handler, ConsumerSignalListener listener)
      throws IOException;

  void basicCancel(String consumerTag) throws IOException;

  void basicAck(long deliveryTag, boolean multiple) throws IOException;

  void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException;

  /** Closes the channel. Never throws. */
  @Override
  void close();
}
