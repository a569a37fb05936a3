package com.acme.amqp.rabbitmq;

import com.acme.amqp.spi.BrokerChannel;
import com.acme.amqp.spi.ConsumerSignalListener;
import com.acme.amqp.spi.Delivery;
import com.acme.amqp.spi.DeliveryHandler;
import com.acme.amqp.spi.MessageProperties;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.time.Duration;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class RabbitMqChannel implements BrokerChannel {

  private static final int PERSISTENT = 2;
  private static final int TRANSIENT = 1;

  private final Channel channel;

  RabbitMqChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void exchangeDeclare(String exchange, String type, boolean durable) throws IOException {
    channel.exchangeDeclare(exchange, type, durable);
  }

  @Override
  public void queueDeclare(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException {
    Map<String, Object> args = arguments == null || arguments.isEmpty() ? null : arguments;
    channel.queueDeclare(queue, durable, exclusive, autoDelete, args);
  }

  @Override
  public void queueBind(String queue, String exchange, String routingKey) throws IOException {
    channel.queueBind(queue, exchange, routingKey);
  }

  @Override
  public void basicQos(int prefetchSize, int prefetchCount) throws IOException {
    channel.basicQos(prefetchSize, prefetchCount, false);
  }

  @Override
  public void confirmSelect() throws IOException {
    channel.confirmSelect();
  }

  @Override
  public void basicPublish(
      String exchange,
      String routingKey,
      boolean mandatory,
      MessageProperties properties,
      byte[] body)
      throws IOException {
    channel.basicPublish(exchange, routingKey, mandatory, toBasicProperties(properties), body);
  }

  @Override
  public void waitForConfirmsOrDie(Duration timeout)
      throws IOException, InterruptedException, TimeoutException {
    channel.waitForConfirmsOrDie(timeout.toMillis());
  }

  @Override
  public String basicConsume(String queue, DeliveryHandler handler, ConsumerSignalListener listener)
      throws IOException {
    return channel.basicConsume(queue, false, new DispatchingConsumer(channel, handler, listener));
  }

  @Override
  public void basicCancel(String consumerTag) throws IOException {
    channel.basicCancel(consumerTag);
  }

  @Override
  public void basicAck(long deliveryTag, boolean multiple) throws IOException {
    channel.basicAck(deliveryTag, multiple);
  }

  @Override
  public void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
    channel.basicNack(deliveryTag, multiple, requeue);
  }

  @Override
  public void close() {
    if (!channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      log.debug("Channel {} already closing: {}", channel.getChannelNumber(), e.getMessage());
    }
  }

  static AMQP.BasicProperties toBasicProperties(MessageProperties properties) {
    return new AMQP.BasicProperties.Builder()
        .contentType(properties.contentType())
        .contentEncoding(properties.contentEncoding())
        .deliveryMode(properties.persistent() ? PERSISTENT : TRANSIENT)
        .priority(properties.priority())
        .expiration(properties.expirationMs() != null ? properties.expirationMs().toString() : null)
        .messageId(properties.messageId())
        .correlationId(properties.correlationId())
        .type(properties.type())
        .replyTo(properties.replyTo())
        .timestamp(properties.timestamp() != null ? Date.from(properties.timestamp()) : null)
        .appId(properties.appId())
        .userId(properties.userId())
        .headers(properties.headers().isEmpty() ? null : new HashMap<>(properties.headers()))
        .build();
  }

  static MessageProperties toMessageProperties(AMQP.BasicProperties properties) {
    if (properties == null) {
      return MessageProperties.empty();
    }
    Map<String, Object> headers = new HashMap<>();
    if (properties.getHeaders() != null) {
      properties
          .getHeaders()
          .forEach(
              (key, value) -> {
                if (value != null) {
                  headers.put(key, value instanceof LongString ? value.toString() : value);
                }
              });
    }
    Long expiration = null;
    if (properties.getExpiration() != null) {
      try {
        expiration = Long.parseLong(properties.getExpiration());
      } catch (NumberFormatException e) {
        log.warn("Ignoring non-numeric expiration '{}'", properties.getExpiration());
      }
    }
    Integer deliveryMode = properties.getDeliveryMode();
    Date timestamp = properties.getTimestamp();
    return new MessageProperties(
        properties.getContentType(),
        properties.getContentEncoding(),
        deliveryMode != null && deliveryMode == PERSISTENT,
        properties.getPriority(),
        expiration,
        properties.getMessageId(),
        properties.getCorrelationId(),
        properties.getType(),
        properties.getReplyTo(),
        timestamp != null ? timestamp.toInstant() : null,
        properties.getAppId(),
        properties.getUserId(),
        headers);
  }

  private static final class DispatchingConsumer extends DefaultConsumer {

    private final DeliveryHandler handler;
    private final ConsumerSignalListener listener;

    DispatchingConsumer(Channel channel, DeliveryHandler handler, ConsumerSignalListener listener) {
      super(channel);
      this.handler = handler;
      this.listener = listener;
    }

    @Override
    public void handleConsumeOk(String consumerTag) {
      super.handleConsumeOk(consumerTag);
      listener.onRegistered(consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      listener.onCancelled(consumerTag);
    }

    @Override
    public void handleCancel(String consumerTag) {
      listener.onCancelled(consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      listener.onShutdown(consumerTag, sig.getMessage());
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      handler.handle(
          new Delivery(
              consumerTag,
              envelope.getDeliveryTag(),
              envelope.getExchange(),
              envelope.getRoutingKey(),
              envelope.isRedeliver(),
              toMessageProperties(properties),
              body));
    }
  }
}
