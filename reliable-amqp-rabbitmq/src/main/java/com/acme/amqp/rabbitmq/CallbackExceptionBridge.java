package com.acme.amqp.rabbitmq;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.impl.DefaultExceptionHandler;

/** Keeps the client's default handling and additionally reports to the owning connection. */
class CallbackExceptionBridge extends DefaultExceptionHandler {

  private volatile RabbitMqConnection target;

  void bind(RabbitMqConnection connection) {
    this.target = connection;
  }

  @Override
  public void handleConsumerException(
      Channel channel,
      Throwable exception,
      Consumer consumer,
      String consumerTag,
      String methodName) {
    super.handleConsumerException(channel, exception, consumer, consumerTag, methodName);
    report(exception);
  }

  @Override
  public void handleUnexpectedConnectionDriverException(Connection conn, Throwable exception) {
    super.handleUnexpectedConnectionDriverException(conn, exception);
    report(exception);
  }

  private void report(Throwable exception) {
    RabbitMqConnection current = target;
    if (current != null) {
      current.fireCallbackException(exception);
    }
  }
}
