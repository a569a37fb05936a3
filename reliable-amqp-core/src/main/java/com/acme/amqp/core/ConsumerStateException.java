package com.acme.amqp.core;

/** Operation attempted on a consumer in an incompatible state. */
public class ConsumerStateException extends AmqpClientException {
  public ConsumerStateException(String message) {
    super(message);
  }

  public ConsumerStateException(String message, Throwable e) {
    super(message, e);
  }
}
