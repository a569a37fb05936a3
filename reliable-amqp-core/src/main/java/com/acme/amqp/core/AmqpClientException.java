package com.acme.amqp.core;

/** Root of every failure raised by the client. All subclasses are unchecked. */
public class AmqpClientException extends RuntimeException {
  public AmqpClientException(String message) {
    super(message);
  }

  public AmqpClientException(String message, Throwable e) {
    super(message, e);
  }
}
