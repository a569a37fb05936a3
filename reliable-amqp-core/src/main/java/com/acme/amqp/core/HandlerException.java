package com.acme.amqp.core;

/**
 * A user on-dequeue handler failed. The original exception is always the cause so that it can be
 * logged and handed to the on-error callback.
 */
public class HandlerException extends AmqpClientException {
  public HandlerException(String message, Throwable cause) {
    super(message, cause);
  }
}
