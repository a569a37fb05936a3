package com.acme.amqp.core;

/** The channel pool is at capacity and the wait timed out. Callers may retry. */
public class PoolExhaustedException extends AmqpClientException {
  public PoolExhaustedException(String message) {
    super(message);
  }

  public PoolExhaustedException(String message, Throwable e) {
    super(message, e);
  }
}
