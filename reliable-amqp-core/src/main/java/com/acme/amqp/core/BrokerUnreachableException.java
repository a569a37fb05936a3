package com.acme.amqp.core;

/** No broker host accepted a connection within the configured reconnect attempts. */
public class BrokerUnreachableException extends AmqpClientException {
  public BrokerUnreachableException(String message) {
    super(message);
  }

  public BrokerUnreachableException(String message, Throwable e) {
    super(message, e);
  }
}
