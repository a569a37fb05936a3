package com.acme.amqp.core;

/** A channel could not be opened, configured or closed. */
public class ChannelException extends AmqpClientException {
  public ChannelException(String message) {
    super(message);
  }

  public ChannelException(String message, Throwable e) {
    super(message, e);
  }
}
