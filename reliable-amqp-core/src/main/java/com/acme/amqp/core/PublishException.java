package com.acme.amqp.core;

/** A publish or its confirmation failed at the broker. */
public class PublishException extends AmqpClientException {
  public PublishException(String message) {
    super(message);
  }

  public PublishException(String message, Throwable e) {
    super(message, e);
  }
}
