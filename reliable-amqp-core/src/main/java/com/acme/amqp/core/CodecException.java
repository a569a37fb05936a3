package com.acme.amqp.core;

/** Message body could not be encoded or decoded. */
public class CodecException extends AmqpClientException {
  public CodecException(String message) {
    super(message);
  }

  public CodecException(String message, Throwable e) {
    super(message, e);
  }
}
