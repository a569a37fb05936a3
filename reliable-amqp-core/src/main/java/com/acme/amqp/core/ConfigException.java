package com.acme.amqp.core;

/** Invalid configuration. Raised before any broker I/O and never retried. */
public class ConfigException extends AmqpClientException {
  public ConfigException(String message) {
    super(message);
  }

  public ConfigException(String message, Throwable e) {
    super(message, e);
  }
}
