package com.acme.amqp.connection;

import java.time.Instant;

/** Lifecycle event published by a {@link ConnectionManager}. {@code cause} may be null. */
public record ConnectionEvent(
    ConnectionEventType type, String message, Throwable cause, Instant timestamp) {

  public static ConnectionEvent of(ConnectionEventType type, String message) {
    return new ConnectionEvent(type, message, null, Instant.now());
  }

  public static ConnectionEvent of(ConnectionEventType type, String message, Throwable cause) {
    return new ConnectionEvent(type, message, cause, Instant.now());
  }

  @Override
  public String toString() {
    String causeInfo = cause != null ? " - Exception: " + cause.getMessage() : "";
    return "[" + timestamp + "] " + type + ": " + message + causeInfo;
  }
}
