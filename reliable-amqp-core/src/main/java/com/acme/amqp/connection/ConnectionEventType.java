package com.acme.amqp.connection;

public enum ConnectionEventType {
  CONNECTING,
  CONNECTED,
  RECOVERING,
  RECOVERED,
  SHUTDOWN,
  BLOCKED,
  UNBLOCKED,
  ERROR,
  CALLBACK_EXCEPTION,
  DISPOSING,
  DISPOSED
}
