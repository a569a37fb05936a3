package com.acme.amqp.connection;

@FunctionalInterface
public interface ConnectionEventListener {

  void onEvent(ConnectionEvent event);
}
