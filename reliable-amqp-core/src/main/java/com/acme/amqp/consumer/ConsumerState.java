package com.acme.amqp.consumer;

public enum ConsumerState {
  UNBOUND,
  SUBSCRIBED,
  CANCELLED,
  CLOSED
}
