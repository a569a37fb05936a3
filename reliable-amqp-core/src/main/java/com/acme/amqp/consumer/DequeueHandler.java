package com.acme.amqp.consumer;

/**
 * Processes one decoded message. Returning normally acknowledges the delivery, throwing hands it to
 * the retry or dead-letter path.
 */
@FunctionalInterface
public interface DequeueHandler<T> {

  void handle(T message, HandlerScope scope, MessageContext<T> context) throws Exception;
}
