package com.acme.amqp.consumer;

import com.acme.amqp.core.AmqpClientException;

/**
 * Notified when a delivery failed, before it is retried or rejected. Exceptions thrown here are
 * logged and otherwise ignored.
 *
 * <p>{@code message} is {@code null} when the body could not be decoded; {@code error} is then a
 * {@link com.acme.amqp.core.CodecException}, otherwise a {@link
 * com.acme.amqp.core.HandlerException} wrapping what the handler threw.
 */
@FunctionalInterface
public interface ErrorHandler<T> {

  void onError(T message, HandlerScope scope, MessageContext<T> context, AmqpClientException error)
      throws Exception;
}
