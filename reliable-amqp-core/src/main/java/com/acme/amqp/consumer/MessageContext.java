package com.acme.amqp.consumer;

/**
 * What a handler knows about the delivery it is processing.
 *
 * @param lastTry {@code true} when a failure of this attempt will not be retried
 */
public record MessageContext<T>(Consumer<T> sender, boolean lastTry, MessageEnvelope<T> envelope) {

  public int retryCount() {
    return envelope.retryCount();
  }
}
