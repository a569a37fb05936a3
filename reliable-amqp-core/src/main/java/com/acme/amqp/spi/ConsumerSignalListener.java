package com.acme.amqp.spi;

/** Subscription callbacks raised by a {@link BrokerChannel} for one consumer tag. */
public interface ConsumerSignalListener {

  default void onRegistered(String consumerTag) {}

  default void onCancelled(String consumerTag) {}

  default void onShutdown(String consumerTag, String reason) {}
}
