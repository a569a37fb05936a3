package com.acme.amqp.consumer;

/** Subscription callbacks. All methods default to no-op; exceptions are logged by the consumer. */
public interface ConsumerLifecycleListener {

  default void onRegistered(String queue, String consumerTag) {}

  default void onCancelled(String queue, String consumerTag) {}

  default void onShutdown(String queue, String consumerTag, String reason) {}
}
