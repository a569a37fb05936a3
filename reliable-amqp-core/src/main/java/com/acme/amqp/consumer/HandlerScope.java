package com.acme.amqp.consumer;

/**
 * Resources resolved for a single handler invocation. Closed as soon as the handler returns,
 * whether it succeeded or not.
 */
public interface HandlerScope extends AutoCloseable {

  /**
   * @throws IllegalStateException when no resource of {@code type} is available in this scope
   */
  <B> B getBean(Class<B> type);

  @Override
  default void close() {}
}
