package com.acme.amqp.producer;

/**
 * Publishes messages, either to an explicit exchange and routing key or to the queue derived from
 * the message type ({@code <type name>} through {@code <type name>.direct}).
 *
 * <p>Failures are re-raised to the caller: {@link com.acme.amqp.core.PublishException} for broker
 * and confirm failures, {@link com.acme.amqp.core.PoolExhaustedException} when no channel could be
 * borrowed in time.
 */
public interface Producer extends AutoCloseable {

  default void publish(String exchange, String routingKey, Object message) {
    publish(exchange, routingKey, message, PublishOptions.defaults());
  }

  void publish(String exchange, String routingKey, Object message, PublishOptions options);

  default void publishAll(String exchange, String routingKey, Iterable<?> messages) {
    publishAll(exchange, routingKey, messages, PublishOptions.defaults());
  }

  /** Publishes in chunks, one broker batch and one confirm wait per chunk. */
  void publishAll(String exchange, String routingKey, Iterable<?> messages, PublishOptions options);

  default void publish(Object message) {
    publish(message, PublishOptions.defaults());
  }

  /** Routes on the runtime class of {@code message}. */
  void publish(Object message, PublishOptions options);

  default <T> void publish(T message, Class<T> type) {
    publish(message, type, PublishOptions.defaults());
  }

  /** Routes on {@code type}, the type consumers of that queue are declared with. */
  <T> void publish(T message, Class<T> type, PublishOptions options);

  default <T> void publishAll(Iterable<? extends T> messages, Class<T> type) {
    publishAll(messages, type, PublishOptions.defaults());
  }

  <T> void publishAll(Iterable<? extends T> messages, Class<T> type, PublishOptions options);

  /** Opens the connection and primes the channel pool ahead of the first publish. */
  void warmUp();

  @Override
  void close();
}
