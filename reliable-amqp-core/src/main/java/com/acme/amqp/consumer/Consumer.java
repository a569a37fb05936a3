package com.acme.amqp.consumer;

import java.util.Set;

/** A subscription on one queue with its own channel. */
public interface Consumer<T> extends AutoCloseable {

  /**
   * Provisions the queue topology and starts consuming.
   *
   * @param onError may be null
   * @throws com.acme.amqp.core.ConsumerStateException when already subscribed or closed
   */
  void subscribe(DequeueHandler<T> onDequeue, ErrorHandler<T> onError);

  /**
   * Opens a fresh channel and resumes consuming after the previous channel was closed.
   *
   * @return {@code false} when the current channel is still open, consumption is already running,
   *     or (with {@code rethrow == false}) the attempt failed
   */
  boolean createNewChannelAndStartConsume(boolean rethrow);

  /** @return {@code false} when already consuming or (with {@code rethrow == false}) on failure */
  boolean startConsume(boolean rethrow);

  /** Cancels every active consumer tag. In-flight handlers still complete. */
  void basicCancel();

  /** Closes the channel; {@link #createNewChannelAndStartConsume} can open a new one later. */
  void closeChannel();

  Set<String> consumerTags();

  String queueName();

  ConsumerState state();

  void addLifecycleListener(ConsumerLifecycleListener listener);

  @Override
  void close();
}
