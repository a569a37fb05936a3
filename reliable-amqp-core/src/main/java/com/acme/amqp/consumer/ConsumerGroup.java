package com.acme.amqp.consumer;

import com.acme.amqp.connection.ConnectionProvider;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Consumers of one queue built together, plus the connection they share (if any). */
public final class ConsumerGroup<T> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ConsumerGroup.class);

  private final List<Consumer<T>> consumers;
  private final ConnectionProvider sharedConnection;

  ConsumerGroup(List<Consumer<T>> consumers, ConnectionProvider sharedConnection) {
    this.consumers = List.copyOf(consumers);
    this.sharedConnection = sharedConnection;
  }

  public List<Consumer<T>> consumers() {
    return consumers;
  }

  public int size() {
    return consumers.size();
  }

  public void subscribeAll(DequeueHandler<T> onDequeue, ErrorHandler<T> onError) {
    ConsumerFactory.subscribeAll(consumers, onDequeue, onError);
  }

  @Override
  public void close() {
    for (Consumer<T> consumer : consumers) {
      try {
        consumer.close();
      } catch (RuntimeException e) {
        log.error("Failed to close consumer of {}", consumer.queueName(), e);
      }
    }
    if (sharedConnection != null) {
      sharedConnection.close();
    }
  }
}
