package com.acme.amqp.channel;

import com.acme.amqp.spi.BrokerChannel;
import com.acme.amqp.spi.ConsumerSignalListener;
import com.acme.amqp.spi.DeliveryHandler;
import com.acme.amqp.spi.MessageProperties;
import com.acme.amqp.spi.OutboundMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes every operation on a {@link BrokerChannel} behind one lock so concurrent handler
 * completions, republishes and confirm waits never interleave on the underlying channel.
 * Delivery callbacks are not invoked under the lock.
 */
public final class GuardedChannel implements BrokerChannel {

  private final BrokerChannel delegate;
  private final ReentrantLock lock = new ReentrantLock();

  private GuardedChannel(BrokerChannel delegate) {
    this.delegate = delegate;
  }

  /** Wraps {@code channel} unless it is already guarded. */
  public static GuardedChannel of(BrokerChannel channel) {
    if (channel instanceof GuardedChannel guarded) {
      return guarded;
    }
    return new GuardedChannel(channel);
  }

  public BrokerChannel delegate() {
    return delegate;
  }

  @Override
  public boolean isOpen() {
    return delegate.isOpen();
  }

  @Override
  public void exchangeDeclare(String exchange, String type, boolean durable) throws IOException {
    lock.lock();
    try {
      delegate.exchangeDeclare(exchange, type, durable);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void queueDeclare(
      String queue,
      boolean durable,
      boolean exclusive,
      boolean autoDelete,
      Map<String, Object> arguments)
      throws IOException {
    lock.lock();
    try {
      delegate.queueDeclare(queue, durable, exclusive, autoDelete, arguments);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void queueBind(String queue, String exchange, String routingKey) throws IOException {
    lock.lock();
    try {
      delegate.queueBind(queue, exchange, routingKey);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void basicQos(int prefetchSize, int prefetchCount) throws IOException {
    lock.lock();
    try {
      delegate.basicQos(prefetchSize, prefetchCount);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void confirmSelect() throws IOException {
    lock.lock();
    try {
      delegate.confirmSelect();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void basicPublish(
      String exchange,
      String routingKey,
      boolean mandatory,
      MessageProperties properties,
      byte[] body)
      throws IOException {
    lock.lock();
    try {
      delegate.basicPublish(exchange, routingKey, mandatory, properties, body);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void publishBatch(List<OutboundMessage> messages) throws IOException {
    lock.lock();
    try {
      delegate.publishBatch(messages);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void waitForConfirmsOrDie(Duration timeout)
      throws IOException, InterruptedException, TimeoutException {
    lock.lockInterruptibly();
    try {
      delegate.waitForConfirmsOrDie(timeout);
    } finally {
      lock.unlock();
    }
  }

  /** Publishes and waits for the confirm while holding the lock, so no other publish slips in. */
  public void publishAndConfirm(
      String exchange,
      String routingKey,
      boolean mandatory,
      MessageProperties properties,
      byte[] body,
      Duration confirmTimeout)
      throws IOException, InterruptedException, TimeoutException {
    lock.lockInterruptibly();
    try {
      delegate.basicPublish(exchange, routingKey, mandatory, properties, body);
      delegate.waitForConfirmsOrDie(confirmTimeout);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String basicConsume(String queue, DeliveryHandler handler, ConsumerSignalListener listener)
      throws IOException {
    lock.lock();
    try {
      return delegate.basicConsume(queue, handler, listener);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void basicCancel(String consumerTag) throws IOException {
    lock.lock();
    try {
      delegate.basicCancel(consumerTag);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void basicAck(long deliveryTag, boolean multiple) throws IOException {
    lock.lock();
    try {
      delegate.basicAck(deliveryTag, multiple);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void basicNack(long deliveryTag, boolean multiple, boolean requeue) throws IOException {
    lock.lock();
    try {
      delegate.basicNack(deliveryTag, multiple, requeue);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      delegate.close();
    } finally {
      lock.unlock();
    }
  }
}
