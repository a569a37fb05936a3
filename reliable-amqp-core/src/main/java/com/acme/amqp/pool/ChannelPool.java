package com.acme.amqp.pool;

import com.acme.amqp.channel.GuardedChannel;
import com.acme.amqp.config.ChannelPoolConfig;
import com.acme.amqp.connection.ConnectionProvider;
import com.acme.amqp.core.ChannelException;
import com.acme.amqp.core.PoolExhaustedException;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded pool of broker channels drawn from a {@link ConnectionProvider}.
 *
 * <p>{@code outstanding} counts every live channel created by the pool, idle or borrowed, and is
 * only raised through compare-and-set so it never exceeds {@code maxPoolSize}. Unhealthy channels
 * are closed and stop counting as soon as they are seen on acquire or release.
 */
public class ChannelPool implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ChannelPool.class);

  private final ConnectionProvider connectionProvider;
  private final boolean ownsProvider;
  private final int minSize;
  private final int maxSize;
  private final Duration defaultTimeout;

  private final BlockingQueue<PooledChannel> idle;
  private final AtomicInteger outstanding = new AtomicInteger();
  private final AtomicLong ids = new AtomicLong();
  private final ReentrantLock initLock = new ReentrantLock();

  private volatile boolean initialized;
  private volatile boolean closed;

  /**
   * @param ownsProvider whether {@link #close()} also closes {@code connectionProvider}
   */
  public ChannelPool(
      ConnectionProvider connectionProvider, ChannelPoolConfig config, boolean ownsProvider) {
    config.validate();
    this.connectionProvider = connectionProvider;
    this.ownsProvider = ownsProvider;
    this.minSize = config.getMinPoolSize();
    this.maxSize = config.getMaxPoolSize();
    this.defaultTimeout = config.waitTimeout();
    this.idle = new LinkedBlockingQueue<>(maxSize);
  }

  public PooledChannel acquire() {
    return acquire(defaultTimeout);
  }

  /**
   * Takes an idle channel, waiting up to {@code timeout} for one to be released, and creates a new
   * one when nothing healthy became available while the pool is below capacity.
   *
   * @throws PoolExhaustedException when the pool is at capacity and no channel was released in time
   * @throws ChannelException when creating a channel failed
   */
  public PooledChannel acquire(Duration timeout) {
    ensureOpen();
    ensureInitialized();

    PooledChannel taken = idle.poll();
    if (taken != null) {
      if (taken.isHealthy()) {
        return taken;
      }
      discard(taken);
    } else {
      try {
        taken = idle.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PoolExhaustedException("Interrupted while waiting for a channel", e);
      }
      if (taken != null) {
        if (taken.isHealthy()) {
          return taken;
        }
        discard(taken);
      }
    }

    if (!tryReserve()) {
      throw new PoolExhaustedException(
          "Channel pool exhausted: max="
              + maxSize
              + ", outstanding="
              + outstanding.get()
              + ", waited="
              + timeout.toMillis()
              + "ms");
    }
    try {
      return createChannel();
    } catch (RuntimeException e) {
      outstanding.decrementAndGet();
      throw e;
    }
  }

  /** Returns a borrowed channel. Unhealthy channels, or any surplus, are closed. */
  public void release(PooledChannel channel) {
    if (channel == null) {
      return;
    }
    if (closed || !channel.isHealthy() || !idle.offer(channel)) {
      discard(channel);
    }
  }

  /** Primes {@code minPoolSize} channels. Runs once; later calls are no-ops. */
  public void warmUp() {
    ensureOpen();
    ensureInitialized();
  }

  public int outstanding() {
    return outstanding.get();
  }

  public int idleCount() {
    return idle.size();
  }

  public int maxSize() {
    return maxSize;
  }

  /** Closes idle channels; borrowed channels are closed when released. */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    PooledChannel channel;
    int drained = 0;
    while ((channel = idle.poll()) != null) {
      discard(channel);
      drained++;
    }
    log.info("Channel pool closed: drained={}, stillBorrowed={}", drained, outstanding.get());
    if (ownsProvider) {
      connectionProvider.close();
    }
  }

  private void ensureInitialized() {
    if (initialized) {
      return;
    }
    initLock.lock();
    try {
      if (initialized) {
        return;
      }
      for (int i = 0; i < minSize && tryReserve(); i++) {
        try {
          idle.offer(createChannel());
        } catch (RuntimeException e) {
          outstanding.decrementAndGet();
          throw e;
        }
      }
      initialized = true;
      log.debug("Channel pool primed: min={}, max={}", minSize, maxSize);
    } finally {
      initLock.unlock();
    }
  }

  private boolean tryReserve() {
    while (true) {
      int current = outstanding.get();
      if (current >= maxSize) {
        return false;
      }
      if (outstanding.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  private PooledChannel createChannel() {
    try {
      GuardedChannel channel = GuardedChannel.of(connectionProvider.getOrCreate().createChannel());
      return new PooledChannel(channel, ids.incrementAndGet());
    } catch (IOException e) {
      throw new ChannelException("Failed to create channel", e);
    }
  }

  private void discard(PooledChannel channel) {
    outstanding.decrementAndGet();
    try {
      channel.channel().close();
    } catch (RuntimeException e) {
      log.warn("Failed to close pooled channel {}", channel.id(), e);
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Channel pool is closed");
    }
  }
}
