package com.acme.amqp.pool;

import com.acme.amqp.channel.GuardedChannel;

/** A channel checked out of a {@link ChannelPool}. The borrower owns it until release. */
public final class PooledChannel {

  private final GuardedChannel channel;
  private final long id;
  private volatile boolean broken;

  PooledChannel(GuardedChannel channel, long id) {
    this.channel = channel;
    this.id = id;
  }

  public GuardedChannel channel() {
    return channel;
  }

  public long id() {
    return id;
  }

  /** Flags the channel so the pool disposes of it on release instead of reusing it. */
  public void markBroken() {
    broken = true;
  }

  public boolean isHealthy() {
    return !broken && channel.isOpen();
  }

  @Override
  public String toString() {
    return "PooledChannel{id=" + id + ", healthy=" + isHealthy() + "}";
  }
}
