package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.time.Duration;

public class ChannelPoolConfig {

  private int minPoolSize = 1;
  private int maxPoolSize = 10;
  private long waitTimeoutMs = 1000L;

  public ChannelPoolConfig() {}

  public ChannelPoolConfig(int minPoolSize, int maxPoolSize, long waitTimeoutMs) {
    this.minPoolSize = minPoolSize;
    this.maxPoolSize = maxPoolSize;
    this.waitTimeoutMs = waitTimeoutMs;
  }

  public int getMinPoolSize() {
    return minPoolSize;
  }

  public void setMinPoolSize(int minPoolSize) {
    this.minPoolSize = minPoolSize;
  }

  public int getMaxPoolSize() {
    return maxPoolSize;
  }

  public void setMaxPoolSize(int maxPoolSize) {
    this.maxPoolSize = maxPoolSize;
  }

  public long getWaitTimeoutMs() {
    return waitTimeoutMs;
  }

  public void setWaitTimeoutMs(long waitTimeoutMs) {
    this.waitTimeoutMs = waitTimeoutMs;
  }

  public Duration waitTimeout() {
    return Duration.ofMillis(waitTimeoutMs);
  }

  public void validate() {
    if (minPoolSize <= 0) {
      throw new ConfigException("ChannelPool minPoolSize must be > 0 but was " + minPoolSize);
    }
    if (maxPoolSize <= minPoolSize) {
      throw new ConfigException(
          "ChannelPool maxPoolSize ("
              + maxPoolSize
              + ") must be greater than minPoolSize ("
              + minPoolSize
              + ")");
    }
    if (waitTimeoutMs <= 0) {
      throw new ConfigException("ChannelPool waitTimeoutMs must be > 0 but was " + waitTimeoutMs);
    }
  }
}
