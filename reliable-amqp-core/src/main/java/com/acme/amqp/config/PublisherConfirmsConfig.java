package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.time.Duration;

public class PublisherConfirmsConfig {

  private long waitConfirmsMs;

  public PublisherConfirmsConfig() {}

  public PublisherConfirmsConfig(long waitConfirmsMs) {
    this.waitConfirmsMs = waitConfirmsMs;
  }

  public long getWaitConfirmsMs() {
    return waitConfirmsMs;
  }

  public void setWaitConfirmsMs(long waitConfirmsMs) {
    this.waitConfirmsMs = waitConfirmsMs;
  }

  public Duration waitConfirms() {
    return Duration.ofMillis(waitConfirmsMs);
  }

  public void validate() {
    if (waitConfirmsMs < ConfigDefaults.MIN_WAIT_CONFIRMS_MS) {
      throw new ConfigException(
          "PublisherConfirms waitConfirmsMs must be >= "
              + ConfigDefaults.MIN_WAIT_CONFIRMS_MS
              + " but was "
              + waitConfirmsMs);
    }
  }
}
