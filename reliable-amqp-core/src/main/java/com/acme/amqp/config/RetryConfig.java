package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.List;

/** Retry tiers: the n-th entry is the delay in milliseconds before the n-th redelivery. */
public class RetryConfig {

  private List<Long> perMessageTtlMs = new ArrayList<>();

  public RetryConfig() {}

  public RetryConfig(List<Long> perMessageTtlMs) {
    this.perMessageTtlMs = perMessageTtlMs;
  }

  public List<Long> getPerMessageTtlMs() {
    return perMessageTtlMs;
  }

  public void setPerMessageTtlMs(List<Long> perMessageTtlMs) {
    this.perMessageTtlMs = perMessageTtlMs;
  }

  public void validate() {
    if (perMessageTtlMs == null || perMessageTtlMs.isEmpty()) {
      throw new ConfigException("Retry perMessageTtlMs cannot be empty");
    }
    for (Long ttl : perMessageTtlMs) {
      if (ttl == null || ttl < ConfigDefaults.MIN_RETRY_TTL_MS) {
        throw new ConfigException(
            "Retry perMessageTtlMs entries must be >= "
                + ConfigDefaults.MIN_RETRY_TTL_MS
                + "ms but found "
                + ttl);
      }
    }
  }
}
