package com.acme.amqp.topology;

import com.acme.amqp.config.ConfigDefaults;
import com.acme.amqp.config.RetryConfig;
import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered retry tiers. A message whose {@code x-retries} header equals {@code n} is retried through
 * tier {@code n}; once {@code n} reaches {@link #maxAttempts()} it is rejected.
 */
public final class RetryPolicy {

  private static final RetryPolicy DISABLED = new RetryPolicy(List.of());

  private final List<RetryTier> tiers;

  private RetryPolicy(List<RetryTier> tiers) {
    this.tiers = List.copyOf(tiers);
  }

  public static RetryPolicy disabled() {
    return DISABLED;
  }

  public static RetryPolicy from(RetryConfig config) {
    if (config == null) {
      return DISABLED;
    }
    config.validate();
    return of(config.getPerMessageTtlMs());
  }

  public static RetryPolicy of(List<Long> perMessageTtlMs) {
    if (perMessageTtlMs == null || perMessageTtlMs.isEmpty()) {
      throw new ConfigException("Retry perMessageTtlMs cannot be empty");
    }
    List<RetryTier> tiers = new ArrayList<>(perMessageTtlMs.size());
    for (int i = 0; i < perMessageTtlMs.size(); i++) {
      Long ttl = perMessageTtlMs.get(i);
      if (ttl == null || ttl < ConfigDefaults.MIN_RETRY_TTL_MS) {
        throw new ConfigException(
            "Retry perMessageTtlMs entries must be >= "
                + ConfigDefaults.MIN_RETRY_TTL_MS
                + "ms but found "
                + ttl);
      }
      tiers.add(RetryTier.of(i, ttl));
    }
    return new RetryPolicy(tiers);
  }

  public boolean isEnabled() {
    return !tiers.isEmpty();
  }

  public int maxAttempts() {
    return tiers.size();
  }

  public List<RetryTier> tiers() {
    return tiers;
  }

  /** Tiers with distinct identifiers, first occurrence wins. One retry queue exists per entry. */
  public List<RetryTier> distinctTiers() {
    Map<String, RetryTier> byId = new LinkedHashMap<>();
    for (RetryTier tier : tiers) {
      byId.putIfAbsent(tier.id(), tier);
    }
    return List.copyOf(byId.values());
  }

  /** @return the tier for the next attempt, empty when the message must be rejected */
  public Optional<RetryTier> nextTier(int retryCount) {
    if (retryCount < 0 || retryCount >= tiers.size()) {
      return Optional.empty();
    }
    return Optional.of(tiers.get(retryCount));
  }

  public boolean isLastTry(int retryCount) {
    return !(isEnabled() && retryCount < tiers.size());
  }

  @Override
  public String toString() {
    return "RetryPolicy" + tiers.stream().map(RetryTier::id).toList();
  }
}
