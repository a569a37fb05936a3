package com.acme.amqp.topology;

/**
 * One retry step. {@code id} is the human readable TTL and serves as retry queue suffix, binding
 * key on the retry exchange and routing key when republishing.
 */
public record RetryTier(int index, long ttlMs, String id) {

  public static RetryTier of(int index, long ttlMs) {
    return new RetryTier(index, ttlMs, TtlFormatter.format(ttlMs));
  }
}
