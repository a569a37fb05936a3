package com.acme.amqp.producer;

/**
 * Per-call publish settings.
 *
 * @param priority message priority, {@code null} for none
 * @param expirationMs per-message TTL; applied only above 100 ms
 * @param batchSize chunk size for batch publishes, {@code null} for the producer default
 */
public record PublishOptions(Integer priority, long expirationMs, Integer batchSize) {

  private static final PublishOptions DEFAULTS = new PublishOptions(null, 0L, null);

  public static PublishOptions defaults() {
    return DEFAULTS;
  }

  public PublishOptions withPriority(Integer value) {
    return new PublishOptions(value, expirationMs, batchSize);
  }

  public PublishOptions withExpirationMs(long value) {
    return new PublishOptions(priority, value, batchSize);
  }

  public PublishOptions withBatchSize(Integer value) {
    return new PublishOptions(priority, expirationMs, value);
  }
}
