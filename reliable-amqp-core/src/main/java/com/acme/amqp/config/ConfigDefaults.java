package com.acme.amqp.config;

import java.util.List;

/**
 * Central defaults and fixed protocol constants shared by configuration, topology and the
 * consumer/producer engine.
 */
public final class ConfigDefaults {

  // Connection
  public static final int RECONNECT_COUNT = 3;
  public static final int RECONNECT_INTERVAL_SECONDS = 10;
  public static final int NETWORK_RECOVERY_INTERVAL_SECONDS = 5;
  public static final int DEFAULT_PORT = 5672;

  // Consumer
  public static final int PREFETCH_SIZE = 0;
  public static final int PREFETCH_COUNT = 1;
  public static final long MIN_RETRY_TTL_MS = 500L;

  // Producer
  public static final int BATCH_SIZE = 20;
  public static final long MIN_EXPIRATION_MS = 100L;
  public static final long MIN_WAIT_CONFIRMS_MS = 10L;

  // Message headers
  public static final String HEADER_RETRIES = "x-retries";

  // Queue argument keys
  public static final String ARG_EXPIRES = "x-expires";
  public static final String ARG_MAX_PRIORITY = "x-max-priority";
  public static final String ARG_MESSAGE_TTL = "x-message-ttl";
  public static final String ARG_DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
  public static final String ARG_DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
  public static final String ARG_SINGLE_ACTIVE_CONSUMER = "x-single-active-consumer";

  public static final List<String> ALLOWED_QUEUE_ARGS =
      List.of(
          ARG_EXPIRES,
          ARG_MAX_PRIORITY,
          ARG_MESSAGE_TTL,
          ARG_DEAD_LETTER_EXCHANGE,
          ARG_DEAD_LETTER_ROUTING_KEY,
          ARG_SINGLE_ACTIVE_CONSUMER);

  private ConfigDefaults() {
    // Utility class - prevent instantiation
  }
}
