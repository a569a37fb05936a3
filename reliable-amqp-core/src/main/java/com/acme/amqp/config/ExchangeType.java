package com.acme.amqp.config;

import java.util.Locale;
import java.util.Optional;

/** AMQP exchange types accepted in consumer configuration. */
public enum ExchangeType {
  DIRECT,
  FANOUT,
  TOPIC,
  HEADERS;

  /** Name used on the wire when declaring the exchange, e.g. {@code direct}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ExchangeType> fromName(String name) {
    if (name == null || name.isBlank()) {
      return Optional.empty();
    }
    for (ExchangeType type : values()) {
      if (type.wireName().equalsIgnoreCase(name.trim())) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
