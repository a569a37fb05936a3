package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.Locale;

/** A single {@code x-*} queue argument restricted to {@link ConfigDefaults#ALLOWED_QUEUE_ARGS}. */
public class QueueArg {

  private String key;
  private Object value;

  public QueueArg() {}

  public QueueArg(String key, Object value) {
    this.key = key;
    this.value = value;
  }

  public String getKey() {
    return key;
  }

  public void setKey(String key) {
    this.key = key;
  }

  public Object getValue() {
    return value;
  }

  public void setValue(Object value) {
    this.value = value;
  }

  public String normalizedKey() {
    return key == null ? null : key.trim().toLowerCase(Locale.ROOT);
  }

  public boolean isDeadLetterArg() {
    String k = normalizedKey();
    return ConfigDefaults.ARG_DEAD_LETTER_EXCHANGE.equals(k)
        || ConfigDefaults.ARG_DEAD_LETTER_ROUTING_KEY.equals(k);
  }

  /**
   * Value converted to the type the broker expects for this key: integers for priority, long for
   * TTL/expiry, boolean for single-active-consumer, everything else as given.
   */
  public Object brokerValue() {
    String k = normalizedKey();
    try {
      if (ConfigDefaults.ARG_MAX_PRIORITY.equals(k)) {
        return value instanceof Number n ? n.intValue() : Integer.parseInt(value.toString().trim());
      }
      if (ConfigDefaults.ARG_MESSAGE_TTL.equals(k) || ConfigDefaults.ARG_EXPIRES.equals(k)) {
        return value instanceof Number n ? n.longValue() : Long.parseLong(value.toString().trim());
      }
    } catch (NumberFormatException e) {
      throw new ConfigException("QueueArg " + key + " value is not numeric: " + value, e);
    }
    if (ConfigDefaults.ARG_SINGLE_ACTIVE_CONSUMER.equals(k)) {
      return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
    }
    return value;
  }

  public void validate() {
    if (key == null || !ConfigDefaults.ALLOWED_QUEUE_ARGS.contains(normalizedKey())) {
      throw new ConfigException("QueueArg key is not valid: " + key);
    }
    if (value == null) {
      throw new ConfigException("QueueArg " + key + " value is null");
    }
    brokerValue();
  }
}
