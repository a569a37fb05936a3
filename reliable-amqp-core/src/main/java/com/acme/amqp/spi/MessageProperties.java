package com.acme.amqp.spi;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * AMQP basic properties carried with a message. Every optional property is {@code null} when not
 * set. Identity properties ({@code messageId}, {@code correlationId}, {@code type} and the rest)
 * survive a retry republish unchanged; only the expiration and headers are rewritten.
 */
public record MessageProperties(
    String contentType,
    String contentEncoding,
    boolean persistent,
    Integer priority,
    Long expirationMs,
    String messageId,
    String correlationId,
    String type,
    String replyTo,
    Instant timestamp,
    String appId,
    String userId,
    Map<String, Object> headers) {

  public static final String JSON = "application/json";

  public MessageProperties {
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public MessageProperties(
      String contentType,
      boolean persistent,
      Integer priority,
      Long expirationMs,
      Map<String, Object> headers) {
    this(
        contentType,
        null,
        persistent,
        priority,
        expirationMs,
        null,
        null,
        null,
        null,
        null,
        null,
        null,
        headers);
  }

  public static MessageProperties empty() {
    return new MessageProperties(null, false, null, null, Map.of());
  }

  public MessageProperties withPriority(Integer value) {
    return new MessageProperties(
        contentType,
        contentEncoding,
        persistent,
        value,
        expirationMs,
        messageId,
        correlationId,
        type,
        replyTo,
        timestamp,
        appId,
        userId,
        headers);
  }

  public MessageProperties withExpirationMs(Long value) {
    return new MessageProperties(
        contentType,
        contentEncoding,
        persistent,
        priority,
        value,
        messageId,
        correlationId,
        type,
        replyTo,
        timestamp,
        appId,
        userId,
        headers);
  }

  public MessageProperties withHeader(String key, Object value) {
    Map<String, Object> copy = new HashMap<>(headers);
    copy.put(key, value);
    return new MessageProperties(
        contentType,
        contentEncoding,
        persistent,
        priority,
        expirationMs,
        messageId,
        correlationId,
        type,
        replyTo,
        timestamp,
        appId,
        userId,
        copy);
  }

  /** Integer header value, tolerating the numeric types different brokers hand back. */
  public int intHeader(String key, int defaultValue) {
    Object value = headers.get(key);
    if (value instanceof Number n) {
      return n.intValue();
    }
    if (value != null) {
      try {
        return Integer.parseInt(value.toString().trim());
      } catch (NumberFormatException e) {
        return defaultValue;
      }
    }
    return defaultValue;
  }
}
