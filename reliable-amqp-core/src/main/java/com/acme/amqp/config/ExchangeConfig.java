package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.List;

/** An extra exchange the consumer queue is bound to, optionally declared by the client. */
public class ExchangeConfig {

  private String name;
  private String type = ExchangeType.DIRECT.wireName();
  private boolean declare;
  private List<String> routingKeys = new ArrayList<>();

  public ExchangeConfig() {}

  public ExchangeConfig(String name, String type, boolean declare, List<String> routingKeys) {
    this.name = name;
    this.type = type;
    this.declare = declare;
    this.routingKeys = routingKeys;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public boolean isDeclare() {
    return declare;
  }

  public void setDeclare(boolean declare) {
    this.declare = declare;
  }

  public List<String> getRoutingKeys() {
    return routingKeys;
  }

  public void setRoutingKeys(List<String> routingKeys) {
    this.routingKeys = routingKeys;
  }

  /** Parsed exchange type; only valid after {@link #validate()}. */
  public ExchangeType exchangeType() {
    return ExchangeType.fromName(type)
        .orElseThrow(() -> new ConfigException("Exchange type is not valid: " + type));
  }

  /** Non-blank routing keys in configuration order. */
  public List<String> effectiveRoutingKeys() {
    if (routingKeys == null) {
      return List.of();
    }
    return routingKeys.stream().filter(k -> k != null && !k.isBlank()).toList();
  }

  public void validate() {
    ServerEndpoint.requireText(name, "Exchange name is null or empty");
    ExchangeType exchangeType = exchangeType();
    if (exchangeType != ExchangeType.FANOUT
        && (routingKeys == null
            || routingKeys.isEmpty()
            || routingKeys.stream().anyMatch(k -> k == null || k.isBlank()))) {
      throw new ConfigException(
          "Exchange " + name + " routingKeys is empty or has a blank item");
    }
  }
}
