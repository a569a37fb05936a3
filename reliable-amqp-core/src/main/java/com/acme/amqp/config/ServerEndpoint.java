package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.List;

/**
 * Broker endpoint and reconnect settings. Pure POJO - no framework dependencies; bound from
 * {@code amqp.server.*} by the RabbitMQ module.
 */
public class ServerEndpoint {

  private String userName;
  private String password;
  private String virtualHost;
  private List<String> hosts = new ArrayList<>();
  private String clientId;
  private Integer reconnectCount;
  private Integer reconnectIntervalSeconds;
  private Integer networkRecoveryIntervalSeconds;

  public String getUserName() {
    return userName;
  }

  public void setUserName(String userName) {
    this.userName = userName;
  }

  public String getPassword() {
    return password;
  }

  public void setPassword(String password) {
    this.password = password;
  }

  public String getVirtualHost() {
    return virtualHost;
  }

  public void setVirtualHost(String virtualHost) {
    this.virtualHost = virtualHost;
  }

  public List<String> getHosts() {
    return hosts;
  }

  public void setHosts(List<String> hosts) {
    this.hosts = hosts;
  }

  public String getClientId() {
    return clientId;
  }

  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  public Integer getReconnectCount() {
    return reconnectCount;
  }

  public void setReconnectCount(Integer reconnectCount) {
    this.reconnectCount = reconnectCount;
  }

  public Integer getReconnectIntervalSeconds() {
    return reconnectIntervalSeconds;
  }

  public void setReconnectIntervalSeconds(Integer reconnectIntervalSeconds) {
    this.reconnectIntervalSeconds = reconnectIntervalSeconds;
  }

  public Integer getNetworkRecoveryIntervalSeconds() {
    return networkRecoveryIntervalSeconds;
  }

  public void setNetworkRecoveryIntervalSeconds(Integer networkRecoveryIntervalSeconds) {
    this.networkRecoveryIntervalSeconds = networkRecoveryIntervalSeconds;
  }

  public int reconnectCountOrDefault() {
    return reconnectCount != null ? reconnectCount : ConfigDefaults.RECONNECT_COUNT;
  }

  public int reconnectIntervalSecondsOrDefault() {
    return reconnectIntervalSeconds != null
        ? reconnectIntervalSeconds
        : ConfigDefaults.RECONNECT_INTERVAL_SECONDS;
  }

  public int networkRecoveryIntervalSecondsOrDefault() {
    return networkRecoveryIntervalSeconds != null
        ? networkRecoveryIntervalSeconds
        : ConfigDefaults.NETWORK_RECOVERY_INTERVAL_SECONDS;
  }

  /**
   * Client-provided connection name shown in the broker management UI. Example: clientId {@code
   * orders} with suffix {@code 2} -> {@code orders:2}
   */
  public String connectionName(String suffix) {
    return suffix == null || suffix.isBlank() ? clientId : clientId + ":" + suffix;
  }

  /** @throws ConfigException describing the first invalid field */
  public void validate() {
    requireText(userName, "Server userName is null or empty");
    requireText(password, "Server password is null or empty");
    requireText(virtualHost, "Server virtualHost is null or empty");
    requireText(clientId, "Server clientId is null or empty");

    if (reconnectCount != null && reconnectCount <= 0) {
      throw new ConfigException("Server reconnectCount must be > 0 but was " + reconnectCount);
    }
    if (reconnectIntervalSeconds != null && reconnectIntervalSeconds <= 0) {
      throw new ConfigException(
          "Server reconnectIntervalSeconds must be > 0 but was " + reconnectIntervalSeconds);
    }
    if (networkRecoveryIntervalSeconds != null && networkRecoveryIntervalSeconds <= 0) {
      throw new ConfigException(
          "Server networkRecoveryIntervalSeconds must be > 0 but was "
              + networkRecoveryIntervalSeconds);
    }
    if (hosts == null
        || hosts.isEmpty()
        || hosts.stream().anyMatch(h -> h == null || h.isBlank())) {
      throw new ConfigException("Server hosts is null, empty or contains a blank entry");
    }
  }

  static void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new ConfigException(message);
    }
  }

  @Override
  public String toString() {
    return "ServerEndpoint{userName='"
        + userName
        + "', virtualHost='"
        + virtualHost
        + "', hosts="
        + hosts
        + ", clientId='"
        + clientId
        + "'}";
  }
}
