package com.acme.amqp.connection;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/** Point-in-time health snapshot for external health check wiring. */
public record ConnectionHealth(
    ConnectionHealthStatus status,
    boolean connected,
    Duration uptime,
    Instant lastCheckTime,
    String details) {

  public static ConnectionHealth healthy(Duration uptime) {
    return new ConnectionHealth(
        ConnectionHealthStatus.HEALTHY, true, uptime, Instant.now(), "Connection is healthy");
  }

  public static ConnectionHealth degraded(String details) {
    return new ConnectionHealth(
        ConnectionHealthStatus.DEGRADED, true, null, Instant.now(), details);
  }

  public static ConnectionHealth unhealthy(String details) {
    return new ConnectionHealth(
        ConnectionHealthStatus.UNHEALTHY, false, null, Instant.now(), details);
  }

  public static ConnectionHealth disconnected() {
    return new ConnectionHealth(
        ConnectionHealthStatus.DISCONNECTED,
        false,
        null,
        Instant.now(),
        "Connection is not established");
  }

  public Optional<Duration> uptimeIfKnown() {
    return Optional.ofNullable(uptime);
  }
}
