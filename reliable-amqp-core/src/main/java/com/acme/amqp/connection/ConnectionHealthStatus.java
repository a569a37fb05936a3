package com.acme.amqp.connection;

public enum ConnectionHealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY,
  DISCONNECTED
}
