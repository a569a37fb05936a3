package com.acme.amqp.rabbitmq;

import com.acme.amqp.config.ProducerConfig;
import com.acme.amqp.config.ServerEndpoint;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

/** Logs the effective broker configuration on startup. The password is never printed. */
@Slf4j
@Singleton
@Requires(notEnv = "test")
@Requires(property = "amqp.server")
public class AmqpConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private final ServerEndpoint serverEndpoint;
  private final ProducerConfig producerConfig;

  public AmqpConfigurationLogger(ServerEndpoint serverEndpoint, ProducerConfig producerConfig) {
    this.serverEndpoint = serverEndpoint;
    this.producerConfig = producerConfig;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    log.info("━━━ AMQP Server Configuration ━━━");
    log.info("  Hosts:              {}", serverEndpoint.getHosts());
    log.info("  Virtual Host:       {}", serverEndpoint.getVirtualHost());
    log.info("  User:               {}", serverEndpoint.getUserName());
    log.info("  Password:           {}", mask(serverEndpoint.getPassword()));
    log.info("  Client Id:          {}", serverEndpoint.getClientId());
    log.info(
        "  Reconnect:          {} attempts every {}s",
        serverEndpoint.reconnectCountOrDefault(),
        serverEndpoint.reconnectIntervalSecondsOrDefault());
    log.info("  Network Recovery:   {}s", serverEndpoint.networkRecoveryIntervalSecondsOrDefault());
    log.info("");
    log.info("━━━ AMQP Producer Configuration ━━━");
    log.info(
        "  Channel Pool:       min={} max={} wait={}ms",
        producerConfig.getChannelPool().getMinPoolSize(),
        producerConfig.getChannelPool().getMaxPoolSize(),
        producerConfig.getChannelPool().getWaitTimeoutMs());
    log.info(
        "  Publisher Confirms: {}",
        producerConfig.isPublisherConfirmsEnabled()
            ? "ENABLED (" + producerConfig.getPublisherConfirms().getWaitConfirmsMs() + "ms)"
            : "DISABLED");
    log.info("  Batch Size:         {}", producerConfig.batchSizeOrDefault());
    log.info("  Open On Startup:    {}", producerConfig.isOpenOnStartup());
  }

  static String mask(String secret) {
    return secret == null || secret.isEmpty() ? "<not set>" : "****";
  }
}
