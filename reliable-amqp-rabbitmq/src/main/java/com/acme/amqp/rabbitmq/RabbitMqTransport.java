package com.acme.amqp.rabbitmq;

import com.acme.amqp.config.ConfigDefaults;
import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.core.BrokerUnreachableException;
import com.acme.amqp.core.ConfigException;
import com.acme.amqp.spi.BrokerConnection;
import com.acme.amqp.spi.Transport;
import com.rabbitmq.client.Address;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Transport} backed by the RabbitMQ Java client. Automatic connection and topology recovery
 * are always on; each connect builds its own {@link ConnectionFactory} so callback exceptions can
 * be routed back to the connection that raised them.
 */
@Slf4j
public class RabbitMqTransport implements Transport {

  private final Supplier<ConnectionFactory> factorySupplier;

  public RabbitMqTransport() {
    this(ConnectionFactory::new);
  }

  RabbitMqTransport(Supplier<ConnectionFactory> factorySupplier) {
    this.factorySupplier = factorySupplier;
  }

  @Override
  public BrokerConnection connect(ServerEndpoint endpoint, String clientName) {
    ConnectionFactory factory = factorySupplier.get();
    factory.setUsername(endpoint.getUserName());
    factory.setPassword(endpoint.getPassword());
    factory.setVirtualHost(endpoint.getVirtualHost());
    factory.setAutomaticRecoveryEnabled(true);
    factory.setTopologyRecoveryEnabled(true);
    factory.setNetworkRecoveryInterval(endpoint.networkRecoveryIntervalSecondsOrDefault() * 1000L);
    CallbackExceptionBridge exceptionBridge = new CallbackExceptionBridge();
    factory.setExceptionHandler(exceptionBridge);

    List<Address> addresses = addresses(endpoint.getHosts());
    try {
      Connection connection = factory.newConnection(addresses, clientName);
      RabbitMqConnection wrapped = new RabbitMqConnection(connection);
      exceptionBridge.bind(wrapped);
      log.info("Opened RabbitMQ connection {} to {}", clientName, addresses);
      return wrapped;
    } catch (IOException | TimeoutException e) {
      throw new BrokerUnreachableException(
          "None of the RabbitMQ hosts is reachable: " + endpoint.getHosts(), e);
    }
  }

  /** Parses {@code host} or {@code host:port}; the port defaults to 5672. */
  static List<Address> addresses(List<String> hosts) {
    return hosts.stream().map(RabbitMqTransport::address).toList();
  }

  private static Address address(String host) {
    String trimmed = host.trim();
    int colon = trimmed.lastIndexOf(':');
    if (colon < 0) {
      return new Address(trimmed, ConfigDefaults.DEFAULT_PORT);
    }
    try {
      return new Address(
          trimmed.substring(0, colon), Integer.parseInt(trimmed.substring(colon + 1)));
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid port in host entry: " + host, e);
    }
  }
}
