package com.acme.amqp.rabbitmq;

import com.acme.amqp.spi.BrokerChannel;
import com.acme.amqp.spi.BrokerConnection;
import com.acme.amqp.spi.ConnectionSignalListener;
import com.rabbitmq.client.BlockedListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Recoverable;
import com.rabbitmq.client.RecoveryListener;
import com.rabbitmq.client.ShutdownListener;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
class RabbitMqConnection implements BrokerConnection {

  private final Connection connection;
  private final List<ConnectionSignalListener> listeners = new CopyOnWriteArrayList<>();

  private final ShutdownListener shutdownListener =
      cause ->
          fire(
              l ->
                  l.onShutdown(
                      cause.getMessage(), cause.getCause() != null ? cause.getCause() : cause));

  private final BlockedListener blockedListener =
      new BlockedListener() {
        @Override
        public void handleBlocked(String reason) {
          fire(l -> l.onBlocked(reason));
        }

        @Override
        public void handleUnblocked() {
          fire(ConnectionSignalListener::onUnblocked);
        }
      };

  private final RecoveryListener recoveryListener =
      new RecoveryListener() {
        @Override
        public void handleRecovery(Recoverable recoverable) {
          fire(ConnectionSignalListener::onRecovered);
        }

        @Override
        public void handleRecoveryStarted(Recoverable recoverable) {
          fire(ConnectionSignalListener::onRecovering);
        }
      };

  RabbitMqConnection(Connection connection) {
    this.connection = connection;
    connection.addShutdownListener(shutdownListener);
    connection.addBlockedListener(blockedListener);
    if (connection instanceof Recoverable recoverable) {
      recoverable.addRecoveryListener(recoveryListener);
    }
  }

  @Override
  public boolean isOpen() {
    return connection.isOpen();
  }

  @Override
  public BrokerChannel createChannel() throws IOException {
    Channel channel = connection.createChannel();
    if (channel == null) {
      throw new IOException(
          "No channel number available on " + connection.getClientProvidedName());
    }
    return new RabbitMqChannel(channel);
  }

  @Override
  public void addSignalListener(ConnectionSignalListener listener) {
    listeners.add(listener);
  }

  @Override
  public void removeSignalListener(ConnectionSignalListener listener) {
    listeners.remove(listener);
  }

  void fireCallbackException(Throwable cause) {
    fire(l -> l.onCallbackException(cause));
  }

  @Override
  public void close() {
    connection.removeShutdownListener(shutdownListener);
    connection.removeBlockedListener(blockedListener);
    if (connection instanceof Recoverable recoverable) {
      recoverable.removeRecoveryListener(recoveryListener);
    }
    if (!connection.isOpen()) {
      return;
    }
    try {
      connection.close();
    } catch (IOException | RuntimeException e) {
      log.warn("Error closing RabbitMQ connection {}", connection.getClientProvidedName(), e);
    }
  }

  private void fire(Consumer<ConnectionSignalListener> call) {
    for (ConnectionSignalListener listener : listeners) {
      try {
        call.accept(listener);
      } catch (RuntimeException e) {
        log.error("Connection signal listener failed", e);
      }
    }
  }
}
