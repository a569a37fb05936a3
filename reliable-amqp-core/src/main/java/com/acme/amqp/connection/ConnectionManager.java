package com.acme.amqp.connection;

import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.core.BrokerUnreachableException;
import com.acme.amqp.spi.BrokerConnection;
import com.acme.amqp.spi.ConnectionSignalListener;
import com.acme.amqp.spi.Transport;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the single broker connection of a logical group.
 *
 * <p>The connection is created lazily on the first {@link #getOrCreate()} call and transparently
 * recreated once the cached one is closed. Concurrent callers racing on a missing connection result
 * in exactly one connect: the open check is repeated under the lock. A failing connect is retried
 * {@code reconnectCount} more times with a fixed pause of {@code reconnectIntervalSeconds} between
 * attempts.
 *
 * <p>Broker signals are re-published as {@link ConnectionEvent}s. Listener failures are logged and
 * never reach the broker callback thread or the caller.
 */
public class ConnectionManager implements ConnectionProvider {

  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  private final Transport transport;
  private final ServerEndpoint endpoint;
  private final String clientName;
  private final int reconnectCount;
  private final Duration reconnectInterval;

  private final ReentrantLock connectLock = new ReentrantLock();
  private final List<ConnectionEventListener> listeners = new CopyOnWriteArrayList<>();
  private final ConnectionSignalListener signalListener = new SignalBridge();

  private volatile BrokerConnection connection;
  private volatile long connectedAtNanos;
  private volatile boolean closed;
  private volatile String blockedReason;

  public ConnectionManager(Transport transport, ServerEndpoint endpoint) {
    this(transport, endpoint, null);
  }

  /**
   * @param clientNameSuffix appended to the endpoint client id as {@code clientId:suffix}; may be
   *     null
   */
  public ConnectionManager(Transport transport, ServerEndpoint endpoint, String clientNameSuffix) {
    this(
        transport,
        endpoint,
        clientNameSuffix,
        Duration.ofSeconds(validated(endpoint).reconnectIntervalSecondsOrDefault()));
  }

  ConnectionManager(
      Transport transport,
      ServerEndpoint endpoint,
      String clientNameSuffix,
      Duration reconnectInterval) {
    validated(endpoint);
    this.transport = transport;
    this.endpoint = endpoint;
    this.clientName = endpoint.connectionName(clientNameSuffix);
    this.reconnectCount = endpoint.reconnectCountOrDefault();
    this.reconnectInterval = reconnectInterval;
  }

  private static ServerEndpoint validated(ServerEndpoint endpoint) {
    endpoint.validate();
    return endpoint;
  }

  public String getClientName() {
    return clientName;
  }

  @Override
  public BrokerConnection getOrCreate() {
    BrokerConnection current = connection;
    if (current != null && current.isOpen()) {
      return current;
    }

    connectLock.lock();
    try {
      current = connection;
      if (current != null && current.isOpen()) {
        return current;
      }
      if (closed) {
        throw new IllegalStateException("Connection manager " + clientName + " is closed");
      }
      if (current != null) {
        current.removeSignalListener(signalListener);
        closeStale(current);
      }

      publish(
          ConnectionEvent.of(ConnectionEventType.CONNECTING, "Establishing connection to broker"));
      BrokerConnection created = connectWithRetry();
      created.addSignalListener(signalListener);
      connectedAtNanos = System.nanoTime();
      blockedReason = null;
      connection = created;

      log.info("Connected to broker: client={}, hosts={}", clientName, endpoint.getHosts());
      publish(
          ConnectionEvent.of(
              ConnectionEventType.CONNECTED,
              "Successfully connected to broker: " + endpoint.getHosts()));
      return created;
    } finally {
      connectLock.unlock();
    }
  }

  private BrokerConnection connectWithRetry() {
    int attempt = 0;
    while (true) {
      try {
        return transport.connect(endpoint, clientName);
      } catch (BrokerUnreachableException e) {
        log.error(
            "Error while trying to connect to broker hosts. attempt={}/{}, hosts={}",
            attempt + 1,
            reconnectCount + 1,
            endpoint.getHosts(),
            e);
        publish(ConnectionEvent.of(ConnectionEventType.ERROR, "Connect attempt failed", e));
        attempt++;
        if (attempt > reconnectCount) {
          throw e;
        }
        sleepBeforeRetry(e);
      }
    }
  }

  /** Closes a connection that is being replaced so client-side recovery cannot revive it. */
  private void closeStale(BrokerConnection stale) {
    try {
      stale.close();
    } catch (RuntimeException e) {
      log.warn("Error closing stale broker connection: client={}", clientName, e);
    }
  }

  private void sleepBeforeRetry(BrokerUnreachableException lastFailure) {
    try {
      TimeUnit.MILLISECONDS.sleep(reconnectInterval.toMillis());
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      BrokerUnreachableException ex =
          new BrokerUnreachableException("Interrupted while waiting to reconnect", ie);
      ex.addSuppressed(lastFailure);
      throw ex;
    }
  }

  @Override
  public ConnectionHealth getHealth() {
    BrokerConnection current = connection;
    if (current == null) {
      return ConnectionHealth.disconnected();
    }
    if (current.isOpen() && blockedReason != null) {
      return ConnectionHealth.degraded("Connection is blocked: " + blockedReason);
    }
    if (current.isOpen()) {
      return ConnectionHealth.healthy(Duration.ofNanos(System.nanoTime() - connectedAtNanos));
    }
    return ConnectionHealth.unhealthy("Connection is closed");
  }

  @Override
  public void addListener(ConnectionEventListener listener) {
    listeners.add(listener);
  }

  @Override
  public void removeListener(ConnectionEventListener listener) {
    listeners.remove(listener);
  }

  @Override
  public void close() {
    connectLock.lock();
    try {
      if (closed) {
        return;
      }
      publish(
          ConnectionEvent.of(
              ConnectionEventType.DISPOSING, "Connection manager is being disposed"));
      closed = true;
      BrokerConnection current = connection;
      if (current != null) {
        current.removeSignalListener(signalListener);
        current.close();
      }
      connection = null;
      log.info("Connection manager closed: client={}", clientName);
      publish(ConnectionEvent.of(ConnectionEventType.DISPOSED, "Connection manager disposed"));
    } finally {
      connectLock.unlock();
    }
  }

  private void publish(ConnectionEvent event) {
    for (ConnectionEventListener listener : listeners) {
      try {
        listener.onEvent(event);
      } catch (Exception e) {
        log.error("Error raising connection event: {}", event.type(), e);
      }
    }
  }

  private final class SignalBridge implements ConnectionSignalListener {

    @Override
    public void onShutdown(String reason, Throwable cause) {
      log.warn("Broker connection shutdown: client={}, reason={}", clientName, reason);
      publish(
          ConnectionEvent.of(
              ConnectionEventType.SHUTDOWN, "Connection shutdown: " + reason, cause));
    }

    @Override
    public void onBlocked(String reason) {
      blockedReason = reason;
      log.warn("Broker connection blocked: client={}, reason={}", clientName, reason);
      publish(ConnectionEvent.of(ConnectionEventType.BLOCKED, "Connection blocked: " + reason));
    }

    @Override
    public void onUnblocked() {
      blockedReason = null;
      log.warn("Broker connection unblocked: client={}", clientName);
      publish(ConnectionEvent.of(ConnectionEventType.UNBLOCKED, "Connection unblocked"));
    }

    @Override
    public void onCallbackException(Throwable cause) {
      log.warn("Broker callback exception: client={}", clientName, cause);
      publish(
          ConnectionEvent.of(
              ConnectionEventType.CALLBACK_EXCEPTION, "Callback exception occurred", cause));
    }

    @Override
    public void onRecovering() {
      log.info("Broker connection recovering: client={}", clientName);
      publish(ConnectionEvent.of(ConnectionEventType.RECOVERING, "Connection recovery started"));
    }

    @Override
    public void onRecovered() {
      connectedAtNanos = System.nanoTime();
      log.info("Broker connection recovered: client={}", clientName);
      publish(ConnectionEvent.of(ConnectionEventType.RECOVERED, "Connection recovered"));
    }
  }
}
