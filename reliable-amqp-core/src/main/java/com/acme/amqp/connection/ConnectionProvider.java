package com.acme.amqp.connection;

import com.acme.amqp.core.BrokerUnreachableException;
import com.acme.amqp.spi.BrokerConnection;

/** Hands out the one live broker connection of a logical group, creating it on demand. */
public interface ConnectionProvider extends AutoCloseable {

  /**
   * @return an open connection
   * @throws BrokerUnreachableException when every connect attempt failed
   */
  BrokerConnection getOrCreate();

  ConnectionHealth getHealth();

  void addListener(ConnectionEventListener listener);

  void removeListener(ConnectionEventListener listener);

  /** Idempotent. */
  @Override
  void close();
}
