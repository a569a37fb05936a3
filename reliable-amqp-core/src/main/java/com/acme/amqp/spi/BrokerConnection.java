package com.acme.amqp.spi;

import java.io.IOException;

public interface BrokerConnection extends AutoCloseable {

  boolean isOpen();

  BrokerChannel createChannel() throws IOException;

  void addSignalListener(ConnectionSignalListener listener);

  void removeSignalListener(ConnectionSignalListener listener);

  /** Closes the connection and every channel it owns. Never throws. */
  @Override
  void close();
}
