package com.acme.amqp.spi;

import com.acme.amqp.config.ServerEndpoint;
import com.acme.amqp.core.BrokerUnreachableException;

/** Wire-level broker transport. Implementations open one physical connection per call. */
public interface Transport {

  /**
   * @param clientName connection name advertised to the broker
   * @throws BrokerUnreachableException when no host of the endpoint accepts the connection
   */
  BrokerConnection connect(ServerEndpoint endpoint, String clientName);
}
