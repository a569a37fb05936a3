package com.acme.amqp.spi;

@FunctionalInterface
public interface DeliveryHandler {

  void handle(Delivery delivery);
}
