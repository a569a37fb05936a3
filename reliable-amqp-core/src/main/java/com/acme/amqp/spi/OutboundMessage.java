package com.acme.amqp.spi;

public record OutboundMessage(
    String exchange,
    String routingKey,
    boolean mandatory,
    MessageProperties properties,
    byte[] body) {}
