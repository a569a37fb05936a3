package com.acme.amqp.consumer;

import com.acme.amqp.spi.MessageProperties;

/** Routing metadata of one delivery plus its decoded payload ({@code null} if decoding failed). */
public record MessageEnvelope<T>(
    String exchange,
    String routingKey,
    long deliveryTag,
    String consumerTag,
    boolean redelivered,
    int retryCount,
    MessageProperties properties,
    T payload) {}
