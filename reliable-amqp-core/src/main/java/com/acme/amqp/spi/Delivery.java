package com.acme.amqp.spi;

/** A raw message delivered to a consumer tag. */
public record Delivery(
    String consumerTag,
    long deliveryTag,
    String exchange,
    String routingKey,
    boolean redelivered,
    MessageProperties properties,
    byte[] body) {

  public Delivery {
    if (properties == null) {
      properties = MessageProperties.empty();
    }
  }
}
