package com.acme.amqp.topology;

import java.util.List;
import java.util.Map;

/**
 * Everything that must exist on the broker before a consumer can start: declarations are applied in
 * list order (exchanges, then queues, then bindings).
 */
public record QueueTopology(
    String queueName,
    boolean deadLettering,
    RetryPolicy retryPolicy,
    List<ExchangeDeclaration> exchanges,
    List<QueueDeclaration> queues,
    List<Binding> bindings) {

  public QueueTopology {
    exchanges = List.copyOf(exchanges);
    queues = List.copyOf(queues);
    bindings = List.copyOf(bindings);
  }

  public String directExchange() {
    return QueueNaming.directExchange(queueName);
  }

  public String retryExchange() {
    return QueueNaming.retryExchange(queueName);
  }

  public String deadLetterQueue() {
    return QueueNaming.deadLetterQueue(queueName);
  }

  public record ExchangeDeclaration(String name, String type) {}

  public record QueueDeclaration(String name, Map<String, Object> arguments) {

    public QueueDeclaration {
      arguments = Map.copyOf(arguments);
    }
  }

  public record Binding(String queue, String exchange, String routingKey) {}
}
