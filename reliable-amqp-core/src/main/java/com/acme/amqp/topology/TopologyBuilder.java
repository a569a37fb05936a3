package com.acme.amqp.topology;

import com.acme.amqp.config.ConfigDefaults;
import com.acme.amqp.config.ConsumerConfig;
import com.acme.amqp.config.ExchangeConfig;
import com.acme.amqp.config.ExchangeType;
import com.acme.amqp.config.QueueArg;
import com.acme.amqp.config.QueueConfig;
import com.acme.amqp.core.ChannelException;
import com.acme.amqp.spi.BrokerChannel;
import com.acme.amqp.topology.QueueTopology.Binding;
import com.acme.amqp.topology.QueueTopology.ExchangeDeclaration;
import com.acme.amqp.topology.QueueTopology.QueueDeclaration;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the queues, exchanges and bindings a consumer needs and declares them. Every declaration
 * is durable and idempotent, so running it again on a recreated channel is harmless.
 *
 * <p>For queue {@code orders} with dead-lettering and tiers [5000, 60000] the result is:
 *
 * <pre>
 * orders              x-dead-letter-exchange=orders.direct.DL, x-dead-letter-routing-key=orders
 * orders.direct       direct, orders -> orders
 * orders.direct.DL    direct, orders -> orders.DLQ
 * orders.topic.Retry  topic,  5s -> orders.RetryQ.5s, 1m -> orders.RetryQ.1m
 * orders.RetryQ.5s    x-message-ttl=5000, x-dead-letter-exchange=orders.direct,
 *                     x-dead-letter-routing-key=orders
 * </pre>
 */
public final class TopologyBuilder {

  private static final Logger log = LoggerFactory.getLogger(TopologyBuilder.class);

  private TopologyBuilder() {}

  /** Queue name from configuration, or the message type name when so configured. */
  public static String resolveQueueName(QueueConfig queue, Class<?> messageType) {
    if (queue.isUseTypeNameAsQueueName()) {
      return QueueNaming.forType(messageType);
    }
    return queue.getName();
  }

  /** Pure computation; the configuration is expected to be validated already. */
  public static QueueTopology build(ConsumerConfig config, Class<?> messageType) {
    String queue = resolveQueueName(config.getQueue(), messageType);
    boolean deadLettering = config.isDeadLetteringEnabled();
    RetryPolicy retryPolicy = RetryPolicy.from(config.getRetry());

    List<ExchangeDeclaration> exchanges = new ArrayList<>();
    List<QueueDeclaration> queues = new ArrayList<>();
    List<Binding> bindings = new ArrayList<>();

    Map<String, Object> mainArgs = queueArguments(config.getQueue().getQueueArgs());
    if (deadLettering) {
      mainArgs.put(ConfigDefaults.ARG_DEAD_LETTER_EXCHANGE, QueueNaming.deadLetterExchange(queue));
      mainArgs.put(ConfigDefaults.ARG_DEAD_LETTER_ROUTING_KEY, queue);
    }
    queues.add(new QueueDeclaration(queue, mainArgs));
    exchanges.add(
        new ExchangeDeclaration(QueueNaming.directExchange(queue), ExchangeType.DIRECT.wireName()));
    bindings.add(new Binding(queue, QueueNaming.directExchange(queue), queue));

    if (deadLettering) {
      String dlx = QueueNaming.deadLetterExchange(queue);
      String dlq = QueueNaming.deadLetterQueue(queue);
      exchanges.add(new ExchangeDeclaration(dlx, ExchangeType.DIRECT.wireName()));
      queues.add(new QueueDeclaration(dlq, Map.of()));
      bindings.add(new Binding(dlq, dlx, queue));
    }

    if (retryPolicy.isEnabled()) {
      String retryExchange = QueueNaming.retryExchange(queue);
      exchanges.add(new ExchangeDeclaration(retryExchange, ExchangeType.TOPIC.wireName()));
      for (RetryTier tier : retryPolicy.distinctTiers()) {
        String retryQueue = QueueNaming.retryQueue(queue, tier.id());
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ConfigDefaults.ARG_MESSAGE_TTL, tier.ttlMs());
        args.put(ConfigDefaults.ARG_DEAD_LETTER_EXCHANGE, QueueNaming.directExchange(queue));
        args.put(ConfigDefaults.ARG_DEAD_LETTER_ROUTING_KEY, queue);
        queues.add(new QueueDeclaration(retryQueue, args));
        bindings.add(new Binding(retryQueue, retryExchange, tier.id()));
      }
    }

    if (config.getExchanges() != null) {
      for (ExchangeConfig exchange : config.getExchanges()) {
        ExchangeType type = exchange.exchangeType();
        if (exchange.isDeclare()) {
          exchanges.add(new ExchangeDeclaration(exchange.getName(), type.wireName()));
        }
        if (type == ExchangeType.FANOUT) {
          bindings.add(new Binding(queue, exchange.getName(), ""));
        } else {
          for (String routingKey : exchange.effectiveRoutingKeys()) {
            bindings.add(new Binding(queue, exchange.getName(), routingKey));
          }
        }
      }
    }

    return new QueueTopology(queue, deadLettering, retryPolicy, exchanges, queues, bindings);
  }

  /**
   * Declares the topology on {@code channel}.
   *
   * @throws ChannelException when the broker rejects a declaration
   */
  public static void declare(BrokerChannel channel, QueueTopology topology) {
    String current = topology.queueName();
    try {
      for (ExchangeDeclaration exchange : topology.exchanges()) {
        current = exchange.name();
        channel.exchangeDeclare(exchange.name(), exchange.type(), true);
      }
      for (QueueDeclaration queue : topology.queues()) {
        current = queue.name();
        channel.queueDeclare(queue.name(), true, false, false, queue.arguments());
      }
      for (Binding binding : topology.bindings()) {
        current = binding.queue() + " <- " + binding.exchange();
        channel.queueBind(binding.queue(), binding.exchange(), binding.routingKey());
      }
    } catch (IOException e) {
      throw new ChannelException("Failed to declare topology at " + current, e);
    }
    log.debug(
        "Declared topology for queue={} exchanges={} queues={} bindings={}",
        topology.queueName(),
        topology.exchanges().size(),
        topology.queues().size(),
        topology.bindings().size());
  }

  static Map<String, Object> queueArguments(List<QueueArg> args) {
    Map<String, Object> result = new LinkedHashMap<>();
    if (args == null) {
      return result;
    }
    for (QueueArg arg : args) {
      result.put(arg.normalizedKey(), arg.brokerValue());
    }
    return result;
  }
}
