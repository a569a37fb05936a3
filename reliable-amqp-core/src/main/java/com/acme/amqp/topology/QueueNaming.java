package com.acme.amqp.topology;

/** Broker object names derived from a queue name. Existing deployments rely on these exactly. */
public final class QueueNaming {

  private QueueNaming() {}

  public static String directExchange(String queue) {
    return queue + ".direct";
  }

  public static String deadLetterExchange(String queue) {
    return queue + ".direct.DL";
  }

  public static String deadLetterQueue(String queue) {
    return queue + ".DLQ";
  }

  public static String retryExchange(String queue) {
    return queue + ".topic.Retry";
  }

  public static String retryQueue(String queue, String tierId) {
    return queue + ".RetryQ." + tierId;
  }

  /** Queue name used for messages of {@code type}. */
  public static String forType(Class<?> type) {
    return type.getName();
  }
}
