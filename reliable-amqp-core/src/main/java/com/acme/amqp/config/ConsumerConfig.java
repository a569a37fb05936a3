package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.List;

/**
 * Declarative consumer settings. A {@code null} {@link #getRetry() retry} disables retrying, a
 * {@code null} {@link #getPublisherConfirms() publisherConfirms} disables confirm waits when
 * republishing to the retry exchange.
 */
public class ConsumerConfig {

  private int consumersCount = 1;
  private Integer prefetchSize;
  private Integer prefetchCount;
  private boolean disableDeadLettering;
  private List<ExchangeConfig> exchanges = new ArrayList<>();
  private QueueConfig queue = new QueueConfig();
  private RetryConfig retry;
  private PublisherConfirmsConfig publisherConfirms;

  public int getConsumersCount() {
    return consumersCount;
  }

  public void setConsumersCount(int consumersCount) {
    this.consumersCount = consumersCount;
  }

  public Integer getPrefetchSize() {
    return prefetchSize;
  }

  public void setPrefetchSize(Integer prefetchSize) {
    this.prefetchSize = prefetchSize;
  }

  public Integer getPrefetchCount() {
    return prefetchCount;
  }

  public void setPrefetchCount(Integer prefetchCount) {
    this.prefetchCount = prefetchCount;
  }

  public boolean isDisableDeadLettering() {
    return disableDeadLettering;
  }

  public void setDisableDeadLettering(boolean disableDeadLettering) {
    this.disableDeadLettering = disableDeadLettering;
  }

  public List<ExchangeConfig> getExchanges() {
    return exchanges;
  }

  public void setExchanges(List<ExchangeConfig> exchanges) {
    this.exchanges = exchanges;
  }

  public QueueConfig getQueue() {
    return queue;
  }

  public void setQueue(QueueConfig queue) {
    this.queue = queue;
  }

  public RetryConfig getRetry() {
    return retry;
  }

  public void setRetry(RetryConfig retry) {
    this.retry = retry;
  }

  public PublisherConfirmsConfig getPublisherConfirms() {
    return publisherConfirms;
  }

  public void setPublisherConfirms(PublisherConfirmsConfig publisherConfirms) {
    this.publisherConfirms = publisherConfirms;
  }

  public int prefetchSizeOrDefault() {
    return prefetchSize != null ? prefetchSize : ConfigDefaults.PREFETCH_SIZE;
  }

  public int prefetchCountOrDefault() {
    return prefetchCount != null ? prefetchCount : ConfigDefaults.PREFETCH_COUNT;
  }

  public boolean isRetryEnabled() {
    return retry != null;
  }

  public boolean isDeadLetteringEnabled() {
    return !disableDeadLettering;
  }

  public boolean isPublisherConfirmsEnabled() {
    return publisherConfirms != null;
  }

  /** Fails fast before any broker I/O. */
  public void validate() {
    if (consumersCount <= 0) {
      throw new ConfigException("Consumer consumersCount must be > 0 but was " + consumersCount);
    }
    if (prefetchSize != null && prefetchSize < 0) {
      throw new ConfigException("Consumer prefetchSize must be >= 0 but was " + prefetchSize);
    }
    if (prefetchCount != null && prefetchCount <= 0) {
      throw new ConfigException("Consumer prefetchCount must be > 0 but was " + prefetchCount);
    }
    if (queue == null) {
      throw new ConfigException("Consumer queue is null");
    }
    queue.validate();
    if ((isDeadLetteringEnabled() || isRetryEnabled()) && queue.hasDeadLetterArgs()) {
      throw new ConfigException(
          "QueueArgs "
              + ConfigDefaults.ARG_DEAD_LETTER_EXCHANGE
              + " and "
              + ConfigDefaults.ARG_DEAD_LETTER_ROUTING_KEY
              + " are set by the client when dead-lettering or retry is enabled");
    }
    if (exchanges != null) {
      for (ExchangeConfig exchange : exchanges) {
        if (exchange == null) {
          throw new ConfigException("One of exchanges items is null");
        }
        exchange.validate();
      }
    }
    if (retry != null) {
      retry.validate();
    }
    if (publisherConfirms != null) {
      publisherConfirms.validate();
    }
  }
}
