package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;

public class ProducerConfig {

  private ChannelPoolConfig channelPool = new ChannelPoolConfig();
  private PublisherConfirmsConfig publisherConfirms;
  private Integer batchSize;
  private boolean openOnStartup;

  public ChannelPoolConfig getChannelPool() {
    return channelPool;
  }

  public void setChannelPool(ChannelPoolConfig channelPool) {
    this.channelPool = channelPool;
  }

  public PublisherConfirmsConfig getPublisherConfirms() {
    return publisherConfirms;
  }

  public void setPublisherConfirms(PublisherConfirmsConfig publisherConfirms) {
    this.publisherConfirms = publisherConfirms;
  }

  public Integer getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(Integer batchSize) {
    this.batchSize = batchSize;
  }

  public boolean isOpenOnStartup() {
    return openOnStartup;
  }

  public void setOpenOnStartup(boolean openOnStartup) {
    this.openOnStartup = openOnStartup;
  }

  public int batchSizeOrDefault() {
    return batchSize != null ? batchSize : ConfigDefaults.BATCH_SIZE;
  }

  public boolean isPublisherConfirmsEnabled() {
    return publisherConfirms != null;
  }

  public void validate() {
    if (channelPool == null) {
      throw new ConfigException("Producer channelPool is null");
    }
    channelPool.validate();
    if (publisherConfirms != null) {
      publisherConfirms.validate();
    }
    if (batchSize != null && batchSize <= 0) {
      throw new ConfigException("Producer batchSize must be > 0 but was " + batchSize);
    }
  }
}
