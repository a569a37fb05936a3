package com.acme.amqp.config;

import com.acme.amqp.core.ConfigException;
import java.util.ArrayList;
import java.util.List;

public class QueueConfig {

  private String name;
  private boolean useTypeNameAsQueueName;
  private List<QueueArg> queueArgs = new ArrayList<>();

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public boolean isUseTypeNameAsQueueName() {
    return useTypeNameAsQueueName;
  }

  public void setUseTypeNameAsQueueName(boolean useTypeNameAsQueueName) {
    this.useTypeNameAsQueueName = useTypeNameAsQueueName;
  }

  public List<QueueArg> getQueueArgs() {
    return queueArgs;
  }

  public void setQueueArgs(List<QueueArg> queueArgs) {
    this.queueArgs = queueArgs;
  }

  public boolean hasDeadLetterArgs() {
    return queueArgs != null && queueArgs.stream().anyMatch(QueueArg::isDeadLetterArg);
  }

  public void validate() {
    boolean hasName = name != null && !name.isBlank();
    if (useTypeNameAsQueueName && hasName) {
      throw new ConfigException(
          "Queue name should not be provided when useTypeNameAsQueueName is true");
    }
    if (!useTypeNameAsQueueName && !hasName) {
      throw new ConfigException("Queue name is required when useTypeNameAsQueueName is false");
    }
    if (queueArgs != null) {
      for (QueueArg arg : queueArgs) {
        if (arg == null) {
          throw new ConfigException("One of queueArgs items is null");
        }
        arg.validate();
      }
    }
  }
}
