package com.acme.amqp.consumer;

@FunctionalInterface
public interface ScopeFactory {

  HandlerScope openScope();

  /** Scope factory for handlers that do not resolve anything. */
  static ScopeFactory none() {
    return () ->
        new HandlerScope() {
          @Override
          public <B> B getBean(Class<B> type) {
            throw new IllegalStateException(
                "No scope factory configured, cannot resolve " + type.getName());
          }
        };
  }
}
