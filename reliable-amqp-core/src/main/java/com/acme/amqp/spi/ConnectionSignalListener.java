package com.acme.amqp.spi;

/** Callbacks raised by a {@link BrokerConnection}. All methods default to no-op. */
public interface ConnectionSignalListener {

  default void onShutdown(String reason, Throwable cause) {}

  default void onBlocked(String reason) {}

  default void onUnblocked() {}

  default void onCallbackException(Throwable cause) {}

  default void onRecovering() {}

  default void onRecovered() {}
}
