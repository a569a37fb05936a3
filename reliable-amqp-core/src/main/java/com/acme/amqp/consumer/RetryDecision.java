package com.acme.amqp.consumer;

import com.acme.amqp.topology.RetryPolicy;
import com.acme.amqp.topology.RetryTier;

/**
 * What happens to a delivery whose handling failed. {@code tier} is set only for {@link
 * Action#RETRY}.
 */
public record RetryDecision(Action action, RetryTier tier) {

  public enum Action {
    /** Acknowledge and drop: no retry left and dead-lettering disabled. */
    ACK_DROP,
    /** Reject without requeue so the broker routes it to the dead-letter queue. */
    DEAD_LETTER,
    /** Republish through the retry exchange, then acknowledge the original. */
    RETRY
  }

  public static RetryDecision decide(RetryPolicy policy, boolean deadLettering, int retryCount) {
    return policy
        .nextTier(retryCount)
        .map(tier -> new RetryDecision(Action.RETRY, tier))
        .orElseGet(
            () -> new RetryDecision(deadLettering ? Action.DEAD_LETTER : Action.ACK_DROP, null));
  }
}
