package com.acme.amqp.topology;

import static org.assertj.core.api.Assertions.*;

import com.acme.amqp.config.RetryConfig;
import com.acme.amqp.core.ConfigException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for RetryPolicy */
class RetryPolicyTest {

  @Nested
  @DisplayName("Tier Tests")
  class TierTests {

    @Test
    @DisplayName("should build one tier per configured TTL in order")
    void testTiers() {
      RetryPolicy policy = RetryPolicy.of(List.of(5000L, 15000L, 60000L));

      assertThat(policy.isEnabled()).isTrue();
      assertThat(policy.maxAttempts()).isEqualTo(3);
      assertThat(policy.tiers())
          .extracting(RetryTier::id)
          .containsExactly("5s", "15s", "1m");
      assertThat(policy.tiers()).extracting(RetryTier::index).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("should collapse duplicate TTLs into one distinct tier")
    void testDistinctTiers() {
      RetryPolicy policy = RetryPolicy.of(List.of(5000L, 5000L, 60000L));

      assertThat(policy.maxAttempts()).isEqualTo(3);
      assertThat(policy.distinctTiers()).extracting(RetryTier::id).containsExactly("5s", "1m");
    }

    @Test
    @DisplayName("nextTier should follow the retry count and end after the last tier")
    void testNextTier() {
      RetryPolicy policy = RetryPolicy.of(List.of(5000L, 60000L));

      assertThat(policy.nextTier(0)).map(RetryTier::ttlMs).contains(5000L);
      assertThat(policy.nextTier(1)).map(RetryTier::ttlMs).contains(60000L);
      assertThat(policy.nextTier(2)).isEmpty();
      assertThat(policy.nextTier(-1)).isEmpty();
    }

    @Test
    @DisplayName("should reject TTLs below the minimum")
    void testRejectsShortTtl() {
      assertThatThrownBy(() -> RetryPolicy.of(List.of(400L)))
          .isInstanceOf(ConfigException.class);
      assertThatThrownBy(() -> RetryPolicy.of(List.of())).isInstanceOf(ConfigException.class);
    }
  }

  @Nested
  @DisplayName("Last Try Tests")
  class LastTryTests {

    @Test
    @DisplayName("should be last try only once the retry count reaches the tier count")
    void testLastTryGrid() {
      RetryPolicy policy = RetryPolicy.of(List.of(5000L, 15000L, 60000L));

      assertThat(policy.isLastTry(0)).isFalse();
      assertThat(policy.isLastTry(1)).isFalse();
      assertThat(policy.isLastTry(2)).isFalse();
      assertThat(policy.isLastTry(3)).isTrue();
      assertThat(policy.isLastTry(4)).isTrue();
    }

    @Test
    @DisplayName("every delivery is the last try when retry is disabled")
    void testDisabled() {
      RetryPolicy policy = RetryPolicy.disabled();

      assertThat(policy.isEnabled()).isFalse();
      assertThat(policy.isLastTry(0)).isTrue();
      assertThat(policy.nextTier(0)).isEmpty();
    }

    @Test
    @DisplayName("from(null) should be disabled")
    void testFromNull() {
      assertThat(RetryPolicy.from(null).isEnabled()).isFalse();
      assertThat(RetryPolicy.from(new RetryConfig(List.of(1000L))).maxAttempts()).isEqualTo(1);
    }
  }
}
