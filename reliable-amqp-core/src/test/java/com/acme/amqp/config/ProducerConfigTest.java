package com.acme.amqp.config;

import static org.assertj.core.api.Assertions.*;

import com.acme.amqp.core.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Unit tests for ProducerConfig and ChannelPoolConfig */
class ProducerConfigTest {

  @Test
  @DisplayName("should accept the defaults")
  void testDefaults() {
    ProducerConfig config = new ProducerConfig();

    assertThatCode(config::validate).doesNotThrowAnyException();
    assertThat(config.batchSizeOrDefault()).isEqualTo(20);
    assertThat(config.isPublisherConfirmsEnabled()).isFalse();
    assertThat(config.isOpenOnStartup()).isFalse();
  }

  @ParameterizedTest(name = "min={0}, max={1}, wait={2}")
  @CsvSource({"0, 5, 200", "5, 5, 200", "6, 5, 200", "2, 5, 0"})
  @DisplayName("should reject invalid pool bounds")
  void testInvalidPool(int min, int max, long wait) {
    ProducerConfig config = new ProducerConfig();
    config.setChannelPool(new ChannelPoolConfig(min, max, wait));

    assertThatThrownBy(config::validate).isInstanceOf(ConfigException.class);
  }

  @Test
  @DisplayName("should accept 0 < min < max and a positive wait")
  void testValidPool() {
    ProducerConfig config = new ProducerConfig();
    config.setChannelPool(new ChannelPoolConfig(2, 5, 200));

    assertThatCode(config::validate).doesNotThrowAnyException();
    assertThat(config.getChannelPool().waitTimeout().toMillis()).isEqualTo(200);
  }

  @Test
  @DisplayName("should reject a non-positive batch size")
  void testBatchSize() {
    ProducerConfig config = new ProducerConfig();
    config.setBatchSize(0);

    assertThatThrownBy(config::validate).hasMessageContaining("batchSize");
  }

  @Test
  @DisplayName("should validate publisher confirms")
  void testPublisherConfirms() {
    ProducerConfig config = new ProducerConfig();
    config.setPublisherConfirms(new PublisherConfirmsConfig(9));

    assertThatThrownBy(config::validate).hasMessageContaining("waitConfirmsMs");
  }
}
