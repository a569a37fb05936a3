package com.acme.amqp.codec;

import static org.assertj.core.api.Assertions.*;

import com.acme.amqp.core.CodecException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for JacksonCodec */
class JacksonCodecTest {

  record Payment(String id, long amountCents, Instant createdAt) {}

  private final JacksonCodec codec = new JacksonCodec();

  @Test
  @DisplayName("should decode JSON bodies including java.time values")
  void testDecode() {
    byte[] body =
        "{\"id\":\"p-1\",\"amountCents\":1250,\"createdAt\":\"2024-03-01T10:15:30Z\"}"
            .getBytes(StandardCharsets.UTF_8);

    Payment payment = codec.decode(body, Payment.class);

    assertThat(payment.id()).isEqualTo("p-1");
    assertThat(payment.amountCents()).isEqualTo(1250);
    assertThat(payment.createdAt()).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
  }

  @Test
  @DisplayName("should encode to JSON")
  void testEncode() {
    byte[] body = codec.encode(new Payment("p-2", 10, null));

    assertThat(new String(body, StandardCharsets.UTF_8))
        .contains("\"id\":\"p-2\"")
        .contains("\"amountCents\":10");
    assertThat(codec.contentType()).isEqualTo("application/json");
  }

  @Test
  @DisplayName("should reject empty bodies")
  void testEmptyBody() {
    assertThatThrownBy(() -> codec.decode(new byte[0], Payment.class))
        .isInstanceOf(CodecException.class)
        .hasMessageContaining("empty");
  }

  @Test
  @DisplayName("should reject malformed JSON")
  void testMalformed() {
    byte[] body = "{not json".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> codec.decode(body, Payment.class))
        .isInstanceOf(CodecException.class)
        .hasMessageContaining(Payment.class.getName());
  }

  @Test
  @DisplayName("should reject a JSON null literal")
  void testNullLiteral() {
    byte[] body = "null".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> codec.decode(body, Payment.class))
        .isInstanceOf(CodecException.class)
        .hasMessageContaining("null");
  }
}
