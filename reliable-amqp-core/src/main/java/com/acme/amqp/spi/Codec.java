package com.acme.amqp.spi;

import com.acme.amqp.core.CodecException;

/** Message body encoding. */
public interface Codec {

  /** @throws CodecException when the value cannot be serialized */
  byte[] encode(Object value);

  /** @throws CodecException when the bytes do not decode to a non-null {@code type} */
  <T> T decode(byte[] body, Class<T> type);

  default String contentType() {
    return MessageProperties.JSON;
  }
}
