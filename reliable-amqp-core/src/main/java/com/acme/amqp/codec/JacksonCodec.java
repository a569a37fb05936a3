package com.acme.amqp.codec;

import com.acme.amqp.core.CodecException;
import com.acme.amqp.spi.Codec;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

/** JSON message bodies via Jackson. */
public final class JacksonCodec implements Codec {

  private final ObjectMapper mapper;

  public JacksonCodec() {
    this(new ObjectMapper().registerModule(new JavaTimeModule()));
  }

  public JacksonCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  @Override
  public byte[] encode(Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (IOException e) {
      throw new CodecException("Failed to encode " + typeName(value), e);
    }
  }

  @Override
  public <T> T decode(byte[] body, Class<T> type) {
    if (body == null || body.length == 0) {
      throw new CodecException("Cannot decode an empty body to " + type.getName());
    }
    T value;
    try {
      value = mapper.readValue(body, type);
    } catch (IOException e) {
      throw new CodecException("Failed to decode body to " + type.getName(), e);
    }
    if (value == null) {
      throw new CodecException("Body decoded to null for " + type.getName());
    }
    return value;
  }

  private static String typeName(Object value) {
    return value == null ? "null" : value.getClass().getName();
  }
}
