package com.mk.fx.qa.probe.execution.rest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Shared Jackson mapper for request bodies sent by the client. */
public final class JsonUtil {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .addModule(new JavaTimeModule())
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private JsonUtil() {
    throw new UnsupportedOperationException("JsonUtil cannot be instantiated");
  }

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static String toJson(Object value) throws JsonProcessingException {
    return MAPPER.writeValueAsString(value);
  }
}
