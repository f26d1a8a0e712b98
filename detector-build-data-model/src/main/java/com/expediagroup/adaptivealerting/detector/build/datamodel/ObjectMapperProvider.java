package com.expediagroup.adaptivealerting.detector.build.datamodel;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;
  private static volatile ObjectMapper nonEmptyObjectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper = create(Include.NON_NULL);
        }
      }
    }
    return objectMapper;
  }

  /** Mapper that also drops empty strings, collections and maps from its output. */
  public static ObjectMapper getNonEmpty() {
    if (nonEmptyObjectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (nonEmptyObjectMapper == null) {
          nonEmptyObjectMapper = create(Include.NON_EMPTY);
        }
      }
    }
    return nonEmptyObjectMapper;
  }

  private static ObjectMapper create(Include include) {
    return new ObjectMapper()
        .setSerializationInclusion(include)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }
}
