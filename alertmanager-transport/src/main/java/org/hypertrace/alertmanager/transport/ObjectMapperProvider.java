package org.hypertrace.alertmanager.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          // sorted keys keep retry files byte-stable for the same alert
          objectMapper =
              new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        }
      }
    }
    return objectMapper;
  }
}
