package com.propertyprice.map.application.port.out;

import java.time.Duration;
import java.util.Optional;

/**
 * Output port for short-lived response state keyed by request parameters.
 * Entries expire after their TTL; a miss is always a valid answer.
 */
public interface ResponseStateStore {

  void put(String key, Object value, Duration ttl);

  <T> Optional<T> get(String key, Class<T> type);
}
