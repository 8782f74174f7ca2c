package com.propertyprice.map.application.service;

import com.propertyprice.map.application.port.out.ResponseStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through use of the response state store.
 * Store failures (e.g. Redis connection errors) are logged and the response is
 * computed afresh; they never fail a request.
 */
class ResponseCache {

    private static final Logger logger = LoggerFactory.getLogger(ResponseCache.class);

    private final ResponseStateStore stateStore;
    private final Duration ttl;

    ResponseCache(ResponseStateStore stateStore, Duration ttl) {
        this.stateStore = stateStore;
        this.ttl = ttl;
    }

    /**
     * Serve from the state store when possible, otherwise compute and store.
     * A computation that throws stores nothing.
     */
    <T> T getOrCompute(String key, Class<T> type, Supplier<T> compute) {
        Optional<T> hit = read(key, type);
        if (hit.isPresent()) {
            logger.debug("State store hit for key: {}", key);
            return hit.get();
        }
        logger.debug("State store miss for key: {}", key);
        T response = compute.get();
        write(key, response);
        return response;
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        try {
            return stateStore.get(key, type);
        } catch (Exception e) {
            logger.warn("Failed to read response from state store, continuing without cache: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void write(String key, Object response) {
        try {
            stateStore.put(key, response, ttl);
        } catch (Exception e) {
            logger.warn("Failed to store response, continuing without cache: {}", e.getMessage());
        }
    }
}
