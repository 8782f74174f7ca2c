package com.propertyprice.map.domain.model;

import java.util.Arrays;

/**
 * Partitioning applied before geographic clustering.
 * SIZE has no partitioning of its own and clusters exactly like GEOGRAPHIC.
 */
public enum ClusterMode {
    GEOGRAPHIC("geographic"),
    PRICE("price"),
    SIZE("size");

    private final String value;

    ClusterMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ClusterMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cluster mode: " + value));
    }
}
