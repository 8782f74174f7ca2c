package com.propertyprice.map.domain.model;

import java.util.Arrays;

/**
 * Variable correlated against sale price.
 * SIZE uses the band in the sale's size description, DATE the sale date.
 */
public enum CorrelationVariable {
    SIZE("size"),
    DATE("date");

    private final String value;

    CorrelationVariable(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CorrelationVariable fromValue(String value) {
        return Arrays.stream(values())
                .filter(variable -> variable.value.equalsIgnoreCase(value) || variable.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown correlation variable: " + value));
    }
}
