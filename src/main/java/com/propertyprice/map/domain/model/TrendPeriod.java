package com.propertyprice.map.domain.model;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Calendar period that sales are grouped by for price trends. Labels sort
 * chronologically as plain strings.
 */
public enum TrendPeriod {
    MONTHLY("monthly"),
    QUARTERLY("quarterly"),
    YEARLY("yearly");

    private final String value;

    TrendPeriod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Label of the period containing a date: "2023-07", "2023Q3" or "2023".
     */
    public String labelOf(LocalDate date) {
        switch (this) {
            case MONTHLY:
                return String.format("%04d-%02d", date.getYear(), date.getMonthValue());
            case QUARTERLY:
                return String.format("%04dQ%d", date.getYear(), (date.getMonthValue() - 1) / 3 + 1);
            case YEARLY:
            default:
                return String.format("%04d", date.getYear());
        }
    }

    public static TrendPeriod fromValue(String value) {
        return Arrays.stream(values())
                .filter(period -> period.value.equalsIgnoreCase(value) || period.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trend period: " + value));
    }
}
