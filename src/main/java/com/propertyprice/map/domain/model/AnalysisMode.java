package com.propertyprice.map.domain.model;

import java.util.Arrays;

public enum AnalysisMode {
    SPATIAL_PATTERNS("spatial-patterns"),
    HOTSPOTS("hotspots"),
    CLUSTER_IDENTIFICATION("cluster-identification"),
    GROWTH_DECLINE("growth-decline"),
    PRICE_HEATMAP("price-heatmap"),
    SALES_HEATMAP("sales-heatmap");

    private final String value;

    AnalysisMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AnalysisMode fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equalsIgnoreCase(value) || mode.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown analysis mode: " + value));
    }
}
