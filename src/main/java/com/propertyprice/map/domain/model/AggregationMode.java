package com.propertyprice.map.domain.model;

/**
 * Which aggregation a viewport request is answered with.
 */
public enum AggregationMode {
    /** Raw records, no aggregation. */
    POINTS,
    /** Interactive pin clustering over a capped, possibly sampled record set. */
    CLUSTERS,
    /** Grid statistics over every record in view. */
    REAL_COUNT,
    /** Viewport-anchored N x N polygon grid. */
    HEATMAP,
    /** Polygon grid plus a mode-specific per-point intensity layer. */
    ANALYSIS
}
