package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Weighted point of an analysis overlay. Only the metadata relevant to the
 * producing analysis mode is set; the rest stays null.
 */
@Getter
@EqualsAndHashCode
@ToString
public class HeatmapPoint {
    private final double latitude;
    private final double longitude;
    private final double intensity;
    private final Integer salesCount;
    private final Long avgPrice;
    private final Double changePercent;
    private final Long earlyAvgPrice;
    private final Long lateAvgPrice;

    public HeatmapPoint(double latitude, double longitude, double intensity, Integer salesCount,
            Long avgPrice, Double changePercent, Long earlyAvgPrice, Long lateAvgPrice) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.intensity = intensity;
        this.salesCount = salesCount;
        this.avgPrice = avgPrice;
        this.changePercent = changePercent;
        this.earlyAvgPrice = earlyAvgPrice;
        this.lateAvgPrice = lateAvgPrice;
    }

    public static HeatmapPoint of(double latitude, double longitude, double intensity) {
        return new HeatmapPoint(latitude, longitude, intensity, null, null, null, null, null);
    }

    public static HeatmapPoint withSales(double latitude, double longitude, double intensity,
            int salesCount, Long avgPrice) {
        return new HeatmapPoint(latitude, longitude, intensity, salesCount, avgPrice, null, null, null);
    }
}
