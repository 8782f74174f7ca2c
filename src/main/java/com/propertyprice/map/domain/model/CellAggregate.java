package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Grid cell statistics over every record in the cell. Price statistics cover
 * only members with a price and are null when no member has one.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CellAggregate {
    private final double centerLat;
    private final double centerLng;
    private final int count;
    private final List<Long> propertyIds;
    private final Long avgPrice;
    private final Long minPrice;
    private final Long maxPrice;
    /** Number of members with a recorded sale price. */
    private final int totalSales;
    private final BoundingBox bounds;

    public CellAggregate(double centerLat, double centerLng, int count, List<Long> propertyIds,
            Long avgPrice, Long minPrice, Long maxPrice, int totalSales, BoundingBox bounds) {
        this.centerLat = centerLat;
        this.centerLng = centerLng;
        this.count = count;
        this.propertyIds = List.copyOf(propertyIds);
        this.avgPrice = avgPrice;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.totalSales = totalSales;
        this.bounds = bounds;
    }
}
