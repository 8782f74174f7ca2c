package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Value object for one geo-tagged sale record, the unit of spatial aggregation.
 * Coordinates and price are optional; records without both coordinates, or with
 * a non-finite or out-of-range one, are skipped by every spatial component.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeoRecord {
    private final Long id;
    private final Double latitude;
    private final Double longitude;
    private final Long price;
    private final LocalDate saleDate;
    private final String label;
    private final String region;

    public GeoRecord(Long id, Double latitude, Double longitude, Long price,
            LocalDate saleDate, String label, String region) {
        if (id == null) {
            throw new IllegalArgumentException("Record id must not be null");
        }
        this.id = id;
        this.latitude = latitude;
        this.longitude = longitude;
        this.price = price;
        this.saleDate = saleDate;
        this.label = label;
        this.region = region;
    }

    public GeoRecord(Long id, Double latitude, Double longitude, Long price) {
        this(id, latitude, longitude, price, null, null, null);
    }

    public boolean hasCoordinates() {
        return isWithin(latitude, 90.0) && isWithin(longitude, 180.0);
    }

    public boolean hasPrice() {
        return price != null;
    }

    private static boolean isWithin(Double coordinate, double limit) {
        return coordinate != null && Double.isFinite(coordinate) && Math.abs(coordinate) <= limit;
    }
}
