package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object for a lat/lng rectangle in decimal degrees.
 * Boxes crossing the antimeridian are not supported.
 */
@Getter
@EqualsAndHashCode
@ToString
public class BoundingBox {
    private final double north;
    private final double south;
    private final double east;
    private final double west;

    public BoundingBox(double north, double south, double east, double west) {
        if (south < -90 || north > 90) {
            throw new IllegalArgumentException("Latitude bounds must be between -90 and 90");
        }
        if (west < -180 || east > 180) {
            throw new IllegalArgumentException("Longitude bounds must be between -180 and 180");
        }
        if (south > north) {
            throw new IllegalArgumentException("South bound must not exceed north bound");
        }
        if (west > east) {
            throw new IllegalArgumentException("West bound must not exceed east bound");
        }
        this.north = north;
        this.south = south;
        this.east = east;
        this.west = west;
    }

    public boolean contains(double latitude, double longitude) {
        return latitude >= south && latitude <= north
                && longitude >= west && longitude <= east;
    }

    public double latitudeSpan() {
        return north - south;
    }

    public double longitudeSpan() {
        return east - west;
    }
}
