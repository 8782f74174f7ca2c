package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Records sharing one grid cell, summarized by the mean of their coordinates
 * (not the cell midpoint) and the min/max extent of their coordinates.
 */
@Getter
@EqualsAndHashCode
@ToString
public class Cluster {
    private final double centerLat;
    private final double centerLng;
    private final int count;
    private final BoundingBox bounds;
    private final List<GeoRecord> members;
    private final PriceBucket priceBucket;

    private Cluster(double centerLat, double centerLng, BoundingBox bounds,
            List<GeoRecord> members, PriceBucket priceBucket) {
        this.centerLat = centerLat;
        this.centerLng = centerLng;
        this.count = members.size();
        this.bounds = bounds;
        this.members = members;
        this.priceBucket = priceBucket;
    }

    /**
     * Build a cluster from the members of one non-empty cell.
     *
     * @param members records with coordinates
     * @param priceBucket bucket the members were partitioned into, or null
     */
    public static Cluster of(List<GeoRecord> members, PriceBucket priceBucket) {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A cluster needs at least one member");
        }
        double latSum = 0;
        double lngSum = 0;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double minLng = Double.POSITIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        for (GeoRecord record : members) {
            double lat = record.getLatitude();
            double lng = record.getLongitude();
            latSum += lat;
            lngSum += lng;
            minLat = Math.min(minLat, lat);
            maxLat = Math.max(maxLat, lat);
            minLng = Math.min(minLng, lng);
            maxLng = Math.max(maxLng, lng);
        }
        int n = members.size();
        return new Cluster(latSum / n, lngSum / n,
                new BoundingBox(maxLat, minLat, maxLng, minLng),
                List.copyOf(members), priceBucket);
    }

    public static Cluster of(List<GeoRecord> members) {
        return of(members, null);
    }
}
