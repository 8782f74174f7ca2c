package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.CellAggregate;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.policy.GridResolutionPolicy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Aggregates every record in view into grid cells with true counts and price
 * statistics. Unlike {@link GeographicClusterer}, the input is expected to be
 * the complete filtered set, so counts are exact.
 */
@Service
public class RealCountGridAggregator {

    private final SpatialGridBinner binner;

    public RealCountGridAggregator(SpatialGridBinner binner) {
        this.binner = binner;
    }

    public List<CellAggregate> aggregateAll(Collection<GeoRecord> records, int zoomLevel) {
        double cellSize = GridResolutionPolicy.realCountCellSize(zoomLevel);
        List<CellAggregate> cells = new ArrayList<>();
        for (List<GeoRecord> members : binner.bin(records, cellSize).values()) {
            cells.add(summarize(members));
        }
        return cells;
    }

    private CellAggregate summarize(List<GeoRecord> members) {
        double latSum = 0;
        double lngSum = 0;
        double minLat = Double.POSITIVE_INFINITY;
        double maxLat = Double.NEGATIVE_INFINITY;
        double minLng = Double.POSITIVE_INFINITY;
        double maxLng = Double.NEGATIVE_INFINITY;
        long priceSum = 0;
        int priced = 0;
        Long minPrice = null;
        Long maxPrice = null;
        List<Long> ids = new ArrayList<>(members.size());

        for (GeoRecord record : members) {
            double lat = record.getLatitude();
            double lng = record.getLongitude();
            latSum += lat;
            lngSum += lng;
            minLat = Math.min(minLat, lat);
            maxLat = Math.max(maxLat, lat);
            minLng = Math.min(minLng, lng);
            maxLng = Math.max(maxLng, lng);
            ids.add(record.getId());

            if (record.hasPrice()) {
                long price = record.getPrice();
                priceSum += price;
                priced++;
                minPrice = minPrice == null ? price : Math.min(minPrice, price);
                maxPrice = maxPrice == null ? price : Math.max(maxPrice, price);
            }
        }

        int count = members.size();
        Long avgPrice = priced > 0 ? Math.round((double) priceSum / priced) : null;
        return new CellAggregate(
                latSum / count,
                lngSum / count,
                count,
                ids,
                avgPrice,
                minPrice,
                maxPrice,
                priced,
                new BoundingBox(maxLat, minLat, maxLng, minLng));
    }
}
