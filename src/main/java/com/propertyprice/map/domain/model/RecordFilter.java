package com.propertyprice.map.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Filters applied by the record store before any aggregation.
 * Every field is optional; a null bounding box means "anywhere".
 * Dates are inclusive.
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
@ToString
public class RecordFilter {
    private final BoundingBox boundingBox;
    private final String county;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final Long minPrice;
    private final Long maxPrice;
    private final Boolean hasGeocoding;

    public boolean hasDateWindow() {
        return startDate != null || endDate != null;
    }

    public boolean hasPriceBounds() {
        return minPrice != null || maxPrice != null;
    }

    /**
     * Stable textual form used in response cache keys.
     */
    public String toKey() {
        String box = boundingBox == null ? "-"
                : boundingBox.getNorth() + "," + boundingBox.getSouth() + ","
                        + boundingBox.getEast() + "," + boundingBox.getWest();
        return box + "|" + county + "|" + startDate + "|" + endDate + "|"
                + minPrice + "|" + maxPrice + "|" + hasGeocoding;
    }
}
