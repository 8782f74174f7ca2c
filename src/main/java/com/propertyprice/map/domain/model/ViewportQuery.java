package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A map viewport request snapshot: visible box, zoom level and record filters.
 */
@Getter
@EqualsAndHashCode
@ToString
public class ViewportQuery {
    private final RecordFilter filter;
    private final int zoom;

    public ViewportQuery(RecordFilter filter, int zoom) {
        if (filter == null || filter.getBoundingBox() == null) {
            throw new IllegalArgumentException("A viewport query needs a bounding box");
        }
        if (zoom < 0) {
            throw new IllegalArgumentException("Zoom level must not be negative");
        }
        this.filter = filter;
        this.zoom = zoom;
    }

    public BoundingBox getBoundingBox() {
        return filter.getBoundingBox();
    }

    public String toKey() {
        return zoom + "|" + filter.toKey();
    }
}
