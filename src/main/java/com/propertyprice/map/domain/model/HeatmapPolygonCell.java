package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One non-empty cell of the viewport-anchored heatmap grid.
 */
@Getter
@EqualsAndHashCode
@ToString
public class HeatmapPolygonCell {
    private final int row;
    private final int col;
    private final double south;
    private final double north;
    private final double west;
    private final double east;
    private final double intensity;
    private final int salesCount;
    private final Long avgPrice;

    public HeatmapPolygonCell(int row, int col, double south, double north, double west, double east,
            double intensity, int salesCount, Long avgPrice) {
        this.row = row;
        this.col = col;
        this.south = south;
        this.north = north;
        this.west = west;
        this.east = east;
        this.intensity = intensity;
        this.salesCount = salesCount;
        this.avgPrice = avgPrice;
    }

    /**
     * Closed ring of five [lng, lat] points, counter-clockwise from the south-west corner.
     */
    public List<List<Double>> ring() {
        return List.of(
                List.of(west, south),
                List.of(east, south),
                List.of(east, north),
                List.of(west, north),
                List.of(west, south));
    }
}
