package com.propertyprice.map.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of one aggregation call. Lists not produced by the mode are empty.
 */
@Getter
@ToString
public class ViewportAggregation {
    private final AggregationMode mode;
    private final List<GeoRecord> points;
    private final List<Cluster> clusters;
    private final List<CellAggregate> cells;
    private final List<HeatmapPolygonCell> polygons;
    private final List<HeatmapPoint> heatmapPoints;

    public ViewportAggregation(AggregationMode mode, List<GeoRecord> points, List<Cluster> clusters,
            List<CellAggregate> cells, List<HeatmapPolygonCell> polygons, List<HeatmapPoint> heatmapPoints) {
        this.mode = mode;
        this.points = List.copyOf(points);
        this.clusters = List.copyOf(clusters);
        this.cells = List.copyOf(cells);
        this.polygons = List.copyOf(polygons);
        this.heatmapPoints = List.copyOf(heatmapPoints);
    }

    public static ViewportAggregation ofPoints(List<GeoRecord> points) {
        return new ViewportAggregation(AggregationMode.POINTS, points, List.of(), List.of(), List.of(), List.of());
    }

    public static ViewportAggregation ofClusters(List<Cluster> clusters) {
        return new ViewportAggregation(AggregationMode.CLUSTERS, List.of(), clusters, List.of(), List.of(), List.of());
    }

    public static ViewportAggregation ofCells(List<CellAggregate> cells) {
        return new ViewportAggregation(AggregationMode.REAL_COUNT, List.of(), List.of(), cells, List.of(), List.of());
    }

    public static ViewportAggregation ofPolygons(List<HeatmapPolygonCell> polygons) {
        return new ViewportAggregation(AggregationMode.HEATMAP, List.of(), List.of(), List.of(), polygons, List.of());
    }

    public static ViewportAggregation ofAnalysis(List<GeoRecord> points, List<Cluster> clusters,
            List<HeatmapPolygonCell> polygons, List<HeatmapPoint> heatmapPoints) {
        return new ViewportAggregation(AggregationMode.ANALYSIS, points, clusters, List.of(), polygons, heatmapPoints);
    }
}
