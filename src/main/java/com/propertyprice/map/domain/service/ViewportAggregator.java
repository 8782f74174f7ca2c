package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AggregationRequest;
import com.propertyprice.map.domain.model.Cluster;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPoint;
import com.propertyprice.map.domain.model.HeatmapPolygonCell;
import com.propertyprice.map.domain.model.ViewportAggregation;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Single entry point that runs one aggregation mode over an already fetched,
 * already capped record set. Pure and stateless.
 */
@Service
public class ViewportAggregator {

    /** Zoom at which the cluster-based analysis modes group records. */
    public static final int ANALYSIS_CLUSTER_ZOOM = 10;

    private final GeographicClusterer clusterer;
    private final RealCountGridAggregator realCountAggregator;
    private final HeatmapPolygonCompositor polygonCompositor;
    private final HeatmapPointAnalyzer pointAnalyzer;

    public ViewportAggregator(
            GeographicClusterer clusterer,
            RealCountGridAggregator realCountAggregator,
            HeatmapPolygonCompositor polygonCompositor,
            HeatmapPointAnalyzer pointAnalyzer) {
        this.clusterer = clusterer;
        this.realCountAggregator = realCountAggregator;
        this.polygonCompositor = polygonCompositor;
        this.pointAnalyzer = pointAnalyzer;
    }

    public ViewportAggregation aggregate(List<GeoRecord> records, AggregationRequest request) {
        if (request.getMode() == null) {
            throw new IllegalArgumentException("Aggregation mode must not be null");
        }
        switch (request.getMode()) {
            case POINTS:
                return ViewportAggregation.ofPoints(
                        records.stream().filter(GeoRecord::hasCoordinates).toList());
            case CLUSTERS:
                return ViewportAggregation.ofClusters(
                        clusterer.cluster(records, request.getZoom(), request.getClusterMode()));
            case REAL_COUNT:
                return ViewportAggregation.ofCells(
                        realCountAggregator.aggregateAll(records, request.getZoom()));
            case HEATMAP:
                return ViewportAggregation.ofPolygons(polygonCompositor.computePolygons(
                        records, request.getBoundingBox(), request.getAnalysisMode(), request.getGridCells()));
            case ANALYSIS:
                return analyze(records, request);
            default:
                throw new IllegalArgumentException("Unsupported aggregation mode: " + request.getMode());
        }
    }

    private ViewportAggregation analyze(List<GeoRecord> records, AggregationRequest request) {
        if (request.getAnalysisMode() == null) {
            throw new IllegalArgumentException("Analysis mode must not be null");
        }
        List<HeatmapPolygonCell> polygons = polygonCompositor.computePolygons(
                records, request.getBoundingBox(), request.getAnalysisMode(), request.getGridCells());

        List<Cluster> clusters = switch (request.getAnalysisMode()) {
            case CLUSTER_IDENTIFICATION, SALES_HEATMAP ->
                    clusterer.cluster(records, ANALYSIS_CLUSTER_ZOOM, ClusterMode.GEOGRAPHIC);
            default -> List.of();
        };

        List<HeatmapPoint> heatmapPoints = pointAnalyzer.analyze(records, clusters, request.getAnalysisMode(),
                request.getPatternType(), request.getHotspotIntensity(), request.getPeriodComparison());

        List<GeoRecord> located = records.stream().filter(GeoRecord::hasCoordinates).toList();
        return ViewportAggregation.ofAnalysis(located, clusters, polygons, heatmapPoints);
    }
}
