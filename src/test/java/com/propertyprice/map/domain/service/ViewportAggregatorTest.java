package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AggregationMode;
import com.propertyprice.map.domain.model.AggregationRequest;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.ViewportAggregation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.propertyprice.map.module.test.support.TestFixtures.Locations.*;
import static com.propertyprice.map.module.test.support.TestFixtures.record;
import static com.propertyprice.map.module.test.support.TestFixtures.unlocated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewportAggregatorTest {

    private final ViewportAggregator aggregator = newAggregator();

    private final List<GeoRecord> records = List.of(
            record(1, DUBLIN_LAT, DUBLIN_LNG, 300_000L),
            record(2, DUBLIN_NEXT_DOOR_LAT, DUBLIN_NEXT_DOOR_LNG, 500_000L),
            record(3, LONGFORD_LAT, LONGFORD_LNG, null),
            unlocated(4, 250_000L));

    private static ViewportAggregator newAggregator() {
        SpatialGridBinner binner = new SpatialGridBinner();
        return new ViewportAggregator(
                new GeographicClusterer(binner),
                new RealCountGridAggregator(binner),
                new HeatmapPolygonCompositor(),
                new HeatmapPointAnalyzer(binner));
    }

    @Test
    void testAggregate_Points_DropsUnlocatedRecords() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.POINTS)
                .build());

        assertThat(result.getMode()).isEqualTo(AggregationMode.POINTS);
        assertThat(result.getPoints()).extracting(GeoRecord::getId).containsExactly(1L, 2L, 3L);
        assertThat(result.getClusters()).isEmpty();
    }

    @Test
    void testAggregate_Clusters_GroupsByZoom() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.CLUSTERS)
                .zoom(12)
                .build());

        assertThat(result.getClusters()).hasSize(2);
    }

    @Test
    void testAggregate_RealCount_ReturnsCells() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.REAL_COUNT)
                .zoom(6)
                .build());

        assertThat(result.getCells()).hasSize(2);
        assertThat(result.getCells().stream().mapToInt(cell -> cell.getCount()).sum()).isEqualTo(3);
    }

    @Test
    void testAggregate_Heatmap_UsesRequestedGrid() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.HEATMAP)
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .gridCells(10)
                .build());

        assertThat(result.getPolygons()).hasSize(2);
    }

    @Test
    void testAggregate_ClusterIdentification_IncludesClustersAndOverlay() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.ANALYSIS)
                .analysisMode(AnalysisMode.CLUSTER_IDENTIFICATION)
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .build());

        assertThat(result.getMode()).isEqualTo(AggregationMode.ANALYSIS);
        assertThat(result.getClusters()).hasSize(2);
        assertThat(result.getHeatmapPoints()).hasSize(2);
        assertThat(result.getPolygons()).isNotEmpty();
        assertThat(result.getPoints()).hasSize(3);
    }

    @Test
    void testAggregate_Hotspots_HasNoClusters() {
        ViewportAggregation result = aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.ANALYSIS)
                .analysisMode(AnalysisMode.HOTSPOTS)
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .build());

        assertThat(result.getClusters()).isEmpty();
        assertThat(result.getHeatmapPoints()).isNotEmpty();
    }

    @Test
    void testAggregate_AnalysisWithoutMode_Throws() {
        assertThatThrownBy(() -> aggregator.aggregate(records, AggregationRequest.builder()
                .mode(AggregationMode.ANALYSIS)
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .build()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
