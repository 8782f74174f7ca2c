package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.Cluster;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPoint;
import com.propertyprice.map.domain.model.PricePeriodComparison;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.propertyprice.map.module.test.support.TestFixtures.Locations.*;
import static com.propertyprice.map.module.test.support.TestFixtures.record;
import static com.propertyprice.map.module.test.support.TestFixtures.stack;
import static com.propertyprice.map.module.test.support.TestFixtures.unlocated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HeatmapPointAnalyzerTest {

    private final HeatmapPointAnalyzer analyzer = new HeatmapPointAnalyzer(new SpatialGridBinner());

    @Test
    void testSpatialPatterns_Density_UniformIntensity() {
        List<HeatmapPoint> points = analyzer.spatialPatterns(
                List.of(record(1, DUBLIN_LAT, DUBLIN_LNG, 250_000L), unlocated(2, 100L)), "density");

        assertThat(points).hasSize(1);
        assertThat(points.get(0).getIntensity()).isEqualTo(1.0);
    }

    @Test
    void testSpatialPatterns_Concentration_ScalesByPrice() {
        List<HeatmapPoint> points = analyzer.spatialPatterns(List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, 250_000L),
                record(2, GALWAY_LAT, GALWAY_LNG, 2_000_000L),
                record(3, LONGFORD_LAT, LONGFORD_LNG, null)), HeatmapPointAnalyzer.PATTERN_CONCENTRATION);

        assertThat(points).extracting(HeatmapPoint::getIntensity).containsExactly(0.25, 1.0, 0.5);
    }

    @Test
    void testHotspots_ScaledByBusiestCellAndMultiplier() {
        List<GeoRecord> records = new ArrayList<>(stack(1, 3, DUBLIN_LAT, DUBLIN_LNG, null));
        records.add(record(10, GALWAY_LAT, GALWAY_LNG, null));

        List<HeatmapPoint> points = analyzer.hotspots(records, 0.5);

        assertThat(points).hasSize(2);
        assertThat(points.get(0).getSalesCount()).isEqualTo(3);
        assertThat(points.get(0).getIntensity()).isCloseTo(0.5, within(1e-9));
        assertThat(points.get(1).getIntensity()).isCloseTo(0.5 / 3, within(1e-9));
    }

    @Test
    void testClusterDensity_SaturatesAtOneHundredMembers() {
        List<Cluster> clusters = List.of(
                Cluster.of(stack(1, 250, DUBLIN_LAT, DUBLIN_LNG, 300_000L)),
                Cluster.of(stack(1000, 50, GALWAY_LAT, GALWAY_LNG, null)));

        List<HeatmapPoint> points = analyzer.clusterDensity(clusters);

        assertThat(points).extracting(HeatmapPoint::getIntensity).containsExactly(1.0, 0.5);
        assertThat(points.get(0).getAvgPrice()).isEqualTo(300_000L);
        assertThat(points.get(1).getAvgPrice()).isNull();
    }

    @Test
    void testSalesHeatmap_RelativeToLargestCluster() {
        List<Cluster> clusters = List.of(
                Cluster.of(stack(1, 4, DUBLIN_LAT, DUBLIN_LNG, null)),
                Cluster.of(stack(100, 1, GALWAY_LAT, GALWAY_LNG, null)));

        List<HeatmapPoint> points = analyzer.salesHeatmap(clusters);

        assertThat(points).extracting(HeatmapPoint::getIntensity).containsExactly(1.0, 0.25);
    }

    @Test
    void testPriceHeatmap_RelativeToHighestAverage() {
        List<HeatmapPoint> points = analyzer.priceHeatmap(List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, 300_000L),
                record(2, DUBLIN_LAT, DUBLIN_LNG, 500_000L),
                record(3, GALWAY_LAT, GALWAY_LNG, 200_000L),
                record(4, LONGFORD_LAT, LONGFORD_LNG, null)));

        assertThat(points).hasSize(2);
        assertThat(points).extracting(HeatmapPoint::getIntensity).containsExactly(1.0, 0.5);
        assertThat(points).extracting(HeatmapPoint::getAvgPrice).containsExactly(400_000L, 200_000L);
    }

    @Test
    void testGrowthDecline_ChangeMappedAroundMidpoint() {
        List<GeoRecord> records = List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, null),
                record(2, DUBLIN_LAT, DUBLIN_LNG, null),
                record(3, GALWAY_LAT, GALWAY_LNG, null));
        PricePeriodComparison comparison = new PricePeriodComparison(
                Map.of(1L, 200_000L, 3L, 250_000L),
                Map.of(1L, 300_000L, 2L, 300_000L));

        List<HeatmapPoint> points = analyzer.growthDecline(records, comparison);

        assertThat(points).hasSize(1);
        HeatmapPoint point = points.get(0);
        assertThat(point.getChangePercent()).isEqualTo(50.0);
        assertThat(point.getIntensity()).isCloseTo(0.75, within(1e-9));
        assertThat(point.getEarlyAvgPrice()).isEqualTo(200_000L);
        assertThat(point.getLateAvgPrice()).isEqualTo(300_000L);
    }

    @Test
    void testGrowthDecline_Decline_BelowMidpoint() {
        PricePeriodComparison comparison = new PricePeriodComparison(
                Map.of(1L, 400_000L), Map.of(1L, 100_000L));

        List<HeatmapPoint> points = analyzer.growthDecline(List.of(record(1, DUBLIN_LAT, DUBLIN_LNG, null)), comparison);

        assertThat(points.get(0).getChangePercent()).isEqualTo(-75.0);
        assertThat(points.get(0).getIntensity()).isCloseTo(0.125, within(1e-9));
    }

    @Test
    void testGrowthDecline_NoComparison_ReturnsEmpty() {
        assertThat(analyzer.growthDecline(List.of(record(1, DUBLIN_LAT, DUBLIN_LNG, null)), null)).isEmpty();
    }

    @Test
    void testAnalyze_DispatchesOnMode() {
        List<GeoRecord> records = List.of(record(1, DUBLIN_LAT, DUBLIN_LNG, 100_000L));

        List<HeatmapPoint> points = analyzer.analyze(records, List.of(), AnalysisMode.HOTSPOTS, null, 1.0, null);

        assertThat(points).hasSize(1);
        assertThat(points.get(0).getIntensity()).isEqualTo(1.0);
    }
}
