package com.propertyprice.map.domain.policy;

import com.propertyprice.map.domain.model.AggregationMode;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.propertyprice.map.module.test.support.TestFixtures.stack;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewportQueryPlannerTest {

    private final ViewportQueryPlanner planner = new ViewportQueryPlanner(500, 3, 10, 5000, 140_000, 7, 10_000, new Random(42));

    @Test
    void testPlan_LowZoomPoints_OversamplesAndSamples() {
        FetchPlan plan = planner.plan(AggregationMode.POINTS, 8, ClusterMode.GEOGRAPHIC);

        assertThat(plan.getRoute()).isEqualTo(AggregationMode.POINTS);
        assertThat(plan.getFetchLimit()).isEqualTo(1500);
        assertThat(plan.getCap()).isEqualTo(500);
        assertThat(plan.isSampling()).isTrue();
    }

    @Test
    void testPlan_HighZoomClusters_Truncates() {
        FetchPlan plan = planner.plan(AggregationMode.CLUSTERS, 12, ClusterMode.GEOGRAPHIC);

        assertThat(plan.getRoute()).isEqualTo(AggregationMode.CLUSTERS);
        assertThat(plan.getFetchLimit()).isEqualTo(5001);
        assertThat(plan.getCap()).isEqualTo(5000);
        assertThat(plan.isSampling()).isFalse();
    }

    @Test
    void testPlan_LowZoomGeographicClusters_RoutesToRealCount() {
        FetchPlan plan = planner.plan(AggregationMode.CLUSTERS, 6, ClusterMode.GEOGRAPHIC);

        assertThat(plan.getRoute()).isEqualTo(AggregationMode.REAL_COUNT);
        assertThat(plan.isComplete()).isTrue();
        assertThat(plan.isSampling()).isFalse();
        assertThat(plan.getFetchLimit()).isEqualTo(10_000);
    }

    @Test
    void testApplyCap_RealCountPlan_NeverTruncates() {
        FetchPlan plan = planner.plan(AggregationMode.CLUSTERS, 5, ClusterMode.GEOGRAPHIC);
        List<GeoRecord> fetched = stack(1, 140_001, 53.35, -6.26, null);

        CappedRecords capped = planner.applyCap(fetched, plan);

        assertThat(capped.getRecords()).hasSize(140_001);
        assertThat(capped.isTruncated()).isFalse();
        assertThat(capped.isSampled()).isFalse();
    }

    @Test
    void testPlan_LowZoomPriceClusters_StaysInteractive() {
        FetchPlan plan = planner.plan(AggregationMode.CLUSTERS, 6, ClusterMode.PRICE);

        assertThat(plan.getRoute()).isEqualTo(AggregationMode.CLUSTERS);
        assertThat(plan.isSampling()).isTrue();
    }

    @Test
    void testPlan_HeatmapAndAnalysis_UseLargeCapButRealCountDoesNot() {
        assertThat(planner.plan(AggregationMode.HEATMAP, 3, ClusterMode.GEOGRAPHIC).getCap()).isEqualTo(140_000);
        assertThat(planner.plan(AggregationMode.ANALYSIS, 15, ClusterMode.GEOGRAPHIC).getCap()).isEqualTo(140_000);
        assertThat(planner.plan(AggregationMode.HEATMAP, 3, ClusterMode.GEOGRAPHIC).isComplete()).isFalse();
        assertThat(planner.plan(AggregationMode.REAL_COUNT, 15, ClusterMode.GEOGRAPHIC).isComplete()).isTrue();
    }

    @Test
    void testApplyCap_UnderCap_KeepsEverything() {
        List<GeoRecord> fetched = stack(1, 20, 53.35, -6.26, null);

        CappedRecords capped = planner.applyCap(fetched, planner.plan(AggregationMode.POINTS, 5, ClusterMode.GEOGRAPHIC));

        assertThat(capped.getRecords()).containsExactlyElementsOf(fetched);
        assertThat(capped.isTruncated()).isFalse();
        assertThat(capped.isSampled()).isFalse();
    }

    @Test
    void testApplyCap_Sampling_DrawsDistinctRecords() {
        List<GeoRecord> fetched = stack(1, 1500, 53.35, -6.26, null);

        CappedRecords capped = planner.applyCap(fetched, planner.plan(AggregationMode.POINTS, 5, ClusterMode.GEOGRAPHIC));

        assertThat(capped.getRecords()).hasSize(500).doesNotHaveDuplicates();
        assertThat(fetched).containsAll(capped.getRecords());
        assertThat(capped.getFetchedCount()).isEqualTo(1500);
        assertThat(capped.isTruncated()).isTrue();
        assertThat(capped.isSampled()).isTrue();
    }

    @Test
    void testApplyCap_Sampling_NotBiasedToLowIds() {
        List<GeoRecord> fetched = stack(1, 1500, 53.35, -6.26, null);

        CappedRecords capped = planner.applyCap(fetched, planner.plan(AggregationMode.POINTS, 5, ClusterMode.GEOGRAPHIC));

        assertThat(capped.getRecords()).anySatisfy(record -> assertThat(record.getId()).isGreaterThan(1000L));
    }

    @Test
    void testApplyCap_Truncation_KeepsIdOrderPrefix() {
        List<GeoRecord> fetched = stack(1, 5001, 53.35, -6.26, null);

        CappedRecords capped = planner.applyCap(fetched, planner.plan(AggregationMode.POINTS, 14, ClusterMode.GEOGRAPHIC));

        assertThat(capped.getRecords()).containsExactlyElementsOf(fetched.subList(0, 5000));
        assertThat(capped.isTruncated()).isTrue();
        assertThat(capped.isSampled()).isFalse();
    }

    @Test
    void testCompleteScan_NonPositivePageSize_Throws() {
        assertThatThrownBy(() -> FetchPlan.completeScan(AggregationMode.REAL_COUNT, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testConstructor_NonPositiveCap_Throws() {
        assertThatThrownBy(() -> new ViewportQueryPlanner(0, 3, 10, 5000, 140_000, 7, 10_000, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
