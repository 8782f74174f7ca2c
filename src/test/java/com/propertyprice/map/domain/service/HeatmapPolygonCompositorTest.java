package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPolygonCell;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.propertyprice.map.module.test.support.TestFixtures.record;
import static com.propertyprice.map.module.test.support.TestFixtures.stack;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HeatmapPolygonCompositorTest {

    private static final BoundingBox UNIT_BOX = new BoundingBox(1.0, 0.0, 1.0, 0.0);

    private final HeatmapPolygonCompositor compositor = new HeatmapPolygonCompositor();

    @Test
    void testComputePolygons_IntensityRelativeToBusiestCell() {
        List<GeoRecord> records = new ArrayList<>(stack(1, 3, 0.25, 0.25, 100_000L));
        records.add(record(10, 0.75, 0.75, 200_000L));
        records.add(record(11, 1.0, 1.0, null));

        List<HeatmapPolygonCell> polygons = compositor.computePolygons(
                records, UNIT_BOX, AnalysisMode.PRICE_HEATMAP, 2);

        assertThat(polygons).hasSize(2);
        HeatmapPolygonCell busiest = polygons.get(0);
        assertThat(busiest.getRow()).isZero();
        assertThat(busiest.getCol()).isZero();
        assertThat(busiest.getSalesCount()).isEqualTo(3);
        assertThat(busiest.getIntensity()).isEqualTo(1.0);
        assertThat(busiest.getAvgPrice()).isEqualTo(100_000L);

        HeatmapPolygonCell corner = polygons.get(1);
        assertThat(corner.getRow()).isEqualTo(1);
        assertThat(corner.getCol()).isEqualTo(1);
        assertThat(corner.getSalesCount()).isEqualTo(2);
        assertThat(corner.getIntensity()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(corner.getAvgPrice()).isEqualTo(200_000L);
    }

    @Test
    void testComputePolygons_RecordsOutsideBoxIgnored() {
        List<GeoRecord> records = List.of(record(1, 0.5, 0.5, null), record(2, 2.0, 0.5, null),
                record(3, 0.5, -0.1, null));

        List<HeatmapPolygonCell> polygons = compositor.computePolygons(records, UNIT_BOX, null, 4);

        assertThat(polygons).hasSize(1);
        assertThat(polygons.get(0).getSalesCount()).isEqualTo(1);
    }

    @Test
    void testComputePolygons_SparseGrid_IntensitiesWithinUnitRange() {
        BoundingBox box = new BoundingBox(54.0, 53.0, -6.0, -7.0);
        List<GeoRecord> records = new ArrayList<>(stack(1, 100, 53.5, -6.5, null));
        records.add(record(500, 53.0, -7.0, null));

        List<HeatmapPolygonCell> polygons = compositor.computePolygons(records, box, null, 40);

        assertThat(polygons).hasSize(2);
        assertThat(polygons).allSatisfy(cell -> assertThat(cell.getIntensity()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0));
        assertThat(polygons).extracting(HeatmapPolygonCell::getIntensity).contains(1.0);
    }

    @Test
    void testComputePolygons_RingIsClosed() {
        List<HeatmapPolygonCell> polygons = compositor.computePolygons(
                List.of(record(1, 0.1, 0.1, null)), UNIT_BOX, null, 2);

        List<List<Double>> ring = polygons.get(0).ring();
        assertThat(ring).hasSize(5);
        assertThat(ring.get(0)).isEqualTo(ring.get(4));
        assertThat(ring.get(0)).containsExactly(0.0, 0.0);
        assertThat(ring.get(2)).containsExactly(0.5, 0.5);
    }

    @Test
    void testComputePolygons_EmptyInput_ReturnsEmpty() {
        assertThat(compositor.computePolygons(List.of(), UNIT_BOX, null, 40)).isEmpty();
    }

    @Test
    void testComputePolygons_NonPositiveGridCells_Throws() {
        assertThatThrownBy(() -> compositor.computePolygons(List.of(), UNIT_BOX, null, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testLocate_EdgesBelongToExpectedCells() {
        double[] edges = HeatmapPolygonCompositor.edges(0.0, 1.0, 4);

        assertThat(HeatmapPolygonCompositor.locate(edges, 0.0)).isZero();
        assertThat(HeatmapPolygonCompositor.locate(edges, 0.25)).isEqualTo(1);
        assertThat(HeatmapPolygonCompositor.locate(edges, 1.0)).isEqualTo(3);
        assertThat(HeatmapPolygonCompositor.locate(edges, -0.01)).isEqualTo(-1);
        assertThat(HeatmapPolygonCompositor.locate(edges, 1.01)).isEqualTo(-1);
    }
}
