package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.CellAggregate;
import com.propertyprice.map.domain.model.GeoRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.propertyprice.map.module.test.support.TestFixtures.Locations.*;
import static com.propertyprice.map.module.test.support.TestFixtures.record;
import static com.propertyprice.map.module.test.support.TestFixtures.stack;
import static org.assertj.core.api.Assertions.assertThat;

class RealCountGridAggregatorTest {

    private final RealCountGridAggregator aggregator = new RealCountGridAggregator(new SpatialGridBinner());

    @Test
    void testAggregateAll_ReportsEveryRecordInCell() {
        List<GeoRecord> records = stack(1, 10_000, DUBLIN_LAT, DUBLIN_LNG, 250_000L);

        List<CellAggregate> cells = aggregator.aggregateAll(records, 6);

        assertThat(cells).hasSize(1);
        CellAggregate cell = cells.get(0);
        assertThat(cell.getCount()).isEqualTo(10_000);
        assertThat(cell.getPropertyIds()).hasSize(10_000);
        assertThat(cell.getTotalSales()).isEqualTo(10_000);
        assertThat(cell.getAvgPrice()).isEqualTo(250_000L);
    }

    @Test
    void testAggregateAll_PriceStatisticsOverPricedMembers() {
        List<GeoRecord> records = List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, 300_000L),
                record(2, DUBLIN_NEXT_DOOR_LAT, DUBLIN_NEXT_DOOR_LNG, 500_000L),
                record(3, DUBLIN_LAT, DUBLIN_LNG, null));

        List<CellAggregate> cells = aggregator.aggregateAll(records, 6);

        assertThat(cells).hasSize(1);
        CellAggregate cell = cells.get(0);
        assertThat(cell.getCount()).isEqualTo(3);
        assertThat(cell.getTotalSales()).isEqualTo(2);
        assertThat(cell.getAvgPrice()).isEqualTo(400_000L);
        assertThat(cell.getMinPrice()).isEqualTo(300_000L);
        assertThat(cell.getMaxPrice()).isEqualTo(500_000L);
        assertThat(cell.getPropertyIds()).containsExactlyInAnyOrder(1L, 2L, 3L);
    }

    @Test
    void testAggregateAll_NoPrices_LeavesStatisticsNull() {
        List<CellAggregate> cells = aggregator.aggregateAll(List.of(record(1, LONGFORD_LAT, LONGFORD_LNG, null)), 6);

        CellAggregate cell = cells.get(0);
        assertThat(cell.getAvgPrice()).isNull();
        assertThat(cell.getMinPrice()).isNull();
        assertThat(cell.getMaxPrice()).isNull();
        assertThat(cell.getTotalSales()).isZero();
    }

    @Test
    void testAggregateAll_AveragesRoundToNearestEuro() {
        List<GeoRecord> records = List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, 100_000L),
                record(2, DUBLIN_LAT, DUBLIN_LNG, 100_001L));

        CellAggregate cell = aggregator.aggregateAll(records, 12).get(0);

        assertThat(cell.getAvgPrice()).isEqualTo(100_001L);
    }

    @Test
    void testAggregateAll_CoarserGridAtLowZoom() {
        List<GeoRecord> records = List.of(
                record(1, 53.31, -6.21, null),
                record(2, 53.39, -6.29, null));

        assertThat(aggregator.aggregateAll(records, 3)).hasSize(1);
        assertThat(aggregator.aggregateAll(records, 12)).hasSize(2);
    }
}
