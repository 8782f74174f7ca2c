package com.propertyprice.map.application.service;

import com.propertyprice.map.api.dto.ClusterDto;
import com.propertyprice.map.api.dto.HeatmapResponseDto;
import com.propertyprice.map.api.dto.MapAnalysisResponseDto;
import com.propertyprice.map.api.dto.MapClustersResponseDto;
import com.propertyprice.map.api.dto.MapPointDto;
import com.propertyprice.map.api.dto.MapPointsResponseDto;
import com.propertyprice.map.application.mapper.MapResponseMapper;
import com.propertyprice.map.application.port.out.GeoRecordSource;
import com.propertyprice.map.application.port.out.ResponseStateStore;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.ViewportQuery;
import com.propertyprice.map.domain.policy.ViewportQueryPlanner;
import com.propertyprice.map.domain.service.GeographicClusterer;
import com.propertyprice.map.domain.service.HeatmapPointAnalyzer;
import com.propertyprice.map.domain.service.HeatmapPolygonCompositor;
import com.propertyprice.map.domain.service.RealCountGridAggregator;
import com.propertyprice.map.domain.service.SpatialGridBinner;
import com.propertyprice.map.domain.service.ViewportAggregator;
import com.propertyprice.map.infrastructure.cache.InMemoryResponseStateStore;
import com.propertyprice.map.module.test.support.FakeGeoRecordSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.propertyprice.map.module.test.support.TestFixtures.Locations.*;
import static com.propertyprice.map.module.test.support.TestFixtures.record;
import static com.propertyprice.map.module.test.support.TestFixtures.stack;
import static com.propertyprice.map.module.test.support.TestFixtures.viewport;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MapQueryServiceTest {

    private FakeGeoRecordSource source;
    private InMemoryResponseStateStore stateStore;
    private MapQueryService service;

    @BeforeEach
    void setUp() {
        source = new FakeGeoRecordSource().withRecords(List.of(
                record(1, DUBLIN_LAT, DUBLIN_LNG, 300_000L),
                record(2, DUBLIN_NEXT_DOOR_LAT, DUBLIN_NEXT_DOOR_LNG, 500_000L),
                record(3, LONGFORD_LAT, LONGFORD_LNG, null)));
        stateStore = new InMemoryResponseStateStore(Clock.systemUTC());
        service = newService(source, stateStore, new ViewportQueryPlanner(500, 3, 10, 5000, 140_000, 7, 2, new Random(7)));
    }

    private static MapQueryService newService(GeoRecordSource source, ResponseStateStore store,
            ViewportQueryPlanner planner) {
        SpatialGridBinner binner = new SpatialGridBinner();
        ViewportAggregator aggregator = new ViewportAggregator(
                new GeographicClusterer(binner),
                new RealCountGridAggregator(binner),
                new HeatmapPolygonCompositor(),
                new HeatmapPointAnalyzer(binner));
        return new MapQueryService(source, planner, aggregator, store, new MapResponseMapper(), 300, 1000, 2);
    }

    @Test
    void testGetClusters_HighZoom_ReturnsInteractiveClusters() {
        MapClustersResponseDto response = service.getClusters(viewport(MIDLANDS_AND_DUBLIN, 12), ClusterMode.GEOGRAPHIC);

        assertThat(response.getAggregation()).isEqualTo("clusters");
        assertThat(response.getClusters()).hasSize(2);
        assertThat(response.getTotalProperties()).isEqualTo(3);
        assertThat(response.isTruncated()).isFalse();
        assertThat(source.getLastLimit()).isEqualTo(5001);
    }

    @Test
    void testGetClusters_LowZoomGeographic_ReturnsRealCountCells() {
        MapClustersResponseDto response = service.getClusters(viewport(MIDLANDS_AND_DUBLIN, 6), ClusterMode.GEOGRAPHIC);

        assertThat(response.getAggregation()).isEqualTo("real-count");
        ClusterDto dublin = response.getClusters().stream()
                .filter(cluster -> cluster.getCount() == 2)
                .findFirst()
                .orElseThrow();
        assertThat(dublin.getAvgPrice()).isEqualTo(400_000L);
        assertThat(dublin.getPropertyIds()).containsExactlyInAnyOrder(1L, 2L);
        assertThat(dublin.getProperties()).isNull();
        assertThat(source.getFindCalls()).isEqualTo(2);
        assertThat(source.getLastAfterId()).isEqualTo(2L);
        assertThat(source.getLastLimit()).isEqualTo(2);
    }

    @Test
    void testGetOverview_MoreRecordsThanAnalysisCap_CountsEveryRecord() {
        FakeGeoRecordSource crowded = new FakeGeoRecordSource().withRecords(stack(1, 7, DUBLIN_LAT, DUBLIN_LNG, 250_000L));
        MapQueryService overview = newService(crowded, stateStore,
                new ViewportQueryPlanner(500, 3, 10, 5000, 3, 7, 2, new Random(11)));

        MapClustersResponseDto response = overview.getOverview(viewport(MIDLANDS_AND_DUBLIN, 5));

        assertThat(response.getClusters()).hasSize(1);
        assertThat(response.getClusters().get(0).getCount()).isEqualTo(7);
        assertThat(response.getTotalProperties()).isEqualTo(7);
        assertThat(response.isTruncated()).isFalse();
        assertThat(response.isSampled()).isFalse();
        assertThat(crowded.getFindCalls()).isEqualTo(4);
    }

    @Test
    void testGetOverview_ExactMultipleOfPageSize_StopsOnEmptyPage() {
        FakeGeoRecordSource even = new FakeGeoRecordSource().withRecords(stack(1, 4, DUBLIN_LAT, DUBLIN_LNG, null));
        MapQueryService overview = newService(even, stateStore,
                new ViewportQueryPlanner(500, 3, 10, 5000, 140_000, 7, 2, new Random(13)));

        MapClustersResponseDto response = overview.getOverview(viewport(MIDLANDS_AND_DUBLIN, 5));

        assertThat(response.getTotalProperties()).isEqualTo(4);
        assertThat(even.getFindCalls()).isEqualTo(3);
        assertThat(even.getLastAfterId()).isEqualTo(4L);
    }

    @Test
    void testAggregate_ForcesGeocodedRecords() {
        service.getPoints(viewport(MIDLANDS_AND_DUBLIN, 12));

        RecordFilter filter = source.getLastFilter();
        assertThat(filter.getHasGeocoding()).isTrue();
        assertThat(filter.getBoundingBox()).isEqualTo(MIDLANDS_AND_DUBLIN);
    }

    @Test
    void testGetPoints_SecondCall_ServedFromStateStore() {
        ViewportQuery query = viewport(MIDLANDS_AND_DUBLIN, 12);

        MapPointsResponseDto first = service.getPoints(query);
        MapPointsResponseDto second = service.getPoints(query);

        assertThat(source.getFindCalls()).isEqualTo(1);
        assertThat(second).isSameAs(first);
    }

    @Test
    void testGetPoints_OverCap_ReportsSampling() {
        FakeGeoRecordSource busy = new FakeGeoRecordSource().withRecords(stack(1, 30, DUBLIN_LAT, DUBLIN_LNG, null));
        MapQueryService capped = newService(busy, stateStore, new ViewportQueryPlanner(10, 3, 10, 20, 100, 7, 10_000, new Random(1)));

        MapPointsResponseDto response = capped.getPoints(viewport(MIDLANDS_AND_DUBLIN, 8));

        assertThat(response.getPoints()).hasSize(10);
        assertThat(response.isTruncated()).isTrue();
        assertThat(response.isSampled()).isTrue();
        assertThat(busy.getLastLimit()).isEqualTo(30);
    }

    @Test
    void testGetHeatmap_ReturnsClosedPolygons() {
        HeatmapResponseDto response = service.getHeatmap(viewport(MIDLANDS_AND_DUBLIN, 8), 10);

        assertThat(response.getGridCells()).isEqualTo(10);
        assertThat(response.getPolygons()).hasSize(2);
        assertThat(response.getPolygons()).allSatisfy(polygon -> {
            List<List<Double>> ring = polygon.getCoordinates().get(0);
            assertThat(ring).hasSize(5);
            assertThat(ring.get(0)).isEqualTo(ring.get(4));
        });
    }

    @Test
    void testGetAnalysis_GrowthDecline_SplitsDateWindow() {
        LocalDate start = LocalDate.of(2023, 1, 1);
        LocalDate end = LocalDate.of(2023, 12, 31);
        LocalDate mid = start.plusDays(182);
        source.withLatestPrices(start, Map.of(1L, 200_000L, 2L, 400_000L))
                .withLatestPrices(mid, Map.of(1L, 300_000L, 2L, 500_000L));
        RecordFilter filter = RecordFilter.builder()
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .startDate(start)
                .endDate(end)
                .build();

        MapAnalysisResponseDto response = service.getAnalysis(
                new ViewportQuery(filter, 10), AnalysisMode.GROWTH_DECLINE, null, null, 40);

        assertThat(source.getPriceWindows()).hasSize(4);
        assertThat(source.getPriceWindows().get(0)).containsExactly(start, mid);
        assertThat(source.getPriceWindows().get(source.getPriceWindows().size() - 1))
                .containsExactly(mid, end.plusDays(1));
        assertThat(response.getHeatmapData()).hasSize(1);
        assertThat(response.getHeatmapData().get(0).getData().getChangePercent()).isEqualTo(33.33);
        assertThat(response.getHeatmapData().get(0).getData().getEarlyAvg()).isEqualTo(300_000L);
    }

    @Test
    void testGetAnalysis_GrowthDecline_ShortWindowSkipsLookup() {
        RecordFilter filter = RecordFilter.builder()
                .boundingBox(MIDLANDS_AND_DUBLIN)
                .startDate(LocalDate.of(2023, 1, 1))
                .endDate(LocalDate.of(2023, 1, 15))
                .build();

        MapAnalysisResponseDto response = service.getAnalysis(
                new ViewportQuery(filter, 10), AnalysisMode.GROWTH_DECLINE, null, null, 40);

        assertThat(source.getPriceWindows()).isEmpty();
        assertThat(response.getHeatmapData()).isEmpty();
        assertThat(response.getPolygons()).isNotEmpty();
    }

    @Test
    void testGetAnalysis_ClusterIdentification_IncludesClusters() {
        MapAnalysisResponseDto response = service.getAnalysis(
                viewport(MIDLANDS_AND_DUBLIN, 8), AnalysisMode.CLUSTER_IDENTIFICATION, null, null, 40);

        assertThat(response.getAnalysisMode()).isEqualTo("cluster-identification");
        assertThat(response.getClusters()).hasSize(2);
        assertThat(response.getPoints()).hasSize(3);
    }

    @Test
    void testGetOverview_InterruptedThread_Cancels() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> service.getOverview(viewport(MIDLANDS_AND_DUBLIN, 6)))
                    .isInstanceOf(MapQueryService.AggregationCancelledException.class);
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void testGetOverview_WorkerCancelled_StopsPagingAndStoresNothing() throws Exception {
        PagesUntilInterrupted blocking = new PagesUntilInterrupted();
        MapQueryService slow = newService(blocking, stateStore,
                new ViewportQueryPlanner(500, 3, 10, 5000, 140_000, 7, 2, new Random(5)));
        ViewportQuery query = viewport(MIDLANDS_AND_DUBLIN, 6);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        ExecutorService worker = Executors.newSingleThreadExecutor();

        Future<?> overview = worker.submit(() -> {
            try {
                slow.getOverview(query);
            } catch (RuntimeException e) {
                failure.set(e);
            }
        });
        assertThat(blocking.firstPageStarted.await(5, TimeUnit.SECONDS)).isTrue();
        overview.cancel(true);
        worker.shutdown();

        assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(failure.get()).isInstanceOf(MapQueryService.AggregationCancelledException.class);
        assertThat(blocking.pagesRead.get()).isEqualTo(1);
        assertThat(stateStore.get("map:overview:" + query.toKey(), MapClustersResponseDto.class)).isEmpty();
    }

    @Test
    void testGetPoints_StateStoreDown_StillAnswers() {
        ResponseStateStore broken = new ResponseStateStore() {
            @Override
            public void put(String key, Object value, Duration ttl) {
                throw new IllegalStateException("Redis unavailable");
            }

            @Override
            public <T> Optional<T> get(String key, Class<T> type) {
                throw new IllegalStateException("Redis unavailable");
            }
        };
        MapQueryService uncached = newService(source, broken,
                new ViewportQueryPlanner(500, 3, 10, 5000, 140_000, 7, 2, new Random(3)));

        MapPointsResponseDto response = uncached.getPoints(viewport(MIDLANDS_AND_DUBLIN, 12));

        assertThat(response.getPoints()).extracting(MapPointDto::getId).containsExactly(1L, 2L, 3L);
    }

    /**
     * Serves full pages, each one only after the reading thread is interrupted.
     */
    private static final class PagesUntilInterrupted implements GeoRecordSource {
        private final CountDownLatch firstPageStarted = new CountDownLatch(1);
        private final CountDownLatch never = new CountDownLatch(1);
        private final AtomicInteger pagesRead = new AtomicInteger();

        @Override
        public List<GeoRecord> findRecords(RecordFilter filter, int offset, int limit) {
            throw new UnsupportedOperationException("Real-count reads use keyset pages");
        }

        @Override
        public List<GeoRecord> findRecordsAfter(RecordFilter filter, long afterId, int limit) {
            pagesRead.incrementAndGet();
            firstPageStarted.countDown();
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return stack(afterId + 1, limit, DUBLIN_LAT, DUBLIN_LNG, null);
        }

        @Override
        public Map<Long, Long> findLatestPrices(Collection<Long> recordIds, LocalDate startInclusive,
                LocalDate endExclusive) {
            return Map.of();
        }
    }
}
