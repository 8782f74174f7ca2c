package com.propertyprice.map.application.service;

import com.propertyprice.map.api.dto.ClusterDto;
import com.propertyprice.map.api.dto.HeatmapResponseDto;
import com.propertyprice.map.api.dto.MapAnalysisResponseDto;
import com.propertyprice.map.api.dto.MapClustersResponseDto;
import com.propertyprice.map.api.dto.MapPointsResponseDto;
import com.propertyprice.map.application.mapper.MapResponseMapper;
import com.propertyprice.map.application.port.in.QueryMapUseCase;
import com.propertyprice.map.application.port.out.GeoRecordSource;
import com.propertyprice.map.application.port.out.ResponseStateStore;
import com.propertyprice.map.domain.model.AggregationMode;
import com.propertyprice.map.domain.model.AggregationRequest;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.PricePeriodComparison;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.ViewportAggregation;
import com.propertyprice.map.domain.model.ViewportQuery;
import com.propertyprice.map.domain.policy.CappedRecords;
import com.propertyprice.map.domain.policy.FetchPlan;
import com.propertyprice.map.domain.policy.ViewportQueryPlanner;
import com.propertyprice.map.domain.service.ViewportAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Application service for map viewport queries.
 * Strategy: state store → plan → fetch → cap → aggregate → populate state store
 */
@Service
public class MapQueryService implements QueryMapUseCase {

    private static final Logger logger = LoggerFactory.getLogger(MapQueryService.class);

    /** Shortest date window growth/decline analysis will split in two. */
    static final long MIN_GROWTH_WINDOW_DAYS = 30;

    private final GeoRecordSource geoRecordSource;
    private final ViewportQueryPlanner planner;
    private final ViewportAggregator aggregator;
    private final ResponseCache responseCache;
    private final MapResponseMapper mapper;
    private final int analysisPointLimit;
    private final int priceLookupBatchSize;

    public MapQueryService(
            GeoRecordSource geoRecordSource,
            ViewportQueryPlanner planner,
            ViewportAggregator aggregator,
            ResponseStateStore stateStore,
            MapResponseMapper mapper,
            @Value("${app.cache.ttl-seconds:300}") long responseTtlSeconds,
            @Value("${app.map.analysis-point-limit:1000}") int analysisPointLimit,
            @Value("${app.map.price-lookup-batch-size:10000}") int priceLookupBatchSize) {
        this.geoRecordSource = geoRecordSource;
        this.planner = planner;
        this.aggregator = aggregator;
        this.responseCache = new ResponseCache(stateStore, Duration.ofSeconds(responseTtlSeconds));
        this.mapper = mapper;
        this.analysisPointLimit = analysisPointLimit;
        this.priceLookupBatchSize = priceLookupBatchSize;
    }

    @Override
    @Transactional(readOnly = true)
    public MapPointsResponseDto getPoints(ViewportQuery query) {
        String key = "map:points:" + query.toKey();
        return cached(key, MapPointsResponseDto.class, () -> {
            AggregationOutcome outcome = aggregate(query, AggregationRequest.builder()
                    .mode(AggregationMode.POINTS)
                    .build());
            return new MapPointsResponseDto(
                    outcome.aggregation.getPoints().stream().map(mapper::toPointDto).toList(),
                    outcome.capped.getRecords().size(),
                    mapper.toViewportDto(query),
                    outcome.capped.isTruncated(),
                    outcome.capped.isSampled());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public MapClustersResponseDto getClusters(ViewportQuery query, ClusterMode mode) {
        String key = "map:clusters:" + mode.getValue() + ":" + query.toKey();
        return cached(key, MapClustersResponseDto.class, () -> toClustersResponse(query, mode,
                aggregate(query, AggregationRequest.builder()
                        .mode(AggregationMode.CLUSTERS)
                        .clusterMode(mode)
                        .build())));
    }

    @Override
    @Transactional(readOnly = true)
    public MapClustersResponseDto getOverview(ViewportQuery query) {
        String key = "map:overview:" + query.toKey();
        return cached(key, MapClustersResponseDto.class, () -> toClustersResponse(query, ClusterMode.GEOGRAPHIC,
                aggregate(query, AggregationRequest.builder()
                        .mode(AggregationMode.REAL_COUNT)
                        .build())));
    }

    @Override
    @Transactional(readOnly = true)
    public HeatmapResponseDto getHeatmap(ViewportQuery query, int gridCells) {
        String key = "map:heatmap:" + gridCells + ":" + query.toKey();
        return cached(key, HeatmapResponseDto.class, () -> {
            AggregationOutcome outcome = aggregate(query, AggregationRequest.builder()
                    .mode(AggregationMode.HEATMAP)
                    .gridCells(gridCells)
                    .build());
            return new HeatmapResponseDto(
                    outcome.aggregation.getPolygons().stream().map(mapper::toPolygonDto).toList(),
                    gridCells,
                    outcome.capped.getRecords().size(),
                    mapper.toViewportDto(query),
                    outcome.capped.isTruncated());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public MapAnalysisResponseDto getAnalysis(ViewportQuery query, AnalysisMode analysisMode,
            String patternType, Double hotspotIntensity, int gridCells) {
        double intensity = hotspotIntensity != null ? hotspotIntensity : AggregationRequest.DEFAULT_HOTSPOT_INTENSITY;
        String key = "map:analysis:" + analysisMode.getValue() + ":" + patternType + ":" + intensity
                + ":" + gridCells + ":" + query.toKey();
        return cached(key, MapAnalysisResponseDto.class, () -> {
            AggregationOutcome outcome = aggregate(query, AggregationRequest.builder()
                    .mode(AggregationMode.ANALYSIS)
                    .analysisMode(analysisMode)
                    .patternType(patternType)
                    .hotspotIntensity(intensity)
                    .gridCells(gridCells)
                    .build());
            ViewportAggregation aggregation = outcome.aggregation;
            return new MapAnalysisResponseDto(
                    analysisMode.getValue(),
                    outcome.capped.getRecords().size(),
                    mapper.toViewportDto(query),
                    aggregation.getHeatmapPoints().stream().map(mapper::toHeatmapPointDto).toList(),
                    aggregation.getPolygons().stream().map(mapper::toPolygonDto).toList(),
                    aggregation.getClusters().stream().map(mapper::toClusterDto).toList(),
                    aggregation.getPoints().stream().limit(analysisPointLimit).map(mapper::toPointDto).toList(),
                    outcome.capped.isTruncated());
        });
    }

    /**
     * Fetch, cap and aggregate records for one viewport.
     * The plan may reroute the requested mode (low-zoom geographic clusters become real-count cells).
     */
    AggregationOutcome aggregate(ViewportQuery query, AggregationRequest request) {
        FetchPlan plan = planner.plan(request.getMode(), query.getZoom(), request.getClusterMode());
        RecordFilter filter = query.getFilter().toBuilder().hasGeocoding(Boolean.TRUE).build();

        List<GeoRecord> fetched = plan.isComplete()
                ? fetchEveryRecord(filter, plan.getFetchLimit())
                : geoRecordSource.findRecords(filter, plan.getFetchLimit());
        ensureNotCancelled();

        CappedRecords capped = planner.applyCap(fetched, plan);
        if (capped.isTruncated()) {
            logger.info("Viewport result capped: route={}, fetched={}, kept={}, sampled={}",
                    plan.getRoute(), capped.getFetchedCount(), capped.getRecords().size(), capped.isSampled());
        }

        AggregationRequest.AggregationRequestBuilder routed = request.toBuilder()
                .mode(plan.getRoute())
                .boundingBox(query.getBoundingBox())
                .zoom(query.getZoom());
        if (plan.getRoute() == AggregationMode.ANALYSIS && request.getAnalysisMode() == AnalysisMode.GROWTH_DECLINE) {
            routed.periodComparison(comparePeriods(capped.getRecords(), filter));
        }
        ensureNotCancelled();

        ViewportAggregation aggregation = aggregator.aggregate(capped.getRecords(), routed.build());
        ensureNotCancelled();

        logger.debug("Aggregated {} records with route {}", capped.getRecords().size(), plan.getRoute());
        return new AggregationOutcome(aggregation, capped);
    }

    /**
     * Read the whole filtered set in id-ordered keyset pages, checking for
     * cancellation between pages.
     */
    List<GeoRecord> fetchEveryRecord(RecordFilter filter, int pageSize) {
        List<GeoRecord> records = new ArrayList<>();
        long afterId = 0;
        int pages = 0;
        while (true) {
            List<GeoRecord> page = geoRecordSource.findRecordsAfter(filter, afterId, pageSize);
            records.addAll(page);
            pages++;
            if (page.size() < pageSize) {
                break;
            }
            ensureNotCancelled();
            afterId = page.get(page.size() - 1).getId();
        }
        logger.info("Read {} records in {} pages for real-count aggregation", records.size(), pages);
        return records;
    }

    /**
     * Split the filter's date window at its midpoint and look up each record's
     * latest price in both halves. Returns null when the window is open or too short.
     */
    PricePeriodComparison comparePeriods(List<GeoRecord> records, RecordFilter filter) {
        LocalDate start = filter.getStartDate();
        LocalDate end = filter.getEndDate();
        if (start == null || end == null) {
            return null;
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (days < MIN_GROWTH_WINDOW_DAYS) {
            logger.debug("Date window of {} days too short for growth/decline", days);
            return null;
        }
        LocalDate mid = start.plusDays(days / 2);
        List<Long> ids = records.stream().map(GeoRecord::getId).toList();
        return new PricePeriodComparison(
                latestPrices(ids, start, mid),
                latestPrices(ids, mid, end.plusDays(1)));
    }

    private Map<Long, Long> latestPrices(List<Long> ids, LocalDate startInclusive, LocalDate endExclusive) {
        Map<Long, Long> prices = new HashMap<>();
        for (int from = 0; from < ids.size(); from += priceLookupBatchSize) {
            List<Long> batch = ids.subList(from, Math.min(ids.size(), from + priceLookupBatchSize));
            prices.putAll(geoRecordSource.findLatestPrices(batch, startInclusive, endExclusive));
            ensureNotCancelled();
        }
        return prices;
    }

    private MapClustersResponseDto toClustersResponse(ViewportQuery query, ClusterMode mode,
            AggregationOutcome outcome) {
        ViewportAggregation aggregation = outcome.aggregation;
        boolean realCount = aggregation.getMode() == AggregationMode.REAL_COUNT;
        List<ClusterDto> clusters = realCount
                ? aggregation.getCells().stream().map(mapper::toClusterDto).toList()
                : aggregation.getClusters().stream().map(mapper::toClusterDto).toList();
        return new MapClustersResponseDto(
                clusters,
                outcome.capped.getRecords().size(),
                mapper.toViewportDto(query),
                realCount ? "real-count" : "clusters",
                mode.getValue(),
                outcome.capped.isTruncated(),
                outcome.capped.isSampled());
    }

    private static void ensureNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new AggregationCancelledException("Map request cancelled");
        }
    }

    private <T> T cached(String key, Class<T> type, Supplier<T> compute) {
        return responseCache.getOrCompute(key, type, compute);
    }

    static final class AggregationOutcome {
        final ViewportAggregation aggregation;
        final CappedRecords capped;

        AggregationOutcome(ViewportAggregation aggregation, CappedRecords capped) {
            this.aggregation = aggregation;
            this.capped = capped;
        }
    }

    /**
     * Exception thrown when the worker thread is interrupted mid-aggregation.
     */
    public static class AggregationCancelledException extends RuntimeException {
        public AggregationCancelledException(String message) {
            super(message);
        }
    }
}
