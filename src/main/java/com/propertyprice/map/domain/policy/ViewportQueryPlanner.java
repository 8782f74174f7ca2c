package com.propertyprice.map.domain.policy;

import com.propertyprice.map.domain.model.AggregationMode;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Decides, per zoom level and mode, how many records to fetch and which
 * aggregation answers a viewport request.
 *
 * Caps:
 * - interactive, zoom below the high-zoom threshold: fetch oversample x cap, then
 *   uniform random sample without replacement down to the cap
 * - interactive, high zoom: fetch by stable id order, truncate at the cap
 * - heatmap and analysis: one large cap, truncate
 * - real-count: no cap, the whole filtered set is read in id-ordered pages
 *
 * Every capped path fetches one row past the cap so truncation is detected
 * without a COUNT query.
 */
@Component
public class ViewportQueryPlanner {

    private final int interactiveSampleSize;
    private final int oversampleFactor;
    private final int highZoomThreshold;
    private final int highZoomLimit;
    private final int analysisLimit;
    private final int realCountMaxZoom;
    private final int realCountPageSize;
    private final Random random;

    @Autowired
    public ViewportQueryPlanner(
            @Value("${app.map.interactive-sample-size:500}") int interactiveSampleSize,
            @Value("${app.map.oversample-factor:3}") int oversampleFactor,
            @Value("${app.map.high-zoom-threshold:10}") int highZoomThreshold,
            @Value("${app.map.high-zoom-limit:5000}") int highZoomLimit,
            @Value("${app.map.analysis-limit:140000}") int analysisLimit,
            @Value("${app.map.real-count-max-zoom:7}") int realCountMaxZoom,
            @Value("${app.map.real-count-page-size:10000}") int realCountPageSize) {
        this(interactiveSampleSize, oversampleFactor, highZoomThreshold, highZoomLimit,
                analysisLimit, realCountMaxZoom, realCountPageSize, new Random());
    }

    public ViewportQueryPlanner(int interactiveSampleSize, int oversampleFactor, int highZoomThreshold,
            int highZoomLimit, int analysisLimit, int realCountMaxZoom, int realCountPageSize, Random random) {
        if (interactiveSampleSize <= 0 || highZoomLimit <= 0 || analysisLimit <= 0) {
            throw new IllegalArgumentException("Record caps must be positive");
        }
        if (realCountPageSize <= 0) {
            throw new IllegalArgumentException("Real-count page size must be positive");
        }
        if (oversampleFactor < 1) {
            throw new IllegalArgumentException("Oversample factor must be at least 1");
        }
        this.interactiveSampleSize = interactiveSampleSize;
        this.oversampleFactor = oversampleFactor;
        this.highZoomThreshold = highZoomThreshold;
        this.highZoomLimit = highZoomLimit;
        this.analysisLimit = analysisLimit;
        this.realCountMaxZoom = realCountMaxZoom;
        this.realCountPageSize = realCountPageSize;
        this.random = random;
    }

    /**
     * Plan a request for the given mode and zoom.
     * A geographic cluster request at or below the real-count zoom is routed to
     * real-count aggregation so wide-area overviews report true counts.
     */
    public FetchPlan plan(AggregationMode mode, int zoom, ClusterMode clusterMode) {
        AggregationMode route = mode;
        if (mode == AggregationMode.CLUSTERS
                && clusterMode == ClusterMode.GEOGRAPHIC
                && zoom <= realCountMaxZoom) {
            route = AggregationMode.REAL_COUNT;
        }

        switch (route) {
            case REAL_COUNT:
                return FetchPlan.completeScan(route, realCountPageSize);
            case HEATMAP:
            case ANALYSIS:
                return new FetchPlan(route, analysisLimit + 1, analysisLimit, false);
            default:
                if (zoom >= highZoomThreshold) {
                    return new FetchPlan(route, highZoomLimit + 1, highZoomLimit, false);
                }
                int fetchLimit = Math.max(interactiveSampleSize * oversampleFactor, interactiveSampleSize + 1);
                return new FetchPlan(route, fetchLimit, interactiveSampleSize, true);
        }
    }

    /**
     * Cut fetched records down to the plan's cap.
     * Sampling draws uniformly without replacement so no id range is favoured.
     */
    public CappedRecords applyCap(List<GeoRecord> fetched, FetchPlan plan) {
        int fetchedCount = fetched.size();
        if (plan.isComplete() || fetchedCount <= plan.getCap()) {
            return new CappedRecords(fetched, fetchedCount, false, false);
        }
        if (!plan.isSampling()) {
            return new CappedRecords(fetched.subList(0, plan.getCap()), fetchedCount, true, false);
        }
        return new CappedRecords(sample(fetched, plan.getCap()), fetchedCount, true, true);
    }

    // Partial Fisher-Yates shuffle over a copy
    private List<GeoRecord> sample(List<GeoRecord> records, int size) {
        List<GeoRecord> pool = new ArrayList<>(records);
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(pool.size() - i);
            GeoRecord picked = pool.get(j);
            pool.set(j, pool.get(i));
            pool.set(i, picked);
        }
        return new ArrayList<>(pool.subList(0, size));
    }
}
