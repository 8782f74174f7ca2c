package com.propertyprice.map.domain.policy;

import com.propertyprice.map.domain.model.AggregationMode;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * How many rows to fetch for one viewport request, how to cut them down and
 * which aggregation answers it.
 */
@Getter
@EqualsAndHashCode
@ToString
public class FetchPlan {
    private final AggregationMode route;
    /**
     * Maximum rows requested from the store; greater than {@link #cap} for a capped
     * plan, the page size for a complete plan.
     */
    private final int fetchLimit;
    /** Maximum rows handed to aggregation. Unbounded for a complete plan. */
    private final int cap;
    /** Whether an over-cap result is reduced by uniform random sampling rather than truncation. */
    private final boolean sampling;
    /** Whether every matching row is read, page by page, and none is dropped. */
    private final boolean complete;

    public FetchPlan(AggregationMode route, int fetchLimit, int cap, boolean sampling) {
        if (cap <= 0 || fetchLimit <= cap) {
            throw new IllegalArgumentException("Fetch limit must exceed a positive cap");
        }
        this.route = route;
        this.fetchLimit = fetchLimit;
        this.cap = cap;
        this.sampling = sampling;
        this.complete = false;
    }

    private FetchPlan(AggregationMode route, int pageSize) {
        this.route = route;
        this.fetchLimit = pageSize;
        this.cap = Integer.MAX_VALUE;
        this.sampling = false;
        this.complete = true;
    }

    /**
     * A plan that reads the whole filtered set in pages of the given size.
     */
    public static FetchPlan completeScan(AggregationMode route, int pageSize) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        return new FetchPlan(route, pageSize);
    }
}
