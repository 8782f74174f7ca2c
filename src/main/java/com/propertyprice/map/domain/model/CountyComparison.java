package com.propertyprice.map.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Per-county price summaries, highest average first, with the mean and median
 * over every property counted.
 */
@Getter
@ToString
public class CountyComparison {
    private final List<CountySummary> counties;
    private final double overallAverage;
    private final double overallMedian;

    public CountyComparison(List<CountySummary> counties, double overallAverage, double overallMedian) {
        this.counties = List.copyOf(counties);
        this.overallAverage = overallAverage;
        this.overallMedian = overallMedian;
    }
}
