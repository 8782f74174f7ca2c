package com.propertyprice.map.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Price statistics of the sales in one trend period. The standard deviation is
 * the sample deviation and is 0 for a single sale.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PriceTrend {
    private final String period;
    private final double averagePrice;
    private final double medianPrice;
    private final double stdDeviation;
    private final long minPrice;
    private final long maxPrice;
    private final int count;
}
