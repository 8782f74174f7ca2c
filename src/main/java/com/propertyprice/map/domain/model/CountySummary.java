package com.propertyprice.map.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class CountySummary {
    private final String county;
    private final int propertyCount;
    private final double averagePrice;
    private final double medianPrice;
    private final long minPrice;
    private final long maxPrice;
}
