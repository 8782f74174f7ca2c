package com.propertyprice.map.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Latest sale price per record id in an early and a late period, used by
 * growth/decline analysis.
 */
@Getter
@ToString
public class PricePeriodComparison {
    private final Map<Long, Long> earlyPrices;
    private final Map<Long, Long> latePrices;

    public PricePeriodComparison(Map<Long, Long> earlyPrices, Map<Long, Long> latePrices) {
        this.earlyPrices = Map.copyOf(earlyPrices);
        this.latePrices = Map.copyOf(latePrices);
    }
}
