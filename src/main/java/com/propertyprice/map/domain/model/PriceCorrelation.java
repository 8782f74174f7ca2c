package com.propertyprice.map.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Pearson correlation of sale price against another variable, with its
 * two-sided p-value and a verbal strength.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class PriceCorrelation {
    public static final String INSUFFICIENT_DATA = "Insufficient data";
    public static final String INSUFFICIENT_VALID_DATA = "Insufficient valid data";

    private final double coefficient;
    private final double pValue;
    private final int sampleSize;
    private final String interpretation;
}
