package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Latest sale price of one property in a county.
 */
@Getter
@EqualsAndHashCode
@ToString
public class CountyPrice {
    private final String county;
    private final long price;

    public CountyPrice(String county, long price) {
        this.county = county;
        this.price = price;
    }
}
