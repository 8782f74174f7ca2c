package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * One recorded sale as seen by the statistics: date, price in whole euro and
 * the free-text size description, which may be null.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SaleObservation {
    private final LocalDate dateOfSale;
    private final long price;
    private final String description;

    public SaleObservation(LocalDate dateOfSale, long price, String description) {
        this.dateOfSale = dateOfSale;
        this.price = price;
        this.description = description;
    }
}
