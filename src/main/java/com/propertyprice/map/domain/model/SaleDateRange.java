package com.propertyprice.map.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Earliest and latest recorded sale dates, both inclusive.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SaleDateRange {
    private final LocalDate minDate;
    private final LocalDate maxDate;
}
