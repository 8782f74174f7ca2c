package com.propertyprice.map.api.dto;

import com.propertyprice.map.domain.model.TrendPeriod;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * Grouping period and sale filters for price trends. Dates and prices bound
 * each sale.
 */
@Getter
@Setter
@NoArgsConstructor
public class PriceTrendsRequestDto {

    private TrendPeriod period = TrendPeriod.MONTHLY;

    private String county;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate startDate;

    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate endDate;

    @PositiveOrZero(message = "Minimum price must not be negative")
    private Long minPrice;

    @PositiveOrZero(message = "Maximum price must not be negative")
    private Long maxPrice;

    private Boolean hasGeocoding;
}
