package com.propertyprice.map.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * Paging and filter parameters for the property list. The bounding box is
 * optional but must be given completely when used.
 */
@Getter
@Setter
@NoArgsConstructor
public class PropertyListRequestDto {

    @Min(value = 1, message = "Page must be at least 1")
    private int page = 1;

    @Min(value = 1, message = "Page size must be between 1 and 1000")
    @Max(value = 1000, message = "Page size must be between 1 and 1000")
    private int pageSize = 50;

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

    private Double north;
    private Double south;
    private Double east;
    private Double west;
}
