package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DateRangeDto {

    @JsonProperty("minYear")
    private int minYear;

    @JsonProperty("maxYear")
    private int maxYear;

    @JsonProperty("minDate")
    private LocalDate minDate;

    @JsonProperty("maxDate")
    private LocalDate maxDate;
}
