package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CountyComparisonResponseDto {

    @JsonProperty("counties")
    private List<CountyStatisticsDto> counties;

    @JsonProperty("overallAverage")
    private double overallAverage;

    @JsonProperty("overallMedian")
    private double overallMedian;
}
