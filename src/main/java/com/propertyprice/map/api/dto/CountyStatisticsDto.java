package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CountyStatisticsDto {

    @JsonProperty("county")
    private String county;

    @JsonProperty("propertyCount")
    private int propertyCount;

    @JsonProperty("averagePrice")
    private double averagePrice;

    @JsonProperty("medianPrice")
    private double medianPrice;

    @JsonProperty("minPrice")
    private long minPrice;

    @JsonProperty("maxPrice")
    private long maxPrice;
}
