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
public class PriceTrendPointDto {

    /** Period label: "2023-07", "2023Q3" or "2023". */
    @JsonProperty("date")
    private String date;

    @JsonProperty("averagePrice")
    private double averagePrice;

    @JsonProperty("medianPrice")
    private double medianPrice;

    @JsonProperty("stdDeviation")
    private double stdDeviation;

    @JsonProperty("minPrice")
    private long minPrice;

    @JsonProperty("maxPrice")
    private long maxPrice;

    @JsonProperty("count")
    private int count;
}
