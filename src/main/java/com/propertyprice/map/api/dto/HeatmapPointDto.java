package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapPointDto {

    @JsonProperty("lat")
    private double lat;

    @JsonProperty("lng")
    private double lng;

    @JsonProperty("intensity")
    private double intensity;

    @JsonProperty("data")
    private DataDto data;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class DataDto {
        @JsonProperty("intensity")
        private Double intensity;

        @JsonProperty("salesCount")
        private Integer salesCount;

        @JsonProperty("avgPrice")
        private Long avgPrice;

        @JsonProperty("changePercent")
        private Double changePercent;

        @JsonProperty("earlyAvg")
        private Long earlyAvg;

        @JsonProperty("lateAvg")
        private Long lateAvg;
    }
}
