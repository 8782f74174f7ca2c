package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * A map cluster. Interactive clusters carry their member points; real-count
 * cells carry member ids and price statistics instead.
 */
@Getter
@Setter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClusterDto {

    @JsonProperty("centerLat")
    private double centerLat;

    @JsonProperty("centerLng")
    private double centerLng;

    @JsonProperty("count")
    private int count;

    @JsonProperty("bounds")
    private BoundsDto bounds;

    @JsonProperty("properties")
    private List<MapPointDto> properties;

    @JsonProperty("priceBucket")
    private String priceBucket;

    @JsonProperty("propertyIds")
    private List<Long> propertyIds;

    @JsonProperty("avgPrice")
    private Long avgPrice;

    @JsonProperty("minPrice")
    private Long minPrice;

    @JsonProperty("maxPrice")
    private Long maxPrice;

    @JsonProperty("totalSales")
    private Integer totalSales;
}
