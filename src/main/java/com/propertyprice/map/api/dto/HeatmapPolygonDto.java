package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * GeoJSON-style polygon: a single closed ring of [lng, lat] points plus cell metadata.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class HeatmapPolygonDto {

    @JsonProperty("coordinates")
    private List<List<List<Double>>> coordinates;

    @JsonProperty("metadata")
    private MetadataDto metadata;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class MetadataDto {
        @JsonProperty("intensity")
        private double intensity;

        @JsonProperty("salesCount")
        private int salesCount;

        @JsonProperty("avgPrice")
        private Long avgPrice;
    }
}
