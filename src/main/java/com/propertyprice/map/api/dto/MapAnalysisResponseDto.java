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
public class MapAnalysisResponseDto {

    @JsonProperty("analysisMode")
    private String analysisMode;

    @JsonProperty("totalProperties")
    private int totalProperties;

    @JsonProperty("viewport")
    private ViewportDto viewport;

    @JsonProperty("heatmapData")
    private List<HeatmapPointDto> heatmapData;

    @JsonProperty("polygons")
    private List<HeatmapPolygonDto> polygons;

    @JsonProperty("clusters")
    private List<ClusterDto> clusters;

    @JsonProperty("points")
    private List<MapPointDto> points;

    @JsonProperty("truncated")
    private boolean truncated;
}
