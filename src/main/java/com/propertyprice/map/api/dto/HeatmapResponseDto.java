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
public class HeatmapResponseDto {

    @JsonProperty("polygons")
    private List<HeatmapPolygonDto> polygons;

    @JsonProperty("gridCells")
    private int gridCells;

    @JsonProperty("totalProperties")
    private int totalProperties;

    @JsonProperty("viewport")
    private ViewportDto viewport;

    @JsonProperty("truncated")
    private boolean truncated;
}
