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
public class ViewportDto {

    @JsonProperty("north")
    private double north;

    @JsonProperty("south")
    private double south;

    @JsonProperty("east")
    private double east;

    @JsonProperty("west")
    private double west;

    @JsonProperty("zoom")
    private Integer zoom;
}
