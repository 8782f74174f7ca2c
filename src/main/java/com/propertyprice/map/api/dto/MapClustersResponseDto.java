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
public class MapClustersResponseDto {

    @JsonProperty("clusters")
    private List<ClusterDto> clusters;

    @JsonProperty("totalProperties")
    private int totalProperties;

    @JsonProperty("viewport")
    private ViewportDto viewport;

    /** "clusters" or "real-count". */
    @JsonProperty("aggregation")
    private String aggregation;

    @JsonProperty("clusterMode")
    private String clusterMode;

    @JsonProperty("truncated")
    private boolean truncated;

    @JsonProperty("sampled")
    private boolean sampled;
}
