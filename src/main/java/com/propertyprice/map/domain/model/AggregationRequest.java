package com.propertyprice.map.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameters of one aggregation call. Fields that do not apply to the chosen
 * mode are ignored.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class AggregationRequest {

    public static final int DEFAULT_GRID_CELLS = 40;
    public static final double DEFAULT_HOTSPOT_INTENSITY = 0.5;

    private final AggregationMode mode;
    private final BoundingBox boundingBox;
    private final int zoom;
    @Builder.Default
    private final ClusterMode clusterMode = ClusterMode.GEOGRAPHIC;
    @Builder.Default
    private final int gridCells = DEFAULT_GRID_CELLS;
    private final AnalysisMode analysisMode;
    private final String patternType;
    @Builder.Default
    private final double hotspotIntensity = DEFAULT_HOTSPOT_INTENSITY;
    private final PricePeriodComparison periodComparison;
}
