package com.propertyprice.map.application.port.in;

import com.propertyprice.map.api.dto.HeatmapResponseDto;
import com.propertyprice.map.api.dto.MapAnalysisResponseDto;
import com.propertyprice.map.api.dto.MapClustersResponseDto;
import com.propertyprice.map.api.dto.MapPointsResponseDto;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.ViewportQuery;

/**
 * Input port for map viewport queries.
 * Every operation fetches a capped record set for the viewport and aggregates it.
 */
public interface QueryMapUseCase {

  MapPointsResponseDto getPoints(ViewportQuery query);

  /**
   * Clusters for the viewport. Geographic requests at low zoom are answered
   * with real-count cells.
   */
  MapClustersResponseDto getClusters(ViewportQuery query, ClusterMode mode);

  /**
   * Real-count cells over every record in view, regardless of zoom.
   */
  MapClustersResponseDto getOverview(ViewportQuery query);

  HeatmapResponseDto getHeatmap(ViewportQuery query, int gridCells);

  MapAnalysisResponseDto getAnalysis(ViewportQuery query, AnalysisMode analysisMode,
      String patternType, Double hotspotIntensity, int gridCells);
}
