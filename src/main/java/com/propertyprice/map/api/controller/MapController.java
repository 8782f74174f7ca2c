package com.propertyprice.map.api.controller;

import com.propertyprice.map.api.dto.HeatmapResponseDto;
import com.propertyprice.map.api.dto.MapAnalysisResponseDto;
import com.propertyprice.map.api.dto.MapClustersResponseDto;
import com.propertyprice.map.api.dto.MapPointsResponseDto;
import com.propertyprice.map.api.dto.ViewportRequestDto;
import com.propertyprice.map.application.port.in.QueryMapUseCase;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.ViewportQuery;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.Callable;

/**
 * Controller for map viewport endpoints.
 * Every endpoint takes the viewport (north/south/east/west/zoom) plus record filters.
 *
 * Parameters are validated on the request thread; aggregation runs as an async
 * {@link Callable} on the MVC task executor. When the request times out
 * (spring.mvc.async.request-timeout) Spring cancels the worker with an interrupt
 * and the query service abandons the aggregation.
 */
@RestController
@RequestMapping("/api/map")
@Validated
public class MapController {

    private static final Logger logger = LoggerFactory.getLogger(MapController.class);

    private final QueryMapUseCase queryMapUseCase;

    public MapController(QueryMapUseCase queryMapUseCase) {
        this.queryMapUseCase = queryMapUseCase;
    }

    /**
     * GET /api/map/points
     *
     * Individual sale points in the viewport, capped per zoom level.
     */
    @GetMapping("/points")
    public Callable<ResponseEntity<MapPointsResponseDto>> getPoints(@Valid @ModelAttribute ViewportRequestDto viewport) {
        logger.info("Querying map points: bounds=[{}, {}, {}, {}], zoom={}",
                viewport.getNorth(), viewport.getSouth(), viewport.getEast(), viewport.getWest(), viewport.getZoom());

        ViewportQuery query = toQuery(viewport);
        return () -> ResponseEntity.ok(queryMapUseCase.getPoints(query));
    }

    /**
     * GET /api/map/clusters?mode=geographic|price|size
     *
     * Clustered points. Geographic clustering at low zoom returns real-count cells.
     */
    @GetMapping("/clusters")
    public Callable<ResponseEntity<MapClustersResponseDto>> getClusters(
            @Valid @ModelAttribute ViewportRequestDto viewport,
            @RequestParam(name = "mode", defaultValue = "geographic") ClusterMode mode) {
        logger.info("Querying map clusters: bounds=[{}, {}, {}, {}], zoom={}, mode={}",
                viewport.getNorth(), viewport.getSouth(), viewport.getEast(), viewport.getWest(),
                viewport.getZoom(), mode.getValue());

        ViewportQuery query = toQuery(viewport);
        return () -> ResponseEntity.ok(queryMapUseCase.getClusters(query, mode));
    }

    /**
     * GET /api/map/overview
     *
     * Real-count grid cells with exact counts and price statistics.
     */
    @GetMapping("/overview")
    public Callable<ResponseEntity<MapClustersResponseDto>> getOverview(@Valid @ModelAttribute ViewportRequestDto viewport) {
        logger.info("Querying map overview: bounds=[{}, {}, {}, {}], zoom={}",
                viewport.getNorth(), viewport.getSouth(), viewport.getEast(), viewport.getWest(), viewport.getZoom());

        ViewportQuery query = toQuery(viewport);
        return () -> ResponseEntity.ok(queryMapUseCase.getOverview(query));
    }

    /**
     * GET /api/map/heatmap?gridCells=40
     */
    @GetMapping("/heatmap")
    public Callable<ResponseEntity<HeatmapResponseDto>> getHeatmap(
            @Valid @ModelAttribute ViewportRequestDto viewport,
            @RequestParam(name = "gridCells", defaultValue = "40") @Min(1) @Max(200) int gridCells) {
        logger.info("Querying heatmap: bounds=[{}, {}, {}, {}], gridCells={}",
                viewport.getNorth(), viewport.getSouth(), viewport.getEast(), viewport.getWest(), gridCells);

        ViewportQuery query = toQuery(viewport);
        return () -> ResponseEntity.ok(queryMapUseCase.getHeatmap(query, gridCells));
    }

    /**
     * GET /api/map/analysis?analysisMode=hotspots
     *
     * Heatmap polygons plus a mode-specific intensity overlay.
     *
     * @param patternType spatial-patterns only: "density" (default) or "concentration"
     * @param intensity hotspots only: multiplier for hotspot intensities
     */
    @GetMapping("/analysis")
    public Callable<ResponseEntity<MapAnalysisResponseDto>> getAnalysis(
            @Valid @ModelAttribute ViewportRequestDto viewport,
            @RequestParam(name = "analysisMode") AnalysisMode analysisMode,
            @RequestParam(name = "patternType", required = false) String patternType,
            @RequestParam(name = "intensity", required = false) @DecimalMin("0.0") @DecimalMax("1.0") Double intensity,
            @RequestParam(name = "gridCells", defaultValue = "40") @Min(1) @Max(200) int gridCells) {
        logger.info("Querying map analysis: mode={}, bounds=[{}, {}, {}, {}]",
                analysisMode.getValue(), viewport.getNorth(), viewport.getSouth(), viewport.getEast(),
                viewport.getWest());

        ViewportQuery query = toQuery(viewport);
        return () -> ResponseEntity.ok(queryMapUseCase.getAnalysis(
                query, analysisMode, patternType, intensity, gridCells));
    }

    private ViewportQuery toQuery(ViewportRequestDto viewport) {
        BoundingBox box = new BoundingBox(
                viewport.getNorth(), viewport.getSouth(), viewport.getEast(), viewport.getWest());
        RecordFilter filter = RecordFilter.builder()
                .boundingBox(box)
                .county(viewport.getCounty())
                .startDate(viewport.getStartDate())
                .endDate(viewport.getEndDate())
                .minPrice(viewport.getMinPrice())
                .maxPrice(viewport.getMaxPrice())
                .build();
        int zoom = viewport.getZoom() != null ? viewport.getZoom() : 10;
        return new ViewportQuery(filter, zoom);
    }
}
