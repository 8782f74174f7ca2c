package com.propertyprice.map.api.controller;

import com.propertyprice.map.api.dto.CorrelationResponseDto;
import com.propertyprice.map.api.dto.CountyComparisonResponseDto;
import com.propertyprice.map.api.dto.DateRangeDto;
import com.propertyprice.map.api.dto.PriceTrendsRequestDto;
import com.propertyprice.map.api.dto.PriceTrendsResponseDto;
import com.propertyprice.map.application.port.in.QueryStatisticsUseCase;
import com.propertyprice.map.domain.model.CorrelationVariable;
import com.propertyprice.map.domain.model.RecordFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * Controller for sale price statistics.
 */
@RestController
@RequestMapping("/api/statistics")
@Validated
public class StatisticsController {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsController.class);

    private final QueryStatisticsUseCase queryStatisticsUseCase;

    public StatisticsController(QueryStatisticsUseCase queryStatisticsUseCase) {
        this.queryStatisticsUseCase = queryStatisticsUseCase;
    }

    /**
     * GET /api/statistics/price-trends?period=quarterly&county=Dublin
     *
     * Average, median, sample deviation and range of sale prices per calendar
     * period, oldest first.
     */
    @GetMapping("/price-trends")
    public ResponseEntity<PriceTrendsResponseDto> getPriceTrends(@Valid @ModelAttribute PriceTrendsRequestDto request) {
        logger.info("Price trends request: period={}, county={}", request.getPeriod(), request.getCounty());

        RecordFilter filter = RecordFilter.builder()
                .county(request.getCounty())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .minPrice(request.getMinPrice())
                .maxPrice(request.getMaxPrice())
                .hasGeocoding(request.getHasGeocoding())
                .build();
        return ResponseEntity.ok(queryStatisticsUseCase.getPriceTrends(filter, request.getPeriod()));
    }

    /**
     * GET /api/statistics/county
     *
     * Latest-price statistics per county, highest average first.
     */
    @GetMapping("/county")
    public ResponseEntity<CountyComparisonResponseDto> getCountyComparison() {
        logger.info("County comparison request");
        return ResponseEntity.ok(queryStatisticsUseCase.getCountyComparison());
    }

    /**
     * GET /api/statistics/correlation?variable=size
     */
    @GetMapping("/correlation")
    public ResponseEntity<CorrelationResponseDto> getCorrelation(
            @RequestParam(value = "variable", defaultValue = "size") CorrelationVariable variable) {
        logger.info("Correlation request: variable={}", variable);
        return ResponseEntity.ok(queryStatisticsUseCase.getCorrelation(variable));
    }

    /**
     * GET /api/statistics/date-range
     */
    @GetMapping("/date-range")
    public ResponseEntity<DateRangeDto> getDateRange() {
        return ResponseEntity.ok(queryStatisticsUseCase.getSaleDateRange());
    }
}
