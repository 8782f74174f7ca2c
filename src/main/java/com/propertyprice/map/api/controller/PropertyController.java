package com.propertyprice.map.api.controller;

import com.propertyprice.map.api.dto.PriceHistoryDto;
import com.propertyprice.map.api.dto.PropertyDetailDto;
import com.propertyprice.map.api.dto.PropertyListRequestDto;
import com.propertyprice.map.api.dto.PropertyListResponseDto;
import com.propertyprice.map.application.port.in.QueryPropertiesUseCase;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.RecordFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for property listing and detail.
 */
@RestController
@RequestMapping("/api/properties")
@Validated
public class PropertyController {

    private static final Logger logger = LoggerFactory.getLogger(PropertyController.class);

    private final QueryPropertiesUseCase queryPropertiesUseCase;

    public PropertyController(QueryPropertiesUseCase queryPropertiesUseCase) {
        this.queryPropertiesUseCase = queryPropertiesUseCase;
    }

    /**
     * GET /api/properties?page=1&pageSize=50
     *
     * One page of properties with their latest sale. "total" is only present
     * when the whole result fits on the first page.
     */
    @GetMapping
    public ResponseEntity<PropertyListResponseDto> listProperties(@Valid @ModelAttribute PropertyListRequestDto request) {
        logger.info("Listing properties: page={}, pageSize={}, county={}",
                request.getPage(), request.getPageSize(), request.getCounty());

        RecordFilter filter = RecordFilter.builder()
                .boundingBox(toBoundingBox(request))
                .county(request.getCounty())
                .startDate(request.getStartDate())
                .endDate(request.getEndDate())
                .minPrice(request.getMinPrice())
                .maxPrice(request.getMaxPrice())
                .hasGeocoding(request.getHasGeocoding())
                .build();
        return ResponseEntity.ok(queryPropertiesUseCase.listProperties(filter, request.getPage(), request.getPageSize()));
    }

    /**
     * GET /api/properties/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<PropertyDetailDto> getProperty(@PathVariable("id") Long id) {
        logger.info("Fetching property: id={}", id);
        return ResponseEntity.ok(queryPropertiesUseCase.getProperty(id));
    }

    /**
     * GET /api/properties/{id}/history
     *
     * Every recorded sale of the property, oldest first.
     */
    @GetMapping("/{id}/history")
    public ResponseEntity<List<PriceHistoryDto>> getPriceHistory(@PathVariable("id") Long id) {
        logger.info("Fetching price history: id={}", id);
        return ResponseEntity.ok(queryPropertiesUseCase.getPriceHistory(id));
    }

    private BoundingBox toBoundingBox(PropertyListRequestDto request) {
        boolean anyBound = request.getNorth() != null || request.getSouth() != null
                || request.getEast() != null || request.getWest() != null;
        if (!anyBound) {
            return null;
        }
        if (request.getNorth() == null || request.getSouth() == null
                || request.getEast() == null || request.getWest() == null) {
            throw new IllegalArgumentException("north, south, east and west must be given together");
        }
        return new BoundingBox(request.getNorth(), request.getSouth(), request.getEast(), request.getWest());
    }
}
