package com.propertyprice.map.api.controller;

import com.propertyprice.map.application.port.in.QueryStatisticsUseCase;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/address")
public class AddressController {

    private final QueryStatisticsUseCase queryStatisticsUseCase;

    public AddressController(QueryStatisticsUseCase queryStatisticsUseCase) {
        this.queryStatisticsUseCase = queryStatisticsUseCase;
    }

    /**
     * GET /api/address/counties
     *
     * Distinct counties of all properties, sorted.
     */
    @GetMapping("/counties")
    public ResponseEntity<List<String>> listCounties() {
        return ResponseEntity.ok(queryStatisticsUseCase.listCounties());
    }
}
