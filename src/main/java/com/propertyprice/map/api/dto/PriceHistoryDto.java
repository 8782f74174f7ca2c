package com.propertyprice.map.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class PriceHistoryDto {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("dateOfSale")
    private LocalDate dateOfSale;

    @JsonProperty("price")
    private Long price;

    @JsonProperty("notFullMarketPrice")
    private boolean notFullMarketPrice;

    @JsonProperty("vatExclusive")
    private boolean vatExclusive;

    @JsonProperty("description")
    private String description;
}
