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
public class PriceTrendsResponseDto {

    @JsonProperty("trends")
    private List<PriceTrendPointDto> trends;

    @JsonProperty("period")
    private String period;
}
