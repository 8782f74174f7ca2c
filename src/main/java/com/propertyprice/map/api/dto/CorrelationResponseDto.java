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
public class CorrelationResponseDto {

    @JsonProperty("variable")
    private String variable;

    @JsonProperty("correlationCoefficient")
    private double correlationCoefficient;

    @JsonProperty("pValue")
    private double probabilityValue;

    @JsonProperty("sampleSize")
    private int sampleSize;

    @JsonProperty("interpretation")
    private String interpretation;
}
