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
public class PropertyListResponseDto {

    @JsonProperty("items")
    private List<PropertyListItemDto> items;

    @JsonProperty("page")
    private int page;

    @JsonProperty("pageSize")
    private int pageSize;

    @JsonProperty("hasMore")
    private boolean hasMore;

    /** Exact total, only reported when it is known without counting. */
    @JsonProperty("total")
    private Integer total;
}
