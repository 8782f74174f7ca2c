package com.propertyprice.map.application.mapper;

import com.propertyprice.map.api.dto.PriceHistoryDto;
import com.propertyprice.map.api.dto.PropertyDetailDto;
import com.propertyprice.map.api.dto.PropertyListItemDto;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.PriceHistory;
import com.propertyprice.map.domain.model.Property;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PropertyMapper {

    public PropertyListItemDto toListItemDto(GeoRecord record) {
        return new PropertyListItemDto(
                record.getId(),
                record.getLabel(),
                record.getRegion(),
                record.getLatitude(),
                record.getLongitude(),
                record.getPrice(),
                record.getSaleDate());
    }

    public PropertyDetailDto toDetailDto(Property property, List<PriceHistory> sales) {
        return new PropertyDetailDto(
                property.getId(),
                property.getAddress(),
                property.getCounty(),
                property.getEircode(),
                property.getLatitude(),
                property.getLongitude(),
                sales.stream().map(this::toPriceHistoryDto).toList());
    }

    public PriceHistoryDto toPriceHistoryDto(PriceHistory sale) {
        return new PriceHistoryDto(
                sale.getId(),
                sale.getDateOfSale(),
                sale.getPrice(),
                sale.isNotFullMarketPrice(),
                sale.isVatExclusive(),
                sale.getDescription());
    }
}
