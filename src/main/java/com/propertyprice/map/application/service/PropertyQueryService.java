package com.propertyprice.map.application.service;

import com.propertyprice.map.api.dto.PriceHistoryDto;
import com.propertyprice.map.api.dto.PropertyDetailDto;
import com.propertyprice.map.api.dto.PropertyListItemDto;
import com.propertyprice.map.api.dto.PropertyListResponseDto;
import com.propertyprice.map.application.mapper.PropertyMapper;
import com.propertyprice.map.application.port.in.QueryPropertiesUseCase;
import com.propertyprice.map.application.port.out.GeoRecordSource;
import com.propertyprice.map.application.port.out.PriceHistoryRepository;
import com.propertyprice.map.application.port.out.PropertyRepository;
import com.propertyprice.map.application.port.out.ResponseStateStore;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.PriceHistory;
import com.propertyprice.map.domain.model.Property;
import com.propertyprice.map.domain.model.RecordFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;

/**
 * Application service for property listing and detail.
 * Pages are read one row past the page size so "hasMore" needs no COUNT.
 */
@Service
public class PropertyQueryService implements QueryPropertiesUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PropertyQueryService.class);

    private final GeoRecordSource geoRecordSource;
    private final PropertyRepository propertyRepository;
    private final PriceHistoryRepository priceHistoryRepository;
    private final ResponseCache responseCache;
    private final PropertyMapper propertyMapper;

    public PropertyQueryService(
            GeoRecordSource geoRecordSource,
            PropertyRepository propertyRepository,
            PriceHistoryRepository priceHistoryRepository,
            ResponseStateStore stateStore,
            PropertyMapper propertyMapper,
            @Value("${app.cache.ttl-seconds:300}") long responseTtlSeconds) {
        this.geoRecordSource = geoRecordSource;
        this.propertyRepository = propertyRepository;
        this.priceHistoryRepository = priceHistoryRepository;
        this.responseCache = new ResponseCache(stateStore, Duration.ofSeconds(responseTtlSeconds));
        this.propertyMapper = propertyMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public PropertyListResponseDto listProperties(RecordFilter filter, int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            throw new IllegalArgumentException("Page and page size must be positive");
        }
        int offset = offsetOf(page, pageSize);
        String cacheKey = "properties:" + page + ":" + pageSize + ":" + filter.toKey();
        return responseCache.getOrCompute(cacheKey, PropertyListResponseDto.class,
                () -> readPage(filter, page, pageSize, offset));
    }

    private PropertyListResponseDto readPage(RecordFilter filter, int page, int pageSize, int offset) {
        List<GeoRecord> rows = geoRecordSource.findRecords(filter, offset, pageSize + 1);
        boolean hasMore = rows.size() > pageSize;
        List<PropertyListItemDto> items = rows.stream()
                .limit(pageSize)
                .map(propertyMapper::toListItemDto)
                .toList();
        // The total is only exact when the whole filtered set fits on the first page
        Integer total = (page == 1 && !hasMore) ? items.size() : null;

        logger.debug("Read property page {} ({} rows, hasMore={})", page, items.size(), hasMore);
        return new PropertyListResponseDto(items, page, pageSize, hasMore, total);
    }

    @Override
    @Transactional(readOnly = true)
    public PropertyDetailDto getProperty(Long id) {
        Property property = propertyRepository.findById(id)
                .orElseThrow(() -> new PropertyNotFoundException(id));
        List<PriceHistory> sales = priceHistoryRepository.findByPropertyIdOrderByDateOfSaleDesc(id);
        return propertyMapper.toDetailDto(property, sales);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PriceHistoryDto> getPriceHistory(Long id) {
        if (propertyRepository.findById(id).isEmpty()) {
            throw new PropertyNotFoundException(id);
        }
        return priceHistoryRepository.findByPropertyIdOrderByDateOfSaleAsc(id).stream()
                .map(propertyMapper::toPriceHistoryDto)
                .toList();
    }

    /**
     * Row offset of a page. Pages whose first row lies beyond the addressable
     * range are rejected rather than wrapped.
     */
    static int offsetOf(int page, int pageSize) {
        long offset = Math.multiplyExact((long) page - 1, (long) pageSize);
        if (offset > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Page " + page + " with page size " + pageSize + " is beyond the last addressable row");
        }
        return (int) offset;
    }
}
