package com.propertyprice.map.application.port.in;

import com.propertyprice.map.api.dto.PriceHistoryDto;
import com.propertyprice.map.api.dto.PropertyDetailDto;
import com.propertyprice.map.api.dto.PropertyListResponseDto;
import com.propertyprice.map.domain.model.RecordFilter;

import java.util.List;

/**
 * Input port for property listing and detail lookups.
 */
public interface QueryPropertiesUseCase {

  /**
   * List one page of properties without counting the filtered set.
   *
   * @param filter record filters, bounding box optional
   * @param page 1-based page number
   * @param pageSize rows per page
   */
  PropertyListResponseDto listProperties(RecordFilter filter, int page, int pageSize);

  /**
   * @throws com.propertyprice.map.application.service.PropertyNotFoundException when no property has the id
   */
  PropertyDetailDto getProperty(Long id);

  /**
   * Every recorded sale of a property, oldest first.
   *
   * @throws com.propertyprice.map.application.service.PropertyNotFoundException when no property has the id
   */
  List<PriceHistoryDto> getPriceHistory(Long id);
}
