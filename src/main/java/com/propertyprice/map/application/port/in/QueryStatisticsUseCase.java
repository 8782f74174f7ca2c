package com.propertyprice.map.application.port.in;

import com.propertyprice.map.api.dto.CorrelationResponseDto;
import com.propertyprice.map.api.dto.CountyComparisonResponseDto;
import com.propertyprice.map.api.dto.DateRangeDto;
import com.propertyprice.map.api.dto.PriceTrendsResponseDto;
import com.propertyprice.map.domain.model.CorrelationVariable;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.TrendPeriod;

import java.util.List;

/**
 * Input port for sale statistics and address lookups.
 */
public interface QueryStatisticsUseCase {

  /**
   * Price statistics per calendar period over every sale matching the filter.
   */
  PriceTrendsResponseDto getPriceTrends(RecordFilter filter, TrendPeriod period);

  /**
   * County comparison over the latest sale of each property with a county.
   */
  CountyComparisonResponseDto getCountyComparison();

  CorrelationResponseDto getCorrelation(CorrelationVariable variable);

  /**
   * Span of recorded sale dates. Without any sale, the previous and current
   * calendar years.
   */
  DateRangeDto getSaleDateRange();

  List<String> listCounties();
}
