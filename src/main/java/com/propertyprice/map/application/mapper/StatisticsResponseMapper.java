package com.propertyprice.map.application.mapper;

import com.propertyprice.map.api.dto.CorrelationResponseDto;
import com.propertyprice.map.api.dto.CountyComparisonResponseDto;
import com.propertyprice.map.api.dto.CountyStatisticsDto;
import com.propertyprice.map.api.dto.DateRangeDto;
import com.propertyprice.map.api.dto.PriceTrendPointDto;
import com.propertyprice.map.api.dto.PriceTrendsResponseDto;
import com.propertyprice.map.domain.model.CorrelationVariable;
import com.propertyprice.map.domain.model.CountyComparison;
import com.propertyprice.map.domain.model.CountySummary;
import com.propertyprice.map.domain.model.PriceCorrelation;
import com.propertyprice.map.domain.model.PriceTrend;
import com.propertyprice.map.domain.model.SaleDateRange;
import com.propertyprice.map.domain.model.TrendPeriod;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StatisticsResponseMapper {

  public PriceTrendsResponseDto toTrendsResponse(List<PriceTrend> trends, TrendPeriod period) {
    return new PriceTrendsResponseDto(
        trends.stream().map(this::toTrendPointDto).toList(),
        period.getValue());
  }

  public PriceTrendPointDto toTrendPointDto(PriceTrend trend) {
    return new PriceTrendPointDto(
        trend.getPeriod(),
        trend.getAveragePrice(),
        trend.getMedianPrice(),
        trend.getStdDeviation(),
        trend.getMinPrice(),
        trend.getMaxPrice(),
        trend.getCount());
  }

  public CountyComparisonResponseDto toCountyComparisonResponse(CountyComparison comparison) {
    return new CountyComparisonResponseDto(
        comparison.getCounties().stream().map(this::toCountyStatisticsDto).toList(),
        comparison.getOverallAverage(),
        comparison.getOverallMedian());
  }

  public CountyStatisticsDto toCountyStatisticsDto(CountySummary summary) {
    return new CountyStatisticsDto(
        summary.getCounty(),
        summary.getPropertyCount(),
        summary.getAveragePrice(),
        summary.getMedianPrice(),
        summary.getMinPrice(),
        summary.getMaxPrice());
  }

  public CorrelationResponseDto toCorrelationResponse(PriceCorrelation correlation, CorrelationVariable variable) {
    return new CorrelationResponseDto(
        variable.getValue(),
        correlation.getCoefficient(),
        correlation.getPValue(),
        correlation.getSampleSize(),
        correlation.getInterpretation());
  }

  public DateRangeDto toDateRangeDto(SaleDateRange range) {
    return new DateRangeDto(
        range.getMinDate().getYear(),
        range.getMaxDate().getYear(),
        range.getMinDate(),
        range.getMaxDate());
  }
}
