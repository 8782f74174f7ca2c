package com.propertyprice.map.application.service;

import com.propertyprice.map.api.dto.CorrelationResponseDto;
import com.propertyprice.map.api.dto.CountyComparisonResponseDto;
import com.propertyprice.map.api.dto.DateRangeDto;
import com.propertyprice.map.api.dto.PriceTrendsResponseDto;
import com.propertyprice.map.application.mapper.StatisticsResponseMapper;
import com.propertyprice.map.application.port.in.QueryStatisticsUseCase;
import com.propertyprice.map.application.port.out.ResponseStateStore;
import com.propertyprice.map.application.port.out.SaleStatisticsSource;
import com.propertyprice.map.domain.model.CorrelationVariable;
import com.propertyprice.map.domain.model.CountyComparison;
import com.propertyprice.map.domain.model.PriceCorrelation;
import com.propertyprice.map.domain.model.PriceTrend;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.SaleDateRange;
import com.propertyprice.map.domain.model.SaleObservation;
import com.propertyprice.map.domain.model.TrendPeriod;
import com.propertyprice.map.domain.service.PriceStatisticsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Application service for sale statistics. Responses are cached in the state
 * store under keys prefixed "statistics:" and "address:".
 */
@Service
public class StatisticsQueryService implements QueryStatisticsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsQueryService.class);

    private final SaleStatisticsSource saleStatisticsSource;
    private final PriceStatisticsCalculator calculator;
    private final StatisticsResponseMapper mapper;
    private final ResponseCache responseCache;
    private final Clock clock;

    public StatisticsQueryService(
            SaleStatisticsSource saleStatisticsSource,
            PriceStatisticsCalculator calculator,
            StatisticsResponseMapper mapper,
            ResponseStateStore stateStore,
            Clock clock,
            @Value("${app.cache.ttl-seconds:300}") long responseTtlSeconds) {
        this.saleStatisticsSource = saleStatisticsSource;
        this.calculator = calculator;
        this.mapper = mapper;
        this.responseCache = new ResponseCache(stateStore, Duration.ofSeconds(responseTtlSeconds));
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public PriceTrendsResponseDto getPriceTrends(RecordFilter filter, TrendPeriod period) {
        if (filter.getStartDate() != null && filter.getEndDate() != null
                && filter.getStartDate().isAfter(filter.getEndDate())) {
            throw new IllegalArgumentException("Start date must not be after end date");
        }
        String key = "statistics:trends:" + period.getValue() + ":" + filter.toKey();
        return responseCache.getOrCompute(key, PriceTrendsResponseDto.class, () -> {
            List<SaleObservation> sales = saleStatisticsSource.findSales(filter);
            List<PriceTrend> trends = calculator.priceTrends(sales, period);
            logger.info("Computed {} {} price trend points from {} sales", trends.size(), period.getValue(),
                    sales.size());
            return mapper.toTrendsResponse(trends, period);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public CountyComparisonResponseDto getCountyComparison() {
        return responseCache.getOrCompute("statistics:county", CountyComparisonResponseDto.class, () -> {
            CountyComparison comparison = calculator.countyComparison(saleStatisticsSource.findLatestCountyPrices());
            logger.info("Compared {} counties", comparison.getCounties().size());
            return mapper.toCountyComparisonResponse(comparison);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public CorrelationResponseDto getCorrelation(CorrelationVariable variable) {
        String key = "statistics:correlation:" + variable.getValue();
        return responseCache.getOrCompute(key, CorrelationResponseDto.class, () -> {
            PriceCorrelation correlation = calculator.correlation(
                    saleStatisticsSource.findSales(RecordFilter.builder().build()), variable);
            logger.info("Price correlation with {}: r={}, n={}", variable.getValue(),
                    correlation.getCoefficient(), correlation.getSampleSize());
            return mapper.toCorrelationResponse(correlation, variable);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public DateRangeDto getSaleDateRange() {
        return responseCache.getOrCompute("statistics:date-range", DateRangeDto.class,
                () -> mapper.toDateRangeDto(saleStatisticsSource.findSaleDateRange().orElseGet(this::defaultRange)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> listCounties() {
        return List.of(responseCache.getOrCompute("address:counties", String[].class,
                () -> saleStatisticsSource.findCounties().toArray(new String[0])));
    }

    private SaleDateRange defaultRange() {
        int year = LocalDate.now(clock).getYear();
        logger.debug("No sales recorded, defaulting date range to {}-{}", year - 1, year);
        return new SaleDateRange(LocalDate.of(year - 1, 1, 1), LocalDate.of(year, 12, 31));
    }
}
