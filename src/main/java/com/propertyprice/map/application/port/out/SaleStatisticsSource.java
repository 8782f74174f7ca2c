package com.propertyprice.map.application.port.out;

import com.propertyprice.map.domain.model.CountyPrice;
import com.propertyprice.map.domain.model.RecordFilter;
import com.propertyprice.map.domain.model.SaleObservation;
import com.propertyprice.map.domain.model.SaleDateRange;

import java.util.List;
import java.util.Optional;

/**
 * Output port for the sale-level reads behind the statistics endpoints.
 */
public interface SaleStatisticsSource {

  /**
   * Every sale matching the filter, oldest first. Unlike record queries, the
   * date window and price bounds apply to each sale rather than to a property's
   * latest sale; the remaining filters apply to the sold property.
   */
  List<SaleObservation> findSales(RecordFilter filter);

  /**
   * Latest sale price of every property that has a county and at least one sale.
   * When several sales share the latest date the highest price wins.
   */
  List<CountyPrice> findLatestCountyPrices();

  /**
   * Earliest and latest sale dates, empty when no sale is recorded.
   */
  Optional<SaleDateRange> findSaleDateRange();

  /**
   * Distinct counties of all properties, sorted.
   */
  List<String> findCounties();
}
