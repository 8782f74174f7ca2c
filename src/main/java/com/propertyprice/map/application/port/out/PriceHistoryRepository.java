package com.propertyprice.map.application.port.out;

import com.propertyprice.map.domain.model.PriceHistory;

import java.util.List;

/**
 * Output port for sale history persistence.
 */
public interface PriceHistoryRepository {

  /**
   * All recorded sales of a property, newest first.
   */
  List<PriceHistory> findByPropertyIdOrderByDateOfSaleDesc(Long propertyId);

  List<PriceHistory> findByPropertyIdOrderByDateOfSaleAsc(Long propertyId);
}
