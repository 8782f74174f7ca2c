package com.propertyprice.map.application.port.out;

import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.RecordFilter;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Output port for reading filtered sale records.
 * Implementations must honour the limit in the query itself and never count
 * the full filtered set.
 */
public interface GeoRecordSource {

  /**
   * Find records matching the filter, ordered by id.
   * The price of each record is its latest sale in the filter's date window.
   *
   * @param filter record filters
   * @param offset rows to skip
   * @param limit maximum rows to return
   */
  List<GeoRecord> findRecords(RecordFilter filter, int offset, int limit);

  default List<GeoRecord> findRecords(RecordFilter filter, int limit) {
    return findRecords(filter, 0, limit);
  }

  /**
   * Keyset page: records matching the filter with an id greater than {@code afterId},
   * ordered by id. Reading the whole set page by page costs no deep offsets.
   *
   * @param afterId last id of the previous page, 0 for the first page
   * @param limit maximum rows to return
   */
  List<GeoRecord> findRecordsAfter(RecordFilter filter, long afterId, int limit);

  /**
   * Latest sale price per record id within {@code [startInclusive, endExclusive)}.
   * Ids without a sale in the window are absent from the result.
   */
  Map<Long, Long> findLatestPrices(Collection<Long> recordIds, LocalDate startInclusive, LocalDate endExclusive);
}
