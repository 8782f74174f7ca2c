package com.propertyprice.map.domain.policy;

import com.propertyprice.map.domain.model.GeoRecord;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Records left after applying a {@link FetchPlan}, with disclosure of any data loss.
 */
@Getter
@ToString
public class CappedRecords {
    private final List<GeoRecord> records;
    private final int fetchedCount;
    private final boolean truncated;
    private final boolean sampled;

    public CappedRecords(List<GeoRecord> records, int fetchedCount, boolean truncated, boolean sampled) {
        this.records = List.copyOf(records);
        this.fetchedCount = fetchedCount;
        this.truncated = truncated;
        this.sampled = sampled;
    }
}
