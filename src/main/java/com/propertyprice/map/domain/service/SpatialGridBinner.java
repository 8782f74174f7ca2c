package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.GridCellKey;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions records into a uniform lat/lng grid anchored at (0, 0).
 *
 * Cell key: {@code ((long) (lat / cellSize), (long) (lng / cellSize))}, i.e. the
 * quotient truncated toward zero. Records without coordinates are skipped.
 */
@Service
public class SpatialGridBinner {

    /**
     * Bin records into cells of the given size in a single pass.
     *
     * @param records records to bin; may be empty
     * @param cellSizeDegrees edge length of a cell in degrees, must be positive and finite
     * @return cell key to members, in first-seen order
     */
    public Map<GridCellKey, List<GeoRecord>> bin(Collection<GeoRecord> records, double cellSizeDegrees) {
        if (!(cellSizeDegrees > 0) || Double.isInfinite(cellSizeDegrees)) {
            throw new IllegalArgumentException("cellSizeDegrees must be > 0, got " + cellSizeDegrees);
        }
        Map<GridCellKey, List<GeoRecord>> cells = new LinkedHashMap<>();
        for (GeoRecord record : records) {
            if (!record.hasCoordinates()) {
                continue;
            }
            cells.computeIfAbsent(keyOf(record, cellSizeDegrees), key -> new ArrayList<>()).add(record);
        }
        return cells;
    }

    public GridCellKey keyOf(GeoRecord record, double cellSizeDegrees) {
        long row = (long) (record.getLatitude() / cellSizeDegrees);
        long col = (long) (record.getLongitude() / cellSizeDegrees);
        return new GridCellKey(row, col);
    }
}
