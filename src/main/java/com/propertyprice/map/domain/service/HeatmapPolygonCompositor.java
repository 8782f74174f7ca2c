package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AggregationRequest;
import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPolygonCell;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Bins records into a gridCells x gridCells grid spanning the bounding box and
 * emits one rectangular polygon per non-empty cell.
 *
 * Unlike {@link SpatialGridBinner} the grid is anchored to the viewport: edges are
 * evenly spaced between south/north and west/east. Records outside the box are
 * ignored; a record on the north or east edge belongs to the last row or column.
 */
@Service
public class HeatmapPolygonCompositor {

    /**
     * @param records records to bin
     * @param boundingBox viewport the grid spans
     * @param analysisMode accepted for mode-specific metadata; polygon shape and
     *                     intensity do not depend on it
     * @param gridCells cells per side, must be positive
     * @return polygons of non-empty cells in row-major order, intensity = count / max count
     */
    public List<HeatmapPolygonCell> computePolygons(Collection<GeoRecord> records, BoundingBox boundingBox,
            AnalysisMode analysisMode, int gridCells) {
        if (gridCells <= 0) {
            throw new IllegalArgumentException("gridCells must be > 0, got " + gridCells);
        }
        if (boundingBox == null) {
            throw new IllegalArgumentException("Bounding box must not be null");
        }
        if (records.isEmpty()) {
            return List.of();
        }

        double[] latEdges = edges(boundingBox.getSouth(), boundingBox.getNorth(), gridCells);
        double[] lngEdges = edges(boundingBox.getWest(), boundingBox.getEast(), gridCells);

        int[][] counts = new int[gridCells][gridCells];
        long[][] priceSums = new long[gridCells][gridCells];
        int[][] priceCounts = new int[gridCells][gridCells];
        int maxCount = 0;

        for (GeoRecord record : records) {
            if (!record.hasCoordinates()) {
                continue;
            }
            int row = locate(latEdges, record.getLatitude());
            int col = locate(lngEdges, record.getLongitude());
            if (row < 0 || col < 0) {
                continue;
            }
            counts[row][col]++;
            maxCount = Math.max(maxCount, counts[row][col]);
            if (record.hasPrice()) {
                priceSums[row][col] += record.getPrice();
                priceCounts[row][col]++;
            }
        }

        if (maxCount == 0) {
            return List.of();
        }

        List<HeatmapPolygonCell> polygons = new ArrayList<>();
        for (int row = 0; row < gridCells; row++) {
            for (int col = 0; col < gridCells; col++) {
                int count = counts[row][col];
                if (count == 0) {
                    continue;
                }
                double intensity = clamp((double) count / maxCount);
                Long avgPrice = priceCounts[row][col] > 0
                        ? Math.round((double) priceSums[row][col] / priceCounts[row][col])
                        : null;
                polygons.add(new HeatmapPolygonCell(row, col,
                        latEdges[row], latEdges[row + 1],
                        lngEdges[col], lngEdges[col + 1],
                        intensity, count, avgPrice));
            }
        }
        return polygons;
    }

    public List<HeatmapPolygonCell> computePolygons(Collection<GeoRecord> records, BoundingBox boundingBox,
            AnalysisMode analysisMode) {
        return computePolygons(records, boundingBox, analysisMode, AggregationRequest.DEFAULT_GRID_CELLS);
    }

    static double[] edges(double from, double to, int cells) {
        double[] edges = new double[cells + 1];
        double step = (to - from) / cells;
        for (int i = 0; i < cells; i++) {
            edges[i] = from + i * step;
        }
        edges[cells] = to;
        return edges;
    }

    /**
     * Index of the cell containing value, or -1 when outside the edges.
     */
    static int locate(double[] edges, double value) {
        int cells = edges.length - 1;
        if (value < edges[0] || value > edges[cells]) {
            return -1;
        }
        // first edge strictly greater than value
        int lo = 0;
        int hi = edges.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (edges[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return Math.min(lo - 1, cells - 1);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
