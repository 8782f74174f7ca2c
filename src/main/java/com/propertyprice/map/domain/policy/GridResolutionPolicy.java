package com.propertyprice.map.domain.policy;

/**
 * Zoom-to-cell-size tables for the two fixed-size grids.
 *
 * The clustering grid shrinks geometrically with zoom; the real-count grid
 * uses a coarser step table. Each call site uses its own table.
 */
public final class GridResolutionPolicy {

    /** Smallest clustering cell, about 1 km. */
    public static final double MIN_CLUSTERING_CELL_DEGREES = 0.01;

    /** Cell size used by the fixed-resolution analysis overlays. */
    public static final double ANALYSIS_CELL_DEGREES = 0.01;

    private static final double BASE_CLUSTERING_CELL_DEGREES = 0.5;
    private static final int BASE_CLUSTERING_ZOOM = 5;

    private GridResolutionPolicy() {
    }

    /**
     * Cell size for interactive clustering: {@code max(0.01, 0.5 / 2^(zoom - 5))}.
     */
    public static double clusteringCellSize(int zoomLevel) {
        double size = BASE_CLUSTERING_CELL_DEGREES / Math.pow(2, zoomLevel - BASE_CLUSTERING_ZOOM);
        return Math.max(MIN_CLUSTERING_CELL_DEGREES, size);
    }

    /**
     * Cell size for real-count aggregation.
     */
    public static double realCountCellSize(int zoomLevel) {
        if (zoomLevel <= 4) {
            return 0.1;
        }
        if (zoomLevel <= 7) {
            return 0.05;
        }
        if (zoomLevel <= 10) {
            return 0.01;
        }
        return 0.005;
    }
}
