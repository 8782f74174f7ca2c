package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.AnalysisMode;
import com.propertyprice.map.domain.model.Cluster;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPoint;
import com.propertyprice.map.domain.model.PricePeriodComparison;
import com.propertyprice.map.domain.policy.GridResolutionPolicy;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Per-point intensity functions for the analysis overlays. Every intensity is
 * clamped to [0, 1]; point locations are cell or cluster centroids.
 */
@Service
public class HeatmapPointAnalyzer {

    public static final String PATTERN_CONCENTRATION = "concentration";

    private static final double CONCENTRATION_PRICE_SCALE = 1_000_000.0;
    private static final double UNPRICED_CONCENTRATION = 0.5;
    private static final double CLUSTER_COUNT_SCALE = 100.0;

    private final SpatialGridBinner binner;

    public HeatmapPointAnalyzer(SpatialGridBinner binner) {
        this.binner = binner;
    }

    /**
     * Compute the overlay for an analysis mode.
     *
     * @param records capped records in view
     * @param clusters zoom-10 geographic clusters of the same records, used by the
     *                 cluster-based modes
     * @param mode analysis mode
     * @param patternType spatial-patterns variant, "concentration" or anything else for density
     * @param hotspotIntensity multiplier applied to hotspot intensities
     * @param periodComparison early/late prices for growth-decline, or null
     */
    public List<HeatmapPoint> analyze(Collection<GeoRecord> records, List<Cluster> clusters, AnalysisMode mode,
            String patternType, double hotspotIntensity, PricePeriodComparison periodComparison) {
        switch (mode) {
            case SPATIAL_PATTERNS:
                return spatialPatterns(records, patternType);
            case HOTSPOTS:
                return hotspots(records, hotspotIntensity);
            case CLUSTER_IDENTIFICATION:
                return clusterDensity(clusters);
            case GROWTH_DECLINE:
                return growthDecline(records, periodComparison);
            case PRICE_HEATMAP:
                return priceHeatmap(records);
            case SALES_HEATMAP:
                return salesHeatmap(clusters);
            default:
                throw new IllegalArgumentException("Unsupported analysis mode: " + mode);
        }
    }

    public List<HeatmapPoint> spatialPatterns(Collection<GeoRecord> records, String patternType) {
        boolean concentration = PATTERN_CONCENTRATION.equalsIgnoreCase(patternType);
        List<HeatmapPoint> points = new ArrayList<>();
        for (GeoRecord record : records) {
            if (!record.hasCoordinates()) {
                continue;
            }
            double intensity = 1.0;
            if (concentration) {
                intensity = record.hasPrice()
                        ? record.getPrice() / CONCENTRATION_PRICE_SCALE
                        : UNPRICED_CONCENTRATION;
            }
            points.add(HeatmapPoint.of(record.getLatitude(), record.getLongitude(), clamp(intensity)));
        }
        return points;
    }

    public List<HeatmapPoint> hotspots(Collection<GeoRecord> records, double hotspotIntensity) {
        Collection<List<GeoRecord>> cells = binner.bin(records, GridResolutionPolicy.ANALYSIS_CELL_DEGREES).values();
        int maxCount = cells.stream().mapToInt(List::size).max().orElse(0);
        List<HeatmapPoint> points = new ArrayList<>();
        for (List<GeoRecord> members : cells) {
            Cluster cell = Cluster.of(members);
            double intensity = clamp((double) cell.getCount() / maxCount * hotspotIntensity);
            points.add(HeatmapPoint.withSales(cell.getCenterLat(), cell.getCenterLng(), intensity,
                    cell.getCount(), null));
        }
        return points;
    }

    public List<HeatmapPoint> clusterDensity(List<Cluster> clusters) {
        List<HeatmapPoint> points = new ArrayList<>();
        for (Cluster cluster : clusters) {
            double intensity = clamp(cluster.getCount() / CLUSTER_COUNT_SCALE);
            points.add(HeatmapPoint.withSales(cluster.getCenterLat(), cluster.getCenterLng(), intensity,
                    cluster.getCount(), averagePrice(cluster.getMembers())));
        }
        return points;
    }

    public List<HeatmapPoint> salesHeatmap(List<Cluster> clusters) {
        int maxCount = clusters.stream().mapToInt(Cluster::getCount).max().orElse(0);
        List<HeatmapPoint> points = new ArrayList<>();
        for (Cluster cluster : clusters) {
            double intensity = clamp((double) cluster.getCount() / maxCount);
            points.add(HeatmapPoint.withSales(cluster.getCenterLat(), cluster.getCenterLng(), intensity,
                    cluster.getCount(), null));
        }
        return points;
    }

    public List<HeatmapPoint> priceHeatmap(Collection<GeoRecord> records) {
        List<GeoRecord> priced = records.stream().filter(GeoRecord::hasPrice).toList();
        List<Cluster> cells = new ArrayList<>();
        for (List<GeoRecord> members : binner.bin(priced, GridResolutionPolicy.ANALYSIS_CELL_DEGREES).values()) {
            cells.add(Cluster.of(members));
        }
        double maxAvg = cells.stream()
                .mapToDouble(cell -> meanPrice(cell.getMembers()))
                .max()
                .orElse(0);
        List<HeatmapPoint> points = new ArrayList<>();
        for (Cluster cell : cells) {
            double avg = meanPrice(cell.getMembers());
            double intensity = maxAvg > 0 ? clamp(avg / maxAvg) : 0.0;
            points.add(new HeatmapPoint(cell.getCenterLat(), cell.getCenterLng(), intensity,
                    null, Math.round(avg), null, null, null));
        }
        return points;
    }

    /**
     * Cells with sales in both periods, placed on a 0..1 scale where 0.5 is no
     * change, 0 is a 100% decline and 1 is a 100% (or greater) rise.
     */
    public List<HeatmapPoint> growthDecline(Collection<GeoRecord> records, PricePeriodComparison comparison) {
        if (comparison == null) {
            return List.of();
        }
        Map<Long, Long> early = comparison.getEarlyPrices();
        Map<Long, Long> late = comparison.getLatePrices();
        List<HeatmapPoint> points = new ArrayList<>();
        for (List<GeoRecord> members : binner.bin(records, GridResolutionPolicy.ANALYSIS_CELL_DEGREES).values()) {
            long earlySum = 0;
            int earlyCount = 0;
            long lateSum = 0;
            int lateCount = 0;
            for (GeoRecord record : members) {
                Long earlyPrice = early.get(record.getId());
                if (earlyPrice != null) {
                    earlySum += earlyPrice;
                    earlyCount++;
                }
                Long latePrice = late.get(record.getId());
                if (latePrice != null) {
                    lateSum += latePrice;
                    lateCount++;
                }
            }
            if (earlyCount == 0 || lateCount == 0) {
                continue;
            }
            double earlyAvg = (double) earlySum / earlyCount;
            double lateAvg = (double) lateSum / lateCount;
            if (earlyAvg <= 0) {
                continue;
            }
            double changePercent = (lateAvg - earlyAvg) / earlyAvg * 100.0;
            double intensity = clamp(changePercent / 200.0 + 0.5);
            Cluster cell = Cluster.of(members);
            points.add(new HeatmapPoint(cell.getCenterLat(), cell.getCenterLng(), intensity,
                    null, null, Math.round(changePercent * 100.0) / 100.0,
                    Math.round(earlyAvg), Math.round(lateAvg)));
        }
        return points;
    }

    private static Long averagePrice(List<GeoRecord> members) {
        long sum = 0;
        int priced = 0;
        for (GeoRecord record : members) {
            if (record.hasPrice()) {
                sum += record.getPrice();
                priced++;
            }
        }
        return priced > 0 ? Math.round((double) sum / priced) : null;
    }

    private static double meanPrice(List<GeoRecord> pricedMembers) {
        return pricedMembers.stream().mapToLong(GeoRecord::getPrice).average().orElse(0);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
