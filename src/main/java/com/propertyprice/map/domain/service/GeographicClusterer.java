package com.propertyprice.map.domain.service;

import com.propertyprice.map.domain.model.Cluster;
import com.propertyprice.map.domain.model.ClusterMode;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.PriceBucket;
import com.propertyprice.map.domain.policy.GridResolutionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups records into one cluster per non-empty grid cell.
 *
 * A single-member cell still yields a cluster (count 1, zero-area bounds).
 * Cluster order is not part of the contract.
 */
@Service
public class GeographicClusterer {

    private static final Logger logger = LoggerFactory.getLogger(GeographicClusterer.class);

    private final SpatialGridBinner binner;

    public GeographicClusterer(SpatialGridBinner binner) {
        this.binner = binner;
    }

    /**
     * Cluster records for a zoom level.
     *
     * @param records records to cluster; those without coordinates are ignored
     * @param zoomLevel map zoom level
     * @param mode PRICE clusters each price bucket separately and drops unpriced
     *             records; SIZE behaves like GEOGRAPHIC
     */
    public List<Cluster> cluster(Collection<GeoRecord> records, int zoomLevel, ClusterMode mode) {
        double cellSize = GridResolutionPolicy.clusteringCellSize(zoomLevel);
        if (mode == ClusterMode.PRICE) {
            return clusterByPriceBucket(records, cellSize);
        }
        if (mode == ClusterMode.SIZE) {
            logger.debug("Size clustering has no partitioning, falling back to geographic");
        }
        return clusterCells(records, cellSize, null);
    }

    public List<Cluster> cluster(Collection<GeoRecord> records, int zoomLevel) {
        return cluster(records, zoomLevel, ClusterMode.GEOGRAPHIC);
    }

    private List<Cluster> clusterByPriceBucket(Collection<GeoRecord> records, double cellSize) {
        Map<PriceBucket, List<GeoRecord>> buckets = new EnumMap<>(PriceBucket.class);
        for (GeoRecord record : records) {
            if (!record.hasPrice()) {
                continue;
            }
            PriceBucket.of(record.getPrice())
                    .ifPresent(bucket -> buckets.computeIfAbsent(bucket, b -> new ArrayList<>()).add(record));
        }
        List<Cluster> clusters = new ArrayList<>();
        buckets.forEach((bucket, members) -> clusters.addAll(clusterCells(members, cellSize, bucket)));
        return clusters;
    }

    private List<Cluster> clusterCells(Collection<GeoRecord> records, double cellSize, PriceBucket bucket) {
        List<Cluster> clusters = new ArrayList<>();
        for (List<GeoRecord> members : binner.bin(records, cellSize).values()) {
            clusters.add(Cluster.of(members, bucket));
        }
        return clusters;
    }
}
