package com.propertyprice.map.application.mapper;

import com.propertyprice.map.api.dto.BoundsDto;
import com.propertyprice.map.api.dto.ClusterDto;
import com.propertyprice.map.api.dto.HeatmapPointDto;
import com.propertyprice.map.api.dto.HeatmapPolygonDto;
import com.propertyprice.map.api.dto.MapPointDto;
import com.propertyprice.map.api.dto.ViewportDto;
import com.propertyprice.map.domain.model.BoundingBox;
import com.propertyprice.map.domain.model.CellAggregate;
import com.propertyprice.map.domain.model.Cluster;
import com.propertyprice.map.domain.model.GeoRecord;
import com.propertyprice.map.domain.model.HeatmapPoint;
import com.propertyprice.map.domain.model.HeatmapPolygonCell;
import com.propertyprice.map.domain.model.ViewportQuery;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Mapper for converting aggregation results to response DTOs.
 */
@Component
public class MapResponseMapper {

  public MapPointDto toPointDto(GeoRecord record) {
    return new MapPointDto(
        record.getId(),
        record.getLatitude(),
        record.getLongitude(),
        record.getPrice(),
        record.getLabel(),
        record.getRegion(),
        record.getSaleDate());
  }

  public ClusterDto toClusterDto(Cluster cluster) {
    ClusterDto dto = new ClusterDto();
    dto.setCenterLat(cluster.getCenterLat());
    dto.setCenterLng(cluster.getCenterLng());
    dto.setCount(cluster.getCount());
    dto.setBounds(toBoundsDto(cluster.getBounds()));
    dto.setProperties(cluster.getMembers().stream().map(this::toPointDto).toList());
    if (cluster.getPriceBucket() != null) {
      dto.setPriceBucket(cluster.getPriceBucket().name());
    }
    return dto;
  }

  /**
   * Maps a real-count cell. Member ids replace member points.
   */
  public ClusterDto toClusterDto(CellAggregate cell) {
    ClusterDto dto = new ClusterDto();
    dto.setCenterLat(cell.getCenterLat());
    dto.setCenterLng(cell.getCenterLng());
    dto.setCount(cell.getCount());
    dto.setBounds(toBoundsDto(cell.getBounds()));
    dto.setPropertyIds(cell.getPropertyIds());
    dto.setAvgPrice(cell.getAvgPrice());
    dto.setMinPrice(cell.getMinPrice());
    dto.setMaxPrice(cell.getMaxPrice());
    dto.setTotalSales(cell.getTotalSales());
    return dto;
  }

  public HeatmapPolygonDto toPolygonDto(HeatmapPolygonCell cell) {
    return new HeatmapPolygonDto(
        List.of(cell.ring()),
        new HeatmapPolygonDto.MetadataDto(cell.getIntensity(), cell.getSalesCount(), cell.getAvgPrice()));
  }

  public HeatmapPointDto toHeatmapPointDto(HeatmapPoint point) {
    HeatmapPointDto.DataDto data = new HeatmapPointDto.DataDto(
        point.getIntensity(),
        point.getSalesCount(),
        point.getAvgPrice(),
        point.getChangePercent(),
        point.getEarlyAvgPrice(),
        point.getLateAvgPrice());
    return new HeatmapPointDto(point.getLatitude(), point.getLongitude(), point.getIntensity(), data);
  }

  public ViewportDto toViewportDto(ViewportQuery query) {
    BoundingBox box = query.getBoundingBox();
    return new ViewportDto(box.getNorth(), box.getSouth(), box.getEast(), box.getWest(), query.getZoom());
  }

  public BoundsDto toBoundsDto(BoundingBox box) {
    return new BoundsDto(box.getNorth(), box.getSouth(), box.getEast(), box.getWest());
  }
}
