package com.propertyprice.map.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Integer (row, col) address of a fixed-size grid cell.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GridCellKey {
    private final long row;
    private final long col;

    public GridCellKey(long row, long col) {
        this.row = row;
        this.col = col;
    }
}
