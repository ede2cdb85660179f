package com.poc.eurverifier.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One data row of a {@link Grid}. Cell values may be null for empty cells.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class GridRow {

    /** 1-based row number in the sheet the grid was read from. */
    private final int rowNumber;
    private final Map<String, Object> cells;

    public GridRow(int rowNumber, Map<String, Object> cells) {
        this.rowNumber = rowNumber;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public Object get(String column) {
        return cells.get(column);
    }
}
