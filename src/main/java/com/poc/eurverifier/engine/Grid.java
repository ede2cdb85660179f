package com.poc.eurverifier.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of one report: ordered column headers and ordered rows
 * of already computed cell values.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Grid {

    /** Sheet row of the first data row when the header occupies row 1. */
    public static final int FIRST_DATA_ROW_NUMBER = 2;

    private final List<String> headers;
    private final List<GridRow> rows;

    public Grid(List<String> headers, List<GridRow> rows) {
        this.headers = List.copyOf(headers);
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /**
     * Builds a grid from positional row values, numbering rows as they would
     * appear under a single header row.
     */
    public static Grid ofValues(List<String> headers, List<List<Object>> values) {
        List<GridRow> rows = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            List<Object> rowValues = values.get(i);
            Map<String, Object> cells = new LinkedHashMap<>();
            for (int c = 0; c < headers.size() && c < rowValues.size(); c++) {
                cells.put(headers.get(c), rowValues.get(c));
            }
            rows.add(new GridRow(FIRST_DATA_ROW_NUMBER + i, cells));
        }
        return new Grid(headers, rows);
    }

    public boolean hasColumn(String column) {
        return headers.contains(column);
    }

    public int rowCount() {
        return rows.size();
    }

    public GridRow row(int index) {
        return rows.get(index);
    }
}
