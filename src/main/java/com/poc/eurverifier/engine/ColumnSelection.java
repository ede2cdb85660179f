package com.poc.eurverifier.engine;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Which columns a verification run checks: an explicit ordered list, or every
 * source column that holds numeric data in at least one row.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ColumnSelection {

    public enum Mode {
        EXPLICIT,
        ALL_NUMERIC
    }

    private static final ColumnSelection ALL_NUMERIC = new ColumnSelection(Mode.ALL_NUMERIC, List.of());

    private final Mode mode;
    private final List<String> columns;

    private ColumnSelection(Mode mode, List<String> columns) {
        this.mode = mode;
        this.columns = columns;
    }

    public static ColumnSelection explicit(List<String> columns) {
        return new ColumnSelection(Mode.EXPLICIT, List.copyOf(columns));
    }

    public static ColumnSelection explicit(String... columns) {
        return explicit(List.of(columns));
    }

    public static ColumnSelection allNumeric() {
        return ALL_NUMERIC;
    }

    public boolean isExplicit() {
        return mode == Mode.EXPLICIT;
    }
}
