package com.poc.eurverifier.engine;

import lombok.Value;

/**
 * Positional pairing of source and target rows; only the overlapping rows are compared.
 */
@Value
public class RowAlignment {
    int sourceRowCount;
    int targetRowCount;

    public int pairedRowCount() {
        return Math.min(sourceRowCount, targetRowCount);
    }

    public boolean isRowCountMismatch() {
        return sourceRowCount != targetRowCount;
    }
}
