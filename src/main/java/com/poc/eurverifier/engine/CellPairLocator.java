package com.poc.eurverifier.engine;

import com.poc.eurverifier.exception.UnknownColumnException;
import com.poc.eurverifier.exception.VerificationConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * Aligns source and target grids into cell pairs, row-major in resolved column order.
 */
@Slf4j
public class CellPairLocator {

    static final String SOURCE = "source";
    static final String TARGET = "target";

    private final Predicate<Object> numericTest;

    /**
     * @param numericTest decides whether a raw source value counts as numeric
     *                    when discovering columns for {@link ColumnSelection.Mode#ALL_NUMERIC}
     */
    public CellPairLocator(Predicate<Object> numericTest) {
        this.numericTest = numericTest;
    }

    /**
     * Resolves the selection against both grids.
     *
     * @throws UnknownColumnException if an explicit column is missing from either grid
     * @throws VerificationConfigurationException if an explicit selection is empty
     */
    public List<String> resolveColumns(Grid source, Grid target, ColumnSelection selection) {
        if (selection.isExplicit()) {
            if (selection.getColumns().isEmpty()) {
                throw new VerificationConfigurationException("Please select at least one column");
            }
            for (String column : selection.getColumns()) {
                if (!source.hasColumn(column)) {
                    throw new UnknownColumnException(column, SOURCE);
                }
                if (!target.hasColumn(column)) {
                    throw new UnknownColumnException(column, TARGET);
                }
            }
            return selection.getColumns().stream().distinct().toList();
        }

        List<String> numericColumns = new ArrayList<>();
        for (String column : source.getHeaders()) {
            boolean numeric = source.getRows().stream()
                    .map(row -> row.get(column))
                    .anyMatch(numericTest);
            if (numeric) {
                numericColumns.add(column);
                if (!target.hasColumn(column)) {
                    log.warn("Numeric column '{}' is missing from the target file; its cells are reported as empty", column);
                }
            }
        }
        return numericColumns;
    }

    public RowAlignment alignRows(Grid source, Grid target) {
        return new RowAlignment(source.rowCount(), target.rowCount());
    }

    /**
     * Lazily produces pairs for every aligned row and resolved column. A column the
     * target does not have yields null target values.
     */
    public Stream<CellPair> producePairs(Grid source, Grid target, List<String> columns, RowAlignment alignment) {
        return IntStream.range(0, alignment.pairedRowCount())
                .boxed()
                .flatMap(rowIndex -> {
                    GridRow sourceRow = source.row(rowIndex);
                    GridRow targetRow = target.row(rowIndex);
                    return columns.stream().map(column -> new CellPair(
                            rowIndex,
                            sourceRow.getRowNumber(),
                            column,
                            sourceRow.get(column),
                            targetRow.get(column)));
                });
    }
}
