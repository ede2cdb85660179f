package com.poc.eurverifier.engine;

import com.poc.eurverifier.dto.Discrepancy;
import com.poc.eurverifier.dto.DiscrepancyReason;
import com.poc.eurverifier.dto.VerificationReport;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Compares a BGN source grid against its EUR target copy, cell by cell.
 * <p>
 * Holds no per-run state, so one instance serves concurrent callers. Data-quality
 * problems are reported in the returned {@link VerificationReport}; only a column
 * selection that cannot be resolved raises an exception.
 */
@Slf4j
public class VerificationEngine {

    private final RateConverter converter;
    private final CellPairLocator locator;

    public VerificationEngine(RateConverter converter, CellPairLocator locator) {
        this.converter = converter;
        this.locator = locator;
    }

    public VerificationReport verify(Grid source, Grid target, ColumnSelection selection) {
        List<String> columns = locator.resolveColumns(source, target, selection);
        RowAlignment alignment = locator.alignRows(source, target);
        log.info("Verifying {} columns over {} rows (source rows: {}, target rows: {})",
                columns.size(), alignment.pairedRowCount(), alignment.getSourceRowCount(), alignment.getTargetRowCount());

        Run run = new Run();
        if (alignment.isRowCountMismatch()) {
            run.record(Discrepancy.builder()
                    .reason(DiscrepancyReason.ROW_COUNT_MISMATCH)
                    .details(String.format("Source has %d rows, target has %d rows; compared the first %d",
                            alignment.getSourceRowCount(), alignment.getTargetRowCount(), alignment.pairedRowCount()))
                    .build());
        }

        Iterator<CellPair> pairs = locator.producePairs(source, target, columns, alignment).iterator();
        while (pairs.hasNext()) {
            check(pairs.next(), run);
        }

        VerificationReport report = new VerificationReport(run.discrepancies, run.checked, run.skipped,
                columns, alignment.getSourceRowCount(), alignment.getTargetRowCount());
        log.info("Verification finished: passed={}, checked={}, skipped={}, discrepancies={}",
                report.isPassed(), report.getCheckedCount(), report.getSkippedCount(), report.getDiscrepancyCount());
        return report;
    }

    private void check(CellPair pair, Run run) {
        MonetaryValue source;
        try {
            source = converter.toMonetary(pair.getSourceValue(), Currency.BGN);
        } catch (NonNumericValueException e) {
            run.skipped++;
            return;
        }

        if (isEmpty(pair.getTargetValue())) {
            run.record(discrepancy(pair, source, null, null)
                    .reason(DiscrepancyReason.TARGET_EMPTY)
                    .details("Target cell is empty")
                    .build());
            return;
        }

        MonetaryValue expected = converter.convertBgnToEur(source);

        MonetaryValue actual;
        try {
            actual = converter.roundToCents(converter.toMonetary(pair.getTargetValue(), Currency.EUR));
        } catch (NonNumericValueException e) {
            run.record(discrepancy(pair, source, expected, null)
                    .reason(DiscrepancyReason.NON_NUMERIC_TARGET)
                    .details("Target cell is not numeric: '" + pair.getTargetValue() + "'")
                    .build());
            return;
        }

        run.checked++;
        if (!expected.isSameAmount(actual)) {
            run.record(discrepancy(pair, source, expected, actual)
                    .delta(actual.subtract(expected).getAmount())
                    .reason(DiscrepancyReason.VALUE_MISMATCH)
                    .details(String.format("Expected %s, found %s", expected, actual))
                    .build());
        }
    }

    private static Discrepancy.DiscrepancyBuilder discrepancy(CellPair pair, MonetaryValue source,
                                                             MonetaryValue expected, MonetaryValue actual) {
        return Discrepancy.builder()
                .rowIndex(pair.getRowIndex())
                .rowNumber(pair.getRowNumber())
                .column(pair.getColumn())
                .sourceValue(source.getAmount())
                .expectedValue(expected == null ? null : expected.getAmount())
                .actualValue(actual == null ? null : actual.getAmount());
    }

    private static boolean isEmpty(Object value) {
        return value == null || (value instanceof CharSequence && value.toString().isBlank());
    }

    private static final class Run {
        private final List<Discrepancy> discrepancies = new ArrayList<>();
        private int checked;
        private int skipped;

        private void record(Discrepancy discrepancy) {
            log.debug("Discrepancy at row {} column '{}': {}",
                    discrepancy.getRowNumber(), discrepancy.getColumn(), discrepancy.getDetails());
            discrepancies.add(discrepancy);
        }
    }
}
