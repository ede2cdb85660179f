package com.poc.eurverifier.dto;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one verification run. {@code passed} holds exactly when no discrepancy was found.
 */
@Value
public class VerificationReport {
    boolean passed;
    List<Discrepancy> discrepancies;
    int checkedCount;
    int skippedCount;
    List<String> columns;
    int sourceRowCount;
    int targetRowCount;

    public VerificationReport(List<Discrepancy> discrepancies, int checkedCount, int skippedCount,
                              List<String> columns, int sourceRowCount, int targetRowCount) {
        this.discrepancies = List.copyOf(discrepancies);
        this.passed = this.discrepancies.isEmpty();
        this.checkedCount = checkedCount;
        this.skippedCount = skippedCount;
        this.columns = List.copyOf(columns);
        this.sourceRowCount = sourceRowCount;
        this.targetRowCount = targetRowCount;
    }

    public int getDiscrepancyCount() {
        return discrepancies.size();
    }
}
