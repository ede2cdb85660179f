package com.poc.eurverifier.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DiscrepancyReason {
    VALUE_MISMATCH("Value mismatch"),
    TARGET_EMPTY("Target cell empty"),
    NON_NUMERIC_TARGET("Non-numeric data"),
    ROW_COUNT_MISMATCH("Row count mismatch");

    private final String label;
}
