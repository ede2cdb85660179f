package com.poc.eurverifier.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class Discrepancy {
    /**
     * 0-based index of the data row. Null for findings that concern the whole grid.
     */
    Integer rowIndex;

    /**
     * Row number as shown in the spreadsheet (header is row 1).
     */
    Integer rowNumber;

    String column;

    /** BGN amount read from the source file. */
    BigDecimal sourceValue;

    /** EUR amount computed from the source value. */
    BigDecimal expectedValue;

    /** EUR amount read from the target file, rounded to cents. */
    BigDecimal actualValue;

    /** actual - expected */
    BigDecimal delta;

    DiscrepancyReason reason;
    String details;
}
