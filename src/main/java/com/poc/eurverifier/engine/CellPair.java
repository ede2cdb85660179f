package com.poc.eurverifier.engine;

import lombok.Value;

/**
 * One source/target cell comparison unit.
 */
@Value
public class CellPair {
    int rowIndex;
    int rowNumber;
    String column;
    Object sourceValue;
    Object targetValue;
}
