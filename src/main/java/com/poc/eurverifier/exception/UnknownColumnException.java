package com.poc.eurverifier.exception;

import lombok.Getter;

/**
 * An explicitly selected column is missing from the source or target grid.
 */
@Getter
public class UnknownColumnException extends VerificationConfigurationException {

    private final String column;
    private final String gridName;

    public UnknownColumnException(String column, String gridName) {
        super(String.format("Column '%s' not found in %s file", column, gridName));
        this.column = column;
        this.gridName = gridName;
    }
}
