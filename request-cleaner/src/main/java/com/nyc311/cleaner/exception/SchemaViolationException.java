package com.nyc311.cleaner.exception;

import java.util.List;

/**
 * Thrown when the input is missing one or more of the fixed source columns.
 * Fatal for the whole run: nothing is cleaned or written.
 */
public class SchemaViolationException extends RuntimeException {

    private final List<String> missingColumns;

    public SchemaViolationException(List<String> missingColumns, String where) {
        super("Input is missing required column(s) " + missingColumns + " (" + where + ")");
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
