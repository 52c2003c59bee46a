package com.olympiadregistration.application.bulk;

/**
 * One recognized column of a bulk import file.
 *
 * @param name exact header text
 * @param required whether every row must supply a value
 * @param uniqueInBatch whether a value may appear at most once in the file
 * @param commaSeparated whether the cell holds a comma-separated list
 */
public record ColumnSpec(String name, boolean required, boolean uniqueInBatch, boolean commaSeparated) {

    public static ColumnSpec optional(String name) {
        return new ColumnSpec(name, false, false, false);
    }

    public static ColumnSpec required(String name) {
        return new ColumnSpec(name, true, false, false);
    }

    public static ColumnSpec unique(String name, boolean required) {
        return new ColumnSpec(name, required, true, false);
    }

    public static ColumnSpec list(String name) {
        return new ColumnSpec(name, false, false, true);
    }
}
