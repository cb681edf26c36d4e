package org.octconverter.pixel;

/**
 * Sample order of an uncompressed plane.
 */
public enum Storage {
    /** Consecutive samples run along a row. */
    ROW_MAJOR,
    /** Consecutive samples run down a column, one A-scan after another. */
    COLUMN_MAJOR
}
