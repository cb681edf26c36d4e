package org.octconverter.model;

/**
 * Which eye a scan or photograph belongs to.
 */
public enum Laterality {
    LEFT,
    RIGHT,
    UNKNOWN;

    /**
     * Maps the single-letter codes used by most vendors and by DICOM.
     *
     * @param code {@code L}/{@code OS} or {@code R}/{@code OD}, case-insensitive
     * @return the laterality, {@link #UNKNOWN} for anything else
     */
    public static Laterality fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        return switch (code.trim().toUpperCase()) {
            case "L", "OS" -> LEFT;
            case "R", "OD" -> RIGHT;
            default -> UNKNOWN;
        };
    }
}
