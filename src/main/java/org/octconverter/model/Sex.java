package org.octconverter.model;

public enum Sex {
    MALE,
    FEMALE,
    OTHER;

    /**
     * @param code {@code M}, {@code F} or {@code O}, case-insensitive
     * @return the sex, or {@code null} when the code is blank or unknown
     */
    public static Sex fromCode(String code) {
        if (code == null) {
            return null;
        }
        return switch (code.trim().toUpperCase()) {
            case "M" -> MALE;
            case "F" -> FEMALE;
            case "O" -> OTHER;
            default -> null;
        };
    }
}
