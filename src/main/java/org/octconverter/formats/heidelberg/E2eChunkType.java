package org.octconverter.formats.heidelberg;

/**
 * Chunk type codes of Heidelberg E2E files that are decoded. Everything else is {@link #UNKNOWN}.
 */
public enum E2eChunkType {
    PATIENT(9),
    LATERALITY(11),
    BSCAN_METADATA(10004),
    CONTOUR(10019),
    IMAGE(0x40000000L),
    UNKNOWN(-1);

    private final long code;

    E2eChunkType(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static E2eChunkType fromCode(long code) {
        for (E2eChunkType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return UNKNOWN;
    }

    /**
     * @return the name used as a record tag: the constant name, or {@code type-<code>} for unknown codes
     */
    public static String tagOf(long code) {
        E2eChunkType type = fromCode(code);
        return type == UNKNOWN ? "type-" + code : type.name();
    }
}
