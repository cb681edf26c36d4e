package org.octconverter.formats.optovue;

/**
 * Record tags of the Optovue directory table.
 */
public enum OptovueChunkType {
    BSCAN(1),
    FUNDUS(2),
    PATIENT(3),
    ACQUISITION(4),
    DEVICE(5),
    UNKNOWN(-1);

    private final long code;

    OptovueChunkType(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    public static OptovueChunkType fromCode(long code) {
        for (OptovueChunkType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
