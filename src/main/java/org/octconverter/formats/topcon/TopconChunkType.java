package org.octconverter.formats.topcon;

import java.util.HashMap;
import java.util.Map;

/**
 * Chunk names of Topcon FDS and FDA files that are decoded. Everything else is {@link #UNKNOWN}.
 */
public enum TopconChunkType {
    IMG_SCAN_03("@IMG_SCAN_03"),
    IMG_JPEG("@IMG_JPEG"),
    IMG_MOT_COMP_03("@IMG_MOT_COMP_03"),
    IMG_FUNDUS("@IMG_FUNDUS"),
    IMG_OBS("@IMG_OBS"),
    IMG_TRC_02("@IMG_TRC_02"),
    PATIENT_INFO_02("@PATIENT_INFO_02"),
    CAPTURE_INFO_02("@CAPTURE_INFO_02"),
    HW_INFO_03("@HW_INFO_03"),
    CONTOUR_INFO("@CONTOUR_INFO"),
    PARAM_SCAN_04("@PARAM_SCAN_04"),
    UNKNOWN(null);

    private static final Map<String, TopconChunkType> BY_TAG = new HashMap<>();

    static {
        for (TopconChunkType t : values()) {
            if (t.tag != null) {
                BY_TAG.put(t.tag, t);
            }
        }
    }

    private final String tag;

    TopconChunkType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static TopconChunkType fromTag(String tag) {
        return BY_TAG.getOrDefault(tag, UNKNOWN);
    }
}
