package org.octconverter.formats.bioptigen;

/**
 * Keys of the Bioptigen tagged directory. The constant name is the key as stored.
 */
public enum BioptigenChunkType {
    FRAMECOUNT,
    LINECOUNT,
    LINELENGTH,
    SAMPLEFORMAT,
    DESCRIPTION,
    XMIN,
    XMAX,
    XCAPTION,
    YMIN,
    YMAX,
    YCAPTION,
    SCANTYPE,
    SCANDEPTH,
    SCANLENGTH,
    AZSCANLENGTH,
    ELSCANLENGTH,
    OBJECTDISTANCE,
    SCANANGLE,
    SCANS,
    FRAMES,
    DOPPLERFLAG,
    CONFIG,
    FRAMEDATA,
    FRAMEDATETIME,
    FRAMETIMESTAMP,
    FRAMELINES,
    FRAMESAMPLES,
    DOPPLERSAMPLES,
    UNKNOWN;

    public static BioptigenChunkType fromKey(String key) {
        for (BioptigenChunkType t : values()) {
            if (t != UNKNOWN && t.name().equals(key)) {
                return t;
            }
        }
        return UNKNOWN;
    }
}
