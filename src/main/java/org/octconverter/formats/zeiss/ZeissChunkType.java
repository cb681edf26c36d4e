package org.octconverter.formats.zeiss;

/**
 * Regions of a Zeiss IMG stream, which has no directory of its own.
 */
public enum ZeissChunkType {
    /** One complete B-scan frame. */
    FRAME,
    /** Bytes after the last complete frame. */
    TRAILER,
    UNKNOWN
}
