package org.octconverter.errors;

/**
 * Categories of decoding failures.
 * <p>
 * The same categories are used for fatal {@link DecodeException}s and for the non-fatal
 * {@link org.octconverter.model.DecodeWarning}s attached to decoded entities.
 */
public enum ErrorKind {

    /** Bad magic or header, or no recognisable structure in the file. Always fatal. */
    UNRECOGNIZED_FORMAT,

    /** A read or record range exceeds the buffer. Fatal to the record being read. */
    OUT_OF_BOUNDS,

    /** A pointer chain revisits an offset or points at itself. Traversal of that chain stops. */
    MALFORMED_CHUNK_CHAIN,

    /** One slice or image failed to decode. The slice is marked missing. */
    PIXEL_DECODE,

    /** Slices of one volume disagree on width, height or bit depth. Fatal for that volume. */
    INCONSISTENT_VOLUME_GEOMETRY,

    /** One metadata field is malformed. The field is reported as absent. */
    METADATA_FIELD
}
