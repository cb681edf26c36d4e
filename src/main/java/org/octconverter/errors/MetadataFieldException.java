package org.octconverter.errors;

/**
 * A single metadata field could not be decoded.
 */
public class MetadataFieldException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public MetadataFieldException(String message) {
        super(ErrorKind.METADATA_FIELD, message);
    }

    public MetadataFieldException(String message, long offset, String tag) {
        super(ErrorKind.METADATA_FIELD, message, offset, tag);
    }

    public MetadataFieldException(String message, long offset, String tag, Throwable cause) {
        super(ErrorKind.METADATA_FIELD, message, offset, tag, cause);
    }
}
