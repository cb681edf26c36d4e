package org.octconverter.errors;

/**
 * Slices collected for one volume disagree on width, height or bit depth.
 */
public class InconsistentVolumeGeometryException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public InconsistentVolumeGeometryException(String message) {
        super(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY, message);
    }

    public InconsistentVolumeGeometryException(String message, long offset, String tag) {
        super(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY, message, offset, tag);
    }

    public InconsistentVolumeGeometryException(String message, long offset, String tag, Throwable cause) {
        super(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY, message, offset, tag, cause);
    }
}
