package org.octconverter.errors;

/**
 * A slice or image payload could not be turned into a pixel plane.
 */
public class PixelDecodeException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public PixelDecodeException(String message) {
        super(ErrorKind.PIXEL_DECODE, message);
    }

    public PixelDecodeException(String message, long offset, String tag) {
        super(ErrorKind.PIXEL_DECODE, message, offset, tag);
    }

    public PixelDecodeException(String message, long offset, String tag, Throwable cause) {
        super(ErrorKind.PIXEL_DECODE, message, offset, tag, cause);
    }
}
