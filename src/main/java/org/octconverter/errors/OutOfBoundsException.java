package org.octconverter.errors;

/**
 * A read or a record range extends beyond the end of its buffer.
 */
public class OutOfBoundsException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public OutOfBoundsException(String message) {
        super(ErrorKind.OUT_OF_BOUNDS, message);
    }

    public OutOfBoundsException(String message, long offset, String tag) {
        super(ErrorKind.OUT_OF_BOUNDS, message, offset, tag);
    }

    /**
     * Builds the exception for a rejected range read.
     *
     * @param offset requested start, relative to the buffer
     * @param length requested length
     * @param size   buffer length
     * @param base   absolute offset of the buffer within its file
     * @return the exception, carrying the absolute offset when it is representable
     */
    public static OutOfBoundsException forRange(long offset, long length, long size, long base) {
        String message = "Range [offset=" + Long.toUnsignedString(offset) + ", length="
                + Long.toUnsignedString(length) + "] exceeds buffer of " + size + " bytes";
        long absolute = offset >= 0 && base >= 0 && offset <= Long.MAX_VALUE - base ? base + offset : -1;
        return new OutOfBoundsException(message, absolute, null);
    }
}
