package org.octconverter.errors;

/**
 * The buffer does not start with the signature a reader expects, or no structure could be
 * identified in it. Always fatal.
 */
public class UnrecognizedFormatException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public UnrecognizedFormatException(String message) {
        super(ErrorKind.UNRECOGNIZED_FORMAT, message);
    }

    public UnrecognizedFormatException(String message, long offset, String tag) {
        super(ErrorKind.UNRECOGNIZED_FORMAT, message, offset, tag);
    }
}
