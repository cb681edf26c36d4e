package org.octconverter.errors;

/**
 * A pointer chain revisits an offset or references itself.
 */
public class MalformedChunkChainException extends DecodeException {

    private static final long serialVersionUID = 1L;

    public MalformedChunkChainException(String message) {
        super(ErrorKind.MALFORMED_CHUNK_CHAIN, message);
    }

    public MalformedChunkChainException(String message, long offset, String tag) {
        super(ErrorKind.MALFORMED_CHUNK_CHAIN, message, offset, tag);
    }

    public MalformedChunkChainException(String message, long offset, String tag, Throwable cause) {
        super(ErrorKind.MALFORMED_CHUNK_CHAIN, message, offset, tag, cause);
    }
}
