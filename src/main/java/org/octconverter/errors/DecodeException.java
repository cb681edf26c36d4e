package org.octconverter.errors;

import java.io.IOException;
import java.util.Optional;
import java.util.OptionalLong;

import org.octconverter.model.DecodeWarning;

/**
 * Base class of all decoding failures.
 * <p>
 * Carries the {@link ErrorKind} plus, when known, the absolute byte offset and the record tag
 * that caused the failure. Errors local to one record are converted to warnings with
 * {@link #toWarning()} at the record boundary; the rest propagate to the caller.
 */
public class DecodeException extends IOException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final long offset;
    private final String tag;

    public DecodeException(ErrorKind kind, String message) {
        this(kind, message, -1, null, null);
    }

    public DecodeException(ErrorKind kind, String message, long offset, String tag) {
        this(kind, message, offset, tag, null);
    }

    public DecodeException(ErrorKind kind, String message, long offset, String tag, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.offset = offset;
        this.tag = tag;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * @return the absolute offset of the offending record, if known.
     */
    public OptionalLong offset() {
        return offset >= 0 ? OptionalLong.of(offset) : OptionalLong.empty();
    }

    /**
     * @return the tag or chunk name of the offending record, if known.
     */
    public Optional<String> tag() {
        return Optional.ofNullable(tag);
    }

    /**
     * Converts this failure into a non-fatal warning with the same kind, offset and tag.
     *
     * @return the equivalent warning.
     */
    public DecodeWarning toWarning() {
        return new DecodeWarning(kind, super.getMessage(), offset, tag);
    }

    /**
     * Like {@link #toWarning()}, naming {@code fallbackTag} when the failure carries no tag of its own.
     */
    public DecodeWarning toWarning(String fallbackTag) {
        return new DecodeWarning(kind, super.getMessage(), offset, tag != null ? tag : fallbackTag);
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));
        if (tag != null) {
            sb.append(" [tag=").append(tag).append(']');
        }
        if (offset >= 0) {
            sb.append(" [offset=").append(offset).append(']');
        }
        return sb.toString();
    }
}
