package org.octconverter.model;

import org.octconverter.errors.ErrorKind;

/**
 * A non-fatal problem found while decoding, attached to the entity it affected.
 *
 * @param kind    problem category
 * @param message human-readable description
 * @param offset  absolute byte offset of the offending record, or -1 when unknown
 * @param tag     tag or chunk name of the offending record, or {@code null}
 */
public record DecodeWarning(ErrorKind kind, String message, long offset, String tag) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(kind).append(": ").append(message);
        if (tag != null) {
            sb.append(" [tag=").append(tag).append(']');
        }
        if (offset >= 0) {
            sb.append(" [offset=").append(offset).append(']');
        }
        return sb.toString();
    }
}
