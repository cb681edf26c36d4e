package org.octconverter.metadata;

import org.octconverter.errors.DecodeException;
import org.octconverter.io.ByteCursor;

/**
 * Decodes one metadata field from a record payload.
 *
 * @param <V> field value type
 */
@FunctionalInterface
public interface IFieldDecoder<V> {

    /**
     * @param payload cursor over the whole record payload, positioned at 0
     * @return the value, or {@code null} when the record does not carry the field
     * @throws DecodeException if the field is malformed
     */
    V decode(ByteCursor payload) throws DecodeException;
}
