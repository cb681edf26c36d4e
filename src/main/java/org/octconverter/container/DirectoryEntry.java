package org.octconverter.container;

import java.util.Optional;

/**
 * One record of a container directory, resolved to an absolute byte range.
 *
 * @param type   chunk type, the format's {@code UNKNOWN} constant when not recognised
 * @param tag    identifier as stored in the file
 * @param offset absolute offset of the payload
 * @param length payload length in bytes
 * @param key    structured key for multi-volume containers, or {@code null}
 * @param <T>    the format's chunk type enum
 */
public record DirectoryEntry<T extends Enum<T>>(T type, String tag, long offset, long length, ChunkKey key) {

    public DirectoryEntry(T type, String tag, long offset, long length) {
        this(type, tag, offset, length, null);
    }

    /**
     * @return the first offset after the payload; may exceed the buffer for unchecked entries
     */
    public long end() {
        return offset + length;
    }

    public Optional<ChunkKey> chunkKey() {
        return Optional.ofNullable(key);
    }

    @Override
    public String toString() {
        return type + "(" + tag + ") @" + offset + "+" + length + (key != null ? " " + key : "");
    }
}
