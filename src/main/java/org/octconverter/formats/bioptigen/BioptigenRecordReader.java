package org.octconverter.formats.bioptigen;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.StandardCharsets;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.container.IDirectoryRecordReader;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.OutOfBoundsException;
import org.octconverter.io.ByteCursor;

/**
 * Reads {@code u32 keyLength, key, u32 dataLength} records; the data follows.
 */
final class BioptigenRecordReader implements IDirectoryRecordReader<BioptigenChunkType> {

    /** Longer keys mean the walk has lost its alignment. */
    static final int MAX_KEY_LENGTH = 64;

    @Override
    public Layout layout() {
        return Layout.SEQUENTIAL;
    }

    @Override
    public DirectoryEntry<BioptigenChunkType> next(ByteCursor cursor) throws DecodeException {
        if (cursor.remaining() < 4) {
            return null;
        }
        long at = cursor.absolutePosition();
        long keyLength = cursor.readU32(LITTLE_ENDIAN);
        if (keyLength == 0 || keyLength > MAX_KEY_LENGTH) {
            throw new OutOfBoundsException("Implausible key length " + keyLength, at, null);
        }
        String key = cursor.readFixedString((int) keyLength, StandardCharsets.US_ASCII);
        long dataLength = cursor.readU32(LITTLE_ENDIAN);
        return new DirectoryEntry<>(BioptigenChunkType.fromKey(key), key, cursor.absolutePosition(), dataLength);
    }

    @Override
    public Class<BioptigenChunkType> typeClass() {
        return BioptigenChunkType.class;
    }
}
