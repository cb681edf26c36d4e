package org.octconverter.formats.topcon;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.StandardCharsets;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.container.IDirectoryRecordReader;
import org.octconverter.errors.DecodeException;
import org.octconverter.io.ByteCursor;

/**
 * Reads the chunk headers of a Topcon file: {@code u8 nameLength}, the ASCII name,
 * {@code u32 size}, then the payload. A zero name length or the end of the file ends the directory.
 */
final class TopconRecordReader implements IDirectoryRecordReader<TopconChunkType> {

    @Override
    public Layout layout() {
        return Layout.SEQUENTIAL;
    }

    @Override
    public DirectoryEntry<TopconChunkType> next(ByteCursor cursor) throws DecodeException {
        if (cursor.remaining() == 0) {
            return null;
        }
        int nameLength = cursor.readU8();
        if (nameLength == 0) {
            return null;
        }
        String name = cursor.readFixedString(nameLength, StandardCharsets.US_ASCII);
        long size = cursor.readU32(LITTLE_ENDIAN);
        return new DirectoryEntry<>(TopconChunkType.fromTag(name), name, cursor.absolutePosition(), size);
    }

    @Override
    public Class<TopconChunkType> typeClass() {
        return TopconChunkType.class;
    }
}
