package org.octconverter.formats.optovue;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.container.IDirectoryRecordReader;
import org.octconverter.errors.DecodeException;
import org.octconverter.io.ByteCursor;

/**
 * Reads the fixed 24-byte records {@code u32 tag, u32 reserved, u64 offset, u64 length}.
 */
final class OptovueRecordReader implements IDirectoryRecordReader<OptovueChunkType> {

    static final int RECORD_SIZE = 24;

    private final long entryCount;
    private long read;

    OptovueRecordReader(long entryCount) {
        this.entryCount = entryCount;
    }

    @Override
    public Layout layout() {
        return Layout.TABLE;
    }

    @Override
    public DirectoryEntry<OptovueChunkType> next(ByteCursor cursor) throws DecodeException {
        if (read >= entryCount) {
            return null;
        }
        read++;
        long code = cursor.readU32(LITTLE_ENDIAN);
        cursor.skip(4);
        long offset = cursor.readU64(LITTLE_ENDIAN);
        long length = cursor.readU64(LITTLE_ENDIAN);
        OptovueChunkType type = OptovueChunkType.fromCode(code);
        String tag = type == OptovueChunkType.UNKNOWN ? "tag-" + code : type.name();
        return new DirectoryEntry<>(type, tag, offset, length);
    }

    @Override
    public Class<OptovueChunkType> typeClass() {
        return OptovueChunkType.class;
    }
}
