package org.octconverter.formats.heidelberg;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.octconverter.container.ChunkKey;
import org.octconverter.container.IChainNodeReader;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.OutOfBoundsException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.io.ByteCursor;

/**
 * One block of the E2E directory list: a 52-byte header followed by 44-byte entries.
 *
 * @param offset     absolute offset of the block
 * @param current    the block's {@code current} pointer
 * @param prev       the next block to visit, 0 at the end
 * @param entries    the listed chunks, placeholders included
 */
record E2eDirectoryBlock(long offset, long current, long prev, List<Entry> entries) {

    static final int HEADER_SIZE = 52;
    static final int ENTRY_SIZE = 44;
    static final String MAGIC = "MDbMDir";

    /**
     * A directory line. {@code start <= pos} marks an unused placeholder.
     */
    record Entry(long pos, long start, long size, ChunkKey key, long type) {

        boolean isPlaceholder() {
            return start <= pos;
        }
    }

    /**
     * Reads the main directory or a directory block header at the cursor.
     *
     * @return {@code numEntries, current, prev}
     */
    static long[] readHeader(ByteCursor cursor) throws DecodeException {
        long at = cursor.absolutePosition();
        String magic = cursor.readFixedString(12, StandardCharsets.US_ASCII);
        if (!MAGIC.equals(magic)) {
            throw new UnrecognizedFormatException("Expected " + MAGIC + " directory header, found '" + magic + "'",
                    at, MAGIC);
        }
        cursor.skip(4 + 20);
        long numEntries = cursor.readU32(LITTLE_ENDIAN);
        long current = cursor.readU32(LITTLE_ENDIAN);
        long prev = cursor.readU32(LITTLE_ENDIAN);
        cursor.skip(4);
        return new long[] {numEntries, current, prev};
    }

    static final IChainNodeReader<E2eDirectoryBlock> READER = new IChainNodeReader<>() {

        @Override
        public int minimumNodeSize() {
            return HEADER_SIZE;
        }

        @Override
        public E2eDirectoryBlock read(ByteCursor file, long offset) throws DecodeException {
            ByteCursor cursor = file.slice(offset, file.size() - offset);
            long[] header = readHeader(cursor);
            long numEntries = header[0];
            if (!cursor.hasRemaining(numEntries * ENTRY_SIZE)) {
                throw new OutOfBoundsException("Directory block lists " + numEntries + " entries but only "
                        + cursor.remaining() + " bytes follow", offset, MAGIC);
            }
            List<Entry> entries = new ArrayList<>((int) numEntries);
            for (long i = 0; i < numEntries; i++) {
                long pos = cursor.readU32(LITTLE_ENDIAN);
                long start = cursor.readU32(LITTLE_ENDIAN);
                long size = cursor.readU32(LITTLE_ENDIAN);
                cursor.skip(4);
                long patientId = cursor.readU32(LITTLE_ENDIAN);
                long studyId = cursor.readU32(LITTLE_ENDIAN);
                long seriesId = cursor.readU32(LITTLE_ENDIAN);
                int sliceId = cursor.readI32(LITTLE_ENDIAN);
                cursor.skip(4);
                long type = cursor.readU32(LITTLE_ENDIAN);
                cursor.skip(4);
                entries.add(new Entry(pos, start, size, new ChunkKey(patientId, studyId, seriesId, sliceId), type));
            }
            return new E2eDirectoryBlock(offset, header[1], header[2], entries);
        }

        @Override
        public long next(E2eDirectoryBlock node) {
            return node.prev();
        }
    };
}
