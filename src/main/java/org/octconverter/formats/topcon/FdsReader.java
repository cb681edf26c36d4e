package org.octconverter.formats.topcon;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeException;
import org.octconverter.formats.ReadOptions;
import org.octconverter.io.ByteCursor;
import org.octconverter.io.RawBuffer;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;

/**
 * Topcon FDS: uncompressed 16-bit OCT in {@code @IMG_SCAN_03}, colour fundus in {@code @IMG_OBS}.
 */
public final class FdsReader extends AbstractTopconReader {

    private static final int SCAN_HEADER = 25;

    private FdsReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions, "FDS");
    }

    public static FdsReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static FdsReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return create(RawBuffer.map(path), defaultOptions);
    }

    public static FdsReader fromBytes(byte[] bytes) throws DecodeException {
        return create(RawBuffer.wrap(bytes, "memory.fds"), ReadOptions.defaults());
    }

    private static FdsReader create(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        FdsReader reader = new FdsReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    @Override
    protected List<TopconChunkType> colourFundusTypes() {
        return List.of(TopconChunkType.IMG_OBS);
    }

    @Override
    protected void decodeScans(Directory<TopconChunkType> directory, ByteCursor file, VolumeAssembler assembler)
            throws DecodeException {
        for (DirectoryEntry<TopconChunkType> entry : directory.entries(TopconChunkType.IMG_SCAN_03)) {
            ByteCursor payload = file.slice(entry.offset(), entry.length());
            int width;
            int height;
            int slices;
            try {
                payload.skip(9);
                width = payload.readU32AsInt(LITTLE_ENDIAN);
                height = payload.readU32AsInt(LITTLE_ENDIAN);
                slices = payload.readU32AsInt(LITTLE_ENDIAN);
            } catch (DecodeException e) {
                assembler.diagnostics().report(e, entry.tag());
                continue;
            }
            if (!validGeometry(assembler, entry, width, height)) {
                continue;
            }
            long sliceBytes = 2L * width * height;
            slices = credibleSliceCount(assembler, entry, slices, file.size() / sliceBytes);
            int first = assembler.sliceCount();
            long available = Math.max(0, Math.min(slices, (payload.size() - SCAN_HEADER) / sliceBytes));
            for (int s = 0; s < available; s++) {
                long start = SCAN_HEADER + s * sliceBytes;
                assembler.decodeSlice(first + s, entry.tag(), () -> PixelDecoder.raw(
                        payload.slice(start, sliceBytes), width, height, 16, LITTLE_ENDIAN, Storage.ROW_MAJOR));
            }
            if (available < slices) {
                truncated(assembler, entry, first + (int) available, first + slices,
                        "Chunk holds " + available + " of " + slices + " declared slices");
            }
        }
    }
}
