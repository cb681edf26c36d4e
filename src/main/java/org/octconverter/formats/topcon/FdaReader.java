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
 * Topcon FDA: compressed OCT slices in {@code @IMG_JPEG} (JPEG 2000), with the uncompressed
 * motion-corrected copy in {@code @IMG_MOT_COMP_03} used when no compressed scan exists.
 * Colour fundus in {@code @IMG_FUNDUS}.
 */
public final class FdaReader extends AbstractTopconReader {

    private static final int JPEG_HEADER = 25;
    private static final int MOT_COMP_HEADER = 22;

    private FdaReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions, "FDA");
    }

    public static FdaReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static FdaReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return create(RawBuffer.map(path), defaultOptions);
    }

    public static FdaReader fromBytes(byte[] bytes) throws DecodeException {
        return create(RawBuffer.wrap(bytes, "memory.fda"), ReadOptions.defaults());
    }

    private static FdaReader create(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        FdaReader reader = new FdaReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    @Override
    protected List<TopconChunkType> colourFundusTypes() {
        return List.of(TopconChunkType.IMG_FUNDUS);
    }

    @Override
    protected void decodeScans(Directory<TopconChunkType> directory, ByteCursor file, VolumeAssembler assembler)
            throws DecodeException {
        if (directory.contains(TopconChunkType.IMG_JPEG)) {
            for (DirectoryEntry<TopconChunkType> entry : directory.entries(TopconChunkType.IMG_JPEG)) {
                decodeCompressed(entry, file.slice(entry.offset(), entry.length()), assembler);
            }
        } else {
            for (DirectoryEntry<TopconChunkType> entry : directory.entries(TopconChunkType.IMG_MOT_COMP_03)) {
                decodeMotionCorrected(entry, file.slice(entry.offset(), entry.length()), file.size(), assembler);
            }
        }
    }

    private void decodeCompressed(DirectoryEntry<TopconChunkType> entry, ByteCursor payload,
                                  VolumeAssembler assembler) {
        int slices;
        try {
            payload.skip(17);
            slices = payload.readU32AsInt(LITTLE_ENDIAN);
            payload.seek(JPEG_HEADER);
        } catch (DecodeException e) {
            assembler.diagnostics().report(e, entry.tag());
            return;
        }
        // every slice carries at least its u32 length
        slices = credibleSliceCount(assembler, entry, slices, (payload.size() - JPEG_HEADER) / 4);
        int first = assembler.sliceCount();
        for (int s = 0; s < slices; s++) {
            ByteCursor image;
            try {
                long size = payload.readU32(LITTLE_ENDIAN);
                image = payload.readSlice(size);
            } catch (DecodeException e) {
                truncated(assembler, entry, first + s, first + slices,
                        "Slice " + s + " of " + slices + " extends beyond the chunk: " + e.getMessage());
                return;
            }
            assembler.decodeSlice(first + s, entry.tag(), () -> PixelDecoder.compressed(image, entry.tag()));
        }
    }

    private void decodeMotionCorrected(DirectoryEntry<TopconChunkType> entry, ByteCursor payload, long fileSize,
                                       VolumeAssembler assembler) {
        int width;
        int height;
        int bitDepth;
        int slices;
        try {
            payload.skip(1);
            width = payload.readU32AsInt(LITTLE_ENDIAN);
            height = payload.readU32AsInt(LITTLE_ENDIAN);
            bitDepth = payload.readU32AsInt(LITTLE_ENDIAN) == 16 ? 16 : 8;
            slices = payload.readU32AsInt(LITTLE_ENDIAN);
        } catch (DecodeException e) {
            assembler.diagnostics().report(e, entry.tag());
            return;
        }
        if (!validGeometry(assembler, entry, width, height)) {
            return;
        }
        long sliceBytes = (long) width * height * (bitDepth / 8);
        slices = credibleSliceCount(assembler, entry, slices, fileSize / sliceBytes);
        int first = assembler.sliceCount();
        long available = Math.max(0, Math.min(slices, (payload.size() - MOT_COMP_HEADER) / sliceBytes));
        for (int s = 0; s < available; s++) {
            long start = MOT_COMP_HEADER + s * sliceBytes;
            assembler.decodeSlice(first + s, entry.tag(), () -> PixelDecoder.raw(
                    payload.slice(start, sliceBytes), width, height, bitDepth, LITTLE_ENDIAN, Storage.ROW_MAJOR));
        }
        if (available < slices) {
            truncated(assembler, entry, first + (int) available, first + slices,
                    "Chunk holds " + available + " of " + slices + " declared slices");
        }
    }
}
