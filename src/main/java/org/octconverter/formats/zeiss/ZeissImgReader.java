package org.octconverter.formats.zeiss;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.formats.AbstractFormatReader;
import org.octconverter.formats.ReadOptions;
import org.octconverter.io.ByteCursor;
import org.octconverter.io.RawBuffer;
import org.octconverter.model.Decoded;
import org.octconverter.model.DeviceMetadata;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelPlane;
import org.octconverter.pixel.Deinterlacer;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;

/**
 * Zeiss Cirrus IMG: a headerless stream of 8-bit frames.
 * <p>
 * Each frame holds {@code cols} A-scans of {@code rows} samples, stored A-scan after A-scan.
 * The frame size is not recorded in the file and comes from {@link ReadOptions}.
 */
public final class ZeissImgReader extends AbstractFormatReader<ZeissChunkType> {

    static final String MANUFACTURER = "Carl Zeiss Meditec";

    private ZeissImgReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions);
    }

    public static ZeissImgReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static ZeissImgReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return create(RawBuffer.map(path), defaultOptions);
    }

    public static ZeissImgReader fromBytes(byte[] bytes, ReadOptions defaultOptions) throws DecodeException {
        return create(RawBuffer.wrap(bytes, "memory.img"), defaultOptions);
    }

    private static ZeissImgReader create(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        ZeissImgReader reader = new ZeissImgReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    @Override
    public String formatName() {
        return "Zeiss IMG";
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        requireFrame(file, defaultOptions());
    }

    private static long requireFrame(ByteCursor file, ReadOptions options) throws UnrecognizedFormatException {
        long frameSize = (long) options.zeissRows() * options.zeissCols();
        if (file.size() < frameSize) {
            throw new UnrecognizedFormatException("File of " + file.size() + " bytes is smaller than one "
                    + options.zeissRows() + "x" + options.zeissCols() + " frame", 0, null);
        }
        return frameSize;
    }

    @Override
    protected Directory<ZeissChunkType> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics) {
        long frameSize = (long) defaultOptions().zeissRows() * defaultOptions().zeissCols();
        List<DirectoryEntry<ZeissChunkType>> entries = new ArrayList<>();
        long frames = file.size() / frameSize;
        for (long i = 0; i < frames; i++) {
            entries.add(new DirectoryEntry<>(ZeissChunkType.FRAME, "frame-" + i, i * frameSize, frameSize));
        }
        long trailer = file.size() - frames * frameSize;
        if (trailer > 0 || entries.isEmpty()) {
            entries.add(new DirectoryEntry<>(ZeissChunkType.TRAILER, "trailer", frames * frameSize, trailer));
        }
        return new Directory<>(ZeissChunkType.class, entries, List.of());
    }

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        ByteCursor file = file();
        long frameSize = requireFrame(file, options);
        int rows = options.zeissRows();
        int cols = options.zeissCols();
        long frames = file.size() / frameSize;
        DecodeDiagnostics shared = newDiagnostics();
        long trailer = file.size() - frames * frameSize;
        if (trailer > 0) {
            shared.warn(ErrorKind.OUT_OF_BOUNDS, "Ignoring " + trailer + " trailing bytes that do not form a "
                    + rows + "x" + cols + " frame", frames * frameSize, "trailer");
        }
        if (frames > Integer.MAX_VALUE / 2) {
            throw new UnrecognizedFormatException("Implausible frame count " + frames);
        }

        VolumeAssembler assembler = new VolumeAssembler(fileStem(), newDiagnostics());
        for (int i = 0; i < frames; i++) {
            ByteCursor frame = file.slice(i * frameSize, frameSize);
            String tag = "frame-" + i;
            if (!options.deinterlace()) {
                assembler.decodeSlice(i, tag,
                        () -> PixelDecoder.raw(frame, cols, rows, 8, LITTLE_ENDIAN, Storage.COLUMN_MAJOR));
                continue;
            }
            PixelPlane plane;
            try {
                plane = PixelDecoder.raw(frame, cols, rows, 8, LITTLE_ENDIAN, Storage.COLUMN_MAJOR);
            } catch (DecodeException e) {
                assembler.diagnostics().report(e, tag);
                assembler.markMissing(2 * i);
                assembler.markMissing(2 * i + 1);
                continue;
            }
            List<PixelPlane> fields = Deinterlacer.split(plane);
            assembler.decodeSlice(2 * i, tag, () -> fields.get(0));
            assembler.decodeSlice(2 * i + 1, tag, () -> fields.get(1));
        }
        assembler.volume().device(DeviceMetadata.of(MANUFACTURER));
        return finishVolumes(List.of(assembler), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) {
        return List.of();
    }
}
