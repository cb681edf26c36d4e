package org.octconverter.formats.bioptigen;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.container.DirectoryParser;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.formats.AbstractFormatReader;
import org.octconverter.formats.ReadOptions;
import org.octconverter.io.ByteCursor;
import org.octconverter.io.RawBuffer;
import org.octconverter.metadata.MetadataExtractor;
import org.octconverter.model.Decoded;
import org.octconverter.model.DeviceMetadata;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelSpacing;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;

/**
 * Bioptigen OCT: an 8-byte header followed by key/value records. Header keys describe the scan;
 * then every frame is introduced by an empty {@code FRAMEDATA} record and carries its own
 * time, line count and 16-bit samples.
 */
public final class BioptigenReader extends AbstractFormatReader<BioptigenChunkType> {

    static final String MANUFACTURER = "Bioptigen";
    static final int HEADER_SIZE = 8;
    static final String SIGNATURE_KEY = "FRAMECOUNT";

    private BioptigenReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions);
    }

    public static BioptigenReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static BioptigenReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return open(RawBuffer.map(path), defaultOptions);
    }

    public static BioptigenReader fromBytes(byte[] bytes) throws DecodeException {
        return open(RawBuffer.wrap(bytes, "memory.oct"), ReadOptions.defaults());
    }

    /**
     * Reads an already opened buffer, so a caller that sniffed it does not map the file twice.
     */
    public static BioptigenReader open(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        BioptigenReader reader = new BioptigenReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    /**
     * Tells whether a buffer starts like a Bioptigen file: the first key after the header is
     * {@code FRAMECOUNT}.
     */
    public static boolean hasSignature(ByteCursor file) {
        try {
            file.seek(HEADER_SIZE);
            long keyLength = file.readU32(LITTLE_ENDIAN);
            return keyLength == SIGNATURE_KEY.length()
                    && SIGNATURE_KEY.equals(file.readFixedString((int) keyLength, StandardCharsets.US_ASCII));
        } catch (DecodeException e) {
            return false;
        }
    }

    @Override
    public String formatName() {
        return "Bioptigen OCT";
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        if (!hasSignature(file)) {
            throw new UnrecognizedFormatException("First key is not " + SIGNATURE_KEY + ", not a Bioptigen file",
                    HEADER_SIZE, null);
        }
    }

    @Override
    protected Directory<BioptigenChunkType> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException {
        return DirectoryParser.parse(file, HEADER_SIZE, new BioptigenRecordReader(), diagnostics);
    }

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        Directory<BioptigenChunkType> directory = directory();
        ByteCursor file = file();
        DecodeDiagnostics shared = newDiagnostics();

        Long lineLength = headerU32(directory, file, BioptigenChunkType.LINELENGTH, shared);
        if (lineLength == null || lineLength == 0) {
            throw new UnrecognizedFormatException("Bioptigen header has no LINELENGTH");
        }
        int samplesPerLine = lineLength.intValue();
        Long declaredFrames = headerU32(directory, file, BioptigenChunkType.FRAMECOUNT, shared);

        VolumeAssembler assembler = new VolumeAssembler(fileStem(), newDiagnostics());
        LocalDateTime firstFrameTime = null;
        int frame = -1;
        long lines = 0;
        for (DirectoryEntry<BioptigenChunkType> entry : directory.entries()) {
            ByteCursor payload = file.slice(entry.offset(), entry.length());
            switch (entry.type()) {
                case FRAMEDATA -> {
                    frame++;
                    lines = 0;
                }
                case FRAMEDATETIME -> {
                    if (frame == 0 && firstFrameTime == null) {
                        firstFrameTime = MetadataExtractor.decodeOrWarn(BioptigenReader::systemTime, payload,
                                entry.tag(), shared);
                    }
                }
                case FRAMELINES -> {
                    Long value = MetadataExtractor.decodeOrWarn(p -> p.readU32(LITTLE_ENDIAN), payload,
                            entry.tag(), assembler.diagnostics());
                    lines = value == null ? 0 : value;
                }
                case FRAMESAMPLES -> {
                    if (frame < 0) {
                        shared.warn(ErrorKind.MALFORMED_CHUNK_CHAIN, "Frame samples before any FRAMEDATA",
                                entry.offset(), entry.tag());
                        continue;
                    }
                    int width = (int) (lines > 0 ? lines : entry.length() / 2 / samplesPerLine);
                    assembler.decodeSlice(frame, entry.tag(), () -> PixelDecoder.raw(payload, width, samplesPerLine,
                            16, LITTLE_ENDIAN, Storage.COLUMN_MAJOR));
                }
                default -> {
                }
            }
        }
        if (assembler.sliceCount() == 0) {
            return List.of();
        }
        if (declaredFrames != null && declaredFrames != assembler.sliceCount()) {
            shared.warn(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY, "FRAMECOUNT is " + declaredFrames + " but "
                    + assembler.sliceCount() + " frames were found", -1, BioptigenChunkType.FRAMECOUNT.name());
        }

        assembler.volume()
                .acquisitionDateTime(firstFrameTime)
                .device(DeviceMetadata.of(MANUFACTURER))
                .pixelSpacing(pixelSpacing(directory, file, samplesPerLine, assembler.sliceCount(), shared));
        return finishVolumes(List.of(assembler), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) {
        return List.of();
    }

    // SYSTEMTIME: year, month, day of week, day, hour, minute, second, milliseconds
    private static LocalDateTime systemTime(ByteCursor p) throws DecodeException {
        int year = p.readU16(LITTLE_ENDIAN);
        int month = p.readU16(LITTLE_ENDIAN);
        p.readU16(LITTLE_ENDIAN);
        int day = p.readU16(LITTLE_ENDIAN);
        int hour = p.readU16(LITTLE_ENDIAN);
        int minute = p.readU16(LITTLE_ENDIAN);
        int second = p.readU16(LITTLE_ENDIAN);
        int millis = p.readU16(LITTLE_ENDIAN);
        return year == 0 ? null : LocalDateTime.of(year, month, day, hour, minute, second, millis * 1_000_000);
    }

    /**
     * Scan extents in mm divided by the sample counts, when the header records them.
     */
    private static PixelSpacing pixelSpacing(Directory<BioptigenChunkType> directory, ByteCursor file,
                                             int samplesPerLine, int frames, DecodeDiagnostics diagnostics)
            throws DecodeException {
        Double length = headerF64(directory, file, BioptigenChunkType.SCANLENGTH, diagnostics);
        Double depth = headerF64(directory, file, BioptigenChunkType.SCANDEPTH, diagnostics);
        Double elevation = headerF64(directory, file, BioptigenChunkType.ELSCANLENGTH, diagnostics);
        Long lines = headerU32(directory, file, BioptigenChunkType.LINECOUNT, diagnostics);
        if (length == null || depth == null || lines == null || lines == 0) {
            return null;
        }
        double z = elevation != null && frames > 1 ? elevation / (frames - 1) : 0;
        return new PixelSpacing(length / lines, depth / samplesPerLine, z);
    }

    private static Long headerU32(Directory<BioptigenChunkType> directory, ByteCursor file, BioptigenChunkType key,
                                  DecodeDiagnostics diagnostics) throws DecodeException {
        var entry = directory.first(key);
        if (entry.isEmpty()) {
            return null;
        }
        return MetadataExtractor.decodeOrWarn(p -> p.readU32(LITTLE_ENDIAN),
                file.slice(entry.get().offset(), entry.get().length()), key.name(), diagnostics);
    }

    private static Double headerF64(Directory<BioptigenChunkType> directory, ByteCursor file, BioptigenChunkType key,
                                    DecodeDiagnostics diagnostics) throws DecodeException {
        var entry = directory.first(key);
        if (entry.isEmpty()) {
            return null;
        }
        return MetadataExtractor.decodeOrWarn(p -> p.readF64(LITTLE_ENDIAN),
                file.slice(entry.get().offset(), entry.get().length()), key.name(), diagnostics);
    }
}
