package org.octconverter.formats.optovue;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
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
import org.octconverter.metadata.MetadataField;
import org.octconverter.metadata.MetadataRecord;
import org.octconverter.metadata.MetadataTable;
import org.octconverter.model.Decoded;
import org.octconverter.model.FundusImage;
import org.octconverter.model.Laterality;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelPlane;
import org.octconverter.model.Sex;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;

/**
 * Optovue OCT: a 64-byte header naming the scan geometry and the location of a flat record
 * table. B-scan records hold one raw slice each, in slice order.
 */
public final class OptovueReader extends AbstractFormatReader<OptovueChunkType> {

    static final String MANUFACTURER = "Optovue";
    static final String MAGIC = "OPTOVUE";
    static final int HEADER_SIZE = 64;

    private static final Charset TEXT = StandardCharsets.ISO_8859_1;
    private static final DateTimeFormatter BIRTH_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ACQUIRED = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final MetadataTable<OptovueChunkType> METADATA = initializeMetadata();

    private OptovueReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions);
    }

    public static OptovueReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static OptovueReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return open(RawBuffer.map(path), defaultOptions);
    }

    public static OptovueReader fromBytes(byte[] bytes) throws DecodeException {
        return open(RawBuffer.wrap(bytes, "memory.OCT"), ReadOptions.defaults());
    }

    /**
     * Reads an already opened buffer, so a caller that sniffed it does not map the file twice.
     */
    public static OptovueReader open(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        OptovueReader reader = new OptovueReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    private static MetadataTable<OptovueChunkType> initializeMetadata() {
        MetadataTable<OptovueChunkType> table = new MetadataTable<>(OptovueChunkType.class);
        table.register(OptovueChunkType.PATIENT, MetadataField.PATIENT_ID, p -> p.readFixedString(64, TEXT));
        table.register(OptovueChunkType.PATIENT, MetadataField.SURNAME,
                p -> nameParts(p.seek(64).readFixedString(64, TEXT))[0]);
        table.register(OptovueChunkType.PATIENT, MetadataField.FIRST_NAME,
                p -> nameParts(p.seek(64).readFixedString(64, TEXT))[1]);
        table.register(OptovueChunkType.PATIENT, MetadataField.BIRTH_DATE, p -> {
            String text = p.seek(128).readFixedString(8, TEXT);
            return text.isEmpty() ? null : LocalDate.parse(text, BIRTH_DATE);
        });
        table.register(OptovueChunkType.PATIENT, MetadataField.SEX,
                p -> Sex.fromCode(p.seek(136).readFixedString(1, TEXT)));
        table.register(OptovueChunkType.ACQUISITION, MetadataField.ACQUISITION_TIME, p -> {
            String text = p.readFixedString(14, TEXT);
            return text.isEmpty() ? null : LocalDateTime.parse(text, ACQUIRED);
        });
        table.register(OptovueChunkType.DEVICE, MetadataField.DEVICE_MODEL, p -> p.readFixedString(32, TEXT));
        table.register(OptovueChunkType.DEVICE, MetadataField.DEVICE_SERIAL,
                p -> p.seek(32).readFixedString(32, TEXT));
        return table;
    }

    /**
     * Splits {@code Surname^Given} or {@code Surname, Given}; a single name is the surname.
     */
    static String[] nameParts(String name) {
        int split = name.indexOf('^');
        if (split < 0) {
            split = name.indexOf(',');
        }
        if (split < 0) {
            return new String[] {name, null};
        }
        return new String[] {name.substring(0, split).trim(), name.substring(split + 1).trim()};
    }

    @Override
    public String formatName() {
        return "Optovue OCT";
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        if (file.size() < HEADER_SIZE || !MAGIC.equals(file.readFixedString(8, StandardCharsets.US_ASCII))) {
            throw new UnrecognizedFormatException("Missing OPTOVUE signature, not an Optovue file", 0, null);
        }
    }

    @Override
    protected Directory<OptovueChunkType> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException {
        Header header = Header.read(file);
        return DirectoryParser.parse(file, header.directoryOffset(), new OptovueRecordReader(header.entryCount()),
                diagnostics);
    }

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        Directory<OptovueChunkType> directory = directory();
        ByteCursor file = file();
        Header header = Header.read(file());
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, file, shared);

        List<DirectoryEntry<OptovueChunkType>> scans = directory.entries(OptovueChunkType.BSCAN);
        if (scans.isEmpty()) {
            return List.of();
        }
        VolumeAssembler assembler = new VolumeAssembler(fileStem(), newDiagnostics());
        for (int i = 0; i < scans.size(); i++) {
            DirectoryEntry<OptovueChunkType> entry = scans.get(i);
            ByteCursor payload = file.slice(entry.offset(), entry.length());
            assembler.decodeSlice(i, entry.tag(), () -> PixelDecoder.raw(payload, header.width(), header.height(),
                    header.bitDepth(), LITTLE_ENDIAN, Storage.ROW_MAJOR));
        }
        if (header.slices() != scans.size()) {
            shared.warn(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY, "Header declares "
                    + header.slices() + " slices, table lists " + scans.size(), 20, "header");
        }
        assembler.volume()
                .laterality(header.laterality())
                .acquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                .patient(metadata.patient())
                .device(metadata.device(MANUFACTURER));
        return finishVolumes(List.of(assembler), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) throws DecodeException {
        Directory<OptovueChunkType> directory = directory();
        ByteCursor file = file();
        Header header = Header.read(file());
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, file, shared);

        List<Decoded<FundusImage>> images = new ArrayList<>();
        int index = 0;
        for (DirectoryEntry<OptovueChunkType> entry : directory.entries(OptovueChunkType.FUNDUS)) {
            DecodeDiagnostics own = newDiagnostics();
            try {
                ByteCursor payload = file.slice(entry.offset(), entry.length());
                int width = payload.readU32AsInt(LITTLE_ENDIAN);
                int height = payload.readU32AsInt(LITTLE_ENDIAN);
                PixelPlane plane = PixelDecoder.raw(payload, width, height, 8, LITTLE_ENDIAN, Storage.ROW_MAJOR);
                FundusImage image = FundusImage.of("fundus-" + index++, plane)
                        .withLaterality(header.laterality())
                        .withAcquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                        .withPatient(metadata.patient())
                        .withDevice(metadata.device(MANUFACTURER));
                images.add(decoded(image, shared, own));
            } catch (DecodeException e) {
                shared.report(e, entry.tag());
            }
        }
        return images;
    }

    private static MetadataRecord extractMetadata(Directory<OptovueChunkType> directory, ByteCursor file,
                                                  DecodeDiagnostics diagnostics) {
        MetadataRecord record = new MetadataRecord();
        for (DirectoryEntry<OptovueChunkType> entry : directory.entries()) {
            MetadataExtractor.extract(METADATA, entry, file, record, diagnostics);
        }
        return record;
    }

    /**
     * The fixed file header.
     */
    record Header(long version, int width, int height, long slices, int bitDepth, long directoryOffset,
                  long entryCount, Laterality laterality) {

        static Header read(ByteCursor file) throws DecodeException {
            file.seek(8);
            long version = file.readU32(LITTLE_ENDIAN);
            int width = file.readU32AsInt(LITTLE_ENDIAN);
            int height = file.readU32AsInt(LITTLE_ENDIAN);
            long slices = file.readU32(LITTLE_ENDIAN);
            int bitDepth = file.readU32AsInt(LITTLE_ENDIAN) == 16 ? 16 : 8;
            long directoryOffset = file.readU32(LITTLE_ENDIAN);
            long entryCount = file.readU32(LITTLE_ENDIAN);
            Laterality laterality = Laterality.fromCode(String.valueOf((char) file.readU8()));
            return new Header(version, width, height, slices, bitDepth, directoryOffset, entryCount, laterality);
        }
    }
}
