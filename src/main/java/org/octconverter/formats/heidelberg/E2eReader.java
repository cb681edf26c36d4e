package org.octconverter.formats.heidelberg;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.octconverter.container.ChunkKey;
import org.octconverter.container.ChunkStream;
import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.MetadataFieldException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.formats.AbstractFormatReader;
import org.octconverter.formats.ReadOptions;
import org.octconverter.io.ByteCursor;
import org.octconverter.io.RawBuffer;
import org.octconverter.metadata.MetadataExtractor;
import org.octconverter.metadata.MetadataField;
import org.octconverter.metadata.MetadataRecord;
import org.octconverter.metadata.MetadataTable;
import org.octconverter.model.Contour;
import org.octconverter.model.Decoded;
import org.octconverter.model.DeviceMetadata;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelPlane;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heidelberg Engineering E2E (and SDB) files.
 * <p>
 * The main directory points at the newest directory block; blocks link to older ones through
 * their {@code prev} pointer. Each listed chunk starts with a 60-byte header that repeats its
 * key and type. Chunks are grouped by volume key {@code (patient, study, series)}, so one file
 * yields any number of volumes and fundus images; laterality and acquisition time are taken
 * from the chunks of the same volume key only.
 */
public final class E2eReader extends AbstractFormatReader<E2eChunkType> {

    private static final Logger LOG = LoggerFactory.getLogger(E2eReader.class);

    static final String MANUFACTURER = "Heidelberg Engineering";
    static final String FILE_MAGIC = "CMDb";
    static final String CHUNK_MAGIC = "MDbData";
    static final int FILE_HEADER_SIZE = 36;
    static final int CHUNK_HEADER_SIZE = 60;
    static final int IMAGE_HEADER_SIZE = 20;

    private static final MetadataTable<E2eChunkType> METADATA = E2eMetadata.initialize();

    private static final int IND_FUNDUS = 0;
    private static final int IND_OCT = 1;

    // chunk payload offset -> image kind, filled while the directory is parsed
    private final Map<Long, Integer> imageKinds = new HashMap<>();

    private E2eReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions);
    }

    public static E2eReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static E2eReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return create(RawBuffer.map(path), defaultOptions);
    }

    public static E2eReader fromBytes(byte[] bytes) throws DecodeException {
        return create(RawBuffer.wrap(bytes, "memory.e2e"), ReadOptions.defaults());
    }

    private static E2eReader create(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        E2eReader reader = new E2eReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    @Override
    public String formatName() {
        return "Heidelberg E2E";
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        if (file.size() < FILE_HEADER_SIZE + E2eDirectoryBlock.HEADER_SIZE
                || !FILE_MAGIC.equals(file.readFixedString(12, StandardCharsets.US_ASCII))) {
            throw new UnrecognizedFormatException("Missing CMDb signature, not an E2E file", 0, null);
        }
    }

    @Override
    protected Directory<E2eChunkType> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException {
        DecodeDiagnostics local = diagnostics.fork();
        file.seek(FILE_HEADER_SIZE);
        long head = E2eDirectoryBlock.readHeader(file)[1];

        List<E2eDirectoryBlock> blocks = ChunkStream.traverse(file, head, E2eDirectoryBlock.READER, local);
        List<DirectoryEntry<E2eChunkType>> entries = new ArrayList<>();
        imageKinds.clear();
        for (E2eDirectoryBlock block : blocks) {
            for (E2eDirectoryBlock.Entry listed : block.entries()) {
                if (!listed.isPlaceholder()) {
                    DirectoryEntry<E2eChunkType> entry = resolve(file, listed, local);
                    if (entry != null) {
                        entries.add(entry);
                    }
                }
            }
        }
        diagnostics.merge(local);
        if (entries.isEmpty()) {
            throw new UnrecognizedFormatException("E2E directory lists no readable chunk", FILE_HEADER_SIZE, null);
        }
        LOG.debug("{}: {} directory blocks, {} chunks", source(), blocks.size(), entries.size());
        return new Directory<>(E2eChunkType.class, entries, local.warnings());
    }

    /**
     * Reads the chunk header behind a directory line and checks it against the line.
     *
     * @return the payload entry, or {@code null} when the chunk is unusable (a warning is reported)
     */
    private DirectoryEntry<E2eChunkType> resolve(ByteCursor file, E2eDirectoryBlock.Entry listed,
                                                 DecodeDiagnostics diagnostics) {
        String tag = E2eChunkType.tagOf(listed.type());
        try {
            ByteCursor header = file.slice(listed.start(), CHUNK_HEADER_SIZE);
            String magic = header.readFixedString(12, StandardCharsets.US_ASCII);
            header.skip(12);
            long size = header.readU32(LITTLE_ENDIAN);
            header.skip(4);
            ChunkKey key = new ChunkKey(header.readU32(LITTLE_ENDIAN), header.readU32(LITTLE_ENDIAN),
                    header.readU32(LITTLE_ENDIAN), header.readI32(LITTLE_ENDIAN));
            int ind = header.readU16(LITTLE_ENDIAN);
            header.skip(2);
            long type = header.readU32(LITTLE_ENDIAN);

            if (!CHUNK_MAGIC.equals(magic) || type != listed.type() || !key.equals(listed.key())) {
                diagnostics.warn(ErrorKind.MALFORMED_CHUNK_CHAIN, "Chunk header disagrees with its directory entry",
                        listed.start(), tag);
                return null;
            }
            long payload = listed.start() + CHUNK_HEADER_SIZE;
            if (size > file.size() - payload) {
                diagnostics.warn(ErrorKind.OUT_OF_BOUNDS, "Chunk of " + size + " bytes extends beyond the file",
                        listed.start(), tag);
                return null;
            }
            if (type == E2eChunkType.IMAGE.code()) {
                imageKinds.put(payload, ind);
            }
            return new DirectoryEntry<>(E2eChunkType.fromCode(type), tag, payload, size, key);
        } catch (DecodeException e) {
            diagnostics.report(e, tag);
            return null;
        }
    }

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        Directory<E2eChunkType> directory = directory();
        ByteCursor file = file();
        DecodeDiagnostics shared = newDiagnostics();
        Metadata metadata = collectMetadata(directory, file, shared);

        Map<ChunkKey.VolumeKey, VolumeAssembler> volumes = new LinkedHashMap<>();
        Map<ChunkKey.VolumeKey, Map<String, Map<Integer, float[]>>> contours = new LinkedHashMap<>();
        for (DirectoryEntry<E2eChunkType> entry : directory.entries()) {
            ChunkKey key = entry.key();
            if (entry.type() == E2eChunkType.IMAGE && imageKind(entry) == IND_OCT) {
                VolumeAssembler assembler = volumes.computeIfAbsent(key.volumeKey(),
                        k -> new VolumeAssembler(k.toString(), newDiagnostics()));
                ByteCursor payload = file.slice(entry.offset(), entry.length());
                assembler.decodeSlice(sliceIndex(key), entry.tag(), () -> decodeOct(payload, options.e2eGamma()));
            } else if (entry.type() == E2eChunkType.CONTOUR) {
                ContourRow row = MetadataExtractor.decodeOrWarn(E2eReader::decodeContour,
                        file.slice(entry.offset(), entry.length()), entry.tag(), shared);
                if (row != null) {
                    contours.computeIfAbsent(key.volumeKey(), k -> new LinkedHashMap<>())
                            .computeIfAbsent(row.name(), n -> new TreeMap<>())
                            .put(sliceIndex(key), row.values());
                }
            }
        }

        contours.forEach((volumeKey, layers) -> {
            if (!volumes.containsKey(volumeKey)) {
                shared.warn(ErrorKind.METADATA_FIELD, layers.size() + " contour layer(s) of volume " + volumeKey
                        + " have no matching B-scans and are discarded", -1, E2eChunkType.CONTOUR.name());
            }
        });

        for (Map.Entry<ChunkKey.VolumeKey, VolumeAssembler> e : volumes.entrySet()) {
            MetadataRecord record = metadata.forVolume(e.getKey());
            OctVolume.Builder volume = e.getValue().volume()
                    .laterality(record.laterality())
                    .acquisitionDateTime(record.get(MetadataField.ACQUISITION_TIME).orElse(null))
                    .patient(record.patient())
                    .device(DeviceMetadata.of(MANUFACTURER));
            Map<String, Map<Integer, float[]>> layers = contours.getOrDefault(e.getKey(), Map.of());
            for (Map.Entry<String, Map<Integer, float[]>> layer : layers.entrySet()) {
                volume.addContour(toContour(layer.getKey(), layer.getValue(), e.getValue().sliceCount()));
            }
        }
        return finishVolumes(new ArrayList<>(volumes.values()), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) throws DecodeException {
        Directory<E2eChunkType> directory = directory();
        ByteCursor file = file();
        DecodeDiagnostics shared = newDiagnostics();
        Metadata metadata = collectMetadata(directory, file, shared);

        List<DirectoryEntry<E2eChunkType>> fundusEntries = new ArrayList<>();
        Map<ChunkKey.VolumeKey, Integer> perKey = new HashMap<>();
        for (DirectoryEntry<E2eChunkType> entry : directory.entries(E2eChunkType.IMAGE)) {
            if (imageKind(entry) == IND_FUNDUS) {
                fundusEntries.add(entry);
                perKey.merge(entry.key().volumeKey(), 1, Integer::sum);
            }
        }

        List<Decoded<FundusImage>> images = new ArrayList<>();
        Map<ChunkKey.VolumeKey, Integer> seen = new HashMap<>();
        for (DirectoryEntry<E2eChunkType> entry : fundusEntries) {
            ChunkKey.VolumeKey volumeKey = entry.key().volumeKey();
            int ordinal = seen.merge(volumeKey, 1, Integer::sum);
            String id = perKey.get(volumeKey) > 1 ? volumeKey + "#" + ordinal : volumeKey.toString();
            DecodeDiagnostics own = newDiagnostics();
            try {
                PixelPlane plane = decodeFundus(file.slice(entry.offset(), entry.length()));
                MetadataRecord record = metadata.forVolume(volumeKey);
                FundusImage image = FundusImage.of(id, plane)
                        .withLaterality(record.laterality())
                        .withAcquisitionDateTime(record.get(MetadataField.ACQUISITION_TIME).orElse(null))
                        .withPatient(record.patient())
                        .withDevice(DeviceMetadata.of(MANUFACTURER));
                images.add(decoded(image, shared, own));
            } catch (DecodeException e) {
                shared.report(e, entry.tag());
            }
        }
        return images;
    }

    private int imageKind(DirectoryEntry<E2eChunkType> entry) {
        return imageKinds.getOrDefault(entry.offset(), -1);
    }

    /**
     * Device slice index: slice ids count in steps of two starting at 2.
     */
    static int sliceIndex(ChunkKey key) {
        return key.sliceId() / 2 - 1;
    }

    // an OCT image stores `width` rows of `height` samples
    private static PixelPlane decodeOct(ByteCursor payload, double gamma) throws DecodeException {
        payload.skip(12);
        int rows = payload.readU32AsInt(LITTLE_ENDIAN);
        int columns = payload.readU32AsInt(LITTLE_ENDIAN);
        return PixelDecoder.ufloat16(payload, columns, rows, gamma);
    }

    private static PixelPlane decodeFundus(ByteCursor payload) throws DecodeException {
        payload.skip(12);
        int width = payload.readU32AsInt(LITTLE_ENDIAN);
        int height = payload.readU32AsInt(LITTLE_ENDIAN);
        return PixelDecoder.raw(payload, width, height, 8, LITTLE_ENDIAN, Storage.ROW_MAJOR);
    }

    private record ContourRow(String name, float[] values) {
    }

    private static ContourRow decodeContour(ByteCursor payload) throws DecodeException {
        payload.skip(4);
        long id = payload.readU32(LITTLE_ENDIAN);
        payload.skip(4);
        int width = payload.readU32AsInt(LITTLE_ENDIAN);
        if (width == 0) {
            return null;
        }
        if (!payload.hasRemaining(4L * width)) {
            throw new MetadataFieldException("Contour row of " + width
                    + " values needs " + 4L * width + " bytes, " + payload.remaining() + " available");
        }
        float[] values = new float[width];
        for (int i = 0; i < width; i++) {
            float v = payload.readF32(LITTLE_ENDIAN);
            values[i] = v < 1e-9f || v == Float.MAX_VALUE ? Float.NaN : v;
        }
        return new ContourRow("contour" + id, values);
    }

    private static Contour toContour(String name, Map<Integer, float[]> rows, int sliceCount) {
        int length = sliceCount;
        for (int index : rows.keySet()) {
            length = Math.max(length, index + 1);
        }
        float[][] values = new float[length][];
        rows.forEach((index, row) -> {
            if (index >= 0) {
                values[index] = row;
            }
        });
        return new Contour(name, values);
    }

    private Metadata collectMetadata(Directory<E2eChunkType> directory, ByteCursor file, DecodeDiagnostics shared) {
        Metadata metadata = new Metadata();
        for (DirectoryEntry<E2eChunkType> entry : directory.entries()) {
            if (!METADATA.handles(entry.type())) {
                continue;
            }
            ChunkKey key = entry.key();
            MetadataRecord target = entry.type() == E2eChunkType.PATIENT
                    ? metadata.patients.computeIfAbsent(key.patientId(), id -> new MetadataRecord())
                    : metadata.volumes.computeIfAbsent(key.volumeKey(), k -> new MetadataRecord());
            // the first B-scan of a volume carries its acquisition time
            if (entry.type() == E2eChunkType.BSCAN_METADATA && target.contains(MetadataField.ACQUISITION_TIME)) {
                continue;
            }
            MetadataExtractor.extract(METADATA, entry, file, target, shared);
        }
        return metadata;
    }

    /**
     * Metadata of one read: patient records by patient id, the rest by volume key.
     */
    private static final class Metadata {
        private final Map<Long, MetadataRecord> patients = new HashMap<>();
        private final Map<ChunkKey.VolumeKey, MetadataRecord> volumes = new HashMap<>();

        MetadataRecord forVolume(ChunkKey.VolumeKey key) {
            MetadataRecord record = new MetadataRecord();
            record.inheritFrom(volumes.getOrDefault(key, new MetadataRecord()));
            record.inheritFrom(patients.getOrDefault(key.patientId(), new MetadataRecord()));
            return record;
        }
    }
}
