package org.octconverter.formats.topcon;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.StandardCharsets;
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
import org.octconverter.model.Contour;
import org.octconverter.model.Decoded;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelPlane;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.VolumeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Common decoding of the Topcon FDS and FDA containers.
 * <p>
 * Both start with {@code "FOCT"}, the three-letter kind and two version words, followed by a
 * sequential chunk directory. One file holds at most one OCT volume; repeated scan chunks
 * append slices to it in directory order.
 */
public abstract class AbstractTopconReader extends AbstractFormatReader<TopconChunkType> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTopconReader.class);

    static final String MANUFACTURER = "Topcon";
    static final int HEADER_SIZE = 15;

    private static final byte[] MAGIC = "FOCT".getBytes(StandardCharsets.US_ASCII);
    private static final MetadataTable<TopconChunkType> METADATA = TopconMetadata.initialize();

    private final String kind;

    protected AbstractTopconReader(RawBuffer buffer, ReadOptions defaultOptions, String kind) {
        super(buffer, defaultOptions);
        this.kind = kind;
    }

    @Override
    public String formatName() {
        return "Topcon " + kind;
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        byte[] expected = ("FOCT" + kind).getBytes(StandardCharsets.US_ASCII);
        if (!file.matches(MAGIC)) {
            throw new UnrecognizedFormatException("Missing FOCT signature, not a " + formatName() + " file", 0, null);
        }
        if (!file.matches(expected) || file.size() < HEADER_SIZE) {
            throw new UnrecognizedFormatException("Topcon file is not of kind " + kind, 4, null);
        }
    }

    @Override
    protected Directory<TopconChunkType> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException {
        return DirectoryParser.parse(file, HEADER_SIZE, new TopconRecordReader(), diagnostics);
    }

    /**
     * Decodes the OCT slices of the file into {@code assembler}, numbering them from 0 in
     * directory order.
     */
    protected abstract void decodeScans(Directory<TopconChunkType> directory, ByteCursor file,
                                        VolumeAssembler assembler) throws DecodeException;

    /**
     * @return the chunk types holding the colour fundus photograph, in order of preference
     */
    protected abstract List<TopconChunkType> colourFundusTypes();

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        Directory<TopconChunkType> directory = directory();
        ByteCursor file = file();
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, file, shared);

        VolumeAssembler assembler = new VolumeAssembler(fileStem(), newDiagnostics());
        decodeScans(directory, file, assembler);
        if (assembler.sliceCount() == 0 && !assembler.diagnostics().hasWarnings()) {
            LOG.debug("{}: no OCT scan chunk", source());
            return List.of();
        }

        OctVolume.Builder volume = assembler.volume()
                .laterality(metadata.laterality())
                .acquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                .patient(metadata.patient())
                .device(metadata.device(MANUFACTURER))
                .pixelSpacing(metadata.get(MetadataField.PIXEL_SPACING).orElse(null));
        for (DirectoryEntry<TopconChunkType> entry : directory.entries(TopconChunkType.CONTOUR_INFO)) {
            Contour contour = MetadataExtractor.decodeOrWarn(TopconMetadata::contour,
                    file.slice(entry.offset(), entry.length()), entry.tag(), assembler.diagnostics());
            if (contour != null) {
                volume.addContour(contour);
            }
        }
        return finishVolumes(List.of(assembler), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) throws DecodeException {
        Directory<TopconChunkType> directory = directory();
        ByteCursor file = file();
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, file, shared);

        List<Decoded<FundusImage>> images = new ArrayList<>();
        for (TopconChunkType type : colourFundusTypes()) {
            DecodeDiagnostics own = newDiagnostics();
            PixelPlane plane = lastDecodable(directory.entries(type), file, own);
            if (plane != null) {
                images.add(decoded(withMetadata(FundusImage.of(type.tag(), plane), metadata), shared, own));
                break;
            }
            if (own.hasWarnings()) {
                shared.merge(own);
            }
        }

        int trcIndex = 0;
        for (DirectoryEntry<TopconChunkType> entry : directory.entries(TopconChunkType.IMG_TRC_02)) {
            DecodeDiagnostics own = newDiagnostics();
            for (PixelPlane plane : decodeTrc(entry, file, own)) {
                String id = entry.tag() + "#" + trcIndex++;
                images.add(decoded(withMetadata(FundusImage.of(id, plane), metadata), shared, own));
            }
        }
        return images;
    }

    /**
     * A later colour fundus chunk replaces an earlier one; the last one that decodes is used.
     */
    private PixelPlane lastDecodable(List<DirectoryEntry<TopconChunkType>> entries, ByteCursor file,
                                     DecodeDiagnostics diagnostics) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            DirectoryEntry<TopconChunkType> entry = entries.get(i);
            try {
                ByteCursor payload = file.slice(entry.offset(), entry.length());
                payload.skip(20);
                long size = payload.readU32(LITTLE_ENDIAN);
                PixelPlane plane = PixelDecoder.compressed(payload.readSlice(size), entry.tag());
                if (i > 0) {
                    LOG.info("{}: using {} #{}, {} earlier entries superseded", source(), entry.tag(), i, i);
                }
                return plane;
            } catch (DecodeException e) {
                diagnostics.report(e, entry.tag());
            }
        }
        return null;
    }

    private List<PixelPlane> decodeTrc(DirectoryEntry<TopconChunkType> entry, ByteCursor file,
                                       DecodeDiagnostics diagnostics) {
        List<PixelPlane> planes = new ArrayList<>();
        try {
            ByteCursor payload = file.slice(entry.offset(), entry.length());
            payload.skip(12);
            long count = payload.readU32(LITTLE_ENDIAN);
            payload.skip(4);
            for (long i = 0; i < count; i++) {
                long size = payload.readU32(LITTLE_ENDIAN);
                ByteCursor image = payload.readSlice(size);
                try {
                    planes.add(PixelDecoder.compressed(image, entry.tag()));
                } catch (DecodeException e) {
                    diagnostics.report(e, entry.tag());
                }
            }
        } catch (DecodeException e) {
            diagnostics.report(e, entry.tag());
        }
        return planes;
    }

    private MetadataRecord extractMetadata(Directory<TopconChunkType> directory, ByteCursor file,
                                           DecodeDiagnostics diagnostics) {
        MetadataRecord record = new MetadataRecord();
        for (DirectoryEntry<TopconChunkType> entry : directory.entries()) {
            MetadataExtractor.extract(METADATA, entry, file, record, diagnostics);
        }
        return record;
    }

    private FundusImage withMetadata(FundusImage image, MetadataRecord metadata) {
        return image.withLaterality(metadata.laterality())
                .withAcquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                .withPatient(metadata.patient())
                .withDevice(metadata.device(MANUFACTURER));
    }

    /**
     * Caps the slice count a chunk header declares at the number of slices the container could hold.
     * An overstated count is reported once.
     *
     * @param capacity upper bound derived from the smallest possible encoding of one slice
     * @return the count to decode, never above {@code capacity}
     */
    protected static int credibleSliceCount(VolumeAssembler assembler, DirectoryEntry<TopconChunkType> entry,
                                            int declared, long capacity) {
        if (declared <= capacity) {
            return declared;
        }
        int credible = (int) Math.max(0, capacity);
        assembler.diagnostics().warn(ErrorKind.OUT_OF_BOUNDS,
                "Chunk declares " + declared + " slices but has room for at most " + credible,
                entry.offset(), entry.tag());
        return credible;
    }

    /**
     * Rejects a slice geometry with no samples. Reported once for the chunk.
     *
     * @return {@code true} if the geometry holds at least one sample
     */
    protected static boolean validGeometry(VolumeAssembler assembler, DirectoryEntry<TopconChunkType> entry,
                                           int width, int height) {
        if (width > 0 && height > 0) {
            return true;
        }
        assembler.diagnostics().warn(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY,
                "Chunk declares an empty " + width + "x" + height + " slice geometry", entry.offset(), entry.tag());
        return false;
    }

    /**
     * Marks the slices of a chunk that lie beyond its payload as missing, with one warning for the chunk.
     */
    protected static void truncated(VolumeAssembler assembler, DirectoryEntry<TopconChunkType> entry,
                                    int firstMissing, int endIndex, String reason) {
        assembler.diagnostics().warn(ErrorKind.OUT_OF_BOUNDS, reason, entry.offset(), entry.tag());
        for (int i = firstMissing; i < endIndex; i++) {
            assembler.markMissing(i);
        }
    }
}
