package org.octconverter.formats.dicom;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.PixelDecodeException;
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
import org.octconverter.model.PixelSpacing;
import org.octconverter.model.Sex;
import org.octconverter.pixel.IPlaneDecoder;
import org.octconverter.pixel.PixelDecoder;
import org.octconverter.pixel.Storage;
import org.octconverter.pixel.VolumeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DICOM Part 10 files written by OCT devices.
 * <p>
 * Modality {@code OPT} is read as one volume whose frames are the slices; any other modality
 * (typically {@code OP}) yields one fundus image per frame. Native pixel data and encapsulated
 * fragments decodable by ImageIO are supported.
 */
public final class DicomReader extends AbstractFormatReader<DicomTag> {

    private static final Logger LOG = LoggerFactory.getLogger(DicomReader.class);

    static final String MAGIC = "DICM";
    static final String OCT_MODALITY = "OPT";
    static final String UNKNOWN_MANUFACTURER = "unknown";

    private static final DateTimeFormatter DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final MetadataTable<DicomTag> METADATA = initializeMetadata();

    private DicomReader(RawBuffer buffer, ReadOptions defaultOptions) {
        super(buffer, defaultOptions);
    }

    public static DicomReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    public static DicomReader open(Path path, ReadOptions defaultOptions) throws IOException {
        return create(RawBuffer.map(path), defaultOptions);
    }

    public static DicomReader fromBytes(byte[] bytes) throws DecodeException {
        return create(RawBuffer.wrap(bytes, "memory.dcm"), ReadOptions.defaults());
    }

    private static DicomReader create(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        DicomReader reader = new DicomReader(buffer, defaultOptions);
        reader.verify();
        return reader;
    }

    private static MetadataTable<DicomTag> initializeMetadata() {
        MetadataTable<DicomTag> table = new MetadataTable<>(DicomTag.class);
        table.register(DicomTag.PATIENT_ID, MetadataField.PATIENT_ID, DicomReader::textOrNull);
        table.register(DicomTag.PATIENT_NAME, MetadataField.SURNAME, p -> nameComponent(DicomParser.text(p), 0));
        table.register(DicomTag.PATIENT_NAME, MetadataField.FIRST_NAME, p -> nameComponent(DicomParser.text(p), 1));
        table.register(DicomTag.PATIENT_BIRTH_DATE, MetadataField.BIRTH_DATE, p -> {
            String text = DicomParser.text(p);
            return text.isEmpty() ? null : LocalDate.parse(text, DATE);
        });
        table.register(DicomTag.PATIENT_SEX, MetadataField.SEX, p -> Sex.fromCode(DicomParser.text(p)));
        table.register(DicomTag.LATERALITY, MetadataField.LATERALITY, DicomReader::laterality);
        table.register(DicomTag.IMAGE_LATERALITY, MetadataField.LATERALITY, DicomReader::laterality);
        table.register(DicomTag.MANUFACTURER_MODEL_NAME, MetadataField.DEVICE_MODEL, DicomReader::textOrNull);
        table.register(DicomTag.DEVICE_SERIAL_NUMBER, MetadataField.DEVICE_SERIAL, DicomReader::textOrNull);
        return table;
    }

    private static String textOrNull(ByteCursor payload) throws DecodeException {
        String text = DicomParser.text(payload);
        return text.isEmpty() ? null : text;
    }

    private static Laterality laterality(ByteCursor payload) throws DecodeException {
        Laterality laterality = Laterality.fromCode(DicomParser.text(payload));
        return laterality == Laterality.UNKNOWN ? null : laterality;
    }

    /**
     * @return one {@code ^}-separated component of a person name, or {@code null} when empty
     */
    static String nameComponent(String personName, int index) {
        String[] parts = personName.split("\\^", -1);
        if (index >= parts.length || parts[index].isBlank()) {
            return null;
        }
        return parts[index].trim();
    }

    /**
     * Combines a DA and an optional TM value. Fractional seconds are dropped; times may omit
     * minutes and seconds.
     */
    static LocalDateTime dateTime(String date, String time) {
        LocalDate day = LocalDate.parse(date.substring(0, 8), DATE);
        if (time == null || time.isEmpty()) {
            return day.atStartOfDay();
        }
        String digits = time.replace(":", "");
        int dot = digits.indexOf('.');
        if (dot >= 0) {
            digits = digits.substring(0, dot);
        }
        int hour = Integer.parseInt(digits.substring(0, 2));
        int minute = digits.length() >= 4 ? Integer.parseInt(digits.substring(2, 4)) : 0;
        int second = digits.length() >= 6 ? Integer.parseInt(digits.substring(4, 6)) : 0;
        return day.atTime(LocalTime.of(hour, minute, second));
    }

    @Override
    public String formatName() {
        return "DICOM";
    }

    @Override
    protected void checkSignature(ByteCursor file) throws DecodeException {
        if (file.size() < DicomParser.PREAMBLE + 4
                || !MAGIC.equals(file.seek(DicomParser.PREAMBLE).readFixedString(4, StandardCharsets.US_ASCII))) {
            throw new UnrecognizedFormatException("Missing DICM prefix after the preamble, not a DICOM file",
                    DicomParser.PREAMBLE, null);
        }
    }

    @Override
    protected Directory<DicomTag> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException {
        return DicomParser.parse(file, diagnostics);
    }

    @Override
    public List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException {
        Directory<DicomTag> directory = directory();
        if (!OCT_MODALITY.equals(text(directory, DicomTag.MODALITY).orElse(""))) {
            return List.of();
        }
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, shared);
        List<IPlaneDecoder> frames = frames(directory, shared);
        if (frames.isEmpty()) {
            return List.of();
        }
        VolumeAssembler assembler = new VolumeAssembler(fileStem(), newDiagnostics());
        for (int i = 0; i < frames.size(); i++) {
            assembler.decodeSlice(i, "frame-" + i, frames.get(i));
        }
        assembler.volume()
                .laterality(metadata.laterality())
                .acquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                .patient(metadata.patient())
                .device(metadata.device(manufacturer(directory)))
                .pixelSpacing(metadata.get(MetadataField.PIXEL_SPACING).orElse(null));
        return finishVolumes(List.of(assembler), shared);
    }

    @Override
    public List<Decoded<FundusImage>> readFundusImages(ReadOptions options) throws DecodeException {
        Directory<DicomTag> directory = directory();
        if (OCT_MODALITY.equals(text(directory, DicomTag.MODALITY).orElse(""))) {
            return List.of();
        }
        DecodeDiagnostics shared = newDiagnostics();
        MetadataRecord metadata = extractMetadata(directory, shared);
        List<IPlaneDecoder> frames = frames(directory, shared);
        String manufacturer = manufacturer(directory);
        List<Decoded<FundusImage>> images = new ArrayList<>();
        for (int i = 0; i < frames.size(); i++) {
            DecodeDiagnostics own = newDiagnostics();
            String id = frames.size() == 1 ? fileStem() : fileStem() + "#" + i;
            try {
                FundusImage image = FundusImage.of(id, frames.get(i).decode())
                        .withLaterality(metadata.laterality())
                        .withAcquisitionDateTime(metadata.get(MetadataField.ACQUISITION_TIME).orElse(null))
                        .withPatient(metadata.patient())
                        .withDevice(metadata.device(manufacturer));
                images.add(decoded(image, shared, own));
            } catch (DecodeException e) {
                shared.report(e, "frame-" + i);
            }
        }
        return images;
    }

    private MetadataRecord extractMetadata(Directory<DicomTag> directory, DecodeDiagnostics diagnostics)
            throws DecodeException {
        ByteCursor file = file();
        MetadataRecord record = new MetadataRecord();
        for (DirectoryEntry<DicomTag> entry : directory.entries()) {
            MetadataExtractor.extract(METADATA, entry, file, record, diagnostics);
        }
        acquisitionTime(directory, diagnostics).ifPresent(t -> record.put(MetadataField.ACQUISITION_TIME, t));
        pixelSpacing(directory, diagnostics).ifPresent(s -> record.put(MetadataField.PIXEL_SPACING, s));
        return record;
    }

    private Optional<LocalDateTime> acquisitionTime(Directory<DicomTag> directory, DecodeDiagnostics diagnostics)
            throws DecodeException {
        Optional<String> dateTime = text(directory, DicomTag.ACQUISITION_DATE_TIME);
        Optional<String> date = text(directory, DicomTag.ACQUISITION_DATE);
        Optional<String> time = text(directory, DicomTag.ACQUISITION_TIME);
        if (date.isEmpty()) {
            date = text(directory, DicomTag.CONTENT_DATE);
            time = text(directory, DicomTag.CONTENT_TIME);
        }
        try {
            if (dateTime.isPresent() && dateTime.get().length() >= 8) {
                String value = dateTime.get();
                return Optional.of(dateTime(value.substring(0, 8), value.length() > 8 ? value.substring(8) : null));
            }
            if (date.isPresent()) {
                return Optional.of(dateTime(date.get(), time.orElse(null)));
            }
        } catch (RuntimeException e) {
            diagnostics.warn(ErrorKind.METADATA_FIELD, "Invalid acquisition date/time: " + e.getMessage(), -1,
                    DicomTag.format(DicomTag.ACQUISITION_DATE_TIME.tag()));
        }
        return Optional.empty();
    }

    private Optional<PixelSpacing> pixelSpacing(Directory<DicomTag> directory, DecodeDiagnostics diagnostics)
            throws DecodeException {
        Optional<String> inPlane = text(directory, DicomTag.PIXEL_SPACING);
        if (inPlane.isEmpty()) {
            return Optional.empty();
        }
        try {
            // row spacing first: the distance between rows is the depth resolution
            String[] values = inPlane.get().split("\\\\");
            double y = Double.parseDouble(values[0].trim());
            double x = values.length > 1 ? Double.parseDouble(values[1].trim()) : y;
            double z = Double.parseDouble(text(directory, DicomTag.SPACING_BETWEEN_SLICES).orElse("0").trim());
            return Optional.of(new PixelSpacing(x, y, z));
        } catch (NumberFormatException e) {
            diagnostics.warn(ErrorKind.METADATA_FIELD, "Invalid pixel spacing '" + inPlane.get() + "'", -1,
                    DicomTag.format(DicomTag.PIXEL_SPACING.tag()));
            return Optional.empty();
        }
    }

    /**
     * @return one decoder per frame; empty when the file carries no pixel data
     */
    private List<IPlaneDecoder> frames(Directory<DicomTag> directory, DecodeDiagnostics diagnostics)
            throws DecodeException {
        ByteCursor file = file();
        List<DirectoryEntry<DicomTag>> fragments = directory.entries(DicomTag.PIXEL_FRAGMENT);
        int frameCount = Math.max(1, parseInt(text(directory, DicomTag.NUMBER_OF_FRAMES).orElse("1")));
        List<IPlaneDecoder> frames = new ArrayList<>();

        if (!fragments.isEmpty()) {
            if (fragments.size() == frameCount) {
                for (DirectoryEntry<DicomTag> fragment : fragments) {
                    ByteCursor payload = file.slice(fragment.offset(), fragment.length());
                    frames.add(() -> PixelDecoder.compressed(payload, fragment.tag()));
                }
            } else if (frameCount == 1) {
                ByteArrayOutputStream joined = new ByteArrayOutputStream();
                for (DirectoryEntry<DicomTag> fragment : fragments) {
                    joined.writeBytes(file.slice(fragment.offset(), fragment.length()).readBytes(fragment.length()));
                }
                byte[] bytes = joined.toByteArray();
                frames.add(() -> PixelDecoder.compressed(ByteCursor.wrap(bytes), fragments.get(0).tag()));
            } else {
                diagnostics.warn(ErrorKind.PIXEL_DECODE, frameCount + " frames declared but " + fragments.size()
                        + " fragments found, reading one frame per fragment", fragments.get(0).offset(),
                        DicomTag.format(DicomTag.PIXEL_DATA.tag()));
                for (DirectoryEntry<DicomTag> fragment : fragments) {
                    ByteCursor payload = file.slice(fragment.offset(), fragment.length());
                    frames.add(() -> PixelDecoder.compressed(payload, fragment.tag()));
                }
            }
            return frames;
        }

        Optional<DirectoryEntry<DicomTag>> pixelData = directory.first(DicomTag.PIXEL_DATA);
        if (pixelData.isEmpty()) {
            LOG.debug("{}: no pixel data", source());
            return frames;
        }
        int rows = us(directory, DicomTag.ROWS);
        int columns = us(directory, DicomTag.COLUMNS);
        int bits = us(directory, DicomTag.BITS_ALLOCATED);
        int samples = directory.contains(DicomTag.SAMPLES_PER_PIXEL) ? us(directory, DicomTag.SAMPLES_PER_PIXEL) : 1;
        if (samples == 3 && bits != 8 || samples != 1 && samples != 3) {
            throw new PixelDecodeException("Unsupported pixel layout: " + samples + " samples of " + bits + " bits",
                    pixelData.get().offset(), pixelData.get().tag());
        }
        long frameBytes = (long) rows * columns * samples * (bits / 8);
        DirectoryEntry<DicomTag> entry = pixelData.get();
        for (int i = 0; i < frameCount; i++) {
            long offset = entry.offset() + i * frameBytes;
            if (frameBytes == 0 || (i + 1) * frameBytes > entry.length()) {
                diagnostics.warn(ErrorKind.OUT_OF_BOUNDS, "Pixel data holds " + i + " of " + frameCount
                        + " declared frames", offset, entry.tag());
                break;
            }
            ByteCursor payload = file.slice(offset, frameBytes);
            frames.add(samples == 3
                    ? () -> PixelDecoder.rgbInterleaved(payload, columns, rows)
                    : () -> PixelDecoder.raw(payload, columns, rows, bits, LITTLE_ENDIAN, Storage.ROW_MAJOR));
        }
        return frames;
    }

    private String manufacturer(Directory<DicomTag> directory) throws DecodeException {
        return text(directory, DicomTag.MANUFACTURER).orElse(UNKNOWN_MANUFACTURER);
    }

    private Optional<String> text(Directory<DicomTag> directory, DicomTag tag) throws DecodeException {
        Optional<DirectoryEntry<DicomTag>> entry = directory.first(tag);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        String value = DicomParser.text(file().slice(entry.get().offset(), entry.get().length()));
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private int us(Directory<DicomTag> directory, DicomTag tag) throws DecodeException {
        DirectoryEntry<DicomTag> entry = directory.first(tag)
                .orElseThrow(() -> new PixelDecodeException("Missing " + tag + " for native pixel data", -1,
                        DicomTag.format(tag.tag())));
        return file().slice(entry.offset(), entry.length()).readU16(LITTLE_ENDIAN);
    }

    private static int parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.debug("Ignoring non-numeric NumberOfFrames '{}'", value);
            return 1;
        }
    }
}
