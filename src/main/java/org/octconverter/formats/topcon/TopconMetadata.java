package org.octconverter.formats.topcon;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;

import org.octconverter.errors.DecodeException;
import org.octconverter.errors.MetadataFieldException;
import org.octconverter.io.ByteCursor;
import org.octconverter.metadata.MetadataField;
import org.octconverter.metadata.MetadataTable;
import org.octconverter.model.Contour;
import org.octconverter.model.Laterality;
import org.octconverter.model.PixelSpacing;
import org.octconverter.model.Sex;

/**
 * Field layouts of the Topcon metadata chunks.
 */
final class TopconMetadata {

    private static final Charset TEXT = StandardCharsets.ISO_8859_1;

    private TopconMetadata() {
    }

    static MetadataTable<TopconChunkType> initialize() {
        MetadataTable<TopconChunkType> table = new MetadataTable<>(TopconChunkType.class);

        table.register(TopconChunkType.PATIENT_INFO_02, MetadataField.PATIENT_ID, p -> p.readFixedString(32, TEXT));
        table.register(TopconChunkType.PATIENT_INFO_02, MetadataField.FIRST_NAME,
                p -> p.seek(32).readFixedString(32, TEXT));
        table.register(TopconChunkType.PATIENT_INFO_02, MetadataField.SURNAME,
                p -> p.seek(64).readFixedString(32, TEXT));
        table.register(TopconChunkType.PATIENT_INFO_02, MetadataField.BIRTH_DATE, TopconMetadata::birthDate);
        table.register(TopconChunkType.PATIENT_INFO_02, MetadataField.SEX, p -> switch (p.seek(112).readU8()) {
            case 1 -> Sex.MALE;
            case 2 -> Sex.FEMALE;
            default -> null;
        });

        table.register(TopconChunkType.CAPTURE_INFO_02, MetadataField.LATERALITY, p -> switch (p.readU16(LITTLE_ENDIAN)) {
            case 0 -> Laterality.RIGHT;
            case 1 -> Laterality.LEFT;
            default -> null;
        });
        table.register(TopconChunkType.CAPTURE_INFO_02, MetadataField.ACQUISITION_TIME, TopconMetadata::captureTime);

        table.register(TopconChunkType.HW_INFO_03, MetadataField.DEVICE_MODEL, p -> p.readFixedString(16, TEXT));
        table.register(TopconChunkType.HW_INFO_03, MetadataField.DEVICE_SERIAL,
                p -> p.seek(16).readFixedString(16, TEXT));
        table.register(TopconChunkType.HW_INFO_03, MetadataField.SOFTWARE_VERSION, p -> {
            p.seek(64);
            return p.readU16(LITTLE_ENDIAN) + "." + p.readU16(LITTLE_ENDIAN) + "." + p.readU16(LITTLE_ENDIAN)
                    + "." + p.readU16(LITTLE_ENDIAN);
        });

        table.register(TopconChunkType.PARAM_SCAN_04, MetadataField.PIXEL_SPACING, p -> {
            p.seek(12);
            double x = p.readF64(LITTLE_ENDIAN);
            double y = p.readF64(LITTLE_ENDIAN);
            double z = p.readF64(LITTLE_ENDIAN);
            return new PixelSpacing(x, y, z);
        });
        return table;
    }

    // year, month, day, then five words the format leaves unused
    private static LocalDate birthDate(ByteCursor p) throws DecodeException {
        p.seek(96);
        int year = p.readU16(LITTLE_ENDIAN);
        int month = p.readU16(LITTLE_ENDIAN);
        int day = p.readU16(LITTLE_ENDIAN);
        return year == 0 ? null : LocalDate.of(year, month, day);
    }

    private static LocalDateTime captureTime(ByteCursor p) throws DecodeException {
        p.seek(54);
        int year = p.readU16(LITTLE_ENDIAN);
        int month = p.readU16(LITTLE_ENDIAN);
        int day = p.readU16(LITTLE_ENDIAN);
        int hour = p.readU16(LITTLE_ENDIAN);
        int minute = p.readU16(LITTLE_ENDIAN);
        int second = p.readU16(LITTLE_ENDIAN);
        return year == 0 ? null : LocalDateTime.of(year, month, day, hour, minute, second);
    }

    /**
     * Reads one {@code @CONTOUR_INFO} chunk. Row {@code n} of the stored grid is the boundary on B-scan {@code n}.
     */
    static Contour contour(ByteCursor p) throws DecodeException {
        String id = p.readFixedString(20, TEXT);
        int type = p.readU16(LITTLE_ENDIAN);
        int width = p.readU32AsInt(LITTLE_ENDIAN);
        int height = p.readU32AsInt(LITTLE_ENDIAN);
        p.readU32(LITTLE_ENDIAN);
        long bytes = (long) width * height * (type == 0 ? 2 : 8);
        if (!p.hasRemaining(bytes)) {
            throw new MetadataFieldException("Contour " + id + " of " + width + "x" + height
                    + " needs " + bytes + " bytes, " + p.remaining() + " available");
        }
        float[][] values = new float[height][width];
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                values[row][col] = type == 0 ? p.readU16(LITTLE_ENDIAN) : (float) p.readF64(LITTLE_ENDIAN);
            }
        }
        return new Contour(id.isEmpty() ? "contour" : id, values);
    }
}
