package org.octconverter.formats.heidelberg;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.JulianFields;

import org.octconverter.errors.DecodeException;
import org.octconverter.errors.MetadataFieldException;
import org.octconverter.io.ByteCursor;
import org.octconverter.metadata.MetadataField;
import org.octconverter.metadata.MetadataTable;
import org.octconverter.model.Laterality;
import org.octconverter.model.Sex;

/**
 * Field layouts of the E2E metadata chunks.
 */
final class E2eMetadata {

    private static final Charset TEXT = StandardCharsets.ISO_8859_1;

    /** Birth dates are stored as {@code (julianDay + JULIAN_OFFSET) * 64}. */
    static final long JULIAN_OFFSET = 14558805L;

    /** Seconds from 1601-01-01 to 1970-01-01. */
    private static final long FILETIME_EPOCH_SECONDS = 11644473600L;
    private static final long FILETIME_TICKS_PER_SECOND = 10_000_000L;

    private E2eMetadata() {
    }

    static MetadataTable<E2eChunkType> initialize() {
        MetadataTable<E2eChunkType> table = new MetadataTable<>(E2eChunkType.class);
        table.register(E2eChunkType.PATIENT, MetadataField.FIRST_NAME, p -> p.readFixedString(31, TEXT));
        table.register(E2eChunkType.PATIENT, MetadataField.SURNAME, p -> p.seek(31).readFixedString(66, TEXT));
        table.register(E2eChunkType.PATIENT, MetadataField.BIRTH_DATE, E2eMetadata::birthDate);
        table.register(E2eChunkType.PATIENT, MetadataField.SEX,
                p -> Sex.fromCode(String.valueOf((char) p.seek(101).readU8())));
        table.register(E2eChunkType.PATIENT, MetadataField.PATIENT_ID, p -> p.seek(102).readFixedString(25, TEXT));

        table.register(E2eChunkType.LATERALITY, MetadataField.LATERALITY, p -> switch (p.seek(14).readU8()) {
            case 'R' -> Laterality.RIGHT;
            case 'L' -> Laterality.LEFT;
            default -> null;
        });

        table.register(E2eChunkType.BSCAN_METADATA, MetadataField.ACQUISITION_TIME,
                p -> fromFiletime(p.seek(88).readU64(LITTLE_ENDIAN)));
        return table;
    }

    private static LocalDate birthDate(ByteCursor p) throws DecodeException {
        long raw = p.seek(97).readU32(LITTLE_ENDIAN);
        if (raw == 0) {
            return null;
        }
        long julianDay = raw / 64 - JULIAN_OFFSET;
        return LocalDate.EPOCH.with(JulianFields.JULIAN_DAY, julianDay);
    }

    /**
     * Converts a Windows FILETIME (100 ns ticks since 1601-01-01 UTC).
     */
    static LocalDateTime fromFiletime(long ticks) throws DecodeException {
        if (ticks == 0) {
            return null;
        }
        if (ticks < 0) {
            throw new MetadataFieldException("FILETIME " + Long.toUnsignedString(ticks) + " out of range");
        }
        long seconds = ticks / FILETIME_TICKS_PER_SECOND - FILETIME_EPOCH_SECONDS;
        int nanos = (int) (ticks % FILETIME_TICKS_PER_SECOND) * 100;
        return LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
    }
}
