package org.octconverter.formats.dicom;

import static java.nio.ByteOrder.LITTLE_ENDIAN;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.MalformedChunkChainException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.io.ByteCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flat walk over a DICOM Part 10 file in little-endian transfer syntaxes.
 * <p>
 * Top-level elements become directory entries; sequences and items of undefined length are
 * skipped. Encapsulated pixel data yields one {@link DicomTag#PIXEL_FRAGMENT} entry per
 * fragment, the basic offset table excluded.
 */
final class DicomParser {

    private static final Logger LOG = LoggerFactory.getLogger(DicomParser.class);

    static final int PREAMBLE = 128;
    static final String IMPLICIT_LE = "1.2.840.10008.1.2";
    static final String EXPLICIT_LE = "1.2.840.10008.1.2.1";
    static final String EXPLICIT_BE = "1.2.840.10008.1.2.2";
    static final String DEFLATED_LE = "1.2.840.10008.1.2.1.99";

    private static final long UNDEFINED_LENGTH = 0xFFFFFFFFL;
    private static final int ITEM = 0xFFFEE000;
    private static final int ITEM_END = 0xFFFEE00D;
    private static final int SEQUENCE_END = 0xFFFEE0DD;
    private static final int MAX_NESTING = 32;

    private static final Set<String> LONG_VRS = Set.of("OB", "OD", "OF", "OL", "OV", "OW", "SQ", "SV", "UC", "UN",
            "UR", "UT", "UV");

    private DicomParser() {
    }

    record Header(int tag, String vr, long length, long valueOffset) {

        boolean undefinedLength() {
            return length == UNDEFINED_LENGTH;
        }
    }

    static Directory<DicomTag> parse(ByteCursor file, DecodeDiagnostics diagnostics) throws DecodeException {
        DecodeDiagnostics local = diagnostics.fork();
        List<DirectoryEntry<DicomTag>> entries = new ArrayList<>();
        file.seek(PREAMBLE + 4);

        String transferSyntax = null;
        while (file.remaining() >= 8) {
            long start = file.position();
            if (file.readU16(LITTLE_ENDIAN) != 0x0002) {
                file.seek(start);
                break;
            }
            file.seek(start);
            Header header = readHeader(file, true);
            ByteCursor value = file.readSlice(header.length());
            if (header.tag() == DicomTag.TRANSFER_SYNTAX_UID.tag()) {
                transferSyntax = text(value);
            }
            entries.add(entry(header));
        }
        if (transferSyntax == null) {
            throw new UnrecognizedFormatException("DICOM file meta information has no transfer syntax",
                    PREAMBLE + 4, DicomTag.format(DicomTag.TRANSFER_SYNTAX_UID.tag()));
        }
        if (EXPLICIT_BE.equals(transferSyntax) || DEFLATED_LE.equals(transferSyntax)) {
            throw new UnrecognizedFormatException("Unsupported transfer syntax " + transferSyntax, -1,
                    DicomTag.format(DicomTag.TRANSFER_SYNTAX_UID.tag()));
        }
        boolean explicit = !IMPLICIT_LE.equals(transferSyntax);
        LOG.debug("Transfer syntax {} ({} VR)", transferSyntax, explicit ? "explicit" : "implicit");

        try {
            while (file.remaining() >= 8) {
                Header header = readHeader(file, explicit);
                if (!header.undefinedLength()) {
                    file.readSlice(header.length());
                    if (!"SQ".equals(header.vr())) {
                        entries.add(entry(header));
                    }
                    continue;
                }
                if (header.tag() == DicomTag.PIXEL_DATA.tag()) {
                    readFragments(file, header, entries);
                } else {
                    skipSequence(file, explicit, 0);
                }
            }
        } catch (DecodeException e) {
            local.report(e);
        }

        diagnostics.merge(local);
        return new Directory<>(DicomTag.class, entries, local.warnings());
    }

    static Header readHeader(ByteCursor cursor, boolean explicit) throws DecodeException {
        int group = cursor.readU16(LITTLE_ENDIAN);
        int element = cursor.readU16(LITTLE_ENDIAN);
        int tag = group << 16 | element;
        if (group == 0xFFFE) {
            long length = cursor.readU32(LITTLE_ENDIAN);
            return new Header(tag, "", length, cursor.absolutePosition());
        }
        if (!explicit) {
            long length = cursor.readU32(LITTLE_ENDIAN);
            return new Header(tag, DicomTag.fromTag(tag).vr(), length, cursor.absolutePosition());
        }
        String vr = new String(cursor.readBytes(2), StandardCharsets.US_ASCII);
        long length;
        if (LONG_VRS.contains(vr)) {
            cursor.skip(2);
            length = cursor.readU32(LITTLE_ENDIAN);
        } else {
            length = cursor.readU16(LITTLE_ENDIAN);
        }
        return new Header(tag, vr, length, cursor.absolutePosition());
    }

    private static void readFragments(ByteCursor file, Header pixelData, List<DirectoryEntry<DicomTag>> entries)
            throws DecodeException {
        String name = DicomTag.format(pixelData.tag());
        boolean offsetTable = true;
        int fragment = 0;
        while (true) {
            Header item = readHeader(file, true);
            if (item.tag() == SEQUENCE_END) {
                return;
            }
            if (item.tag() != ITEM || item.undefinedLength()) {
                throw new MalformedChunkChainException("Unexpected " + DicomTag.format(item.tag())
                        + " inside encapsulated pixel data", item.valueOffset(), name);
            }
            file.readSlice(item.length());
            if (offsetTable) {
                offsetTable = false;
                continue;
            }
            entries.add(new DirectoryEntry<>(DicomTag.PIXEL_FRAGMENT, name + "#" + fragment++, item.valueOffset(),
                    item.length()));
        }
    }

    /**
     * Skips items up to and including the sequence delimiter.
     */
    private static void skipSequence(ByteCursor file, boolean explicit, int depth) throws DecodeException {
        if (depth > MAX_NESTING) {
            throw new MalformedChunkChainException("Sequences nested deeper than " + MAX_NESTING,
                    file.absolutePosition(), null);
        }
        while (true) {
            Header item = readHeader(file, explicit);
            if (item.tag() == SEQUENCE_END) {
                return;
            }
            if (item.tag() != ITEM) {
                throw new MalformedChunkChainException("Expected an item inside a sequence, found "
                        + DicomTag.format(item.tag()), item.valueOffset(), null);
            }
            if (!item.undefinedLength()) {
                file.skip(item.length());
                continue;
            }
            while (true) {
                Header element = readHeader(file, explicit);
                if (element.tag() == ITEM_END) {
                    break;
                }
                if (element.undefinedLength()) {
                    skipSequence(file, explicit, depth + 1);
                } else {
                    file.skip(element.length());
                }
            }
        }
    }

    private static DirectoryEntry<DicomTag> entry(Header header) {
        return new DirectoryEntry<>(DicomTag.fromTag(header.tag()), DicomTag.format(header.tag()),
                header.valueOffset(), header.length());
    }

    static String text(ByteCursor value) throws DecodeException {
        return value.readFixedString((int) value.size(), StandardCharsets.ISO_8859_1).trim();
    }
}
