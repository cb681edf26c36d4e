package org.octconverter.formats.dicom;

import java.nio.charset.StandardCharsets;
import java.util.Set;

import org.octconverter.test.utils.LeBytes;

/**
 * Writes little-endian DICOM Part 10 files element by element.
 */
final class DicomFixtures {

    private static final Set<String> LONG_VRS = Set.of("OB", "OW", "SQ", "UN", "UT");

    private final LeBytes out = new LeBytes();
    private final boolean explicit;

    private DicomFixtures(String transferSyntax) {
        this.explicit = !DicomParser.IMPLICIT_LE.equals(transferSyntax);
        out.zeros(DicomParser.PREAMBLE).ascii(DicomReader.MAGIC);
        explicitElement(DicomTag.TRANSFER_SYNTAX_UID.tag(), "UI", padded(transferSyntax, (byte) 0));
    }

    static DicomFixtures explicitLittleEndian() {
        return new DicomFixtures(DicomParser.EXPLICIT_LE);
    }

    static DicomFixtures implicitLittleEndian() {
        return new DicomFixtures(DicomParser.IMPLICIT_LE);
    }

    static DicomFixtures withTransferSyntax(String uid) {
        return new DicomFixtures(uid);
    }

    DicomFixtures text(DicomTag tag, String value) {
        return element(tag.tag(), tag.vr(), padded(value, (byte) ' '));
    }

    DicomFixtures us(DicomTag tag, int value) {
        return element(tag.tag(), "US", new LeBytes().u16(value).toByteArray());
    }

    DicomFixtures pixels(String vr, byte[] data) {
        return element(DicomTag.PIXEL_DATA.tag(), vr, data);
    }

    /** Encapsulated pixel data: an empty offset table, then one item per fragment. */
    DicomFixtures fragments(byte[]... fragments) {
        header(DicomTag.PIXEL_DATA.tag(), "OB", 0xFFFFFFFFL);
        item(0xFFFEE000, new byte[0]);
        for (byte[] fragment : fragments) {
            item(0xFFFEE000, fragment);
        }
        item(0xFFFEE0DD, new byte[0]);
        return this;
    }

    /** A sequence of undefined length holding one undefined-length item with one text element. */
    DicomFixtures sequence(int tag) {
        header(tag, "SQ", 0xFFFFFFFFL);
        tag(0xFFFEE000).u32(0xFFFFFFFFL);
        element(0x00081150, "UI", padded("1.2.3", (byte) 0));
        item(0xFFFEE00D, new byte[0]);
        item(0xFFFEE0DD, new byte[0]);
        return this;
    }

    DicomFixtures element(int tag, String vr, byte[] value) {
        header(tag, vr, value.length);
        out.bytes(value);
        return this;
    }

    byte[] build() {
        return out.toByteArray();
    }

    private void explicitElement(int tag, String vr, byte[] value) {
        tag(tag).ascii(vr).u16(value.length).bytes(value);
    }

    private void header(int tag, String vr, long length) {
        tag(tag);
        if (!explicit) {
            out.u32(length);
        } else if (LONG_VRS.contains(vr)) {
            out.ascii(vr).u16(0).u32(length);
        } else {
            out.ascii(vr).u16((int) length);
        }
    }

    private void item(int tag, byte[] value) {
        tag(tag).u32(value.length).bytes(value);
    }

    private LeBytes tag(int tag) {
        return out.u16(tag >>> 16).u16(tag & 0xFFFF);
    }

    private static byte[] padded(String value, byte pad) {
        byte[] raw = value.getBytes(StandardCharsets.ISO_8859_1);
        if (raw.length % 2 == 0) {
            return raw;
        }
        byte[] even = new byte[raw.length + 1];
        System.arraycopy(raw, 0, even, 0, raw.length);
        even[raw.length] = pad;
        return even;
    }
}
