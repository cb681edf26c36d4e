package org.octconverter.formats.topcon;

import org.octconverter.test.utils.LeBytes;

/**
 * Builds synthetic Topcon files chunk by chunk.
 */
final class TopconFixtures {

    private final LeBytes bytes = new LeBytes();

    TopconFixtures(String kind) {
        bytes.ascii("FOCT").ascii(kind).zeros(8);
    }

    TopconFixtures chunk(String name, byte[] payload) {
        bytes.u8(name.length()).ascii(name).u32(payload.length).bytes(payload);
        return this;
    }

    /**
     * Writes a chunk header declaring more bytes than follow.
     */
    TopconFixtures truncatedChunk(String name, int declared, byte[] payload) {
        bytes.u8(name.length()).ascii(name).u32(declared).bytes(payload);
        return this;
    }

    byte[] build() {
        return bytes.toByteArray();
    }

    /** Colour fundus payload: 20 unused bytes, u32 size, compressed image. */
    static byte[] fundus(byte[] image) {
        return new LeBytes().zeros(20).u32(image.length).bytes(image).toByteArray();
    }

    /** IMG_JPEG payload with one compressed image per slice. */
    static byte[] jpegScan(byte[]... slices) {
        LeBytes out = new LeBytes().zeros(17).u32(slices.length).zeros(4);
        for (byte[] slice : slices) {
            out.u32(slice.length).bytes(slice);
        }
        return out.toByteArray();
    }

    /** IMG_SCAN_03 payload: 25-byte header, 16-bit samples; sample {@code i} of slice {@code s} is {@code s * 100 + i}. */
    static byte[] fdsScan(int width, int height, int slices, int slicesWritten) {
        LeBytes out = new LeBytes().zeros(9).u32(width).u32(height).u32(slices).padTo(25);
        for (int s = 0; s < slicesWritten; s++) {
            for (int i = 0; i < width * height; i++) {
                out.u16(s * 100 + i);
            }
        }
        return out.toByteArray();
    }

    /** IMG_MOT_COMP_03 payload: 22-byte header, 8-bit samples numbered like {@link #fdsScan}. */
    static byte[] motionCorrectedScan(int width, int height, int slices) {
        LeBytes out = new LeBytes().u8(0).u32(width).u32(height).u32(8).u32(slices).padTo(22);
        for (int s = 0; s < slices; s++) {
            for (int i = 0; i < width * height; i++) {
                out.u8(s * 100 + i);
            }
        }
        return out.toByteArray();
    }

    static byte[] patient(String id, String first, String surname, int year, int month, int day, int sex) {
        return new LeBytes().fixed(id, 32).fixed(first, 32).fixed(surname, 32)
                .u16(year).u16(month).u16(day).zeros(10).u8(sex).zeros(7).toByteArray();
    }

    static byte[] capture(int eye, int year, int month, int day, int hour, int minute, int second) {
        return new LeBytes().u16(eye).padTo(54).u16(year).u16(month).u16(day).u16(hour).u16(minute).u16(second)
                .toByteArray();
    }

    static byte[] hardware(String model, String serial, int... version) {
        LeBytes out = new LeBytes().fixed(model, 16).fixed(serial, 16).padTo(64);
        for (int v : version) {
            out.u16(v);
        }
        return out.toByteArray();
    }

    static byte[] scanParameters(double x, double y, double z) {
        return new LeBytes().zeros(12).f64(x).f64(y).f64(z).toByteArray();
    }

    /** 16-bit contour grid of {@code width} values per B-scan, {@code height} B-scans. */
    static byte[] contour(String id, int width, int height) {
        LeBytes out = new LeBytes().fixed(id, 20).u16(0).u32(width).u32(height).u32(0);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                out.u16(row * 10 + col);
            }
        }
        return out.toByteArray();
    }
}
