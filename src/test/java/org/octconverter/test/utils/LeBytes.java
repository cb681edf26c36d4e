package org.octconverter.test.utils;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Growable little-endian byte buffer for building synthetic files in tests.
 * <p>
 * Values are appended at the end; {@code put*At} methods patch already written bytes, which
 * is how tests fill in offsets that are only known after the payloads are laid out.
 */
public final class LeBytes {

    private byte[] data = new byte[256];
    private int size;

    public int position() {
        return size;
    }

    public LeBytes u8(int value) {
        ensure(1);
        data[size++] = (byte) value;
        return this;
    }

    public LeBytes u16(int value) {
        return u8(value).u8(value >>> 8);
    }

    public LeBytes u32(long value) {
        return u16((int) (value & 0xFFFF)).u16((int) ((value >>> 16) & 0xFFFF));
    }

    public LeBytes u64(long value) {
        return u32(value & 0xFFFFFFFFL).u32(value >>> 32);
    }

    public LeBytes f32(float value) {
        return u32(Float.floatToIntBits(value) & 0xFFFFFFFFL);
    }

    public LeBytes f64(double value) {
        return u64(Double.doubleToLongBits(value));
    }

    public LeBytes bytes(byte[] value) {
        ensure(value.length);
        System.arraycopy(value, 0, data, size, value.length);
        size += value.length;
        return this;
    }

    /**
     * Appends the ASCII bytes of {@code text} without terminator.
     */
    public LeBytes ascii(String text) {
        return bytes(text.getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Appends {@code text} NUL-padded (or cut) to exactly {@code width} bytes.
     */
    public LeBytes fixed(String text, int width) {
        byte[] raw = text.getBytes(StandardCharsets.ISO_8859_1);
        return bytes(Arrays.copyOf(raw, width));
    }

    public LeBytes zeros(int count) {
        ensure(count);
        size += count;
        return this;
    }

    /**
     * Pads with zeros up to an absolute position.
     */
    public LeBytes padTo(int position) {
        if (position < size) {
            throw new IllegalStateException("Already at " + size + ", cannot pad to " + position);
        }
        return zeros(position - size);
    }

    public LeBytes u16At(int position, int value) {
        ByteBuffer.wrap(data, 0, size).order(ByteOrder.LITTLE_ENDIAN).putShort(position, (short) value);
        return this;
    }

    public LeBytes u32At(int position, long value) {
        ByteBuffer.wrap(data, 0, size).order(ByteOrder.LITTLE_ENDIAN).putInt(position, (int) value);
        return this;
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(data, size);
    }

    private void ensure(int extra) {
        if (size + extra > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + extra));
        }
    }
}
