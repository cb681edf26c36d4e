package org.octconverter.io;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;

import org.octconverter.errors.OutOfBoundsException;

/**
 * Bounds-checked sequential reader over a read-only {@link ByteBuffer}.
 * <p>
 * Every read names its byte order, advances the position by its width and fails with
 * {@link OutOfBoundsException} instead of an unchecked exception when the requested range
 * leaves the buffer. Positions are relative to the start of the cursor's buffer; the
 * absolute file offset of that start is kept so that errors and sub-cursors report positions
 * within the file.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Create one cursor per consumer; cursors
 * over the same buffer are independent.
 */
public final class ByteCursor {

    private final ByteBuffer little;
    private final ByteBuffer big;
    private final long base;
    private final int size;
    private int position;

    /**
     * @param buffer data to read, from its position to its limit; the buffer itself is not modified
     * @param base   absolute offset of {@code buffer}'s first readable byte within the file
     */
    public ByteCursor(ByteBuffer buffer, long base) {
        ByteBuffer view = buffer.slice();
        this.little = view.duplicate().order(ByteOrder.LITTLE_ENDIAN);
        this.big = view.duplicate().order(ByteOrder.BIG_ENDIAN);
        this.base = base;
        this.size = view.remaining();
    }

    public static ByteCursor wrap(byte[] bytes) {
        return new ByteCursor(ByteBuffer.wrap(bytes).asReadOnlyBuffer(), 0);
    }

    /**
     * Validates an unsigned 64-bit value that is about to be used as an offset or length.
     *
     * @param value raw unsigned value
     * @param what  name used in the error message
     * @return the value as a non-negative {@code long}
     * @throws OutOfBoundsException if the value does not fit a signed {@code long}
     */
    public static long requireNonNegative(long value, String what) throws OutOfBoundsException {
        if (value < 0) {
            throw new OutOfBoundsException(what + " " + Long.toUnsignedString(value) + " is not addressable");
        }
        return value;
    }

    public long size() {
        return size;
    }

    public long position() {
        return position;
    }

    /**
     * @return the absolute file offset of the current position
     */
    public long absolutePosition() {
        return base + position;
    }

    /**
     * @return the absolute file offset of this cursor's first byte
     */
    public long base() {
        return base;
    }

    public long remaining() {
        return size - position;
    }

    public boolean hasRemaining(long n) {
        return n >= 0 && n <= remaining();
    }

    /**
     * Moves to an offset relative to the start of this cursor. Seeking to {@link #size()} is
     * allowed; nothing can be read there.
     */
    public ByteCursor seek(long offset) throws OutOfBoundsException {
        check(offset, 0);
        position = (int) offset;
        return this;
    }

    public ByteCursor skip(long n) throws OutOfBoundsException {
        check(position, n);
        position += (int) n;
        return this;
    }

    public int readU8() throws OutOfBoundsException {
        int p = advance(1);
        return little.get(p) & 0xFF;
    }

    public int readU16(ByteOrder order) throws OutOfBoundsException {
        int p = advance(2);
        return view(order).getShort(p) & 0xFFFF;
    }

    public short readI16(ByteOrder order) throws OutOfBoundsException {
        int p = advance(2);
        return view(order).getShort(p);
    }

    public long readU32(ByteOrder order) throws OutOfBoundsException {
        int p = advance(4);
        return view(order).getInt(p) & 0xFFFFFFFFL;
    }

    public int readI32(ByteOrder order) throws OutOfBoundsException {
        int p = advance(4);
        return view(order).getInt(p);
    }

    /**
     * Reads an unsigned 32-bit count or dimension that must fit a Java {@code int}.
     *
     * @throws OutOfBoundsException if the value exceeds {@link Integer#MAX_VALUE}
     */
    public int readU32AsInt(ByteOrder order) throws OutOfBoundsException {
        long start = absolutePosition();
        long v = readU32(order);
        if (v > Integer.MAX_VALUE) {
            throw new OutOfBoundsException("Unsigned value " + v + " too large", start, null);
        }
        return (int) v;
    }

    /**
     * @return the raw 64 bits; values above {@link Long#MAX_VALUE} come back negative, see
     *         {@link #requireNonNegative(long, String)}
     */
    public long readU64(ByteOrder order) throws OutOfBoundsException {
        int p = advance(8);
        return view(order).getLong(p);
    }

    public long readI64(ByteOrder order) throws OutOfBoundsException {
        return readU64(order);
    }

    public float readF32(ByteOrder order) throws OutOfBoundsException {
        int p = advance(4);
        return view(order).getFloat(p);
    }

    public double readF64(ByteOrder order) throws OutOfBoundsException {
        int p = advance(8);
        return view(order).getDouble(p);
    }

    public byte[] readBytes(long n) throws OutOfBoundsException {
        int p = advance(n);
        byte[] out = new byte[(int) n];
        little.get(p, out, 0, out.length);
        return out;
    }

    /**
     * Reads a fixed-width text field. The value ends at the first NUL; trailing whitespace is
     * removed.
     *
     * @param n       field width in bytes, always consumed completely
     * @param charset encoding of the field
     * @return the decoded text, possibly empty
     */
    public String readFixedString(int n, Charset charset) throws OutOfBoundsException {
        byte[] raw = readBytes(n);
        int end = 0;
        while (end < raw.length && raw[end] != 0) {
            end++;
        }
        return new String(raw, 0, end, charset).stripTrailing();
    }

    /**
     * Compares the bytes at the current position with {@code expected} without moving.
     */
    public boolean matches(byte[] expected) {
        if (!hasRemaining(expected.length)) {
            return false;
        }
        for (int i = 0; i < expected.length; i++) {
            if (little.get(position + i) != expected[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Creates an independent cursor over a sub-range without copying.
     *
     * @param offset start relative to this cursor
     * @param length number of bytes
     * @return a cursor positioned at 0 whose absolute base is this cursor's base plus {@code offset}
     */
    public ByteCursor slice(long offset, long length) throws OutOfBoundsException {
        return new ByteCursor(sliceBuffer(offset, length), base + offset);
    }

    /**
     * Exposes a sub-range as a read-only buffer, for codecs that consume NIO buffers or streams.
     */
    public ByteBuffer sliceBuffer(long offset, long length) throws OutOfBoundsException {
        check(offset, length);
        return little.duplicate().position((int) offset).limit((int) (offset + length)).slice().asReadOnlyBuffer();
    }

    /**
     * Consumes {@code length} bytes and returns a cursor over them.
     */
    public ByteCursor readSlice(long length) throws OutOfBoundsException {
        ByteCursor sub = slice(position, length);
        position += (int) length;
        return sub;
    }

    private ByteBuffer view(ByteOrder order) {
        return order == ByteOrder.BIG_ENDIAN ? big : little;
    }

    private int advance(long n) throws OutOfBoundsException {
        check(position, n);
        int p = position;
        position += (int) n;
        return p;
    }

    // offset + length may overflow for adversarial input, so compare against size - offset
    private void check(long offset, long length) throws OutOfBoundsException {
        if (offset < 0 || length < 0 || offset > size || length > size - offset) {
            throw OutOfBoundsException.forRange(offset, length, size, base);
        }
    }
}
