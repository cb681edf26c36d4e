package org.octconverter.pixel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heidelberg's unsigned 16-bit float: 6-bit exponent in the high bits, 10-bit mantissa in the
 * low bits, no sign, bias 63.
 * <p>
 * The mantissa field is stored least significant bit first, so bit 0 of the raw value carries
 * weight 512.
 */
public final class UFloat16 {

    private static final int MANTISSA_BITS = 10;
    private static final int MANTISSA_MASK = (1 << MANTISSA_BITS) - 1;
    private static final int EXPONENT_BIAS = 63;

    private static final Map<Double, short[]> DISPLAY_TABLES = new ConcurrentHashMap<>();

    private UFloat16() {
    }

    /**
     * @param raw the 16 stored bits
     * @return {@code (1 + m / 1024) * 2^(e - 63)}, {@code m} being the bit-reversed low ten bits
     */
    public static double toDouble(int raw) {
        int mantissa = Integer.reverse(raw & MANTISSA_MASK) >>> (Integer.SIZE - MANTISSA_BITS);
        int exponent = (raw >>> MANTISSA_BITS) & 0x3F;
        return (1.0 + mantissa / 1024.0) * Math.pow(2, exponent - EXPONENT_BIAS);
    }

    /**
     * Maps a value to 8 bits with {@code 256 * v^(1/gamma)}, clamped to 0..255.
     */
    public static int toDisplay(int raw, double gamma) {
        double v = 256.0 * Math.pow(toDouble(raw), 1.0 / gamma);
        return (int) Math.max(0, Math.min(255, Math.floor(v)));
    }

    /**
     * Returns the 65536-entry lookup table for a gamma. Tables are built once per gamma value.
     *
     * @param gamma display gamma, positive
     * @return the shared table; callers must not modify it
     */
    static short[] displayTable(double gamma) {
        if (!(gamma > 0)) {
            throw new IllegalArgumentException("Gamma must be positive, got " + gamma);
        }
        return DISPLAY_TABLES.computeIfAbsent(gamma, g -> {
            short[] table = new short[1 << 16];
            for (int i = 0; i < table.length; i++) {
                table[i] = (short) toDisplay(i, g);
            }
            return table;
        });
    }
}
