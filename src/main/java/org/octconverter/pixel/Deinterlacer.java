package org.octconverter.pixel;

import java.util.ArrayList;
import java.util.List;

import org.octconverter.model.PixelPlane;

/**
 * Splits frames that store two fields one above the other.
 * <p>
 * Every input frame of height {@code h} becomes two slices of height {@code h / 2}: the top
 * half (field 1) followed by the bottom half (field 2). An odd last row is dropped. The
 * operation only makes sense once; applying it to its own output halves the slices again.
 */
public final class Deinterlacer {

    private Deinterlacer() {
    }

    public static List<PixelPlane> deinterlace(List<PixelPlane> frames) {
        List<PixelPlane> out = new ArrayList<>(frames.size() * 2);
        for (PixelPlane frame : frames) {
            out.addAll(split(frame));
        }
        return out;
    }

    /**
     * @param frame a grayscale frame at least two rows high
     * @return field 1 and field 2
     */
    public static List<PixelPlane> split(PixelPlane frame) {
        if (frame.isColor()) {
            throw new IllegalArgumentException("Only grayscale frames can be de-interlaced");
        }
        int half = frame.height() / 2;
        if (half == 0) {
            throw new IllegalArgumentException("Frame of height " + frame.height() + " cannot be de-interlaced");
        }
        return List.of(rows(frame, 0, half), rows(frame, half, half));
    }

    private static PixelPlane rows(PixelPlane frame, int firstRow, int count) {
        int w = frame.width();
        short[] samples = new short[w * count];
        for (int y = 0; y < count; y++) {
            for (int x = 0; x < w; x++) {
                samples[y * w + x] = (short) frame.get(x, firstRow + y);
            }
        }
        return frame.bitDepth() == 16 ? PixelPlane.gray16(w, count, samples) : PixelPlane.gray8(w, count, samples);
    }
}
