package org.octconverter.model;

/**
 * One B-scan of a volume.
 * <p>
 * A slice whose payload failed to decode is kept as a <em>missing</em> placeholder so that
 * slice positions stay meaningful; it has no plane and reports a zero geometry.
 *
 * @param index device slice index, 0-based
 * @param plane decoded pixels, or {@code null} when missing
 */
public record Slice(int index, PixelPlane plane) {

    public static Slice missing(int index) {
        return new Slice(index, null);
    }

    public boolean isMissing() {
        return plane == null;
    }

    public int width() {
        return plane == null ? 0 : plane.width();
    }

    public int height() {
        return plane == null ? 0 : plane.height();
    }

    public int bitDepth() {
        return plane == null ? 0 : plane.bitDepth();
    }
}
