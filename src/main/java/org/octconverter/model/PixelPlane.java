package org.octconverter.model;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * A dense, row-major 2D grid of unsigned samples.
 * <p>
 * Grayscale planes of 8 or 16 bits keep their samples in a {@code short[]}; colour planes keep
 * packed {@code 0xRRGGBB} values in an {@code int[]} and report a bit depth of 24. Planes are
 * immutable: the backing arrays are never handed out.
 */
public final class PixelPlane {

    private final int width;
    private final int height;
    private final int bitDepth;
    private final short[] gray;
    private final int[] rgb;

    private PixelPlane(int width, int height, int bitDepth, short[] gray, int[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Plane dimensions must be positive, got " + width + "x" + height);
        }
        int expected = Math.multiplyExact(width, height);
        int actual = gray != null ? gray.length : rgb.length;
        if (actual != expected) {
            throw new IllegalArgumentException("Plane " + width + "x" + height + " needs " + expected
                    + " samples, got " + actual);
        }
        this.width = width;
        this.height = height;
        this.bitDepth = bitDepth;
        this.gray = gray;
        this.rgb = rgb;
    }

    /**
     * Wraps 8-bit samples. Ownership of the array passes to the plane.
     */
    public static PixelPlane gray8(int width, int height, short[] samples) {
        return new PixelPlane(width, height, 8, samples, null);
    }

    /**
     * Wraps 16-bit samples. Ownership of the array passes to the plane.
     */
    public static PixelPlane gray16(int width, int height, short[] samples) {
        return new PixelPlane(width, height, 16, samples, null);
    }

    /**
     * Wraps packed {@code 0xRRGGBB} samples. Ownership of the array passes to the plane.
     */
    public static PixelPlane rgb(int width, int height, int[] samples) {
        return new PixelPlane(width, height, 24, null, samples);
    }

    /**
     * Converts a decoded {@link BufferedImage}. Single-band images keep their sample depth
     * (8 or 16 bit); everything else becomes packed RGB.
     *
     * @param image the decoded image
     * @return the equivalent plane
     */
    public static PixelPlane fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        var raster = image.getRaster();
        if (raster.getNumBands() == 1) {
            int depth = raster.getSampleModel().getSampleSize(0);
            short[] samples = new short[w * h];
            int[] row = new int[w];
            for (int y = 0; y < h; y++) {
                raster.getSamples(0, y, w, 1, 0, row);
                for (int x = 0; x < w; x++) {
                    samples[y * w + x] = (short) row[x];
                }
            }
            return depth > 8 ? gray16(w, h, samples) : gray8(w, h, samples);
        }
        int[] packed = image.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < packed.length; i++) {
            packed[i] &= 0xFFFFFF;
        }
        return rgb(w, h, packed);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * @return 8 or 16 for grayscale planes, 24 for packed RGB.
     */
    public int bitDepth() {
        return bitDepth;
    }

    public boolean isColor() {
        return rgb != null;
    }

    public int channels() {
        return rgb != null ? 3 : 1;
    }

    /**
     * @return the unsigned grayscale sample, or the packed {@code 0xRRGGBB} value for colour planes.
     */
    public int get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
        }
        int i = y * width + x;
        return rgb != null ? rgb[i] : gray[i] & 0xFFFF;
    }

    /**
     * @return a copy of one row as unsigned values.
     */
    public int[] row(int y) {
        int[] out = new int[width];
        for (int x = 0; x < width; x++) {
            out[x] = get(x, y);
        }
        return out;
    }

    public Geometry geometry() {
        return new Geometry(width, height, bitDepth);
    }

    /**
     * Renders the plane for display or export. 16-bit planes become {@code TYPE_USHORT_GRAY}.
     *
     * @return a new image holding a copy of the samples
     */
    public BufferedImage toBufferedImage() {
        if (rgb != null) {
            BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
            image.setRGB(0, 0, width, height, rgb, 0, width);
            return image;
        }
        int type = bitDepth > 8 ? BufferedImage.TYPE_USHORT_GRAY : BufferedImage.TYPE_BYTE_GRAY;
        BufferedImage image = new BufferedImage(width, height, type);
        var raster = image.getRaster();
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                row[x] = gray[y * width + x] & 0xFFFF;
            }
            raster.setSamples(0, y, width, 1, 0, row);
        }
        return image;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelPlane other)) {
            return false;
        }
        return width == other.width && height == other.height && bitDepth == other.bitDepth
                && Arrays.equals(gray, other.gray) && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        int result = 31 * width + height;
        result = 31 * result + bitDepth;
        return 31 * result + (gray != null ? Arrays.hashCode(gray) : Arrays.hashCode(rgb));
    }

    @Override
    public String toString() {
        return "PixelPlane[" + width + "x" + height + ", " + bitDepth + " bit]";
    }

    /**
     * Width, height and bit depth of a plane; equal geometry is required within one volume.
     */
    public record Geometry(int width, int height, int bitDepth) {

        @Override
        public String toString() {
            return width + "x" + height + "@" + bitDepth;
        }
    }
}
