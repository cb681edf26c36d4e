package org.octconverter.pixel;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteOrder;
import java.util.Iterator;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.octconverter.errors.DecodeException;
import org.octconverter.errors.OutOfBoundsException;
import org.octconverter.errors.PixelDecodeException;
import org.octconverter.io.ByteCursor;
import org.octconverter.model.PixelPlane;

/**
 * Turns pixel payloads into {@link PixelPlane}s.
 * <p>
 * Compressed payloads go through whatever {@link ImageIO} readers are registered; the JPEG 2000
 * reader comes from the jai-imageio plugin on the runtime classpath.
 */
public final class PixelDecoder {

    private PixelDecoder() {
    }

    /**
     * Reinterprets {@code width * height} samples at the cursor position.
     *
     * @param cursor   positioned at the first sample; advanced past the plane
     * @param width    plane width
     * @param height   plane height
     * @param bitDepth 8 or 16
     * @param order    byte order of 16-bit samples
     * @param storage  sample order in the file
     * @return the plane, always row-major
     * @throws OutOfBoundsException if the cursor holds fewer samples than required
     */
    public static PixelPlane raw(ByteCursor cursor, int width, int height, int bitDepth, ByteOrder order,
                                 Storage storage) throws DecodeException {
        if (width <= 0 || height <= 0) {
            throw new PixelDecodeException("Invalid plane size " + width + "x" + height,
                    cursor.absolutePosition(), null);
        }
        if (bitDepth != 8 && bitDepth != 16) {
            throw new PixelDecodeException("Unsupported bit depth " + bitDepth, cursor.absolutePosition(), null);
        }
        long count = (long) width * height;
        if (count > Integer.MAX_VALUE) {
            throw new PixelDecodeException("Plane " + width + "x" + height + " too large",
                    cursor.absolutePosition(), null);
        }
        int bytesPerSample = bitDepth / 8;
        if (!cursor.hasRemaining(count * bytesPerSample)) {
            throw new OutOfBoundsException("Plane of " + count * bytesPerSample + " bytes needs more than the "
                    + cursor.remaining() + " remaining", cursor.absolutePosition(), null);
        }
        short[] samples = new short[(int) count];
        if (storage == Storage.ROW_MAJOR) {
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (short) (bitDepth == 8 ? cursor.readU8() : cursor.readU16(order));
            }
        } else {
            for (int x = 0; x < width; x++) {
                for (int y = 0; y < height; y++) {
                    samples[y * width + x] = (short) (bitDepth == 8 ? cursor.readU8() : cursor.readU16(order));
                }
            }
        }
        return bitDepth == 8 ? PixelPlane.gray8(width, height, samples) : PixelPlane.gray16(width, height, samples);
    }

    /**
     * Reads 8-bit RGB samples stored pixel by pixel ({@code R, G, B, R, G, B, ...}).
     *
     * @param cursor positioned at the first sample; advanced past the plane
     * @param width  plane width
     * @param height plane height
     * @return a colour plane
     */
    public static PixelPlane rgbInterleaved(ByteCursor cursor, int width, int height) throws DecodeException {
        if (width <= 0 || height <= 0) {
            throw new PixelDecodeException("Invalid plane size " + width + "x" + height,
                    cursor.absolutePosition(), null);
        }
        long count = (long) width * height;
        if (count > Integer.MAX_VALUE / 3 || !cursor.hasRemaining(count * 3)) {
            throw new OutOfBoundsException("RGB plane of " + count * 3 + " bytes needs more than the "
                    + cursor.remaining() + " remaining", cursor.absolutePosition(), null);
        }
        int[] packed = new int[(int) count];
        for (int i = 0; i < packed.length; i++) {
            packed[i] = cursor.readU8() << 16 | cursor.readU8() << 8 | cursor.readU8();
        }
        return PixelPlane.rgb(width, height, packed);
    }

    /**
     * Decodes a complete compressed image (JPEG, JPEG 2000, PNG, ...).
     *
     * @param payload cursor over exactly the compressed bytes
     * @param tag     record name used in error messages
     * @return the decoded plane
     * @throws PixelDecodeException if no registered reader accepts the data or decoding fails
     */
    public static PixelPlane compressed(ByteCursor payload, String tag) throws DecodeException {
        long offset = payload.absolutePosition();
        byte[] bytes = payload.readBytes(payload.remaining());
        BufferedImage image;
        try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new PixelDecodeException("No image reader recognises " + bytes.length + " compressed bytes",
                        offset, tag);
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(in, true, true);
                image = reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            if (e instanceof PixelDecodeException pde) {
                throw pde;
            }
            throw new PixelDecodeException("Compressed image could not be decoded: " + e.getMessage(), offset, tag, e);
        }
        if (image == null) {
            throw new PixelDecodeException("Compressed image decoded to nothing", offset, tag);
        }
        return PixelPlane.fromImage(image);
    }

    /**
     * Decodes a Heidelberg {@code ufloat16} plane and maps it to 8-bit display values.
     *
     * @param cursor positioned at the first sample; advanced past the plane
     * @param width  plane width
     * @param height plane height
     * @param gamma  display gamma
     * @return an 8-bit plane
     */
    public static PixelPlane ufloat16(ByteCursor cursor, int width, int height, double gamma) throws DecodeException {
        PixelPlane raw = raw(cursor, width, height, 16, ByteOrder.LITTLE_ENDIAN, Storage.ROW_MAJOR);
        short[] lut = UFloat16.displayTable(gamma);
        short[] out = new short[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                out[y * width + x] = lut[raw.get(x, y)];
            }
        }
        return PixelPlane.gray8(width, height, out);
    }
}
