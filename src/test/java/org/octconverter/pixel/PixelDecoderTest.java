package org.octconverter.pixel;

import static java.nio.ByteOrder.BIG_ENDIAN;
import static java.nio.ByteOrder.LITTLE_ENDIAN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.octconverter.errors.OutOfBoundsException;
import org.octconverter.errors.PixelDecodeException;
import org.octconverter.io.ByteCursor;
import org.octconverter.model.PixelPlane;
import org.octconverter.test.utils.LeBytes;
import org.octconverter.test.utils.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PixelDecoderTest {

    @Test
    void rowMajorEightBit() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[] {1, 2, 3, 4, 5, 6});

        PixelPlane plane = PixelDecoder.raw(cursor, 3, 2, 8, LITTLE_ENDIAN, Storage.ROW_MAJOR);

        assertThat(plane.row(0)).containsExactly(1, 2, 3);
        assertThat(plane.row(1)).containsExactly(4, 5, 6);
        assertThat(cursor.remaining()).isZero();
    }

    @Test
    @DisplayName("Column-major samples are transposed into row-major order")
    void columnMajorIsTransposed() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[] {1, 4, 2, 5, 3, 6});

        PixelPlane plane = PixelDecoder.raw(cursor, 3, 2, 8, LITTLE_ENDIAN, Storage.COLUMN_MAJOR);

        assertThat(plane.row(0)).containsExactly(1, 2, 3);
        assertThat(plane.row(1)).containsExactly(4, 5, 6);
    }

    @Test
    void sixteenBitHonoursByteOrder() throws Exception {
        byte[] data = {0x12, 0x34, (byte) 0xFF, (byte) 0xFF};

        PixelPlane little = PixelDecoder.raw(ByteCursor.wrap(data), 2, 1, 16, LITTLE_ENDIAN, Storage.ROW_MAJOR);
        PixelPlane big = PixelDecoder.raw(ByteCursor.wrap(data), 2, 1, 16, BIG_ENDIAN, Storage.ROW_MAJOR);

        assertThat(little.row(0)).containsExactly(0x3412, 0xFFFF);
        assertThat(big.row(0)).containsExactly(0x1234, 0xFFFF);
        assertThat(little.bitDepth()).isEqualTo(16);
    }

    @Test
    void shortPayloadIsOutOfBounds() {
        ByteCursor cursor = ByteCursor.wrap(new byte[5]);

        assertThatThrownBy(() -> PixelDecoder.raw(cursor, 3, 2, 8, LITTLE_ENDIAN, Storage.ROW_MAJOR))
                .isInstanceOf(OutOfBoundsException.class);
        assertThat(cursor.position()).isZero();
    }

    @Test
    void invalidGeometryIsAPixelError() {
        ByteCursor cursor = ByteCursor.wrap(new byte[16]);

        assertThatThrownBy(() -> PixelDecoder.raw(cursor, 0, 2, 8, LITTLE_ENDIAN, Storage.ROW_MAJOR))
                .isInstanceOf(PixelDecodeException.class);
        assertThatThrownBy(() -> PixelDecoder.raw(cursor, 2, 2, 12, LITTLE_ENDIAN, Storage.ROW_MAJOR))
                .isInstanceOf(PixelDecodeException.class);
    }

    @Test
    void interleavedRgb() throws Exception {
        byte[] data = new LeBytes().u8(0xFF).u8(0).u8(0).u8(0).u8(0x80).u8(0x01).toByteArray();

        PixelPlane plane = PixelDecoder.rgbInterleaved(ByteCursor.wrap(data), 2, 1);

        assertThat(plane.isColor()).isTrue();
        assertThat(plane.get(0, 0)).isEqualTo(0xFF0000);
        assertThat(plane.get(1, 0)).isEqualTo(0x008001);
    }

    @Test
    void compressedPngDecodes() throws Exception {
        byte[] png = TestImages.grayPng(4, 3, 10);

        PixelPlane plane = PixelDecoder.compressed(ByteCursor.wrap(png), "IMG");

        assertThat(plane.width()).isEqualTo(4);
        assertThat(plane.height()).isEqualTo(3);
        assertThat(plane.bitDepth()).isEqualTo(8);
        assertThat(plane.get(3, 2)).isEqualTo(15);
    }

    @Test
    void garbageIsAPixelErrorNamingTheTag() {
        byte[] garbage = new LeBytes().ascii("not an image at all").toByteArray();

        assertThatThrownBy(() -> PixelDecoder.compressed(ByteCursor.wrap(garbage), "@IMG_JPEG"))
                .isInstanceOf(PixelDecodeException.class)
                .satisfies(e -> assertThat(((PixelDecodeException) e).tag()).hasValue("@IMG_JPEG"));
    }

    @Test
    void ufloat16MapsThroughTheDisplayCurve() throws Exception {
        byte[] data = new LeBytes().u16(63 << 10).u16(62 << 10).u16(0).toByteArray();

        PixelPlane plane = PixelDecoder.ufloat16(ByteCursor.wrap(data), 3, 1, 2.4);

        assertThat(plane.bitDepth()).isEqualTo(8);
        assertThat(plane.row(0)).containsExactly(255, 191, 0);
    }
}
