package org.octconverter.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PixelPlaneTest {

    @Test
    void sixteenBitSamplesAreUnsigned() {
        PixelPlane plane = PixelPlane.gray16(1, 1, new short[] {(short) 0xFFFE});

        assertThat(plane.get(0, 0)).isEqualTo(0xFFFE);
    }

    @Test
    void sampleCountMustMatchGeometry() {
        assertThatThrownBy(() -> PixelPlane.gray8(2, 2, new short[3])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PixelPlane.gray8(0, 2, new short[0])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertsToAndFromBufferedImage() {
        PixelPlane plane = PixelPlane.gray16(2, 1, new short[] {1000, (short) 60000});

        BufferedImage image = plane.toBufferedImage();

        assertThat(image.getType()).isEqualTo(BufferedImage.TYPE_USHORT_GRAY);
        assertThat(PixelPlane.fromImage(image)).isEqualTo(plane);
    }

    @Test
    void rejectsReadsOutsideThePlane() {
        PixelPlane plane = PixelPlane.gray8(2, 2, new short[4]);

        assertThatThrownBy(() -> plane.get(2, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
