package org.octconverter.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.octconverter.errors.InconsistentVolumeGeometryException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class OctVolumeTest {

    private static PixelPlane filled(int width, int height, int value) {
        short[] samples = new short[width * height];
        java.util.Arrays.fill(samples, (short) value);
        return PixelPlane.gray8(width, height, samples);
    }

    @Test
    void slicesAreOrderedByIndex() throws Exception {
        OctVolume volume = OctVolume.builder("v")
                .addSlice(new Slice(2, filled(3, 2, 20)))
                .addSlice(new Slice(0, filled(3, 2, 0)))
                .addSlice(Slice.missing(1))
                .build();

        assertThat(volume.slices()).extracting(Slice::index).containsExactly(0, 1, 2);
        assertThat(volume.missingSliceIndices()).containsExactly(1);
        assertThat(volume.geometry()).isEqualTo(new PixelPlane.Geometry(3, 2, 8));
        assertThat(volume.laterality()).isEqualTo(Laterality.UNKNOWN);
    }

    @Test
    void mismatchedGeometryIsRejected() {
        OctVolume.Builder builder = OctVolume.builder("scan-1")
                .addSlice(new Slice(0, filled(3, 2, 1)))
                .addSlice(new Slice(1, filled(4, 2, 1)));

        assertThatThrownBy(builder::build)
                .isInstanceOf(InconsistentVolumeGeometryException.class)
                .satisfies(e -> assertThat(((InconsistentVolumeGeometryException) e).tag()).hasValue("scan-1"));
    }

    @Test
    void bitDepthIsPartOfTheGeometry() {
        OctVolume.Builder builder = OctVolume.builder("v")
                .addSlice(new Slice(0, filled(2, 2, 1)))
                .addSlice(new Slice(1, PixelPlane.gray16(2, 2, new short[4])));

        assertThatThrownBy(builder::build).isInstanceOf(InconsistentVolumeGeometryException.class);
    }

    @Test
    void volumeWithoutDecodedSlicesIsRejected() {
        OctVolume.Builder builder = OctVolume.builder("v").addSlice(Slice.missing(0)).addSlice(Slice.missing(1));

        assertThatThrownBy(builder::build)
                .isInstanceOf(InconsistentVolumeGeometryException.class)
                .hasMessageContaining("no decoded slice");
    }

    @Test
    void meanProjectionAveragesDepthAndLeavesMissingRowsBlack() throws Exception {
        short[] ramp = {0, 10, 20, 30, 40, 50};
        OctVolume volume = OctVolume.builder("v")
                .addSlice(new Slice(0, PixelPlane.gray8(2, 3, ramp)))
                .addSlice(Slice.missing(1))
                .build();

        PixelPlane projection = volume.meanProjection();

        assertThat(projection.width()).isEqualTo(2);
        assertThat(projection.height()).isEqualTo(2);
        assertThat(projection.row(0)).containsExactly(20, 30);
        assertThat(projection.row(1)).containsExactly(0, 0);
    }

    @Test
    void emptyPatientIsDropped() throws Exception {
        OctVolume volume = OctVolume.builder("v")
                .addSlice(new Slice(0, filled(1, 1, 0)))
                .patient(PatientMetadata.EMPTY)
                .build();

        assertThat(volume.patient()).isEmpty();
    }
}
