package org.octconverter.formats.topcon;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.InconsistentVolumeGeometryException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.model.Decoded;
import org.octconverter.model.OctVolume;
import org.octconverter.test.utils.TestImages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class FdsReaderTest {

    @Test
    void sixteenBitScanWithObservationImage() throws Exception {
        byte[] bytes = new TopconFixtures("FDS")
                .chunk("@IMG_OBS", TopconFixtures.fundus(TestImages.rgbPng(8, 8, 0x808080)))
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(3, 2, 3, 3))
                .build();

        try (FdsReader reader = FdsReader.fromBytes(bytes)) {
            OctVolume volume = reader.readOctVolumes().get(0).value();

            assertThat(reader.formatName()).isEqualTo("Topcon FDS");
            assertThat(volume.sliceCount()).isEqualTo(3);
            assertThat(volume.bitDepth()).isEqualTo(16);
            assertThat(volume.slice(2).plane().row(0)).containsExactly(200, 201, 202);
            assertThat(reader.readFundusImages()).singleElement()
                    .satisfies(d -> assertThat(d.value().imageId()).isEqualTo("@IMG_OBS"));
        }
    }

    @Test
    void repeatedScanChunksAppendInDirectoryOrder() throws Exception {
        byte[] bytes = new TopconFixtures("FDS")
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(2, 2, 2, 2))
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(2, 2, 1, 1))
                .build();

        try (FdsReader reader = FdsReader.fromBytes(bytes)) {
            OctVolume volume = reader.readOctVolumes().get(0).value();

            assertThat(volume.sliceCount()).isEqualTo(3);
            assertThat(volume.slice(2).plane().get(0, 0)).isZero();
            assertThat(volume.slice(1).plane().get(0, 0)).isEqualTo(100);
        }
    }

    @Test
    void slicesBeyondThePayloadAreMissing() throws Exception {
        byte[] bytes = new TopconFixtures("FDS")
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(2, 2, 4, 2))
                .build();

        try (FdsReader reader = FdsReader.fromBytes(bytes)) {
            Decoded<OctVolume> decoded = reader.readOctVolumes().get(0);

            assertThat(decoded.value().sliceCount()).isEqualTo(4);
            assertThat(decoded.value().missingSliceIndices()).containsExactly(2, 3);
            assertThat(decoded.warnings()).singleElement().satisfies(w -> {
                assertThat(w.kind()).isEqualTo(ErrorKind.OUT_OF_BOUNDS);
                assertThat(w.tag()).isEqualTo("@IMG_SCAN_03");
            });
        }
    }

    @Test
    @DisplayName("An empty slice geometry is reported once, not once per declared slice")
    void emptyGeometryIsRejectedOnce() throws Exception {
        byte[] bytes = new TopconFixtures("FDS")
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(0, 4, 200_000, 0))
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(2, 2, 1, 1))
                .build();

        try (FdsReader reader = FdsReader.fromBytes(bytes)) {
            Decoded<OctVolume> decoded = reader.readOctVolumes().get(0);

            assertThat(decoded.value().sliceCount()).isEqualTo(1);
            assertThat(decoded.warnings()).singleElement().satisfies(w -> {
                assertThat(w.kind()).isEqualTo(ErrorKind.INCONSISTENT_VOLUME_GEOMETRY);
                assertThat(w.tag()).isEqualTo("@IMG_SCAN_03");
            });
        }
    }

    @Test
    void scanWithOnlyAnEmptyGeometryFailsTheVolume() throws Exception {
        byte[] bytes = new TopconFixtures("FDS")
                .chunk("@IMG_SCAN_03", TopconFixtures.fdsScan(4, 0, 200_000, 0))
                .build();

        try (FdsReader reader = FdsReader.fromBytes(bytes)) {
            assertThatThrownBy(reader::readOctVolumes).isInstanceOf(InconsistentVolumeGeometryException.class);
        }
    }

    @Test
    void badMagicIsUnrecognized() {
        byte[] fda = new TopconFixtures("FDA").chunk("@IMG_SCAN_03", new byte[4]).build();

        assertThatThrownBy(() -> FdsReader.fromBytes(fda)).isInstanceOf(UnrecognizedFormatException.class);
        assertThatThrownBy(() -> FdsReader.fromBytes("CMDb".getBytes())).isInstanceOf(UnrecognizedFormatException.class);
    }

    @Test
    void fileWithoutChunksIsUnrecognized() throws Exception {
        byte[] headerOnly = new TopconFixtures("FDS").build();

        try (FdsReader reader = FdsReader.fromBytes(headerOnly)) {
            assertThatThrownBy(reader::readOctVolumes).isInstanceOf(UnrecognizedFormatException.class);
        }
    }
}
