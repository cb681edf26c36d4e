package org.octconverter.formats.dicom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.model.Decoded;
import org.octconverter.model.FundusImage;
import org.octconverter.model.Laterality;
import org.octconverter.model.OctVolume;
import org.octconverter.model.PixelSpacing;
import org.octconverter.model.Sex;
import org.octconverter.test.utils.LeBytes;
import org.octconverter.test.utils.TestImages;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DicomReaderTest {

    // sample k of frame f holds f * 10 + k
    private static byte[] frames8(int frames, int samplesPerFrame) {
        byte[] data = new byte[frames * samplesPerFrame];
        for (int f = 0; f < frames; f++) {
            for (int k = 0; k < samplesPerFrame; k++) {
                data[f * samplesPerFrame + k] = (byte) (f * 10 + k);
            }
        }
        return data;
    }

    private static DicomFixtures octHeader(DicomFixtures file, int frames, int bits) {
        return file.text(DicomTag.ACQUISITION_DATE_TIME, "20210304101112.123")
                .text(DicomTag.MODALITY, "OPT")
                .text(DicomTag.MANUFACTURER, "Carl Zeiss Meditec")
                .text(DicomTag.MANUFACTURER_MODEL_NAME, "Cirrus")
                .text(DicomTag.PATIENT_NAME, "Doe^John")
                .text(DicomTag.PATIENT_ID, "PAT-9")
                .text(DicomTag.PATIENT_BIRTH_DATE, "19800101")
                .text(DicomTag.PATIENT_SEX, "M")
                .text(DicomTag.SPACING_BETWEEN_SLICES, "0.1")
                .text(DicomTag.LATERALITY, "R")
                .text(DicomTag.IMAGE_LATERALITY, "L")
                .text(DicomTag.NUMBER_OF_FRAMES, String.valueOf(frames))
                .us(DicomTag.ROWS, 2)
                .us(DicomTag.COLUMNS, 3)
                .text(DicomTag.PIXEL_SPACING, "0.5\\0.25")
                .us(DicomTag.BITS_ALLOCATED, bits);
    }

    @Test
    void explicitVrOctVolume() throws Exception {
        byte[] bytes = octHeader(DicomFixtures.explicitLittleEndian(), 2, 8)
                .pixels("OB", frames8(2, 6))
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            Decoded<OctVolume> decoded = reader.readOctVolumes().get(0);
            OctVolume volume = decoded.value();

            assertThat(volume.volumeId()).isEqualTo("memory");
            assertThat(volume.sliceCount()).isEqualTo(2);
            assertThat(volume.geometry().toString()).isEqualTo("3x2@8");
            assertThat(volume.slice(1).plane().row(1)).containsExactly(13, 14, 15);
            assertThat(volume.laterality()).isEqualTo(Laterality.LEFT);
            assertThat(volume.acquisitionDateTime()).hasValue(LocalDateTime.of(2021, 3, 4, 10, 11, 12));
            assertThat(volume.pixelSpacing()).hasValue(new PixelSpacing(0.25, 0.5, 0.1));
            assertThat(volume.patient()).get().satisfies(p -> {
                assertThat(p.surname()).isEqualTo("Doe");
                assertThat(p.firstName()).isEqualTo("John");
                assertThat(p.patientId()).isEqualTo("PAT-9");
                assertThat(p.birthDate()).isEqualTo(LocalDate.of(1980, 1, 1));
                assertThat(p.sex()).isEqualTo(Sex.MALE);
            });
            assertThat(volume.device()).get().satisfies(d -> {
                assertThat(d.manufacturer()).isEqualTo("Carl Zeiss Meditec");
                assertThat(d.model()).isEqualTo("Cirrus");
            });
            assertThat(decoded.warnings()).isEmpty();
            assertThat(reader.readFundusImages()).isEmpty();
        }
    }

    @Test
    void implicitVrSixteenBitVolume() throws Exception {
        LeBytes samples = new LeBytes();
        for (int k = 0; k < 6; k++) {
            samples.u16(1000 * k);
        }
        byte[] bytes = octHeader(DicomFixtures.implicitLittleEndian(), 1, 16)
                .pixels("OW", samples.toByteArray())
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            OctVolume volume = reader.readOctVolumes().get(0).value();

            assertThat(volume.bitDepth()).isEqualTo(16);
            assertThat(volume.slice(0).plane().row(1)).containsExactly(3000, 4000, 5000);
            assertThat(volume.patient()).get().satisfies(p -> assertThat(p.patientId()).isEqualTo("PAT-9"));
        }
    }

    @Test
    void sequencesAreSkipped() throws Exception {
        byte[] bytes = DicomFixtures.explicitLittleEndian()
                .text(DicomTag.MODALITY, "OPT")
                .sequence(0x00081115)
                .text(DicomTag.PATIENT_ID, "AFTER-SEQ")
                .us(DicomTag.ROWS, 1)
                .us(DicomTag.COLUMNS, 2)
                .us(DicomTag.BITS_ALLOCATED, 8)
                .pixels("OB", new byte[] {7, 9})
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            Decoded<OctVolume> decoded = reader.readOctVolumes().get(0);

            assertThat(decoded.value().patient()).get()
                    .satisfies(p -> assertThat(p.patientId()).isEqualTo("AFTER-SEQ"));
            assertThat(decoded.value().slice(0).plane().row(0)).containsExactly(7, 9);
            assertThat(decoded.value().device()).get()
                    .satisfies(d -> assertThat(d.manufacturer()).isEqualTo("unknown"));
            assertThat(decoded.warnings()).isEmpty();
        }
    }

    @Test
    void missingFramesAreReported() throws Exception {
        byte[] bytes = octHeader(DicomFixtures.explicitLittleEndian(), 3, 8)
                .pixels("OB", frames8(2, 6))
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            Decoded<OctVolume> decoded = reader.readOctVolumes().get(0);

            assertThat(decoded.value().sliceCount()).isEqualTo(2);
            assertThat(decoded.warnings()).singleElement()
                    .satisfies(w -> assertThat(w.kind()).isEqualTo(ErrorKind.OUT_OF_BOUNDS));
        }
    }

    @Test
    void ophthalmicPhotographsAreFundusImages() throws Exception {
        byte[] rgb = {(byte) 255, 0, 0, 0, (byte) 255, 0, 0, 0, (byte) 255, 1, 2, 3};
        byte[] bytes = DicomFixtures.explicitLittleEndian()
                .text(DicomTag.MODALITY, "OP")
                .text(DicomTag.IMAGE_LATERALITY, "R")
                .us(DicomTag.SAMPLES_PER_PIXEL, 3)
                .text(DicomTag.NUMBER_OF_FRAMES, "2")
                .us(DicomTag.ROWS, 1)
                .us(DicomTag.COLUMNS, 2)
                .us(DicomTag.BITS_ALLOCATED, 8)
                .pixels("OB", rgb)
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            List<Decoded<FundusImage>> images = reader.readFundusImages();

            assertThat(images).extracting(Decoded::value).extracting(FundusImage::imageId)
                    .containsExactly("memory#0", "memory#1");
            assertThat(images.get(0).value().plane().row(0)).containsExactly(0xFF0000, 0x00FF00);
            assertThat(images.get(1).value().plane().row(0)).containsExactly(0x0000FF, 0x010203);
            assertThat(images.get(0).value().laterality()).isEqualTo(Laterality.RIGHT);
            assertThat(reader.readOctVolumes()).isEmpty();
        }
    }

    @Test
    void encapsulatedFragmentsOfOneFrameAreJoined() throws Exception {
        byte[] png = TestImages.rgbPng(5, 4, 0x336699);
        int half = png.length / 2 + png.length / 2 % 2;
        byte[] bytes = DicomFixtures.explicitLittleEndian()
                .text(DicomTag.MODALITY, "OP")
                .fragments(Arrays.copyOfRange(png, 0, half), padToEven(Arrays.copyOfRange(png, half, png.length)))
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            assertThat(reader.listDirectory()).extracting(DirectoryEntry::tag)
                    .contains("(7FE0,0010)#0", "(7FE0,0010)#1");
            assertThat(reader.readFundusImages()).singleElement().satisfies(d -> {
                assertThat(d.value().imageId()).isEqualTo("memory");
                assertThat(d.value().plane().get(4, 3)).isEqualTo(0x336699);
            });
        }
    }

    @Test
    void oneFragmentPerFrame() throws Exception {
        byte[] bytes = DicomFixtures.explicitLittleEndian()
                .text(DicomTag.MODALITY, "OPT")
                .text(DicomTag.NUMBER_OF_FRAMES, "2")
                .fragments(padToEven(TestImages.grayPng(3, 2, 0)), padToEven(TestImages.grayPng(3, 2, 40)))
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            OctVolume volume = reader.readOctVolumes().get(0).value();

            assertThat(volume.sliceCount()).isEqualTo(2);
            assertThat(volume.slice(1).plane().get(0, 0)).isEqualTo(40);
        }
    }

    @Test
    void bigEndianIsUnsupported() throws Exception {
        byte[] bytes = DicomFixtures.withTransferSyntax(DicomParser.EXPLICIT_BE)
                .text(DicomTag.MODALITY, "OPT")
                .build();

        try (DicomReader reader = DicomReader.fromBytes(bytes)) {
            assertThatThrownBy(reader::readOctVolumes).isInstanceOf(UnrecognizedFormatException.class)
                    .hasMessageContaining(DicomParser.EXPLICIT_BE);
        }
    }

    @Test
    void missingPrefixIsUnrecognized() {
        byte[] bytes = DicomFixtures.explicitLittleEndian().text(DicomTag.MODALITY, "OPT").build();
        bytes[DicomParser.PREAMBLE] = 'X';

        assertThatThrownBy(() -> DicomReader.fromBytes(bytes)).isInstanceOf(UnrecognizedFormatException.class);
        assertThatThrownBy(() -> DicomReader.fromBytes(new byte[100]))
                .isInstanceOf(UnrecognizedFormatException.class);
    }

    @Test
    void personNamesAndTimes() {
        assertThat(DicomReader.nameComponent("Doe^John^^Dr", 0)).isEqualTo("Doe");
        assertThat(DicomReader.nameComponent("Doe^John^^Dr", 2)).isNull();
        assertThat(DicomReader.nameComponent("Doe", 1)).isNull();
        assertThat(DicomReader.dateTime("20200102", "0304")).isEqualTo(LocalDateTime.of(2020, 1, 2, 3, 4));
        assertThat(DicomReader.dateTime("20200102", "03:04:05.250")).isEqualTo(LocalDateTime.of(2020, 1, 2, 3, 4, 5));
        assertThat(DicomReader.dateTime("20200102", null)).isEqualTo(LocalDateTime.of(2020, 1, 2, 0, 0));
    }

    // trailing zero bytes after the image end are ignored by ImageIO
    private static byte[] padToEven(byte[] data) {
        return data.length % 2 == 0 ? data : Arrays.copyOf(data, data.length + 1);
    }
}
