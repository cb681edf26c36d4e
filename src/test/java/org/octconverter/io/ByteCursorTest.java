package org.octconverter.io;

import static java.nio.ByteOrder.BIG_ENDIAN;
import static java.nio.ByteOrder.LITTLE_ENDIAN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.OutOfBoundsException;
import org.octconverter.test.utils.LeBytes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ByteCursorTest {

    @Test
    void readsLittleAndBigEndianValues() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[] {0x01, 0x02, 0x03, 0x04, (byte) 0xFF, (byte) 0xFE});

        assertThat(cursor.readU16(LITTLE_ENDIAN)).isEqualTo(0x0201);
        assertThat(cursor.readU16(BIG_ENDIAN)).isEqualTo(0x0304);
        assertThat(cursor.readI16(LITTLE_ENDIAN)).isEqualTo((short) 0xFEFF);
        assertThat(cursor.remaining()).isZero();
    }

    @Test
    void readsUnsigned32And64BitValues() throws Exception {
        byte[] data = new LeBytes().u32(0xFFFFFFFFL).u64(-1L).toByteArray();
        ByteCursor cursor = ByteCursor.wrap(data);

        assertThat(cursor.readU32(LITTLE_ENDIAN)).isEqualTo(0xFFFFFFFFL);
        assertThat(cursor.readU64(LITTLE_ENDIAN)).isEqualTo(-1L);
    }

    @Test
    void fixedStringStopsAtNulAndConsumesWholeField() throws Exception {
        byte[] data = new LeBytes().fixed("ABC  ", 8).u8(7).toByteArray();
        ByteCursor cursor = ByteCursor.wrap(data);

        assertThat(cursor.readFixedString(8, StandardCharsets.US_ASCII)).isEqualTo("ABC");
        assertThat(cursor.readU8()).isEqualTo(7);
    }

    @Test
    @DisplayName("Zero-length read at the end is allowed, one more byte is not")
    void zeroLengthReadAtEnd() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[4]);
        cursor.seek(4);

        assertThat(cursor.readBytes(0)).isEmpty();
        assertThatThrownBy(cursor::readU8)
                .isInstanceOf(OutOfBoundsException.class)
                .satisfies(e -> assertThat(((OutOfBoundsException) e).kind()).isEqualTo(ErrorKind.OUT_OF_BOUNDS));
    }

    @Test
    void rejectsNegativeOffsetsAndLengths() {
        ByteCursor cursor = ByteCursor.wrap(new byte[16]);

        assertThatThrownBy(() -> cursor.seek(-1)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> cursor.skip(-4)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> cursor.slice(2, -1)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> cursor.readBytes(-1)).isInstanceOf(OutOfBoundsException.class);
    }

    @Test
    @DisplayName("Lengths near Long.MAX_VALUE do not overflow the bounds check")
    void rejectsMaxUnsignedLengths() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[16]);
        cursor.seek(8);

        assertThatThrownBy(() -> cursor.slice(8, Long.MAX_VALUE)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> cursor.readSlice(Long.MAX_VALUE)).isInstanceOf(OutOfBoundsException.class);
        assertThatThrownBy(() -> ByteCursor.requireNonNegative(0xFFFFFFFFFFFFFFFFL, "length"))
                .isInstanceOf(OutOfBoundsException.class)
                .hasMessageContaining("18446744073709551615");
        assertThat(cursor.position()).isEqualTo(8);
    }

    @Test
    void failedReadLeavesPositionUnchanged() throws Exception {
        ByteCursor cursor = ByteCursor.wrap(new byte[3]);
        cursor.skip(1);

        assertThatThrownBy(() -> cursor.readU32(LITTLE_ENDIAN)).isInstanceOf(OutOfBoundsException.class);
        assertThat(cursor.position()).isEqualTo(1);
    }

    @Test
    void slicesReportAbsoluteOffsets() throws Exception {
        byte[] data = new LeBytes().zeros(10).u16(0xBEEF).toByteArray();
        ByteCursor file = ByteCursor.wrap(data);

        ByteCursor slice = file.slice(8, 4);
        slice.skip(2);

        assertThat(slice.base()).isEqualTo(8);
        assertThat(slice.absolutePosition()).isEqualTo(10);
        assertThat(slice.readU16(LITTLE_ENDIAN)).isEqualTo(0xBEEF);
        assertThatThrownBy(slice::readU8)
                .isInstanceOf(OutOfBoundsException.class)
                .satisfies(e -> assertThat(((OutOfBoundsException) e).offset()).hasValue(12));
    }

    @Test
    void matchesDoesNotMove() throws Exception {
        ByteCursor cursor = ByteCursor.wrap("CMDb".getBytes(StandardCharsets.US_ASCII));

        assertThat(cursor.matches("CMD".getBytes(StandardCharsets.US_ASCII))).isTrue();
        assertThat(cursor.matches("CMDbX".getBytes(StandardCharsets.US_ASCII))).isFalse();
        assertThat(cursor.position()).isZero();
    }
}
