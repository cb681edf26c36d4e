package org.octconverter.pixel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class UFloat16Test {

    @Test
    void exponentIsBiasedBy63() {
        assertThat(UFloat16.toDouble(63 << 10)).isEqualTo(1.0);
        assertThat(UFloat16.toDouble(64 << 10)).isEqualTo(2.0);
        assertThat(UFloat16.toDouble(62 << 10)).isEqualTo(0.5);
    }

    @Test
    void mantissaIsTheLowTenBitsLeastSignificantFirst() {
        assertThat(UFloat16.toDouble(60 << 10 | 1)).isEqualTo(0.1875);
        assertThat(UFloat16.toDouble(63 << 10 | 1)).isEqualTo(1.5);
        assertThat(UFloat16.toDouble(63 << 10 | 512)).isCloseTo(1.0 + 1 / 1024.0, within(1e-12));
        assertThat(UFloat16.toDouble(63 << 10 | 0b11)).isCloseTo(1.75, within(1e-12));
        assertThat(UFloat16.toDouble(63 << 10 | 1023)).isCloseTo(1.0 + 1023 / 1024.0, within(1e-12));
    }

    @Test
    void displayValuesAreClamped() {
        assertThat(UFloat16.toDisplay(0xFFFF, 2.4)).isEqualTo(255);
        assertThat(UFloat16.toDisplay(0, 2.4)).isZero();
    }

    @Test
    void displayTableIsSharedPerGamma() {
        short[] first = UFloat16.displayTable(1.8);

        assertThat(UFloat16.displayTable(1.8)).isSameAs(first);
        assertThat(first).hasSize(65536);
        assertThat(first[62 << 10]).isEqualTo((short) UFloat16.toDisplay(62 << 10, 1.8));
    }

    @Test
    void nonPositiveGammaIsRejected() {
        assertThatThrownBy(() -> UFloat16.displayTable(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
