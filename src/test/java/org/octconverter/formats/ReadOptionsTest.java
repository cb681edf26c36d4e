package org.octconverter.formats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class ReadOptionsTest {

    @Test
    void referenceConfigMatchesDefaults() {
        Config config = ConfigFactory.defaultReference();

        assertThat(ReadOptions.fromConfig(config)).isEqualTo(ReadOptions.defaults());
    }

    @Test
    void missingKeysKeepTheirDefaults() {
        Config config = ConfigFactory.parseString("octconverter.read { deinterlace = true, e2e.gamma = 1.5 }");

        ReadOptions options = ReadOptions.fromConfig(config);

        assertThat(options.deinterlace()).isTrue();
        assertThat(options.e2eGamma()).isEqualTo(1.5);
        assertThat(options.zeissRows()).isEqualTo(ReadOptions.DEFAULT_ZEISS_ROWS);
        assertThat(options.zeissCols()).isEqualTo(ReadOptions.DEFAULT_ZEISS_COLS);
    }

    @Test
    void emptyConfigGivesDefaults() {
        assertThat(ReadOptions.fromConfig(ConfigFactory.empty())).isEqualTo(ReadOptions.defaults());
    }

    @Test
    void invalidValuesAreProgrammerErrors() {
        assertThatThrownBy(() -> ReadOptions.defaults().withZeissFrame(0, 512))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReadOptions.defaults().withE2eGamma(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReadOptions.fromConfig(ConfigFactory.parseString("octconverter.read.zeiss.cols = -1")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
