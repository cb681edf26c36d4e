package org.octconverter.formats;

import com.typesafe.config.Config;

/**
 * Caller-supplied decoding options.
 *
 * @param deinterlace split every Zeiss frame into its two stacked fields
 * @param zeissRows   samples per A-scan in Zeiss IMG files
 * @param zeissCols   A-scans per B-scan in Zeiss IMG files
 * @param e2eGamma    display gamma applied to Heidelberg {@code ufloat16} samples
 */
public record ReadOptions(boolean deinterlace, int zeissRows, int zeissCols, double e2eGamma) {

    public static final int DEFAULT_ZEISS_ROWS = 1024;
    public static final int DEFAULT_ZEISS_COLS = 512;
    public static final double DEFAULT_E2E_GAMMA = 2.4;

    public ReadOptions {
        if (zeissRows <= 0 || zeissCols <= 0) {
            throw new IllegalArgumentException("Zeiss frame size must be positive, got " + zeissRows + "x" + zeissCols);
        }
        if (!(e2eGamma > 0) || Double.isInfinite(e2eGamma)) {
            throw new IllegalArgumentException("E2E gamma must be a positive number, got " + e2eGamma);
        }
    }

    public static ReadOptions defaults() {
        return new ReadOptions(false, DEFAULT_ZEISS_ROWS, DEFAULT_ZEISS_COLS, DEFAULT_E2E_GAMMA);
    }

    /**
     * Reads the {@code octconverter.read} block; missing keys keep their defaults.
     *
     * @param config the resolved application configuration
     * @return the options
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ReadOptions fromConfig(Config config) {
        ReadOptions d = defaults();
        if (!config.hasPath("octconverter.read")) {
            return d;
        }
        Config read = config.getConfig("octconverter.read");
        return new ReadOptions(
                read.hasPath("deinterlace") ? read.getBoolean("deinterlace") : d.deinterlace(),
                read.hasPath("zeiss.rows") ? read.getInt("zeiss.rows") : d.zeissRows(),
                read.hasPath("zeiss.cols") ? read.getInt("zeiss.cols") : d.zeissCols(),
                read.hasPath("e2e.gamma") ? read.getDouble("e2e.gamma") : d.e2eGamma());
    }

    public ReadOptions withDeinterlace(boolean value) {
        return new ReadOptions(value, zeissRows, zeissCols, e2eGamma);
    }

    public ReadOptions withZeissFrame(int rows, int cols) {
        return new ReadOptions(deinterlace, rows, cols, e2eGamma);
    }

    public ReadOptions withE2eGamma(double value) {
        return new ReadOptions(deinterlace, zeissRows, zeissCols, value);
    }
}
