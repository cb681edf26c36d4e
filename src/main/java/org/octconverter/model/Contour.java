package org.octconverter.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * A segmented layer boundary.
 * <p>
 * {@code values[s]} holds one depth coordinate per column of slice {@code s}, or is
 * {@code null} when the layer was not segmented on that slice. Undefined columns are
 * {@link Float#NaN}.
 */
public final class Contour {

    private final String name;
    private final float[][] values;

    public Contour(String name, float[][] values) {
        this.name = name;
        this.values = new float[values.length][];
        for (int s = 0; s < values.length; s++) {
            this.values[s] = values[s] == null ? null : values[s].clone();
        }
    }

    public String name() {
        return name;
    }

    public int sliceCount() {
        return values.length;
    }

    /**
     * @param slice 0-based slice index
     * @return a copy of the depth values for that slice, if the layer covers it
     */
    public Optional<float[]> forSlice(int slice) {
        if (slice < 0 || slice >= values.length || values[slice] == null) {
            return Optional.empty();
        }
        return Optional.of(values[slice].clone());
    }

    @Override
    public String toString() {
        long covered = Arrays.stream(values).filter(v -> v != null).count();
        return "Contour[" + name + ", " + covered + "/" + values.length + " slices]";
    }
}
