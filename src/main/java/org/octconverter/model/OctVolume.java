package org.octconverter.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.octconverter.errors.InconsistentVolumeGeometryException;

/**
 * An ordered stack of B-scans with the metadata of the scan that produced them.
 * <p>
 * Slices are ordered by their device slice index. Every present slice shares one
 * {@link PixelPlane.Geometry}, and at least one slice is present; both are checked by
 * {@link Builder#build()}. Missing slices stay in place as placeholders.
 */
public final class OctVolume {

    private final String volumeId;
    private final List<Slice> slices;
    private final PixelPlane.Geometry geometry;
    private final Laterality laterality;
    private final LocalDateTime acquisitionDateTime;
    private final PatientMetadata patient;
    private final DeviceMetadata device;
    private final List<Contour> contours;
    private final PixelSpacing pixelSpacing;

    private OctVolume(Builder b, List<Slice> slices, PixelPlane.Geometry geometry) {
        this.volumeId = b.volumeId;
        this.slices = slices;
        this.geometry = geometry;
        this.laterality = b.laterality;
        this.acquisitionDateTime = b.acquisitionDateTime;
        this.patient = b.patient;
        this.device = b.device;
        this.contours = List.copyOf(b.contours);
        this.pixelSpacing = b.pixelSpacing;
    }

    public static Builder builder(String volumeId) {
        return new Builder(volumeId);
    }

    public String volumeId() {
        return volumeId;
    }

    public List<Slice> slices() {
        return slices;
    }

    public int sliceCount() {
        return slices.size();
    }

    public Slice slice(int position) {
        return slices.get(position);
    }

    public int width() {
        return geometry.width();
    }

    public int height() {
        return geometry.height();
    }

    public int bitDepth() {
        return geometry.bitDepth();
    }

    public PixelPlane.Geometry geometry() {
        return geometry;
    }

    public Laterality laterality() {
        return laterality;
    }

    public Optional<LocalDateTime> acquisitionDateTime() {
        return Optional.ofNullable(acquisitionDateTime);
    }

    public Optional<PatientMetadata> patient() {
        return Optional.ofNullable(patient);
    }

    public Optional<DeviceMetadata> device() {
        return Optional.ofNullable(device);
    }

    public List<Contour> contours() {
        return contours;
    }

    public Optional<PixelSpacing> pixelSpacing() {
        return Optional.ofNullable(pixelSpacing);
    }

    /**
     * @return the slice indices whose payload could not be decoded, ascending.
     */
    public List<Integer> missingSliceIndices() {
        List<Integer> missing = new ArrayList<>();
        for (Slice s : slices) {
            if (s.isMissing()) {
                missing.add(s.index());
            }
        }
        return missing;
    }

    /**
     * Averages every depth column of every present slice into an en-face image.
     * <p>
     * The result has {@link #width()} columns and one row per slice position; rows of missing
     * slices are zero. Colour volumes are averaged on their luminance.
     *
     * @return an 8- or 16-bit plane matching the volume's bit depth
     */
    public PixelPlane meanProjection() {
        int w = width();
        int h = height();
        int rows = slices.size();
        short[] out = new short[w * rows];
        for (int r = 0; r < rows; r++) {
            PixelPlane plane = slices.get(r).plane();
            if (plane == null) {
                continue;
            }
            for (int x = 0; x < w; x++) {
                long sum = 0;
                for (int y = 0; y < h; y++) {
                    int v = plane.get(x, y);
                    sum += plane.isColor() ? luminance(v) : v;
                }
                out[r * w + x] = (short) Math.round((double) sum / h);
            }
        }
        return bitDepth() == 16 ? PixelPlane.gray16(w, rows, out) : PixelPlane.gray8(w, rows, out);
    }

    private static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }

    @Override
    public String toString() {
        return "OctVolume[" + volumeId + ", " + slices.size() + " slices, " + geometry + ", " + laterality + "]";
    }

    /**
     * Collects slices and metadata while a file is decoded. Slices may be added in any order.
     */
    public static final class Builder {
        private final String volumeId;
        private final List<Slice> slices = new ArrayList<>();
        private final List<Contour> contours = new ArrayList<>();
        private Laterality laterality = Laterality.UNKNOWN;
        private LocalDateTime acquisitionDateTime;
        private PatientMetadata patient;
        private DeviceMetadata device;
        private PixelSpacing pixelSpacing;

        private Builder(String volumeId) {
            this.volumeId = volumeId;
        }

        public Builder addSlice(Slice slice) {
            slices.add(slice);
            return this;
        }

        public Builder addSlices(List<Slice> toAdd) {
            slices.addAll(toAdd);
            return this;
        }

        public Builder laterality(Laterality laterality) {
            this.laterality = laterality == null ? Laterality.UNKNOWN : laterality;
            return this;
        }

        public Builder acquisitionDateTime(LocalDateTime acquisitionDateTime) {
            this.acquisitionDateTime = acquisitionDateTime;
            return this;
        }

        public Builder patient(PatientMetadata patient) {
            this.patient = patient == null || patient.isEmpty() ? null : patient;
            return this;
        }

        public Builder device(DeviceMetadata device) {
            this.device = device;
            return this;
        }

        public Builder addContour(Contour contour) {
            contours.add(contour);
            return this;
        }

        public Builder pixelSpacing(PixelSpacing pixelSpacing) {
            this.pixelSpacing = pixelSpacing;
            return this;
        }

        public int sliceCount() {
            return slices.size();
        }

        /**
         * Orders the slices by index (stable for equal indices) and checks the geometry.
         *
         * @return the immutable volume
         * @throws InconsistentVolumeGeometryException if no slice was decoded or present slices
         *                                             differ in width, height or bit depth
         */
        public OctVolume build() throws InconsistentVolumeGeometryException {
            List<Slice> ordered = new ArrayList<>(slices);
            ordered.sort(Comparator.comparingInt(Slice::index));
            PixelPlane.Geometry geometry = null;
            for (Slice s : ordered) {
                if (s.isMissing()) {
                    continue;
                }
                PixelPlane.Geometry g = s.plane().geometry();
                if (geometry == null) {
                    geometry = g;
                } else if (!geometry.equals(g)) {
                    throw new InconsistentVolumeGeometryException("Volume " + volumeId + ": slice " + s.index()
                            + " is " + g + " but earlier slices are " + geometry, -1, volumeId);
                }
            }
            if (geometry == null) {
                throw new InconsistentVolumeGeometryException("Volume " + volumeId + " has no decoded slice ("
                        + ordered.size() + " missing)", -1, volumeId);
            }
            return new OctVolume(this, Collections.unmodifiableList(ordered), geometry);
        }
    }
}
