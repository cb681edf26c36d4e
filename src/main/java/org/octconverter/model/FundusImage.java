package org.octconverter.model;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A single en-face photograph or scanning-laser image of the retina.
 *
 * @param imageId             identifier unique within the file
 * @param plane               grayscale or RGB pixels
 * @param laterality          eye, {@link Laterality#UNKNOWN} when not recorded
 * @param acquisitionDateTime capture time, or {@code null}
 * @param patient             patient metadata, or {@code null}
 * @param device              device metadata, or {@code null}
 */
public record FundusImage(String imageId, PixelPlane plane, Laterality laterality,
                          LocalDateTime acquisitionDateTime, PatientMetadata patient, DeviceMetadata device) {

    public FundusImage {
        Objects.requireNonNull(plane, "plane");
        laterality = laterality == null ? Laterality.UNKNOWN : laterality;
        patient = patient == null || patient.isEmpty() ? null : patient;
    }

    public static FundusImage of(String imageId, PixelPlane plane) {
        return new FundusImage(imageId, plane, Laterality.UNKNOWN, null, null, null);
    }

    public FundusImage withLaterality(Laterality value) {
        return new FundusImage(imageId, plane, value, acquisitionDateTime, patient, device);
    }

    public FundusImage withAcquisitionDateTime(LocalDateTime value) {
        return new FundusImage(imageId, plane, laterality, value, patient, device);
    }

    public FundusImage withPatient(PatientMetadata value) {
        return new FundusImage(imageId, plane, laterality, acquisitionDateTime, value, device);
    }

    public FundusImage withDevice(DeviceMetadata value) {
        return new FundusImage(imageId, plane, laterality, acquisitionDateTime, patient, value);
    }

    public int width() {
        return plane.width();
    }

    public int height() {
        return plane.height();
    }

    public Optional<LocalDateTime> acquisitionTime() {
        return Optional.ofNullable(acquisitionDateTime);
    }
}
