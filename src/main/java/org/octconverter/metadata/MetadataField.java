package org.octconverter.metadata;

import java.time.LocalDate;
import java.time.LocalDateTime;

import org.octconverter.model.Laterality;
import org.octconverter.model.PixelSpacing;
import org.octconverter.model.Sex;

/**
 * Typed key of a metadata value collected into a {@link MetadataRecord}.
 *
 * @param <V> value type
 */
public final class MetadataField<V> {

    public static final MetadataField<String> PATIENT_ID = new MetadataField<>("patientId", String.class);
    public static final MetadataField<String> FIRST_NAME = new MetadataField<>("firstName", String.class);
    public static final MetadataField<String> SURNAME = new MetadataField<>("surname", String.class);
    public static final MetadataField<Sex> SEX = new MetadataField<>("sex", Sex.class);
    public static final MetadataField<LocalDate> BIRTH_DATE = new MetadataField<>("birthDate", LocalDate.class);
    public static final MetadataField<Laterality> LATERALITY = new MetadataField<>("laterality", Laterality.class);
    public static final MetadataField<LocalDateTime> ACQUISITION_TIME =
            new MetadataField<>("acquisitionTime", LocalDateTime.class);
    public static final MetadataField<String> DEVICE_MODEL = new MetadataField<>("deviceModel", String.class);
    public static final MetadataField<String> DEVICE_SERIAL = new MetadataField<>("deviceSerial", String.class);
    public static final MetadataField<String> SOFTWARE_VERSION =
            new MetadataField<>("softwareVersion", String.class);
    public static final MetadataField<PixelSpacing> PIXEL_SPACING =
            new MetadataField<>("pixelSpacing", PixelSpacing.class);

    private final String name;
    private final Class<V> type;

    private MetadataField(String name, Class<V> type) {
        this.name = name;
        this.type = type;
    }

    public String name() {
        return name;
    }

    V cast(Object value) {
        return type.cast(value);
    }

    @Override
    public String toString() {
        return name;
    }
}
