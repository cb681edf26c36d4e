package org.octconverter.metadata;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.octconverter.model.DeviceMetadata;
import org.octconverter.model.Laterality;
import org.octconverter.model.PatientMetadata;

/**
 * Metadata values collected for one volume or image while its records are decoded.
 * A later value for the same field replaces the earlier one unless {@link #putIfAbsent} is used.
 */
public final class MetadataRecord {

    private final Map<MetadataField<?>, Object> values = new LinkedHashMap<>();

    public <V> void put(MetadataField<V> field, V value) {
        if (value != null) {
            values.put(field, value);
        }
    }

    public <V> void putIfAbsent(MetadataField<V> field, V value) {
        if (value != null) {
            values.putIfAbsent(field, value);
        }
    }

    public <V> Optional<V> get(MetadataField<V> field) {
        return Optional.ofNullable(values.get(field)).map(field::cast);
    }

    public boolean contains(MetadataField<?> field) {
        return values.containsKey(field);
    }

    /**
     * Fills fields this record lacks from {@code fallback}.
     */
    public void inheritFrom(MetadataRecord fallback) {
        fallback.values.forEach(values::putIfAbsent);
    }

    public PatientMetadata patient() {
        return PatientMetadata.builder()
                .patientId(get(MetadataField.PATIENT_ID).orElse(null))
                .firstName(get(MetadataField.FIRST_NAME).orElse(null))
                .surname(get(MetadataField.SURNAME).orElse(null))
                .sex(get(MetadataField.SEX).orElse(null))
                .birthDate(get(MetadataField.BIRTH_DATE).orElse(null))
                .build();
    }

    public DeviceMetadata device(String manufacturer) {
        return new DeviceMetadata(manufacturer,
                get(MetadataField.DEVICE_MODEL).orElse(null),
                get(MetadataField.DEVICE_SERIAL).orElse(null),
                get(MetadataField.SOFTWARE_VERSION).orElse(null));
    }

    public Laterality laterality() {
        return get(MetadataField.LATERALITY).orElse(Laterality.UNKNOWN);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
