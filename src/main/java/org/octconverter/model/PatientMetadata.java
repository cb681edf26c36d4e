package org.octconverter.model;

import java.time.LocalDate;

/**
 * Patient identity as stored by the device. Every component is optional and {@code null}
 * when the file does not carry it or the field could not be decoded.
 *
 * @param firstName given name
 * @param surname   family name
 * @param sex       sex
 * @param birthDate date of birth
 * @param patientId device- or site-assigned identifier
 */
public record PatientMetadata(String firstName, String surname, Sex sex, LocalDate birthDate, String patientId) {

    public static final PatientMetadata EMPTY = new PatientMetadata(null, null, null, null, null);

    public boolean isEmpty() {
        return firstName == null && surname == null && sex == null && birthDate == null && patientId == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator used while metadata fields are extracted one by one.
     */
    public static final class Builder {
        private String firstName;
        private String surname;
        private Sex sex;
        private LocalDate birthDate;
        private String patientId;

        public Builder firstName(String firstName) {
            this.firstName = blankToNull(firstName);
            return this;
        }

        public Builder surname(String surname) {
            this.surname = blankToNull(surname);
            return this;
        }

        public Builder sex(Sex sex) {
            this.sex = sex;
            return this;
        }

        public Builder birthDate(LocalDate birthDate) {
            this.birthDate = birthDate;
            return this;
        }

        public Builder patientId(String patientId) {
            this.patientId = blankToNull(patientId);
            return this;
        }

        public PatientMetadata build() {
            return new PatientMetadata(firstName, surname, sex, birthDate, patientId);
        }

        private static String blankToNull(String s) {
            return s == null || s.isBlank() ? null : s.trim();
        }
    }
}
