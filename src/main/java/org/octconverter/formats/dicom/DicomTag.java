package org.octconverter.formats.dicom;

/**
 * The data elements this library reads, with their value representation for implicit-VR files.
 */
public enum DicomTag {
    TRANSFER_SYNTAX_UID(0x00020010, "UI"),
    MODALITY(0x00080060, "CS"),
    ACQUISITION_DATE(0x00080022, "DA"),
    CONTENT_DATE(0x00080023, "DA"),
    ACQUISITION_DATE_TIME(0x0008002A, "DT"),
    ACQUISITION_TIME(0x00080032, "TM"),
    CONTENT_TIME(0x00080033, "TM"),
    MANUFACTURER(0x00080070, "LO"),
    MANUFACTURER_MODEL_NAME(0x00081090, "LO"),
    PATIENT_NAME(0x00100010, "PN"),
    PATIENT_ID(0x00100020, "LO"),
    PATIENT_BIRTH_DATE(0x00100030, "DA"),
    PATIENT_SEX(0x00100040, "CS"),
    SPACING_BETWEEN_SLICES(0x00180088, "DS"),
    DEVICE_SERIAL_NUMBER(0x00181000, "LO"),
    LATERALITY(0x00200060, "CS"),
    IMAGE_LATERALITY(0x00200062, "CS"),
    SAMPLES_PER_PIXEL(0x00280002, "US"),
    NUMBER_OF_FRAMES(0x00280008, "IS"),
    ROWS(0x00280010, "US"),
    COLUMNS(0x00280011, "US"),
    PIXEL_SPACING(0x00280030, "DS"),
    BITS_ALLOCATED(0x00280100, "US"),
    /** Native (uncompressed) pixel data. */
    PIXEL_DATA(0x7FE00010, "OW"),
    /** One fragment of encapsulated pixel data. */
    PIXEL_FRAGMENT(0x7FE00010, "OB"),
    UNKNOWN(-1, "UN");

    private final int tag;
    private final String vr;

    DicomTag(int tag, String vr) {
        this.tag = tag;
        this.vr = vr;
    }

    public int tag() {
        return tag;
    }

    public String vr() {
        return vr;
    }

    public static DicomTag fromTag(int tag) {
        for (DicomTag t : values()) {
            if (t.tag == tag && t != PIXEL_FRAGMENT) {
                return t;
            }
        }
        return UNKNOWN;
    }

    /**
     * @return the tag as {@code (gggg,eeee)}
     */
    public static String format(int tag) {
        return String.format("(%04X,%04X)", tag >>> 16, tag & 0xFFFF);
    }
}
