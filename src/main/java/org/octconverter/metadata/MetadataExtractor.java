package org.octconverter.metadata;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.MetadataFieldException;
import org.octconverter.io.ByteCursor;

/**
 * Applies a {@link MetadataTable} to the records of a file.
 * <p>
 * Extraction is best-effort per field: a failing decoder produces {@link FieldResult#error},
 * the field stays absent and a {@code METADATA_FIELD} warning is reported. Other fields of the
 * same record are still decoded.
 */
public final class MetadataExtractor {

    private MetadataExtractor() {
    }

    /**
     * Decodes one field from a payload without throwing.
     *
     * @param decoder field decoder
     * @param payload cursor over the record payload; not moved
     * @param tag     record name used in the error
     * @return present, absent or error
     */
    public static <V> FieldResult<V> decode(IFieldDecoder<V> decoder, ByteCursor payload, String tag) {
        try {
            return FieldResult.ofNullable(decoder.decode(payload.slice(0, payload.size())));
        } catch (DecodeException e) {
            return FieldResult.error(new MetadataFieldException("Field could not be decoded: " + e.getMessage(),
                    payload.base(), tag, e));
        } catch (RuntimeException e) {
            // invalid calendar values and similar surface as unchecked exceptions from java.time
            return FieldResult.error(new MetadataFieldException("Field has an invalid value: " + e.getMessage(),
                    payload.base(), tag, e));
        }
    }

    /**
     * Decodes one field and downgrades an error to a warning.
     *
     * @return the value, or {@code null} when absent or failed
     */
    public static <V> V decodeOrWarn(IFieldDecoder<V> decoder, ByteCursor payload, String tag,
                                     DecodeDiagnostics diagnostics) {
        FieldResult<V> result = decode(decoder, payload, tag);
        result.error().ifPresent(diagnostics::report);
        return result.value().orElse(null);
    }

    /**
     * Decodes every field the table binds to the entry's type into {@code target}.
     *
     * @param table       the format's table
     * @param entry       a validated directory entry
     * @param file        cursor over the whole file
     * @param target      receives present values
     * @param diagnostics receives field errors
     */
    public static <T extends Enum<T>> void extract(MetadataTable<T> table, DirectoryEntry<T> entry, ByteCursor file,
                                                   MetadataRecord target, DecodeDiagnostics diagnostics) {
        if (!table.handles(entry.type())) {
            return;
        }
        ByteCursor payload;
        try {
            payload = file.slice(entry.offset(), entry.length());
        } catch (DecodeException e) {
            diagnostics.report(e, entry.tag());
            return;
        }
        extract(table, entry.type(), payload, entry.tag(), target, diagnostics);
    }

    /**
     * Variant for payloads already cut out of the file.
     */
    public static <T extends Enum<T>> void extract(MetadataTable<T> table, T type, ByteCursor payload, String tag,
                                                   MetadataRecord target, DecodeDiagnostics diagnostics) {
        for (MetadataTable.Binding<T, ?> binding : table.get(type)) {
            apply(binding, payload, tag, target, diagnostics);
        }
    }

    private static <T extends Enum<T>, V> void apply(MetadataTable.Binding<T, V> binding, ByteCursor payload,
                                                     String tag, MetadataRecord target,
                                                     DecodeDiagnostics diagnostics) {
        target.put(binding.field(), decodeOrWarn(binding.decoder(), payload, tag, diagnostics));
    }
}
