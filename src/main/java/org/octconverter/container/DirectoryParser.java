package org.octconverter.container;

import java.util.ArrayList;
import java.util.List;

import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.io.ByteCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a tag/offset/length directory and resolves it to validated byte ranges.
 * <p>
 * Payloads are not interpreted. Every returned entry satisfies
 * {@code offset + length <= file length}; records that do not are reported as
 * {@link ErrorKind#OUT_OF_BOUNDS} warnings. The walk performs at most one iteration per byte
 * of the file and stops as soon as a reader fails to advance.
 */
public final class DirectoryParser {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryParser.class);

    private DirectoryParser() {
    }

    /**
     * @param file        cursor over the whole file
     * @param start       absolute offset of the first record
     * @param reader      record decoder for the layout
     * @param diagnostics receives the warnings, which are also kept on the result
     * @return the directory, never empty
     * @throws UnrecognizedFormatException if no valid record was found
     * @throws DecodeException             if {@code start} lies outside the file
     */
    public static <T extends Enum<T>> Directory<T> parse(ByteCursor file, long start,
                                                         IDirectoryRecordReader<T> reader,
                                                         DecodeDiagnostics diagnostics) throws DecodeException {
        DecodeDiagnostics local = diagnostics.fork();
        List<DirectoryEntry<T>> entries = new ArrayList<>();
        long fileLength = file.size();
        boolean sequential = reader.layout() == IDirectoryRecordReader.Layout.SEQUENTIAL;

        file.seek(start);
        for (long iteration = 0; iteration <= fileLength; iteration++) {
            long recordStart = file.position();
            DirectoryEntry<T> entry;
            try {
                entry = reader.next(file);
            } catch (DecodeException e) {
                local.report(e);
                break;
            }
            if (entry == null) {
                break;
            }
            boolean inBounds = entry.offset() >= 0 && entry.length() >= 0
                    && entry.offset() <= fileLength && entry.length() <= fileLength - entry.offset();
            if (!inBounds) {
                local.warn(ErrorKind.OUT_OF_BOUNDS, "Record range [offset=" + entry.offset() + ", length="
                        + Long.toUnsignedString(entry.length()) + "] exceeds file of " + fileLength + " bytes",
                        entry.offset(), entry.tag());
                if (sequential) {
                    break;
                }
                continue;
            }
            entries.add(entry);
            if (sequential) {
                file.seek(entry.end());
            }
            if (file.position() <= recordStart) {
                local.warn(ErrorKind.MALFORMED_CHUNK_CHAIN, "Directory walk does not advance", recordStart,
                        entry.tag());
                break;
            }
        }

        diagnostics.merge(local);
        if (entries.isEmpty()) {
            throw new UnrecognizedFormatException("No valid directory record found", start, null);
        }
        LOG.debug("Directory at {}: {} records, {} warnings", start, entries.size(), local.warnings().size());
        return new Directory<>(reader.typeClass(), entries, local.warnings());
    }
}
