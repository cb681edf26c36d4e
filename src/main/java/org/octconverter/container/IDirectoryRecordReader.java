package org.octconverter.container;

import org.octconverter.errors.DecodeException;
import org.octconverter.io.ByteCursor;

/**
 * Decodes the records of one directory layout for {@link DirectoryParser}.
 *
 * @param <T> the format's chunk type enum
 */
public interface IDirectoryRecordReader<T extends Enum<T>> {

    /**
     * How the next record is located.
     */
    enum Layout {
        /**
         * Records and payloads alternate; the next record starts after the payload. A record
         * with an invalid length ends the walk.
         */
        SEQUENTIAL,
        /**
         * Records form a table separate from the payloads. A record with an invalid range is
         * skipped and the walk continues.
         */
        TABLE
    }

    Layout layout();

    /**
     * Reads the record at the cursor position.
     * <p>
     * For {@link Layout#SEQUENTIAL} readers the cursor is left at the start of the payload;
     * for {@link Layout#TABLE} readers it is left at the next record.
     *
     * @param cursor cursor over the whole file
     * @return the entry with an absolute, not yet validated range, or {@code null} at the end
     *         of the directory
     * @throws DecodeException if the record itself cannot be read
     */
    DirectoryEntry<T> next(ByteCursor cursor) throws DecodeException;

    /**
     * @return the enum class used to group entries
     */
    Class<T> typeClass();
}
