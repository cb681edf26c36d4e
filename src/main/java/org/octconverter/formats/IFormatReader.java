package org.octconverter.formats;

import java.util.List;

import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeException;
import org.octconverter.model.Decoded;
import org.octconverter.model.FundusImage;
import org.octconverter.model.OctVolume;

/**
 * Decoder for one opened file of one vendor format.
 * <p>
 * A reader owns the file's bytes until it is closed. Reads are synchronous and independent:
 * each call decodes again from the buffer. Non-fatal problems are returned as warnings on
 * each {@link Decoded} result; problems found before the owning entity is known (for example
 * while walking the directory) are attached to every result of the call.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Use one reader per thread.
 */
public interface IFormatReader extends AutoCloseable {

    /**
     * @return the format name, for example {@code "Topcon FDA"}
     */
    String formatName();

    /**
     * @return the options used by the no-argument read methods
     */
    ReadOptions defaultOptions();

    /**
     * Decodes every OCT volume in the file.
     *
     * @param options decoding options
     * @return zero or more volumes, each with its warnings
     * @throws DecodeException if the file cannot be decoded at all, or if its only volume is invalid
     */
    List<Decoded<OctVolume>> readOctVolumes(ReadOptions options) throws DecodeException;

    /**
     * Decodes every fundus image in the file.
     *
     * @param options decoding options
     * @return zero or more images, each with its warnings
     * @throws DecodeException if the file cannot be decoded at all
     */
    List<Decoded<FundusImage>> readFundusImages(ReadOptions options) throws DecodeException;

    /**
     * Lists the records the file's directory resolves to, for inspection.
     *
     * @return validated entries in directory order
     * @throws DecodeException if the directory cannot be read
     */
    List<DirectoryEntry<?>> listDirectory() throws DecodeException;

    default List<Decoded<OctVolume>> readOctVolumes() throws DecodeException {
        return readOctVolumes(defaultOptions());
    }

    default List<Decoded<FundusImage>> readFundusImages() throws DecodeException {
        return readFundusImages(defaultOptions());
    }

    @Override
    void close();
}
