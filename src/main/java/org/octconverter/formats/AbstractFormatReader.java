package org.octconverter.formats;

import java.util.ArrayList;
import java.util.List;

import org.octconverter.container.Directory;
import org.octconverter.container.DirectoryEntry;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.InconsistentVolumeGeometryException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.io.ByteCursor;
import org.octconverter.io.RawBuffer;
import org.octconverter.model.Decoded;
import org.octconverter.model.DecodeWarning;
import org.octconverter.model.OctVolume;
import org.octconverter.pixel.VolumeAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing of the format readers: buffer ownership, the cached directory, and the
 * rules for turning assembled volumes and collected warnings into results.
 *
 * @param <T> the format's chunk type enum
 */
public abstract class AbstractFormatReader<T extends Enum<T>> implements IFormatReader {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractFormatReader.class);

    private RawBuffer buffer;
    private final ReadOptions defaultOptions;
    private Directory<T> directory;

    protected AbstractFormatReader(RawBuffer buffer, ReadOptions defaultOptions) {
        this.buffer = buffer;
        this.defaultOptions = defaultOptions;
    }

    /**
     * Checks the magic bytes or header. Called by the static factories right after construction.
     *
     * @param file cursor at offset 0
     * @throws UnrecognizedFormatException if the signature does not match
     */
    protected abstract void checkSignature(ByteCursor file) throws DecodeException;

    /**
     * Walks the file's directory.
     *
     * @param file        cursor over the whole file
     * @param diagnostics receives directory-level warnings
     * @return the validated directory
     */
    protected abstract Directory<T> parseDirectory(ByteCursor file, DecodeDiagnostics diagnostics)
            throws DecodeException;

    /**
     * Validates the signature; the static factories call this before handing the reader out.
     */
    protected final void verify() throws DecodeException {
        checkSignature(file());
        LOG.debug("Opened {} as {}", buffer.source(), formatName());
    }

    @Override
    public ReadOptions defaultOptions() {
        return defaultOptions;
    }

    @Override
    public List<DirectoryEntry<?>> listDirectory() throws DecodeException {
        return List.copyOf(directory().entries());
    }

    @Override
    public void close() {
        buffer = null;
        directory = null;
    }

    /**
     * @return a fresh cursor over the whole file
     * @throws IllegalStateException if the reader has been closed
     */
    protected final ByteCursor file() {
        if (buffer == null) {
            throw new IllegalStateException("Reader for " + formatName() + " is closed");
        }
        return buffer.cursor();
    }

    protected final String source() {
        if (buffer == null) {
            throw new IllegalStateException("Reader for " + formatName() + " is closed");
        }
        return buffer.source();
    }

    /**
     * @return the file name without its extension, used as the default volume id
     */
    protected final String fileStem() {
        String name = source();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * @return the directory, parsed on first use
     */
    protected final Directory<T> directory() throws DecodeException {
        if (directory == null) {
            directory = parseDirectory(file(), newDiagnostics());
        }
        return directory;
    }

    protected final DecodeDiagnostics newDiagnostics() {
        return new DecodeDiagnostics(source());
    }

    /**
     * Wraps an entity with the directory warnings, the read-level warnings and its own.
     */
    protected final <E> Decoded<E> decoded(E value, DecodeDiagnostics shared, DecodeDiagnostics own)
            throws DecodeException {
        List<DecodeWarning> warnings = new ArrayList<>(directory().warnings());
        warnings.addAll(shared.warnings());
        warnings.addAll(own.warnings());
        return new Decoded<>(value, warnings);
    }

    /**
     * Builds every volume. A volume that fails validation is dropped and its failure is attached
     * as a warning to the first remaining volume; if no volume remains, the first failure is thrown.
     *
     * @param assemblers one per volume, in file order
     * @param shared     read-level warnings attached to every volume
     * @return the valid volumes
     * @throws InconsistentVolumeGeometryException if every volume was rejected
     */
    protected final List<Decoded<OctVolume>> finishVolumes(List<VolumeAssembler> assemblers,
                                                           DecodeDiagnostics shared) throws DecodeException {
        List<Decoded<OctVolume>> results = new ArrayList<>();
        List<InconsistentVolumeGeometryException> rejected = new ArrayList<>();
        for (VolumeAssembler assembler : assemblers) {
            try {
                OctVolume volume = assembler.assemble();
                results.add(decoded(volume, shared, assembler.diagnostics()));
            } catch (InconsistentVolumeGeometryException e) {
                LOG.warn("{}: dropping volume: {}", source(), e.getMessage());
                rejected.add(e);
            }
        }
        if (results.isEmpty()) {
            if (!rejected.isEmpty()) {
                throw rejected.get(0);
            }
            return results;
        }
        if (!rejected.isEmpty()) {
            Decoded<OctVolume> first = results.get(0);
            List<DecodeWarning> warnings = new ArrayList<>(first.warnings());
            rejected.forEach(e -> warnings.add(e.toWarning()));
            results.set(0, new Decoded<>(first.value(), warnings));
        }
        return results;
    }
}
