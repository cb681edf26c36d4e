package org.octconverter.formats;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

import org.octconverter.errors.DecodeException;
import org.octconverter.errors.UnrecognizedFormatException;
import org.octconverter.formats.bioptigen.BioptigenReader;
import org.octconverter.formats.dicom.DicomReader;
import org.octconverter.formats.heidelberg.E2eReader;
import org.octconverter.formats.optovue.OptovueReader;
import org.octconverter.formats.topcon.FdaReader;
import org.octconverter.formats.topcon.FdsReader;
import org.octconverter.formats.zeiss.ZeissImgReader;
import org.octconverter.io.RawBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point choosing a reader from the file extension.
 */
public final class FormatReaders {

    private static final Logger LOG = LoggerFactory.getLogger(FormatReaders.class);

    private FormatReaders() {
    }

    public static IFormatReader open(Path path) throws IOException {
        return open(path, ReadOptions.defaults());
    }

    /**
     * Opens a file with the reader for its extension. {@code .oct} files are read as Bioptigen
     * when their first key matches, otherwise as Optovue.
     *
     * @param path           file to open
     * @param defaultOptions options used by the reader's no-argument read methods
     * @return an open reader; the caller closes it
     * @throws UnrecognizedFormatException if the extension is unknown or the signature does not match
     * @throws IOException                 if the file cannot be mapped
     */
    public static IFormatReader open(Path path, ReadOptions defaultOptions) throws IOException {
        String extension = extension(path);
        LOG.debug("Opening {} by extension '{}'", path, extension);
        return switch (extension) {
            case "fds" -> FdsReader.open(path, defaultOptions);
            case "fda" -> FdaReader.open(path, defaultOptions);
            case "e2e", "sdb" -> E2eReader.open(path, defaultOptions);
            case "img" -> ZeissImgReader.open(path, defaultOptions);
            case "oct" -> openOct(RawBuffer.map(path), defaultOptions);
            case "dcm", "dicom" -> DicomReader.open(path, defaultOptions);
            default -> throw new UnrecognizedFormatException("No reader for extension '" + extension + "' of "
                    + path.getFileName(), -1, null);
        };
    }

    /**
     * Chooses between the two {@code .oct} formats on one mapping of the file.
     */
    static IFormatReader openOct(RawBuffer buffer, ReadOptions defaultOptions) throws DecodeException {
        return BioptigenReader.hasSignature(buffer.cursor())
                ? BioptigenReader.open(buffer, defaultOptions)
                : OptovueReader.open(buffer, defaultOptions);
    }

    static String extension(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String text = name.toString();
        int dot = text.lastIndexOf('.');
        return dot < 0 ? "" : text.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
