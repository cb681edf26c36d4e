package org.octconverter.io;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The immutable bytes of one opened file.
 * <p>
 * Files are mapped read-only; in-memory inputs are wrapped without copying and exposed
 * read-only. The content is never modified after construction.
 */
public final class RawBuffer {

    private static final Logger LOG = LoggerFactory.getLogger(RawBuffer.class);

    private final ByteBuffer data;
    private final String source;

    private RawBuffer(ByteBuffer data, String source) {
        this.data = data.asReadOnlyBuffer();
        this.source = source;
    }

    /**
     * Maps a file read-only. The mapping stays valid after the channel is closed.
     *
     * @param path file to map
     * @return the buffer
     * @throws IOException if the file cannot be opened or exceeds 2 GiB
     */
    public static RawBuffer map(Path path) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new IOException("File " + path + " is " + size + " bytes; files above 2 GiB are not supported");
            }
            LOG.debug("Mapping {} ({} bytes)", path, size);
            return new RawBuffer(channel.map(FileChannel.MapMode.READ_ONLY, 0, size), path.getFileName().toString());
        }
    }

    public static RawBuffer wrap(byte[] bytes, String source) {
        return new RawBuffer(ByteBuffer.wrap(bytes), source);
    }

    public long length() {
        return data.remaining();
    }

    /**
     * @return the file name or label the buffer was created from, used in messages
     */
    public String source() {
        return source;
    }

    /**
     * @return a new cursor positioned at offset 0
     */
    public ByteCursor cursor() {
        return new ByteCursor(data, 0);
    }
}
