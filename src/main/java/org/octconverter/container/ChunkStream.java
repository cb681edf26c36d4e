package org.octconverter.container;

import java.util.ArrayList;
import java.util.List;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.longs.LongSet;
import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.ErrorKind;
import org.octconverter.io.ByteCursor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Follows a chain of nodes linked by absolute file offsets.
 * <p>
 * Traversal ends at a zero pointer. A pointer back to a visited node, a pointer outside the
 * file, an unreadable node, or more nodes than the file can hold stop the traversal with a
 * warning; the nodes read so far are kept.
 */
public final class ChunkStream {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkStream.class);

    private ChunkStream() {
    }

    /**
     * @param file        cursor over the whole file
     * @param head        absolute offset of the first node, 0 for an empty chain
     * @param reader      node decoder
     * @param diagnostics receives traversal warnings
     * @return the nodes in traversal order
     */
    public static <N> List<N> traverse(ByteCursor file, long head, IChainNodeReader<N> reader,
                                       DecodeDiagnostics diagnostics) {
        long capacity = file.size() / Math.max(1, reader.minimumNodeSize());
        LongSet visited = new LongOpenHashSet();
        List<N> nodes = new ArrayList<>();

        long offset = head;
        while (offset != 0) {
            if (offset < 0 || offset >= file.size()) {
                diagnostics.warn(ErrorKind.OUT_OF_BOUNDS, "Chain pointer " + Long.toUnsignedString(offset)
                        + " outside file of " + file.size() + " bytes", -1, null);
                break;
            }
            if (!visited.add(offset)) {
                diagnostics.warn(ErrorKind.MALFORMED_CHUNK_CHAIN, "Chain revisits node after " + nodes.size()
                        + " nodes", offset, null);
                break;
            }
            if (visited.size() > capacity) {
                diagnostics.warn(ErrorKind.MALFORMED_CHUNK_CHAIN, "Chain longer than the " + capacity
                        + " nodes the file can hold", offset, null);
                break;
            }
            N node;
            try {
                node = reader.read(file, offset);
            } catch (DecodeException e) {
                diagnostics.report(e);
                break;
            }
            nodes.add(node);
            offset = reader.next(node);
        }
        LOG.debug("Chain from {}: {} nodes", head, nodes.size());
        return nodes;
    }
}
