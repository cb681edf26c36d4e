package org.octconverter.container;

import org.octconverter.errors.DecodeException;
import org.octconverter.io.ByteCursor;

/**
 * Decodes the nodes of an on-disk linked list for {@link ChunkStream}.
 *
 * @param <N> node type
 */
public interface IChainNodeReader<N> {

    /**
     * @return the smallest number of bytes a node occupies; bounds the number of nodes a file can hold
     */
    int minimumNodeSize();

    /**
     * @param file   cursor over the whole file
     * @param offset absolute offset of the node
     * @return the decoded node
     * @throws DecodeException if the node cannot be read at that offset
     */
    N read(ByteCursor file, long offset) throws DecodeException;

    /**
     * @return the absolute offset of the following node, or 0 at the end of the chain
     */
    long next(N node);
}
