package org.octconverter.pixel;

import org.octconverter.errors.DecodeException;
import org.octconverter.model.PixelPlane;

/**
 * Deferred decode of one slice payload.
 */
@FunctionalInterface
public interface IPlaneDecoder {

    PixelPlane decode() throws DecodeException;
}
