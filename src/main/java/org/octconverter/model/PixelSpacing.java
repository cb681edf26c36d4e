package org.octconverter.model;

/**
 * Physical size of one voxel in millimetres.
 *
 * @param x across a B-scan (between A-scans)
 * @param y along an A-scan (depth)
 * @param z between B-scans
 */
public record PixelSpacing(double x, double y, double z) {
}
