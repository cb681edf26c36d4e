package org.octconverter.pixel;

import org.octconverter.errors.DecodeDiagnostics;
import org.octconverter.errors.DecodeException;
import org.octconverter.errors.InconsistentVolumeGeometryException;
import org.octconverter.model.OctVolume;
import org.octconverter.model.Slice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the slices of one volume as they are decoded.
 * <p>
 * A slice that fails to decode is reported to the volume's diagnostics and kept as a missing
 * placeholder; assembly continues with the next slice.
 */
public final class VolumeAssembler {

    private static final Logger LOG = LoggerFactory.getLogger(VolumeAssembler.class);

    private final OctVolume.Builder builder;
    private final DecodeDiagnostics diagnostics;
    private int missing;

    public VolumeAssembler(String volumeId, DecodeDiagnostics diagnostics) {
        this.builder = OctVolume.builder(volumeId);
        this.diagnostics = diagnostics;
    }

    /**
     * Decodes one slice, or records it as missing when decoding fails.
     *
     * @param index   device slice index
     * @param tag     record the slice comes from, named in the warning
     * @param decoder the deferred decode
     * @return {@code true} if the slice was decoded
     */
    public boolean decodeSlice(int index, String tag, IPlaneDecoder decoder) {
        try {
            builder.addSlice(new Slice(index, decoder.decode()));
            return true;
        } catch (DecodeException e) {
            diagnostics.report(e, tag);
            builder.addSlice(Slice.missing(index));
            missing++;
            return false;
        }
    }

    /**
     * Records a slice whose payload is known to be unavailable. The cause is reported separately.
     */
    public void markMissing(int index) {
        builder.addSlice(Slice.missing(index));
        missing++;
    }

    /**
     * @return the builder, for attaching metadata
     */
    public OctVolume.Builder volume() {
        return builder;
    }

    public DecodeDiagnostics diagnostics() {
        return diagnostics;
    }

    public int sliceCount() {
        return builder.sliceCount();
    }

    /**
     * @throws InconsistentVolumeGeometryException if no slice decoded or geometries differ
     */
    public OctVolume assemble() throws InconsistentVolumeGeometryException {
        OctVolume volume = builder.build();
        LOG.debug("Assembled {} ({} missing)", volume, missing);
        return volume;
    }
}
