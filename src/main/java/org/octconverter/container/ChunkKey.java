package org.octconverter.container;

/**
 * Identity of a chunk within a multi-volume container.
 *
 * @param patientId device patient number
 * @param studyId   study number
 * @param seriesId  series number; one series is one acquisition
 * @param sliceId   raw slice identifier as stored, format-specific
 */
public record ChunkKey(long patientId, long studyId, long seriesId, int sliceId) {

    public VolumeKey volumeKey() {
        return new VolumeKey(patientId, studyId, seriesId);
    }

    /**
     * The part of a {@link ChunkKey} that identifies one volume.
     */
    public record VolumeKey(long patientId, long studyId, long seriesId) {

        @Override
        public String toString() {
            return patientId + "-" + studyId + "-" + seriesId;
        }
    }
}
