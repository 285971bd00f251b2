package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.tsv.DataLine;

/**
 * One aligned signal event, the typed view of an eventalign data line.
 */
public final class AlignedEvent {

    /**
     * Model kmer reported for events the aligner could not model.
     */
    public static final String AMBIGUOUS_KMER = "NNNNN";

    private final long position;
    private final String referenceKmer;
    private final String modelKmer;
    private final double eventLength;
    private final long startIdx;
    private final long endIdx;
    private final String samples;

    public AlignedEvent(final long position, final String referenceKmer, final String modelKmer, final double eventLength,
                        final long startIdx, final long endIdx, final String samples) {
        this.position = position;
        this.referenceKmer = Utils.nonNull(referenceKmer, "reference kmer cannot be null");
        this.modelKmer = Utils.nonNull(modelKmer, "model kmer cannot be null");
        this.eventLength = eventLength;
        this.startIdx = startIdx;
        this.endIdx = endIdx;
        this.samples = samples;
    }

    /**
     * Converts a data line using a resolved column layout.
     *
     * @throws org.nanopolishcomp.exceptions.UserException.BadInput if a numeric field is malformed.
     */
    public static AlignedEvent fromDataLine(final DataLine line, final EventalignColumns columns) {
        final long startIdx = columns.hasSampleIndices() ? line.getLong(columns.getStartIdxIndex()) : EventalignColumns.ABSENT;
        final long endIdx = columns.hasSampleIndices() ? line.getLong(columns.getEndIdxIndex()) : EventalignColumns.ABSENT;
        final double eventLength = line.getDouble(columns.getEventLengthIndex());
        if (Double.isNaN(eventLength) || Double.isInfinite(eventLength)) {
            throw line.formatError(String.format("expected a finite event length but found %s", line.get(columns.getEventLengthIndex())));
        }
        return new AlignedEvent(
                line.getLong(columns.getPositionIndex()),
                line.get(columns.getReferenceKmerIndex()),
                line.get(columns.getModelKmerIndex()),
                eventLength,
                startIdx,
                endIdx,
                columns.hasSamples() ? line.get(columns.getSamplesIndex()) : null);
    }

    public long getPosition() {
        return position;
    }

    public String getReferenceKmer() {
        return referenceKmer;
    }

    public String getModelKmer() {
        return modelKmer;
    }

    public double getEventLength() {
        return eventLength;
    }

    public long getStartIdx() {
        return startIdx;
    }

    public long getEndIdx() {
        return endIdx;
    }

    /**
     * Raw comma separated signal samples, {@code null} if the input has none.
     */
    public String getSamples() {
        return samples;
    }

    public boolean isAmbiguous() {
        return AMBIGUOUS_KMER.equals(modelKmer);
    }

    /**
     * Whether the model kmer is a real call that differs from the reference kmer.
     */
    public boolean isMismatch() {
        return !isAmbiguous() && !modelKmer.equals(referenceKmer);
    }
}
