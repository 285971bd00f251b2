package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;

/**
 * Totals over the collapsed kmers of one read.
 */
public final class ReadSummary {

    private final String readId;
    private final String refId;
    private final long refStart;
    private final long refEnd;
    private final int kmers;
    private final double dwellTime;
    private final int ambiguousKmers;
    private final int mismatchKmers;
    private final long missingKmers;

    public ReadSummary(final String readId, final String refId, final long refStart, final long refEnd, final int kmers,
                       final double dwellTime, final int ambiguousKmers, final int mismatchKmers, final long missingKmers) {
        this.readId = Utils.nonNull(readId, "read id cannot be null");
        this.refId = Utils.nonNull(refId, "reference id cannot be null");
        this.refStart = refStart;
        this.refEnd = refEnd;
        this.kmers = kmers;
        this.dwellTime = dwellTime;
        this.ambiguousKmers = ambiguousKmers;
        this.mismatchKmers = mismatchKmers;
        this.missingKmers = missingKmers;
    }

    public String getReadId() {
        return readId;
    }

    public String getRefId() {
        return refId;
    }

    /**
     * Position of the first collapsed kmer.
     */
    public long getRefStart() {
        return refStart;
    }

    /**
     * Position of the last collapsed kmer plus one.
     */
    public long getRefEnd() {
        return refEnd;
    }

    public int getKmers() {
        return kmers;
    }

    public double getDwellTime() {
        return dwellTime;
    }

    public int getAmbiguousKmers() {
        return ambiguousKmers;
    }

    public int getMismatchKmers() {
        return mismatchKmers;
    }

    /**
     * Reference positions skipped entirely between collapsed kmers.
     */
    public long getMissingKmers() {
        return missingKmers;
    }

    @Override
    public String toString() {
        return String.format("ReadSummary{%s/%s [%d, %d) kmers=%d missing=%d}", readId, refId, refStart, refEnd, kmers, missingKmers);
    }
}
