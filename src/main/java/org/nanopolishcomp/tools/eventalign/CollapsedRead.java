package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;

/**
 * A collapsed read ready to be written: its summary and its text block in the data file.
 */
public final class CollapsedRead {

    /**
     * Termination marker sent by every worker to the writer once it stops.
     */
    static final CollapsedRead END_OF_RESULTS = new CollapsedRead();

    private final ReadSummary summary;
    private final String block;

    public CollapsedRead(final ReadSummary summary, final String block) {
        this.summary = Utils.nonNull(summary, "summary cannot be null");
        this.block = Utils.nonEmpty(block, "block cannot be empty");
    }

    private CollapsedRead() {
        this.summary = null;
        this.block = "";
    }

    boolean isEndOfResults() {
        return this == END_OF_RESULTS;
    }

    public ReadSummary getSummary() {
        return summary;
    }

    /**
     * The read line, the kmer header and one line per kmer, every line newline terminated.
     */
    public String getBlock() {
        return block;
    }
}
