package org.nanopolishcomp.tools.eventalign;

import java.nio.file.Path;

/**
 * Outcome of a successful collapse run.
 */
public final class CollapseSummary {

    private final long reads;
    private final long kmers;
    private final double elapsedSeconds;
    private final Path dataFile;
    private final Path indexFile;

    public CollapseSummary(final long reads, final long kmers, final double elapsedSeconds, final Path dataFile, final Path indexFile) {
        this.reads = reads;
        this.kmers = kmers;
        this.elapsedSeconds = elapsedSeconds;
        this.dataFile = dataFile;
        this.indexFile = indexFile;
    }

    public long getReads() {
        return reads;
    }

    public long getKmers() {
        return kmers;
    }

    public double getElapsedSeconds() {
        return elapsedSeconds;
    }

    public Path getDataFile() {
        return dataFile;
    }

    public Path getIndexFile() {
        return indexFile;
    }

    @Override
    public String toString() {
        return String.format("%d reads (%d kmers) collapsed in %.2f s%ndata: %s%nindex: %s", reads, kmers, elapsedSeconds, dataFile, indexFile);
    }
}
