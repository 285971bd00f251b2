package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.tsv.TableColumnCollection;

/**
 * Location of a read block inside the collapsed data file, with the read summary.
 * <p>
 * {@code byteLength} excludes the newline that terminates the block.
 * </p>
 */
public final class IndexRecord {

    public static final TableColumnCollection COLUMNS = new TableColumnCollection(
            "ref_id", "ref_start", "ref_end", "read_id", "kmers", "dwell_time",
            "NNNNN_kmers", "mismatch_kmers", "missing_kmers", "byte_offset", "byte_len");

    private final ReadSummary summary;
    private final long byteOffset;
    private final long byteLength;

    public IndexRecord(final ReadSummary summary, final long byteOffset, final long byteLength) {
        Utils.validateArg(byteOffset >= 0, "byte offset cannot be negative");
        Utils.validateArg(byteLength >= 0, "byte length cannot be negative");
        this.summary = Utils.nonNull(summary, "summary cannot be null");
        this.byteOffset = byteOffset;
        this.byteLength = byteLength;
    }

    public ReadSummary getSummary() {
        return summary;
    }

    public String getReadId() {
        return summary.getReadId();
    }

    public String getRefId() {
        return summary.getRefId();
    }

    public long getByteOffset() {
        return byteOffset;
    }

    public long getByteLength() {
        return byteLength;
    }
}
