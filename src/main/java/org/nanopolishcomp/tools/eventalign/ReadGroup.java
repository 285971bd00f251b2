package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.tsv.DataLine;

import java.util.Collections;
import java.util.List;

/**
 * The consecutive eventalign lines of one (read, reference) pair, not yet converted into events.
 */
public final class ReadGroup {

    /**
     * Termination marker sent by the reader to every worker after the last group.
     */
    static final ReadGroup END_OF_INPUT = new ReadGroup();

    private final String readId;
    private final String refId;
    private final List<DataLine> lines;
    private final EventalignColumns columns;

    /**
     * @param readId the read the lines belong to.
     * @param refId the reference the read is aligned to.
     * @param lines the lines in input order.
     * @param columns layout to interpret the lines with.
     */
    public ReadGroup(final String readId, final String refId, final List<DataLine> lines, final EventalignColumns columns) {
        this.readId = Utils.nonNull(readId, "read id cannot be null");
        this.refId = Utils.nonNull(refId, "reference id cannot be null");
        this.lines = Collections.unmodifiableList(Utils.nonEmpty(lines, "a read group needs at least one line"));
        this.columns = Utils.nonNull(columns, "columns cannot be null");
    }

    private ReadGroup() {
        this.readId = "";
        this.refId = "";
        this.lines = Collections.emptyList();
        this.columns = null;
    }

    boolean isEndOfInput() {
        return this == END_OF_INPUT;
    }

    public String getReadId() {
        return readId;
    }

    public String getRefId() {
        return refId;
    }

    public EventalignColumns getColumns() {
        return columns;
    }

    public List<DataLine> getLines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    @Override
    public String toString() {
        return readId + "/" + refId + " (" + lines.size() + " events)";
    }
}
