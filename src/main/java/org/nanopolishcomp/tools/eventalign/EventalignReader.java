package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.utils.tsv.DataLine;
import org.nanopolishcomp.utils.tsv.TableReader;

import java.io.IOException;
import java.io.Reader;

/**
 * Reads the data lines of an eventalign table.
 * <p>
 * Lines are returned unconverted; {@link AlignedEvent#fromDataLine} turns them into events once the column
 * layout is known.
 * </p>
 */
public final class EventalignReader extends TableReader<DataLine> {

    public EventalignReader(final String sourceName, final Reader sourceReader) throws IOException {
        super(sourceName, sourceReader);
    }

    @Override
    protected DataLine createRecord(final DataLine dataLine) {
        return dataLine;
    }
}
