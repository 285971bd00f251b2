package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.tsv.TableColumnCollection;

import java.util.ArrayList;
import java.util.List;

/**
 * Column layout of an eventalign table, resolved once from the header of the first input.
 * <p>
 * Holds the index of every column the collapse reads and whether the optional sample index pair and the
 * raw samples are present. Every read group of a run is interpreted with the same layout.
 * </p>
 */
public final class EventalignColumns {

    public static final String CONTIG = "contig";
    public static final String READ_NAME = "read_name";
    public static final String READ_INDEX = "read_index";
    public static final String POSITION = "position";
    public static final String REFERENCE_KMER = "reference_kmer";
    public static final String MODEL_KMER = "model_kmer";
    public static final String EVENT_LENGTH = "event_length";
    public static final String START_IDX = "start_idx";
    public static final String END_IDX = "end_idx";
    public static final String SAMPLES = "samples";

    static final int ABSENT = -1;

    private final TableColumnCollection header;
    private final int contigIndex;
    private final int readIdIndex;
    private final int positionIndex;
    private final int referenceKmerIndex;
    private final int modelKmerIndex;
    private final int eventLengthIndex;
    private final int startIdxIndex;
    private final int endIdxIndex;
    private final int samplesIndex;

    private EventalignColumns(final TableColumnCollection header) {
        this.header = header;
        this.contigIndex = header.indexOf(CONTIG);
        this.readIdIndex = header.contains(READ_NAME) ? header.indexOf(READ_NAME) : header.indexOf(READ_INDEX);
        this.positionIndex = header.indexOf(POSITION);
        this.referenceKmerIndex = header.indexOf(REFERENCE_KMER);
        this.modelKmerIndex = header.indexOf(MODEL_KMER);
        this.eventLengthIndex = header.indexOf(EVENT_LENGTH);
        final boolean hasSampleIndices = header.containsAll(START_IDX, END_IDX);
        this.startIdxIndex = hasSampleIndices ? header.indexOf(START_IDX) : ABSENT;
        this.endIdxIndex = hasSampleIndices ? header.indexOf(END_IDX) : ABSENT;
        this.samplesIndex = header.indexOf(SAMPLES);
    }

    /**
     * Resolves the layout of an eventalign header.
     *
     * @param source name of the input the header comes from, for error messages.
     * @param header the header columns.
     * @throws UserException.MissingColumns if any required column is absent.
     */
    public static EventalignColumns resolve(final String source, final TableColumnCollection header) {
        Utils.nonNull(header, "header cannot be null");
        final List<String> missing = new ArrayList<>();
        for (final String required : new String[]{CONTIG, POSITION, REFERENCE_KMER, MODEL_KMER, EVENT_LENGTH}) {
            if (!header.contains(required)) {
                missing.add(required);
            }
        }
        if (!header.contains(READ_NAME) && !header.contains(READ_INDEX)) {
            missing.add(READ_NAME + " or " + READ_INDEX);
        }
        if (!missing.isEmpty()) {
            throw new UserException.MissingColumns(source, missing);
        }
        return new EventalignColumns(header);
    }

    /**
     * The header this layout was resolved from.
     */
    public TableColumnCollection getHeader() {
        return header;
    }

    public int getContigIndex() {
        return contigIndex;
    }

    public int getReadIdIndex() {
        return readIdIndex;
    }

    public int getPositionIndex() {
        return positionIndex;
    }

    public int getReferenceKmerIndex() {
        return referenceKmerIndex;
    }

    public int getModelKmerIndex() {
        return modelKmerIndex;
    }

    public int getEventLengthIndex() {
        return eventLengthIndex;
    }

    public int getStartIdxIndex() {
        return startIdxIndex;
    }

    public int getEndIdxIndex() {
        return endIdxIndex;
    }

    public int getSamplesIndex() {
        return samplesIndex;
    }

    /**
     * Whether both {@value #START_IDX} and {@value #END_IDX} are present.
     */
    public boolean hasSampleIndices() {
        return startIdxIndex != ABSENT;
    }

    public boolean hasSamples() {
        return samplesIndex != ABSENT;
    }
}
