package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.NanopolishCompException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.tsv.DataLine;
import org.nanopolishcomp.utils.tsv.TableColumnCollection;
import org.nanopolishcomp.utils.tsv.TableUtils;
import org.nanopolishcomp.utils.tsv.TableWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Collapses the events of a read group into one line per reference position.
 * <p>
 * Consecutive events at the same position are folded into a {@link KmerAggregate}; a change of position
 * writes the aggregate out and seeds a new one. Positions skipped between two kmers are counted as missing,
 * whichever the direction of the alignment (RNA reads run from the higher positions to the lower ones).
 * </p>
 * <p>
 * Instances are not thread safe: every worker owns its own.
 * </p>
 */
public final class KmerCollapser {

    public static final String REF_POS = "ref_pos";
    public static final String REF_KMER = "ref_kmer";
    public static final String NUM_EVENTS = "num_events";
    public static final String DWELL_TIME = "dwell_time";
    public static final String NNNNN_DWELL_TIME = "NNNNN_dwell_time";
    public static final String MISMATCH_DWELL_TIME = "mismatch_dwell_time";
    public static final String START_IDX = "start_idx";
    public static final String END_IDX = "end_idx";
    public static final String SAMPLES = "samples";

    static final String NOT_A_NUMBER = "nan";

    private final EventalignColumns inputColumns;
    private final List<StatField> statFields;
    private final boolean writeSamples;
    private final TableColumnCollection outputColumns;
    private final DecimalFormat decimalFormat = newDecimalFormat();

    /**
     * @param inputColumns layout of the eventalign input.
     * @param statFields statistics to report, only used when the input has samples.
     * @param writeSamples whether to report the raw samples, only used when the input has samples.
     */
    public KmerCollapser(final EventalignColumns inputColumns, final List<StatField> statFields, final boolean writeSamples) {
        this.inputColumns = Utils.nonNull(inputColumns, "input columns cannot be null");
        Utils.nonNull(statFields, "stat fields cannot be null");
        this.statFields = inputColumns.hasSamples() ? Collections.unmodifiableList(new ArrayList<>(statFields)) : Collections.emptyList();
        this.writeSamples = inputColumns.hasSamples() && writeSamples;
        this.outputColumns = composeOutputColumns(inputColumns, this.statFields, this.writeSamples);
    }

    /**
     * Decimal format of dwell times and statistics: at most six decimals, no trailing zeros.
     */
    static DecimalFormat newDecimalFormat() {
        return new DecimalFormat("0.######", DecimalFormatSymbols.getInstance(Locale.US));
    }

    private static TableColumnCollection composeOutputColumns(final EventalignColumns inputColumns, final List<StatField> statFields,
                                                              final boolean writeSamples) {
        final List<String> names = new ArrayList<>();
        Collections.addAll(names, REF_POS, REF_KMER, NUM_EVENTS, DWELL_TIME, NNNNN_DWELL_TIME, MISMATCH_DWELL_TIME);
        if (inputColumns.hasSampleIndices()) {
            Collections.addAll(names, START_IDX, END_IDX);
        }
        for (final StatField field : statFields) {
            names.add(field.getColumnName());
        }
        if (writeSamples) {
            names.add(SAMPLES);
        }
        return new TableColumnCollection(names);
    }

    /**
     * Header of the kmer lines of every block.
     */
    public TableColumnCollection getOutputColumns() {
        return outputColumns;
    }

    /**
     * Collapses one read group.
     *
     * @throws org.nanopolishcomp.exceptions.UserException.BadInput if an event or a signal sample is malformed.
     */
    public CollapsedRead collapse(final ReadGroup group) {
        Utils.nonNull(group, "read group cannot be null");
        final StringWriter block = new StringWriter();
        final ReadTotals totals = new ReadTotals();
        try (final TableWriter<KmerAggregate> writer = TableUtils.writer(block, outputColumns, this::composeLine)) {
            writer.writeComment(group.getReadId() + TableUtils.COLUMN_SEPARATOR_STRING + group.getRefId());
            writer.writeHeaderIfApplies();

            KmerAggregate current = null;
            for (final DataLine line : group.getLines()) {
                final AlignedEvent event = AlignedEvent.fromDataLine(line, inputColumns);
                if (current == null) {
                    current = KmerAggregate.seed(event);
                    totals.refStart = event.getPosition();
                    continue;
                }
                final long offset = event.getPosition() - current.getPosition();
                if (offset == 0) {
                    current.fold(event);
                } else {
                    totals.add(current);
                    writer.writeRecord(current);
                    final long gap = Math.abs(offset);
                    if (gap >= 2) {
                        totals.missingKmers += gap - 1;
                    }
                    current = KmerAggregate.seed(event);
                }
            }
            totals.add(current);
            writer.writeRecord(current);
            totals.refEnd = current.getPosition() + 1;
        } catch (final IOException e) {
            throw new NanopolishCompException.ShouldNeverReachHereException("in-memory block writing failed", e);
        }
        final ReadSummary summary = new ReadSummary(group.getReadId(), group.getRefId(), totals.refStart, totals.refEnd,
                totals.kmers, totals.dwellTime, totals.ambiguousKmers, totals.mismatchKmers, totals.missingKmers);
        return new CollapsedRead(summary, block.toString());
    }

    private void composeLine(final KmerAggregate kmer, final DataLine dataLine) {
        dataLine.append(kmer.getPosition())
                .append(kmer.getReferenceKmer())
                .append(kmer.getNumEvents())
                .append(formatDecimal(kmer.getDwellTime()))
                .append(formatDecimal(kmer.getAmbiguousDwellTime()))
                .append(formatDecimal(kmer.getMismatchDwellTime()));
        if (inputColumns.hasSampleIndices()) {
            dataLine.append(kmer.getStartIdx()).append(kmer.getEndIdx());
        }
        if (!statFields.isEmpty()) {
            final SignalStatistics statistics = new SignalStatistics(kmer.parseSamples());
            for (final StatField field : statFields) {
                dataLine.append(formatDecimal(statistics.get(field)));
            }
        }
        if (writeSamples) {
            dataLine.append(kmer.getSamples());
        }
    }

    String formatDecimal(final double value) {
        return Double.isNaN(value) ? NOT_A_NUMBER : decimalFormat.format(value);
    }

    /**
     * Running totals of the read being collapsed.
     */
    private static final class ReadTotals {
        private long refStart;
        private long refEnd;
        private int kmers;
        private double dwellTime;
        private int ambiguousKmers;
        private int mismatchKmers;
        private long missingKmers;

        private void add(final KmerAggregate kmer) {
            kmers++;
            dwellTime += kmer.getDwellTime();
            if (kmer.hasAmbiguousCalls()) {
                ambiguousKmers++;
            }
            if (kmer.hasMismatchCalls()) {
                mismatchKmers++;
            }
        }
    }
}
