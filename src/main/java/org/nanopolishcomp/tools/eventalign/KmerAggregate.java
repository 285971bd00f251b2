package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;

/**
 * Fold of the events observed at one reference position of a read.
 * <p>
 * Seeded from the first event at the position and updated in place by {@link #fold(AlignedEvent)}; an
 * instance is only ever touched by the worker collapsing its read.
 * </p>
 */
public final class KmerAggregate {

    private static final char SAMPLE_SEPARATOR = ',';

    private final long position;
    private final String referenceKmer;
    private int numEvents;
    private double dwellTime;
    private double ambiguousDwellTime;
    private double mismatchDwellTime;
    private long startIdx;
    private long endIdx;
    private final StringBuilder samples;

    private KmerAggregate(final AlignedEvent first) {
        this.position = first.getPosition();
        this.referenceKmer = first.getReferenceKmer();
        this.samples = first.getSamples() == null ? null : new StringBuilder();
        addEvent(first);
    }

    /**
     * Starts a new aggregate at the position of {@code first}.
     */
    public static KmerAggregate seed(final AlignedEvent first) {
        return new KmerAggregate(first);
    }

    /**
     * Adds an event observed at the same position.
     *
     * @throws IllegalArgumentException if the event is at another position.
     */
    public void fold(final AlignedEvent event) {
        if (event.getPosition() != position) {
            throw new IllegalArgumentException(String.format("cannot fold an event at position %d into the kmer at position %d", event.getPosition(), position));
        }
        addEvent(event);
    }

    private void addEvent(final AlignedEvent event) {
        numEvents++;
        dwellTime += event.getEventLength();
        if (event.isAmbiguous()) {
            ambiguousDwellTime += event.getEventLength();
        } else if (event.isMismatch()) {
            mismatchDwellTime += event.getEventLength();
        }
        startIdx = event.getStartIdx();
        endIdx = event.getEndIdx();
        if (samples != null && event.getSamples() != null && !event.getSamples().isEmpty()) {
            if (samples.length() > 0) {
                samples.append(SAMPLE_SEPARATOR);
            }
            samples.append(event.getSamples());
        }
    }

    public long getPosition() {
        return position;
    }

    public String getReferenceKmer() {
        return referenceKmer;
    }

    public int getNumEvents() {
        return numEvents;
    }

    public double getDwellTime() {
        return dwellTime;
    }

    /**
     * Dwell time of the events whose model kmer is {@value AlignedEvent#AMBIGUOUS_KMER}.
     */
    public double getAmbiguousDwellTime() {
        return ambiguousDwellTime;
    }

    public double getMismatchDwellTime() {
        return mismatchDwellTime;
    }

    public boolean hasAmbiguousCalls() {
        return ambiguousDwellTime > 0;
    }

    public boolean hasMismatchCalls() {
        return mismatchDwellTime > 0;
    }

    /**
     * Start sample index of the last event folded in.
     */
    public long getStartIdx() {
        return startIdx;
    }

    public long getEndIdx() {
        return endIdx;
    }

    /**
     * The comma joined raw samples of every event, {@code null} if the input has no samples.
     */
    public String getSamples() {
        return samples == null ? null : samples.toString();
    }

    /**
     * Parses the raw samples.
     *
     * @throws UserException.BadInput if any sample is not a number.
     */
    public double[] parseSamples() {
        if (samples == null || samples.length() == 0) {
            return new double[0];
        }
        final String[] values = samples.toString().split(String.valueOf(SAMPLE_SEPARATOR));
        final double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            try {
                result[i] = Double.parseDouble(values[i]);
            } catch (final NumberFormatException e) {
                throw new UserException.BadInput(String.format("malformed signal sample '%s' at reference position %d", values[i], position), e);
            }
        }
        return result;
    }
}
