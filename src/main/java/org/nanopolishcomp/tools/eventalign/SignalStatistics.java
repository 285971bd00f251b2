package org.nanopolishcomp.tools.eventalign;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.nanopolishcomp.utils.Utils;

/**
 * Summary statistics over the raw signal samples of one kmer.
 * <p>
 * The standard deviation is the population one and the median absolute deviation is not scaled.
 * Every statistic but the sample count is {@link Double#NaN} when there are no samples.
 * </p>
 */
public final class SignalStatistics {

    private final double[] samples;

    public SignalStatistics(final double[] samples) {
        this.samples = Utils.nonNull(samples, "samples cannot be null");
    }

    public double mean() {
        return new Mean().evaluate(samples);
    }

    public double std() {
        return new StandardDeviation(false).evaluate(samples);
    }

    public double median() {
        return new Median().evaluate(samples);
    }

    public double mad() {
        if (samples.length == 0) {
            return Double.NaN;
        }
        final double median = median();
        final double[] deviations = new double[samples.length];
        for (int i = 0; i < samples.length; i++) {
            deviations[i] = Math.abs(samples[i] - median);
        }
        return new Median().evaluate(deviations);
    }

    public int numSignals() {
        return samples.length;
    }

    /**
     * Returns the value of the requested statistic.
     */
    public double get(final StatField field) {
        switch (field) {
            case MEAN: return mean();
            case STD: return std();
            case MEDIAN: return median();
            case MAD: return mad();
            case NUM_SIGNALS: return numSignals();
            default:
                throw new IllegalArgumentException("unknown statistic field: " + field);
        }
    }
}
