package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.Utils;
import org.nanopolishcomp.utils.io.IOUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Immutable run-wide settings of an eventalign collapse.
 * <p>
 * Instances are created with {@link #builder()}; {@link Builder#build()} validates every setting so that a
 * configuration that exists can always drive a run.
 * </p>
 */
public final class CollapseConfiguration {

    public static final String DATA_FILE_SUFFIX = "_eventalign_collapse.tsv";
    public static final String INDEX_FILE_EXTENSION = ".idx";

    public static final String DEFAULT_OUTPUT_PREFIX = "out";
    public static final int DEFAULT_THREADS = 4;
    public static final int MINIMUM_THREADS = 3;
    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final List<String> DEFAULT_STAT_FIELDS = Collections.unmodifiableList(Arrays.asList(
            StatField.MEAN.getColumnName(), StatField.MEDIAN.getColumnName(), StatField.NUM_SIGNALS.getColumnName()));

    private final List<String> inputs;
    private final Path outputDirectory;
    private final String outputPrefix;
    private final long maxReads;
    private final boolean writeSamples;
    private final List<StatField> statFields;
    private final int threads;
    private final int queueCapacity;
    private final boolean progress;
    private final double secondsBetweenProgressUpdates;

    private CollapseConfiguration(final Builder builder, final List<StatField> statFields) {
        this.inputs = Collections.unmodifiableList(new ArrayList<>(builder.inputs));
        this.outputDirectory = builder.outputDirectory;
        this.outputPrefix = builder.outputPrefix;
        this.maxReads = builder.maxReads;
        this.writeSamples = builder.writeSamples;
        this.statFields = Collections.unmodifiableList(statFields);
        this.threads = builder.threads;
        this.queueCapacity = builder.queueCapacity;
        this.progress = builder.progress;
        this.secondsBetweenProgressUpdates = builder.secondsBetweenProgressUpdates;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Input names in processing order; {@value IOUtils#STDIN_NAME} stands for the standard input.
     */
    public List<String> getInputs() {
        return inputs;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    /**
     * Maximum number of read groups to collapse, {@code 0} for no limit.
     */
    public long getMaxReads() {
        return maxReads;
    }

    public boolean hasReadCeiling() {
        return maxReads > 0;
    }

    public boolean isWriteSamples() {
        return writeSamples;
    }

    public List<StatField> getStatFields() {
        return statFields;
    }

    public int getThreads() {
        return threads;
    }

    /**
     * One thread reads and one writes; the remaining ones collapse.
     */
    public int getWorkerCount() {
        return threads - 2;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public boolean isProgress() {
        return progress;
    }

    public double getSecondsBetweenProgressUpdates() {
        return secondsBetweenProgressUpdates;
    }

    public Path getDataFile() {
        return outputDirectory.resolve(outputPrefix + DATA_FILE_SUFFIX);
    }

    public Path getIndexFile() {
        return outputDirectory.resolve(outputPrefix + DATA_FILE_SUFFIX + INDEX_FILE_EXTENSION);
    }

    @Override
    public String toString() {
        return "CollapseConfiguration{" +
                "inputs=" + inputs +
                ", outputDirectory=" + outputDirectory +
                ", outputPrefix='" + outputPrefix + '\'' +
                ", maxReads=" + maxReads +
                ", writeSamples=" + writeSamples +
                ", statFields=" + statFields +
                ", threads=" + threads +
                ", queueCapacity=" + queueCapacity +
                '}';
    }

    public static final class Builder {
        private final List<String> inputs = new ArrayList<>(Collections.singletonList(IOUtils.STDIN_NAME));
        private Path outputDirectory = Paths.get(".");
        private String outputPrefix = DEFAULT_OUTPUT_PREFIX;
        private long maxReads = 0;
        private boolean writeSamples = false;
        private final List<String> statFields = new ArrayList<>(DEFAULT_STAT_FIELDS);
        private int threads = DEFAULT_THREADS;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private boolean progress = false;
        private double secondsBetweenProgressUpdates = 10.0;

        private Builder() {}

        public Builder inputs(final List<String> inputs) {
            Utils.nonNull(inputs, "inputs cannot be null");
            this.inputs.clear();
            this.inputs.addAll(inputs);
            return this;
        }

        public Builder inputs(final String... inputs) {
            return inputs(Arrays.asList(Utils.nonNull(inputs, "inputs cannot be null")));
        }

        public Builder outputDirectory(final Path outputDirectory) {
            this.outputDirectory = Utils.nonNull(outputDirectory, "output directory cannot be null");
            return this;
        }

        public Builder outputPrefix(final String outputPrefix) {
            this.outputPrefix = Utils.nonNull(outputPrefix, "output prefix cannot be null");
            return this;
        }

        public Builder maxReads(final long maxReads) {
            this.maxReads = maxReads;
            return this;
        }

        public Builder writeSamples(final boolean writeSamples) {
            this.writeSamples = writeSamples;
            return this;
        }

        public Builder statFields(final List<String> statFields) {
            Utils.nonNull(statFields, "stat fields cannot be null");
            this.statFields.clear();
            this.statFields.addAll(statFields);
            return this;
        }

        public Builder statFields(final String... statFields) {
            return statFields(Arrays.asList(Utils.nonNull(statFields, "stat fields cannot be null")));
        }

        public Builder threads(final int threads) {
            this.threads = threads;
            return this;
        }

        public Builder queueCapacity(final int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder progress(final boolean progress) {
            this.progress = progress;
            return this;
        }

        public Builder secondsBetweenProgressUpdates(final double seconds) {
            this.secondsBetweenProgressUpdates = seconds;
            return this;
        }

        /**
         * Validates the settings and creates the configuration.
         *
         * @throws UserException.InvalidConfiguration if any setting cannot drive a run.
         */
        public CollapseConfiguration build() {
            if (inputs.isEmpty()) {
                throw new UserException.InvalidConfiguration("at least one input is required");
            }
            if (inputs.stream().anyMatch(input -> input == null || input.isEmpty())) {
                throw new UserException.InvalidConfiguration("input names cannot be empty");
            }
            if (inputs.size() > 1 && inputs.contains(IOUtils.STDIN_NAME)) {
                throw new UserException.InvalidConfiguration("the standard input ('" + IOUtils.STDIN_NAME + "') cannot be combined with other inputs");
            }
            if (outputPrefix.isEmpty()) {
                throw new UserException.InvalidConfiguration("the output prefix cannot be empty");
            }
            if (maxReads < 0) {
                throw new UserException.InvalidConfiguration("the maximum number of reads cannot be negative: " + maxReads);
            }
            if (threads < MINIMUM_THREADS) {
                throw new UserException.InvalidConfiguration(String.format(
                        "at least %d threads are required (one reader, one writer and one worker) but %d were given", MINIMUM_THREADS, threads));
            }
            if (queueCapacity <= 0) {
                throw new UserException.InvalidConfiguration("the queue capacity must be positive: " + queueCapacity);
            }
            if (!(secondsBetweenProgressUpdates > 0)) {
                throw new UserException.InvalidConfiguration("the progress update interval must be positive: " + secondsBetweenProgressUpdates);
            }
            final Set<String> duplicated = Utils.getDuplicatedItems(statFields);
            if (!duplicated.isEmpty()) {
                throw new UserException.InvalidConfiguration("statistic fields requested more than once: " + String.join(", ", duplicated));
            }
            final List<StatField> fields = new ArrayList<>(statFields.size());
            for (final String name : statFields) {
                try {
                    fields.add(StatField.fromColumnName(name));
                } catch (final IllegalArgumentException e) {
                    throw new UserException.InvalidConfiguration(e.getMessage());
                }
            }
            return new CollapseConfiguration(this, fields);
        }
    }
}
