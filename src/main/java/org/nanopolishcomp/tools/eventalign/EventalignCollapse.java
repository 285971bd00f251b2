package org.nanopolishcomp.tools.eventalign;

import org.broadinstitute.barclay.argparser.Advanced;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.nanopolishcomp.cmdline.CommandLineProgram;
import org.nanopolishcomp.cmdline.StandardArgumentDefinitions;
import org.nanopolishcomp.cmdline.programgroups.NanoporeSignalProgramGroup;
import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.utils.io.IOUtils;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collapses a nanopolish eventalign table by reference position.
 *
 * <p>Consecutive events of a read aligned to the same reference position are merged into one kmer line
 * with the number of events, the total dwell time and the dwell time of ambiguous ({@code NNNNN}) and
 * mismatching calls. When eventalign was run with {@code --samples}, statistics over the raw signal of every
 * kmer are added.</p>
 *
 * <h3>Output</h3>
 * <ul>
 *     <li>{@code <prefix>_eventalign_collapse.tsv}: one block per read, made of a {@code #read_id<tab>ref_id}
 *     line, a header line and one line per kmer. The file ends with a lone {@code #} line.</li>
 *     <li>{@code <prefix>_eventalign_collapse.tsv.idx}: one line per read with its totals and the byte offset
 *     and length of its block.</li>
 * </ul>
 *
 * <p>Reads are written as soon as they are collapsed, so their order in the output may differ from the input.
 * Use the index to locate a read.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 * nanopolishcomp EventalignCollapse \
 *   -I eventalign.tsv.gz \
 *   -O collapsed \
 *   --stat-fields mean --stat-fields std \
 *   --threads 8
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Collapses a nanopolish eventalign table by reference position, producing one line per kmer and read " +
                "with dwell time and raw signal statistics, plus an index of the byte offset of every read.",
        oneLineSummary = "Collapses nanopolish eventalign output by kmer",
        programGroup = NanoporeSignalProgramGroup.class
)
@DocumentedFeature
public final class EventalignCollapse extends CommandLineProgram {

    @Argument(fullName = StandardArgumentDefinitions.INPUT_LONG_NAME, shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
            doc = "Eventalign tsv file(s), plain or gzipped, processed in the given order. '-' reads the standard input.",
            optional = true)
    public List<String> inputs = new ArrayList<>(Collections.singletonList(IOUtils.STDIN_NAME));

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_DIRECTORY_SHORT_NAME,
            doc = "Output directory, created if it does not exist.", optional = true)
    public String outputDirectory = ".";

    @Argument(fullName = StandardArgumentDefinitions.OUTPUT_PREFIX_LONG_NAME, shortName = StandardArgumentDefinitions.OUTPUT_PREFIX_SHORT_NAME,
            doc = "Prefix of the output file names.", optional = true)
    public String outputPrefix = CollapseConfiguration.DEFAULT_OUTPUT_PREFIX;

    @Argument(fullName = StandardArgumentDefinitions.MAX_READS_LONG_NAME,
            doc = "Maximum number of reads to collapse, 0 for all of them.", optional = true)
    public long maxReads = 0;

    @Argument(fullName = StandardArgumentDefinitions.WRITE_SAMPLES_LONG_NAME,
            doc = "Write the raw signal samples of every kmer. Requires eventalign to have been run with --samples.", optional = true)
    public boolean writeSamples = false;

    @Argument(fullName = StandardArgumentDefinitions.STAT_FIELDS_LONG_NAME, shortName = StandardArgumentDefinitions.STAT_FIELDS_SHORT_NAME,
            doc = "Raw signal statistics to report, in this order: any of mean, std, median, mad and num_signals. " +
                    "Only used when eventalign was run with --samples.", optional = true)
    public List<String> statFields = new ArrayList<>(CollapseConfiguration.DEFAULT_STAT_FIELDS);

    @Argument(fullName = StandardArgumentDefinitions.THREADS_LONG_NAME, shortName = StandardArgumentDefinitions.THREADS_SHORT_NAME,
            doc = "Total number of threads. One reads, one writes and the others collapse, so at least 3 are needed.", optional = true)
    public int threads = CollapseConfiguration.DEFAULT_THREADS;

    @Advanced
    @Argument(fullName = StandardArgumentDefinitions.QUEUE_CAPACITY_LONG_NAME,
            doc = "Number of reads that can wait between the reader and the workers, and between the workers and the writer.", optional = true)
    public int queueCapacity = CollapseConfiguration.DEFAULT_QUEUE_CAPACITY;

    @Argument(fullName = StandardArgumentDefinitions.PROGRESS_LONG_NAME,
            doc = "Periodically log the number of reads written.", optional = true)
    public boolean progress = false;

    private CollapseConfiguration configuration;

    @Override
    protected String[] customCommandLineValidation() {
        try {
            configuration = CollapseConfiguration.builder()
                    .inputs(inputs)
                    .outputDirectory(Paths.get(outputDirectory))
                    .outputPrefix(outputPrefix)
                    .maxReads(maxReads)
                    .writeSamples(writeSamples)
                    .statFields(statFields)
                    .threads(threads)
                    .queueCapacity(queueCapacity)
                    .progress(progress)
                    .build();
        } catch (final UserException.InvalidConfiguration e) {
            return new String[]{e.getMessage()};
        }
        return null;
    }

    @Override
    protected void onStartup() {
        logger.info("Collapsing {} with {} workers into {}", String.join(", ", configuration.getInputs()),
                configuration.getWorkerCount(), configuration.getDataFile());
        logger.debug("{}", configuration);
    }

    @Override
    protected Object doWork() {
        final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();
        logger.info(String.format("Collapsed %d reads into %d kmers", summary.getReads(), summary.getKmers()));
        return summary;
    }

    CollapseConfiguration getConfiguration() {
        return configuration;
    }
}
