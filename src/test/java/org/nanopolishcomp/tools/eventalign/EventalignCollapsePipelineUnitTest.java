package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.testutils.BaseTest;
import org.nanopolishcomp.utils.tsv.TableUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.zip.GZIPOutputStream;

import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.HEADER;
import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.event;
import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.readGroup;
import static org.nanopolishcomp.tools.eventalign.EventalignTestUtils.syntheticTable;

public final class EventalignCollapsePipelineUnitTest extends BaseTest {

    private static List<IndexRecord> readIndex(final Path indexFile) throws IOException {
        try (final CollapsedIndexReader reader = CollapsedIndexReader.open(indexFile)) {
            return reader.toList();
        }
    }

    /**
     * Expected block of every read of a table whose reads are contiguous, collapsed one by one.
     */
    private static Map<String, String> expectedBlocks(final String table, final CollapseConfiguration configuration) {
        final Map<String, StringBuilder> readTables = new HashMap<>();
        final List<String> lines = new ArrayList<>(Arrays.asList(table.split("\n")));
        lines.remove(0);
        for (final String line : lines) {
            final String readName = line.split("\t")[3];
            readTables.computeIfAbsent(readName, name -> new StringBuilder(HEADER)).append(line).append('\n');
        }
        final Map<String, String> blocks = new HashMap<>();
        readTables.forEach((name, readTable) -> {
            final ReadGroup group = readGroup(readTable.toString());
            final String block = new KmerCollapser(group.getColumns(), configuration.getStatFields(), configuration.isWriteSamples())
                    .collapse(group).getBlock();
            blocks.put(name, block.substring(0, block.length() - 1));
        });
        return blocks;
    }

    private static void assertIndexCoversDataFile(final List<IndexRecord> records, final Path dataFile) throws IOException {
        final List<IndexRecord> byOffset = records.stream()
                .sorted(Comparator.comparingLong(IndexRecord::getByteOffset))
                .collect(Collectors.toList());
        long expectedOffset = 0;
        for (final IndexRecord record : byOffset) {
            Assert.assertEquals(record.getByteOffset(), expectedOffset, record.getReadId());
            expectedOffset += record.getByteLength() + 1;
        }
        Assert.assertEquals(Files.size(dataFile), expectedOffset + 2);
    }

    @Test
    public void testBlocksMatchTheIndex() throws IOException {
        final String table = syntheticTable(50, 5);
        final Path input = writeTempFile("synthetic", ".tsv", table);
        final Path output = createTempDir("pipeline").toPath();
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(input.toString())
                .outputDirectory(output)
                .outputPrefix("synthetic")
                .statFields("mean", "std", "median", "mad", "num_signals")
                .threads(5)
                .queueCapacity(4)
                .build();

        final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();

        Assert.assertEquals(summary.getReads(), 50L);
        Assert.assertEquals(summary.getKmers(), 250L);
        Assert.assertEquals(summary.getDataFile(), output.resolve("synthetic_eventalign_collapse.tsv"));
        Assert.assertTrue(readString(summary.getDataFile()).endsWith("\n#\n"));

        final List<IndexRecord> records = readIndex(summary.getIndexFile());
        Assert.assertEquals(records.size(), 50);
        assertIndexCoversDataFile(records, summary.getDataFile());

        final Map<String, String> expected = expectedBlocks(table, configuration);
        final Set<String> seen = new HashSet<>();
        for (final IndexRecord record : records) {
            Assert.assertTrue(seen.add(record.getReadId()), "read written twice: " + record.getReadId());
            Assert.assertEquals(CollapsedIndexReader.readBlock(summary.getDataFile(), record), expected.get(record.getReadId()));
            Assert.assertEquals(record.getSummary().getKmers(), 5);
            Assert.assertEquals(record.getSummary().getRefStart(), 1000L);
            Assert.assertEquals(record.getSummary().getRefEnd(), 1005L);
            Assert.assertEquals(record.getSummary().getDwellTime(), 0.02, 1e-9);
        }
        Assert.assertEquals(seen, expected.keySet());
    }

    @Test
    public void testFaultStopsTheRun() {
        final StringBuilder table = new StringBuilder(HEADER);
        for (int i = 0; i < 1000; i++) {
            // data line 5 is line 6 of the file, after the header
            final String eventLength = i == 4 ? "0.00x" : "0.001";
            table.append(event("ref_0001", i, "ACGTA", "read_" + i, eventLength, "ACGTA", i, i + 1, "80"));
        }
        final Path input = writeTempFile("malformed", ".tsv", table.toString());
        final Path output = createTempDir("pipeline").toPath();
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(input.toString())
                .outputDirectory(output)
                .threads(4)
                .queueCapacity(2)
                .build();

        final UserException.BadInput error = Assert.expectThrows(UserException.BadInput.class,
                () -> new EventalignCollapsePipeline(configuration).run());
        assertContains(error.getMessage(), "at line 6");
        assertContains(error.getMessage(), input.toString());
        final Path dataFile = configuration.getDataFile();
        Assert.assertFalse(Files.exists(dataFile) && readString(dataFile).endsWith(TableUtils.COMMENT_PREFIX + "\n"));
    }

    @Test(timeOut = 120_000)
    public void testSingleWorkerWithMinimalQueues() {
        final StringBuilder table = new StringBuilder(HEADER);
        for (int i = 0; i < 10_000; i++) {
            table.append(event("ref_0001", 1, "ACGTA", "read_" + i, "0.001", "ACGTA", 0, 1, "80"));
        }
        final Path input = writeTempFile("many", ".tsv", table.toString());
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(input.toString())
                .outputDirectory(createTempDir("pipeline").toPath())
                .threads(3)
                .queueCapacity(1)
                .build();

        final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();
        Assert.assertEquals(summary.getReads(), 10_000L);
        Assert.assertEquals(summary.getKmers(), 10_000L);
    }

    @Test
    public void testReadCeiling() throws IOException {
        final Path input = writeTempFile("ceiling", ".tsv", syntheticTable(20, 2));
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(input.toString())
                .outputDirectory(createTempDir("pipeline").toPath())
                .maxReads(7)
                .build();

        final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();
        Assert.assertEquals(summary.getReads(), 7L);
        final List<IndexRecord> records = readIndex(configuration.getIndexFile());
        Assert.assertEquals(records.size(), 7);
        Assert.assertEquals(records.stream().map(IndexRecord::getReadId).collect(Collectors.toSet()),
                IntStream.range(0, 7).mapToObj(i -> String.format("read_%05d", i)).collect(Collectors.toSet()));
    }

    @Test
    public void testPlainAndGzippedInputs() throws IOException {
        final Path plain = writeTempFile("plain", ".tsv", HEADER + event("chr1", 1, "ACGTA", "r1", "0.1", "ACGTA", 0, 1, "80"));
        final Path zipped = createTempFile("zipped", ".tsv.gz").toPath();
        try (final OutputStream out = new GZIPOutputStream(Files.newOutputStream(zipped))) {
            out.write((HEADER + event("chr2", 8, "CCCCC", "r2", "0.2", "CCCCC", 0, 1, "81")).getBytes(StandardCharsets.UTF_8));
        }
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(plain.toString(), zipped.toString())
                .outputDirectory(createTempDir("pipeline").toPath())
                .build();

        Assert.assertEquals(new EventalignCollapsePipeline(configuration).run().getReads(), 2L);
        Assert.assertEquals(readIndex(configuration.getIndexFile()).stream().map(IndexRecord::getRefId).collect(Collectors.toSet()),
                new HashSet<>(Arrays.asList("chr1", "chr2")));
    }

    @Test
    public void testStandardInput() throws IOException {
        final InputStream stdin = System.in;
        try {
            System.setIn(new ByteArrayInputStream(syntheticTable(3, 4).getBytes(StandardCharsets.UTF_8)));
            final CollapseConfiguration configuration = CollapseConfiguration.builder()
                    .outputDirectory(createTempDir("pipeline").toPath())
                    .build();
            final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();
            Assert.assertEquals(summary.getReads(), 3L);
            Assert.assertEquals(summary.getKmers(), 12L);
            assertIndexCoversDataFile(readIndex(configuration.getIndexFile()), configuration.getDataFile());
        } finally {
            System.setIn(stdin);
        }
    }

    @Test
    public void testHeaderOnlyInput() throws IOException {
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(writeTempFile("header", ".tsv", HEADER).toString())
                .outputDirectory(createTempDir("pipeline").toPath().resolve("nested").resolve("dir"))
                .build();
        final CollapseSummary summary = new EventalignCollapsePipeline(configuration).run();
        Assert.assertEquals(summary.getReads(), 0L);
        Assert.assertEquals(readString(configuration.getDataFile()), TableUtils.COMMENT_PREFIX + "\n");
        Assert.assertTrue(readIndex(configuration.getIndexFile()).isEmpty());
    }

    @Test(expectedExceptions = UserException.CouldNotCreateOutputFile.class)
    public void testOutputDirectoryIsAFile() {
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(writeTempFile("header", ".tsv", HEADER).toString())
                .outputDirectory(writeTempFile("file", ".txt", "x"))
                .build();
        new EventalignCollapsePipeline(configuration).run();
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingInput() {
        final CollapseConfiguration configuration = CollapseConfiguration.builder()
                .inputs(createTempDir("absent").toPath().resolve("none.tsv").toString())
                .outputDirectory(createTempDir("pipeline").toPath())
                .build();
        new EventalignCollapsePipeline(configuration).run();
    }
}
