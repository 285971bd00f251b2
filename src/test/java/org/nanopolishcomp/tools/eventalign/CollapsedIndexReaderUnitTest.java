package org.nanopolishcomp.tools.eventalign;

import org.nanopolishcomp.exceptions.UserException;
import org.nanopolishcomp.testutils.BaseTest;
import org.nanopolishcomp.utils.tsv.TableUtils;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class CollapsedIndexReaderUnitTest extends BaseTest {

    private static final String INDEX_HEADER = TableUtils.joinColumns(IndexRecord.COLUMNS.names()) + "\n";

    private static final String DATA =
            "#read_a\tref_0001\n" +
            "ref_pos\tref_kmer\n" +
            "10\tAAAAC\n" +
            "#read_b\tref_0002\n" +
            "ref_pos\tref_kmer\n" +
            "20\tCGTTA\n" +
            "#\n";

    private static List<IndexRecord> read(final Path index) throws IOException {
        try (final CollapsedIndexReader reader = CollapsedIndexReader.open(index)) {
            return reader.toList();
        }
    }

    @Test
    public void testReadsRecordsAndBlocks() throws IOException {
        final Path data = writeTempFile("data", ".tsv", DATA);
        // each block length leaves out the newline that ends the block
        final int secondOffset = DATA.indexOf("#read_b");
        final int secondLength = DATA.indexOf("#\n", secondOffset + 1) - secondOffset - 1;
        final Path index = writeTempFile("data", ".tsv.idx", INDEX_HEADER +
                "ref_0001\t10\t15\tread_a\t1\t0.009\t1\t0\t2\t0\t" + (secondOffset - 1) + "\n" +
                "ref_0002\t20\t21\tread_b\t1\t0.00332\t0\t0\t0\t" + secondOffset + "\t" + secondLength + "\n");

        final List<IndexRecord> records = read(index);
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).getByteLength(), 42L);
        Assert.assertEquals(records.get(1).getByteOffset(), 43L);

        final IndexRecord first = records.get(0);
        Assert.assertEquals(first.getReadId(), "read_a");
        Assert.assertEquals(first.getRefId(), "ref_0001");
        Assert.assertEquals(first.getSummary().getRefStart(), 10L);
        Assert.assertEquals(first.getSummary().getRefEnd(), 15L);
        Assert.assertEquals(first.getSummary().getDwellTime(), 0.009, 1e-12);
        Assert.assertEquals(first.getSummary().getAmbiguousKmers(), 1);
        Assert.assertEquals(first.getSummary().getMissingKmers(), 2L);
        Assert.assertEquals(CollapsedIndexReader.readBlock(data, first), "#read_a\tref_0001\nref_pos\tref_kmer\n10\tAAAAC");
        Assert.assertEquals(CollapsedIndexReader.readBlock(data, records.get(1)), "#read_b\tref_0002\nref_pos\tref_kmer\n20\tCGTTA");
    }

    @Test(expectedExceptions = UserException.BadInput.class)
    public void testUnexpectedHeader() throws IOException {
        read(writeTempFile("bad", ".idx", "read_id\tbyte_offset\tbyte_len\nread_a\t0\t10\n"));
    }

    @Test
    public void testNegativeOffset() {
        final Path index = writeTempFile("negative", ".idx", INDEX_HEADER + "ref_0001\t10\t15\tread_a\t1\t0.009\t1\t0\t2\t-1\t39\n");
        final UserException.BadInput error = Assert.expectThrows(UserException.BadInput.class, () -> read(index));
        assertContains(error.getMessage(), "at line 2");
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testBlockPastTheEndOfTheData() {
        final Path data = writeTempFile("short", ".tsv", DATA);
        final IndexRecord record = new IndexRecord(new ReadSummary("read_z", "ref_0003", 0, 1, 1, 0.1, 0, 0, 0), DATA.length() - 2, 100);
        CollapsedIndexReader.readBlock(data, record);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testMissingIndex() {
        CollapsedIndexReader.open(createTempDir("index").toPath().resolve("absent.idx"));
    }
}
