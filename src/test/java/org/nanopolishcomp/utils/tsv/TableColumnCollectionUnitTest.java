package org.nanopolishcomp.utils.tsv;

import org.nanopolishcomp.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

/**
 * Unit tests for {@link TableColumnCollection}.
 */
public final class TableColumnCollectionUnitTest extends BaseTest {

    @Test
    public void testIndexLookup() {
        final TableColumnCollection columns = new TableColumnCollection("contig", "position", "reference_kmer");
        Assert.assertEquals(columns.columnCount(), 3);
        Assert.assertEquals(columns.indexOf("position"), 1);
        Assert.assertEquals(columns.indexOf("samples"), -1);
        Assert.assertEquals(columns.nameAt(2), "reference_kmer");
        Assert.assertTrue(columns.contains("contig"));
        Assert.assertFalse(columns.contains("samples"));
        Assert.assertTrue(columns.containsAll("contig", "reference_kmer"));
        Assert.assertFalse(columns.containsAll(Arrays.asList("contig", "samples")));
    }

    @Test
    public void testMatchesExactlyIsOrderSensitive() {
        final TableColumnCollection columns = new TableColumnCollection("a", "b");
        Assert.assertTrue(columns.matchesExactly("a", "b"));
        Assert.assertFalse(columns.matchesExactly("b", "a"));
        Assert.assertFalse(columns.matchesExactly("a"));
    }

    @Test
    public void testEqualityAndToString() {
        final TableColumnCollection columns = new TableColumnCollection(Arrays.asList("a", "b"));
        Assert.assertEquals(columns, new TableColumnCollection("a", "b"));
        Assert.assertEquals(columns.hashCode(), new TableColumnCollection("a", "b").hashCode());
        Assert.assertNotEquals(columns, new TableColumnCollection("b", "a"));
        Assert.assertEquals(columns.toString(), "a\tb");
    }

    @DataProvider(name = "invalidNames")
    public Object[][] invalidNames() {
        return new Object[][] {
                { new String[0] },
                { new String[]{"a", null} },
                { new String[]{"a", ""} },
                { new String[]{"#a", "b"} },
                { new String[]{"a", "b", "a"} },
        };
    }

    @Test(dataProvider = "invalidNames", expectedExceptions = IllegalArgumentException.class)
    public void testInvalidNames(final String[] names) {
        new TableColumnCollection(names);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNameAtOutOfRange() {
        new TableColumnCollection("a").nameAt(1);
    }
}
